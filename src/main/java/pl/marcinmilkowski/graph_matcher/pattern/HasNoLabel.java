package pl.marcinmilkowski.graph_matcher.pattern;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Holds when none of the listed labels is present, including when no label is
 * present at all. Captures nothing.
 */
public record HasNoLabel(Set<String> labels) implements Label {

    public HasNoLabel {
        labels = Label.checkedLabels(labels, "HasNoLabel");
    }

    public static HasNoLabel of(String... labels) {
        return new HasNoLabel(new LinkedHashSet<>(Arrays.asList(labels)));
    }

    @Override
    public Optional<Set<String>> satisfied(Set<String> actualLabels) {
        for (String label : actualLabels) {
            if (labels.contains(label)) {
                return Optional.empty();
            }
        }
        return Optional.of(Set.of());
    }
}
