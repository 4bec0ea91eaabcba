package pl.marcinmilkowski.graph_matcher.pattern;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Holds when at least one of the listed labels is present.
 */
public record HasLabelFromList(Set<String> labels) implements Label {

    public HasLabelFromList {
        labels = Label.checkedLabels(labels, "HasLabelFromList");
    }

    public static HasLabelFromList of(String... labels) {
        return new HasLabelFromList(new LinkedHashSet<>(Arrays.asList(labels)));
    }

    @Override
    public Optional<Set<String>> satisfied(Set<String> actualLabels) {
        Set<String> matched = new LinkedHashSet<>();
        for (String label : actualLabels) {
            if (labels.contains(label)) {
                matched.add(label);
            }
        }
        return matched.isEmpty() ? Optional.empty() : Optional.of(Set.copyOf(matched));
    }
}
