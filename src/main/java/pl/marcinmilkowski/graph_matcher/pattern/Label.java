package pl.marcinmilkowski.graph_matcher.pattern;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Predicate over the set of relation labels found on an edge (or on all edges
 * touching a node).
 */
public sealed interface Label permits HasLabelFromList, HasNoLabel {

    /**
     * The labels this predicate refers to.
     */
    Set<String> labels();

    /**
     * Test the predicate against the labels actually present.
     *
     * @param actualLabels labels present in the sentence, possibly empty
     * @return the labels matched (empty for a satisfied negative predicate),
     *         or empty Optional if the predicate does not hold
     */
    Optional<Set<String>> satisfied(Set<String> actualLabels);

    static Set<String> checkedLabels(Set<String> labels, String kind) {
        if (labels == null || labels.isEmpty()) {
            throw new InvalidPatternShapeException(kind + " constraint needs at least one label");
        }
        for (String label : labels) {
            if (label == null || label.isBlank()) {
                throw new InvalidPatternShapeException(kind + " constraint contains a blank label");
            }
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(labels));
    }
}
