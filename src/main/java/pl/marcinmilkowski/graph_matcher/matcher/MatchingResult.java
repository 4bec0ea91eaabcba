package pl.marcinmilkowski.graph_matcher.matcher;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One match of a pattern: captured variable bindings and the edge labels that
 * were matched between bound nodes.
 */
public final class MatchingResult {

    /** Returned by {@link #token(String)} for unknown, unmatched or uncaptured names. */
    public static final int NOT_MATCHED = -1;

    /**
     * A (child, parent) pair of node positions.
     */
    public record IndexPair(int child, int parent) {
    }

    private final Map<String, Integer> name2index;
    private final Map<IndexPair, Set<String>> indices2label;

    public MatchingResult(Map<String, Integer> name2index, Map<IndexPair, Set<String>> indices2label) {
        this.name2index = Collections.unmodifiableMap(new LinkedHashMap<>(name2index));
        Map<IndexPair, Set<String>> labels = new LinkedHashMap<>();
        indices2label.forEach((pair, set) -> labels.put(pair, Set.copyOf(set)));
        this.indices2label = Collections.unmodifiableMap(labels);
    }

    /**
     * Position of the node bound to {@code name}, or {@link #NOT_MATCHED}.
     */
    public int token(String name) {
        return name2index.getOrDefault(name, NOT_MATCHED);
    }

    /**
     * Labels captured on the edge from {@code child} to {@code parent}; empty if none.
     */
    public Set<String> edge(int child, int parent) {
        return indices2label.getOrDefault(new IndexPair(child, parent), Set.of());
    }

    /**
     * Captured variable names.
     */
    public Set<String> names() {
        return name2index.keySet();
    }

    public Map<String, Integer> getTokens() {
        return name2index;
    }

    public Map<IndexPair, Set<String>> getEdges() {
        return indices2label;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MatchingResult)) return false;
        MatchingResult that = (MatchingResult) o;
        return name2index.equals(that.name2index) && indices2label.equals(that.indices2label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name2index, indices2label);
    }

    @Override
    public String toString() {
        return "MatchingResult(" + name2index + ", " + indices2label + ")";
    }
}
