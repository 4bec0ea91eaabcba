package pl.marcinmilkowski.graph_matcher.matcher;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Per-variable candidate node positions, produced by {@link NodeMatcher} once per
 * sentence. Unmodifiable.
 */
public final class CandidateMap {

    private final Map<String, SortedSet<Integer>> candidates;

    public CandidateMap(Map<String, ? extends Set<Integer>> candidates) {
        Map<String, SortedSet<Integer>> copy = new LinkedHashMap<>();
        candidates.forEach((name, positions) ->
            copy.put(name, Collections.unmodifiableSortedSet(new TreeSet<>(positions))));
        this.candidates = Collections.unmodifiableMap(copy);
    }

    /**
     * Candidate positions of a variable, ascending; empty if it has none.
     */
    public SortedSet<Integer> get(String name) {
        return candidates.getOrDefault(name, Collections.emptySortedSet());
    }

    public Set<String> names() {
        return candidates.keySet();
    }

    @Override
    public String toString() {
        return "CandidateMap" + candidates;
    }
}
