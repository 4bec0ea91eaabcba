package pl.marcinmilkowski.graph_matcher.matcher;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All results of a matcher for one sentence of a batch, keyed by pattern name
 * in declaration order.
 */
public record SentenceMatches(int sentenceIndex, Map<String, List<MatchingResult>> matches) {

    public SentenceMatches {
        matches = Collections.unmodifiableMap(new LinkedHashMap<>(matches));
    }

    public List<MatchingResult> matchesFor(String name) {
        return matches.getOrDefault(name, List.of());
    }

    public int total() {
        int total = 0;
        for (List<MatchingResult> results : matches.values()) {
            total += results.size();
        }
        return total;
    }
}
