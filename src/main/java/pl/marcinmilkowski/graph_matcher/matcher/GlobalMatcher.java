package pl.marcinmilkowski.graph_matcher.matcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.graph_matcher.pattern.Distance;
import pl.marcinmilkowski.graph_matcher.pattern.Edge;
import pl.marcinmilkowski.graph_matcher.pattern.Full;
import pl.marcinmilkowski.graph_matcher.pattern.Token;
import pl.marcinmilkowski.graph_matcher.pattern.TokenTuple;
import pl.marcinmilkowski.graph_matcher.sentence.SentenceGraph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;
import java.util.stream.Stream;

/**
 * Combines per-variable candidates into full assignments.
 *
 * <ol>
 *   <li>For each edge constraint, in declaration order, the (child, parent)
 *       candidate pairs whose labels satisfy the edge become two-variable
 *       assignments. The labels they matched are remembered for the results.</li>
 *   <li>The running assignments are joined with each edge's assignments. Two
 *       assignments merge only if they bind every shared variable to the same
 *       node. An empty join ends the match; later edges are not inspected.</li>
 *   <li>Variables that no edge mentions are joined one candidate at a time.</li>
 *   <li>Distance and phrase constraints filter the merged assignments.</li>
 * </ol>
 *
 * An optional variable without candidates stays unbound: edges touching it are
 * skipped, and distance or phrase constraints referring to it hold vacuously.
 */
public class GlobalMatcher {

    private static final Logger logger = LoggerFactory.getLogger(GlobalMatcher.class);

    private final Full constraint;
    // token ids that don't require a capture
    private final Set<String> dontCaptureNames;

    /**
     * Key of a matched edge pair in the label cache.
     */
    private record LabelKey(String childName, int child, String parentName, int parent) {
    }

    public GlobalMatcher(Full constraint) {
        this.constraint = constraint;
        Set<String> names = new HashSet<>();
        for (Token token : constraint.tokens()) {
            if (!token.capture()) {
                names.add(token.id());
            }
        }
        this.dontCaptureNames = Set.copyOf(names);
    }

    /**
     * Match the pattern against a sentence given its candidate map. Assignments
     * are merged eagerly; filtering and result construction happen as the
     * stream is consumed. Result order is unspecified.
     */
    public Stream<MatchingResult> match(CandidateMap candidates, SentenceGraph sentence) {
        Map<LabelKey, Set<String>> capturedLabels = new HashMap<>();
        List<Map<String, Integer>> merges = mergeAssignments(candidates, sentence, capturedLabels);
        return merges.stream()
            .filter(merged -> filterDistanceConstraints(merged) && filterConcatConstraints(merged, sentence))
            .map(merged -> toResult(merged, capturedLabels));
    }

    private List<Map<String, Integer>> mergeAssignments(CandidateMap candidates, SentenceGraph sentence,
                                                        Map<LabelKey, Set<String>> capturedLabels) {
        Set<String> unbound = new HashSet<>();
        for (Token token : constraint.tokens()) {
            if (token.optional() && candidates.get(token.id()).isEmpty()) {
                unbound.add(token.id());
            }
        }

        List<Map<String, Integer>> merges = List.of(Map.of());
        Set<String> joined = new HashSet<>();
        for (Edge edge : constraint.edges()) {
            if (unbound.contains(edge.child()) || unbound.contains(edge.parent())) {
                continue;
            }
            merges = join(merges, edgeAssignments(edge, candidates, sentence, capturedLabels));
            if (merges.isEmpty()) {
                logger.debug("No assignment survives edge {} -> {}", edge.child(), edge.parent());
                return List.of();
            }
            joined.add(edge.child());
            joined.add(edge.parent());
        }

        for (Token token : constraint.tokens()) {
            if (joined.contains(token.id()) || unbound.contains(token.id())) {
                continue;
            }
            List<Map<String, Integer>> single = new ArrayList<>();
            for (Integer position : candidates.get(token.id())) {
                single.add(Map.of(token.id(), position));
            }
            merges = join(merges, single);
            if (merges.isEmpty()) {
                return List.of();
            }
        }
        return merges;
    }

    private static List<Map<String, Integer>> edgeAssignments(Edge edge, CandidateMap candidates,
                                                              SentenceGraph sentence,
                                                              Map<LabelKey, Set<String>> capturedLabels) {
        List<Map<String, Integer>> assignments = new ArrayList<>();
        for (Integer child : candidates.get(edge.child())) {
            for (Integer parent : candidates.get(edge.parent())) {
                Optional<Set<String>> matched = edge.label().satisfied(sentence.labels(child, parent));
                if (matched.isEmpty()) {
                    continue;
                }
                capturedLabels.computeIfAbsent(new LabelKey(edge.child(), child, edge.parent(), parent),
                    k -> new LinkedHashSet<>()).addAll(matched.get());
                assignments.add(Map.of(edge.child(), child, edge.parent(), parent));
            }
        }
        return assignments;
    }

    private static List<Map<String, Integer>> join(List<Map<String, Integer>> merges,
                                                   List<Map<String, Integer>> assignments) {
        List<Map<String, Integer>> newMerges = new ArrayList<>();
        for (Map<String, Integer> merged : merges) {
            for (Map<String, Integer> assignment : assignments) {
                Map<String, Integer> justMerged = tryMerge(merged, assignment);
                if (justMerged != null) {
                    newMerges.add(justMerged);
                }
            }
        }
        return newMerges;
    }

    /**
     * Merge two assignments, or return null if they bind a shared variable differently.
     */
    static Map<String, Integer> tryMerge(Map<String, Integer> base, Map<String, Integer> addition) {
        for (Map.Entry<String, Integer> entry : addition.entrySet()) {
            Integer bound = base.get(entry.getKey());
            if (bound != null && !bound.equals(entry.getValue())) {
                return null;
            }
        }
        Map<String, Integer> merged = new LinkedHashMap<>(base);
        merged.putAll(addition);
        return merged;
    }

    private boolean filterDistanceConstraints(Map<String, Integer> match) {
        for (Distance distance : constraint.distances()) {
            Integer position1 = match.get(distance.token1());
            Integer position2 = match.get(distance.token2());
            if (position1 == null || position2 == null) {
                continue;
            }
            if (!distance.isSatisfiedBy(Distance.tokensBetween(position1, position2))) {
                return false;
            }
        }
        return true;
    }

    private boolean filterConcatConstraints(Map<String, Integer> match, SentenceGraph sentence) {
        for (TokenTuple concat : constraint.concats()) {
            StringJoiner phrase = new StringJoiner(TokenTuple.SEPARATOR);
            boolean complete = true;
            for (String name : concat.tokens()) {
                Integer position = match.get(name);
                if (position == null) {
                    complete = false;
                    break;
                }
                phrase.add(sentence.text(position));
            }
            if (complete && !concat.tupleSet().contains(phrase.toString())) {
                return false;
            }
        }
        return true;
    }

    private MatchingResult toResult(Map<String, Integer> merged, Map<LabelKey, Set<String>> capturedLabels) {
        Map<MatchingResult.IndexPair, Set<String>> edges = new LinkedHashMap<>();
        for (Map.Entry<LabelKey, Set<String>> entry : capturedLabels.entrySet()) {
            LabelKey key = entry.getKey();
            if (entry.getValue().isEmpty()
                    || !Integer.valueOf(key.child()).equals(merged.get(key.childName()))
                    || !Integer.valueOf(key.parent()).equals(merged.get(key.parentName()))) {
                continue;
            }
            edges.computeIfAbsent(new MatchingResult.IndexPair(key.child(), key.parent()),
                k -> new LinkedHashSet<>()).addAll(entry.getValue());
        }

        // keep only required captures
        Map<String, Integer> captured = new LinkedHashMap<>(merged);
        captured.keySet().removeAll(dontCaptureNames);
        return new MatchingResult(captured, edges);
    }
}
