package pl.marcinmilkowski.graph_matcher.matcher;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.graph_matcher.pattern.Full;
import pl.marcinmilkowski.graph_matcher.pattern.HasLabelFromList;
import pl.marcinmilkowski.graph_matcher.pattern.Token;
import pl.marcinmilkowski.graph_matcher.sentence.DependencySentence;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class GlobalMatcherTest {

    private static final Full CHAIN = Full.builder()
        .token(Token.builder("a").build())
        .token(Token.builder("b").build())
        .token(Token.builder("c").build())
        .edge("a", "b", HasLabelFromList.of("nsubj"))
        .edge("b", "c", HasLabelFromList.of("obj"))
        .build();

    private static CandidateMap everyNode(int size, String... names) {
        Set<Integer> all = new TreeSet<>();
        for (int i = 0; i < size; i++) {
            all.add(i);
        }
        Map<String, Set<Integer>> candidates = new LinkedHashMap<>();
        for (String name : names) {
            candidates.put(name, all);
        }
        return new CandidateMap(candidates);
    }

    @Test
    @DisplayName("An edge with no matching pair stops the join before later edges are inspected")
    void testJoinShortCircuit() {
        // only "obj" edges: the first edge constraint (nsubj) has no pair
        DependencySentence sentence = SentenceFixtures.tagged("x y z", "X X X")
            .addEdge(1, 2, "obj")
            .addEdge(0, 2, "obj")
            .build();
        SentenceFixtures.CountingSentenceGraph counting = new SentenceFixtures.CountingSentenceGraph(sentence);

        List<MatchingResult> results = new GlobalMatcher(CHAIN)
            .match(everyNode(3, "a", "b", "c"), counting)
            .collect(Collectors.toList());

        assertTrue(results.isEmpty());
        // 3 x 3 candidate pairs for the first edge, none for the second
        assertEquals(9, counting.getLabelLookups());
    }

    @Test
    void testBothEdgesInspectedWhenFirstJoins() {
        DependencySentence sentence = SentenceFixtures.tagged("x y z", "X X X")
            .addEdge(0, 1, "nsubj")
            .addEdge(1, 2, "obj")
            .build();
        SentenceFixtures.CountingSentenceGraph counting = new SentenceFixtures.CountingSentenceGraph(sentence);

        List<MatchingResult> results = new GlobalMatcher(CHAIN)
            .match(everyNode(3, "a", "b", "c"), counting)
            .collect(Collectors.toList());

        assertEquals(1, results.size());
        assertEquals(Map.of("a", 0, "b", 1, "c", 2), results.get(0).getTokens());
        assertEquals(18, counting.getLabelLookups());
    }

    @Test
    void testTryMerge() {
        Map<String, Integer> base = Map.of("a", 1, "b", 2);

        assertEquals(Map.of("a", 1, "b", 2, "c", 3), GlobalMatcher.tryMerge(base, Map.of("c", 3)));
        assertEquals(base, GlobalMatcher.tryMerge(base, Map.of("a", 1)));
        assertNull(GlobalMatcher.tryMerge(base, Map.of("b", 3, "c", 3)));
        assertEquals(base, GlobalMatcher.tryMerge(Map.of(), base));
    }

    @Test
    @DisplayName("Variables outside every edge are bound from their candidates")
    void testUnaryJoinForVariablesWithoutEdges() {
        Full pattern = Full.builder()
            .token(Token.builder("a").build())
            .token(Token.builder("b").build())
            .token(Token.builder("free").build())
            .edge("a", "b", HasLabelFromList.of("nsubj"))
            .build();
        DependencySentence sentence = SentenceFixtures.tagged("x y z", "X X X").addEdge(0, 1, "nsubj").build();
        Map<String, Set<Integer>> candidates = Map.of("a", Set.of(0), "b", Set.of(1), "free", Set.of(0, 2));

        List<MatchingResult> results = new GlobalMatcher(pattern)
            .match(new CandidateMap(candidates), sentence)
            .collect(Collectors.toList());

        assertEquals(2, results.size());
        assertEquals(Set.of(0, 2), results.stream().map(r -> r.token("free")).collect(Collectors.toSet()));
        for (MatchingResult result : results) {
            assertEquals(Set.of("nsubj"), result.edge(0, 1));
        }
    }
}
