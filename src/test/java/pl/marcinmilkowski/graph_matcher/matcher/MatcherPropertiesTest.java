package pl.marcinmilkowski.graph_matcher.matcher;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.graph_matcher.pattern.ExactDistance;
import pl.marcinmilkowski.graph_matcher.pattern.FieldNames;
import pl.marcinmilkowski.graph_matcher.pattern.Full;
import pl.marcinmilkowski.graph_matcher.pattern.HasLabelFromList;
import pl.marcinmilkowski.graph_matcher.pattern.HasNoLabel;
import pl.marcinmilkowski.graph_matcher.pattern.Label;
import pl.marcinmilkowski.graph_matcher.pattern.NamedConstraint;
import pl.marcinmilkowski.graph_matcher.pattern.Token;
import pl.marcinmilkowski.graph_matcher.pattern.TokenPair;
import pl.marcinmilkowski.graph_matcher.pattern.UptoDistance;
import pl.marcinmilkowski.graph_matcher.sentence.DependencySentence;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Cross-checks {@link Matcher} against {@link ReferenceMatcher} on random small
 * sentences and patterns, some with optional variables.
 */
class MatcherPropertiesTest {

    private static final String[] WORDS = {"a", "b", "c"};
    private static final String[] TAGS = {"NOUN", "VERB", "ADJ"};
    private static final String[] LABELS = {"nsubj", "obj", "amod"};
    private static final int ROUNDS = 400;

    @Test
    @DisplayName("Every result satisfies every constraint and every satisfying assignment is found")
    void testSoundAndCompleteAgainstBruteForce() {
        Random random = new Random(42);
        for (int round = 0; round < ROUNDS; round++) {
            DependencySentence sentence = randomSentence(random);
            Full pattern = randomPattern(random);

            List<MatchingResult> expected = ReferenceMatcher.match(pattern, sentence);
            List<MatchingResult> actual = run(pattern, sentence);

            String context = "round " + round + ": " + describe(pattern) + " on " + describe(sentence);
            assertEquals(expected.size(), actual.size(), context);
            assertEquals(new HashSet<>(expected), new HashSet<>(actual), context);
        }
    }

    @Test
    @DisplayName("Matching the same pattern twice gives the same results in the same order")
    void testDeterminism() {
        Random random = new Random(7);
        for (int round = 0; round < ROUNDS / 4; round++) {
            DependencySentence sentence = randomSentence(random);
            Full pattern = randomPattern(random);
            Matcher matcher = new Matcher(List.of(new NamedConstraint("p", pattern)));

            List<MatchingResult> first = matcher.apply(sentence).matchesFor("p").collect(Collectors.toList());
            List<MatchingResult> second = matcher.apply(sentence).matchesFor("p").collect(Collectors.toList());

            assertEquals(first, second);
        }
    }

    private static List<MatchingResult> run(Full pattern, DependencySentence sentence) {
        Matcher matcher = new Matcher(List.of(new NamedConstraint("p", pattern)));
        return matcher.apply(sentence).matchesFor("p").collect(Collectors.toList());
    }

    private static DependencySentence randomSentence(Random random) {
        int size = 2 + random.nextInt(5);
        DependencySentence.Builder builder = DependencySentence.builder();
        for (int i = 0; i < size; i++) {
            String word = pick(random, WORDS);
            builder.addToken(word, word, pick(random, TAGS));
        }
        // a tree rooted at 0, plus the odd extra edge
        for (int i = 1; i < size; i++) {
            builder.addEdge(i, random.nextInt(i), pick(random, LABELS));
        }
        if (random.nextBoolean()) {
            int child = random.nextInt(size);
            int parent = (child + 1 + random.nextInt(size - 1)) % size;
            builder.addEdge(child, parent, pick(random, LABELS));
        }
        return builder.build();
    }

    private static Full randomPattern(Random random) {
        int size = 2 + random.nextInt(2);
        List<String> ids = new ArrayList<>();
        Full.Builder builder = Full.builder();
        for (int i = 0; i < size; i++) {
            String id = "v" + i;
            ids.add(id);
            Token.Builder token = Token.builder(id)
                .capture(random.nextInt(4) != 0)
                .optional(random.nextInt(4) == 0);
            if (random.nextBoolean()) {
                token.field(FieldNames.TAG, pick(random, TAGS), pick(random, TAGS));
            }
            if (random.nextInt(4) == 0) {
                token.field(FieldNames.WORD, random.nextBoolean() ? "*" : pick(random, WORDS));
            }
            if (random.nextInt(5) == 0) {
                token.incoming(randomLabel(random));
            }
            if (random.nextInt(5) == 0) {
                token.outgoing(randomLabel(random));
            }
            builder.token(token.build());
        }

        int edges = random.nextInt(3);
        for (int i = 0; i < edges; i++) {
            int child = random.nextInt(size);
            int parent = (child + 1 + random.nextInt(size - 1)) % size;
            builder.edge(ids.get(child), ids.get(parent), randomLabel(random));
        }
        if (random.nextInt(3) == 0) {
            String first = ids.get(random.nextInt(size));
            String second = ids.get(random.nextInt(size));
            builder.distance(random.nextBoolean()
                ? new ExactDistance(first, second, random.nextInt(2))
                : new UptoDistance(first, second, random.nextInt(3)));
        }
        if (random.nextInt(4) == 0) {
            builder.concat(TokenPair.of(ids.get(0), ids.get(1),
                pick(random, WORDS) + "_" + pick(random, WORDS),
                pick(random, WORDS) + "_" + pick(random, WORDS)));
        }
        return builder.build();
    }

    private static Label randomLabel(Random random) {
        Set<String> labels = new HashSet<>();
        labels.add(pick(random, LABELS));
        if (random.nextBoolean()) {
            labels.add(pick(random, LABELS));
        }
        return random.nextInt(3) == 0 ? new HasNoLabel(labels) : new HasLabelFromList(labels);
    }

    private static String pick(Random random, String[] values) {
        return values[random.nextInt(values.length)];
    }

    private static String describe(Full pattern) {
        return pattern.tokens() + " " + pattern.edges() + " " + pattern.distances() + " " + pattern.concats();
    }

    private static String describe(DependencySentence sentence) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < sentence.size(); i++) {
            sb.append(sentence.getToken(i)).append(' ');
            for (int j = 0; j < sentence.size(); j++) {
                if (!sentence.labels(i, j).isEmpty()) {
                    sb.append(i).append("->").append(j).append(sentence.labels(i, j)).append(' ');
                }
            }
        }
        return sb.toString();
    }
}
