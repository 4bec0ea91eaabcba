package pl.marcinmilkowski.graph_matcher.sentence;

import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.graph_matcher.pattern.FieldNames;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DependencySentenceTest {

    private static DependencySentence johnSawTheDog() {
        return DependencySentence.builder()
            .sentenceId(7)
            .comment("# text = John saw the dog")
            .addToken(new SentenceToken(0, "John", "John", "PROPN", "NNP", "_", 2, "nsubj", "NE=PERSON"))
            .addToken(new SentenceToken(1, "saw", "see", "VERB", "VBD", "Tense=Past", 0, "root", "_"))
            .addToken(new SentenceToken(2, "the", "the", "DET", "DT", "_", 4, "det", "_"))
            .addToken(new SentenceToken(3, "dog", "dog", "NOUN", "NN", "_", 2, "obj", "_"))
            .build();
    }

    @Test
    void testBasicEdgesFromHeads() {
        DependencySentence sentence = johnSawTheDog();

        assertEquals(4, sentence.size());
        assertEquals(Set.of("nsubj"), sentence.labels(0, 1));
        assertEquals(Set.of("obj"), sentence.labels(3, 1));
        assertEquals(Set.of("det"), sentence.labels(2, 3));
        // edges are directed child -> parent
        assertTrue(sentence.labels(1, 0).isEmpty());
        // the root has no parent edge
        assertTrue(sentence.labelsAsChild(1).isEmpty());
    }

    @Test
    void testLabelsAroundNode() {
        DependencySentence sentence = johnSawTheDog();

        assertEquals(Set.of("nsubj", "obj"), sentence.labelsAsParent(1));
        assertEquals(Set.of("det"), sentence.labelsAsParent(3));
        assertEquals(Set.of("obj"), sentence.labelsAsChild(3));
        assertTrue(sentence.labelsAsParent(0).isEmpty());
    }

    @Test
    void testMultipleLabelsOnOneEdge() {
        DependencySentence sentence = DependencySentence.builder()
            .addToken("dogs", "dog", "NOUN")
            .addToken("bark", "bark", "VERB")
            .addEdge(0, 1, "nsubj")
            .addEdge(0, 1, "nsubj:outer")
            .build();

        assertEquals(Set.of("nsubj", "nsubj:outer"), sentence.labels(0, 1));
        assertEquals(Set.of("nsubj", "nsubj:outer"), sentence.labelsAsParent(1));
    }

    @Test
    void testValues() {
        DependencySentence sentence = johnSawTheDog();

        assertEquals("saw", sentence.text(1));
        assertEquals(Set.of("see"), sentence.values(1, FieldNames.LEMMA));
        assertEquals(Set.of("VERB"), sentence.values(1, FieldNames.TAG));
        assertEquals(Set.of("VBD"), sentence.values(1, FieldNames.FINE_TAG));
        assertEquals(Set.of("PERSON"), sentence.values(0, FieldNames.ENTITY));
        assertTrue(sentence.values(1, FieldNames.ENTITY).isEmpty());
    }

    @Test
    void testMetadata() {
        DependencySentence sentence = johnSawTheDog();

        assertEquals(7, sentence.getSentenceId());
        assertEquals(1, sentence.getComments().size());
        assertEquals("dog", sentence.getToken(3).word());
        assertNull(sentence.getToken(4));
        assertNull(sentence.getToken(-1));
        assertEquals(johnSawTheDog(), sentence);
        assertEquals(johnSawTheDog().hashCode(), sentence.hashCode());
    }

    @Test
    void testTokenDefaults() {
        SentenceToken token = new SentenceToken(0, "run", null, "VERB", null, null, 0, null, null);
        assertEquals("_", token.lemma());
        assertEquals("VERB", token.xpos());
        assertTrue(token.isRoot());
        assertNull(token.entity());
    }

    @Test
    void testInvalidStructure() {
        DependencySentence.Builder outOfOrder = DependencySentence.builder();
        assertThrows(IllegalArgumentException.class,
            () -> outOfOrder.addToken(SentenceToken.of(1, "a", "a", "DET")));

        DependencySentence.Builder danglingHead = DependencySentence.builder()
            .addToken(new SentenceToken(0, "a", "a", "DET", "DT", "_", 3, "det", "_"));
        assertThrows(IllegalArgumentException.class, danglingHead::build);
    }
}
