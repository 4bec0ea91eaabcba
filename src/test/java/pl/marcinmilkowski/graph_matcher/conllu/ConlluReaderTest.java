package pl.marcinmilkowski.graph_matcher.conllu;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import pl.marcinmilkowski.graph_matcher.pattern.FieldNames;
import pl.marcinmilkowski.graph_matcher.sentence.DependencySentence;
import pl.marcinmilkowski.graph_matcher.sentence.SentenceToken;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConlluReaderTest {

    @TempDir
    Path tempDir;

    private ConlluReader reader;

    @BeforeEach
    void setUp() {
        reader = new ConlluReader();
    }

    private static String line(String... columns) {
        return String.join("\t", columns) + "\n";
    }

    @Test
    void testReadSampleFile() throws IOException, URISyntaxException {
        Path sample = Path.of(getClass().getClassLoader().getResource("sample.conllu").toURI());

        List<DependencySentence> sentences = reader.read(sample);

        assertEquals(2, sentences.size());
        DependencySentence first = sentences.get(0);
        assertEquals(1, first.getSentenceId());
        assertEquals(List.of("# sent_id = 1", "# text = John saw the dog."), first.getComments());
        assertEquals(5, first.size());
        assertEquals(Set.of("nsubj"), first.labels(0, 1));
        assertEquals(Set.of("det"), first.labels(2, 3));
        assertTrue(first.getToken(1).isRoot());
        // empty XPOS is replaced by UPOS
        assertEquals("DET", first.getToken(2).xpos());
        assertEquals("SpaceAfter=No", first.getToken(3).misc());

        DependencySentence second = sentences.get(1);
        assertEquals(2, second.getSentenceId());
        assertEquals(Set.of("GPE"), second.values(2, FieldNames.ENTITY));
        assertEquals(Set.of("compound"), second.labels(2, 3));
    }

    @Test
    void testParseWithoutTrailingBlankLine() {
        String text = "# text = Dogs bark\n"
            + line("1", "Dogs", "dog", "NOUN", "NNS", "Number=Plur", "2", "nsubj", "_", "_")
            + line("2", "bark", "bark", "VERB", "VBP", "_", "0", "root", "_", "_").trim();

        List<DependencySentence> sentences = reader.parse(text);

        assertEquals(1, sentences.size());
        SentenceToken dogs = sentences.get(0).getToken(0);
        assertEquals(new SentenceToken(0, "Dogs", "dog", "NOUN", "NNS", "Number=Plur", 2, "nsubj", "_"), dogs);
    }

    @Test
    void testSeveralBlankLinesBetweenSentences() {
        String text = line("1", "Hi", "hi", "INTJ", "UH", "_", "0", "root", "_", "_")
            + "\n\n\n"
            + line("1", "Bye", "bye", "INTJ", "UH", "_", "0", "root", "_", "_")
            + "\n";

        List<DependencySentence> sentences = reader.parse(text);

        assertEquals(2, sentences.size());
        assertEquals("Bye", sentences.get(1).text(0));
        assertTrue(reader.parse("").isEmpty());
    }

    @Test
    @DisplayName("Multi-word token ranges are not basic CoNLL-U")
    void testRejectsMultiwordTokens() {
        String text = line("1-2", "del", "_", "_", "_", "_", "_", "_", "_", "_")
            + line("1", "de", "de", "ADP", "_", "_", "2", "case", "_", "_")
            + line("2", "el", "el", "DET", "_", "_", "0", "root", "_", "_");

        ConlluFormatException e = assertThrows(ConlluFormatException.class, () -> reader.parse(text));
        assertEquals(1, e.getLineNumber());
    }

    @Test
    @DisplayName("Empty nodes and enhanced dependencies are rejected")
    void testRejectsEnhancedGraphs() {
        String emptyNode = line("1", "I", "I", "PRON", "_", "_", "0", "root", "_", "_")
            + line("1.1", "ate", "eat", "VERB", "_", "_", "_", "_", "_", "_");
        assertThrows(ConlluFormatException.class, () -> reader.parse(emptyNode));

        String deps = line("1", "I", "I", "PRON", "_", "_", "0", "root", "0:root", "_");
        assertThrows(ConlluFormatException.class, () -> reader.parse(deps));
    }

    @Test
    void testRejectsMalformedLines() {
        assertThrows(ConlluFormatException.class, () -> reader.parse("1\tonly\tthree\n"));

        String badHead = line("1", "I", "I", "PRON", "_", "_", "x", "root", "_", "_");
        assertThrows(ConlluFormatException.class, () -> reader.parse(badHead));

        String headOutside = line("1", "I", "I", "PRON", "_", "_", "5", "nsubj", "_", "_");
        assertThrows(ConlluFormatException.class, () -> reader.parse(headOutside));

        String skippedId = line("2", "I", "I", "PRON", "_", "_", "0", "root", "_", "_");
        assertThrows(ConlluFormatException.class, () -> reader.parse(skippedId));
    }

    @Test
    void testLenientDecoding() throws IOException {
        Path file = tempDir.resolve("broken.conllu");
        byte[] prefix = "1\tcaf".getBytes();
        byte[] suffix = "\tcafe\tNOUN\tNN\t_\t0\troot\t_\t_\n".getBytes();
        byte[] content = new byte[prefix.length + 1 + suffix.length];
        System.arraycopy(prefix, 0, content, 0, prefix.length);
        content[prefix.length] = (byte) 0xE9; // latin-1 e-acute, invalid UTF-8
        System.arraycopy(suffix, 0, content, prefix.length + 1, suffix.length);
        Files.write(file, content);

        List<DependencySentence> sentences = reader.read(file);

        assertEquals(1, sentences.size());
        assertEquals("caf?", sentences.get(0).text(0));
    }
}
