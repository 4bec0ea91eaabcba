package pl.marcinmilkowski.graph_matcher.conllu;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.graph_matcher.sentence.DependencySentence;
import pl.marcinmilkowski.graph_matcher.sentence.SentenceToken;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads basic CoNLL-U (https://universaldependencies.org/format.html) into
 * {@link DependencySentence}s.
 *
 * <ul>
 *   <li>Sentences are separated by blank lines; {@code #} lines are kept as comments.</li>
 *   <li>Multi-word token ranges ({@code 1-2}), empty nodes ({@code 1.1}) and a non-empty
 *       DEPS column are rejected: only basic CoNLL-U is accepted.</li>
 *   <li>An empty XPOS ({@code _}) is replaced by the UPOS.</li>
 *   <li>Token ids become 0-based positions; HEAD 0 marks the root.</li>
 * </ul>
 */
public class ConlluReader {

    private static final Logger logger = LoggerFactory.getLogger(ConlluReader.class);

    private static final int COLUMNS = 10;
    private static final String EMPTY = "_";

    /**
     * Parse CoNLL-U text.
     *
     * @throws ConlluFormatException if the text is not basic CoNLL-U
     */
    public List<DependencySentence> parse(String text) {
        try {
            return read(new StringReader(text));
        } catch (IOException e) {
            throw new IllegalStateException("Unexpected I/O error reading a string", e);
        }
    }

    /**
     * Read a CoNLL-U file. Malformed UTF-8 is replaced rather than rejected.
     */
    public List<DependencySentence> read(Path path) throws IOException {
        logger.info("Reading CoNLL-U file: {}", path);

        // Use lenient UTF-8 decoder
        var decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE)
            .replaceWith("?");

        try (Reader reader = new InputStreamReader(Files.newInputStream(path), decoder)) {
            List<DependencySentence> sentences = read(reader);
            logger.info("Read {} sentences from {}", sentences.size(), path);
            return sentences;
        }
    }

    private List<DependencySentence> read(Reader input) throws IOException {
        List<DependencySentence> sentences = new ArrayList<>();
        BufferedReader reader = new BufferedReader(input);

        List<String> comments = new ArrayList<>();
        List<SentenceToken> tokens = new ArrayList<>();
        int lineNumber = 0;
        int sentenceStart = 1;

        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                // End of sentence
                if (!tokens.isEmpty() || !comments.isEmpty()) {
                    sentences.add(buildSentence(sentences.size() + 1, comments, tokens, sentenceStart));
                    comments.clear();
                    tokens.clear();
                }
                sentenceStart = lineNumber + 1;
            } else if (line.startsWith("#")) {
                comments.add(line);
            } else {
                tokens.add(parseToken(line, tokens.size(), lineNumber));
            }
        }

        // Process remaining sentence
        if (!tokens.isEmpty() || !comments.isEmpty()) {
            sentences.add(buildSentence(sentences.size() + 1, comments, tokens, sentenceStart));
        }
        return sentences;
    }

    private static SentenceToken parseToken(String line, int position, int lineNumber) {
        String[] fields = line.split("\t");
        if (fields.length < COLUMNS) {
            throw new ConlluFormatException("expected " + COLUMNS + " tab-separated columns, found "
                + fields.length, lineNumber);
        }
        String id = fields[0];
        if (id.contains("-")) {
            throw new ConlluFormatException("text must be basic CoNLL-U, found multi-word token " + id, lineNumber);
        }
        if (id.contains(".") || !EMPTY.equals(fields[8])) {
            throw new ConlluFormatException("text must be basic CoNLL-U, received an enhanced one", lineNumber);
        }

        int parsedId;
        int head;
        try {
            parsedId = Integer.parseInt(id);
            head = Integer.parseInt(fields[6]);
        } catch (NumberFormatException e) {
            throw new ConlluFormatException("invalid id or head: " + id + ", " + fields[6], lineNumber, e);
        }
        if (parsedId != position + 1) {
            throw new ConlluFormatException("expected token id " + (position + 1) + ", found " + parsedId, lineNumber);
        }

        String upos = fields[3];
        // fix xpos if empty to a copy of upos
        String xpos = EMPTY.equals(fields[4]) ? upos : fields[4];
        return new SentenceToken(position, fields[1], fields[2], upos, xpos, fields[5], head, fields[7], fields[9]);
    }

    private static DependencySentence buildSentence(int sentenceId, List<String> comments,
                                                    List<SentenceToken> tokens, int lineNumber) {
        DependencySentence.Builder builder = DependencySentence.builder().sentenceId(sentenceId);
        comments.forEach(builder::comment);
        for (SentenceToken token : tokens) {
            if (token.head() < 0 || token.head() > tokens.size()) {
                throw new ConlluFormatException("head " + token.head() + " of token " + (token.position() + 1)
                    + " is outside the sentence", lineNumber);
            }
            builder.addToken(token);
        }
        return builder.build();
    }
}
