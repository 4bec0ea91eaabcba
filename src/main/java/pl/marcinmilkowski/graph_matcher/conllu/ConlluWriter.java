package pl.marcinmilkowski.graph_matcher.conllu;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.graph_matcher.sentence.DependencySentence;
import pl.marcinmilkowski.graph_matcher.sentence.SentenceToken;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Serializes {@link DependencySentence}s as basic CoNLL-U: comments, one
 * tab-separated line per token, and a blank line after every sentence.
 */
public class ConlluWriter {

    private static final Logger logger = LoggerFactory.getLogger(ConlluWriter.class);

    // Configuration
    private boolean preserveComments = true;

    public void setPreserveComments(boolean preserveComments) {
        this.preserveComments = preserveComments;
    }

    public String write(List<DependencySentence> sentences) {
        StringBuilder text = new StringBuilder();
        for (DependencySentence sentence : sentences) {
            // recover comments from original file
            if (preserveComments) {
                for (String comment : sentence.getComments()) {
                    text.append(comment).append('\n');
                }
            }
            for (SentenceToken token : sentence.getTokens()) {
                text.append(token.position() + 1).append('\t')
                    .append(token.word()).append('\t')
                    .append(token.lemma()).append('\t')
                    .append(token.upos()).append('\t')
                    .append(token.xpos()).append('\t')
                    .append(token.feats()).append('\t')
                    .append(token.head()).append('\t')
                    .append(token.deprel()).append('\t')
                    .append('_').append('\t')
                    .append(token.misc()).append('\n');
            }
            // an empty line ends the sentence
            text.append('\n');
        }
        return text.toString();
    }

    public void write(List<DependencySentence> sentences, Path path) throws IOException {
        Files.writeString(path, write(sentences), StandardCharsets.UTF_8);
        logger.info("Wrote {} sentences to {}", sentences.size(), path);
    }
}
