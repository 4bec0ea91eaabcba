package pl.marcinmilkowski.graph_matcher.matcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.graph_matcher.sentence.SentenceGraph;

import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * The compiled patterns of a {@link Matcher} bound to one sentence. This is the
 * entry point of the rewrite step.
 */
public class Match {

    private static final Logger logger = LoggerFactory.getLogger(Match.class);

    private final Map<String, CompiledPattern> matchers;
    private final SentenceGraph sentence;

    Match(Map<String, CompiledPattern> matchers, SentenceGraph sentence) {
        this.matchers = matchers;
        this.sentence = sentence;
    }

    /**
     * Pattern names, in declaration order.
     */
    public Set<String> names() {
        return matchers.keySet();
    }

    /**
     * Lazily match one pattern against the sentence. Each call matches afresh;
     * nothing is computed until the stream is consumed.
     *
     * @throws IllegalArgumentException if no pattern has that name
     */
    public Stream<MatchingResult> matchesFor(String name) {
        CompiledPattern compiled = matchers.get(name);
        if (compiled == null) {
            throw new IllegalArgumentException("Unknown pattern: " + name);
        }
        return Stream.of(compiled).flatMap(this::run);
    }

    private Stream<MatchingResult> run(CompiledPattern compiled) {
        CandidateMap candidates;
        try {
            candidates = compiled.nodeMatcher().match(sentence);
        } catch (UnsatisfiedRequiredVariableException e) {
            logger.debug("{}: {}", sentence, e.getMessage());
            return Stream.empty();
        }
        return compiled.globalMatcher().match(candidates, sentence);
    }
}
