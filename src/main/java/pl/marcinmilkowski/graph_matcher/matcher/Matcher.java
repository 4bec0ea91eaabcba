package pl.marcinmilkowski.graph_matcher.matcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.graph_matcher.pattern.Full;
import pl.marcinmilkowski.graph_matcher.pattern.InvalidPatternShapeException;
import pl.marcinmilkowski.graph_matcher.pattern.NamedConstraint;
import pl.marcinmilkowski.graph_matcher.pattern.PatternPreprocessor;
import pl.marcinmilkowski.graph_matcher.query.PredicateTokenMatcher;
import pl.marcinmilkowski.graph_matcher.query.TokenMatcher;
import pl.marcinmilkowski.graph_matcher.sentence.SentenceGraph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compiles a set of named patterns once and applies them to sentences.
 *
 * <p>Each pattern is preprocessed and split into a {@link NodeMatcher} and a
 * {@link GlobalMatcher}. The matcher is immutable and may be shared between
 * threads; pass it explicitly to whatever processes sentences.</p>
 *
 * Usage:
 * <pre>
 *   Matcher matcher = new Matcher(patterns);
 *   Match match = matcher.apply(sentence);
 *   for (String name : match.names()) {
 *       match.matchesFor(name).forEach(result -> ...);
 *   }
 * </pre>
 */
public class Matcher {

    private static final Logger logger = LoggerFactory.getLogger(Matcher.class);

    private final Map<String, CompiledPattern> matchers;

    public Matcher(List<NamedConstraint> constraints) {
        this(constraints, new PredicateTokenMatcher());
    }

    /**
     * @throws InvalidPatternShapeException if two patterns share a name or a
     *         pattern cannot be compiled for the token matcher
     */
    public Matcher(List<NamedConstraint> constraints, TokenMatcher tokenMatcher) {
        Map<String, CompiledPattern> compiled = new LinkedHashMap<>();
        for (NamedConstraint constraint : constraints) {
            if (compiled.containsKey(constraint.name())) {
                throw new InvalidPatternShapeException("Duplicate pattern name: " + constraint.name());
            }
            Full preprocessed = PatternPreprocessor.preprocess(constraint.constraint());
            compiled.put(constraint.name(), new CompiledPattern(
                new NodeMatcher(preprocessed.tokens(), tokenMatcher),
                new GlobalMatcher(preprocessed)));
        }
        this.matchers = Collections.unmodifiableMap(compiled);
        logger.info("Compiled {} patterns", matchers.size());
    }

    /**
     * Bind the compiled patterns to a sentence.
     */
    public Match apply(SentenceGraph sentence) {
        return new Match(matchers, sentence);
    }

    public Set<String> names() {
        return matchers.keySet();
    }
}
