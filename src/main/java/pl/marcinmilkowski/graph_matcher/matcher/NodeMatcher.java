package pl.marcinmilkowski.graph_matcher.matcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.graph_matcher.pattern.Field;
import pl.marcinmilkowski.graph_matcher.pattern.FieldNames;
import pl.marcinmilkowski.graph_matcher.pattern.InvalidPatternShapeException;
import pl.marcinmilkowski.graph_matcher.pattern.Label;
import pl.marcinmilkowski.graph_matcher.pattern.Token;
import pl.marcinmilkowski.graph_matcher.query.TokenMatcher;
import pl.marcinmilkowski.graph_matcher.query.TokenSpan;
import pl.marcinmilkowski.graph_matcher.sentence.SentenceGraph;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Finds, for every pattern variable, the sentence nodes consistent with the
 * variable's own constraints: attribute fields (delegated to a {@link TokenMatcher})
 * and incoming/outgoing label constraints (checked here).
 */
public class NodeMatcher {

    private static final Logger logger = LoggerFactory.getLogger(NodeMatcher.class);

    private final List<Token> tokens;
    private final TokenMatcher tokenMatcher;

    /**
     * @throws InvalidPatternShapeException if a token uses a field kind the
     *         token matcher does not support
     */
    public NodeMatcher(List<Token> tokens, TokenMatcher tokenMatcher) {
        this.tokens = List.copyOf(tokens);
        this.tokenMatcher = tokenMatcher;
        Set<FieldNames> supported = tokenMatcher.supportedFields();
        for (Token token : this.tokens) {
            for (Field field : token.spec()) {
                if (!supported.contains(field.field())) {
                    throw new InvalidPatternShapeException("Token '" + token.id() + "' uses field "
                        + field.field() + " which the token matcher does not support");
                }
            }
        }
    }

    /**
     * Compute the candidate map for a sentence.
     *
     * @throws UnsatisfiedRequiredVariableException if a required variable has no candidate
     * @throws InvalidPatternShapeException if the token matcher returns a span wider than one node
     */
    public CandidateMap match(SentenceGraph sentence) throws UnsatisfiedRequiredVariableException {
        Map<String, Set<Integer>> matched = new LinkedHashMap<>();
        for (Token token : tokens) {
            Set<Integer> positions = new TreeSet<>();
            for (TokenSpan span : tokenMatcher.match(token.spec(), sentence)) {
                if (span.width() != 1) {
                    throw new InvalidPatternShapeException("Token '" + token.id() + "' matched " + span.width()
                        + " nodes at " + span.start() + "; a token must match a single node");
                }
                if (satisfiesAll(token.incomingEdges(), sentence.labelsAsParent(span.start()))
                        && satisfiesAll(token.outgoingEdges(), sentence.labelsAsChild(span.start()))) {
                    positions.add(span.start());
                }
            }
            if (positions.isEmpty() && !token.optional()) {
                throw new UnsatisfiedRequiredVariableException(token.id());
            }
            matched.put(token.id(), positions);
        }
        CandidateMap candidates = new CandidateMap(matched);
        logger.debug("Candidates: {}", candidates);
        return candidates;
    }

    private static boolean satisfiesAll(List<Label> constraints, Set<String> actualLabels) {
        for (Label constraint : constraints) {
            if (constraint.satisfied(actualLabels).isEmpty()) {
                return false;
            }
        }
        return true;
    }
}
