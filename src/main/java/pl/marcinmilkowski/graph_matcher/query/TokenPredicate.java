package pl.marcinmilkowski.graph_matcher.query;

import pl.marcinmilkowski.graph_matcher.sentence.SentenceGraph;

/**
 * Functional interface for single-token matching predicates.
 * Used by PredicateTokenMatcher to check whether a node satisfies a constraint.
 */
@FunctionalInterface
public interface TokenPredicate {
    boolean test(SentenceGraph sentence, int position);
}
