package pl.marcinmilkowski.graph_matcher.query;

import pl.marcinmilkowski.graph_matcher.sentence.SentenceGraph;

import java.util.List;

/**
 * Predicate that matches when ANY of its child predicates match.
 */
public class OrPredicate implements TokenPredicate {
    private final List<TokenPredicate> predicates;

    public OrPredicate(List<TokenPredicate> predicates) {
        this.predicates = List.copyOf(predicates);
    }

    @Override
    public boolean test(SentenceGraph sentence, int position) {
        for (TokenPredicate pred : predicates) {
            if (pred.test(sentence, position)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "Or(" + predicates + ")";
    }
}
