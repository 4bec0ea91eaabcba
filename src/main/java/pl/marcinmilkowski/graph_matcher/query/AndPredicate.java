package pl.marcinmilkowski.graph_matcher.query;

import pl.marcinmilkowski.graph_matcher.sentence.SentenceGraph;

import java.util.List;

/**
 * Predicate that matches when ALL of its child predicates match.
 * An empty conjunction matches every token.
 */
public class AndPredicate implements TokenPredicate {
    private final List<TokenPredicate> predicates;

    public AndPredicate(List<TokenPredicate> predicates) {
        this.predicates = List.copyOf(predicates);
    }

    @Override
    public boolean test(SentenceGraph sentence, int position) {
        for (TokenPredicate pred : predicates) {
            if (!pred.test(sentence, position)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "And(" + predicates + ")";
    }
}
