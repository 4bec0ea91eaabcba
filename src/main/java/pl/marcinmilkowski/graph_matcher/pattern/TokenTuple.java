package pl.marcinmilkowski.graph_matcher.pattern;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Phrase constraint over adjacent-token sequences. The surface forms of the
 * variables, joined with {@code _}, must be one of the phrases in {@code tupleSet}.
 */
public sealed interface TokenTuple permits TokenPair, TokenTriplet {

    String SEPARATOR = "_";

    /**
     * The variables of the phrase, in phrase order.
     */
    List<String> tokens();

    Set<String> tupleSet();

    /**
     * Validate that every phrase splits into exactly {@code arity} words.
     */
    static Set<String> checkedPhrases(Set<String> tupleSet, int arity) {
        if (tupleSet == null || tupleSet.isEmpty()) {
            throw new InvalidPatternShapeException("Phrase constraint accepts no phrases");
        }
        for (String phrase : tupleSet) {
            if (phrase == null || split(phrase).length != arity) {
                throw new InvalidPatternShapeException("Phrase '" + phrase + "' does not have "
                    + arity + " words separated by '" + SEPARATOR + "'");
            }
            for (String word : split(phrase)) {
                if (word.isEmpty()) {
                    throw new InvalidPatternShapeException("Phrase '" + phrase + "' contains an empty word");
                }
            }
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(tupleSet));
    }

    static String[] split(String phrase) {
        // limit -1: keep trailing empty words
        return phrase.split(SEPARATOR, -1);
    }
}
