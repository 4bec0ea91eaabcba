package pl.marcinmilkowski.graph_matcher.pattern;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Two-word phrase constraint, e.g. {@code New_York}.
 */
public record TokenPair(String token1, String token2, Set<String> tupleSet) implements TokenTuple {

    public TokenPair {
        if (token1 == null || token2 == null) {
            throw new InvalidPatternShapeException("Token pair needs two tokens");
        }
        tupleSet = TokenTuple.checkedPhrases(tupleSet, 2);
    }

    public static TokenPair of(String token1, String token2, String... phrases) {
        return new TokenPair(token1, token2, new LinkedHashSet<>(Arrays.asList(phrases)));
    }

    @Override
    public List<String> tokens() {
        return List.of(token1, token2);
    }
}
