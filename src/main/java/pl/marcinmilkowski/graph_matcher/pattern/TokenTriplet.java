package pl.marcinmilkowski.graph_matcher.pattern;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Three-word phrase constraint, e.g. {@code as_well_as}.
 */
public record TokenTriplet(String token1, String token2, String token3, Set<String> tupleSet)
        implements TokenTuple {

    public TokenTriplet {
        if (token1 == null || token2 == null || token3 == null) {
            throw new InvalidPatternShapeException("Token triplet needs three tokens");
        }
        tupleSet = TokenTuple.checkedPhrases(tupleSet, 3);
    }

    public static TokenTriplet of(String token1, String token2, String token3, String... phrases) {
        return new TokenTriplet(token1, token2, token3, new LinkedHashSet<>(Arrays.asList(phrases)));
    }

    @Override
    public List<String> tokens() {
        return List.of(token1, token2, token3);
    }
}
