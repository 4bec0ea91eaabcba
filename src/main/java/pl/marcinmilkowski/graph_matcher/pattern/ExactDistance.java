package pl.marcinmilkowski.graph_matcher.pattern;

/**
 * Exactly {@code distance} tokens between token1 and token2; 0 means adjacent.
 */
public record ExactDistance(String token1, String token2, int distance) implements Distance {

    public ExactDistance {
        if (token1 == null || token2 == null) {
            throw new InvalidPatternShapeException("Distance constraint needs two tokens");
        }
    }

    @Override
    public boolean isSatisfiedBy(int tokensBetween) {
        return tokensBetween == distance;
    }
}
