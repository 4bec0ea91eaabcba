package pl.marcinmilkowski.graph_matcher.pattern;

/**
 * At most {@code distance} tokens between token1 and token2.
 */
public record UptoDistance(String token1, String token2, int distance) implements Distance {

    public UptoDistance {
        if (token1 == null || token2 == null) {
            throw new InvalidPatternShapeException("Distance constraint needs two tokens");
        }
        if (distance < 0) {
            throw new InvalidPatternShapeException("Up-to distance between " + token1 + " and " + token2
                + " must not be negative: " + distance);
        }
    }

    @Override
    public boolean isSatisfiedBy(int tokensBetween) {
        return tokensBetween <= distance;
    }
}
