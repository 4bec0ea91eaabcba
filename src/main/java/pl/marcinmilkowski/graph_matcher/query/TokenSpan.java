package pl.marcinmilkowski.graph_matcher.query;

/**
 * Half-open span {@code [start, end)} of node positions returned by a token matcher.
 */
public record TokenSpan(int start, int end) {

    public TokenSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public static TokenSpan single(int position) {
        return new TokenSpan(position, position + 1);
    }

    public int width() {
        return end - start;
    }
}
