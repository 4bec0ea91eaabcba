package pl.marcinmilkowski.graph_matcher.pattern;

/**
 * Positional constraint between two variables. The measured value is the number
 * of tokens strictly between them: {@code position(token2) - position(token1) - 1}.
 */
public sealed interface Distance permits ExactDistance, UptoDistance {

    String token1();

    String token2();

    int distance();

    /**
     * @param tokensBetween the measured distance for a candidate assignment
     */
    boolean isSatisfiedBy(int tokensBetween);

    static int tokensBetween(int position1, int position2) {
        return position2 - position1 - 1;
    }
}
