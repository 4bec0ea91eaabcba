package pl.marcinmilkowski.graph_matcher.conllu;

/**
 * Exception thrown when input is not basic CoNLL-U.
 */
public class ConlluFormatException extends RuntimeException {

    private final int lineNumber;

    public ConlluFormatException(String message, int lineNumber) {
        super("line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    public ConlluFormatException(String message, int lineNumber, Throwable cause) {
        super("line " + lineNumber + ": " + message, cause);
        this.lineNumber = lineNumber;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
