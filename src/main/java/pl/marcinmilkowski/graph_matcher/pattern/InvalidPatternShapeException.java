package pl.marcinmilkowski.graph_matcher.pattern;

/**
 * Exception thrown when a pattern is structurally invalid: a dangling variable,
 * a wrong constraint arity or an unsupported constraint variant.
 */
public class InvalidPatternShapeException extends RuntimeException {

    public InvalidPatternShapeException(String message) {
        super(message);
    }

    public InvalidPatternShapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
