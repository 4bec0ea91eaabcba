package pl.marcinmilkowski.graph_matcher.pattern;

/**
 * A pattern together with the rule name it is registered under.
 */
public record NamedConstraint(String name, Full constraint) {

    public NamedConstraint {
        if (name == null || name.isBlank()) {
            throw new InvalidPatternShapeException("Pattern without a name");
        }
        if (constraint == null) {
            throw new InvalidPatternShapeException("Pattern '" + name + "' has no constraint");
        }
    }
}
