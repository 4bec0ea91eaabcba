package pl.marcinmilkowski.graph_matcher.matcher;

/**
 * Thrown by the node matcher when a required variable has no candidate node.
 * This is the ordinary "pattern does not occur in this sentence" outcome;
 * {@link Match} turns it into an empty result stream.
 */
public class UnsatisfiedRequiredVariableException extends Exception {

    private final String variable;

    public UnsatisfiedRequiredVariableException(String variable) {
        super("Required token '" + variable + "' not matched");
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}
