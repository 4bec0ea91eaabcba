package pl.marcinmilkowski.graph_matcher.pattern;

import java.util.ArrayList;
import java.util.List;

/**
 * Node-level constraint for one pattern variable.
 *
 * <p>{@code spec} fields are conjoined; each field accepts any of its values.
 * Incoming labels are checked on the edges whose parent is the node, outgoing
 * labels on the edges whose child is the node. Both lists are conjunctive and an
 * empty list holds vacuously.</p>
 *
 * @param id            variable name, unique within a pattern
 * @param capture       whether the variable is reported in match results
 * @param optional      whether the variable may stay unbound
 * @param spec          attribute constraints
 * @param incomingEdges label constraints on edges from the node's dependents
 * @param outgoingEdges label constraints on edges to the node's heads
 */
public record Token(
    String id,
    boolean capture,
    boolean optional,
    List<Field> spec,
    List<Label> incomingEdges,
    List<Label> outgoingEdges
) {

    public Token {
        if (id == null || id.isBlank()) {
            throw new InvalidPatternShapeException("Token constraint without an id");
        }
        spec = spec == null ? List.of() : List.copyOf(spec);
        incomingEdges = incomingEdges == null ? List.of() : List.copyOf(incomingEdges);
        outgoingEdges = outgoingEdges == null ? List.of() : List.copyOf(outgoingEdges);
    }

    /**
     * Copy of this token with the given attribute constraints.
     */
    public Token withSpec(List<Field> newSpec) {
        return new Token(id, capture, optional, newSpec, incomingEdges, outgoingEdges);
    }

    /**
     * Copy of this token with the given label constraints.
     */
    public Token withEdges(List<Label> newIncoming, List<Label> newOutgoing) {
        return new Token(id, capture, optional, spec, newIncoming, newOutgoing);
    }

    public Builder toBuilder() {
        Builder builder = new Builder(id).capture(capture).optional(optional);
        builder.spec.addAll(spec);
        builder.incoming.addAll(incomingEdges);
        builder.outgoing.addAll(outgoingEdges);
        return builder;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * Builder for token constraints. Tokens are captured and required by default.
     */
    public static class Builder {
        private final String id;
        private boolean capture = true;
        private boolean optional = false;
        private final List<Field> spec = new ArrayList<>();
        private final List<Label> incoming = new ArrayList<>();
        private final List<Label> outgoing = new ArrayList<>();

        private Builder(String id) {
            this.id = id;
        }

        public Builder capture(boolean capture) {
            this.capture = capture;
            return this;
        }

        public Builder optional(boolean optional) {
            this.optional = optional;
            return this;
        }

        public Builder field(FieldNames field, String... values) {
            spec.add(Field.of(field, values));
            return this;
        }

        public Builder field(Field field) {
            spec.add(field);
            return this;
        }

        public Builder incoming(Label label) {
            incoming.add(label);
            return this;
        }

        public Builder outgoing(Label label) {
            outgoing.add(label);
            return this;
        }

        public Token build() {
            return new Token(id, capture, optional, spec, incoming, outgoing);
        }
    }
}
