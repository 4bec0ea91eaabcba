package pl.marcinmilkowski.graph_matcher.pattern;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A complete structural pattern: token variables plus the edge, distance and
 * phrase constraints between them.
 *
 * <p>Construction validates the pattern shape. Every variable referenced by an
 * edge, distance or phrase constraint must be declared in {@code tokens}.</p>
 */
public record Full(
    List<Token> tokens,
    List<Edge> edges,
    List<Distance> distances,
    List<TokenTuple> concats
) {

    public Full {
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
        edges = edges == null ? List.of() : List.copyOf(edges);
        distances = distances == null ? List.of() : List.copyOf(distances);
        concats = concats == null ? List.of() : List.copyOf(concats);

        Map<String, Token> byId = new LinkedHashMap<>();
        for (Token token : tokens) {
            if (byId.put(token.id(), token) != null) {
                throw new InvalidPatternShapeException("Duplicate token id: " + token.id());
            }
        }
        for (Edge edge : edges) {
            checkDeclared(byId, edge.child(), "edge " + edge.child() + "->" + edge.parent());
            checkDeclared(byId, edge.parent(), "edge " + edge.child() + "->" + edge.parent());
        }
        for (Distance distance : distances) {
            checkDeclared(byId, distance.token1(), "distance " + distance);
            checkDeclared(byId, distance.token2(), "distance " + distance);
        }
        for (TokenTuple concat : concats) {
            for (String id : concat.tokens()) {
                checkDeclared(byId, id, "phrase " + concat.tokens());
            }
        }
    }

    private static void checkDeclared(Map<String, Token> byId, String id, String where) {
        if (!byId.containsKey(id)) {
            throw new InvalidPatternShapeException("Undeclared token '" + id + "' referenced by " + where);
        }
    }

    /**
     * Find a token constraint by variable name.
     */
    public Optional<Token> token(String id) {
        return tokens.stream().filter(t -> t.id().equals(id)).findFirst();
    }

    /**
     * Copy of this pattern with the token constraints replaced.
     */
    public Full withTokens(List<Token> newTokens) {
        return new Full(newTokens, edges, distances, concats);
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.tokens.addAll(tokens);
        builder.edges.addAll(edges);
        builder.distances.addAll(distances);
        builder.concats.addAll(concats);
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for patterns. Validation happens in {@link #build()}.
     */
    public static class Builder {
        private final List<Token> tokens = new ArrayList<>();
        private final List<Edge> edges = new ArrayList<>();
        private final List<Distance> distances = new ArrayList<>();
        private final List<TokenTuple> concats = new ArrayList<>();

        public Builder token(Token token) {
            tokens.add(token);
            return this;
        }

        public Builder edge(String child, String parent, Label label) {
            edges.add(new Edge(child, parent, label));
            return this;
        }

        public Builder edge(Edge edge) {
            edges.add(edge);
            return this;
        }

        public Builder distance(Distance distance) {
            distances.add(distance);
            return this;
        }

        public Builder concat(TokenTuple concat) {
            concats.add(concat);
            return this;
        }

        public Full build() {
            return new Full(tokens, edges, distances, concats);
        }
    }

    @Override
    public String toString() {
        return String.format("Full(tokens=%d, edges=%d, distances=%d, concats=%d)",
            tokens.size(), edges.size(), distances.size(), concats.size());
    }
}
