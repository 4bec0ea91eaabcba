package pl.marcinmilkowski.graph_matcher.sentence;

import pl.marcinmilkowski.graph_matcher.pattern.FieldNames;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable dependency-parsed sentence.
 *
 * <p>Adjacency is kept as an index keyed by integer positions, computed once when
 * the sentence is built. Tokens never reference each other.</p>
 */
public class DependencySentence implements SentenceGraph {

    private final int sentenceId;
    private final List<String> comments;
    private final List<SentenceToken> tokens;
    // child -> parent -> labels
    private final Map<Integer, Map<Integer, Set<String>>> edges;
    private final Map<Integer, Set<String>> labelsAsChild;
    private final Map<Integer, Set<String>> labelsAsParent;

    private DependencySentence(int sentenceId, List<String> comments, List<SentenceToken> tokens,
                               Map<Integer, Map<Integer, Set<String>>> edges) {
        this.sentenceId = sentenceId;
        this.comments = List.copyOf(comments);
        this.tokens = List.copyOf(tokens);

        Map<Integer, Map<Integer, Set<String>>> frozen = new HashMap<>();
        Map<Integer, Set<String>> asChild = new HashMap<>();
        Map<Integer, Set<String>> asParent = new HashMap<>();
        for (Map.Entry<Integer, Map<Integer, Set<String>>> byChild : edges.entrySet()) {
            Map<Integer, Set<String>> parents = new HashMap<>();
            for (Map.Entry<Integer, Set<String>> byParent : byChild.getValue().entrySet()) {
                Set<String> labels = Collections.unmodifiableSet(new TreeSet<>(byParent.getValue()));
                parents.put(byParent.getKey(), labels);
                asChild.computeIfAbsent(byChild.getKey(), k -> new TreeSet<>()).addAll(labels);
                asParent.computeIfAbsent(byParent.getKey(), k -> new TreeSet<>()).addAll(labels);
            }
            frozen.put(byChild.getKey(), Collections.unmodifiableMap(parents));
        }
        this.edges = Collections.unmodifiableMap(frozen);
        this.labelsAsChild = freeze(asChild);
        this.labelsAsParent = freeze(asParent);
    }

    private static Map<Integer, Set<String>> freeze(Map<Integer, Set<String>> map) {
        Map<Integer, Set<String>> result = new HashMap<>();
        map.forEach((k, v) -> result.put(k, Collections.unmodifiableSet(v)));
        return Collections.unmodifiableMap(result);
    }

    public int getSentenceId() {
        return sentenceId;
    }

    public List<String> getComments() {
        return comments;
    }

    public List<SentenceToken> getTokens() {
        return tokens;
    }

    /**
     * @return the token, or null if position is out of bounds
     */
    public SentenceToken getToken(int position) {
        if (position < 0 || position >= tokens.size()) {
            return null;
        }
        return tokens.get(position);
    }

    @Override
    public int size() {
        return tokens.size();
    }

    @Override
    public String text(int position) {
        return tokens.get(position).word();
    }

    @Override
    public Set<String> values(int position, FieldNames field) {
        String value = tokens.get(position).value(field);
        return value == null ? Set.of() : Set.of(value);
    }

    @Override
    public Set<String> labels(int child, int parent) {
        Map<Integer, Set<String>> parents = edges.get(child);
        if (parents == null) {
            return Set.of();
        }
        return parents.getOrDefault(parent, Set.of());
    }

    @Override
    public Set<String> labelsAsChild(int position) {
        return labelsAsChild.getOrDefault(position, Set.of());
    }

    @Override
    public Set<String> labelsAsParent(int position) {
        return labelsAsParent.getOrDefault(position, Set.of());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DependencySentence)) return false;
        DependencySentence that = (DependencySentence) o;
        return sentenceId == that.sentenceId
            && comments.equals(that.comments)
            && tokens.equals(that.tokens)
            && edges.equals(that.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sentenceId, comments, tokens, edges);
    }

    @Override
    public String toString() {
        return String.format("DependencySentence(id=%d, size=%d)", sentenceId, tokens.size());
    }

    /**
     * Creates a new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for dependency sentences. Tokens with a non-zero head contribute
     * the basic edge {@code position -> head - 1} labeled with their deprel;
     * further edges are added with {@link #addEdge}.
     */
    public static class Builder {
        private int sentenceId;
        private final List<String> comments = new ArrayList<>();
        private final List<SentenceToken> tokens = new ArrayList<>();
        private final Map<Integer, Map<Integer, Set<String>>> edges = new HashMap<>();

        public Builder sentenceId(int sentenceId) {
            this.sentenceId = sentenceId;
            return this;
        }

        public Builder comment(String comment) {
            comments.add(comment);
            return this;
        }

        public Builder addToken(SentenceToken token) {
            if (token.position() != tokens.size()) {
                throw new IllegalArgumentException("Token " + token + " added at position " + tokens.size());
            }
            tokens.add(token);
            if (!token.isRoot()) {
                addEdge(token.position(), token.head() - 1, token.deprel());
            }
            return this;
        }

        /**
         * Append a token without dependency columns.
         */
        public Builder addToken(String word, String lemma, String upos) {
            return addToken(SentenceToken.of(tokens.size(), word, lemma, upos));
        }

        public Builder addEdge(int child, int parent, String label) {
            edges.computeIfAbsent(child, k -> new HashMap<>())
                .computeIfAbsent(parent, k -> new LinkedHashSet<>())
                .add(label);
            return this;
        }

        public DependencySentence build() {
            for (Map.Entry<Integer, Map<Integer, Set<String>>> byChild : edges.entrySet()) {
                checkPosition(byChild.getKey());
                for (Integer parent : byChild.getValue().keySet()) {
                    checkPosition(parent);
                }
            }
            return new DependencySentence(sentenceId, comments, tokens, edges);
        }

        private void checkPosition(int position) {
            if (position < 0 || position >= tokens.size()) {
                throw new IllegalArgumentException("Edge endpoint " + position
                    + " outside sentence of " + tokens.size() + " tokens");
            }
        }
    }
}
