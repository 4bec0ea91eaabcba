package pl.marcinmilkowski.graph_matcher.pattern;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Adds node-level constraints implied by the edge and phrase constraints of a
 * pattern, so candidate nodes can be rejected before edge pairs are enumerated.
 *
 * <ul>
 *   <li>A positive edge label ({@link HasLabelFromList}) becomes an outgoing label
 *       constraint on the child and an incoming label constraint on the parent.
 *       Negative labels are not hoisted: a node may still satisfy the pattern
 *       through another pair.</li>
 *   <li>Each phrase of a {@link TokenTuple} is split into words, and the i-th words
 *       become an extra {@link FieldNames#WORD} constraint on the i-th variable.
 *       The new field is conjoined with any existing word constraint. The phrase
 *       itself is still checked after merging.</li>
 * </ul>
 *
 * A constraint is only moved onto nodes when every variable it mentions is
 * required. An edge or phrase touching an unbound optional variable holds
 * vacuously, and an optional variable with no candidates is left unbound, so
 * narrowing either side could change the results.
 *
 * The input pattern is never modified and no variable is added or removed.
 */
public final class PatternPreprocessor {

    private PatternPreprocessor() {
    }

    public static Full preprocess(Full constraint) {
        Set<String> optional = new HashSet<>();
        for (Token token : constraint.tokens()) {
            if (token.optional()) {
                optional.add(token.id());
            }
        }

        Map<String, List<Label>> outs = new LinkedHashMap<>();
        Map<String, List<Label>> ins = new LinkedHashMap<>();
        for (Edge edge : constraint.edges()) {
            if (!(edge.label() instanceof HasLabelFromList)
                    || optional.contains(edge.child()) || optional.contains(edge.parent())) {
                continue;
            }
            outs.computeIfAbsent(edge.child(), k -> new ArrayList<>()).add(edge.label());
            ins.computeIfAbsent(edge.parent(), k -> new ArrayList<>()).add(edge.label());
        }

        Map<String, List<Field>> words = new LinkedHashMap<>();
        for (TokenTuple concat : constraint.concats()) {
            List<String> ids = concat.tokens();
            if (anyOptional(ids, optional)) {
                continue;
            }
            for (int i = 0; i < ids.size(); i++) {
                Set<String> ithWords = new LinkedHashSet<>();
                for (String phrase : concat.tupleSet()) {
                    ithWords.add(TokenTuple.split(phrase)[i]);
                }
                words.computeIfAbsent(ids.get(i), k -> new ArrayList<>())
                    .add(new Field(FieldNames.WORD, ithWords));
            }
        }

        List<Token> tokens = new ArrayList<>(constraint.tokens().size());
        for (Token token : constraint.tokens()) {
            List<Label> incoming = new ArrayList<>(token.incomingEdges());
            incoming.addAll(ins.getOrDefault(token.id(), List.of()));
            List<Label> outgoing = new ArrayList<>(token.outgoingEdges());
            outgoing.addAll(outs.getOrDefault(token.id(), List.of()));
            List<Field> spec = new ArrayList<>(token.spec());
            spec.addAll(words.getOrDefault(token.id(), List.of()));
            tokens.add(token.withSpec(spec).withEdges(incoming, outgoing));
        }
        return constraint.withTokens(tokens);
    }

    private static boolean anyOptional(List<String> ids, Set<String> optional) {
        for (String id : ids) {
            if (optional.contains(id)) {
                return true;
            }
        }
        return false;
    }
}
