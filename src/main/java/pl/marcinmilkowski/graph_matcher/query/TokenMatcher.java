package pl.marcinmilkowski.graph_matcher.query;

import pl.marcinmilkowski.graph_matcher.pattern.Field;
import pl.marcinmilkowski.graph_matcher.pattern.FieldNames;
import pl.marcinmilkowski.graph_matcher.sentence.SentenceGraph;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Single-token attribute matcher. Allows different implementations to be used
 * interchangeably by the node matcher.
 */
public interface TokenMatcher {

    /**
     * Find the spans of a sentence satisfying all attribute constraints.
     *
     * @param fields   conjunction of attribute constraints; empty matches every node
     * @param sentence the sentence to search
     * @return matching spans, each expected to cover exactly one node
     */
    List<TokenSpan> match(List<Field> fields, SentenceGraph sentence);

    /**
     * Attribute kinds this matcher understands. Patterns using other kinds are
     * rejected when they are compiled.
     */
    default Set<FieldNames> supportedFields() {
        return EnumSet.allOf(FieldNames.class);
    }
}
