package pl.marcinmilkowski.graph_matcher.sentence;

import pl.marcinmilkowski.graph_matcher.pattern.FieldNames;

import java.util.Set;

/**
 * Read-only view of a parsed sentence: nodes addressed by 0-based position and
 * labeled edges directed from a child (dependent) to its parent (head).
 *
 * <p>The matching engine only reads through this interface and never mutates
 * the sentence.</p>
 */
public interface SentenceGraph {

    /**
     * Number of nodes.
     */
    int size();

    /**
     * Surface text of the node at {@code position}.
     */
    String text(int position);

    /**
     * Attribute values of the given kind; empty if the node has none.
     */
    Set<String> values(int position, FieldNames field);

    /**
     * Labels of the edges from {@code child} to {@code parent}; empty if there is no edge.
     */
    Set<String> labels(int child, int parent);

    /**
     * Labels of all edges whose child is {@code position} (the node's outgoing labels).
     */
    Set<String> labelsAsChild(int position);

    /**
     * Labels of all edges whose parent is {@code position} (the node's incoming labels).
     */
    Set<String> labelsAsParent(int position);
}
