package pl.marcinmilkowski.graph_matcher.pattern;

/**
 * Directed edge constraint from a child variable to its parent variable.
 */
public record Edge(String child, String parent, Label label) {

    public Edge {
        if (child == null || parent == null) {
            throw new InvalidPatternShapeException("Edge constraint needs both a child and a parent");
        }
        if (child.equals(parent)) {
            throw new InvalidPatternShapeException("Edge constraint from '" + child + "' to itself");
        }
        if (label == null) {
            throw new InvalidPatternShapeException("Edge constraint " + child + "->" + parent + " has no label predicate");
        }
    }
}
