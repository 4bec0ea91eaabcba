package pl.marcinmilkowski.graph_matcher.matcher;

/**
 * The two matching stages compiled from one preprocessed pattern.
 */
public record CompiledPattern(NodeMatcher nodeMatcher, GlobalMatcher globalMatcher) {
}
