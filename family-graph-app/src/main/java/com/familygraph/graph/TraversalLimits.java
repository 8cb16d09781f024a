package com.familygraph.graph;

/**
 * Ceilings applied to every traversal so that untrusted input cannot walk the whole graph.
 *
 * @param maxDepth     requested depths above this are clamped to it
 * @param maxVisited   a traversal stops collecting once it holds this many people
 * @param defaultDepth depth used when the caller gives none
 */
public record TraversalLimits(int maxDepth, int maxVisited, int defaultDepth) {

    public TraversalLimits {
        if (maxDepth < 1 || maxVisited < 1 || defaultDepth < 0) {
            throw new IllegalArgumentException("Traversal limits must be positive");
        }
        defaultDepth = Math.min(defaultDepth, maxDepth);
    }

    public static TraversalLimits defaults() {
        return new TraversalLimits(20, 10_000, 10);
    }

    public int clampDepth(Integer depth) {
        if (depth == null) {
            return defaultDepth;
        }
        if (depth < 0) {
            throw new ValidationException("Depth must not be negative: " + depth);
        }
        return Math.min(depth, maxDepth);
    }
}
