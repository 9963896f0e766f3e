package org.Fabnet.network.path;

/**
 * Traversal mode of {@link PathFinder#findPaths(TraversalAlgorithm, it.unimi.dsi.fastutil.ints.IntSet)}.
 */
public enum TraversalAlgorithm {
    /**
     * Exhaustive depth-first search emitting every path to every terminal node.
     */
    DFS,

    /**
     * Single-source shortest path, one path per distinct endpoint.
     */
    DIJKSTRA
}
