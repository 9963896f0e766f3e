package org.Fabnet.network.path;

import org.Fabnet.network.graph.Adjacency;

/**
 * Work-list entry of the iterative depth-first search.
 *
 * @param kind visit or backtrack marker.
 * @param nodeId node entered or left.
 * @param fromNodeId predecessor on the current branch, meaningless for the start frame.
 * @param via adjacency entry walked to reach {@code nodeId}, {@code null} for the start frame.
 */
record DfsFrame(Kind kind, int nodeId, int fromNodeId, Adjacency via) {

    enum Kind {
        VISIT,
        BACKTRACK
    }

    static DfsFrame start(int nodeId) {
        return new DfsFrame(Kind.VISIT, nodeId, nodeId, null);
    }

    static DfsFrame visit(int fromNodeId, Adjacency via) {
        return new DfsFrame(Kind.VISIT, via.neighborId(), fromNodeId, via);
    }

    DfsFrame backtrack() {
        return new DfsFrame(Kind.BACKTRACK, nodeId, fromNodeId, via);
    }
}
