package org.Fabnet.network.model;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable link row. A unidirectional link is traversable only from start to end.
 */
@Value
@Builder
public class NetworkLink {
    int id;

    /**
     * Stable external identifier.
     */
    @Builder.Default
    String guid = "";

    int startNodeId;
    int endNodeId;
    boolean bidirectional;

    /**
     * Traversal cost; {@code NaN} means the store had no cost and the loader applies its default.
     */
    @Builder.Default
    double cost = Double.NaN;

    int objectKind;

    /**
     * Returns true when the link touches {@code nodeId} at either end.
     */
    public boolean touches(int nodeId) {
        return startNodeId == nodeId || endNodeId == nodeId;
    }

    /**
     * Returns true when the link can be walked from {@code from} to {@code to}.
     */
    public boolean allows(int from, int to) {
        if (startNodeId == from && endNodeId == to) {
            return true;
        }
        return bidirectional && startNodeId == to && endNodeId == from;
    }
}
