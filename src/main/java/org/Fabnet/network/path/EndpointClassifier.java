package org.Fabnet.network.path;

import it.unimi.dsi.fastutil.ints.IntSet;
import lombok.RequiredArgsConstructor;
import org.Fabnet.network.graph.Adjacency;
import org.Fabnet.network.graph.GraphView;
import org.Fabnet.network.model.NetworkNode;

import java.util.List;

/**
 * Terminal rule shared by both traversal modes.
 *
 * <p>Priority order: LEAF, then TARGET, then BOUNDARY. The result depends only on the graph
 * view and the target codes, so repeated calls for the same node agree.</p>
 */
@RequiredArgsConstructor
public final class EndpointClassifier {
    private final GraphView view;
    private final IntSet targetCodes;

    public EndpointType classify(int nodeId) {
        List<Adjacency> entries = view.adjacency(nodeId);
        if (entries.isEmpty()) {
            return EndpointType.LEAF;
        }
        NetworkNode node = view.node(nodeId);
        if (node != null && !targetCodes.isEmpty() && targetCodes.contains(node.getDataCode())) {
            return EndpointType.TARGET;
        }
        for (Adjacency entry : entries) {
            if (view.isTraversable(entry.neighborId())) {
                return EndpointType.NON_TERMINAL;
            }
        }
        return EndpointType.BOUNDARY;
    }
}
