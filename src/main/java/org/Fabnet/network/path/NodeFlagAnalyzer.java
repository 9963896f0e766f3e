package org.Fabnet.network.path;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import lombok.experimental.UtilityClass;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the (path id, node id) to flag map over a batch of paths.
 *
 * <p>Precedence per path: start node, then the path's own terminal flag, then convergence
 * (node present in more than one path of the batch), otherwise intermediate.</p>
 */
@UtilityClass
public class NodeFlagAnalyzer {

    public Map<NodeFlagKey, NodeFlag> analyze(List<PathResult> paths) {
        Objects.requireNonNull(paths, "paths");
        Int2IntOpenHashMap pathsPerNode = new Int2IntOpenHashMap();
        for (PathResult path : paths) {
            IntOpenHashSet distinct = new IntOpenHashSet(path.nodeIds());
            for (int nodeId : distinct) {
                pathsPerNode.addTo(nodeId, 1);
            }
        }

        Map<NodeFlagKey, NodeFlag> flags = new LinkedHashMap<>();
        for (PathResult path : paths) {
            IntList nodeIds = path.nodeIds();
            for (int i = 0; i < nodeIds.size(); i++) {
                int nodeId = nodeIds.getInt(i);
                NodeFlag flag;
                if (nodeId == path.getStartNodeId()) {
                    flag = NodeFlag.START;
                } else if (nodeId == path.getEndNodeId()) {
                    flag = NodeFlag.forEndpoint(path.getEndpointType());
                } else if (pathsPerNode.get(nodeId) > 1) {
                    flag = NodeFlag.CONVERGENCE;
                } else {
                    flag = NodeFlag.INTERMEDIATE;
                }
                flags.putIfAbsent(new NodeFlagKey(path.getPathId(), nodeId), flag);
            }
        }
        return flags;
    }
}
