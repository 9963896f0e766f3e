package org.Fabnet.network.path;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Immutable discovered path ready for persistence.
 */
@Value
@Builder
public class PathResult {
    /**
     * Identifier unique within one traversal invocation, starting at 1.
     */
    int pathId;

    int startNodeId;
    int endNodeId;
    double totalCost;

    /**
     * Classification of {@link #endNodeId}.
     */
    EndpointType endpointType;

    @Singular
    List<PathStep> steps;

    /**
     * Returns the node sequence from start to end.
     */
    public IntList nodeIds() {
        IntArrayList ids = new IntArrayList(steps.size() + 1);
        ids.add(startNodeId);
        for (PathStep step : steps) {
            ids.add(step.toNodeId());
        }
        return IntLists.unmodifiable(ids);
    }

    /**
     * Returns the link sequence in travel order.
     */
    public IntList linkIds() {
        IntArrayList ids = new IntArrayList(steps.size());
        for (PathStep step : steps) {
            ids.add(step.linkId());
        }
        return IntLists.unmodifiable(ids);
    }

    public int nodeCount() {
        return steps.size() + 1;
    }
}
