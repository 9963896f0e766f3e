package org.Fabnet.sampling;

import lombok.Builder;
import lombok.Value;
import org.Fabnet.network.model.Equipment;
import org.Fabnet.network.model.PointOfContact;

/**
 * Accepted equipment/PoC pair, handed to path discovery as (from node, to node).
 */
@Value
@Builder
public class SampledPair {
    String fab;
    int toolsetId;
    Equipment fromEquipment;
    Equipment toEquipment;
    PointOfContact fromPoc;
    PointOfContact toPoc;

    /**
     * Heuristic cost estimate used to rank pairs before a real path search.
     */
    double estimatedCost;

    public int fromNodeId() {
        return fromPoc.getNodeId();
    }

    public int toNodeId() {
        return toPoc.getNodeId();
    }
}
