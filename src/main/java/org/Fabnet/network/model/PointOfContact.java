package org.Fabnet.network.model;

import lombok.Builder;
import lombok.Value;

/**
 * Point of contact on a piece of equipment, bound to exactly one network node.
 */
@Value
@Builder
public class PointOfContact {
    int id;
    int nodeId;
    int equipmentId;

    /**
     * True when the PoC is in service.
     */
    boolean used;

    /**
     * Utility number, {@code null} when the row carries none.
     */
    Integer utilityNo;

    String markers;
    String reference;

    FlowDirection flowDirection;

    /**
     * True when the PoC feeds back into its own equipment.
     */
    boolean loopback;

    public boolean hasUtility() {
        return utilityNo != null;
    }

    public boolean hasMarkers() {
        return markers != null && !markers.isBlank();
    }

    public boolean hasReference() {
        return reference != null && !reference.isBlank();
    }
}
