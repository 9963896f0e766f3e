package org.Fabnet.network.model;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable node row loaded for one traversal session.
 */
@Value
@Builder
public class NetworkNode {
    int id;

    /**
     * Data/type code, matched against target codes during endpoint classification.
     */
    int dataCode;

    /**
     * Utility code; {@code 0} when unknown.
     */
    int utilityCode;

    /**
     * Owning toolset id; {@code 0} when unassigned.
     */
    int toolsetId;

    /**
     * Equipment-PoC label, may be empty.
     */
    @Builder.Default
    String pocLabel = "";

    @Builder.Default
    NodeObjectKind objectKind = NodeObjectKind.POC;
}
