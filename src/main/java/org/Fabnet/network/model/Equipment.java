package org.Fabnet.network.model;

import lombok.Builder;
import lombok.Value;

/**
 * Equipment row owning one or more points of contact.
 */
@Value
@Builder
public class Equipment {
    int id;

    @Builder.Default
    String guid = "";

    @Builder.Default
    String name = "";

    int nodeId;
    int dataCode;
    int categoryNo;
    int toolsetId;

    @Builder.Default
    EquipmentKind kind = EquipmentKind.OTHER;
}
