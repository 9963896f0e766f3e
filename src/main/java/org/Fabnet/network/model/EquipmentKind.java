package org.Fabnet.network.model;

/**
 * Functional kind of a piece of equipment.
 */
public enum EquipmentKind {
    PROCESSING,
    SUPPLY,
    TREATMENT,
    DISTRIBUTION,
    CONSUMER,
    OTHER
}
