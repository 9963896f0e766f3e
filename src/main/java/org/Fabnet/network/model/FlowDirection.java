package org.Fabnet.network.model;

/**
 * Flow tag of a point of contact.
 */
public enum FlowDirection {
    IN,
    OUT,
    BIDIRECTIONAL
}
