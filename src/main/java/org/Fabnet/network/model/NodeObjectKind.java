package org.Fabnet.network.model;

/**
 * Object-kind tag carried by every network node.
 */
public enum NodeObjectKind {
    LOGICAL,
    POC,
    VIRTUAL
}
