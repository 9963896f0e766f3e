package org.Fabnet.network.path;

/**
 * Reason a traversal may stop at a node.
 */
public enum EndpointType {
    LEAF,
    TARGET,
    BOUNDARY,
    NON_TERMINAL;

    public boolean isTerminal() {
        return this != NON_TERMINAL;
    }
}
