package org.Fabnet.network.path;

/**
 * One-character node classification persisted alongside each path.
 */
public enum NodeFlag {
    START('S'),
    ENDPOINT('E'),
    LEAF('L'),
    BOUNDARY('F'),
    CONVERGENCE('C'),
    INTERMEDIATE('I');

    private final char code;

    NodeFlag(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    /**
     * Maps the terminal classification of a path's end node to its flag.
     */
    public static NodeFlag forEndpoint(EndpointType type) {
        if (type == null) {
            return ENDPOINT;
        }
        return switch (type) {
            case LEAF -> LEAF;
            case BOUNDARY -> BOUNDARY;
            case TARGET, NON_TERMINAL -> ENDPOINT;
        };
    }
}
