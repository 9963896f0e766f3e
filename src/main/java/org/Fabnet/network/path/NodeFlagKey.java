package org.Fabnet.network.path;

/**
 * Key of the node flag map.
 */
public record NodeFlagKey(int pathId, int nodeId) {
}
