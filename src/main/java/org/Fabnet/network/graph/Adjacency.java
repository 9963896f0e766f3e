package org.Fabnet.network.graph;

/**
 * One outgoing adjacency entry.
 *
 * @param neighborId node reached by walking the link.
 * @param linkId link walked.
 * @param cost traversal cost of the link.
 * @param reversed true when the link is walked from its end node to its start node.
 */
public record Adjacency(int neighborId, int linkId, double cost, boolean reversed) {
}
