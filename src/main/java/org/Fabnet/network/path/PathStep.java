package org.Fabnet.network.path;

/**
 * One hop of a discovered path, in travel order.
 *
 * @param sequence 1-based position within the path.
 * @param linkId link walked.
 * @param fromNodeId node the hop leaves.
 * @param toNodeId node the hop reaches.
 * @param cost link cost.
 * @param reversed true when the link was walked end-to-start.
 */
public record PathStep(int sequence, int linkId, int fromNodeId, int toNodeId, double cost, boolean reversed) {
}
