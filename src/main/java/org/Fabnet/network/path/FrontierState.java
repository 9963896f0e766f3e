package org.Fabnet.network.path;

/**
 * Priority-queue entry for the shortest-path search.
 *
 * <p>Ties on cost are broken by insertion order so output is deterministic.</p>
 */
record FrontierState(double cost, long insertionOrder, int nodeId) implements Comparable<FrontierState> {
    @Override
    public int compareTo(FrontierState other) {
        int byCost = Double.compare(cost, other.cost);
        if (byCost != 0) {
            return byCost;
        }
        return Long.compare(insertionOrder, other.insertionOrder);
    }
}
