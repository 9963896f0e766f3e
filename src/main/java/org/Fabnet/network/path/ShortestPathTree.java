package org.Fabnet.network.path;

import it.unimi.dsi.fastutil.ints.Int2DoubleOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import org.Fabnet.network.graph.Adjacency;
import org.Fabnet.network.graph.GraphView;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Single-source shortest-path tree over the traversable part of a graph view.
 *
 * <p>Only traversable nodes are ever settled. The settle order is kept so callers can emit
 * results in a deterministic order.</p>
 */
final class ShortestPathTree {
    private static final int NO_STOP = Integer.MIN_VALUE;

    private final GraphView view;
    private final Int2DoubleOpenHashMap distance = new Int2DoubleOpenHashMap();
    private final Int2IntOpenHashMap predecessor = new Int2IntOpenHashMap();
    private final Int2ObjectOpenHashMap<Adjacency> predecessorVia = new Int2ObjectOpenHashMap<>();
    private final IntOpenHashSet settled = new IntOpenHashSet();
    private final IntArrayList settleOrder = new IntArrayList();

    private ShortestPathTree(GraphView view) {
        this.view = view;
        this.distance.defaultReturnValue(Double.POSITIVE_INFINITY);
    }

    /**
     * Settles every traversable node reachable from the view's start node.
     */
    static ShortestPathTree grow(GraphView view, TraversalBudget budget) {
        return grow(view, budget, NO_STOP);
    }

    /**
     * Settles nodes in cost order until {@code stopNodeId} is settled or the queue empties.
     */
    static ShortestPathTree grow(GraphView view, TraversalBudget budget, int stopNodeId) {
        ShortestPathTree tree = new ShortestPathTree(view);
        tree.run(budget, stopNodeId);
        return tree;
    }

    private void run(TraversalBudget budget, int stopNodeId) {
        int start = view.startNodeId();
        PriorityQueue<FrontierState> frontier = new PriorityQueue<>();
        long insertion = 0L;
        distance.put(start, 0.0d);
        frontier.add(new FrontierState(0.0d, insertion++, start));

        while (!frontier.isEmpty()) {
            FrontierState state = frontier.poll();
            int nodeId = state.nodeId();
            if (settled.contains(nodeId) || state.cost() > distance.get(nodeId)) {
                continue;
            }
            settled.add(nodeId);
            settleOrder.add(nodeId);
            budget.checkExpansions(settled.size());
            if (nodeId == stopNodeId) {
                return;
            }

            for (Adjacency entry : view.adjacency(nodeId)) {
                int next = entry.neighborId();
                if (!view.isTraversable(next) || settled.contains(next)) {
                    continue;
                }
                double candidate = state.cost() + entry.cost();
                if (candidate < distance.get(next)) {
                    distance.put(next, candidate);
                    predecessor.put(next, nodeId);
                    predecessorVia.put(next, entry);
                    frontier.add(new FrontierState(candidate, insertion++, next));
                }
            }
        }
    }

    /**
     * Returns settled node ids in settle order, start node first.
     */
    IntArrayList settleOrder() {
        return settleOrder;
    }

    double distance(int nodeId) {
        return distance.get(nodeId);
    }

    /**
     * Walks predecessors back to the start.
     *
     * @return hops in travel order, or {@code null} when the chain does not lead back to the start.
     */
    List<PathStep> stepsTo(int nodeId) {
        int start = view.startNodeId();
        if (!settled.contains(nodeId)) {
            return null;
        }
        List<Adjacency> reversedHops = new ArrayList<>();
        IntArrayList reversedFrom = new IntArrayList();
        int current = nodeId;
        int guard = settled.size();
        while (current != start) {
            if (guard-- <= 0 || !predecessor.containsKey(current)) {
                return null;
            }
            int previous = predecessor.get(current);
            reversedHops.add(predecessorVia.get(current));
            reversedFrom.add(previous);
            current = previous;
        }
        Collections.reverse(reversedHops);
        List<PathStep> steps = new ArrayList<>(reversedHops.size());
        for (int i = 0; i < reversedHops.size(); i++) {
            Adjacency hop = reversedHops.get(i);
            int from = reversedFrom.getInt(reversedFrom.size() - 1 - i);
            steps.add(new PathStep(i + 1, hop.linkId(), from, hop.neighborId(), hop.cost(), hop.reversed()));
        }
        return steps;
    }
}
