package org.Fabnet.network.graph;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.Fabnet.network.NetworkAnalysisException;
import org.Fabnet.network.StoreCalls;
import org.Fabnet.network.model.NetworkLink;
import org.Fabnet.network.model.NetworkNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Builds a {@link GraphView} for one traversal session from a {@link NetworkStore}.
 */
@Slf4j
@RequiredArgsConstructor
public final class GraphViewLoader {
    /**
     * Cost applied when the store has no cost for a link.
     */
    public static final double DEFAULT_LINK_COST = 1.0d;

    private final NetworkStore store;

    /**
     * Loads a filtered view rooted at {@code startNodeId}.
     *
     * @param startNodeId mandatory start node, traversable regardless of filters.
     * @param ignoreNodeIds nodes removed from the graph together with every link touching them.
     * @param filters node-inclusion filters.
     * @return immutable graph view.
     * @throws NetworkAnalysisException {@code INVALID_CONFIGURATION} when the start node is ignored,
     *                                  unknown, or a link has negative cost;
     *                                  {@code BACKING_STORE_UNAVAILABLE} when the store fails.
     */
    public GraphView load(int startNodeId, IntSet ignoreNodeIds, PathFilters filters) {
        Objects.requireNonNull(ignoreNodeIds, "ignoreNodeIds");
        Objects.requireNonNull(filters, "filters").validate();
        IntOpenHashSet ignored = new IntOpenHashSet(ignoreNodeIds);
        if (ignored.contains(startNodeId)) {
            throw NetworkAnalysisException.invalidConfiguration(
                    "start node " + startNodeId + " is in the ignore set"
            );
        }

        NetworkNode start = StoreCalls.query("findNode", () -> store.findNode(startNodeId))
                .orElseThrow(() -> NetworkAnalysisException.invalidConfiguration(
                        "start node " + startNodeId + " does not exist"
                ));

        Int2ObjectOpenHashMap<NetworkNode> nodes = new Int2ObjectOpenHashMap<>();
        IntOpenHashSet traversable = new IntOpenHashSet();
        nodes.put(startNodeId, start);
        traversable.add(startNodeId);
        for (NetworkNode candidate : StoreCalls.query("findNodes", () -> store.findNodes(filters, ignored))) {
            int id = candidate.getId();
            if (ignored.contains(id) || !filters.matches(candidate)) {
                continue;
            }
            nodes.put(id, candidate);
            traversable.add(id);
        }

        List<NetworkLink> candidateLinks = new ArrayList<>(
                StoreCalls.query("findLinksTouching", () -> store.findLinksTouching(traversable))
        );
        candidateLinks.sort(Comparator.comparingInt(NetworkLink::getId));

        Int2ObjectOpenHashMap<NetworkLink> links = new Int2ObjectOpenHashMap<>();
        Int2ObjectOpenHashMap<List<Adjacency>> adjacency = new Int2ObjectOpenHashMap<>();
        IntArrayList referenced = new IntArrayList();
        for (NetworkLink link : candidateLinks) {
            int from = link.getStartNodeId();
            int to = link.getEndNodeId();
            if (ignored.contains(from) || ignored.contains(to)) {
                continue;
            }
            if (!traversable.contains(from) && !traversable.contains(to)) {
                continue;
            }
            if (links.containsKey(link.getId())) {
                continue;
            }
            double cost = effectiveCost(link);
            links.put(link.getId(), link);
            adjacency.computeIfAbsent(from, k -> new ArrayList<>())
                    .add(new Adjacency(to, link.getId(), cost, false));
            if (link.isBidirectional()) {
                adjacency.computeIfAbsent(to, k -> new ArrayList<>())
                        .add(new Adjacency(from, link.getId(), cost, true));
            }
            if (!nodes.containsKey(from)) {
                referenced.add(from);
            }
            if (!nodes.containsKey(to)) {
                referenced.add(to);
            }
        }

        if (!referenced.isEmpty()) {
            for (NetworkNode node : StoreCalls.query("findNodesByIds", () -> store.findNodesByIds(referenced))) {
                if (!ignored.contains(node.getId())) {
                    nodes.putIfAbsent(node.getId(), node);
                }
            }
        }

        log.info(
                "graph view loaded: start={}, nodes={}, traversable={}, links={}, ignored={}",
                startNodeId, nodes.size(), traversable.size(), links.size(), ignored.size()
        );
        return new GraphView(startNodeId, nodes, traversable, ignored, links, adjacency);
    }

    private static double effectiveCost(NetworkLink link) {
        double cost = link.getCost();
        if (Double.isNaN(cost)) {
            return DEFAULT_LINK_COST;
        }
        if (cost < 0.0d || Double.isInfinite(cost)) {
            throw NetworkAnalysisException.invalidConfiguration(
                    "link " + link.getId() + " has invalid cost " + cost
            );
        }
        return cost;
    }
}
