package org.Fabnet.network.graph;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMaps;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;
import org.Fabnet.network.model.NetworkLink;
import org.Fabnet.network.model.NetworkNode;

import java.util.List;

/**
 * Immutable per-session arena of nodes, links and adjacency keyed by integer id.
 *
 * <p>Invariants established by {@link GraphViewLoader}:</p>
 * <ul>
 *   <li>no ignored node appears as an adjacency key or neighbor,</li>
 *   <li>no link touching an ignored node is present,</li>
 *   <li>the start node is always traversable.</li>
 * </ul>
 */
public final class GraphView {
    private final int startNodeId;
    private final Int2ObjectMap<NetworkNode> nodes;
    private final IntSet traversable;
    private final IntSet ignored;
    private final Int2ObjectMap<NetworkLink> links;
    private final Int2ObjectMap<List<Adjacency>> adjacency;

    GraphView(
            int startNodeId,
            Int2ObjectOpenHashMap<NetworkNode> nodes,
            IntOpenHashSet traversable,
            IntOpenHashSet ignored,
            Int2ObjectOpenHashMap<NetworkLink> links,
            Int2ObjectOpenHashMap<List<Adjacency>> adjacency
    ) {
        this.startNodeId = startNodeId;
        this.nodes = Int2ObjectMaps.unmodifiable(nodes);
        this.traversable = IntSets.unmodifiable(traversable);
        this.ignored = IntSets.unmodifiable(ignored);
        this.links = Int2ObjectMaps.unmodifiable(links);
        this.adjacency = Int2ObjectMaps.unmodifiable(adjacency);
    }

    public int startNodeId() {
        return startNodeId;
    }

    /**
     * Returns the loaded node, or {@code null} when it was never loaded.
     */
    public NetworkNode node(int nodeId) {
        return nodes.get(nodeId);
    }

    public boolean containsNode(int nodeId) {
        return nodes.containsKey(nodeId);
    }

    public boolean isTraversable(int nodeId) {
        return traversable.contains(nodeId);
    }

    public boolean isIgnored(int nodeId) {
        return ignored.contains(nodeId);
    }

    /**
     * Returns outgoing entries of {@code nodeId} in deterministic link-id order, never null.
     */
    public List<Adjacency> adjacency(int nodeId) {
        List<Adjacency> entries = adjacency.get(nodeId);
        return entries == null ? List.of() : entries;
    }

    public NetworkLink link(int linkId) {
        return links.get(linkId);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int linkCount() {
        return links.size();
    }

    public int traversableCount() {
        return traversable.size();
    }

    public IntSet nodeIds() {
        return IntSets.unmodifiable(nodes.keySet());
    }

    public IntSet traversableNodeIds() {
        return traversable;
    }

    public IntSet ignoredNodeIds() {
        return ignored;
    }

    public IntSet linkIds() {
        return IntSets.unmodifiable(links.keySet());
    }

    /**
     * Returns node ids owning at least one adjacency entry.
     */
    public IntSet adjacencyKeys() {
        return IntSets.unmodifiable(adjacency.keySet());
    }
}
