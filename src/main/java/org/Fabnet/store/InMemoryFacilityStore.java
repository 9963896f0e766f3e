package org.Fabnet.store;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntCollection;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import org.Fabnet.coverage.CoverageScope;
import org.Fabnet.coverage.CoverageStore;
import org.Fabnet.coverage.PathRecord;
import org.Fabnet.network.graph.NetworkStore;
import org.Fabnet.network.graph.PathFilters;
import org.Fabnet.network.model.Equipment;
import org.Fabnet.network.model.NetworkLink;
import org.Fabnet.network.model.NetworkNode;
import org.Fabnet.network.model.PointOfContact;
import org.Fabnet.sampling.SamplingCatalog;
import org.Fabnet.sampling.ToolsetInfo;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Heap-backed facility store implementing every store contract of the engine.
 *
 * <p>Rows keep insertion order. Intended for embedding and tests; not thread-safe.</p>
 */
public final class InMemoryFacilityStore implements NetworkStore, CoverageStore, SamplingCatalog {
    private final Int2ObjectLinkedOpenHashMap<NetworkNode> nodes = new Int2ObjectLinkedOpenHashMap<>();
    private final Int2ObjectLinkedOpenHashMap<NetworkLink> links = new Int2ObjectLinkedOpenHashMap<>();
    private final Int2ObjectLinkedOpenHashMap<PointOfContact> pocs = new Int2ObjectLinkedOpenHashMap<>();
    private final Int2ObjectOpenHashMap<PointOfContact> pocsByNode = new Int2ObjectOpenHashMap<>();
    private final Int2ObjectLinkedOpenHashMap<Equipment> equipment = new Int2ObjectLinkedOpenHashMap<>();
    private final Int2ObjectLinkedOpenHashMap<ToolsetInfo> toolsets = new Int2ObjectLinkedOpenHashMap<>();
    private final Int2IntOpenHashMap nodeModels = new Int2IntOpenHashMap();
    private final Map<String, CoverageScope> runScopes = new HashMap<>();
    private final Map<String, List<PathRecord>> runPaths = new HashMap<>();

    public InMemoryFacilityStore addNode(NetworkNode node) {
        nodes.put(node.getId(), Objects.requireNonNull(node, "node"));
        return this;
    }

    /**
     * Places {@code nodeId} in a model for coverage scoping; unplaced nodes belong to model 0.
     */
    public InMemoryFacilityStore assignModel(int nodeId, int modelNo) {
        nodeModels.put(nodeId, modelNo);
        return this;
    }

    public InMemoryFacilityStore addLink(NetworkLink link) {
        links.put(link.getId(), Objects.requireNonNull(link, "link"));
        return this;
    }

    public InMemoryFacilityStore addPoc(PointOfContact poc) {
        pocs.put(poc.getId(), Objects.requireNonNull(poc, "poc"));
        pocsByNode.put(poc.getNodeId(), poc);
        return this;
    }

    public InMemoryFacilityStore addEquipment(Equipment item) {
        equipment.put(item.getId(), Objects.requireNonNull(item, "equipment"));
        return this;
    }

    /**
     * Registers a toolset; its equipment count is derived from registered equipment.
     */
    public InMemoryFacilityStore addToolset(int toolsetId, String fab, int phaseNo) {
        toolsets.put(toolsetId, new ToolsetInfo(toolsetId, Objects.requireNonNull(fab, "fab"), phaseNo, 0));
        return this;
    }

    public InMemoryFacilityStore registerRun(String runId, CoverageScope scope) {
        runScopes.put(Objects.requireNonNull(runId, "runId"), Objects.requireNonNull(scope, "scope"));
        runPaths.putIfAbsent(runId, new ArrayList<>());
        return this;
    }

    public InMemoryFacilityStore persistPath(String runId, PathRecord record) {
        runPaths.computeIfAbsent(Objects.requireNonNull(runId, "runId"), k -> new ArrayList<>())
                .add(Objects.requireNonNull(record, "record"));
        return this;
    }

    @Override
    public Optional<NetworkNode> findNode(int nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    @Override
    public List<NetworkNode> findNodes(PathFilters filters, IntSet excludedNodeIds) {
        List<NetworkNode> matches = new ArrayList<>();
        for (NetworkNode node : nodes.values()) {
            if (!excludedNodeIds.contains(node.getId()) && filters.matches(node)) {
                matches.add(node);
            }
        }
        return matches;
    }

    @Override
    public List<NetworkNode> findNodesByIds(IntCollection nodeIds) {
        List<NetworkNode> found = new ArrayList<>();
        IntOpenHashSet distinct = new IntOpenHashSet(nodeIds);
        for (NetworkNode node : nodes.values()) {
            if (distinct.contains(node.getId())) {
                found.add(node);
            }
        }
        return found;
    }

    @Override
    public List<NetworkLink> findLinksTouching(IntSet nodeIds) {
        List<NetworkLink> found = new ArrayList<>();
        for (NetworkLink link : links.values()) {
            if (nodeIds.contains(link.getStartNodeId()) || nodeIds.contains(link.getEndNodeId())) {
                found.add(link);
            }
        }
        return found;
    }

    @Override
    public Optional<NetworkLink> findLink(int linkId) {
        return Optional.ofNullable(links.get(linkId));
    }

    @Override
    public Optional<PointOfContact> findPocByNode(int nodeId) {
        return Optional.ofNullable(pocsByNode.get(nodeId));
    }

    @Override
    public Optional<PointOfContact> findPoc(int pocId) {
        return Optional.ofNullable(pocs.get(pocId));
    }

    @Override
    public Optional<Equipment> findEquipment(int equipmentId) {
        return Optional.ofNullable(equipment.get(equipmentId));
    }

    @Override
    public int countNodes(CoverageScope scope) {
        return nodeIdsInScope(scope).size();
    }

    @Override
    public int countLinks(CoverageScope scope) {
        return linkIdsInScope(scope).size();
    }

    @Override
    public IntSet nodeIdsInScope(CoverageScope scope) {
        IntOpenHashSet ids = new IntOpenHashSet();
        for (NetworkNode node : nodes.values()) {
            if (inScope(node, scope)) {
                ids.add(node.getId());
            }
        }
        return ids;
    }

    /**
     * A link is in scope when both of its endpoints are.
     */
    @Override
    public IntSet linkIdsInScope(CoverageScope scope) {
        IntSet scopedNodes = nodeIdsInScope(scope);
        IntOpenHashSet ids = new IntOpenHashSet();
        for (NetworkLink link : links.values()) {
            if (scopedNodes.contains(link.getStartNodeId()) && scopedNodes.contains(link.getEndNodeId())) {
                ids.add(link.getId());
            }
        }
        return ids;
    }

    @Override
    public Int2IntMap nodeCategories(CoverageScope scope) {
        Int2IntOpenHashMap categories = new Int2IntOpenHashMap();
        for (int nodeId : nodeIdsInScope(scope)) {
            categories.put(nodeId, categoryOf(nodeId));
        }
        return categories;
    }

    @Override
    public Int2IntMap linkCategories(CoverageScope scope) {
        Int2IntOpenHashMap categories = new Int2IntOpenHashMap();
        for (int linkId : linkIdsInScope(scope)) {
            categories.put(linkId, categoryOf(links.get(linkId).getStartNodeId()));
        }
        return categories;
    }

    @Override
    public Optional<CoverageScope> findRunScope(String runId) {
        return Optional.ofNullable(runScopes.get(runId));
    }

    @Override
    public List<PathRecord> pathRecords(String runId) {
        return List.copyOf(runPaths.getOrDefault(runId, List.of()));
    }

    @Override
    public List<String> fabs() {
        TreeSet<String> fabs = new TreeSet<>();
        for (ToolsetInfo toolset : toolsets.values()) {
            fabs.add(toolset.fab());
        }
        return List.copyOf(fabs);
    }

    @Override
    public List<ToolsetInfo> toolsets(String fab, int phaseNo) {
        Int2IntOpenHashMap equipmentCounts = new Int2IntOpenHashMap();
        for (Equipment item : equipment.values()) {
            equipmentCounts.addTo(item.getToolsetId(), 1);
        }
        List<ToolsetInfo> found = new ArrayList<>();
        for (ToolsetInfo toolset : toolsets.values()) {
            if (!toolset.fab().equals(fab)) {
                continue;
            }
            if (phaseNo != 0 && toolset.phaseNo() != phaseNo) {
                continue;
            }
            found.add(new ToolsetInfo(
                    toolset.toolsetId(), toolset.fab(), toolset.phaseNo(), equipmentCounts.get(toolset.toolsetId())
            ));
        }
        return found;
    }

    @Override
    public List<Equipment> equipmentInToolset(int toolsetId) {
        List<Equipment> found = new ArrayList<>();
        for (Equipment item : equipment.values()) {
            if (item.getToolsetId() == toolsetId) {
                found.add(item);
            }
        }
        return found;
    }

    @Override
    public List<PointOfContact> pocsOfEquipment(int equipmentId) {
        List<PointOfContact> found = new ArrayList<>();
        for (PointOfContact poc : pocs.values()) {
            if (poc.getEquipmentId() == equipmentId) {
                found.add(poc);
            }
        }
        return found;
    }

    private int categoryOf(int nodeId) {
        PointOfContact poc = pocsByNode.get(nodeId);
        if (poc == null) {
            return 0;
        }
        Equipment owner = equipment.get(poc.getEquipmentId());
        return owner == null ? 0 : owner.getCategoryNo();
    }

    private boolean inScope(NetworkNode node, CoverageScope scope) {
        ToolsetInfo toolset = toolsets.get(node.getToolsetId());
        if (toolset == null || !toolset.fab().equals(scope.getFab())) {
            return false;
        }
        if (scope.getPhaseNo() != 0 && toolset.phaseNo() != scope.getPhaseNo()) {
            return false;
        }
        if (scope.getToolsetId() != 0 && toolset.toolsetId() != scope.getToolsetId()) {
            return false;
        }
        return scope.getModelNo() == 0 || nodeModels.get(node.getId()) == scope.getModelNo();
    }
}
