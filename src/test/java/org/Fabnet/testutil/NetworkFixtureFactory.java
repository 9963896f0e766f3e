package org.Fabnet.testutil;

import org.Fabnet.network.model.Equipment;
import org.Fabnet.network.model.EquipmentKind;
import org.Fabnet.network.model.FlowDirection;
import org.Fabnet.network.model.NetworkLink;
import org.Fabnet.network.model.NetworkNode;
import org.Fabnet.network.model.NodeObjectKind;
import org.Fabnet.network.model.PointOfContact;
import org.Fabnet.store.InMemoryFacilityStore;

/**
 * Shared facility fixtures for engine tests.
 */
public final class NetworkFixtureFactory {
    public static final int SCENARIO_START = 1709;
    public static final int SCENARIO_UTILITY = 13;
    public static final int FOREIGN_UTILITY = 99;

    public static final int N_HUB = 1710;
    public static final int N_TARGET_15000 = 1720;
    public static final int N_TARGET_107 = 1730;
    public static final int N_LEAF_DIRECT = 1740;
    public static final int N_BOUNDARY = 1745;
    public static final int N_FOREIGN = 1750;
    public static final int N_LEAF_PAST_TARGET = 1760;

    public static final int L_START_HUB = 1;
    public static final int L_START_IGNORED = 2;
    public static final int L_IGNORED_TARGET = 3;
    public static final int L_HUB_TARGET_15000 = 4;
    public static final int L_TARGET_LEAF = 5;
    public static final int L_HUB_TARGET_107 = 6;
    public static final int L_START_LEAF = 7;
    public static final int L_HUB_BOUNDARY = 8;
    public static final int L_BOUNDARY_FOREIGN = 9;
    public static final int L_TARGET_107_IGNORED = 10;
    public static final int L_IGNORED_IGNORED = 11;
    public static final int L_START_TARGET_107 = 12;

    private NetworkFixtureFactory() {
    }

    public static NetworkNode node(int id, int dataCode, int utilityCode, int toolsetId) {
        return NetworkNode.builder()
                .id(id)
                .dataCode(dataCode)
                .utilityCode(utilityCode)
                .toolsetId(toolsetId)
                .pocLabel("EQ-" + id + "-POC")
                .objectKind(NodeObjectKind.POC)
                .build();
    }

    public static NetworkLink link(int id, int from, int to, double cost, boolean bidirectional) {
        return NetworkLink.builder()
                .id(id)
                .guid("LNK-" + id)
                .startNodeId(from)
                .endNodeId(to)
                .cost(cost)
                .bidirectional(bidirectional)
                .build();
    }

    public static PointOfContact poc(int id, int nodeId, int equipmentId, Integer utilityNo, FlowDirection direction) {
        return PointOfContact.builder()
                .id(id)
                .nodeId(nodeId)
                .equipmentId(equipmentId)
                .used(true)
                .utilityNo(utilityNo)
                .markers("M" + id)
                .reference("REF-" + id)
                .flowDirection(direction)
                .build();
    }

    public static Equipment equipment(int id, int toolsetId, int categoryNo, EquipmentKind kind) {
        return Equipment.builder()
                .id(id)
                .guid("EQ-" + id)
                .name("Equipment " + id)
                .toolsetId(toolsetId)
                .categoryNo(categoryNo)
                .kind(kind)
                .build();
    }

    /**
     * Utility-13 network rooted at 1709 with ignore candidates 123, 304 and 305.
     *
     * <pre>
     * 1709 -> 1710 (1)    1709 -> 123 (1)    123 -> 1720 (1)
     * 1710 -> 1720 (2)    1720 -> 1760 (1)   1710 -> 1730 (5)
     * 1709 -> 1740 (3)    1710 -> 1745 (1)   1745 -> 1750 (1, utility 99)
     * 1730 -> 304 (1)     304 -> 305 (1)     1709 -> 1730 (10)
     * </pre>
     * 1720 carries data code 15000 and 1730 data code 107.
     */
    public static InMemoryFacilityStore scenarioFacility() {
        InMemoryFacilityStore store = new InMemoryFacilityStore()
                .addNode(node(SCENARIO_START, 1, SCENARIO_UTILITY, 1))
                .addNode(node(N_HUB, 1, SCENARIO_UTILITY, 1))
                .addNode(node(123, 1, SCENARIO_UTILITY, 1))
                .addNode(node(N_TARGET_15000, 15000, SCENARIO_UTILITY, 1))
                .addNode(node(N_TARGET_107, 107, SCENARIO_UTILITY, 1))
                .addNode(node(304, 1, SCENARIO_UTILITY, 1))
                .addNode(node(305, 1, SCENARIO_UTILITY, 1))
                .addNode(node(N_LEAF_DIRECT, 1, SCENARIO_UTILITY, 1))
                .addNode(node(N_BOUNDARY, 1, SCENARIO_UTILITY, 1))
                .addNode(node(N_FOREIGN, 1, FOREIGN_UTILITY, 1))
                .addNode(node(N_LEAF_PAST_TARGET, 1, SCENARIO_UTILITY, 1));
        store.addLink(link(L_START_HUB, SCENARIO_START, N_HUB, 1.0, false))
                .addLink(link(L_START_IGNORED, SCENARIO_START, 123, 1.0, false))
                .addLink(link(L_IGNORED_TARGET, 123, N_TARGET_15000, 1.0, false))
                .addLink(link(L_HUB_TARGET_15000, N_HUB, N_TARGET_15000, 2.0, false))
                .addLink(link(L_TARGET_LEAF, N_TARGET_15000, N_LEAF_PAST_TARGET, 1.0, false))
                .addLink(link(L_HUB_TARGET_107, N_HUB, N_TARGET_107, 5.0, false))
                .addLink(link(L_START_LEAF, SCENARIO_START, N_LEAF_DIRECT, 3.0, false))
                .addLink(link(L_HUB_BOUNDARY, N_HUB, N_BOUNDARY, 1.0, false))
                .addLink(link(L_BOUNDARY_FOREIGN, N_BOUNDARY, N_FOREIGN, 1.0, false))
                .addLink(link(L_TARGET_107_IGNORED, N_TARGET_107, 304, 1.0, false))
                .addLink(link(L_IGNORED_IGNORED, 304, 305, 1.0, false))
                .addLink(link(L_START_TARGET_107, SCENARIO_START, N_TARGET_107, 10.0, false));
        store.addToolset(1, "FAB1", 1);
        return store;
    }

    /**
     * Validated three-hop chain 1 -> 2 -> 3 -> 4 with PoCs on every node.
     *
     * <p>Node 2 sits on PROCESSING equipment 20 that converts utility 1 into 2 for node 3.</p>
     */
    public static InMemoryFacilityStore validationChain() {
        InMemoryFacilityStore store = new InMemoryFacilityStore()
                .addNode(node(1, 1, 1, 7))
                .addNode(node(2, 1, 1, 7))
                .addNode(node(3, 1, 2, 7))
                .addNode(node(4, 1, 2, 7))
                .addLink(link(11, 1, 2, 1.0, false))
                .addLink(link(12, 2, 3, 1.0, false))
                .addLink(link(13, 3, 4, 1.0, true))
                .addEquipment(equipment(10, 7, 1, EquipmentKind.SUPPLY))
                .addEquipment(equipment(20, 7, 2, EquipmentKind.PROCESSING))
                .addEquipment(equipment(30, 7, 3, EquipmentKind.CONSUMER))
                .addPoc(poc(101, 1, 10, 1, FlowDirection.OUT))
                .addPoc(poc(102, 2, 20, 1, FlowDirection.BIDIRECTIONAL))
                .addPoc(poc(103, 3, 20, 2, FlowDirection.BIDIRECTIONAL))
                .addPoc(poc(104, 4, 30, 2, FlowDirection.IN));
        store.addToolset(7, "FAB1", 1);
        return store;
    }

    /**
     * Sampling catalog: toolset 10 (four equipment) and toolset 20 (two equipment) in FAB1,
     * toolset 30 (two equipment) in FAB2. PoC node ids are 100 apart.
     */
    public static InMemoryFacilityStore samplingCatalog() {
        InMemoryFacilityStore store = new InMemoryFacilityStore()
                .addToolset(10, "FAB1", 1)
                .addToolset(20, "FAB1", 2)
                .addToolset(30, "FAB2", 1);
        addSamplingEquipment(store, 1, 10, 1, 1000);
        addSamplingEquipment(store, 2, 10, 2, 1100);
        addSamplingEquipment(store, 3, 10, 1, 1200);
        addSamplingEquipment(store, 4, 10, 2, 1300);
        addSamplingEquipment(store, 5, 20, 3, 2000);
        addSamplingEquipment(store, 6, 20, 3, 2100);
        addSamplingEquipment(store, 7, 30, 4, 3000);
        addSamplingEquipment(store, 8, 30, 4, 3100);
        return store;
    }

    private static void addSamplingEquipment(InMemoryFacilityStore store, int id, int toolsetId, int category, int nodeId) {
        store.addEquipment(equipment(id, toolsetId, category, EquipmentKind.CONSUMER))
                .addNode(node(nodeId, 1, 1, toolsetId))
                .addPoc(poc(id * 10, nodeId, id, 1, FlowDirection.IN));
    }
}
