package org.Fabnet.network.path;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSets;
import org.Fabnet.network.graph.GraphView;
import org.Fabnet.network.graph.GraphViewLoader;
import org.Fabnet.network.graph.PathFilters;
import org.Fabnet.testutil.NetworkFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.Fabnet.testutil.NetworkFixtureFactory.N_BOUNDARY;
import static org.Fabnet.testutil.NetworkFixtureFactory.N_HUB;
import static org.Fabnet.testutil.NetworkFixtureFactory.N_LEAF_DIRECT;
import static org.Fabnet.testutil.NetworkFixtureFactory.N_TARGET_107;
import static org.Fabnet.testutil.NetworkFixtureFactory.N_TARGET_15000;
import static org.Fabnet.testutil.NetworkFixtureFactory.SCENARIO_START;
import static org.Fabnet.testutil.NetworkFixtureFactory.SCENARIO_UTILITY;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("EndpointClassifier Tests")
class EndpointClassifierTest {

    private static GraphView scenarioView(int... ignored) {
        return new GraphViewLoader(NetworkFixtureFactory.scenarioFacility()).load(
                SCENARIO_START,
                new IntOpenHashSet(ignored),
                PathFilters.builder().utilityCode(SCENARIO_UTILITY).build()
        );
    }

    @Test
    @DisplayName("LEAF wins over TARGET once ignore removal leaves no adjacency")
    void testLeafWinsOverTarget() {
        EndpointClassifier classifier = new EndpointClassifier(scenarioView(123, 304, 305), TargetCodes.of(107));
        assertEquals(EndpointType.LEAF, classifier.classify(N_TARGET_107));
    }

    @Test
    @DisplayName("Target codes only apply to nodes that still have connections")
    void testTargetRule() {
        GraphView view = scenarioView();
        assertEquals(EndpointType.TARGET, new EndpointClassifier(view, TargetCodes.of(107)).classify(N_TARGET_107));
        assertEquals(EndpointType.NON_TERMINAL, new EndpointClassifier(view, TargetCodes.none()).classify(N_TARGET_107));
        assertEquals(EndpointType.TARGET, new EndpointClassifier(view, TargetCodes.of(15000)).classify(N_TARGET_15000));
    }

    @Test
    @DisplayName("Nodes whose connections all lead to non-traversable nodes are boundaries")
    void testBoundaryRule() {
        EndpointClassifier classifier = new EndpointClassifier(scenarioView(), IntSets.emptySet());
        assertEquals(EndpointType.BOUNDARY, classifier.classify(N_BOUNDARY));
        assertEquals(EndpointType.NON_TERMINAL, classifier.classify(N_HUB));
        assertEquals(EndpointType.LEAF, classifier.classify(N_LEAF_DIRECT));
    }

    @Test
    @DisplayName("Classification is idempotent")
    void testIdempotent() {
        EndpointClassifier classifier = new EndpointClassifier(scenarioView(123), TargetCodes.of(15000, 107));
        for (int nodeId : new int[]{N_HUB, N_BOUNDARY, N_TARGET_15000, N_TARGET_107, N_LEAF_DIRECT}) {
            assertEquals(classifier.classify(nodeId), classifier.classify(nodeId));
        }
        assertTrue(EndpointType.BOUNDARY.isTerminal());
        assertFalse(EndpointType.NON_TERMINAL.isTerminal());
    }
}
