package org.Fabnet.validation;

import org.Fabnet.network.graph.NetworkStore;
import org.Fabnet.network.model.FlowDirection;
import org.Fabnet.network.model.PointOfContact;
import org.Fabnet.store.InMemoryFacilityStore;
import org.Fabnet.testutil.NetworkFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ValidationEngine Tests")
class ValidationEngineTest {
    private static final PathContext CHAIN = PathContext.of(1L, new int[]{1, 2, 3, 4}, new int[]{11, 12, 13});

    private static ValidationEngine engine(InMemoryFacilityStore store) {
        return new ValidationEngine(store);
    }

    @Test
    @DisplayName("Well-formed chain with a permitted conversion yields no findings")
    void testValidChain() {
        ValidationReport report = engine(NetworkFixtureFactory.validationChain()).validate(CHAIN);

        assertTrue(report.isValid());
        assertTrue(report.getErrors().isEmpty());
        assertTrue(report.getFlags().isEmpty());
        assertEquals(1L, report.getPathId());
    }

    @Nested
    @DisplayName("Connectivity")
    class ConnectivityTests {

        @Test
        @DisplayName("Missing node is CRITICAL and blocks the path")
        void testMissingNode() {
            PathContext path = PathContext.of(2L, new int[]{1, 2, 99}, new int[]{11, 12});

            ValidationReport report = engine(NetworkFixtureFactory.validationChain()).validate(path);

            assertFalse(report.isValid());
            List<ValidationError> connectivity = report.errorsOf(PocConnectivityTest.CODE);
            assertEquals(1, connectivity.size());
            assertEquals(ErrorKind.MISSING_NODE, connectivity.get(0).getKind());
            assertEquals(Severity.CRITICAL, connectivity.get(0).getSeverity());
            assertEquals(99L, connectivity.get(0).getObjectId());
        }

        @Test
        @DisplayName("Missing link is CRITICAL")
        void testMissingLink() {
            PathContext path = PathContext.of(3L, new int[]{1, 2}, new int[]{77});

            ValidationReport report = engine(NetworkFixtureFactory.validationChain()).validate(path);

            List<ValidationError> connectivity = report.errorsOf(PocConnectivityTest.CODE);
            assertEquals(1, connectivity.size());
            assertEquals(ErrorKind.MISSING_LINK, connectivity.get(0).getKind());
            assertTrue(report.errorsOf(PathContinuityTest.CODE).isEmpty());
        }

        @Test
        @DisplayName("Walking a unidirectional link backwards is a CRITICAL wrong direction")
        void testWrongDirection() {
            PathContext path = PathContext.of(4L, new int[]{4, 3, 2}, new int[]{13, 12});

            ValidationReport report = engine(NetworkFixtureFactory.validationChain()).validate(path);

            assertEquals(1, report.getErrors().size());
            ValidationError error = report.getErrors().get(0);
            assertEquals(PathContinuityTest.CODE, error.getTestCode());
            assertEquals(ErrorKind.WRONG_DIRECTION, error.getKind());
            assertEquals(12L, error.getObjectId());
            assertEquals("LNK-12", error.getObjectGuid());
        }

        @Test
        @DisplayName("Link that does not join its node pair is a connectivity break")
        void testLinkNotJoiningPair() {
            PathContext path = PathContext.of(5L, new int[]{1, 2, 3}, new int[]{11, 13});

            ValidationReport report = engine(NetworkFixtureFactory.validationChain()).validate(path);

            List<ValidationError> continuity = report.errorsOf(PathContinuityTest.CODE);
            assertEquals(1, continuity.size());
            assertEquals(ErrorKind.CONNECTIVITY_BREAK, continuity.get(0).getKind());
            assertEquals(13L, continuity.get(0).getObjectId());
        }

        @Test
        @DisplayName("Single-node path is only reported as too short")
        void testSingleNodePath() {
            PathContext path = PathContext.of(6L, new int[]{1}, new int[]{});

            ValidationReport report = engine(NetworkFixtureFactory.validationChain()).validate(path);

            assertEquals(1, report.getErrors().size());
            ValidationError error = report.getErrors().get(0);
            assertEquals(PathStructureTest.CODE, error.getTestCode());
            assertEquals(ErrorKind.PATH_TOO_SHORT, error.getKind());
            assertEquals(Severity.ERROR, error.getSeverity());
            assertFalse(report.isValid());
        }
    }

    @Nested
    @DisplayName("Material and flow")
    class MaterialTests {

        @Test
        @DisplayName("Utility change across non-converting equipment is a HIGH mismatch")
        void testUtilityMismatch() {
            InMemoryFacilityStore store = NetworkFixtureFactory.validationChain()
                    .addNode(NetworkFixtureFactory.node(5, 1, 3, 7))
                    .addLink(NetworkFixtureFactory.link(14, 4, 5, 1.0, false))
                    .addPoc(NetworkFixtureFactory.poc(105, 5, 30, 3, FlowDirection.BIDIRECTIONAL));
            PathContext path = PathContext.of(7L, new int[]{3, 4, 5}, new int[]{13, 14});

            ValidationReport report = engine(store).validate(path);

            List<ValidationError> utility = report.errorsOf(UtilityConsistencyTest.CODE);
            assertEquals(1, utility.size());
            assertEquals(ErrorKind.UTILITY_MISMATCH, utility.get(0).getKind());
            assertEquals(Severity.HIGH, utility.get(0).getSeverity());
            assertEquals(5L, utility.get(0).getObjectId());
            assertTrue(report.isValid(), "HIGH findings do not block a path");
        }

        @Test
        @DisplayName("Used PoC without attributes is reported per missing attribute")
        void testMissingAttributes() {
            InMemoryFacilityStore store = NetworkFixtureFactory.validationChain()
                    .addPoc(PointOfContact.builder()
                            .id(102)
                            .nodeId(2)
                            .equipmentId(20)
                            .used(true)
                            .flowDirection(FlowDirection.BIDIRECTIONAL)
                            .build());

            ValidationReport report = engine(store).validate(CHAIN);

            List<ValidationError> attributes = report.errorsOf(RequiredAttributesTest.CODE);
            assertEquals(3, attributes.size());
            assertEquals(Severity.HIGH, attributes.get(0).getSeverity());
            assertEquals(Severity.MEDIUM, attributes.get(1).getSeverity());
            assertEquals(Severity.MEDIUM, attributes.get(2).getSeverity());
            assertTrue(attributes.stream().allMatch(error -> error.getObjectId() == 102L));
        }

        @Test
        @DisplayName("Two inbound termini raise a single flow warning")
        void testFlowConflict() {
            InMemoryFacilityStore store = NetworkFixtureFactory.validationChain()
                    .addPoc(NetworkFixtureFactory.poc(101, 1, 10, 1, FlowDirection.IN));

            ValidationReport report = engine(store).validate(CHAIN);

            List<ValidationError> flow = report.errorsOf(FlowDirectionTest.CODE);
            assertEquals(1, flow.size());
            assertEquals(ErrorKind.FLOW_CONFLICT, flow.get(0).getKind());
            assertEquals(Severity.WARNING, flow.get(0).getSeverity());
            assertTrue(report.isValid());
        }
    }

    @Nested
    @DisplayName("Structure and review flags")
    class StructureTests {

        @Test
        @DisplayName("Repeated node is reported once as a circular path")
        void testDuplicateNode() {
            PathContext path = PathContext.of(8L, new int[]{1, 2, 3, 2, 3}, new int[]{11, 12, 12, 12});

            ValidationReport report = engine(NetworkFixtureFactory.validationChain()).validate(path);

            List<ValidationError> loops = report.errorsOf(LoopDetectionTest.CODE);
            assertEquals(2, loops.size());
            assertEquals(2L, loops.get(0).getObjectId());
            assertEquals(3L, loops.get(1).getObjectId());
            assertTrue(loops.stream().allMatch(error -> error.getKind() == ErrorKind.CIRCULAR_PATH));
        }

        @Test
        @DisplayName("Paths above the node ceiling are flagged as too long")
        void testTooLong() {
            ValidationConfig config = ValidationConfig.builder().maxPathNodes(3).build();
            ValidationEngine engine = new ValidationEngine(
                    NetworkFixtureFactory.validationChain(),
                    new ValidationTestCatalog(config)
            );

            ValidationReport report = engine.validate(CHAIN);

            List<ValidationError> structure = report.errorsOf(PathStructureTest.CODE);
            assertEquals(1, structure.size());
            assertEquals(ErrorKind.PATH_TOO_LONG, structure.get(0).getKind());
            assertTrue(report.isValid());
        }

        @Test
        @DisplayName("Unused and loopback PoCs raise open review flags")
        void testReviewFlags() {
            InMemoryFacilityStore store = NetworkFixtureFactory.validationChain()
                    .addPoc(PointOfContact.builder()
                            .id(102)
                            .nodeId(2)
                            .equipmentId(20)
                            .used(false)
                            .loopback(true)
                            .utilityNo(1)
                            .flowDirection(FlowDirection.BIDIRECTIONAL)
                            .build());

            ValidationReport report = engine(store).validate(CHAIN);

            assertEquals(2, report.getFlags().size());
            ReviewFlag unused = report.getFlags().get(0);
            ReviewFlag loopback = report.getFlags().get(1);
            assertEquals(ReviewFlagType.UNUSED_POC, unused.getFlagType());
            assertEquals(Severity.MEDIUM, unused.getSeverity());
            assertEquals(ReviewFlagType.LOOPBACK_POC, loopback.getFlagType());
            assertEquals(Severity.LOW, loopback.getSeverity());
            assertEquals(ReviewFlag.Status.OPEN, loopback.getStatus());
            assertTrue(report.errorsOf(RequiredAttributesTest.CODE).isEmpty(), "unused PoCs are not attribute-checked");
        }
    }

    @Test
    @DisplayName("Throwing test becomes TEST_EXECUTION_FAILED and later tests still run")
    void testFailingTestIsolated() {
        ValidationTest exploding = new ValidationTest() {
            @Override
            public String code() {
                return "CUSTOM_BOOM";
            }

            @Override
            public ValidationScope scope() {
                return ValidationScope.QA;
            }

            @Override
            public void run(PathContext path, NetworkStore store, ValidationFindings findings) {
                throw new IllegalStateException("boom");
            }
        };
        ValidationTest noting = new ValidationTest() {
            @Override
            public String code() {
                return "CUSTOM_NOTE";
            }

            @Override
            public ValidationScope scope() {
                return ValidationScope.QA;
            }

            @Override
            public void run(PathContext path, NetworkStore store, ValidationFindings findings) {
                findings.add(error(Severity.LOW, ErrorKind.MISSING_ATTRIBUTE)
                        .objectType(ObjectType.PATH)
                        .objectId(path.getPathId())
                        .message("noted")
                        .build());
            }
        };
        ValidationEngine engine = new ValidationEngine(
                NetworkFixtureFactory.validationChain(),
                new ValidationTestCatalog(ValidationConfig.builder().build(), List.of(exploding, noting))
        );

        ValidationReport report = engine.validate(CHAIN);

        assertEquals(2, report.getErrors().size());
        ValidationError failure = report.errorsOf("CUSTOM_BOOM").get(0);
        assertEquals(ErrorKind.TEST_EXECUTION_FAILED, failure.getKind());
        assertEquals(Severity.ERROR, failure.getSeverity());
        assertTrue(failure.getMessage().contains("boom"));
        assertEquals(1, report.errorsOf("CUSTOM_NOTE").size());
        assertFalse(report.isValid());

        Map<Severity, Integer> counts = report.countsBySeverity();
        assertEquals(1, counts.get(Severity.ERROR));
        assertEquals(1, counts.get(Severity.LOW));
        assertFalse(counts.containsKey(Severity.CRITICAL));
    }

    @Nested
    @DisplayName("Unresolved pairs")
    class UnresolvedPairTests {

        @Test
        @DisplayName("Missing endpoint yields CRITICAL POC_NOT_FOUND")
        void testMissingEndpoint() {
            ValidationReport report = engine(NetworkFixtureFactory.validationChain()).validateUnresolvedPair(1, 999);

            assertEquals(1, report.getErrors().size());
            ValidationError error = report.getErrors().get(0);
            assertEquals(ErrorKind.POC_NOT_FOUND, error.getKind());
            assertEquals(Severity.CRITICAL, error.getSeverity());
            assertEquals(999L, error.getObjectId());
            assertEquals(ValidationEngine.CODE_PAIR_RESOLUTION, error.getTestCode());
        }

        @Test
        @DisplayName("Different utilities are named as the likely cause")
        void testDifferentUtilities() {
            ValidationReport report = engine(NetworkFixtureFactory.validationChain()).validateUnresolvedPair(1, 4);

            assertEquals(1, report.getErrors().size());
            ValidationError error = report.getErrors().get(0);
            assertEquals(ErrorKind.PATH_NOT_FOUND, error.getKind());
            assertEquals(Severity.HIGH, error.getSeverity());
            assertTrue(error.getMessage().contains("different utilities"));
            assertFalse(error.getMessage().contains("different toolsets"));
        }

        @Test
        @DisplayName("Matching endpoints fall back to missing connections")
        void testNoConnectingLinks() {
            ValidationReport report = engine(NetworkFixtureFactory.validationChain()).validateUnresolvedPair(2, 1);

            assertTrue(report.getErrors().get(0).getMessage().contains("no connecting links"));
            assertTrue(report.isValid());
        }
    }
}
