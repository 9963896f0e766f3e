package org.Fabnet.validation;

import lombok.extern.slf4j.Slf4j;
import org.Fabnet.network.StoreCalls;
import org.Fabnet.network.graph.NetworkStore;
import org.Fabnet.network.model.NetworkNode;
import org.Fabnet.network.path.PathResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs the validation battery against candidate paths.
 *
 * <p>Per-path problems are returned as data. A test that throws is reported as a synthetic
 * {@link ErrorKind#TEST_EXECUTION_FAILED} error carrying its code, and the remaining tests still run.</p>
 */
@Slf4j
public final class ValidationEngine {
    public static final String CODE_PAIR_RESOLUTION = "PATH_001";

    private final NetworkStore store;
    private final ValidationTestCatalog catalog;

    public ValidationEngine(NetworkStore store) {
        this(store, ValidationTestCatalog.defaultCatalog());
    }

    public ValidationEngine(NetworkStore store, ValidationTestCatalog catalog) {
        this.store = Objects.requireNonNull(store, "store");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public ValidationReport validate(PathResult path) {
        return validate(PathContext.from(path));
    }

    public ValidationReport validate(PathContext path) {
        Objects.requireNonNull(path, "path");
        ValidationFindings findings = new ValidationFindings();
        for (ValidationTest test : catalog.tests()) {
            try {
                test.run(path, store, findings);
            } catch (RuntimeException ex) {
                log.warn("validation test {} failed on path {}", test.code(), path.getPathId(), ex);
                findings.add(test.error(Severity.ERROR, ErrorKind.TEST_EXECUTION_FAILED)
                        .objectType(ObjectType.PATH)
                        .objectId(path.getPathId())
                        .message("test " + test.code() + " failed: " + ex.getMessage())
                        .build());
            }
        }
        return ValidationReport.builder()
                .pathId(path.getPathId())
                .errors(findings.errors())
                .flags(findings.flags())
                .build();
    }

    /**
     * Reports a sampled pair for which no path was found.
     *
     * <p>A missing endpoint yields a CRITICAL {@code POC_NOT_FOUND} per endpoint. Otherwise a single
     * HIGH {@code PATH_NOT_FOUND} is raised with the likely causes in its message.</p>
     */
    public ValidationReport validateUnresolvedPair(int fromNodeId, int toNodeId) {
        Optional<NetworkNode> from = StoreCalls.query("findNode", () -> store.findNode(fromNodeId));
        Optional<NetworkNode> to = StoreCalls.query("findNode", () -> store.findNode(toNodeId));
        ValidationReport.ValidationReportBuilder report = ValidationReport.builder();
        if (from.isEmpty() || to.isEmpty()) {
            if (from.isEmpty()) {
                report.error(pairError(Severity.CRITICAL, ErrorKind.POC_NOT_FOUND, fromNodeId,
                        "start node " + fromNodeId + " not found"));
            }
            if (to.isEmpty()) {
                report.error(pairError(Severity.CRITICAL, ErrorKind.POC_NOT_FOUND, toNodeId,
                        "end node " + toNodeId + " not found"));
            }
            return report.build();
        }

        List<String> causes = new ArrayList<>();
        NetworkNode start = from.get();
        NetworkNode end = to.get();
        if (start.getUtilityCode() != end.getUtilityCode()) {
            causes.add("different utilities (" + start.getUtilityCode() + " vs " + end.getUtilityCode() + ")");
        }
        if (start.getToolsetId() != end.getToolsetId()) {
            causes.add("different toolsets (" + start.getToolsetId() + " vs " + end.getToolsetId() + ")");
        }
        if (causes.isEmpty()) {
            causes.add("no connecting links");
        }
        return report
                .error(pairError(Severity.HIGH, ErrorKind.PATH_NOT_FOUND, fromNodeId,
                        "no path from " + fromNodeId + " to " + toNodeId + ": " + String.join(", ", causes)))
                .build();
    }

    private static ValidationError pairError(Severity severity, ErrorKind kind, int nodeId, String message) {
        return ValidationError.builder()
                .testCode(CODE_PAIR_RESOLUTION)
                .severity(severity)
                .scope(ValidationScope.CONNECTIVITY)
                .kind(kind)
                .objectType(ObjectType.NODE)
                .objectId(nodeId)
                .message(message)
                .build();
    }
}
