package org.Fabnet.validation;

import org.Fabnet.network.graph.NetworkStore;
import org.Fabnet.network.model.FlowDirection;
import org.Fabnet.network.model.PointOfContact;

import java.util.Optional;

/**
 * UTY_002: at most one inbound and one outbound PoC terminus along a path. Informational.
 */
public final class FlowDirectionTest implements ValidationTest {
    public static final String CODE = "UTY_002";

    @Override
    public String code() {
        return CODE;
    }

    @Override
    public ValidationScope scope() {
        return ValidationScope.FLOW;
    }

    @Override
    public void run(PathContext path, NetworkStore store, ValidationFindings findings) {
        int inbound = 0;
        int outbound = 0;
        for (int nodeId : path.getNodeIds()) {
            Optional<PointOfContact> poc = store.findPocByNode(nodeId);
            if (poc.isEmpty() || poc.get().getFlowDirection() == null) {
                continue;
            }
            FlowDirection direction = poc.get().getFlowDirection();
            if (direction == FlowDirection.IN) {
                inbound++;
            } else if (direction == FlowDirection.OUT) {
                outbound++;
            }
        }
        if (inbound > 1) {
            findings.add(conflict(path, "path has " + inbound + " inbound PoC termini"));
        }
        if (outbound > 1) {
            findings.add(conflict(path, "path has " + outbound + " outbound PoC termini"));
        }
    }

    private ValidationError conflict(PathContext path, String message) {
        return error(Severity.WARNING, ErrorKind.FLOW_CONFLICT)
                .objectType(ObjectType.PATH)
                .objectId(path.getPathId())
                .message(message)
                .build();
    }
}
