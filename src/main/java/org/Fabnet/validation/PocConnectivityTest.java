package org.Fabnet.validation;

import it.unimi.dsi.fastutil.ints.IntList;
import org.Fabnet.network.graph.NetworkStore;
import org.Fabnet.network.model.NetworkLink;
import org.Fabnet.network.model.PointOfContact;

import java.util.Optional;

/**
 * CONN_001: every referenced node and link exists; unused points of contact are flagged for review.
 */
public final class PocConnectivityTest implements ValidationTest {
    public static final String CODE = "CONN_001";

    @Override
    public String code() {
        return CODE;
    }

    @Override
    public ValidationScope scope() {
        return ValidationScope.CONNECTIVITY;
    }

    @Override
    public void run(PathContext path, NetworkStore store, ValidationFindings findings) {
        if (path.nodeCount() < 2) {
            return;
        }
        IntList nodeIds = path.getNodeIds();
        for (int i = 0; i < nodeIds.size(); i++) {
            int nodeId = nodeIds.getInt(i);
            if (store.findNode(nodeId).isEmpty()) {
                findings.add(error(Severity.CRITICAL, ErrorKind.MISSING_NODE)
                        .objectType(ObjectType.NODE)
                        .objectId(nodeId)
                        .message("node " + nodeId + " at position " + (i + 1) + " does not exist")
                        .build());
                continue;
            }
            Optional<PointOfContact> poc = store.findPocByNode(nodeId);
            if (poc.isPresent() && !poc.get().isUsed()) {
                findings.flag(ReviewFlag.builder()
                        .flagType(ReviewFlagType.UNUSED_POC)
                        .severity(Severity.MEDIUM)
                        .reason("path passes through unused PoC " + poc.get().getId() + " at node " + nodeId)
                        .objectType(ObjectType.POC)
                        .objectId(poc.get().getId())
                        .build());
            }
        }

        IntList linkIds = path.getLinkIds();
        for (int i = 0; i < linkIds.size(); i++) {
            int linkId = linkIds.getInt(i);
            Optional<NetworkLink> link = store.findLink(linkId);
            if (link.isEmpty()) {
                findings.add(error(Severity.CRITICAL, ErrorKind.MISSING_LINK)
                        .objectType(ObjectType.LINK)
                        .objectId(linkId)
                        .message("link " + linkId + " at position " + (i + 1) + " does not exist")
                        .build());
            }
        }
    }
}
