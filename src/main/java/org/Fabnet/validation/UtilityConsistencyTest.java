package org.Fabnet.validation;

import it.unimi.dsi.fastutil.ints.IntList;
import lombok.RequiredArgsConstructor;
import org.Fabnet.network.graph.NetworkStore;
import org.Fabnet.network.model.Equipment;
import org.Fabnet.network.model.EquipmentKind;
import org.Fabnet.network.model.NetworkNode;

import java.util.Objects;
import java.util.Optional;

/**
 * UTY_001: the utility only changes across converting equipment performing an allow-listed conversion.
 *
 * <p>Nodes without a utility code are skipped. The equipment owning either node of the hop may
 * perform the conversion.</p>
 */
@RequiredArgsConstructor
public final class UtilityConsistencyTest implements ValidationTest {
    public static final String CODE = "UTY_001";

    private final UtilityTransitionRules rules;

    @Override
    public String code() {
        return CODE;
    }

    @Override
    public ValidationScope scope() {
        return ValidationScope.MATERIAL;
    }

    @Override
    public void run(PathContext path, NetworkStore store, ValidationFindings findings) {
        Objects.requireNonNull(rules, "rules");
        IntList nodeIds = path.getNodeIds();
        for (int hop = 0; hop < nodeIds.size() - 1; hop++) {
            Optional<NetworkNode> from = store.findNode(nodeIds.getInt(hop));
            Optional<NetworkNode> to = store.findNode(nodeIds.getInt(hop + 1));
            if (from.isEmpty() || to.isEmpty()) {
                continue;
            }
            int fromUtility = from.get().getUtilityCode();
            int toUtility = to.get().getUtilityCode();
            if (fromUtility == 0 || toUtility == 0 || fromUtility == toUtility) {
                continue;
            }
            EquipmentKind fromKind = equipmentKind(store, from.get().getId());
            EquipmentKind toKind = equipmentKind(store, to.get().getId());
            if (rules.permits(fromKind, fromUtility, toUtility) || rules.permits(toKind, fromUtility, toUtility)) {
                continue;
            }
            findings.add(error(Severity.HIGH, ErrorKind.UTILITY_MISMATCH)
                    .objectType(ObjectType.NODE)
                    .objectId(to.get().getId())
                    .message("utility changes from " + fromUtility + " to " + toUtility
                            + " between nodes " + from.get().getId() + " and " + to.get().getId()
                            + " without a permitted conversion")
                    .build());
        }
    }

    private static EquipmentKind equipmentKind(NetworkStore store, int nodeId) {
        return store.findPocByNode(nodeId)
                .flatMap(poc -> store.findEquipment(poc.getEquipmentId()))
                .map(Equipment::getKind)
                .orElse(null);
    }
}
