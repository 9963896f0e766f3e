package org.Fabnet.validation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Fabnet.network.model.EquipmentKind;

import java.util.Map;
import java.util.Set;

/**
 * Allow-list of utility conversions and the equipment kinds permitted to perform them.
 */
@Value
@Builder
public class UtilityTransitionRules {
    private static final UtilityTransitionRules DEFAULTS = UtilityTransitionRules.builder()
            .transition(1, Set.of(2, 3))
            .transition(2, Set.of(1, 3))
            .transition(3, Set.of(1, 2, 4))
            .transition(4, Set.of(1))
            .transition(10, Set.of(11, 12))
            .transition(11, Set.of(10, 12))
            .transition(20, Set.of())
            .convertingKind(EquipmentKind.PROCESSING)
            .convertingKind(EquipmentKind.SUPPLY)
            .convertingKind(EquipmentKind.TREATMENT)
            .build();

    /**
     * Source utility to the utilities it may legitimately turn into.
     */
    @Singular
    Map<Integer, Set<Integer>> transitions;

    @Singular
    Set<EquipmentKind> convertingKinds;

    public static UtilityTransitionRules defaults() {
        return DEFAULTS;
    }

    public boolean isConverting(EquipmentKind kind) {
        return kind != null && convertingKinds.contains(kind);
    }

    public boolean allows(int fromUtility, int toUtility) {
        Set<Integer> targets = transitions.get(fromUtility);
        return targets != null && targets.contains(toUtility);
    }

    /**
     * True when {@code kind} may convert {@code fromUtility} into {@code toUtility}.
     */
    public boolean permits(EquipmentKind kind, int fromUtility, int toUtility) {
        return isConverting(kind) && allows(fromUtility, toUtility);
    }
}
