package org.Fabnet.sampling;

import java.util.Comparator;

/**
 * Sampling posture suggested from the diversity of a scope's toolsets.
 */
public enum SamplingStrategy {
    /**
     * No toolset with at least two equipment.
     */
    NO_DATA,
    /**
     * Many toolsets whose PoCs are mostly in use: tolerate repeats, favor used toolsets.
     */
    FOCUS_HIGH_USAGE,
    /**
     * Several toolsets spanning many utilities: spread draws across utilities and categories.
     */
    FOCUS_DIVERSE,
    /**
     * Enough well-populated toolsets for the current tuning.
     */
    BALANCED,
    /**
     * Few options: raise ceilings and relax diversity screens.
     */
    EXHAUSTIVE;

    /**
     * Derives the tuning for this strategy from {@code current}; unrelated knobs are kept.
     */
    public BiasConfig recommend(BiasConfig current) {
        switch (this) {
            case FOCUS_HIGH_USAGE:
                return tune(current, 10, 5, 5, 0.2d, 0.1d);
            case FOCUS_DIVERSE:
                return tune(current, 7, 4, 15, 0.5d, 0.3d);
            case EXHAUSTIVE:
                return tune(current, 15, 8, 5, 0.1d, 0.1d);
            default:
                return current;
        }
    }

    /**
     * Order in which toolsets are prioritized under this strategy, best first.
     */
    Comparator<ToolsetDiversity> priorityOrder() {
        Comparator<ToolsetDiversity> order;
        switch (this) {
            case FOCUS_HIGH_USAGE:
                order = Comparator.comparingDouble(ToolsetDiversity::usageRate)
                        .thenComparingInt(ToolsetDiversity::getEquipmentCount);
                break;
            case FOCUS_DIVERSE:
                order = Comparator.comparingInt(ToolsetDiversity::getUtilityDiversity)
                        .thenComparingInt(ToolsetDiversity::getTotalPocs);
                break;
            default:
                order = Comparator.comparingInt(ToolsetDiversity::getEquipmentCount)
                        .thenComparingInt(ToolsetDiversity::getTotalPocs);
                break;
        }
        return order.reversed().thenComparingInt(ToolsetDiversity::getToolsetId);
    }

    private static BiasConfig tune(
            BiasConfig current,
            int toolsetCeiling,
            int equipmentCeiling,
            int minDistance,
            double utilityWeight,
            double categoryWeight
    ) {
        return current.toBuilder()
                .maxAttemptsPerToolset(toolsetCeiling)
                .maxAttemptsPerEquipment(equipmentCeiling)
                .minDistanceBetweenNodes(minDistance)
                .utilityDiversityWeight(utilityWeight)
                .categoryDiversityWeight(categoryWeight)
                .build();
    }
}
