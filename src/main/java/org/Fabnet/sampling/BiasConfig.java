package org.Fabnet.sampling;

import lombok.Builder;
import lombok.Value;
import org.Fabnet.network.NetworkAnalysisException;

/**
 * Bias-reduction tuning of {@link BiasedSampler}.
 */
@Value
@Builder(toBuilder = true)
public class BiasConfig {
    static final String PROP_PREFIX = "fabnet.sampling.";

    /**
     * Draws of one toolset before it is excluded from the random choice.
     */
    @Builder.Default
    int maxAttemptsPerToolset = 5;

    /**
     * Accepted pairs involving one equipment before it is excluded.
     */
    @Builder.Default
    int maxAttemptsPerEquipment = 3;

    /**
     * Minimum id distance between the two nodes of a pair and to any recently sampled node.
     */
    @Builder.Default
    int minDistanceBetweenNodes = 10;

    /**
     * Rejection probability for a pair whose utility was already sampled.
     */
    @Builder.Default
    double utilityDiversityWeight = 0.3d;

    /**
     * Rejection probability for a pair whose equipment category was already sampled.
     */
    @Builder.Default
    double categoryDiversityWeight = 0.2d;

    /**
     * Failed toolset draws in a row that trigger an automatic partial reset.
     */
    @Builder.Default
    int maxConsecutiveFailures = 50;

    @Builder.Default
    int maxPairAttempts = 100;

    /**
     * Equipment/PoC draws within one toolset draw.
     */
    @Builder.Default
    int maxInnerAttempts = 50;

    @Builder.Default
    int recencyCapacity = 20;

    @Builder.Default
    int toolsetPartialDecrement = 2;

    @Builder.Default
    int equipmentPartialDecrement = 1;

    @Builder.Default
    boolean preferUsedPocs = true;

    @Builder.Default
    double unusedPocCostFactor = 1.5d;

    @Builder.Default
    double crossUtilityCostFactor = 0.8d;

    /**
     * Built-in defaults overridden by {@code fabnet.sampling.*} system properties.
     * Malformed values keep the built-in default.
     */
    public static BiasConfig defaults() {
        BiasConfig base = BiasConfig.builder().build();
        return base.toBuilder()
                .maxAttemptsPerToolset(readInt("maxAttemptsPerToolset", base.maxAttemptsPerToolset))
                .maxAttemptsPerEquipment(readInt("maxAttemptsPerEquipment", base.maxAttemptsPerEquipment))
                .minDistanceBetweenNodes(readInt("minDistanceBetweenNodes", base.minDistanceBetweenNodes))
                .maxPairAttempts(readInt("maxPairAttempts", base.maxPairAttempts))
                .recencyCapacity(readInt("recencyCapacity", base.recencyCapacity))
                .build()
                .validate();
    }

    public BiasConfig validate() {
        requirePositive("maxAttemptsPerToolset", maxAttemptsPerToolset);
        requirePositive("maxAttemptsPerEquipment", maxAttemptsPerEquipment);
        requirePositive("maxConsecutiveFailures", maxConsecutiveFailures);
        requirePositive("maxPairAttempts", maxPairAttempts);
        requirePositive("maxInnerAttempts", maxInnerAttempts);
        requirePositive("recencyCapacity", recencyCapacity);
        if (minDistanceBetweenNodes < 0) {
            throw NetworkAnalysisException.invalidConfiguration("minDistanceBetweenNodes must be >= 0");
        }
        if (toolsetPartialDecrement < 1 || equipmentPartialDecrement < 1) {
            throw NetworkAnalysisException.invalidConfiguration("partial decrements must be >= 1");
        }
        requireWeight("utilityDiversityWeight", utilityDiversityWeight);
        requireWeight("categoryDiversityWeight", categoryDiversityWeight);
        if (!(unusedPocCostFactor > 0.0d) || !(crossUtilityCostFactor > 0.0d)) {
            throw NetworkAnalysisException.invalidConfiguration("cost factors must be > 0");
        }
        return this;
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw NetworkAnalysisException.invalidConfiguration(name + " must be > 0, got " + value);
        }
    }

    private static void requireWeight(String name, double value) {
        if (!(value >= 0.0d && value <= 1.0d)) {
            throw NetworkAnalysisException.invalidConfiguration(name + " must be in [0, 1], got " + value);
        }
    }

    private static int readInt(String key, int fallback) {
        String raw = System.getProperty(PROP_PREFIX + key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
