package org.Fabnet.validation;

import lombok.Builder;
import lombok.Value;
import org.Fabnet.network.NetworkAnalysisException;

/**
 * Thresholds and rule tables of the validation battery.
 */
@Value
@Builder(toBuilder = true)
public class ValidationConfig {
    static final String PROP_MAX_PATH_NODES = "fabnet.validation.maxPathNodes";

    @Builder.Default
    int minPathNodes = 2;

    /**
     * Paths with more nodes are reported as suspiciously long.
     */
    @Builder.Default
    int maxPathNodes = 50;

    @Builder.Default
    UtilityTransitionRules utilityRules = UtilityTransitionRules.defaults();

    /**
     * Built-in thresholds with {@code fabnet.validation.maxPathNodes} applied when well-formed.
     */
    public static ValidationConfig defaults() {
        ValidationConfig base = ValidationConfig.builder().build();
        String raw = System.getProperty(PROP_MAX_PATH_NODES);
        if (raw == null || raw.isBlank()) {
            return base;
        }
        try {
            return base.toBuilder().maxPathNodes(Integer.parseInt(raw.trim())).build().validate();
        } catch (NumberFormatException ex) {
            return base;
        }
    }

    public ValidationConfig validate() {
        if (minPathNodes < 1) {
            throw NetworkAnalysisException.invalidConfiguration("minPathNodes must be >= 1");
        }
        if (maxPathNodes < minPathNodes) {
            throw NetworkAnalysisException.invalidConfiguration(
                    "maxPathNodes must be >= minPathNodes, got " + maxPathNodes + " < " + minPathNodes
            );
        }
        if (utilityRules == null) {
            throw NetworkAnalysisException.invalidConfiguration("utilityRules must not be null");
        }
        return this;
    }
}
