package org.Fabnet.sampling;

import it.unimi.dsi.fastutil.ints.IntList;
import lombok.Builder;
import lombok.Value;

/**
 * Suggested strategy for a scope with the tuning and toolset order that go with it.
 */
@Value
@Builder
public class StrategySuggestion {
    SamplingStrategy strategy;
    String reason;
    BiasConfig recommendedConfig;
    /**
     * At most {@link BiasedSampler#MAX_PRIORITY_TOOLSETS} toolset ids, best first.
     */
    IntList priorityToolsets;
    DiversityReport diversity;
}
