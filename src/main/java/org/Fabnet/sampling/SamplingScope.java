package org.Fabnet.sampling;

import lombok.Builder;
import lombok.Value;

/**
 * Constraints of one draw. Null fab, zero phase and zero toolset mean unconstrained.
 */
@Value
@Builder
public class SamplingScope {
    private static final SamplingScope UNCONSTRAINED = SamplingScope.builder().build();

    String fab;
    int phaseNo;
    int toolsetId;

    public static SamplingScope unconstrained() {
        return UNCONSTRAINED;
    }

    public boolean hasFab() {
        return fab != null && !fab.isBlank();
    }
}
