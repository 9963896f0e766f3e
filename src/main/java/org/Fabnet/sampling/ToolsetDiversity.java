package org.Fabnet.sampling;

import lombok.Builder;
import lombok.Value;

/**
 * PoC and utility spread of one samplable toolset, with its draw count in the bound run.
 */
@Value
@Builder
public class ToolsetDiversity {
    int toolsetId;
    String fab;
    int phaseNo;
    int equipmentCount;
    /**
     * Distinct utilities across the toolset's PoCs; PoCs without a utility are not counted.
     */
    int utilityDiversity;
    int totalPocs;
    int usedPocs;
    int attempts;

    public double usageRate() {
        if (totalPocs == 0) {
            return 0.0d;
        }
        return (double) usedPocs / totalPocs;
    }
}
