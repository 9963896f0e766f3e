package org.Fabnet.sampling;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Diversity of every samplable toolset in a scope, largest toolsets first.
 */
@Value
@Builder
public class DiversityReport {
    @Singular
    List<ToolsetDiversity> toolsets;

    public boolean isEmpty() {
        return toolsets.isEmpty();
    }

    public int totalPocs() {
        int total = 0;
        for (ToolsetDiversity toolset : toolsets) {
            total += toolset.getTotalPocs();
        }
        return total;
    }

    public int usedPocs() {
        int used = 0;
        for (ToolsetDiversity toolset : toolsets) {
            used += toolset.getUsedPocs();
        }
        return used;
    }

    public double overallUsageRate() {
        int total = totalPocs();
        if (total == 0) {
            return 0.0d;
        }
        return (double) usedPocs() / total;
    }
}
