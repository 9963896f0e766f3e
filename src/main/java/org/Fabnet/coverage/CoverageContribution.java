package org.Fabnet.coverage;

import lombok.Builder;
import lombok.Value;

/**
 * Coverage a candidate path would add to a run, measured before the path is committed.
 */
@Value
@Builder
public class CoverageContribution {
    /**
     * Distinct node ids of the path not yet covered.
     */
    int newNodes;

    int newLinks;
    int totalNodes;
    int totalLinks;

    /**
     * New ids as a fraction of all in-scope ids, zero when both totals are zero.
     */
    public double ratio() {
        int total = totalNodes + totalLinks;
        if (total <= 0) {
            return 0.0d;
        }
        return (double) (newNodes + newLinks) / total;
    }

    public boolean addsCoverage() {
        return newNodes + newLinks > 0;
    }
}
