package org.Fabnet.coverage;

import lombok.Builder;
import lombok.Value;

/**
 * Coverage of the in-scope nodes and links belonging to one equipment category.
 */
@Value
@Builder
public class CategoryCoverage {
    int categoryNo;
    int totalNodes;
    int totalLinks;
    int coveredNodes;
    int coveredLinks;

    public double coverageRatio() {
        int total = totalNodes + totalLinks;
        if (total <= 0) {
            return 0.0d;
        }
        return (double) (coveredNodes + coveredLinks) / total;
    }

    public double coveragePercentage() {
        return coverageRatio() * 100.0d;
    }
}
