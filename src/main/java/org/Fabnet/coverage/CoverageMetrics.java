package org.Fabnet.coverage;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable coverage snapshot.
 *
 * <p>Nodes and links weigh the same: the overall ratio is
 * {@code (coveredNodes + coveredLinks) / (totalNodes + totalLinks)}, zero when both totals are zero.</p>
 */
@Value
@Builder
public class CoverageMetrics {
    String runId;
    int totalNodes;
    int totalLinks;
    int coveredNodes;
    int coveredLinks;
    int uniquePaths;

    public double coverageRatio() {
        return ratio(coveredNodes + coveredLinks, totalNodes + totalLinks);
    }

    /**
     * Overall coverage in percent, {@code 0..100}.
     */
    public double coveragePercentage() {
        return coverageRatio() * 100.0d;
    }

    public double nodeCoveragePercentage() {
        return ratio(coveredNodes, totalNodes) * 100.0d;
    }

    public double linkCoveragePercentage() {
        return ratio(coveredLinks, totalLinks) * 100.0d;
    }

    /**
     * Returns true when the overall ratio reached {@code targetRatio} (a fraction in {@code (0, 1]}).
     */
    public boolean meetsTarget(double targetRatio) {
        if (!(targetRatio > 0.0d && targetRatio <= 1.0d)) {
            throw new IllegalArgumentException("targetRatio must be in (0, 1], got " + targetRatio);
        }
        return coverageRatio() >= targetRatio;
    }

    private static double ratio(int covered, int total) {
        if (total <= 0) {
            return 0.0d;
        }
        return (double) covered / total;
    }
}
