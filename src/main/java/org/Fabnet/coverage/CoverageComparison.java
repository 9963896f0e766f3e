package org.Fabnet.coverage;

import lombok.Builder;
import lombok.Value;

import java.util.Objects;

/**
 * Difference between two runs' coverage, candidate minus baseline.
 */
@Value
@Builder
public class CoverageComparison {
    String baselineRunId;
    String candidateRunId;

    /**
     * Overall coverage delta in percentage points.
     */
    double coverageDelta;

    double nodeCoverageDelta;
    double linkCoverageDelta;
    int uniquePathDelta;

    public static CoverageComparison compare(CoverageMetrics baseline, CoverageMetrics candidate) {
        Objects.requireNonNull(baseline, "baseline");
        Objects.requireNonNull(candidate, "candidate");
        return CoverageComparison.builder()
                .baselineRunId(baseline.getRunId())
                .candidateRunId(candidate.getRunId())
                .coverageDelta(candidate.coveragePercentage() - baseline.coveragePercentage())
                .nodeCoverageDelta(candidate.nodeCoveragePercentage() - baseline.nodeCoveragePercentage())
                .linkCoverageDelta(candidate.linkCoveragePercentage() - baseline.linkCoveragePercentage())
                .uniquePathDelta(candidate.getUniquePaths() - baseline.getUniquePaths())
                .build();
    }

    public boolean improved() {
        return coverageDelta > 0.0d;
    }
}
