package org.Fabnet.sampling;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time copy of a run's sampling counters.
 */
@Value
@Builder
public class SamplingStatistics {
    int totalAttempts;
    int successfulPairs;
    int consecutiveFailures;
    int resets;
    int toolsetsTracked;
    int equipmentTracked;
    int toolsetsAtCeiling;
    int equipmentAtCeiling;
    int recentNodeCount;
    Int2IntMap utilityUsage;
    Int2IntMap categoryUsage;
    Object2IntMap<RejectionReason> rejections;

    public double successRate() {
        if (totalAttempts == 0) {
            return 0.0d;
        }
        return (double) successfulPairs / totalAttempts;
    }
}
