package org.Fabnet.coverage;

import it.unimi.dsi.fastutil.ints.IntList;
import lombok.Builder;
import lombok.Value;

/**
 * Run of uncovered ids whose neighbors lie at most {@link CoverageTracker#GAP_ID_STEP} apart.
 */
@Value
@Builder
public class CoverageGap {
    CoverageElement kind;
    int startId;
    int endId;

    /**
     * Member ids, ascending.
     */
    IntList ids;

    public int size() {
        return ids.size();
    }
}
