package org.Fabnet.coverage;

import lombok.Builder;
import lombok.Value;
import org.Fabnet.network.NetworkAnalysisException;

/**
 * Facility scope whose nodes and links count towards coverage.
 *
 * <p>Zero model, phase or toolset means "any".</p>
 */
@Value
@Builder
public class CoverageScope {
    String fab;
    int modelNo;
    int phaseNo;
    int toolsetId;

    public CoverageScope validate() {
        if (fab == null || fab.isBlank()) {
            throw NetworkAnalysisException.invalidConfiguration("coverage scope requires a fab");
        }
        if (modelNo < 0 || phaseNo < 0 || toolsetId < 0) {
            throw NetworkAnalysisException.invalidConfiguration("coverage scope filters must be >= 0: " + this);
        }
        return this;
    }
}
