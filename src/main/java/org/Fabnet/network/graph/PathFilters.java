package org.Fabnet.network.graph;

import lombok.Builder;
import lombok.Value;
import org.Fabnet.network.NetworkAnalysisException;
import org.Fabnet.network.model.NetworkNode;

import java.util.Locale;

/**
 * Node-inclusion filters for one traversal session.
 *
 * <p>A zero code or an empty label disables the corresponding filter.</p>
 */
@Value
@Builder
public class PathFilters {
    private static final PathFilters NONE = PathFilters.builder().build();

    int utilityCode;
    int toolsetId;

    /**
     * Case-insensitive substring matched against {@link NetworkNode#getPocLabel()}.
     */
    @Builder.Default
    String pocLabel = "";

    public static PathFilters none() {
        return NONE;
    }

    /**
     * Parses raw textual filter values as handed over by a run configuration.
     *
     * @throws NetworkAnalysisException with {@code INVALID_CONFIGURATION} on malformed numbers.
     */
    public static PathFilters parse(String utilityCode, String toolsetId, String pocLabel) {
        return PathFilters.builder()
                .utilityCode(parseCode("utilityCode", utilityCode))
                .toolsetId(parseCode("toolsetId", toolsetId))
                .pocLabel(pocLabel == null ? "" : pocLabel.trim())
                .build()
                .validate();
    }

    /**
     * Rejects negative codes.
     */
    public PathFilters validate() {
        if (utilityCode < 0) {
            throw NetworkAnalysisException.invalidConfiguration("utilityCode must be >= 0, got " + utilityCode);
        }
        if (toolsetId < 0) {
            throw NetworkAnalysisException.invalidConfiguration("toolsetId must be >= 0, got " + toolsetId);
        }
        if (pocLabel == null) {
            throw NetworkAnalysisException.invalidConfiguration("pocLabel must not be null");
        }
        return this;
    }

    public boolean hasUtilityFilter() {
        return utilityCode != 0;
    }

    public boolean hasToolsetFilter() {
        return toolsetId != 0;
    }

    public boolean hasLabelFilter() {
        return pocLabel != null && !pocLabel.isEmpty();
    }

    public boolean isEmpty() {
        return !hasUtilityFilter() && !hasToolsetFilter() && !hasLabelFilter();
    }

    /**
     * Returns true when {@code node} satisfies every active filter.
     */
    public boolean matches(NetworkNode node) {
        if (hasUtilityFilter() && node.getUtilityCode() != utilityCode) {
            return false;
        }
        if (hasToolsetFilter() && node.getToolsetId() != toolsetId) {
            return false;
        }
        if (hasLabelFilter()) {
            String label = node.getPocLabel();
            return label != null
                    && label.toLowerCase(Locale.ROOT).contains(pocLabel.toLowerCase(Locale.ROOT));
        }
        return true;
    }

    private static int parseCode(String name, String raw) {
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw new NetworkAnalysisException(
                    NetworkAnalysisException.REASON_INVALID_CONFIGURATION,
                    name + " is not a number: '" + raw + "'",
                    ex
            );
        }
    }
}
