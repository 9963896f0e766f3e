package org.Fabnet.network.path;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;
import lombok.experimental.UtilityClass;
import org.Fabnet.network.NetworkAnalysisException;

/**
 * Parsing of comma-separated target data codes.
 */
@UtilityClass
public class TargetCodes {

    /**
     * Returns the empty set, which disables the TARGET rule.
     */
    public IntSet none() {
        return IntSets.emptySet();
    }

    public IntSet of(int... codes) {
        IntOpenHashSet set = new IntOpenHashSet(codes);
        set.remove(0);
        return IntSets.unmodifiable(set);
    }

    /**
     * Parses {@code "15000,107"}. Blank input or {@code "0"} yields the empty set.
     *
     * @throws NetworkAnalysisException {@code INVALID_CONFIGURATION} on a non-numeric token.
     */
    public IntSet parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return none();
        }
        IntOpenHashSet set = new IntOpenHashSet();
        for (String token : raw.split(",")) {
            String trimmed = token.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int code;
            try {
                code = Integer.parseInt(trimmed);
            } catch (NumberFormatException ex) {
                throw new NetworkAnalysisException(
                        NetworkAnalysisException.REASON_INVALID_CONFIGURATION,
                        "target code is not a number: '" + trimmed + "'",
                        ex
                );
            }
            if (code != 0) {
                set.add(code);
            }
        }
        return set.isEmpty() ? none() : IntSets.unmodifiable(set);
    }
}
