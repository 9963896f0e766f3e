package org.Fabnet.coverage;

import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Persisted path as replayed when reconstructing coverage.
 *
 * @param pathId persisted path id.
 * @param nodeIds node sequence.
 * @param linkIds link sequence.
 */
public record PathRecord(long pathId, IntList nodeIds, IntList linkIds) {
}
