package org.Fabnet.coverage;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.IntSet;

import java.util.List;
import java.util.Optional;

/**
 * Backing-store queries needed by {@link CoverageTracker}.
 */
public interface CoverageStore {

    int countNodes(CoverageScope scope);

    int countLinks(CoverageScope scope);

    IntSet nodeIdsInScope(CoverageScope scope);

    IntSet linkIdsInScope(CoverageScope scope);

    /**
     * Maps every in-scope node id to its equipment category; 0 when the node has no equipment.
     */
    Int2IntMap nodeCategories(CoverageScope scope);

    /**
     * Maps every in-scope link id to the category of its start node.
     */
    Int2IntMap linkCategories(CoverageScope scope);

    /**
     * Returns the scope a run was started with, empty for unknown runs.
     */
    Optional<CoverageScope> findRunScope(String runId);

    /**
     * Returns every persisted path record of {@code runId}, in insertion order.
     */
    List<PathRecord> pathRecords(String runId);
}
