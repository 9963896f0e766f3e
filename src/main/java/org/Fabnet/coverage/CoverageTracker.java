package org.Fabnet.coverage;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectAVLTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntCollection;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;
import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import lombok.extern.slf4j.Slf4j;
import org.Fabnet.network.NetworkAnalysisException;
import org.Fabnet.network.StoreCalls;
import org.Fabnet.network.path.PathResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Cumulative node/link coverage of one run.
 *
 * <p>Covered sets only grow. The in-memory sets are a cache: the persisted path records of a run
 * are the source of truth and {@link #reconstruct(String, CoverageStore)} rebuilds from them.
 * Mutated by the owning run's thread only.</p>
 */
@Slf4j
public final class CoverageTracker {
    /**
     * Largest id difference between neighbors of one {@link CoverageGap}.
     */
    public static final int GAP_ID_STEP = 2;

    private final String runId;
    private final CoverageStore store;
    private final IntOpenHashSet coveredNodes = new IntOpenHashSet();
    private final IntOpenHashSet coveredLinks = new IntOpenHashSet();
    private final ObjectOpenHashSet<IntList> pathSignatures = new ObjectOpenHashSet<>();

    private CoverageScope scope;
    private int totalNodes;
    private int totalLinks;

    public CoverageTracker(String runId, CoverageStore store) {
        this.runId = Objects.requireNonNull(runId, "runId");
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Rebuilds a tracker by replaying every persisted path record of {@code runId}.
     *
     * @throws NetworkAnalysisException {@code UNKNOWN_RUN} when the store has no such run.
     */
    public static CoverageTracker reconstruct(String runId, CoverageStore store) {
        CoverageTracker tracker = new CoverageTracker(runId, store);
        CoverageScope runScope = StoreCalls.query("findRunScope", () -> store.findRunScope(runId))
                .orElseThrow(() -> new NetworkAnalysisException(
                        NetworkAnalysisException.REASON_UNKNOWN_RUN,
                        "no coverage scope recorded for run " + runId
                ));
        tracker.initialize(runScope);
        List<PathRecord> records = StoreCalls.query("pathRecords", () -> store.pathRecords(runId));
        for (PathRecord record : records) {
            tracker.pathSignatures.add(new IntArrayList(record.nodeIds()));
            tracker.applyUnion(record.nodeIds(), record.linkIds());
        }
        log.info(
                "coverage for run {} reconstructed from {} path records: {} nodes, {} links",
                runId, records.size(), tracker.coveredNodes.size(), tracker.coveredLinks.size()
        );
        return tracker;
    }

    /**
     * Computes scope totals and clears covered sets.
     */
    public CoverageMetrics initialize(CoverageScope scope) {
        CoverageScope validated = Objects.requireNonNull(scope, "scope").validate();
        int nodes = StoreCalls.query("countNodes", () -> store.countNodes(validated));
        int links = StoreCalls.query("countLinks", () -> store.countLinks(validated));
        this.scope = validated;
        resetTo(nodes, links);
        log.info("coverage for run {} initialized: scope={}, nodes={}, links={}", runId, validated, nodes, links);
        return metrics();
    }

    /**
     * Starts from known totals without a store scope; {@link #uncovered(CoverageElement, int)} is
     * unavailable afterwards.
     */
    public CoverageMetrics initialize(int totalNodes, int totalLinks) {
        if (totalNodes < 0 || totalLinks < 0) {
            throw NetworkAnalysisException.invalidConfiguration(
                    "coverage totals must be >= 0, got nodes=" + totalNodes + ", links=" + totalLinks
            );
        }
        this.scope = null;
        resetTo(totalNodes, totalLinks);
        return metrics();
    }

    /**
     * Unions a path's node and link ids into the covered sets. Idempotent.
     */
    public CoverageMetrics update(IntCollection pathNodes, IntCollection pathLinks) {
        applyUnion(Objects.requireNonNull(pathNodes, "pathNodes"), Objects.requireNonNull(pathLinks, "pathLinks"));
        return metrics();
    }

    /**
     * Same as {@link #update(IntCollection, IntCollection)} and also counts distinct node sequences.
     */
    public CoverageMetrics recordPath(PathResult path) {
        Objects.requireNonNull(path, "path");
        IntList nodeIds = path.nodeIds();
        pathSignatures.add(new IntArrayList(nodeIds));
        return update(nodeIds, path.linkIds());
    }

    public CoverageMetrics metrics() {
        return CoverageMetrics.builder()
                .runId(runId)
                .totalNodes(totalNodes)
                .totalLinks(totalLinks)
                .coveredNodes(coveredNodes.size())
                .coveredLinks(coveredLinks.size())
                .uniquePaths(pathSignatures.size())
                .build();
    }

    /**
     * Returns up to {@code limit} in-scope ids not yet covered, ascending.
     */
    public IntList uncovered(CoverageElement kind, int limit) {
        Objects.requireNonNull(kind, "kind");
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        int[] missing = uncoveredIds(kind);
        return IntArrayList.wrap(missing, Math.min(limit, missing.length));
    }

    /**
     * Counts the ids a path would add without recording it.
     */
    public CoverageContribution contribution(PathResult path) {
        Objects.requireNonNull(path, "path");
        return contribution(path.nodeIds(), path.linkIds());
    }

    public CoverageContribution contribution(IntCollection pathNodes, IntCollection pathLinks) {
        return CoverageContribution.builder()
                .newNodes(countNew(Objects.requireNonNull(pathNodes, "pathNodes"), coveredNodes))
                .newLinks(countNew(Objects.requireNonNull(pathLinks, "pathLinks"), coveredLinks))
                .totalNodes(totalNodes)
                .totalLinks(totalLinks)
                .build();
    }

    /**
     * Breaks in-scope coverage down by equipment category, ascending by category.
     */
    public List<CategoryCoverage> coverageByCategory() {
        CoverageScope current = requireScope();
        Int2IntMap nodeCategories = StoreCalls.query("nodeCategories", () -> store.nodeCategories(current));
        Int2IntMap linkCategories = StoreCalls.query("linkCategories", () -> store.linkCategories(current));

        Int2ObjectAVLTreeMap<int[]> counters = new Int2ObjectAVLTreeMap<>();
        tally(nodeCategories, coveredNodes, counters, 0);
        tally(linkCategories, coveredLinks, counters, 2);

        List<CategoryCoverage> result = new ArrayList<>(counters.size());
        for (Int2ObjectMap.Entry<int[]> entry : counters.int2ObjectEntrySet()) {
            int[] c = entry.getValue();
            result.add(CategoryCoverage.builder()
                    .categoryNo(entry.getIntKey())
                    .totalNodes(c[0])
                    .coveredNodes(c[1])
                    .totalLinks(c[2])
                    .coveredLinks(c[3])
                    .build());
        }
        return result;
    }

    /**
     * Groups uncovered in-scope ids into runs whose consecutive ids are at most
     * {@link #GAP_ID_STEP} apart, keeping runs of at least {@code minGapSize} ids.
     */
    public List<CoverageGap> gaps(CoverageElement kind, int minGapSize) {
        Objects.requireNonNull(kind, "kind");
        if (minGapSize < 1) {
            throw new IllegalArgumentException("minGapSize must be >= 1");
        }
        int[] missing = uncoveredIds(kind);
        List<CoverageGap> gaps = new ArrayList<>();
        int runStart = 0;
        for (int i = 1; i <= missing.length; i++) {
            boolean runEnds = i == missing.length || (long) missing[i] - missing[i - 1] > GAP_ID_STEP;
            if (!runEnds) {
                continue;
            }
            if (i - runStart >= minGapSize) {
                gaps.add(CoverageGap.builder()
                        .kind(kind)
                        .startId(missing[runStart])
                        .endId(missing[i - 1])
                        .ids(IntArrayList.wrap(Arrays.copyOfRange(missing, runStart, i)))
                        .build());
            }
            runStart = i;
        }
        return gaps;
    }

    public String runId() {
        return runId;
    }

    public IntSet coveredNodeIds() {
        return IntSets.unmodifiable(coveredNodes);
    }

    public IntSet coveredLinkIds() {
        return IntSets.unmodifiable(coveredLinks);
    }

    private void resetTo(int nodes, int links) {
        this.totalNodes = nodes;
        this.totalLinks = links;
        coveredNodes.clear();
        coveredLinks.clear();
        pathSignatures.clear();
    }

    private CoverageScope requireScope() {
        if (scope == null) {
            throw new NetworkAnalysisException(
                    NetworkAnalysisException.REASON_COVERAGE_NOT_INITIALIZED,
                    "run " + runId + " has no store-backed coverage scope"
            );
        }
        return scope;
    }

    private int[] uncoveredIds(CoverageElement kind) {
        CoverageScope current = requireScope();
        IntSet inScope;
        IntSet covered;
        if (kind == CoverageElement.NODE) {
            inScope = StoreCalls.query("nodeIdsInScope", () -> store.nodeIdsInScope(current));
            covered = coveredNodes;
        } else {
            inScope = StoreCalls.query("linkIdsInScope", () -> store.linkIdsInScope(current));
            covered = coveredLinks;
        }
        return inScope.intStream().filter(id -> !covered.contains(id)).sorted().toArray();
    }

    /**
     * Adds totals at {@code offset} and covered counts at {@code offset + 1} of each category's counters.
     */
    private static void tally(Int2IntMap categories, IntSet covered, Int2ObjectAVLTreeMap<int[]> counters, int offset) {
        for (Int2IntMap.Entry entry : categories.int2IntEntrySet()) {
            int[] c = counters.get(entry.getIntValue());
            if (c == null) {
                c = new int[4];
                counters.put(entry.getIntValue(), c);
            }
            c[offset]++;
            if (covered.contains(entry.getIntKey())) {
                c[offset + 1]++;
            }
        }
    }

    private static int countNew(IntCollection ids, IntSet covered) {
        IntOpenHashSet fresh = new IntOpenHashSet();
        IntIterator iterator = ids.iterator();
        while (iterator.hasNext()) {
            int id = iterator.nextInt();
            if (!covered.contains(id)) {
                fresh.add(id);
            }
        }
        return fresh.size();
    }

    private void applyUnion(IntCollection nodes, IntCollection links) {
        coveredNodes.addAll(nodes);
        coveredLinks.addAll(links);
    }
}
