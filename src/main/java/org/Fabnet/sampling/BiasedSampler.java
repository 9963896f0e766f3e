package org.Fabnet.sampling;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import lombok.extern.slf4j.Slf4j;
import org.Fabnet.network.NetworkAnalysisException;
import org.Fabnet.network.StoreCalls;
import org.Fabnet.network.model.Equipment;
import org.Fabnet.network.model.PointOfContact;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Hierarchical random pair selection with bias reduction.
 *
 * <p>Draw order is fab, toolset, two distinct equipment, one point of contact per equipment.
 * Toolsets and equipment at their attempt ceiling are excluded; an exhausted pool is partially
 * decremented and retried once. Candidate pairs failing the distance, recency, repetition or
 * diversity screens are rejected without counting as attempts.</p>
 *
 * <p>Reproducible when the caller supplies a seeded {@link Random}.</p>
 */
@Slf4j
public final class BiasedSampler {
    public static final int MAX_PRIORITY_TOOLSETS = 10;

    private static final double HIGH_USAGE_RATE = 0.7d;
    private static final int HIGH_USAGE_TOOLSETS = 5;
    private static final int DIVERSE_UTILITIES = 3;
    private static final int DIVERSE_TOOLSETS = 3;
    private static final int WELL_POPULATED_POCS = 10;
    private static final int WELL_POPULATED_TOOLSETS = 5;

    private final SamplingCatalog catalog;
    private final BiasConfig config;
    private final BiasState state;
    private final Random random;

    public BiasedSampler(SamplingCatalog catalog, BiasConfig config, BiasState state, Random random) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.config = Objects.requireNonNull(config, "config").validate();
        this.state = Objects.requireNonNull(state, "state");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Draws one pair within {@code scope}.
     *
     * @return found outcome, or "no pair" after {@link BiasConfig#getMaxPairAttempts()} toolset draws.
     * @throws NetworkAnalysisException {@code BACKING_STORE_UNAVAILABLE} when the catalog fails.
     */
    public SampleOutcome sample(SamplingScope scope) {
        Objects.requireNonNull(scope, "scope");
        int maxAttempts = config.getMaxPairAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String fab = scope.hasFab() ? scope.getFab() : chooseFab();
            if (fab == null) {
                return SampleOutcome.noPair(SampleOutcome.NoPairReason.NO_CANDIDATES, attempt - 1);
            }
            List<ToolsetInfo> toolsets = candidateToolsets(fab, scope);
            if (toolsets.isEmpty()) {
                if (scope.hasFab()) {
                    return SampleOutcome.noPair(SampleOutcome.NoPairReason.NO_CANDIDATES, attempt - 1);
                }
                recordFailure();
                continue;
            }

            ToolsetInfo toolset = chooseToolset(toolsets);
            if (toolset == null) {
                recordFailure();
                continue;
            }
            state.recordToolsetDraw(toolset.toolsetId());
            SampledPair pair = drawPair(fab, toolset);
            if (pair != null) {
                log.debug(
                        "sampled pair {} -> {} in toolset {} after {} attempts",
                        pair.fromNodeId(), pair.toNodeId(), toolset.toolsetId(), attempt
                );
                return SampleOutcome.found(pair, attempt);
            }
            recordFailure();
        }
        log.debug("no pair found within {} attempts for scope {}", maxAttempts, scope);
        return SampleOutcome.noPair(SampleOutcome.NoPairReason.ATTEMPTS_EXHAUSTED, maxAttempts);
    }

    /**
     * Describes every toolset {@link #sample(SamplingScope)} could draw from in {@code scope},
     * ordered by equipment count descending, then toolset id.
     *
     * @throws NetworkAnalysisException {@code BACKING_STORE_UNAVAILABLE} when the catalog fails.
     */
    public DiversityReport toolsetDiversity(SamplingScope scope) {
        Objects.requireNonNull(scope, "scope");
        List<String> fabs;
        if (scope.hasFab()) {
            fabs = List.of(scope.getFab());
        } else {
            fabs = new ArrayList<>(StoreCalls.query("fabs", catalog::fabs));
            fabs.sort(Comparator.naturalOrder());
        }

        List<ToolsetDiversity> rows = new ArrayList<>();
        for (String fab : fabs) {
            for (ToolsetInfo toolset : candidateToolsets(fab, scope)) {
                rows.add(describe(toolset));
            }
        }
        rows.sort(Comparator.comparingInt(ToolsetDiversity::getEquipmentCount).reversed()
                .thenComparingInt(ToolsetDiversity::getToolsetId));
        return DiversityReport.builder().toolsets(rows).build();
    }

    /**
     * Picks a {@link SamplingStrategy} from the toolset diversity of {@code scope}.
     *
     * <p>Checked in order: at least five toolsets with a PoC usage rate of 0.7 or more,
     * at least three toolsets spanning three or more utilities, at least five toolsets
     * with ten or more PoCs. Otherwise exhaustive.</p>
     */
    public StrategySuggestion suggestStrategy(SamplingScope scope) {
        DiversityReport report = toolsetDiversity(scope);
        if (report.isEmpty()) {
            return StrategySuggestion.builder()
                    .strategy(SamplingStrategy.NO_DATA)
                    .reason("no toolset with at least two equipment")
                    .recommendedConfig(config)
                    .priorityToolsets(IntList.of())
                    .diversity(report)
                    .build();
        }

        int highUsage = 0;
        int diverse = 0;
        int wellPopulated = 0;
        for (ToolsetDiversity toolset : report.getToolsets()) {
            if (toolset.usageRate() >= HIGH_USAGE_RATE) {
                highUsage++;
            }
            if (toolset.getUtilityDiversity() >= DIVERSE_UTILITIES) {
                diverse++;
            }
            if (toolset.getTotalPocs() >= WELL_POPULATED_POCS) {
                wellPopulated++;
            }
        }

        SamplingStrategy strategy;
        String reason;
        if (highUsage >= HIGH_USAGE_TOOLSETS) {
            strategy = SamplingStrategy.FOCUS_HIGH_USAGE;
            reason = highUsage + " toolsets with high PoC usage";
        } else if (diverse >= DIVERSE_TOOLSETS) {
            strategy = SamplingStrategy.FOCUS_DIVERSE;
            reason = diverse + " toolsets spanning several utilities";
        } else if (wellPopulated >= WELL_POPULATED_TOOLSETS) {
            strategy = SamplingStrategy.BALANCED;
            reason = wellPopulated + " toolsets with adequate PoC counts";
        } else {
            strategy = SamplingStrategy.EXHAUSTIVE;
            reason = "limited options, exhaustive search recommended";
        }

        List<ToolsetDiversity> ranked = new ArrayList<>(report.getToolsets());
        ranked.sort(strategy.priorityOrder());
        IntArrayList priorities = new IntArrayList();
        for (int i = 0; i < ranked.size() && i < MAX_PRIORITY_TOOLSETS; i++) {
            priorities.add(ranked.get(i).getToolsetId());
        }
        log.debug("suggested {} for scope {}: {}", strategy, scope, reason);
        return StrategySuggestion.builder()
                .strategy(strategy)
                .reason(reason)
                .recommendedConfig(strategy.recommend(config))
                .priorityToolsets(priorities)
                .diversity(report)
                .build();
    }

    public SamplingStatistics statistics() {
        return state.snapshot(config);
    }

    /**
     * Clears every counter of the bound run state.
     */
    public void reset() {
        state.reset();
        log.info("bias state reset");
    }

    private String chooseFab() {
        List<String> fabs = new ArrayList<>(StoreCalls.query("fabs", catalog::fabs));
        if (fabs.isEmpty()) {
            return null;
        }
        fabs.sort(Comparator.naturalOrder());
        return fabs.get(random.nextInt(fabs.size()));
    }

    private List<ToolsetInfo> candidateToolsets(String fab, SamplingScope scope) {
        List<ToolsetInfo> all = StoreCalls.query("toolsets", () -> catalog.toolsets(fab, scope.getPhaseNo()));
        List<ToolsetInfo> candidates = new ArrayList<>();
        for (ToolsetInfo toolset : all) {
            if (scope.getToolsetId() != 0 && toolset.toolsetId() != scope.getToolsetId()) {
                continue;
            }
            if (toolset.equipmentCount() < 2) {
                continue;
            }
            candidates.add(toolset);
        }
        candidates.sort(Comparator.comparingInt(ToolsetInfo::toolsetId));
        return candidates;
    }

    /**
     * Weighted choice favoring large, rarely drawn toolsets: {@code equipmentCount / (1 + attempts)}.
     *
     * @return chosen toolset, or {@code null} while every toolset stays at its ceiling after the decrement.
     */
    private ToolsetInfo chooseToolset(List<ToolsetInfo> toolsets) {
        List<ToolsetInfo> eligible = toolsetsBelowCeiling(toolsets);
        if (eligible.isEmpty()) {
            IntArrayList ids = new IntArrayList(toolsets.size());
            for (ToolsetInfo toolset : toolsets) {
                ids.add(toolset.toolsetId());
            }
            state.decrementToolsets(ids, config.getToolsetPartialDecrement());
            log.warn("toolset pool of {} exhausted, counters decremented by {}", ids.size(), config.getToolsetPartialDecrement());
            eligible = toolsetsBelowCeiling(toolsets);
            if (eligible.isEmpty()) {
                return null;
            }
        }

        double[] weights = new double[eligible.size()];
        double total = 0.0d;
        for (int i = 0; i < eligible.size(); i++) {
            ToolsetInfo toolset = eligible.get(i);
            weights[i] = toolset.equipmentCount() / (1.0d + state.toolsetAttempts(toolset.toolsetId()));
            total += weights[i];
        }
        double roll = random.nextDouble() * total;
        for (int i = 0; i < weights.length; i++) {
            roll -= weights[i];
            if (roll < 0.0d) {
                return eligible.get(i);
            }
        }
        return eligible.get(eligible.size() - 1);
    }

    private ToolsetDiversity describe(ToolsetInfo toolset) {
        List<Equipment> equipment = StoreCalls.query(
                "equipmentInToolset", () -> catalog.equipmentInToolset(toolset.toolsetId())
        );
        IntOpenHashSet utilities = new IntOpenHashSet();
        int totalPocs = 0;
        int usedPocs = 0;
        for (Equipment item : equipment) {
            List<PointOfContact> pocs = StoreCalls.query("pocsOfEquipment", () -> catalog.pocsOfEquipment(item.getId()));
            for (PointOfContact poc : pocs) {
                totalPocs++;
                if (poc.isUsed()) {
                    usedPocs++;
                }
                if (poc.hasUtility()) {
                    utilities.add(poc.getUtilityNo().intValue());
                }
            }
        }
        return ToolsetDiversity.builder()
                .toolsetId(toolset.toolsetId())
                .fab(toolset.fab())
                .phaseNo(toolset.phaseNo())
                .equipmentCount(toolset.equipmentCount())
                .utilityDiversity(utilities.size())
                .totalPocs(totalPocs)
                .usedPocs(usedPocs)
                .attempts(state.toolsetAttempts(toolset.toolsetId()))
                .build();
    }

    private List<ToolsetInfo> toolsetsBelowCeiling(List<ToolsetInfo> toolsets) {
        List<ToolsetInfo> eligible = new ArrayList<>();
        for (ToolsetInfo toolset : toolsets) {
            if (state.toolsetAttempts(toolset.toolsetId()) < config.getMaxAttemptsPerToolset()) {
                eligible.add(toolset);
            }
        }
        return eligible;
    }

    private SampledPair drawPair(String fab, ToolsetInfo toolset) {
        List<Equipment> equipment = new ArrayList<>(
                StoreCalls.query("equipmentInToolset", () -> catalog.equipmentInToolset(toolset.toolsetId()))
        );
        equipment.sort(Comparator.comparingInt(Equipment::getId));
        List<Equipment> eligible = equipmentBelowCeiling(equipment);
        if (eligible.size() < 2) {
            IntArrayList ids = new IntArrayList(equipment.size());
            for (Equipment item : equipment) {
                ids.add(item.getId());
            }
            state.decrementEquipment(ids, config.getEquipmentPartialDecrement());
            log.warn(
                    "equipment pool of toolset {} exhausted, counters decremented by {}",
                    toolset.toolsetId(), config.getEquipmentPartialDecrement()
            );
            eligible = equipmentBelowCeiling(equipment);
            if (eligible.size() < 2) {
                return null;
            }
        }

        Int2ObjectOpenHashMap<List<PointOfContact>> pocCache = new Int2ObjectOpenHashMap<>();
        for (int inner = 0; inner < config.getMaxInnerAttempts(); inner++) {
            int first = random.nextInt(eligible.size());
            int second = random.nextInt(eligible.size() - 1);
            if (second >= first) {
                second++;
            }
            Equipment from = eligible.get(first);
            Equipment to = eligible.get(second);
            PointOfContact fromPoc = choosePoc(from, pocCache);
            PointOfContact toPoc = choosePoc(to, pocCache);
            if (fromPoc == null || toPoc == null) {
                state.recordRejection(RejectionReason.MISSING_POC);
                continue;
            }

            RejectionReason rejection = screen(from, to, fromPoc, toPoc);
            if (rejection != null) {
                state.recordRejection(rejection);
                log.debug("pair {} -> {} rejected: {}", fromPoc.getNodeId(), toPoc.getNodeId(), rejection);
                continue;
            }

            state.recordAcceptance(
                    from.getId(), to.getId(),
                    from.getCategoryNo(), to.getCategoryNo(),
                    fromPoc.getNodeId(), toPoc.getNodeId()
            );
            if (hasUtility(fromPoc, toPoc)) {
                state.recordUtility(utilityOf(fromPoc, toPoc));
            }
            return SampledPair.builder()
                    .fab(fab)
                    .toolsetId(toolset.toolsetId())
                    .fromEquipment(from)
                    .toEquipment(to)
                    .fromPoc(fromPoc)
                    .toPoc(toPoc)
                    .estimatedCost(estimateCost(fromPoc, toPoc))
                    .build();
        }
        return null;
    }

    private List<Equipment> equipmentBelowCeiling(List<Equipment> equipment) {
        List<Equipment> eligible = new ArrayList<>();
        for (Equipment item : equipment) {
            if (state.equipmentAttempts(item.getId()) < config.getMaxAttemptsPerEquipment()) {
                eligible.add(item);
            }
        }
        return eligible;
    }

    private PointOfContact choosePoc(Equipment equipment, Int2ObjectOpenHashMap<List<PointOfContact>> cache) {
        List<PointOfContact> pocs = cache.get(equipment.getId());
        if (pocs == null) {
            pocs = new ArrayList<>(StoreCalls.query("pocsOfEquipment", () -> catalog.pocsOfEquipment(equipment.getId())));
            pocs.sort(Comparator.comparingInt(PointOfContact::getId));
            cache.put(equipment.getId(), pocs);
        }
        if (pocs.isEmpty()) {
            return null;
        }
        if (config.isPreferUsedPocs()) {
            List<PointOfContact> used = new ArrayList<>();
            for (PointOfContact poc : pocs) {
                if (poc.isUsed()) {
                    used.add(poc);
                }
            }
            if (!used.isEmpty()) {
                return used.get(random.nextInt(used.size()));
            }
        }
        return pocs.get(random.nextInt(pocs.size()));
    }

    private RejectionReason screen(Equipment from, Equipment to, PointOfContact fromPoc, PointOfContact toPoc) {
        int minDistance = config.getMinDistanceBetweenNodes();
        int fromNode = fromPoc.getNodeId();
        int toNode = toPoc.getNodeId();
        if (Math.abs((long) fromNode - toNode) < minDistance) {
            return RejectionReason.PAIR_TOO_CLOSE;
        }
        RecencyBuffer recent = state.recentNodes();
        if (recent.isWithin(fromNode, minDistance) || recent.isWithin(toNode, minDistance)) {
            return RejectionReason.RECENTLY_SAMPLED;
        }
        if (state.wasAttempted(fromNode, toNode)) {
            return RejectionReason.REPEATED_PAIR;
        }
        if (hasUtility(fromPoc, toPoc)
                && state.utilityUsage(utilityOf(fromPoc, toPoc)) > 0
                && random.nextDouble() < config.getUtilityDiversityWeight()) {
            return RejectionReason.UTILITY_DIVERSITY;
        }
        boolean categorySeen = state.categoryUsage(from.getCategoryNo()) > 0
                || state.categoryUsage(to.getCategoryNo()) > 0;
        if (categorySeen && random.nextDouble() < config.getCategoryDiversityWeight()) {
            return RejectionReason.CATEGORY_DIVERSITY;
        }
        return null;
    }

    /**
     * Id distance, scaled up per unused PoC and down when the utilities differ.
     */
    private double estimateCost(PointOfContact fromPoc, PointOfContact toPoc) {
        double cost = Math.abs((long) fromPoc.getNodeId() - toPoc.getNodeId());
        if (!fromPoc.isUsed()) {
            cost *= config.getUnusedPocCostFactor();
        }
        if (!toPoc.isUsed()) {
            cost *= config.getUnusedPocCostFactor();
        }
        if (fromPoc.hasUtility() && toPoc.hasUtility() && !fromPoc.getUtilityNo().equals(toPoc.getUtilityNo())) {
            cost *= config.getCrossUtilityCostFactor();
        }
        return cost;
    }

    private static boolean hasUtility(PointOfContact fromPoc, PointOfContact toPoc) {
        return fromPoc.hasUtility() || toPoc.hasUtility();
    }

    /**
     * Utility of the pair, taken from the source PoC first. Callers check {@link #hasUtility} before.
     */
    private static int utilityOf(PointOfContact fromPoc, PointOfContact toPoc) {
        return fromPoc.hasUtility() ? fromPoc.getUtilityNo() : toPoc.getUtilityNo();
    }

    private void recordFailure() {
        state.recordFailure();
        if (state.consecutiveFailures() >= config.getMaxConsecutiveFailures()) {
            state.partialReset(config.getToolsetPartialDecrement(), config.getEquipmentPartialDecrement());
            log.warn(
                    "{} consecutive sampling failures, counters partially reset",
                    config.getMaxConsecutiveFailures()
            );
        }
    }
}
