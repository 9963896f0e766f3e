package org.Fabnet.sampling;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntCollection;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectIterator;

/**
 * Mutable bias-reduction state of exactly one run.
 *
 * <p>Passed explicitly to {@link BiasedSampler}; build a fresh instance per run.</p>
 */
public final class BiasState {
    private final Int2IntOpenHashMap toolsetAttempts = new Int2IntOpenHashMap();
    private final Int2IntOpenHashMap equipmentAttempts = new Int2IntOpenHashMap();
    private final Int2IntOpenHashMap utilityUsage = new Int2IntOpenHashMap();
    private final Int2IntOpenHashMap categoryUsage = new Int2IntOpenHashMap();
    private final LongOpenHashSet attemptedPairs = new LongOpenHashSet();
    private final Object2IntOpenHashMap<RejectionReason> rejections = new Object2IntOpenHashMap<>();
    private final RecencyBuffer recentNodes;

    private int totalAttempts;
    private int successfulPairs;
    private int consecutiveFailures;
    private int resets;

    public BiasState(int recencyCapacity) {
        this.recentNodes = new RecencyBuffer(recencyCapacity);
    }

    public static BiasState forConfig(BiasConfig config) {
        return new BiasState(config.getRecencyCapacity());
    }

    public int toolsetAttempts(int toolsetId) {
        return toolsetAttempts.get(toolsetId);
    }

    public int equipmentAttempts(int equipmentId) {
        return equipmentAttempts.get(equipmentId);
    }

    public int utilityUsage(int utilityNo) {
        return utilityUsage.get(utilityNo);
    }

    public int categoryUsage(int categoryNo) {
        return categoryUsage.get(categoryNo);
    }

    public RecencyBuffer recentNodes() {
        return recentNodes;
    }

    public boolean wasAttempted(int nodeA, int nodeB) {
        return attemptedPairs.contains(pairKey(nodeA, nodeB));
    }

    public int rejections(RejectionReason reason) {
        return rejections.getInt(reason);
    }

    public int totalAttempts() {
        return totalAttempts;
    }

    public int successfulPairs() {
        return successfulPairs;
    }

    public int consecutiveFailures() {
        return consecutiveFailures;
    }

    public int resets() {
        return resets;
    }

    void recordToolsetDraw(int toolsetId) {
        toolsetAttempts.addTo(toolsetId, 1);
        totalAttempts++;
    }

    void recordRejection(RejectionReason reason) {
        rejections.addTo(reason, 1);
    }

    void recordFailure() {
        consecutiveFailures++;
    }

    void recordAcceptance(int equipmentA, int equipmentB, int categoryA, int categoryB, int nodeA, int nodeB) {
        equipmentAttempts.addTo(equipmentA, 1);
        equipmentAttempts.addTo(equipmentB, 1);
        categoryUsage.addTo(categoryA, 1);
        if (categoryB != categoryA) {
            categoryUsage.addTo(categoryB, 1);
        }
        attemptedPairs.add(pairKey(nodeA, nodeB));
        recentNodes.push(nodeA);
        recentNodes.push(nodeB);
        successfulPairs++;
        consecutiveFailures = 0;
    }

    /**
     * Counts an accepted pair against its utility. Pairs without any utility are not recorded.
     */
    void recordUtility(int utilityNo) {
        utilityUsage.addTo(utilityNo, 1);
    }

    /**
     * Lowers the toolset counters of {@code toolsetIds} by {@code amount}, never below zero.
     */
    void decrementToolsets(IntCollection toolsetIds, int amount) {
        for (int id : toolsetIds) {
            decrement(toolsetAttempts, id, amount);
        }
    }

    void decrementEquipment(IntCollection equipmentIds, int amount) {
        for (int id : equipmentIds) {
            decrement(equipmentAttempts, id, amount);
        }
    }

    /**
     * Lowers every toolset and equipment counter and clears the failure streak.
     */
    void partialReset(int toolsetAmount, int equipmentAmount) {
        decrementAll(toolsetAttempts, toolsetAmount);
        decrementAll(equipmentAttempts, equipmentAmount);
        consecutiveFailures = 0;
        resets++;
    }

    /**
     * Forgets everything, as at the start of a run.
     */
    public void reset() {
        toolsetAttempts.clear();
        equipmentAttempts.clear();
        utilityUsage.clear();
        categoryUsage.clear();
        attemptedPairs.clear();
        rejections.clear();
        recentNodes.clear();
        totalAttempts = 0;
        successfulPairs = 0;
        consecutiveFailures = 0;
        resets = 0;
    }

    SamplingStatistics snapshot(BiasConfig config) {
        return SamplingStatistics.builder()
                .totalAttempts(totalAttempts)
                .successfulPairs(successfulPairs)
                .consecutiveFailures(consecutiveFailures)
                .resets(resets)
                .toolsetsTracked(toolsetAttempts.size())
                .equipmentTracked(equipmentAttempts.size())
                .toolsetsAtCeiling(countAtLeast(toolsetAttempts, config.getMaxAttemptsPerToolset()))
                .equipmentAtCeiling(countAtLeast(equipmentAttempts, config.getMaxAttemptsPerEquipment()))
                .recentNodeCount(recentNodes.size())
                .utilityUsage(new Int2IntOpenHashMap(utilityUsage))
                .categoryUsage(new Int2IntOpenHashMap(categoryUsage))
                .rejections(new Object2IntOpenHashMap<>(rejections))
                .build();
    }

    static long pairKey(int nodeA, int nodeB) {
        int low = Math.min(nodeA, nodeB);
        int high = Math.max(nodeA, nodeB);
        return ((long) low << 32) | (high & 0xFFFFFFFFL);
    }

    private static void decrement(Int2IntOpenHashMap counters, int id, int amount) {
        int next = counters.get(id) - amount;
        if (next <= 0) {
            counters.remove(id);
        } else {
            counters.put(id, next);
        }
    }

    private static void decrementAll(Int2IntOpenHashMap counters, int amount) {
        ObjectIterator<Int2IntMap.Entry> iterator = counters.int2IntEntrySet().iterator();
        while (iterator.hasNext()) {
            Int2IntMap.Entry entry = iterator.next();
            int next = entry.getIntValue() - amount;
            if (next <= 0) {
                iterator.remove();
            } else {
                entry.setValue(next);
            }
        }
    }

    private static int countAtLeast(Int2IntOpenHashMap counters, int ceiling) {
        int count = 0;
        for (int value : counters.values()) {
            if (value >= ceiling) {
                count++;
            }
        }
        return count;
    }
}
