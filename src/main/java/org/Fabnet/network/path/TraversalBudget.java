package org.Fabnet.network.path;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Optional bounds on traversal output and work.
 *
 * <p>A bound {@code <= 0} means unbounded. DFS checks the budget at the top of its work loop,
 * Dijkstra on every settled node.</p>
 */
@Getter
@Accessors(fluent = true)
public final class TraversalBudget {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public static final String REASON_PATHS_EXCEEDED = "TRAVERSAL_PATHS_EXCEEDED";
    public static final String REASON_EXPANSIONS_EXCEEDED = "TRAVERSAL_EXPANSIONS_EXCEEDED";

    static final String PROP_MAX_PATHS = "fabnet.traversal.maxPaths";
    static final String PROP_MAX_EXPANSIONS = "fabnet.traversal.maxExpansions";

    private static final TraversalBudget UNBOUNDED_BUDGET = new TraversalBudget(UNBOUNDED, UNBOUNDED);

    private final int maxPaths;
    private final int maxExpansions;

    private TraversalBudget(int maxPaths, int maxExpansions) {
        this.maxPaths = normalizeBound(maxPaths);
        this.maxExpansions = normalizeBound(maxExpansions);
    }

    /**
     * Creates a budget with explicit bounds.
     */
    public static TraversalBudget of(int maxPaths, int maxExpansions) {
        return new TraversalBudget(maxPaths, maxExpansions);
    }

    public static TraversalBudget unbounded() {
        return UNBOUNDED_BUDGET;
    }

    /**
     * Loads bounds from {@code fabnet.traversal.*} system properties.
     */
    public static TraversalBudget defaults() {
        return of(readBound(PROP_MAX_PATHS), readBound(PROP_MAX_EXPANSIONS));
    }

    void checkPathCount(int pathCount) {
        if (pathCount > maxPaths) {
            throw new BudgetExceededException(
                    REASON_PATHS_EXCEEDED,
                    "path budget exceeded: " + pathCount + " > " + maxPaths
            );
        }
    }

    void checkExpansions(long expansions) {
        if (expansions > maxExpansions) {
            throw new BudgetExceededException(
                    REASON_EXPANSIONS_EXCEEDED,
                    "expansion budget exceeded: " + expansions + " > " + maxExpansions
            );
        }
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    private static int readBound(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return UNBOUNDED;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return UNBOUNDED;
        }
    }

    /**
     * Raised when a traversal runs past its budget.
     */
    public static final class BudgetExceededException extends RuntimeException {
        private final String reasonCode;

        BudgetExceededException(String reasonCode, String message) {
            super(message);
            this.reasonCode = reasonCode;
        }

        public String reasonCode() {
            return reasonCode;
        }
    }
}
