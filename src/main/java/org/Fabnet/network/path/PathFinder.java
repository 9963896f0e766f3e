package org.Fabnet.network.path;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import lombok.extern.slf4j.Slf4j;
import org.Fabnet.network.NetworkAnalysisException;
import org.Fabnet.network.graph.Adjacency;
import org.Fabnet.network.graph.GraphView;
import org.Fabnet.network.graph.GraphViewLoader;
import org.Fabnet.network.graph.NetworkStore;
import org.Fabnet.network.graph.PathFilters;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Filtered path discovery over a per-session {@link GraphView}.
 *
 * <p>One instance owns at most one loaded view at a time and is not thread-safe; parallel runs
 * use separate instances.</p>
 */
@Slf4j
public final class PathFinder {
    private final GraphViewLoader loader;
    private final TraversalBudget budget;
    private GraphView view;

    public PathFinder(NetworkStore store) {
        this(store, TraversalBudget.defaults());
    }

    public PathFinder(NetworkStore store, TraversalBudget budget) {
        this.loader = new GraphViewLoader(Objects.requireNonNull(store, "store"));
        this.budget = Objects.requireNonNull(budget, "budget");
    }

    /**
     * Loads and retains the graph view used by subsequent traversals.
     */
    public GraphView load(int startNodeId, IntSet ignoreNodeIds, PathFilters filters) {
        this.view = loader.load(startNodeId, ignoreNodeIds, filters);
        return view;
    }

    public boolean isLoaded() {
        return view != null;
    }

    public GraphView graphView() {
        return requireView("graphView");
    }

    /**
     * Dispatches to the requested traversal mode.
     */
    public List<PathResult> findPaths(TraversalAlgorithm algorithm, IntSet targetCodes) {
        Objects.requireNonNull(algorithm, "algorithm");
        return switch (algorithm) {
            case DFS -> findAllPaths(targetCodes);
            case DIJKSTRA -> findShortestPaths(targetCodes);
        };
    }

    /**
     * Exhaustive depth-first search.
     *
     * <p>A path is emitted every time the current node is terminal. Exploration continues past
     * TARGET and BOUNDARY nodes and stops at LEAF nodes. Each branch keeps its own visited set,
     * so cycles are never followed.</p>
     */
    public List<PathResult> findAllPaths(IntSet targetCodes) {
        GraphView graph = requireView("findAllPaths");
        EndpointClassifier classifier = new EndpointClassifier(graph, Objects.requireNonNull(targetCodes, "targetCodes"));
        int start = graph.startNodeId();

        List<PathResult> results = new ArrayList<>();
        Deque<DfsFrame> work = new ArrayDeque<>();
        IntOpenHashSet onBranch = new IntOpenHashSet();
        List<PathStep> branch = new ArrayList<>();
        DoubleArrayList branchCost = new DoubleArrayList();
        branchCost.add(0.0d);
        long expansions = 0L;

        work.push(DfsFrame.start(start));
        while (!work.isEmpty()) {
            DfsFrame frame = work.pop();
            if (frame.kind() == DfsFrame.Kind.BACKTRACK) {
                onBranch.remove(frame.nodeId());
                if (frame.via() != null) {
                    branch.remove(branch.size() - 1);
                    branchCost.removeDouble(branchCost.size() - 1);
                }
                continue;
            }

            int nodeId = frame.nodeId();
            if (onBranch.contains(nodeId)) {
                continue;
            }
            budget.checkExpansions(++expansions);
            onBranch.add(nodeId);
            Adjacency via = frame.via();
            if (via != null) {
                branch.add(new PathStep(
                        branch.size() + 1, via.linkId(), frame.fromNodeId(), nodeId, via.cost(), via.reversed()
                ));
                branchCost.add(branchCost.getDouble(branchCost.size() - 1) + via.cost());
            }
            work.push(frame.backtrack());

            if (nodeId != start) {
                EndpointType type = classifier.classify(nodeId);
                if (type.isTerminal()) {
                    results.add(buildPath(results.size() + 1, start, nodeId, branchCost.getDouble(branchCost.size() - 1), type, branch));
                    budget.checkPathCount(results.size());
                    if (type == EndpointType.LEAF) {
                        continue;
                    }
                }
            }

            List<Adjacency> entries = graph.adjacency(nodeId);
            for (int i = entries.size() - 1; i >= 0; i--) {
                Adjacency entry = entries.get(i);
                if (graph.isTraversable(entry.neighborId()) && !onBranch.contains(entry.neighborId())) {
                    work.push(DfsFrame.visit(nodeId, entry));
                }
            }
        }

        log.debug("dfs from {} produced {} paths after {} expansions", start, results.size(), expansions);
        return results;
    }

    /**
     * Shortest path to each distinct endpoint.
     *
     * <p>Every settled node other than the start is classified once. Terminal nodes become
     * candidate endpoints and the search continues past them. Paths are emitted in settle order.</p>
     */
    public List<PathResult> findShortestPaths(IntSet targetCodes) {
        GraphView graph = requireView("findShortestPaths");
        EndpointClassifier classifier = new EndpointClassifier(graph, Objects.requireNonNull(targetCodes, "targetCodes"));
        int start = graph.startNodeId();
        ShortestPathTree tree = ShortestPathTree.grow(graph, budget);

        List<PathResult> results = new ArrayList<>();
        IntArrayList order = tree.settleOrder();
        for (int i = 0; i < order.size(); i++) {
            int nodeId = order.getInt(i);
            if (nodeId == start) {
                continue;
            }
            EndpointType type = classifier.classify(nodeId);
            if (!type.isTerminal()) {
                continue;
            }
            List<PathStep> steps = tree.stepsTo(nodeId);
            if (steps == null) {
                log.debug("endpoint {} has no predecessor chain back to {}, skipped", nodeId, start);
                continue;
            }
            results.add(buildPath(results.size() + 1, start, nodeId, tree.distance(nodeId), type, steps));
            budget.checkPathCount(results.size());
        }

        log.debug("dijkstra from {} settled {} nodes, {} endpoints", start, order.size(), results.size());
        return results;
    }

    /**
     * Shortest path from the loaded start node to one specific node.
     *
     * @return found outcome with the path, or a not-found outcome carrying the reason.
     */
    public PathSearchOutcome shortestPathTo(int targetNodeId) {
        GraphView graph = requireView("shortestPathTo");
        int start = graph.startNodeId();
        if (targetNodeId == start) {
            return PathSearchOutcome.notFound(PathSearchOutcome.NotFoundReason.SAME_AS_START);
        }
        if (!graph.isTraversable(targetNodeId)) {
            return PathSearchOutcome.notFound(PathSearchOutcome.NotFoundReason.NOT_TRAVERSABLE);
        }
        ShortestPathTree tree = ShortestPathTree.grow(graph, budget, targetNodeId);
        List<PathStep> steps = tree.stepsTo(targetNodeId);
        if (steps == null) {
            log.debug("no path from {} to {}", start, targetNodeId);
            return PathSearchOutcome.notFound(PathSearchOutcome.NotFoundReason.UNREACHABLE);
        }
        EndpointType type = new EndpointClassifier(graph, TargetCodes.none()).classify(targetNodeId);
        return PathSearchOutcome.found(buildPath(1, start, targetNodeId, tree.distance(targetNodeId), type, steps));
    }

    /**
     * Flags every node of every path for persistence.
     */
    public Map<NodeFlagKey, NodeFlag> analyzeNodeFlags(List<PathResult> paths) {
        requireView("analyzeNodeFlags");
        return NodeFlagAnalyzer.analyze(paths);
    }

    private static PathResult buildPath(
            int pathId,
            int start,
            int end,
            double totalCost,
            EndpointType type,
            List<PathStep> steps
    ) {
        return PathResult.builder()
                .pathId(pathId)
                .startNodeId(start)
                .endNodeId(end)
                .totalCost(totalCost)
                .endpointType(type)
                .steps(steps)
                .build();
    }

    private GraphView requireView(String operation) {
        if (view == null) {
            throw NetworkAnalysisException.graphNotLoaded(operation);
        }
        return view;
    }
}
