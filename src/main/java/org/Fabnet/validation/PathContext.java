package org.Fabnet.validation;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import lombok.Value;
import org.Fabnet.network.path.PathResult;

import java.util.Objects;

/**
 * Node and link sequence of one candidate path, as seen by validation tests.
 */
@Value
public class PathContext {
    long pathId;
    IntList nodeIds;
    IntList linkIds;

    private PathContext(long pathId, IntList nodeIds, IntList linkIds) {
        this.pathId = pathId;
        this.nodeIds = IntLists.unmodifiable(new IntArrayList(nodeIds));
        this.linkIds = IntLists.unmodifiable(new IntArrayList(linkIds));
    }

    public static PathContext of(long pathId, IntList nodeIds, IntList linkIds) {
        return new PathContext(
                pathId,
                Objects.requireNonNull(nodeIds, "nodeIds"),
                Objects.requireNonNull(linkIds, "linkIds")
        );
    }

    public static PathContext of(long pathId, int[] nodeIds, int[] linkIds) {
        return of(pathId, IntArrayList.wrap(nodeIds), IntArrayList.wrap(linkIds));
    }

    public static PathContext from(PathResult path) {
        Objects.requireNonNull(path, "path");
        return of(path.getPathId(), path.nodeIds(), path.linkIds());
    }

    public int nodeCount() {
        return nodeIds.size();
    }

    public int linkCount() {
        return linkIds.size();
    }
}
