package org.Fabnet.network.path;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Result of a single-target search. "Not found" is an expected outcome, not an exception.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class PathSearchOutcome {
    /**
     * Why no path was produced.
     */
    public enum NotFoundReason {
        NONE,
        SAME_AS_START,
        NOT_TRAVERSABLE,
        UNREACHABLE
    }

    private final PathResult path;
    private final NotFoundReason reason;

    public static PathSearchOutcome found(PathResult path) {
        return new PathSearchOutcome(Objects.requireNonNull(path, "path"), NotFoundReason.NONE);
    }

    public static PathSearchOutcome notFound(NotFoundReason reason) {
        if (Objects.requireNonNull(reason, "reason") == NotFoundReason.NONE) {
            throw new IllegalArgumentException("not-found outcome requires a reason");
        }
        return new PathSearchOutcome(null, reason);
    }

    public boolean isFound() {
        return path != null;
    }
}
