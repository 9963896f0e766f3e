package org.Fabnet.sampling;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Result of one {@link BiasedSampler#sample(SamplingScope)} call.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class SampleOutcome {
    /**
     * Why no pair was produced.
     */
    public enum NoPairReason {
        NONE,
        NO_CANDIDATES,
        ATTEMPTS_EXHAUSTED
    }

    private final SampledPair pair;
    private final NoPairReason reason;
    private final int attempts;

    static SampleOutcome found(SampledPair pair, int attempts) {
        return new SampleOutcome(Objects.requireNonNull(pair, "pair"), NoPairReason.NONE, attempts);
    }

    static SampleOutcome noPair(NoPairReason reason, int attempts) {
        return new SampleOutcome(null, reason, attempts);
    }

    public boolean isFound() {
        return pair != null;
    }
}
