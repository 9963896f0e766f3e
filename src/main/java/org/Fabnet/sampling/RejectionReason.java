package org.Fabnet.sampling;

/**
 * Why a candidate pair was turned down. Rejections never count as toolset or equipment attempts.
 */
public enum RejectionReason {
    MISSING_POC,
    PAIR_TOO_CLOSE,
    RECENTLY_SAMPLED,
    REPEATED_PAIR,
    UTILITY_DIVERSITY,
    CATEGORY_DIVERSITY
}
