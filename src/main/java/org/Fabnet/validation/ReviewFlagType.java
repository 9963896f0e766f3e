package org.Fabnet.validation;

/**
 * Out-of-band anomalies that need a human look but do not invalidate a path.
 */
public enum ReviewFlagType {
    UNUSED_POC,
    LOOPBACK_POC
}
