package org.Fabnet.validation;

/**
 * Severity of a validation finding.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL,
    WARNING,
    ERROR;

    /**
     * CRITICAL and ERROR findings block a path; every other level is informational.
     */
    public boolean isBlocking() {
        return this == CRITICAL || this == ERROR;
    }
}
