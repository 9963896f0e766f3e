package org.Fabnet.network;

import lombok.Getter;

import java.util.Objects;

/**
 * Structural failure of a network-analysis operation, tagged with a deterministic reason code.
 *
 * <p>Per-path semantic problems are never reported through this type; they are returned as
 * validation data instead.</p>
 */
@Getter
public final class NetworkAnalysisException extends RuntimeException {
    public static final String REASON_INVALID_CONFIGURATION = "INVALID_CONFIGURATION";
    public static final String REASON_GRAPH_NOT_LOADED = "GRAPH_NOT_LOADED";
    public static final String REASON_BACKING_STORE_UNAVAILABLE = "BACKING_STORE_UNAVAILABLE";
    public static final String REASON_UNKNOWN_RUN = "UNKNOWN_RUN";
    public static final String REASON_COVERAGE_NOT_INITIALIZED = "COVERAGE_NOT_INITIALIZED";

    private final String reasonCode;

    /**
     * Creates a reason-coded analysis failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public NetworkAnalysisException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded analysis failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public NetworkAnalysisException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    public static NetworkAnalysisException invalidConfiguration(String message) {
        return new NetworkAnalysisException(REASON_INVALID_CONFIGURATION, message);
    }

    public static NetworkAnalysisException graphNotLoaded(String operation) {
        return new NetworkAnalysisException(
                REASON_GRAPH_NOT_LOADED,
                operation + " invoked before a graph view was loaded"
        );
    }

    public static NetworkAnalysisException storeUnavailable(String operation, Throwable cause) {
        return new NetworkAnalysisException(
                REASON_BACKING_STORE_UNAVAILABLE,
                "backing store failed during " + operation,
                cause
        );
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
