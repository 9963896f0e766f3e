package org.Fabnet.validation;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable validation finding, persisted by the caller.
 */
@Value
@Builder
public class ValidationError {
    /**
     * Code of the test that produced the finding, for example {@code CONN_002}.
     */
    String testCode;

    Severity severity;
    ValidationScope scope;
    ErrorKind kind;
    ObjectType objectType;
    long objectId;

    /**
     * External guid of the object, empty when unknown.
     */
    @Builder.Default
    String objectGuid = "";

    String message;

    public boolean isBlocking() {
        return severity.isBlocking();
    }
}
