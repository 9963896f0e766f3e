package org.Fabnet.validation;

import lombok.Builder;
import lombok.Value;

/**
 * Review-queue entry raised during validation.
 */
@Value
@Builder
public class ReviewFlag {
    /**
     * Review lifecycle; the core only ever creates open flags.
     */
    public enum Status {
        OPEN,
        ACKNOWLEDGED,
        RESOLVED
    }

    ReviewFlagType flagType;
    Severity severity;
    String reason;
    ObjectType objectType;
    long objectId;

    @Builder.Default
    String objectGuid = "";

    @Builder.Default
    Status status = Status.OPEN;
}
