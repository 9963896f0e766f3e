package org.Fabnet.validation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Findings of one validation run over one path.
 */
@Value
@Builder
public class ValidationReport {
    long pathId;

    @Singular
    List<ValidationError> errors;

    @Singular
    List<ReviewFlag> flags;

    /**
     * Returns error counts keyed by severity; severities without errors are absent.
     */
    public Map<Severity, Integer> countsBySeverity() {
        EnumMap<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (ValidationError error : errors) {
            counts.merge(error.getSeverity(), 1, Integer::sum);
        }
        return counts;
    }

    public int count(Severity severity) {
        int count = 0;
        for (ValidationError error : errors) {
            if (error.getSeverity() == severity) {
                count++;
            }
        }
        return count;
    }

    public boolean hasBlockingErrors() {
        for (ValidationError error : errors) {
            if (error.isBlocking()) {
                return true;
            }
        }
        return false;
    }

    /**
     * A path is valid when no CRITICAL or ERROR finding was raised.
     */
    public boolean isValid() {
        return !hasBlockingErrors();
    }

    public List<ValidationError> errorsOf(String testCode) {
        return errors.stream().filter(error -> error.getTestCode().equals(testCode)).toList();
    }
}
