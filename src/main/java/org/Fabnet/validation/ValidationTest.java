package org.Fabnet.validation;

import org.Fabnet.network.graph.NetworkStore;

/**
 * One check of the validation battery.
 *
 * <p>Implementations only read the store and only write to the supplied findings.</p>
 */
public interface ValidationTest {

    /**
     * Stable test code, stamped on every finding the test emits.
     */
    String code();

    ValidationScope scope();

    void run(PathContext path, NetworkStore store, ValidationFindings findings);

    /**
     * Starts an error pre-filled with this test's code and scope.
     */
    default ValidationError.ValidationErrorBuilder error(Severity severity, ErrorKind kind) {
        return ValidationError.builder()
                .testCode(code())
                .scope(scope())
                .severity(severity)
                .kind(kind);
    }
}
