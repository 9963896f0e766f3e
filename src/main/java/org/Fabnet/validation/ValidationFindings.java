package org.Fabnet.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Append-only collector handed to each validation test.
 */
public final class ValidationFindings {
    private final List<ValidationError> errors = new ArrayList<>();
    private final List<ReviewFlag> flags = new ArrayList<>();

    public void add(ValidationError error) {
        errors.add(Objects.requireNonNull(error, "error"));
    }

    public void flag(ReviewFlag flag) {
        flags.add(Objects.requireNonNull(flag, "flag"));
    }

    public List<ValidationError> errors() {
        return Collections.unmodifiableList(errors);
    }

    public List<ReviewFlag> flags() {
        return Collections.unmodifiableList(flags);
    }
}
