package io.sigmatics.core.spec;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of descriptor validation. Holds every problem found, in discovery order, so callers can
 * report them together.
 */
public record ValidationResult(boolean valid, List<String> errors) {

    private static final ValidationResult OK = new ValidationResult(true, List.of());

    public ValidationResult {
        errors = List.copyOf(errors);
        if (valid != errors.isEmpty()) {
            throw new IllegalArgumentException("valid must be true exactly when there are no errors");
        }
    }

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult of(List<String> errors) {
        return errors.isEmpty() ? OK : new ValidationResult(false, errors);
    }

    /** Combines two results, keeping the errors of both. */
    public ValidationResult and(ValidationResult other) {
        if (other.valid) {
            return this;
        }
        if (valid) {
            return other;
        }
        List<String> merged = new ArrayList<>(errors);
        merged.addAll(other.errors);
        return new ValidationResult(false, merged);
    }
}
