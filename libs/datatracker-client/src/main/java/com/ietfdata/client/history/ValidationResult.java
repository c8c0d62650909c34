package com.ietfdata.client.history;

import java.util.List;

/**
 * Result of checking a {@link Timeline} for consistency.
 *
 * @param valid  true if no problems were found
 * @param errors human-readable descriptions of the problems (empty when valid)
 */
public record ValidationResult(boolean valid, List<String> errors) {

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, List.copyOf(errors));
    }
}
