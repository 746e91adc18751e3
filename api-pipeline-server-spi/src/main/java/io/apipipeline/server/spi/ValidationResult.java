package io.apipipeline.server.spi;

import java.util.List;

/**
 * Output of {@link ValidationSchema#validate(Object)}.
 */
public record ValidationResult<T>(T value, List<Violation> violations) {

    public ValidationResult {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public static <T> ValidationResult<T> valid(T value) {
        return new ValidationResult<>(value, List.of());
    }

    public static <T> ValidationResult<T> invalid(T value, List<Violation> violations) {
        return new ValidationResult<>(value, violations);
    }

    public boolean isValid() {
        return violations.isEmpty();
    }
}
