package com.codelens.core.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Output of the structure validator phase.
 *
 * <p>The verdict is derived: {@link SyntaxVerdict#INCORRECT} iff {@code errors} is non-empty.
 *
 * @param errors structural errors in emission order
 * @param elapsed wall-clock time spent validating (diagnostic only)
 */
public record StructureReport(
    List<StructureError> errors,
    Duration elapsed
) {
    /**
     * Compact constructor copying the collections.
     */
    public StructureReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
        elapsed = Objects.requireNonNullElse(elapsed, Duration.ZERO);
    }

    public SyntaxVerdict verdict() {
        return errors.isEmpty() ? SyntaxVerdict.CORRECT : SyntaxVerdict.INCORRECT;
    }

    public boolean isCorrect() {
        return verdict() == SyntaxVerdict.CORRECT;
    }

    /**
     * Returns the error messages in emission order.
     *
     * @return error messages
     */
    public List<String> messages() {
        return errors.stream().map(StructureError::message).toList();
    }
}
