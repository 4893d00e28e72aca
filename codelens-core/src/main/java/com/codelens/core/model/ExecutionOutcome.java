package com.codelens.core.model;

import java.util.Objects;

/**
 * Status and output text reported for the execution of the analyzed source.
 *
 * @param status outcome category
 * @param output program stdout on success, diagnostics otherwise; never null
 */
public record ExecutionOutcome(
    ExecutionStatus status,
    String output
) {
    /**
     * Compact constructor with validation.
     */
    public ExecutionOutcome {
        Objects.requireNonNull(status, "status must not be null");
        output = output == null ? "" : output;
    }

    public static ExecutionOutcome success(String stdout) {
        return new ExecutionOutcome(ExecutionStatus.SUCCESS, stdout);
    }

    public static ExecutionOutcome compilationError(String message) {
        return new ExecutionOutcome(ExecutionStatus.COMPILATION_ERROR, message);
    }

    public static ExecutionOutcome runtimeError(String message) {
        return new ExecutionOutcome(ExecutionStatus.RUNTIME_ERROR, message);
    }

    public static ExecutionOutcome skipped() {
        return new ExecutionOutcome(ExecutionStatus.SKIPPED, "");
    }

    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }
}
