package com.codelens.core.model;

/**
 * Outcome categories of the execution collaborator.
 */
public enum ExecutionStatus {
    /** Compiled and ran with exit code 0 */
    SUCCESS("Execution Success"),

    /** The compiler rejected the source */
    COMPILATION_ERROR("Compilation Error"),

    /** The program exited with a non-zero code */
    RUNTIME_ERROR("Runtime Error"),

    /** Execution not attempted because structure validation failed */
    INCORRECT_SYNTAX("Incorrect Syntax"),

    /** Execution disabled by configuration */
    SKIPPED("Execution Skipped"),

    /** Compiler or program exceeded the configured timeout */
    TIMED_OUT("Execution Timed Out"),

    /** The collaborator could not be invoked at all */
    UNAVAILABLE("Execution Unavailable");

    private final String label;

    ExecutionStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
