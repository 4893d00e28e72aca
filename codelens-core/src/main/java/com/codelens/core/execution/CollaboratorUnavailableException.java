package com.codelens.core.execution;

/**
 * Thrown when an external collaborator (compiler, runtime, graph renderer) cannot be invoked.
 *
 * <p>Distinct from a collaborator that ran and reported a failure: a compilation error is
 * a result, a missing {@code javac} binary is this exception. The pipeline catches it and
 * records {@link #getMessage()} as a collaborator failure of the analysis result.
 */
public class CollaboratorUnavailableException extends RuntimeException {

    /** Name of the collaborator that could not be invoked, e.g. "execution" or "visualization". */
    private final String collaborator;

    /**
     * @param collaborator collaborator name
     * @param message detailed error message
     * @param cause underlying failure, may be null
     */
    public CollaboratorUnavailableException(String collaborator, String message, Throwable cause) {
        super(message, cause);
        this.collaborator = collaborator;
    }

    public CollaboratorUnavailableException(String collaborator, String message) {
        this(collaborator, message, null);
    }

    public String getCollaborator() {
        return collaborator;
    }
}
