package com.codelens.core.execution;

import com.codelens.core.model.ExecutionOutcome;

/**
 * External collaborator that compiles and runs analyzed source code.
 *
 * <p>The analysis pipeline treats the outcome as opaque and only decides whether to call
 * the service, based on the structure validator's verdict.
 */
public interface ExecutionService {

    /**
     * Compiles and runs the source.
     *
     * @param source complete compilation unit
     * @param entryPoint name of the class to save the source as and to run
     * @return success with stdout, compilation/runtime error with diagnostics, or timeout
     * @throws CollaboratorUnavailableException if the compiler or runtime cannot be invoked
     */
    ExecutionOutcome execute(String source, String entryPoint);
}
