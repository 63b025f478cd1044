/* (C)2026 */
package com.ammann.imagebuilder.exception;

/**
 * Thrown for any container engine failure other than the tolerated not-found and
 * already-exists outcomes.
 *
 * <p>Always fatal. Callers propagate it unmodified.
 */
public class EngineException extends BuildException {

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
