/* (C)2026 */
package com.ammann.imagebuilder.exception;

/**
 * Base runtime exception for failures while building an image.
 *
 * <p>Subclasses describe the specific failure class (malformed specification, non-zero
 * container exit, engine failure, ...). {@link BuildExceptionMapper} maps each of them
 * to an HTTP status.
 */
public class BuildException extends RuntimeException {

    public BuildException(String message) {
        super(message);
    }

    public BuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
