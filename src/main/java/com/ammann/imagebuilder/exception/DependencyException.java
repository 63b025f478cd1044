/* (C)2026 */
package com.ammann.imagebuilder.exception;

/**
 * Thrown when the containers of a container system do not form a valid dependency graph:
 * unknown references, cycles, or duplicate container names.
 */
public class DependencyException extends BuildException {

    public DependencyException(String message) {
        super(message);
    }
}
