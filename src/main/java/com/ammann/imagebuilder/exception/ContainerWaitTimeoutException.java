/* (C)2026 */
package com.ammann.imagebuilder.exception;

import java.time.Duration;

/**
 * Thrown when waiting for a container to exit does not finish within the given timeout.
 *
 * <p>Distinct from {@link ContainerExitException}: the container may still be running.
 */
public class ContainerWaitTimeoutException extends BuildException {

    private final String containerName;
    private final Duration timeout;

    public ContainerWaitTimeoutException(String containerName, Duration timeout) {
        super("Timed out after " + timeout + " waiting for container " + containerName);
        this.containerName = containerName;
        this.timeout = timeout;
    }

    public String getContainerName() {
        return containerName;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
