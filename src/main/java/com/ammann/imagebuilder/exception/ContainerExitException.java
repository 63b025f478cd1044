/* (C)2026 */
package com.ammann.imagebuilder.exception;

import com.ammann.imagebuilder.engine.ContainerSnapshot;

/**
 * Thrown when a root or helper container exits with a non-zero status code.
 *
 * <p>Carries the exit code, the captured container output and the inspect snapshot taken
 * after the exit, so that the failure can be diagnosed after the container was removed.
 */
public class ContainerExitException extends BuildException {

    private final String containerName;
    private final int exitCode;
    private final String logs;
    private final ContainerSnapshot snapshot;

    /**
     * Constructs a new exception for a failed container.
     *
     * @param containerName the name of the container that exited
     * @param exitCode      the non-zero exit code
     * @param logs          the captured stdout/stderr, empty if unavailable
     * @param snapshot      the inspect snapshot, or {@code null} if the container vanished
     */
    public ContainerExitException(
            String containerName, int exitCode, String logs, ContainerSnapshot snapshot) {
        super(
                String.format(
                        "Container %s exited with code %d%n%nLogs:%n%s%n%nInspect:%n%s%n",
                        containerName, exitCode, logs, snapshot));
        this.containerName = containerName;
        this.exitCode = exitCode;
        this.logs = logs;
        this.snapshot = snapshot;
    }

    public String getContainerName() {
        return containerName;
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getLogs() {
        return logs;
    }

    public ContainerSnapshot getSnapshot() {
        return snapshot;
    }
}
