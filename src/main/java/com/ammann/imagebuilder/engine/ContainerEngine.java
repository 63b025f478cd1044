/* (C)2026 */
package com.ammann.imagebuilder.engine;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Capability surface of the container engine consumed by the builder.
 *
 * <p>Calls whose "not found" or "already exists" outcome is part of normal lifecycle
 * handling return an {@link EngineResult}. Every other failure raises an {@link
 * com.ammann.imagebuilder.exception.EngineException}.
 */
public interface ContainerEngine {

    /**
     * Creates a container.
     *
     * @return the container id, or {@code ALREADY_EXISTS} if the name is taken
     */
    EngineResult<String> create(CreateRequest request);

    /** Starts a created container. */
    EngineResult<Void> start(String name);

    /** Sends a termination signal to a running container. */
    EngineResult<Void> signal(String name, SignalKind signal);

    /**
     * Blocks until the container exits.
     *
     * @param timeout the maximum time to wait, {@code null} to wait indefinitely
     * @return the exit code
     * @throws com.ammann.imagebuilder.exception.ContainerWaitTimeoutException if the timeout
     *     elapsed first
     */
    EngineResult<Integer> waitForExit(String name, Duration timeout);

    /** Removes a container, killing it first if {@code force} is set. */
    EngineResult<Void> remove(String name, boolean force);

    EngineResult<ContainerSnapshot> inspect(String name);

    /** Returns the combined stdout/stderr output of the container. */
    EngineResult<String> logs(String name);

    /**
     * Snapshots a container's filesystem into a new image.
     *
     * @return the new image id
     */
    String commit(String name, String targetTag);

    /**
     * Builds an image from a context directory containing a {@code Dockerfile}.
     *
     * @return the new image id
     */
    String build(Path contextDirectory, String tag);

    /** Verifies that the engine is reachable. */
    void ping();
}
