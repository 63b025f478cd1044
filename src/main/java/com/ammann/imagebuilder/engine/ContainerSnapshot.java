/* (C)2026 */
package com.ammann.imagebuilder.engine;

import java.util.List;

/**
 * Engine-reported state of a container at the time of an inspect call.
 *
 * @param id          the engine identifier
 * @param name        the container name, without the leading slash
 * @param image       the image the container was created from
 * @param running     whether the container process is running
 * @param pid         the process id, {@code 0} if not running
 * @param startedAt   the engine start timestamp, {@link #NEVER_STARTED} if never started
 * @param exitCode    the last exit code, {@code null} if unknown
 * @param volumePaths the container paths of all mounted volumes
 */
public record ContainerSnapshot(
        String id,
        String name,
        String image,
        boolean running,
        long pid,
        String startedAt,
        Integer exitCode,
        List<String> volumePaths) {

    /** Start timestamp the engine reports for a container that was never started. */
    public static final String NEVER_STARTED = "0001-01-01T00:00:00Z";

    public ContainerSnapshot {
        volumePaths = volumePaths == null ? List.of() : List.copyOf(volumePaths);
    }

    /** Returns {@code true} once the engine has recorded a start of this container. */
    public boolean hasStarted() {
        return startedAt != null && !startedAt.isBlank() && !NEVER_STARTED.equals(startedAt);
    }
}
