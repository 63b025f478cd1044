package com.ammann.imagebuilder.model;

import java.util.Objects;

/**
 * A volume mounted into a container.
 *
 * @param hostPath      the host directory or file to bind, {@code null} for an engine-managed
 *                      anonymous volume
 * @param containerPath the mount point inside the container
 * @param readOnly      whether the bind is read-only
 */
public record VolumeLink(String hostPath, String containerPath, boolean readOnly) {

    public VolumeLink {
        Objects.requireNonNull(containerPath, "containerPath");
    }

    /** Returns {@code true} if the volume is bound to a host path. */
    public boolean isBind() {
        return hostPath != null;
    }

    @Override
    public String toString() {
        String base = isBind() ? hostPath + ":" + containerPath : containerPath;
        return readOnly ? base + ":ro" : base;
    }
}
