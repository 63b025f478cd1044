package com.ammann.imagebuilder.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Grants a container access to the volumes of another container.
 *
 * @param containerName the container supplying the volumes
 * @param mode          read-only or read-write access
 */
public record VolumeFromLink(String containerName, Mode mode) {

    public enum Mode {
        RO,
        RW;

        /** Parses {@code ro} / {@code rw}, returning {@code null} for anything else. */
        public static Mode fromText(String text) {
            if (text == null) {
                return null;
            }
            String normalized = text.strip().toLowerCase(Locale.ROOT);
            for (Mode mode : values()) {
                if (mode.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                    return mode;
                }
            }
            return null;
        }
    }

    public VolumeFromLink {
        Objects.requireNonNull(containerName, "containerName");
        Objects.requireNonNull(mode, "mode");
    }

    public boolean isReadOnly() {
        return mode == Mode.RO;
    }

    @Override
    public String toString() {
        return containerName + ":" + mode.name().toLowerCase(Locale.ROOT);
    }
}
