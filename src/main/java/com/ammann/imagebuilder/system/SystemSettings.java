/* (C)2026 */
package com.ammann.imagebuilder.system;

import com.ammann.imagebuilder.container.Container;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Settings shared by every container of a container system.
 *
 * @param stopTimeout     wait after each termination signal during teardown
 * @param extractionImage image of the helper container that archives volume data
 * @param workDir         where host directories are created, {@code null} for the temp dir
 */
public record SystemSettings(Duration stopTimeout, String extractionImage, Path workDir) {

    public static final String DEFAULT_EXTRACTION_IMAGE = "busybox:latest";

    public SystemSettings {
        Objects.requireNonNull(stopTimeout, "stopTimeout");
        Objects.requireNonNull(extractionImage, "extractionImage");
    }

    public static SystemSettings defaults() {
        return new SystemSettings(
                Container.DEFAULT_STOP_TIMEOUT, DEFAULT_EXTRACTION_IMAGE, null);
    }
}
