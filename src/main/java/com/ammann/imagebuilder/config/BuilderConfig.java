/* (C)2026 */
package com.ammann.imagebuilder.config;

import com.ammann.imagebuilder.system.SystemSettings;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Configuration mapping for the image builder, sourced from the {@code builder.*}
 * properties.
 */
@ConfigMapping(prefix = "builder")
public interface BuilderConfig {

    /** Image definitions keyed by image name. */
    Map<String, ImageConfig> images();

    /** Image of the helper container that archives volume data for persisting. */
    @WithName("extraction-image")
    @WithDefault(SystemSettings.DEFAULT_EXTRACTION_IMAGE)
    String extractionImage();

    /** Directory for build contexts and staged files; the system temp dir if unset. */
    @WithName("work-dir")
    Optional<String> workDir();

    /** Base directory that relative resource paths in image definitions resolve against. */
    @WithName("resource-root")
    @WithDefault(".")
    String resourceRoot();

    /** Wait after each termination signal when stopping a container. */
    @WithName("stop-timeout")
    @WithDefault("PT20S")
    Duration stopTimeout();

    default SystemSettings systemSettings() {
        return new SystemSettings(
                stopTimeout(), extractionImage(), workDir().map(Path::of).orElse(null));
    }

    default Path resolveResource(String source) {
        return Path.of(resourceRoot()).resolve(source).normalize();
    }
}
