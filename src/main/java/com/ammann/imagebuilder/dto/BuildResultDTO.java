package com.ammann.imagebuilder.dto;

import com.ammann.imagebuilder.model.BuildMode;
import java.util.List;

/**
 * Outcome of building one configured image.
 *
 * @param image          the configured image name
 * @param mode           the build path that was taken
 * @param producedImages the image tags written by the build
 * @param elapsedMs      wall-clock duration of the build in milliseconds
 */
public record BuildResultDTO(
        String image, BuildMode mode, List<String> producedImages, long elapsedMs) {}
