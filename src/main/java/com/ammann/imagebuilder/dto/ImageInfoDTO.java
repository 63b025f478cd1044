package com.ammann.imagebuilder.dto;

import com.ammann.imagebuilder.model.BuildMode;

/**
 * Summary of a configured image definition.
 *
 * @param name the configured image name
 * @param from the base image
 * @param mode the build path the definition selects
 */
public record ImageInfoDTO(String name, String from, BuildMode mode) {}
