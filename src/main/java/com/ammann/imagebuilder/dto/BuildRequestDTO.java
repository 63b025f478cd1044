package com.ammann.imagebuilder.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/**
 * Request body for building a batch of configured images.
 *
 * @param images the configured image names, built in order
 * @param env    extra {@code KEY=VALUE} environment entries applied to every image, may be
 *               {@code null}
 */
public record BuildRequestDTO(
        @NotEmpty(message = "At least one image is required") List<@NotBlank String> images,
        List<@NotBlank String> env) {

    public List<String> envOrEmpty() {
        return env == null ? List.of() : env;
    }
}
