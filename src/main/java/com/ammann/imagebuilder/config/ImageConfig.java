/* (C)2026 */
package com.ammann.imagebuilder.config;

import io.smallrye.config.WithName;
import java.util.Optional;

/**
 * Definition of one buildable image, read from {@code builder.images.<name>.*}.
 *
 * <p>Plural options hold one entry per line. Setting any of {@code volumes_from}, {@code
 * links} or {@code commit} selects the container-system build; otherwise the image is built
 * from a generated {@code Dockerfile}.
 */
public interface ImageConfig {

    /** The base image. */
    String from();

    Optional<String> maintainer();

    /** {@code SOURCE in DIR} or {@code SOURCE at PATH}. */
    Optional<String> entrypoint();

    Optional<String> libs();

    Optional<String> runs();

    Optional<String> exposes();

    Optional<String> volumes();

    Optional<String> envs();

    /** {@code IMAGE then discard} or {@code IMAGE then persist to TARGET}, one per line. */
    @WithName("volumes_from")
    Optional<String> volumesFrom();

    /** {@code IMAGE alias ALIAS then discard} or {@code ... then commit to TARGET}. */
    Optional<String> links();

    /** Commits the root container to the image name after a successful run. */
    Optional<Boolean> commit();

    /** Root container callbacks, {@code phase_event:handler} per line. */
    Optional<String> callbacks();

    default boolean isContainerSystem() {
        return volumesFrom().isPresent() || links().isPresent() || commit().isPresent();
    }
}
