package com.ammann.imagebuilder.spec;

/**
 * Resolved form of a volume-from specification such as {@code data:latest then discard}.
 *
 * @param image       the image of the container supplying the volumes
 * @param disposition either {@code discard} or {@code persist}
 */
public record VolumeFromSpec(String image, Disposition disposition) {}
