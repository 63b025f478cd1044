/* (C)2026 */
package com.ammann.imagebuilder.system;

import java.nio.file.Path;

/**
 * Host file or directory made visible read-only inside one container of a system.
 *
 * @param containerName the container that receives the file
 * @param source        the host path
 * @param destination   the path inside the container
 * @param executable    whether the staged copy is made executable
 */
public record FileInclude(
        String containerName, Path source, String destination, boolean executable) {}
