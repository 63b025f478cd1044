package com.ammann.imagebuilder.engine;

import java.util.List;

/**
 * Everything the engine needs to create a container.
 *
 * @param name         the unique container name
 * @param image        the image reference
 * @param entrypoint   the entrypoint override, {@code null} to keep the image's entrypoint
 * @param workingDir   the working directory override, {@code null} to keep the image's
 * @param env          environment entries in {@code KEY=VALUE} form
 * @param command      the command, empty to keep the image's command
 * @param volumePaths  container paths of all declared volumes
 * @param hostSettings capabilities, binds, links and volumes-from
 */
public record CreateRequest(
        String name,
        String image,
        String entrypoint,
        String workingDir,
        List<String> env,
        List<String> command,
        List<String> volumePaths,
        HostSettings hostSettings) {

    public CreateRequest {
        env = List.copyOf(env);
        command = List.copyOf(command);
        volumePaths = List.copyOf(volumePaths);
    }
}
