package com.ammann.imagebuilder.engine;

import com.ammann.imagebuilder.model.NetworkLink;
import com.ammann.imagebuilder.model.VolumeFromLink;
import com.ammann.imagebuilder.model.VolumeLink;
import java.util.List;

/**
 * Host-level settings of a container: capabilities, bind mounts, links and volumes-from.
 *
 * @param capAdd      capabilities to add
 * @param capDrop     capabilities to drop
 * @param binds       volumes bound to host paths
 * @param links       network links to other containers
 * @param volumesFrom containers whose volumes are mounted
 */
public record HostSettings(
        List<String> capAdd,
        List<String> capDrop,
        List<VolumeLink> binds,
        List<NetworkLink> links,
        List<VolumeFromLink> volumesFrom) {

    public HostSettings {
        capAdd = List.copyOf(capAdd);
        capDrop = List.copyOf(capDrop);
        binds = List.copyOf(binds);
        links = List.copyOf(links);
        volumesFrom = List.copyOf(volumesFrom);
    }

    public static HostSettings empty() {
        return new HostSettings(List.of(), List.of(), List.of(), List.of(), List.of());
    }
}
