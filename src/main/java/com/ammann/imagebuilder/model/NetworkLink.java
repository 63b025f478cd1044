package com.ammann.imagebuilder.model;

import java.util.Objects;

/**
 * Makes one container reachable from another under an alias.
 *
 * @param containerName the linked container
 * @param alias         the host name visible inside the dependent container
 */
public record NetworkLink(String containerName, String alias) {

    public NetworkLink {
        Objects.requireNonNull(containerName, "containerName");
        Objects.requireNonNull(alias, "alias");
    }

    @Override
    public String toString() {
        return containerName + ":" + alias;
    }
}
