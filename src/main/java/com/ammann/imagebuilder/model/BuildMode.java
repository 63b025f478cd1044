/* (C)2026 */
package com.ammann.imagebuilder.model;

/** How an image is produced. */
public enum BuildMode {
    /** From a generated {@code Dockerfile}. */
    DOCKERFILE,
    /** By running a root container with auxiliary containers and snapshotting the result. */
    CONTAINER_SYSTEM
}
