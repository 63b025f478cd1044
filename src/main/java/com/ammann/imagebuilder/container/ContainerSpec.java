/* (C)2026 */
package com.ammann.imagebuilder.container;

import com.ammann.imagebuilder.model.Env;
import com.ammann.imagebuilder.model.NetworkLink;
import com.ammann.imagebuilder.model.VolumeFromLink;
import com.ammann.imagebuilder.model.VolumeLink;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Declarative description of one container: what to run and how it is wired to other
 * containers.
 *
 * <p>Every instance owns its own lists; they are never shared between specs. The name
 * defaults to the image's base name followed by a short random suffix.
 */
public class ContainerSpec {

    private final String image;
    private final String name;
    private boolean detach = true;
    private String entrypoint;
    private String workingDir;
    private boolean runOnce;
    private final List<String> addCapabilities = new ArrayList<>();
    private final List<String> dropCapabilities = new ArrayList<>();
    private final List<Env> envs = new ArrayList<>();
    private final List<String> commands = new ArrayList<>();
    private final List<EventCallback> callbacks = new ArrayList<>();
    private final List<VolumeLink> volumes = new ArrayList<>();
    private final List<VolumeFromLink> volumesFrom = new ArrayList<>();
    private final List<NetworkLink> links = new ArrayList<>();

    public ContainerSpec(String image) {
        this(image, null);
    }

    public ContainerSpec(String image, String name) {
        this.image = Objects.requireNonNull(image, "image");
        this.name = name != null ? name : randomName(image);
    }

    /**
     * Generates a container name from the image's base name and a random suffix, e.g. {@code
     * base.1a2b3c4d} for {@code registry.local/base:latest}.
     */
    public static String randomName(String image) {
        String withoutTag = image;
        int colon = withoutTag.lastIndexOf(':');
        if (colon > withoutTag.lastIndexOf('/')) {
            withoutTag = withoutTag.substring(0, colon);
        }
        String baseName = withoutTag.substring(withoutTag.lastIndexOf('/') + 1);
        String sanitized = baseName.replaceAll("[^a-zA-Z0-9_.-]", "-");
        if (sanitized.isEmpty() || !Character.isLetterOrDigit(sanitized.charAt(0))) {
            sanitized = "c" + sanitized;
        }
        return sanitized + "." + UUID.randomUUID().toString().substring(0, 8);
    }

    /** Names of the containers this one depends on through links and volumes-from. */
    public Set<String> dependencyNames() {
        Set<String> names = new LinkedHashSet<>();
        links.forEach(link -> names.add(link.containerName()));
        volumesFrom.forEach(volumeFrom -> names.add(volumeFrom.containerName()));
        return names;
    }

    public ContainerSpec detach(boolean detach) {
        this.detach = detach;
        return this;
    }

    public ContainerSpec entrypoint(String entrypoint) {
        this.entrypoint = entrypoint;
        return this;
    }

    public ContainerSpec workingDir(String workingDir) {
        this.workingDir = workingDir;
        return this;
    }

    public ContainerSpec runOnce(boolean runOnce) {
        this.runOnce = runOnce;
        return this;
    }

    public ContainerSpec addCapability(String capability) {
        addCapabilities.add(capability);
        return this;
    }

    public ContainerSpec dropCapability(String capability) {
        dropCapabilities.add(capability);
        return this;
    }

    public ContainerSpec addEnv(String key, String value) {
        envs.add(new Env(key, value));
        return this;
    }

    public ContainerSpec addEnv(Env env) {
        envs.add(env);
        return this;
    }

    public ContainerSpec addCommand(String... arguments) {
        commands.addAll(List.of(arguments));
        return this;
    }

    public ContainerSpec addCallback(EventCallback callback) {
        callbacks.add(callback);
        return this;
    }

    public ContainerSpec addVolume(VolumeLink volume) {
        volumes.add(volume);
        return this;
    }

    public ContainerSpec addVolume(String hostPath, String containerPath, boolean readOnly) {
        return addVolume(new VolumeLink(hostPath, containerPath, readOnly));
    }

    public ContainerSpec addVolumeFrom(String containerName, VolumeFromLink.Mode mode) {
        volumesFrom.add(new VolumeFromLink(containerName, mode));
        return this;
    }

    public ContainerSpec addLink(String containerName, String alias) {
        links.add(new NetworkLink(containerName, alias));
        return this;
    }

    public String getImage() {
        return image;
    }

    public String getName() {
        return name;
    }

    public boolean isDetach() {
        return detach;
    }

    public String getEntrypoint() {
        return entrypoint;
    }

    public String getWorkingDir() {
        return workingDir;
    }

    public boolean isRunOnce() {
        return runOnce;
    }

    public List<String> getAddCapabilities() {
        return addCapabilities;
    }

    public List<String> getDropCapabilities() {
        return dropCapabilities;
    }

    public List<Env> getEnvs() {
        return envs;
    }

    public List<String> getCommands() {
        return commands;
    }

    public List<EventCallback> getCallbacks() {
        return callbacks;
    }

    public List<VolumeLink> getVolumes() {
        return volumes;
    }

    public List<VolumeFromLink> getVolumesFrom() {
        return volumesFrom;
    }

    public List<NetworkLink> getLinks() {
        return links;
    }

    @Override
    public String toString() {
        return name + " (" + image + ")";
    }
}
