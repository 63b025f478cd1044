/* (C)2026 */
package com.ammann.imagebuilder.engine;

import com.ammann.imagebuilder.exception.BuildException;
import com.ammann.imagebuilder.exception.ContainerWaitTimeoutException;
import com.ammann.imagebuilder.exception.EngineException;
import com.ammann.imagebuilder.model.NetworkLink;
import com.ammann.imagebuilder.model.VolumeFromLink;
import com.ammann.imagebuilder.model.VolumeLink;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.BuildImageResultCallback;
import com.github.dockerjava.api.command.CreateContainerCmd;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.command.WaitContainerResultCallback;
import com.github.dockerjava.api.exception.ConflictException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.BuildResponseItem;
import com.github.dockerjava.api.model.Capability;
import com.github.dockerjava.api.model.ContainerConfig;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Link;
import com.github.dockerjava.api.model.Volume;
import com.github.dockerjava.api.model.VolumesFrom;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.jboss.logging.Logger;

/**
 * {@link ContainerEngine} backed by the Docker remote API through docker-java.
 *
 * <p>Docker's 404 and 409 responses are translated into {@link EngineResult} outcomes where
 * the lifecycle treats them as normal. Everything else is wrapped into an {@link
 * EngineException} naming the failed action; when the daemon itself is unreachable the
 * message carries a hint on how to reach it.
 *
 * <p>Host settings are applied at create time, the only point at which current Docker API
 * versions accept them.
 */
@ApplicationScoped
public class DockerContainerEngine implements ContainerEngine {

    private static final String DOCKER_HINT =
            "Ensure Docker is running and that the process can access the Docker socket "
                    + "(for example /var/run/docker.sock) or an explicit docker.host.";

    static final String DOCKERFILE = "Dockerfile";

    @Inject DockerClient dockerClient;

    @Inject Logger logger;

    @Override
    public EngineResult<String> create(CreateRequest request) {
        HostConfig hostConfig = toHostConfig(request.hostSettings());
        try {
            CreateContainerCmd createCmd =
                    dockerClient
                            .createContainerCmd(request.image())
                            .withName(request.name())
                            .withHostConfig(hostConfig);
            if (request.entrypoint() != null) {
                createCmd.withEntrypoint(request.entrypoint());
            }
            if (request.workingDir() != null) {
                createCmd.withWorkingDir(request.workingDir());
            }
            if (!request.env().isEmpty()) {
                createCmd.withEnv(request.env());
            }
            if (!request.command().isEmpty()) {
                createCmd.withCmd(request.command());
            }
            if (!request.volumePaths().isEmpty()) {
                createCmd.withVolumes(
                        request.volumePaths().stream().map(Volume::new).toArray(Volume[]::new));
            }
            String id = createCmd.exec().getId();
            logger.debugf("Engine created container %s (%s)", request.name(), id);
            return EngineResult.ok(id);
        } catch (ConflictException e) {
            return EngineResult.alreadyExists();
        } catch (RuntimeException e) {
            throw translate("create container " + request.name(), e);
        }
    }

    @Override
    public EngineResult<Void> start(String name) {
        try {
            dockerClient.startContainerCmd(name).exec();
            return EngineResult.ok();
        } catch (NotModifiedException e) {
            logger.debugf("Container %s is already running", name);
            return EngineResult.ok();
        } catch (NotFoundException e) {
            return EngineResult.notFound();
        } catch (RuntimeException e) {
            throw translate("start container " + name, e);
        }
    }

    @Override
    public EngineResult<Void> signal(String name, SignalKind signal) {
        try {
            dockerClient.killContainerCmd(name).withSignal(signal.signalName()).exec();
            return EngineResult.ok();
        } catch (ConflictException e) {
            // Docker answers 409 when the container is not running
            logger.debugf("Container %s is not running, %s not delivered", name, signal);
            return EngineResult.ok();
        } catch (NotFoundException e) {
            return EngineResult.notFound();
        } catch (RuntimeException e) {
            throw translate("signal container " + name, e);
        }
    }

    @Override
    public EngineResult<Integer> waitForExit(String name, Duration timeout) {
        WaitContainerResultCallback callback = null;
        try {
            callback = dockerClient.waitContainerCmd(name).exec(new WaitContainerResultCallback());
            if (timeout != null
                    && !callback.awaitCompletion(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                close(callback, name);
                throw new ContainerWaitTimeoutException(name, timeout);
            }
            Integer statusCode = callback.awaitStatusCode();
            return EngineResult.ok(statusCode != null ? statusCode : -1);
        } catch (NotFoundException e) {
            return EngineResult.notFound();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close(callback, name);
            throw new EngineException("Interrupted while waiting for container " + name, e);
        } catch (RuntimeException e) {
            throw translate("wait for container " + name, e);
        }
    }

    @Override
    public EngineResult<Void> remove(String name, boolean force) {
        try {
            dockerClient.removeContainerCmd(name).withForce(force).withRemoveVolumes(true).exec();
            return EngineResult.ok();
        } catch (NotFoundException e) {
            return EngineResult.notFound();
        } catch (RuntimeException e) {
            throw translate("remove container " + name, e);
        }
    }

    @Override
    public EngineResult<ContainerSnapshot> inspect(String name) {
        try {
            return EngineResult.ok(toSnapshot(dockerClient.inspectContainerCmd(name).exec()));
        } catch (NotFoundException e) {
            return EngineResult.notFound();
        } catch (RuntimeException e) {
            throw translate("inspect container " + name, e);
        }
    }

    @Override
    public EngineResult<String> logs(String name) {
        StringBuilder logs = new StringBuilder();
        ResultCallback.Adapter<Frame> callback =
                new ResultCallback.Adapter<>() {
                    @Override
                    public void onNext(Frame frame) {
                        logs.append(new String(frame.getPayload(), StandardCharsets.UTF_8));
                    }
                };
        try {
            dockerClient.logContainerCmd(name).withStdOut(true).withStdErr(true).exec(callback);
            callback.awaitCompletion();
            return EngineResult.ok(logs.toString());
        } catch (NotFoundException e) {
            return EngineResult.notFound();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineException("Interrupted while fetching logs of container " + name, e);
        } catch (RuntimeException e) {
            throw translate("fetch logs of container " + name, e);
        }
    }

    @Override
    public String commit(String name, String targetTag) {
        ImageTag imageTag = ImageTag.parse(targetTag);
        try {
            String imageId =
                    dockerClient
                            .commitCmd(name)
                            .withRepository(imageTag.repository())
                            .withTag(imageTag.tag())
                            .exec();
            logger.debugf("Committed container %s as %s (%s)", name, targetTag, imageId);
            return imageId;
        } catch (RuntimeException e) {
            throw translate("commit container " + name + " to " + targetTag, e);
        }
    }

    @Override
    public String build(Path contextDirectory, String tag) {
        BuildImageResultCallback callback =
                new BuildImageResultCallback() {
                    @Override
                    public void onNext(BuildResponseItem item) {
                        String stream = item.getStream();
                        if (stream != null && !stream.isBlank()) {
                            logger.debugf("[%s] %s", tag, stream.stripTrailing());
                        }
                        super.onNext(item);
                    }
                };
        try {
            dockerClient
                    .buildImageCmd()
                    .withBaseDirectory(contextDirectory.toFile())
                    .withDockerfile(contextDirectory.resolve(DOCKERFILE).toFile())
                    .withTags(Set.of(tag))
                    .exec(callback);
            return callback.awaitImageId();
        } catch (RuntimeException e) {
            throw translate("build image " + tag, e);
        }
    }

    @Override
    public void ping() {
        try {
            dockerClient.pingCmd().exec();
        } catch (RuntimeException e) {
            throw translate("ping the container engine", e);
        }
    }

    HostConfig toHostConfig(HostSettings settings) {
        HostConfig hostConfig = HostConfig.newHostConfig();
        if (!settings.capAdd().isEmpty()) {
            hostConfig.withCapAdd(toCapabilities(settings.capAdd()));
        }
        if (!settings.capDrop().isEmpty()) {
            hostConfig.withCapDrop(toCapabilities(settings.capDrop()));
        }
        if (!settings.binds().isEmpty()) {
            hostConfig.withBinds(
                    settings.binds().stream()
                            .filter(VolumeLink::isBind)
                            .map(DockerContainerEngine::toBind)
                            .toArray(Bind[]::new));
        }
        if (!settings.links().isEmpty()) {
            hostConfig.withLinks(
                    settings.links().stream()
                            .map(DockerContainerEngine::toLink)
                            .toArray(Link[]::new));
        }
        if (!settings.volumesFrom().isEmpty()) {
            hostConfig.withVolumesFrom(
                    settings.volumesFrom().stream()
                            .map(DockerContainerEngine::toVolumesFrom)
                            .toArray(VolumesFrom[]::new));
        }
        return hostConfig;
    }

    static ContainerSnapshot toSnapshot(InspectContainerResponse response) {
        InspectContainerResponse.ContainerState state = response.getState();
        boolean running = state != null && Boolean.TRUE.equals(state.getRunning());
        Long pid = state != null ? state.getPidLong() : null;
        Long exitCode = state != null ? state.getExitCodeLong() : null;
        String startedAt = state != null ? state.getStartedAt() : null;

        String name = response.getName();
        if (name != null && name.startsWith("/")) {
            name = name.substring(1);
        }
        ContainerConfig config = response.getConfig();
        String image = config != null ? config.getImage() : response.getImageId();

        return new ContainerSnapshot(
                response.getId(),
                name,
                image,
                running,
                pid != null ? pid : 0L,
                startedAt,
                exitCode != null ? exitCode.intValue() : null,
                volumePaths(response));
    }

    private static List<String> volumePaths(InspectContainerResponse response) {
        List<String> paths = new ArrayList<>();
        List<InspectContainerResponse.Mount> mounts = response.getMounts();
        if (mounts != null) {
            for (InspectContainerResponse.Mount mount : mounts) {
                if (mount.getDestination() != null) {
                    paths.add(mount.getDestination().getPath());
                }
            }
        }
        ContainerConfig config = response.getConfig();
        if (paths.isEmpty() && config != null && config.getVolumes() != null) {
            paths.addAll(config.getVolumes().keySet());
        }
        return paths;
    }

    private static Capability[] toCapabilities(List<String> names) {
        return names.stream()
                .map(
                        name -> {
                            String normalized = name.strip().toUpperCase(Locale.ROOT);
                            if (normalized.startsWith("CAP_")) {
                                normalized = normalized.substring(4);
                            }
                            try {
                                return Capability.valueOf(normalized);
                            } catch (IllegalArgumentException e) {
                                throw new BuildException("Unknown capability: " + name, e);
                            }
                        })
                .toArray(Capability[]::new);
    }

    private static Bind toBind(VolumeLink volume) {
        return new Bind(
                volume.hostPath(),
                new Volume(volume.containerPath()),
                volume.readOnly() ? AccessMode.ro : AccessMode.rw);
    }

    private static Link toLink(NetworkLink link) {
        return new Link(link.containerName(), link.alias());
    }

    private static VolumesFrom toVolumesFrom(VolumeFromLink volumeFrom) {
        return new VolumesFrom(
                volumeFrom.containerName(),
                volumeFrom.isReadOnly() ? AccessMode.ro : AccessMode.rw);
    }

    private void close(ResultCallback<?> callback, String name) {
        if (callback == null) {
            return;
        }
        try {
            callback.close();
        } catch (IOException e) {
            logger.debugf("Error closing wait callback for container %s: %s", name, e.getMessage());
        }
    }

    private RuntimeException translate(String action, RuntimeException e) {
        if (e instanceof BuildException) {
            return e;
        }
        if (isDockerUnavailable(e)) {
            return new EngineException(
                    "Unable to "
                            + action
                            + " because the Docker daemon is unavailable. "
                            + DOCKER_HINT,
                    e);
        }
        return new EngineException("Unable to " + action + ": " + e.getMessage(), e);
    }

    private static boolean isDockerUnavailable(Throwable throwable) {
        for (Throwable t = throwable; t != null; t = t.getCause()) {
            if (t instanceof ConnectException
                    || t instanceof NoRouteToHostException
                    || t instanceof UnknownHostException
                    || t instanceof NoSuchFileException) {
                return true;
            }
        }
        return false;
    }

    /** Splits {@code repository[:tag]}, keeping a registry port inside the repository part. */
    record ImageTag(String repository, String tag) {

        static ImageTag parse(String reference) {
            int colon = reference.lastIndexOf(':');
            int slash = reference.lastIndexOf('/');
            if (colon > slash && colon < reference.length() - 1) {
                return new ImageTag(reference.substring(0, colon), reference.substring(colon + 1));
            }
            return new ImageTag(reference, "latest");
        }
    }
}
