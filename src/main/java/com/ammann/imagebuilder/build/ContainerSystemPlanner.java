/* (C)2026 */
package com.ammann.imagebuilder.build;

import com.ammann.imagebuilder.config.BuilderConfig;
import com.ammann.imagebuilder.config.ImageConfig;
import com.ammann.imagebuilder.container.CallbackRegistry;
import com.ammann.imagebuilder.container.ContainerSpec;
import com.ammann.imagebuilder.exception.DependencyException;
import com.ammann.imagebuilder.model.Env;
import com.ammann.imagebuilder.model.VolumeFromLink;
import com.ammann.imagebuilder.spec.Disposition;
import com.ammann.imagebuilder.spec.LinkSpec;
import com.ammann.imagebuilder.spec.ResourcePaths;
import com.ammann.imagebuilder.spec.SpecParser;
import com.ammann.imagebuilder.spec.VolumeFromSpec;
import com.ammann.imagebuilder.system.ContainerSystemSpec;
import com.ammann.imagebuilder.system.FileInclude;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Translates a configured image into a {@link ContainerSystemSpec}.
 *
 * <p>The root container runs the configured base image to completion. Each {@code
 * volumes_from} entry adds a non-detached auxiliary whose volumes the root mounts
 * read-write; each {@code links} entry adds a detached auxiliary reachable under its alias.
 * A dependency image that is itself configured with {@code volumes_from} or {@code links}
 * brings its own dependencies along.
 */
@ApplicationScoped
public class ContainerSystemPlanner {

    @Inject Logger logger;

    @Inject BuilderConfig builderConfig;

    @Inject CallbackRegistry callbackRegistry;

    /**
     * Plans the container system for an image.
     *
     * @param imageName the configured image name, also the tag a root commit produces
     * @param image     the image definition
     * @param extraEnv  additional {@code KEY=VALUE} entries for the root container
     * @return the system specification, not yet validated for dependency order
     */
    public ContainerSystemSpec plan(String imageName, ImageConfig image, List<String> extraEnv) {
        logger.infof("Planning container system for %s", imageName);
        ContainerSpec root = new ContainerSpec(image.from()).detach(false);
        ContainerSystemSpec system = new ContainerSystemSpec(root);

        if (image.commit().orElse(false)) {
            logger.debugf("Root container %s will be committed to %s", root.getName(), imageName);
            system.rootDisposition(Disposition.commit(imageName));
        }

        if (image.entrypoint().isPresent()) {
            ResourcePaths paths =
                    SpecParser.parseDirSpec(image.entrypoint().get(), "entrypoint", imageName);
            root.workingDir(paths.destDir()).entrypoint(paths.destPath());
            system.include(include(root, paths, true));
        }

        List<String> envSpecs = new ArrayList<>(SpecParser.optionalPlural(image.envs()));
        envSpecs.addAll(extraEnv);
        for (String envSpec : envSpecs) {
            Env env = SpecParser.parseEnv(envSpec, "env", imageName);
            root.addEnv(env);
        }

        for (String libSpec : SpecParser.optionalPlural(image.libs())) {
            ResourcePaths paths = SpecParser.parseDirSpec(libSpec, "lib", imageName);
            system.include(include(root, paths, false));
        }

        for (String callbackSpec : SpecParser.optionalPlural(image.callbacks())) {
            root.addCallback(
                    SpecParser.parseCallback(
                            callbackSpec, "callback", imageName, callbackRegistry));
        }

        LinkedHashSet<String> path = new LinkedHashSet<>();
        path.add(imageName);
        attachDependencies(system, root, imageName, image, path);
        return system;
    }

    private void attachDependencies(
            ContainerSystemSpec system,
            ContainerSpec dependent,
            String imageName,
            ImageConfig image,
            LinkedHashSet<String> path) {

        for (String volumeSpec : SpecParser.optionalPlural(image.volumesFrom())) {
            VolumeFromSpec volumeFrom =
                    SpecParser.parseVolumeFromSpec(volumeSpec, "volume_from", imageName);
            ContainerSpec auxiliary = new ContainerSpec(volumeFrom.image()).detach(false);
            logger.debugf(
                    "Container %s will have volumes from container %s (%s)",
                    dependent.getName(), auxiliary.getName(), volumeFrom.disposition());
            dependent.addVolumeFrom(auxiliary.getName(), VolumeFromLink.Mode.RW);
            system.addAuxiliary(auxiliary, volumeFrom.disposition());
            attachNested(system, auxiliary, volumeFrom.image(), path);
        }

        for (String linkSpec : SpecParser.optionalPlural(image.links())) {
            LinkSpec link = SpecParser.parseLinkSpec(linkSpec, "link", imageName);
            ContainerSpec auxiliary = new ContainerSpec(link.image()).detach(true);
            logger.debugf(
                    "Container %s will be linked to container %s as %s (%s)",
                    dependent.getName(), auxiliary.getName(), link.alias(), link.disposition());
            dependent.addLink(auxiliary.getName(), link.alias());
            system.addAuxiliary(auxiliary, link.disposition());
            attachNested(system, auxiliary, link.image(), path);
        }
    }

    private void attachNested(
            ContainerSystemSpec system,
            ContainerSpec auxiliary,
            String dependencyImage,
            LinkedHashSet<String> path) {
        ImageConfig nested = builderConfig.images().get(dependencyImage);
        if (nested == null || (nested.volumesFrom().isEmpty() && nested.links().isEmpty())) {
            return;
        }
        if (path.contains(dependencyImage)) {
            throw new DependencyException(
                    "Dependency cycle between image definitions: "
                            + String.join(" -> ", path)
                            + " -> "
                            + dependencyImage);
        }
        path.add(dependencyImage);
        attachDependencies(system, auxiliary, dependencyImage, nested, path);
        path.remove(dependencyImage);
    }

    private FileInclude include(ContainerSpec target, ResourcePaths paths, boolean executable) {
        return new FileInclude(
                target.getName(),
                builderConfig.resolveResource(paths.sourcePath()),
                paths.destPath(),
                executable);
    }
}
