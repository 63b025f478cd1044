/* (C)2026 */
package com.ammann.imagebuilder.build;

import com.ammann.imagebuilder.config.BuilderConfig;
import com.ammann.imagebuilder.config.ImageConfig;
import com.ammann.imagebuilder.context.BuildContext;
import com.ammann.imagebuilder.dto.BuildResultDTO;
import com.ammann.imagebuilder.dto.ImageInfoDTO;
import com.ammann.imagebuilder.engine.ContainerEngine;
import com.ammann.imagebuilder.exception.UnknownImageException;
import com.ammann.imagebuilder.model.BuildMode;
import com.ammann.imagebuilder.model.Env;
import com.ammann.imagebuilder.spec.ResourcePaths;
import com.ammann.imagebuilder.spec.SpecParser;
import com.ammann.imagebuilder.system.ContainerSystem;
import com.ammann.imagebuilder.system.ContainerSystemSpec;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.jboss.logging.Logger;

/**
 * Builds configured images.
 *
 * <p>Images are built one after another in the requested order; the first failure ends the
 * batch and images produced before it remain. Each image takes the container-system path if
 * it configures {@code volumes_from}, {@code links} or {@code commit}, and the {@code
 * Dockerfile} path otherwise.
 */
@ApplicationScoped
public class ImageBuildService {

    @Inject Logger logger;

    @Inject ContainerEngine engine;

    @Inject BuilderConfig builderConfig;

    @Inject ContainerSystemPlanner planner;

    /**
     * Builds a batch of images.
     *
     * @param images   configured image names; a repeated name is built again
     * @param extraEnv {@code KEY=VALUE} entries added to every image
     * @return one result per image, in order
     * @throws UnknownImageException if a name has no definition; nothing is built then
     */
    public List<BuildResultDTO> buildImages(List<String> images, List<String> extraEnv) {
        List<Map.Entry<String, ImageConfig>> definitions = new ArrayList<>();
        for (String image : images) {
            ImageConfig definition = builderConfig.images().get(image);
            if (definition == null) {
                throw new UnknownImageException(image);
            }
            definitions.add(Map.entry(image, definition));
        }

        int count = definitions.size();
        logger.infof("Building %d image%s", count, count == 1 ? "" : "s");
        engine.ping();

        List<BuildResultDTO> results = new ArrayList<>();
        for (Map.Entry<String, ImageConfig> entry : definitions) {
            results.add(buildImage(entry.getKey(), entry.getValue(), extraEnv));
        }
        logger.info("Done");
        return results;
    }

    /** Lists the configured image definitions by name. */
    public List<ImageInfoDTO> listImages() {
        return builderConfig.images().entrySet().stream()
                .sorted(Map.Entry.comparingByKey(Comparator.naturalOrder()))
                .map(e -> new ImageInfoDTO(e.getKey(), e.getValue().from(), modeOf(e.getValue())))
                .toList();
    }

    public static BuildMode modeOf(ImageConfig image) {
        return image.isContainerSystem() ? BuildMode.CONTAINER_SYSTEM : BuildMode.DOCKERFILE;
    }

    BuildResultDTO buildImage(String imageName, ImageConfig image, List<String> extraEnv) {
        logger.debugf("Processing image %s", imageName);
        long start = System.nanoTime();
        BuildMode mode = modeOf(image);
        List<String> produced =
                mode == BuildMode.CONTAINER_SYSTEM
                        ? buildContainerSystem(imageName, image, extraEnv)
                        : buildFromDockerfile(imageName, image, extraEnv);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        logger.infof("Built %s in %d ms, produced %s", imageName, elapsedMs, produced);
        return new BuildResultDTO(imageName, mode, produced, elapsedMs);
    }

    List<String> buildContainerSystem(String imageName, ImageConfig image, List<String> extraEnv) {
        ContainerSystemSpec spec = planner.plan(imageName, image, extraEnv);
        return new ContainerSystem(engine, spec, builderConfig.systemSettings()).run();
    }

    List<String> buildFromDockerfile(String imageName, ImageConfig image, List<String> extraEnv) {
        logger.infof("Generating files for %s", imageName);
        try (BuildContext context =
                new BuildContext(
                        imageName, image.from(), builderConfig.systemSettings().workDir())) {
            populate(context, imageName, image, extraEnv);
            context.build(engine);
        }
        return List.of(imageName);
    }

    void populate(
            BuildContext context, String imageName, ImageConfig image, List<String> extraEnv) {
        image.maintainer().ifPresent(context::maintainer);

        SpecParser.optionalPlural(image.exposes()).forEach(context::expose);
        SpecParser.optionalPlural(image.volumes()).forEach(context::volume);

        for (String libSpec : SpecParser.optionalPlural(image.libs())) {
            ResourcePaths paths = SpecParser.parseDirSpec(libSpec, "lib", imageName);
            context.include(
                    builderConfig.resolveResource(paths.sourcePath()), paths.destPath(), false);
        }

        List<String> envSpecs = new ArrayList<>(SpecParser.optionalPlural(image.envs()));
        envSpecs.addAll(extraEnv);
        for (String envSpec : envSpecs) {
            Env env = SpecParser.parseEnv(envSpec, "env", imageName);
            context.env(env.key(), env.value());
        }

        for (String runSpec : SpecParser.optionalPlural(image.runs())) {
            ResourcePaths paths = SpecParser.parseDirSpec(runSpec, "run", imageName);
            context.include(
                    builderConfig.resolveResource(paths.sourcePath()), paths.destPath(), true);
            context.workdir(paths.destDir());
            context.run(paths.destPath());
        }

        if (image.entrypoint().isPresent()) {
            ResourcePaths paths =
                    SpecParser.parseDirSpec(image.entrypoint().get(), "entrypoint", imageName);
            context.include(
                    builderConfig.resolveResource(paths.sourcePath()), paths.destPath(), true);
            context.workdir(paths.destDir());
            context.entrypoint(paths.destPath());
        }
    }
}
