/* (C)2026 */
package com.ammann.imagebuilder.system;

import com.ammann.imagebuilder.container.Container;
import com.ammann.imagebuilder.container.ContainerSpec;
import com.ammann.imagebuilder.context.BuildContext;
import com.ammann.imagebuilder.context.HostDirectory;
import com.ammann.imagebuilder.engine.ContainerEngine;
import com.ammann.imagebuilder.engine.ContainerSnapshot;
import com.ammann.imagebuilder.exception.BuildException;
import com.ammann.imagebuilder.model.VolumeFromLink;
import com.ammann.imagebuilder.model.VolumeLink;
import java.util.List;
import java.util.function.Consumer;
import org.jboss.logging.Logger;

/**
 * Turns the volume data of a container into a new image.
 *
 * <p>A short-lived helper container mounts the source's volumes read-only and archives them
 * into a host directory. The archive is then unpacked at {@code /} on top of the source's
 * image.
 */
public class PersistenceExtractor {

    private static final Logger LOG = Logger.getLogger(PersistenceExtractor.class);

    static final String ARCHIVE_NAME = "extract.tar";

    private final ContainerEngine engine;
    private final SystemSettings settings;

    public PersistenceExtractor(ContainerEngine engine, SystemSettings settings) {
        this.engine = engine;
        this.settings = settings;
    }

    /**
     * Persists the volumes of {@code source} into {@code targetImage}.
     *
     * @param source      the container whose volumes are extracted
     * @param targetImage the tag of the image to build
     * @param tracker     receives the helper container before it is created, so the caller
     *                    can remove it later
     * @return the id of the built image
     * @throws BuildException if the source declares no volumes
     */
    public String persist(Container source, String targetImage, Consumer<Container> tracker) {
        List<String> volumePaths = volumePaths(source);
        if (volumePaths.isEmpty()) {
            throw new BuildException(
                    "Container " + source + " has no volumes to persist to " + targetImage);
        }
        LOG.infof("Persisting volumes %s of container %s to %s", volumePaths, source, targetImage);

        try (HostDirectory extractDir =
                HostDirectory.create(
                        settings.workDir(), "extract-", HostDirectory.randomImageRoot())) {
            ContainerSpec helperSpec =
                    new ContainerSpec(settings.extractionImage())
                            .detach(false)
                            .workingDir("/")
                            .addVolume(extractDir.path().toString(), extractDir.imageRoot(), false)
                            .addVolumeFrom(source.getName(), VolumeFromLink.Mode.RO)
                            .addCommand("tar", "-cf", extractDir.imagePath(ARCHIVE_NAME));
            for (String path : volumePaths) {
                helperSpec.addCommand(stripLeadingSlashes(path));
            }

            Container helper = new Container(helperSpec, engine, settings.stopTimeout());
            tracker.accept(helper);
            LOG.debugf("Extracting volume data of %s with helper %s", source, helper);
            helper.init();

            try (BuildContext context =
                    new BuildContext(targetImage, source.getImage(), settings.workDir())) {
                context.include(extractDir.path().resolve(ARCHIVE_NAME), "/", false);
                return context.build(engine);
            }
        }
    }

    /** Volume paths as reported by the engine, falling back to the declared volumes. */
    List<String> volumePaths(Container source) {
        List<String> reported =
                source.inspect().map(ContainerSnapshot::volumePaths).orElse(List.of());
        if (!reported.isEmpty()) {
            return reported;
        }
        return source.getSpec().getVolumes().stream().map(VolumeLink::containerPath).toList();
    }

    private static String stripLeadingSlashes(String path) {
        String stripped = path.replaceFirst("^/+", "");
        return stripped.isEmpty() ? "." : stripped;
    }
}
