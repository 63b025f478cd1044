/* (C)2026 */
package com.ammann.imagebuilder.context;

import com.ammann.imagebuilder.engine.ContainerEngine;
import com.ammann.imagebuilder.exception.BuildException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jboss.logging.Logger;

/**
 * Assembles a build context directory with a generated {@code Dockerfile} and builds it.
 *
 * <p>Resources added through {@link #include} are copied into the context and added with
 * {@code ADD}; a local tar archive added to {@code /} is unpacked by the engine. Consecutive
 * {@link #workdir} calls with the same directory produce a single instruction.
 */
public class BuildContext implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(BuildContext.class);

    static final String DOCKERFILE = "Dockerfile";

    private final String imageName;
    private final HostDirectory directory;
    private final List<String> instructions = new ArrayList<>();
    private String currentWorkdir;

    /**
     * Creates an empty context.
     *
     * @param imageName the tag of the image to build
     * @param baseImage the image to build on
     * @param workDir   where to create the context directory, {@code null} for the temp dir
     */
    public BuildContext(String imageName, String baseImage, Path workDir) {
        this.imageName = Objects.requireNonNull(imageName, "imageName");
        Objects.requireNonNull(baseImage, "baseImage");
        this.directory = HostDirectory.create(workDir, "context-", null);
        instructions.add("FROM " + baseImage);
    }

    public BuildContext maintainer(String maintainer) {
        instructions.add("MAINTAINER " + maintainer);
        return this;
    }

    public BuildContext expose(String port) {
        instructions.add("EXPOSE " + port);
        return this;
    }

    public BuildContext volume(String path) {
        instructions.add("VOLUME " + path);
        return this;
    }

    public BuildContext env(String key, String value) {
        instructions.add("ENV " + key + "=" + quote(value));
        return this;
    }

    public BuildContext workdir(String dir) {
        if (!dir.equals(currentWorkdir)) {
            instructions.add("WORKDIR " + dir);
            currentWorkdir = dir;
        }
        return this;
    }

    public BuildContext run(String command) {
        instructions.add("RUN " + command);
        return this;
    }

    public BuildContext entrypoint(String path) {
        instructions.add("ENTRYPOINT [" + quote(path) + "]");
        return this;
    }

    /**
     * Copies a host file or directory into the context and adds it to the image.
     *
     * @param source      the host path
     * @param destination the path inside the image
     * @param executable  whether the file is made executable
     */
    public BuildContext include(Path source, String destination, boolean executable) {
        String relative = directory.include(source, executable);
        instructions.add("ADD " + relative + " " + destination);
        return this;
    }

    /** Returns the {@code Dockerfile} text generated so far. */
    public String dockerfile() {
        return String.join("\n", instructions) + "\n";
    }

    /**
     * Writes the {@code Dockerfile} and builds the image.
     *
     * @return the id of the built image
     */
    public String build(ContainerEngine engine) {
        try {
            Files.writeString(
                    directory.path().resolve(DOCKERFILE), dockerfile(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new BuildException("Unable to write Dockerfile for image " + imageName, e);
        }
        LOG.infof("Building image %s", imageName);
        LOG.debugf("Dockerfile for %s:%n%s", imageName, dockerfile());
        String imageId = engine.build(directory.path(), imageName);
        LOG.infof("Built image %s (%s)", imageName, imageId);
        return imageId;
    }

    public Path directory() {
        return directory.path();
    }

    public String imageName() {
        return imageName;
    }

    @Override
    public void close() {
        directory.close();
    }

    private static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
