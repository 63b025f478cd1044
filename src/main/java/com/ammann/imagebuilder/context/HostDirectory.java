/* (C)2026 */
package com.ammann.imagebuilder.context;

import com.ammann.imagebuilder.exception.BuildException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.jboss.logging.Logger;

/**
 * Temporary directory on the build host whose contents are handed to containers or to an
 * image build.
 *
 * <p>When bind-mounted into a container the directory appears at {@link #imageRoot()}.
 * Closing the directory deletes it with all of its contents.
 */
public final class HostDirectory implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(HostDirectory.class);

    private static final Set<PosixFilePermission> EXECUTE =
            EnumSet.of(
                    PosixFilePermission.OWNER_EXECUTE,
                    PosixFilePermission.GROUP_EXECUTE,
                    PosixFilePermission.OTHERS_EXECUTE);

    private final Path path;
    private final String imageRoot;
    private int resourceCount;

    private HostDirectory(Path path, String imageRoot) {
        this.path = path;
        this.imageRoot = imageRoot;
    }

    /**
     * Creates a new, empty host directory.
     *
     * @param parent    the directory to create it in, {@code null} for the system temp directory
     * @param prefix    the directory name prefix
     * @param imageRoot the mount point used inside containers, may be {@code null}
     */
    public static HostDirectory create(Path parent, String prefix, String imageRoot) {
        try {
            Path path;
            if (parent != null) {
                Files.createDirectories(parent);
                path = Files.createTempDirectory(parent, prefix);
            } else {
                path = Files.createTempDirectory(prefix);
            }
            LOG.debugf("Created host directory %s", path);
            return new HostDirectory(path.toAbsolutePath(), imageRoot);
        } catch (IOException e) {
            throw new BuildException("Unable to create host directory with prefix " + prefix, e);
        }
    }

    /** Returns a random mount point such as {@code /1a2b3c4d}. */
    public static String randomImageRoot() {
        return "/" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Copies a file or directory into a fresh sub directory.
     *
     * @param source     the file or directory to copy
     * @param executable whether copied regular files are made executable
     * @return the path of the copy relative to this directory, using {@code /} separators
     */
    public String include(Path source, boolean executable) {
        if (!Files.exists(source)) {
            throw new BuildException("Resource does not exist: " + source);
        }
        String relative = "res-" + (++resourceCount) + "/" + source.getFileName();
        Path target = path.resolve(relative);
        try {
            Files.createDirectories(target.getParent());
            if (Files.isDirectory(source)) {
                copyTree(source, target, executable);
            } else {
                copyFile(source, target, executable);
            }
        } catch (IOException e) {
            throw new BuildException("Unable to stage " + source + " into " + path, e);
        }
        LOG.debugf("Included %s as %s", source, target);
        return relative;
    }

    /** Returns where a path relative to this directory appears inside a container. */
    public String imagePath(String relative) {
        if (imageRoot == null) {
            throw new IllegalStateException("Host directory " + path + " is not mounted");
        }
        return imageRoot.endsWith("/") ? imageRoot + relative : imageRoot + "/" + relative;
    }

    public Path path() {
        return path;
    }

    public String imageRoot() {
        return imageRoot;
    }

    /** Deletes the directory. Failures are logged; the build result does not depend on them. */
    @Override
    public void close() {
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
            for (Path p : paths) {
                Files.deleteIfExists(p);
            }
            LOG.debugf("Deleted host directory %s", path);
        } catch (IOException e) {
            LOG.warnf("Could not delete host directory %s: %s", path, e.getMessage());
        }
    }

    private static void copyTree(Path source, Path target, boolean executable) throws IOException {
        try (Stream<Path> walk = Files.walk(source)) {
            for (Path p : (Iterable<Path>) walk::iterator) {
                Path destination = target.resolve(source.relativize(p).toString());
                if (Files.isDirectory(p)) {
                    Files.createDirectories(destination);
                } else {
                    copyFile(p, destination, executable);
                }
            }
        }
    }

    private static void copyFile(Path source, Path target, boolean executable) throws IOException {
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        if (executable) {
            try {
                Set<PosixFilePermission> permissions = Files.getPosixFilePermissions(target);
                permissions.addAll(EXECUTE);
                Files.setPosixFilePermissions(target, permissions);
            } catch (UnsupportedOperationException e) {
                target.toFile().setExecutable(true, false);
            }
        }
    }

    @Override
    public String toString() {
        return path.toString();
    }
}
