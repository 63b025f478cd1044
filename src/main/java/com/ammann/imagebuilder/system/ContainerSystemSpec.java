/* (C)2026 */
package com.ammann.imagebuilder.system;

import com.ammann.imagebuilder.container.ContainerSpec;
import com.ammann.imagebuilder.exception.DependencyException;
import com.ammann.imagebuilder.spec.Disposition;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A root container plus the auxiliary containers it links to or takes volumes from, each
 * with its disposition.
 */
public class ContainerSystemSpec {

    /** An auxiliary container and what happens to it after a successful run. */
    public record Auxiliary(ContainerSpec spec, Disposition disposition) {}

    private final ContainerSpec root;
    private Disposition rootDisposition = Disposition.discard();
    private final Map<String, Auxiliary> auxiliaries = new LinkedHashMap<>();
    private final List<FileInclude> includes = new ArrayList<>();

    public ContainerSystemSpec(ContainerSpec root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public ContainerSystemSpec rootDisposition(Disposition disposition) {
        this.rootDisposition = Objects.requireNonNull(disposition, "disposition");
        return this;
    }

    /**
     * Adds an auxiliary container.
     *
     * @throws DependencyException if a container with the same name is already part of the
     *     system
     */
    public ContainerSystemSpec addAuxiliary(ContainerSpec spec, Disposition disposition) {
        String name = spec.getName();
        if (name.equals(root.getName()) || auxiliaries.containsKey(name)) {
            throw new DependencyException("Duplicate container name in system: " + name);
        }
        auxiliaries.put(name, new Auxiliary(spec, Objects.requireNonNull(disposition)));
        return this;
    }

    public ContainerSystemSpec include(FileInclude include) {
        includes.add(Objects.requireNonNull(include, "include"));
        return this;
    }

    public ContainerSpec root() {
        return root;
    }

    public Disposition rootDisposition() {
        return rootDisposition;
    }

    public Map<String, Auxiliary> auxiliaries() {
        return Collections.unmodifiableMap(auxiliaries);
    }

    public List<FileInclude> includes() {
        return Collections.unmodifiableList(includes);
    }
}
