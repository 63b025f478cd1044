/* (C)2026 */
package com.ammann.imagebuilder.system;

import com.ammann.imagebuilder.container.Container;
import com.ammann.imagebuilder.container.ContainerSpec;
import com.ammann.imagebuilder.context.HostDirectory;
import com.ammann.imagebuilder.engine.ContainerEngine;
import com.ammann.imagebuilder.exception.DependencyException;
import com.ammann.imagebuilder.model.VolumeLink;
import com.ammann.imagebuilder.spec.Disposition;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Runs a root container together with its auxiliary containers and applies each container's
 * disposition once the root exited successfully.
 *
 * <p>The dependency graph is validated when the system is constructed, so a broken
 * configuration fails before any container exists. Auxiliaries start in dependency order and
 * the root starts last, blocking until it exits.
 *
 * <p>Whatever happens during {@link #run()}, every container it created is stopped and
 * removed afterwards in reverse creation order and every host directory is deleted. Teardown
 * failures are attached to the primary failure as suppressed exceptions; without a primary
 * failure the first one is raised.
 */
public class ContainerSystem {

    private static final Logger LOG = Logger.getLogger(ContainerSystem.class);

    private final ContainerEngine engine;
    private final ContainerSystemSpec spec;
    private final SystemSettings settings;
    private final PersistenceExtractor extractor;

    private final Container root;
    private final Map<String, Container> containers = new LinkedHashMap<>();
    private final List<Container> startOrder;

    private final List<Container> materialized = new ArrayList<>();
    private final List<HostDirectory> hostDirectories = new ArrayList<>();
    private boolean ran;

    public ContainerSystem(
            ContainerEngine engine, ContainerSystemSpec spec, SystemSettings settings) {
        this(engine, spec, settings, new PersistenceExtractor(engine, settings));
    }

    ContainerSystem(
            ContainerEngine engine,
            ContainerSystemSpec spec,
            SystemSettings settings,
            PersistenceExtractor extractor) {
        this.engine = engine;
        this.spec = spec;
        this.settings = settings;
        this.extractor = extractor;

        spec.root().detach(false);
        this.root = new Container(spec.root(), engine, settings.stopTimeout());
        containers.put(root.getName(), root);
        spec.auxiliaries()
                .forEach(
                        (name, auxiliary) ->
                                containers.put(
                                        name,
                                        new Container(
                                                auxiliary.spec(),
                                                engine,
                                                settings.stopTimeout())));
        this.startOrder = resolveStartOrder();
    }

    /**
     * Runs the system.
     *
     * @return the image tags produced by commit and persist dispositions, root first
     * @throws IllegalStateException if the system has already run
     */
    public List<String> run() {
        if (ran) {
            throw new IllegalStateException("Container system " + root + " has already run");
        }
        ran = true;

        RuntimeException failure = null;
        try {
            stageIncludes();
            for (Container container : startOrder) {
                LOG.infof("Initializing container %s", container);
                materialize(container);
            }
            return applyDispositions();
        } catch (RuntimeException e) {
            failure = e;
            throw e;
        } finally {
            teardown(failure);
        }
    }

    /** Containers in start order, root last. */
    public List<Container> startOrder() {
        return Collections.unmodifiableList(startOrder);
    }

    public Container root() {
        return root;
    }

    List<Container> materialized() {
        return Collections.unmodifiableList(materialized);
    }

    private void materialize(Container container) {
        materialized.add(container);
        container.init();
    }

    private void stageIncludes() {
        if (spec.includes().isEmpty()) {
            return;
        }
        HostDirectory directory = HostDirectory.create(settings.workDir(), "include-", null);
        hostDirectories.add(directory);
        for (FileInclude include : spec.includes()) {
            Container target = containers.get(include.containerName());
            if (target == null) {
                throw new DependencyException(
                        "Cannot include " + include.source() + ": unknown container "
                                + include.containerName());
            }
            String relative = directory.include(include.source(), include.executable());
            String hostPath = directory.path().resolve(relative).toString();
            target.getSpec().addVolume(new VolumeLink(hostPath, include.destination(), true));
            LOG.debugf(
                    "Staged %s for container %s at %s",
                    include.source(), target, include.destination());
        }
    }

    private List<String> applyDispositions() {
        List<String> produced = new ArrayList<>();
        apply(root, spec.rootDisposition()).ifPresent(produced::add);
        for (Map.Entry<String, ContainerSystemSpec.Auxiliary> entry :
                spec.auxiliaries().entrySet()) {
            apply(containers.get(entry.getKey()), entry.getValue().disposition())
                    .ifPresent(produced::add);
        }
        return produced;
    }

    private Optional<String> apply(Container container, Disposition disposition) {
        switch (disposition.type()) {
            case COMMIT:
                LOG.infof("Committing container %s to %s", container, disposition.targetImage());
                engine.commit(container.getName(), disposition.targetImage());
                return Optional.of(disposition.targetImage());
            case PERSIST:
                extractor.persist(container, disposition.targetImage(), materialized::add);
                return Optional.of(disposition.targetImage());
            default:
                LOG.debugf("Discarding container %s", container);
                return Optional.empty();
        }
    }

    private void teardown(RuntimeException failure) {
        List<Container> reversed = new ArrayList<>(materialized);
        Collections.reverse(reversed);
        List<RuntimeException> errors = new ArrayList<>();
        for (Container container : reversed) {
            try {
                container.stop();
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to stop container %s", container);
                errors.add(e);
            }
            try {
                container.remove();
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to remove container %s", container);
                errors.add(e);
            }
        }
        for (int i = hostDirectories.size() - 1; i >= 0; i--) {
            hostDirectories.get(i).close();
        }
        hostDirectories.clear();

        if (errors.isEmpty()) {
            return;
        }
        RuntimeException primary = failure != null ? failure : errors.remove(0);
        errors.forEach(primary::addSuppressed);
        if (failure == null) {
            throw primary;
        }
    }

    private List<Container> resolveStartOrder() {
        List<Container> order = new ArrayList<>();
        Set<String> done = new HashSet<>();
        for (String name : spec.auxiliaries().keySet()) {
            visit(name, null, new LinkedHashSet<>(), done, order);
        }
        visit(root.getName(), null, new LinkedHashSet<>(), done, order);
        return order;
    }

    private void visit(
            String name,
            String referrer,
            LinkedHashSet<String> path,
            Set<String> done,
            List<Container> order) {
        if (done.contains(name)) {
            return;
        }
        if (referrer != null && name.equals(root.getName())) {
            throw new DependencyException(
                    "Container " + referrer + " depends on the root container " + name);
        }
        if (path.contains(name)) {
            List<String> cycle = new ArrayList<>(path);
            cycle = cycle.subList(cycle.indexOf(name), cycle.size());
            throw new DependencyException(
                    "Dependency cycle: " + String.join(" -> ", cycle) + " -> " + name);
        }
        Container container = containers.get(name);
        if (container == null) {
            throw new DependencyException(
                    "Container " + referrer + " references unknown container " + name);
        }
        path.add(name);
        ContainerSpec containerSpec = container.getSpec();
        for (String dependency : containerSpec.dependencyNames()) {
            visit(dependency, name, path, done, order);
        }
        path.remove(name);
        done.add(name);
        order.add(container);
    }
}
