/* (C)2026 */
package com.ammann.imagebuilder.container;

import com.ammann.imagebuilder.engine.ContainerEngine;
import com.ammann.imagebuilder.engine.ContainerSnapshot;
import com.ammann.imagebuilder.engine.CreateRequest;
import com.ammann.imagebuilder.engine.EngineResult;
import com.ammann.imagebuilder.engine.HostSettings;
import com.ammann.imagebuilder.engine.SignalKind;
import com.ammann.imagebuilder.exception.ContainerExitException;
import com.ammann.imagebuilder.exception.ContainerWaitTimeoutException;
import com.ammann.imagebuilder.exception.EngineException;
import com.ammann.imagebuilder.model.Env;
import com.ammann.imagebuilder.model.VolumeLink;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Lifecycle wrapper around one engine container.
 *
 * <p>States: absent, created, running, stopped, removed. {@link #create()} and {@link
 * #remove()} are idempotent, {@link #stop()} never raises on a missing or stubborn container.
 * Callbacks registered on the {@link ContainerSpec} fire synchronously around every
 * transition, in registration order; a failing callback aborts the transition.
 *
 * <p>Stopping escalates from {@link SignalKind#GRACEFUL} to {@link SignalKind#FORCEFUL}, each
 * followed by a wait of the configured stop timeout. If the container still has not exited
 * it is abandoned and the condition is logged.
 */
public class Container {

    private static final Logger LOG = Logger.getLogger(Container.class);

    /** Default wait after each termination signal. */
    public static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(20);

    private final ContainerSpec spec;
    private final ContainerEngine engine;
    private final Duration stopTimeout;

    public Container(ContainerSpec spec, ContainerEngine engine) {
        this(spec, engine, DEFAULT_STOP_TIMEOUT);
    }

    public Container(ContainerSpec spec, ContainerEngine engine, Duration stopTimeout) {
        this.spec = Objects.requireNonNull(spec, "spec");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.stopTimeout = Objects.requireNonNull(stopTimeout, "stopTimeout");
    }

    /** Creates and starts the container. */
    public void init() {
        fireCallbacks(EventPhase.PRE, LifecycleEvent.INIT);
        LOG.debugf("Initializing container %s", this);
        create();
        start();
        fireCallbacks(EventPhase.POST, LifecycleEvent.INIT);
    }

    /**
     * Creates the container. A container that already exists under this name is left as is.
     */
    public void create() {
        fireCallbacks(EventPhase.PRE, LifecycleEvent.CREATE);
        LOG.debugf("Attempting to create container %s", this);
        EngineResult<String> result = engine.create(createRequest());
        if (result.isAlreadyExists()) {
            LOG.debugf("Container %s already exists", this);
            return;
        }
        LOG.infof("Created container %s", this);
        fireCallbacks(EventPhase.POST, LifecycleEvent.CREATE);
    }

    /**
     * Starts the container. A non-detached container is waited for and must exit with code
     * zero. A run-once container that the engine reports as started before is left alone.
     *
     * @throws ContainerExitException if a non-detached container exits with a non-zero code
     */
    public void start() {
        if (spec.isRunOnce()) {
            ContainerSnapshot snapshot = requireSnapshot("start");
            if (snapshot.hasStarted()) {
                LOG.debugf(
                        "Container %s is configured to run only once and has been started before",
                        this);
                return;
            }
        }

        fireCallbacks(EventPhase.PRE, LifecycleEvent.START);
        LOG.debugf("Attempting to start container %s", this);
        if (engine.start(getName()).isNotFound()) {
            throw new EngineException("Cannot start container " + this + ": it does not exist");
        }
        if (spec.isDetach()) {
            LOG.infof("Started container %s", this);
        } else {
            LOG.infof("Waiting for container %s to finish", this);
            waitForExit(null, false);
            LOG.infof("Container %s exited ok", this);
        }
        fireCallbacks(EventPhase.POST, LifecycleEvent.START);
    }

    /**
     * Waits for the container to exit.
     *
     * @param timeout the maximum time to wait, {@code null} to wait indefinitely
     * @param errorOk whether a non-zero exit code is returned instead of raised
     * @return the exit code
     * @throws ContainerWaitTimeoutException if the timeout elapses first
     * @throws ContainerExitException        if the code is non-zero and {@code errorOk} is not set
     */
    public int waitForExit(Duration timeout, boolean errorOk) {
        EngineResult<Integer> result = engine.waitForExit(getName(), timeout);
        if (result.isNotFound()) {
            throw new EngineException("Cannot wait for container " + this + ": it does not exist");
        }
        int status = result.value();
        if (errorOk || status == 0) {
            return status;
        }
        throw new ContainerExitException(
                getName(), status, logs().orElse(""), inspect().orElse(null));
    }

    /**
     * Stops the container if it is running.
     *
     * @return {@code true} if the container is stopped or absent, {@code false} if it could not
     *     be killed within the stop timeouts and was abandoned
     */
    public boolean stop() {
        LOG.debugf("Attempting to stop container %s", this);
        Optional<ContainerSnapshot> snapshot = inspect();
        if (snapshot.isEmpty()) {
            return true;
        }
        if (!snapshot.get().running() && snapshot.get().pid() == 0) {
            LOG.debugf("Container %s is not running", this);
            return true;
        }

        fireCallbacks(EventPhase.PRE, LifecycleEvent.STOP);
        try {
            if (!signalAndWait(SignalKind.GRACEFUL)) {
                LOG.debugf("Container %s does not exist", this);
                return true;
            }
            LOG.infof("Stopped container %s", this);
        } catch (ContainerWaitTimeoutException graceful) {
            try {
                if (!signalAndWait(SignalKind.FORCEFUL)) {
                    LOG.debugf("Container %s does not exist", this);
                    return true;
                }
                LOG.infof("Killed container %s", this);
            } catch (ContainerWaitTimeoutException forceful) {
                LOG.errorf("Unable to kill container %s: %s", this, forceful.getMessage());
                return false;
            }
        }
        fireCallbacks(EventPhase.POST, LifecycleEvent.STOP);
        return true;
    }

    /** Force-removes the container. A container that does not exist is not an error. */
    public void remove() {
        fireCallbacks(EventPhase.PRE, LifecycleEvent.REMOVE);
        LOG.debugf("Attempting to remove container %s", this);
        if (engine.remove(getName(), true).isNotFound()) {
            LOG.debugf("Container %s doesn't exist", this);
            return;
        }
        LOG.infof("Removed container %s", this);
        fireCallbacks(EventPhase.POST, LifecycleEvent.REMOVE);
    }

    /** Returns the container output, or empty if the container does not exist. */
    public Optional<String> logs() {
        EngineResult<String> result = engine.logs(getName());
        if (result.isNotFound()) {
            LOG.debugf("Container %s does not exist", this);
        }
        return result.asOptional();
    }

    /** Returns the engine's view of the container, or empty if it does not exist. */
    public Optional<ContainerSnapshot> inspect() {
        EngineResult<ContainerSnapshot> result = engine.inspect(getName());
        if (result.isNotFound()) {
            LOG.debugf("Container %s does not exist", this);
        }
        return result.asOptional();
    }

    /** Resolves the host-level settings handed to the engine. */
    public HostSettings hostSettings() {
        return new HostSettings(
                spec.getAddCapabilities(),
                spec.getDropCapabilities(),
                spec.getVolumes().stream().filter(VolumeLink::isBind).toList(),
                spec.getLinks(),
                spec.getVolumesFrom());
    }

    CreateRequest createRequest() {
        return new CreateRequest(
                getName(),
                spec.getImage(),
                spec.getEntrypoint(),
                spec.getWorkingDir(),
                spec.getEnvs().stream().map(Env::formatted).toList(),
                spec.getCommands(),
                spec.getVolumes().stream().map(VolumeLink::containerPath).toList(),
                hostSettings());
    }

    /**
     * Sends a signal and waits for the exit.
     *
     * @return {@code false} if the engine reported the container missing
     */
    private boolean signalAndWait(SignalKind signal) {
        if (engine.signal(getName(), signal).isNotFound()) {
            return false;
        }
        return !engine.waitForExit(getName(), stopTimeout).isNotFound();
    }

    private ContainerSnapshot requireSnapshot(String action) {
        String message = "Cannot " + action + " container " + this + ": it does not exist";
        return inspect().orElseThrow(() -> new EngineException(message));
    }

    private void fireCallbacks(EventPhase phase, LifecycleEvent event) {
        List<EventCallback> callbacks = spec.getCallbacks();
        for (EventCallback callback : callbacks) {
            if (callback.matches(phase, event)) {
                callback.handler().onEvent(this, phase, event);
            }
        }
    }

    public ContainerSpec getSpec() {
        return spec;
    }

    public String getName() {
        return spec.getName();
    }

    public String getImage() {
        return spec.getImage();
    }

    public Duration getStopTimeout() {
        return stopTimeout;
    }

    @Override
    public String toString() {
        return getName();
    }
}
