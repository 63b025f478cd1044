package com.ammann.imagebuilder.container;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Built-in callback that writes the container's output to the build log, typically bound
 * as {@code post_start:print-logs} on a root container.
 */
@ApplicationScoped
public class PrintLogsCallback implements ContainerCallbackHandler {

    static final String NAME = "print-logs";

    @Inject Logger logger;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void onEvent(Container container, EventPhase phase, LifecycleEvent event) {
        String output = container.logs().orElse("");
        logger.infof("Output of container %s (%s %s):%n%s", container, phase, event, output);
    }
}
