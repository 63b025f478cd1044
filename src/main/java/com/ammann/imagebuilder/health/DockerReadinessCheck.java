package com.ammann.imagebuilder.health;

import com.ammann.imagebuilder.engine.ContainerEngine;
import com.ammann.imagebuilder.exception.BuildException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

/** Reports the application ready when the Docker daemon answers a ping. */
@Readiness
@ApplicationScoped
public class DockerReadinessCheck implements HealthCheck {

    static final String NAME = "docker";

    @Inject Logger logger;

    @Inject ContainerEngine engine;

    @Override
    public HealthCheckResponse call() {
        try {
            engine.ping();
            return HealthCheckResponse.up(NAME);
        } catch (BuildException e) {
            logger.warnf("Docker daemon is not reachable: %s", e.getMessage());
            return HealthCheckResponse.named(NAME)
                    .down()
                    .withData("error", e.getMessage())
                    .build();
        }
    }
}
