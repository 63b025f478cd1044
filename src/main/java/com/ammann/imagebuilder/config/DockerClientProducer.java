package com.ammann.imagebuilder.config;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import com.github.dockerjava.transport.DockerHttpClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import java.time.Duration;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * CDI producer for the Docker API client used by the container engine.
 *
 * <p>The Docker host URI defaults to the local daemon and can be overridden with {@code
 * docker.host}. Waiting for a build container and streaming an image build keep a request
 * open for as long as the container runs, so {@code docker.response-timeout} defaults to
 * zero, which disables the response timeout.
 */
@ApplicationScoped
public class DockerClientProducer {

    @ConfigProperty(name = "docker.host")
    Optional<String> dockerHostOverride;

    @ConfigProperty(name = "docker.response-timeout", defaultValue = "PT0S")
    Duration responseTimeout;

    @Produces
    @ApplicationScoped
    public DockerClient dockerClient() {
        DefaultDockerClientConfig.Builder configBuilder =
                DefaultDockerClientConfig.createDefaultConfigBuilder();
        dockerHostOverride.ifPresent(configBuilder::withDockerHost);
        DockerClientConfig config = configBuilder.build();

        DockerHttpClient httpClient =
                new ApacheDockerHttpClient.Builder()
                        .dockerHost(config.getDockerHost())
                        .sslConfig(config.getSSLConfig())
                        .maxConnections(20)
                        .connectionTimeout(Duration.ofSeconds(30))
                        .responseTimeout(responseTimeout)
                        .build();

        return DockerClientImpl.getInstance(config, httpClient);
    }
}
