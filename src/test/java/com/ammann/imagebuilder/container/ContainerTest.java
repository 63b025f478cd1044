/* (C)2026 */
package com.ammann.imagebuilder.container;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ammann.imagebuilder.engine.CreateRequest;
import com.ammann.imagebuilder.engine.FakeContainerEngine;
import com.ammann.imagebuilder.exception.ContainerExitException;
import com.ammann.imagebuilder.exception.EngineException;
import com.ammann.imagebuilder.model.VolumeFromLink;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Container")
class ContainerTest {

    FakeContainerEngine engine;

    @BeforeEach
    void setUp() {
        engine = new FakeContainerEngine();
    }

    private Container container(ContainerSpec spec) {
        return new Container(spec, engine, Duration.ofMillis(10));
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("should tolerate creating the same name twice")
        void shouldTolerateDoubleCreate() {
            Container container = container(new ContainerSpec("base:latest", "base.1"));

            container.create();
            container.create();

            assertThat(engine.callsStartingWith("create ")).hasSize(2);
            assertThat(engine.containers).containsOnlyKeys("base.1");
        }

        @Test
        @DisplayName("should skip post_create when the container already exists")
        void shouldSkipPostCreateOnAlreadyExists() {
            List<String> events = new ArrayList<>();
            ContainerSpec spec = new ContainerSpec("base:latest", "base.1");
            recordAll(spec, events);
            Container container = container(spec);

            container.create();
            events.clear();
            container.create();

            assertThat(events).containsExactly("PRE CREATE");
        }

        @Test
        @DisplayName("should pass resolved host settings with the create request")
        void shouldPassHostSettings() {
            ContainerSpec spec =
                    new ContainerSpec("app:1", "app.1")
                            .addVolume("/host", "/data", true)
                            .addVolume(null, "/cache", false)
                            .addVolumeFrom("data.1", VolumeFromLink.Mode.RW)
                            .addLink("db.1", "db")
                            .addEnv("A", "1")
                            .addCapability("NET_ADMIN");

            container(spec).create();

            CreateRequest request = engine.request("app.1");
            assertThat(request.env()).containsExactly("A=1");
            assertThat(request.volumePaths()).containsExactly("/data", "/cache");
            assertThat(request.hostSettings().binds()).hasSize(1);
            assertThat(request.hostSettings().links()).hasSize(1);
            assertThat(request.hostSettings().volumesFrom()).hasSize(1);
            assertThat(request.hostSettings().capAdd()).containsExactly("NET_ADMIN");
        }
    }

    @Nested
    @DisplayName("start")
    class Start {

        @Test
        @DisplayName("should start a run-once container that never ran")
        void shouldStartRunOnceContainerThatNeverRan() {
            Container container =
                    container(new ContainerSpec("base:latest", "once.1").runOnce(true));
            container.create();

            container.start();

            assertThat(engine.callsStartingWith("start ")).containsExactly("start once.1");
        }

        @Test
        @DisplayName("should issue no start for a run-once container that ran before")
        void shouldNotRestartRunOnceContainer() {
            Container container =
                    container(new ContainerSpec("base:latest", "once.1").runOnce(true));
            container.create();
            engine.markStarted("once.1");

            container.start();

            assertThat(engine.callsStartingWith("start ")).isEmpty();
        }

        @Test
        @DisplayName("should raise exit error with code, logs and snapshot")
        void shouldRaiseExitError() {
            engine.exitCode("failing:1", 3);
            Container container =
                    container(new ContainerSpec("failing:1", "failing.1").detach(false));

            assertThatThrownBy(container::init)
                    .isInstanceOf(ContainerExitException.class)
                    .satisfies(
                            e -> {
                                ContainerExitException exit = (ContainerExitException) e;
                                assertThat(exit.getExitCode()).isEqualTo(3);
                                assertThat(exit.getContainerName()).isEqualTo("failing.1");
                                assertThat(exit.getLogs()).isEqualTo("output of failing.1");
                                assertThat(exit.getSnapshot()).isNotNull();
                                assertThat(exit.getSnapshot().exitCode()).isEqualTo(3);
                            });
        }

        @Test
        @DisplayName("should not wait for detached containers")
        void shouldNotWaitForDetached() {
            Container container = container(new ContainerSpec("svc:1", "svc.1"));

            container.init();

            assertThat(engine.callsStartingWith("wait ")).isEmpty();
        }

        @Test
        @DisplayName("should fail when the container is missing")
        void shouldFailWhenMissing() {
            Container container = container(new ContainerSpec("svc:1", "svc.1"));

            assertThatThrownBy(container::start)
                    .isInstanceOf(EngineException.class)
                    .hasMessageContaining("svc.1");
        }
    }

    @Nested
    @DisplayName("stop")
    class Stop {

        @Test
        @DisplayName("should be a no-op for a missing container")
        void shouldIgnoreMissingContainer() {
            Container container = container(new ContainerSpec("svc:1", "ghost.1"));

            assertThat(container.stop()).isTrue();
            assertThat(engine.callsStartingWith("signal ")).isEmpty();
        }

        @Test
        @DisplayName("should be a no-op for a container that is not running")
        void shouldIgnoreStoppedContainer() {
            Container container = container(new ContainerSpec("svc:1", "svc.1"));
            container.create();

            assertThat(container.stop()).isTrue();
            assertThat(engine.callsStartingWith("signal ")).isEmpty();
        }

        @Test
        @DisplayName("should send graceful signal to a running container")
        void shouldStopGracefully() {
            Container container = container(new ContainerSpec("svc:1", "svc.1"));
            container.init();

            assertThat(container.stop()).isTrue();
            assertThat(engine.callsStartingWith("signal ")).containsExactly("signal svc.1 SIGTERM");
        }

        @Test
        @DisplayName("should escalate and give up without raising")
        void shouldEscalateAndGiveUp() {
            engine.stubborn("stubborn:1");
            Container container = container(new ContainerSpec("stubborn:1", "stubborn.1"));
            container.init();

            boolean stopped = container.stop();

            assertThat(stopped).isFalse();
            assertThat(engine.callsStartingWith("signal "))
                    .containsExactly("signal stubborn.1 SIGTERM", "signal stubborn.1 SIGKILL");
            assertThat(engine.callsStartingWith("wait ")).hasSize(2);
        }
    }

    @Nested
    @DisplayName("remove")
    class Remove {

        @Test
        @DisplayName("should tolerate removing a missing container")
        void shouldTolerateMissing() {
            Container container = container(new ContainerSpec("svc:1", "svc.1"));
            container.create();

            container.remove();
            container.remove();

            assertThat(engine.callsStartingWith("remove ")).hasSize(2);
            assertThat(engine.containers).isEmpty();
        }
    }

    @Nested
    @DisplayName("callbacks")
    class Callbacks {

        @Test
        @DisplayName("should fire around every transition in order")
        void shouldFireInOrder() {
            List<String> events = new ArrayList<>();
            ContainerSpec spec = new ContainerSpec("svc:1", "svc.1");
            recordAll(spec, events);
            Container container = container(spec);

            container.init();
            container.stop();
            container.remove();

            assertThat(events)
                    .containsExactly(
                            "PRE INIT",
                            "PRE CREATE",
                            "POST CREATE",
                            "PRE START",
                            "POST START",
                            "POST INIT",
                            "PRE STOP",
                            "POST STOP",
                            "PRE REMOVE",
                            "POST REMOVE");
        }

        @Test
        @DisplayName("should abort the transition when a callback fails")
        void shouldAbortOnCallbackFailure() {
            ContainerCallbackHandler failing = mock(ContainerCallbackHandler.class);
            when(failing.name()).thenReturn("failing");
            doThrow(new IllegalStateException("boom"))
                    .when(failing)
                    .onEvent(any(), any(), any());
            ContainerSpec spec =
                    new ContainerSpec("svc:1", "svc.1")
                            .addCallback(
                                    new EventCallback(
                                            EventPhase.PRE, LifecycleEvent.START, failing));
            Container container = container(spec);
            container.create();

            assertThatThrownBy(container::start).hasMessage("boom");
            assertThat(engine.callsStartingWith("start ")).isEmpty();
        }
    }

    @Test
    @DisplayName("should generate unique names from the image base name")
    void shouldGenerateNames() {
        String first = ContainerSpec.randomName("registry.local:5000/team/base:latest");
        String second = ContainerSpec.randomName("registry.local:5000/team/base:latest");

        assertThat(first).matches("base\\.[0-9a-f]{8}");
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    @DisplayName("should not share collections between specs")
    void shouldNotShareCollections() {
        ContainerSpec first = new ContainerSpec("a:1").addEnv("A", "1");
        ContainerSpec second = new ContainerSpec("a:1");

        assertThat(second.getEnvs()).isEmpty();
        assertThat(first.getEnvs()).hasSize(1);
    }

    private static void recordAll(ContainerSpec spec, List<String> events) {
        ContainerCallbackHandler recorder =
                new ContainerCallbackHandler() {
                    @Override
                    public String name() {
                        return "recorder";
                    }

                    @Override
                    public void onEvent(
                            Container container, EventPhase phase, LifecycleEvent event) {
                        events.add(phase + " " + event);
                    }
                };
        for (LifecycleEvent event : LifecycleEvent.values()) {
            for (EventPhase phase : EventPhase.values()) {
                spec.addCallback(new EventCallback(phase, event, recorder));
            }
        }
    }
}
