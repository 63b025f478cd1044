/* (C)2026 */
package com.ammann.imagebuilder.build;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ammann.imagebuilder.config.StubBuilderConfig;
import com.ammann.imagebuilder.config.StubImageConfig;
import com.ammann.imagebuilder.container.CallbackRegistry;
import com.ammann.imagebuilder.container.ContainerCallbackHandler;
import com.ammann.imagebuilder.container.ContainerSpec;
import com.ammann.imagebuilder.container.EventPhase;
import com.ammann.imagebuilder.container.LifecycleEvent;
import com.ammann.imagebuilder.exception.DependencyException;
import com.ammann.imagebuilder.exception.InvalidFormatException;
import com.ammann.imagebuilder.model.Env;
import com.ammann.imagebuilder.model.NetworkLink;
import com.ammann.imagebuilder.model.VolumeFromLink;
import com.ammann.imagebuilder.spec.Disposition;
import com.ammann.imagebuilder.system.ContainerSystemSpec;
import com.ammann.imagebuilder.system.FileInclude;
import java.lang.reflect.Field;
import java.nio.file.Path;
import java.util.List;
import org.jboss.logging.Logger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ContainerSystemPlanner")
class ContainerSystemPlannerTest {

    ContainerSystemPlanner planner;
    StubBuilderConfig builderConfig;
    ContainerCallbackHandler printLogs;

    @BeforeEach
    void setUp() throws Exception {
        planner = new ContainerSystemPlanner();
        builderConfig = new StubBuilderConfig(null, Path.of("/srv/images"));
        printLogs = mock(ContainerCallbackHandler.class);
        when(printLogs.name()).thenReturn("print-logs");

        inject("logger", mock(Logger.class));
        inject("builderConfig", builderConfig);
        inject("callbackRegistry", new CallbackRegistry(List.of(printLogs)));
    }

    private void inject(String name, Object value) throws Exception {
        Field field = ContainerSystemPlanner.class.getDeclaredField(name);
        field.setAccessible(true);
        field.set(planner, value);
    }

    @Nested
    @DisplayName("root container")
    class RootContainer {

        @Test
        @DisplayName("should run the base image blocking and commit to the image name")
        void shouldCommitRoot() {
            ContainerSystemSpec spec =
                    planner.plan("app", new StubImageConfig("builder:1").commit(true), List.of());

            assertThat(spec.root().getImage()).isEqualTo("builder:1");
            assertThat(spec.root().isDetach()).isFalse();
            assertThat(spec.rootDisposition()).isEqualTo(Disposition.commit("app"));
            assertThat(spec.auxiliaries()).isEmpty();
        }

        @Test
        @DisplayName("should discard the root when commit is false")
        void shouldDiscardRootWithoutCommit() {
            ContainerSystemSpec spec =
                    planner.plan("app", new StubImageConfig("builder:1").commit(false), List.of());

            assertThat(spec.rootDisposition().isDiscard()).isTrue();
        }

        @Test
        @DisplayName("should stage entrypoint and libs from the resource root")
        void shouldStageEntrypointAndLibs() {
            StubImageConfig image =
                    new StubImageConfig("builder:1")
                            .commit(true)
                            .entrypoint("app/run.sh at /opt/app/run.sh")
                            .libs("lib/common.sh in /opt/lib");

            ContainerSystemSpec spec = planner.plan("app", image, List.of());

            ContainerSpec root = spec.root();
            assertThat(root.getEntrypoint()).isEqualTo("/opt/app/run.sh");
            assertThat(root.getWorkingDir()).isEqualTo("/opt/app");
            assertThat(spec.includes())
                    .containsExactly(
                            new FileInclude(
                                    root.getName(),
                                    Path.of("/srv/images/app/run.sh"),
                                    "/opt/app/run.sh",
                                    true),
                            new FileInclude(
                                    root.getName(),
                                    Path.of("/srv/images/lib/common.sh"),
                                    "/opt/lib/common.sh",
                                    false));
        }

        @Test
        @DisplayName("should add configured and extra environment entries")
        void shouldAddEnvironment() {
            ContainerSystemSpec spec =
                    planner.plan(
                            "app",
                            new StubImageConfig("builder:1").commit(true).envs("A=1\nB=2"),
                            List.of("C=3"));

            assertThat(spec.root().getEnvs())
                    .containsExactly(new Env("A", "1"), new Env("B", "2"), new Env("C", "3"));
        }

        @Test
        @DisplayName("should bind configured callbacks")
        void shouldBindCallbacks() {
            ContainerSystemSpec spec =
                    planner.plan(
                            "app",
                            new StubImageConfig("builder:1")
                                    .commit(true)
                                    .callbacks("post_start:print-logs"),
                            List.of());

            assertThat(spec.root().getCallbacks())
                    .singleElement()
                    .satisfies(
                            callback -> {
                                assertThat(callback.phase()).isEqualTo(EventPhase.POST);
                                assertThat(callback.event()).isEqualTo(LifecycleEvent.START);
                                assertThat(callback.handler()).isSameAs(printLogs);
                            });
        }
    }

    @Nested
    @DisplayName("auxiliaries")
    class Auxiliaries {

        @Test
        @DisplayName("should add blocking volume containers with their disposition")
        void shouldAddVolumeContainers() {
            ContainerSystemSpec spec =
                    planner.plan(
                            "app",
                            new StubImageConfig("builder:1")
                                    .volumesFrom("data:1 then persist to data:seeded"),
                            List.of());

            ContainerSystemSpec.Auxiliary auxiliary =
                    spec.auxiliaries().values().iterator().next();
            assertThat(auxiliary.spec().getImage()).isEqualTo("data:1");
            assertThat(auxiliary.spec().isDetach()).isFalse();
            assertThat(auxiliary.disposition()).isEqualTo(Disposition.persist("data:seeded"));
            assertThat(spec.root().getVolumesFrom())
                    .containsExactly(
                            new VolumeFromLink(auxiliary.spec().getName(), VolumeFromLink.Mode.RW));
        }

        @Test
        @DisplayName("should add detached linked containers under their alias")
        void shouldAddLinkedContainers() {
            ContainerSystemSpec spec =
                    planner.plan(
                            "app",
                            new StubImageConfig("builder:1")
                                    .links("db:1 alias db then commit to db:seeded"),
                            List.of());

            ContainerSystemSpec.Auxiliary auxiliary =
                    spec.auxiliaries().values().iterator().next();
            assertThat(auxiliary.spec().isDetach()).isTrue();
            assertThat(auxiliary.disposition()).isEqualTo(Disposition.commit("db:seeded"));
            assertThat(spec.root().getLinks())
                    .containsExactly(new NetworkLink(auxiliary.spec().getName(), "db"));
        }

        @Test
        @DisplayName("should attach dependencies of configured dependency images")
        void shouldAttachNestedDependencies() {
            builderConfig.image(
                    "data-img",
                    new StubImageConfig("fedora:40").links("cache:1 alias cache then discard"));

            ContainerSystemSpec spec =
                    planner.plan(
                            "app",
                            new StubImageConfig("builder:1").volumesFrom("data-img then discard"),
                            List.of());

            assertThat(spec.auxiliaries()).hasSize(2);
            ContainerSpec data =
                    spec.auxiliaries().values().stream()
                            .map(ContainerSystemSpec.Auxiliary::spec)
                            .filter(s -> s.getImage().equals("data-img"))
                            .findFirst()
                            .orElseThrow();
            ContainerSpec cache =
                    spec.auxiliaries().values().stream()
                            .map(ContainerSystemSpec.Auxiliary::spec)
                            .filter(s -> s.getImage().equals("cache:1"))
                            .findFirst()
                            .orElseThrow();
            assertThat(data.getLinks()).containsExactly(new NetworkLink(cache.getName(), "cache"));
        }

        @Test
        @DisplayName("should reject cycles through image definitions")
        void shouldRejectCycles() {
            StubImageConfig a = new StubImageConfig("fedora:40").volumesFrom("b then discard");
            StubImageConfig b = new StubImageConfig("fedora:40").links("a alias a then discard");
            builderConfig.image("a", a).image("b", b);

            assertThatThrownBy(() -> planner.plan("a", a, List.of()))
                    .isInstanceOf(DependencyException.class)
                    .hasMessageContaining("a -> b -> a");
        }

        @Test
        @DisplayName("should reject malformed specifications")
        void shouldRejectMalformedSpecs() {
            StubImageConfig image = new StubImageConfig("builder:1").links("db:1 then discard");

            assertThatThrownBy(() -> planner.plan("app", image, List.of()))
                    .isInstanceOf(InvalidFormatException.class)
                    .hasMessage("Invalid link specification 'db:1 then discard' for image app");
        }
    }
}
