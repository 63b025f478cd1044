/* (C)2026 */
package com.ammann.imagebuilder.container;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ammann.imagebuilder.engine.FakeContainerEngine;
import java.lang.reflect.Field;
import java.util.List;
import org.jboss.logging.Logger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CallbackRegistry")
class CallbackRegistryTest {

    private static ContainerCallbackHandler handler(String name) {
        ContainerCallbackHandler handler = mock(ContainerCallbackHandler.class);
        when(handler.name()).thenReturn(name);
        return handler;
    }

    @Test
    @DisplayName("should find handlers by name")
    void shouldFindByName() {
        ContainerCallbackHandler printLogs = handler("print-logs");
        CallbackRegistry registry = new CallbackRegistry(List.of(printLogs, handler("notify")));

        assertThat(registry.find("print-logs")).contains(printLogs);
        assertThat(registry.find("missing")).isEmpty();
        assertThat(registry.names()).containsExactly("print-logs", "notify");
    }

    @Test
    @DisplayName("should reject two handlers with the same name")
    void shouldRejectDuplicateNames() {
        List<ContainerCallbackHandler> handlers = List.of(handler("dup"), handler("dup"));

        assertThatThrownBy(() -> new CallbackRegistry(handlers))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("dup");
    }

    @Test
    @DisplayName("print-logs should write the container output to the log")
    void printLogsShouldLogOutput() throws Exception {
        PrintLogsCallback callback = new PrintLogsCallback();
        Logger logger = mock(Logger.class);
        Field field = PrintLogsCallback.class.getDeclaredField("logger");
        field.setAccessible(true);
        field.set(callback, logger);
        FakeContainerEngine engine = new FakeContainerEngine();
        Container container = new Container(new ContainerSpec("fedora:40", "app.1"), engine);
        engine.create(container.createRequest());

        callback.onEvent(container, EventPhase.POST, LifecycleEvent.START);

        assertThat(callback.name()).isEqualTo("print-logs");
        verify(logger)
                .infof(
                        anyString(),
                        eq(container),
                        eq(EventPhase.POST),
                        eq(LifecycleEvent.START),
                        eq("output of app.1"));
    }
}
