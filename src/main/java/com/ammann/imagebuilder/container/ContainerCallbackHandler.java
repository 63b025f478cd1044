package com.ammann.imagebuilder.container;

/**
 * Hook invoked around container lifecycle transitions.
 *
 * <p>Implementations are CDI beans collected by {@link CallbackRegistry} and referenced from
 * image definitions by {@link #name()}. An exception thrown by {@link #onEvent} aborts the
 * transition it surrounds.
 */
public interface ContainerCallbackHandler {

    /** The name under which image definitions refer to this handler. */
    String name();

    void onEvent(Container container, EventPhase phase, LifecycleEvent event);
}
