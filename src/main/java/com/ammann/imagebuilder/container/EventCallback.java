package com.ammann.imagebuilder.container;

import java.util.Objects;

/**
 * Binds a handler to one phase of one lifecycle event.
 *
 * @param phase   before or after the transition
 * @param event   the transition
 * @param handler the handler to invoke
 */
public record EventCallback(
        EventPhase phase, LifecycleEvent event, ContainerCallbackHandler handler) {

    public EventCallback {
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(handler, "handler");
    }

    public boolean matches(EventPhase phase, LifecycleEvent event) {
        return this.phase == phase && this.event == event;
    }
}
