/* (C)2026 */
package com.ammann.imagebuilder.container;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of the {@link ContainerCallbackHandler} beans available to image definitions.
 *
 * <p>Populated from all handler beans when first used; a handler is looked up by its {@link
 * ContainerCallbackHandler#name()}. Two handlers with the same name are a deployment error.
 */
@ApplicationScoped
public class CallbackRegistry {

    @Inject @Any Instance<ContainerCallbackHandler> handlerBeans;

    private Map<String, ContainerCallbackHandler> handlers;

    public CallbackRegistry() {}

    /** Creates a registry over an explicit set of handlers. */
    public CallbackRegistry(Iterable<ContainerCallbackHandler> handlers) {
        this.handlers = index(handlers);
    }

    public Optional<ContainerCallbackHandler> find(String name) {
        return Optional.ofNullable(handlers().get(name));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(handlers().keySet());
    }

    private synchronized Map<String, ContainerCallbackHandler> handlers() {
        if (handlers == null) {
            handlers = index(handlerBeans);
        }
        return handlers;
    }

    private static Map<String, ContainerCallbackHandler> index(
            Iterable<ContainerCallbackHandler> handlers) {
        Map<String, ContainerCallbackHandler> indexed = new LinkedHashMap<>();
        for (ContainerCallbackHandler handler : handlers) {
            ContainerCallbackHandler previous = indexed.putIfAbsent(handler.name(), handler);
            if (previous != null && previous != handler) {
                throw new IllegalStateException(
                        "Duplicate container callback handler name: " + handler.name());
            }
        }
        return indexed;
    }
}
