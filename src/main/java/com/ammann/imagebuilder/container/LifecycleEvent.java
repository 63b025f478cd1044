package com.ammann.imagebuilder.container;

import java.util.Locale;

/** Container lifecycle transitions that callbacks can observe. */
public enum LifecycleEvent {
    INIT,
    CREATE,
    START,
    STOP,
    REMOVE;

    /** Parses the lower-case event name, returning {@code null} for anything else. */
    public static LifecycleEvent fromText(String text) {
        for (LifecycleEvent event : values()) {
            if (event.name().toLowerCase(Locale.ROOT).equals(text)) {
                return event;
            }
        }
        return null;
    }
}
