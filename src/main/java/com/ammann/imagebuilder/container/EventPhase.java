package com.ammann.imagebuilder.container;

import java.util.Locale;

/** Whether a callback fires before or after a lifecycle transition. */
public enum EventPhase {
    PRE,
    POST;

    /** Parses {@code pre} / {@code post}, returning {@code null} for anything else. */
    public static EventPhase fromText(String text) {
        for (EventPhase phase : values()) {
            if (phase.name().toLowerCase(Locale.ROOT).equals(text)) {
                return phase;
            }
        }
        return null;
    }
}
