package com.ammann.imagebuilder.model;

/**
 * A single environment variable passed to a container.
 *
 * @param key   the variable name
 * @param value the value, may be empty
 */
public record Env(String key, String value) {

    /** Returns the {@code KEY=VALUE} form expected by the engine. */
    public String formatted() {
        return key + "=" + value;
    }

    @Override
    public String toString() {
        return formatted();
    }
}
