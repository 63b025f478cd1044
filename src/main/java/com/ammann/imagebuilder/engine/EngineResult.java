package com.ammann.imagebuilder.engine;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a container engine call whose "missing" or "already present" cases are part of
 * normal operation.
 *
 * <p>Lifecycle code checks {@link #outcome()} instead of inspecting status codes of engine
 * errors. Every other failure is raised as an
 * {@link com.ammann.imagebuilder.exception.EngineException}.
 *
 * @param outcome the structural outcome
 * @param value   the result value, only present for {@link Outcome#OK}
 * @param <T>     the result value type
 */
public record EngineResult<T>(Outcome outcome, T value) {

    public enum Outcome {
        OK,
        NOT_FOUND,
        ALREADY_EXISTS
    }

    public EngineResult {
        Objects.requireNonNull(outcome, "outcome");
    }

    public static <T> EngineResult<T> ok(T value) {
        return new EngineResult<>(Outcome.OK, value);
    }

    public static EngineResult<Void> ok() {
        return new EngineResult<>(Outcome.OK, null);
    }

    public static <T> EngineResult<T> notFound() {
        return new EngineResult<>(Outcome.NOT_FOUND, null);
    }

    public static <T> EngineResult<T> alreadyExists() {
        return new EngineResult<>(Outcome.ALREADY_EXISTS, null);
    }

    public boolean isOk() {
        return outcome == Outcome.OK;
    }

    public boolean isNotFound() {
        return outcome == Outcome.NOT_FOUND;
    }

    public boolean isAlreadyExists() {
        return outcome == Outcome.ALREADY_EXISTS;
    }

    public Optional<T> asOptional() {
        return Optional.ofNullable(value);
    }
}
