package org.wordscope.core.lookup;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one stage of a fallback cascade: a value was found, nothing was found, or the stage failed.
 *
 * <p>A miss and an error both send the cascade to the next stage; the error is kept so the caller can
 * tell "nothing there" from "could not ask".</p>
 */
public final class Lookup<T> {

    public enum Status {
        HIT,
        MISS,
        ERROR
    }

    private final Status status;
    private final T value;
    private final Exception error;

    private Lookup(Status status, T value, Exception error) {
        this.status = status;
        this.value = value;
        this.error = error;
    }

    public static <T> Lookup<T> hit(T value) {
        return new Lookup<>(Status.HIT, Objects.requireNonNull(value, "value"), null);
    }

    public static <T> Lookup<T> miss() {
        return new Lookup<>(Status.MISS, null, null);
    }

    public static <T> Lookup<T> error(Exception error) {
        return new Lookup<>(Status.ERROR, null, Objects.requireNonNull(error, "error"));
    }

    public Status status() {
        return status;
    }

    public boolean isHit() {
        return status == Status.HIT;
    }

    public boolean isError() {
        return status == Status.ERROR;
    }

    /**
     * @throws IllegalStateException if this is not a hit
     */
    public T value() {
        if (status != Status.HIT) {
            throw new IllegalStateException("No value on a " + status + " lookup");
        }
        return value;
    }

    public Optional<Exception> error() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return switch (status) {
            case HIT -> "Lookup.hit(" + value + ")";
            case MISS -> "Lookup.miss()";
            case ERROR -> "Lookup.error(" + error.getMessage() + ")";
        };
    }
}
