package com.animestats.scraper;

import java.util.Objects;
import java.util.function.Function;

/**
 * Typed success-or-failure value returned by every fallible step of the pipeline
 * (fetch, extract, detail work unit). Exactly one of {@link #value()} and
 * {@link #error()} is non-null.
 *
 * @param <T> success type
 * @param <E> failure type
 * @author Anime Stats Scraper Team
 * @since 1.0
 */
public final class Outcome<T, E> {
    private final T value;
    private final E error;

    private Outcome(T value, E error) {
        this.value = value;
        this.error = error;
    }

    public static <T, E> Outcome<T, E> success(T value) {
        return new Outcome<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T, E> Outcome<T, E> failure(E error) {
        return new Outcome<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public T value() {
        if (error != null) throw new IllegalStateException("Outcome is a failure: " + error);
        return value;
    }

    public E error() {
        if (error == null) throw new IllegalStateException("Outcome is a success");
        return error;
    }

    public <U> Outcome<U, E> map(Function<? super T, ? extends U> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : failure(error);
    }

    public <U> Outcome<U, E> flatMap(Function<? super T, Outcome<U, E>> mapper) {
        return isSuccess() ? mapper.apply(value) : failure(error);
    }

    public <F> Outcome<T, F> mapError(Function<? super E, ? extends F> mapper) {
        return isSuccess() ? success(value) : failure(mapper.apply(error));
    }

    public <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super E, ? extends R> onFailure) {
        return isSuccess() ? onSuccess.apply(value) : onFailure.apply(error);
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success[" + value + "]" : "Failure[" + error + "]";
    }
}
