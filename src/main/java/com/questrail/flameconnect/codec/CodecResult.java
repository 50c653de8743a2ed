package com.questrail.flameconnect.codec;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * CodecResult
 * -----------------------------------------------------------------------------
 * Outcome of a single decode or encode call: either a value or a
 * {@link ProtocolError}.
 *
 * <p>Failures are values so batch call sites can cheaply tell "skip this
 * entry" from "abort everything" without exception-driven control flow.</p>
 *
 * @param <T> type of the successful value
 */
public sealed interface CodecResult<T>
        permits CodecResult.Success, CodecResult.Failure {

    static <T> CodecResult<T> success(T value)
    {
        return new Success<>(value);
    }

    static <T> CodecResult<T> failure(ProtocolError error)
    {
        return new Failure<>(error);
    }

    boolean isSuccess();

    default boolean isFailure()
    {
        return !isSuccess();
    }

    /**
     * Returns the value, or empty on failure.
     */
    Optional<T> value();

    /**
     * Returns the error, or empty on success.
     */
    Optional<ProtocolError> error();

    /**
     * Returns the value or throws {@link ProtocolException} carrying the error.
     */
    T orElseThrow();

    /**
     * Transforms a successful value; failures pass through unchanged.
     */
    <U> CodecResult<U> map(Function<? super T, ? extends U> mapper);

    record Success<T>(T result) implements CodecResult<T>
    {
        public Success {
            Objects.requireNonNull(result, "result");
        }

        @Override
        public boolean isSuccess()
        {
            return true;
        }

        @Override
        public Optional<T> value()
        {
            return Optional.of(result);
        }

        @Override
        public Optional<ProtocolError> error()
        {
            return Optional.empty();
        }

        @Override
        public T orElseThrow()
        {
            return result;
        }

        @Override
        public <U> CodecResult<U> map(Function<? super T, ? extends U> mapper)
        {
            return new Success<>(mapper.apply(result));
        }
    }

    record Failure<T>(ProtocolError cause) implements CodecResult<T>
    {
        public Failure {
            Objects.requireNonNull(cause, "cause");
        }

        @Override
        public boolean isSuccess()
        {
            return false;
        }

        @Override
        public Optional<T> value()
        {
            return Optional.empty();
        }

        @Override
        public Optional<ProtocolError> error()
        {
            return Optional.of(cause);
        }

        @Override
        public T orElseThrow()
        {
            throw new ProtocolException(cause);
        }

        @Override
        public <U> CodecResult<U> map(Function<? super T, ? extends U> mapper)
        {
            return new Failure<>(cause);
        }
    }
}
