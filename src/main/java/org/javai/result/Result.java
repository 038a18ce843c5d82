package org.javai.result;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Represents the result of an operation that may fail.
 * Exactly one of {@link Empty} (no outcome was ever assigned), {@link Ok} containing a
 * success value, or {@link Fail} containing an {@link ErrorInfo}.
 *
 * <p>Results are immutable. Combinators never change a result in place; they build a new one:
 * <pre>{@code
 * Result<Integer, Code> doubled = parse(input).onSuccess(v -> Result.ok(v * 2));
 * int value = doubled.recover(error -> -1);
 * }</pre>
 *
 * @param <V> The type of the success value
 * @param <C> The error code enum
 */
public sealed interface Result<V, C extends Enum<C>> permits Result.Empty, Result.Ok, Result.Fail {

    /**
     * A result that holds neither a value nor an error.
     */
    record Empty<V, C extends Enum<C>>() implements Result<V, C> {

        @Override
        public Content type() {
            return Content.EMPTY;
        }

        @Override
        public V get() {
            throw new InvalidStateAccessException(Content.VALUE, Content.EMPTY);
        }

        @Override
        public ErrorInfo<C> error() {
            throw new InvalidStateAccessException(Content.ERROR, Content.EMPTY);
        }

        @Override
        public Optional<V> findValue() {
            return Optional.empty();
        }

        @Override
        public Optional<ErrorInfo<C>> findError() {
            return Optional.empty();
        }

        @Override
        public V getOrElse(V fallback) {
            return fallback;
        }

        @Override
        public void match(Consumer<? super V> onValue, Consumer<? super ErrorInfo<C>> onError) {
            Objects.requireNonNull(onValue);
            Objects.requireNonNull(onError);
        }

        @Override
        public <U> Result<U, C> onSuccess(Function<? super V, ? extends Result<U, C>> apply) {
            Objects.requireNonNull(apply);
            return new Empty<>();
        }

        @Override
        public <U> Result<U, C> map(Function<? super V, ? extends U> apply) {
            Objects.requireNonNull(apply);
            return new Empty<>();
        }

        @Override
        public V recover(Function<? super ErrorInfo<C>, ? extends V> apply, Supplier<? extends V> onEmpty) {
            Objects.requireNonNull(apply);
            Objects.requireNonNull(onEmpty);
            return onEmpty.get();
        }
    }

    /**
     * A successful result containing a value.
     *
     * @param value the success value (may be null, e.g. for {@code Void})
     */
    record Ok<V, C extends Enum<C>>(V value) implements Result<V, C> {

        @Override
        public Content type() {
            return Content.VALUE;
        }

        @Override
        public V get() {
            return value;
        }

        @Override
        public ErrorInfo<C> error() {
            throw new InvalidStateAccessException(Content.ERROR, Content.VALUE);
        }

        @Override
        public Optional<V> findValue() {
            return Optional.ofNullable(value);
        }

        @Override
        public Optional<ErrorInfo<C>> findError() {
            return Optional.empty();
        }

        @Override
        public V getOrElse(V fallback) {
            return value;
        }

        @Override
        public void match(Consumer<? super V> onValue, Consumer<? super ErrorInfo<C>> onError) {
            Objects.requireNonNull(onValue);
            Objects.requireNonNull(onError);
            onValue.accept(value);
        }

        @Override
        public <U> Result<U, C> onSuccess(Function<? super V, ? extends Result<U, C>> apply) {
            Objects.requireNonNull(apply);
            return Objects.requireNonNull(apply.apply(value), "onSuccess function returned null");
        }

        @Override
        public <U> Result<U, C> map(Function<? super V, ? extends U> apply) {
            Objects.requireNonNull(apply);
            return new Ok<>(apply.apply(value));
        }

        @Override
        public V recover(Function<? super ErrorInfo<C>, ? extends V> apply, Supplier<? extends V> onEmpty) {
            Objects.requireNonNull(apply);
            Objects.requireNonNull(onEmpty);
            return value;
        }
    }

    /**
     * A failed result containing error details.
     *
     * @param error the error details
     */
    record Fail<V, C extends Enum<C>>(ErrorInfo<C> error) implements Result<V, C> {

        public Fail {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public Content type() {
            return Content.ERROR;
        }

        @Override
        public V get() {
            throw new InvalidStateAccessException(Content.VALUE, Content.ERROR);
        }

        @Override
        public ErrorInfo<C> error() {
            return error;
        }

        @Override
        public Optional<V> findValue() {
            return Optional.empty();
        }

        @Override
        public Optional<ErrorInfo<C>> findError() {
            return Optional.of(error);
        }

        @Override
        public V getOrElse(V fallback) {
            return fallback;
        }

        @Override
        public void match(Consumer<? super V> onValue, Consumer<? super ErrorInfo<C>> onError) {
            Objects.requireNonNull(onValue);
            Objects.requireNonNull(onError);
            onError.accept(error);
        }

        @Override
        public <U> Result<U, C> onSuccess(Function<? super V, ? extends Result<U, C>> apply) {
            Objects.requireNonNull(apply);
            return new Fail<>(error);
        }

        @Override
        public <U> Result<U, C> map(Function<? super V, ? extends U> apply) {
            Objects.requireNonNull(apply);
            return new Fail<>(error);
        }

        @Override
        public V recover(Function<? super ErrorInfo<C>, ? extends V> apply, Supplier<? extends V> onEmpty) {
            Objects.requireNonNull(apply);
            Objects.requireNonNull(onEmpty);
            return apply.apply(error);
        }
    }

    /**
     * Returns which state this result holds.
     */
    Content type();

    default boolean isEmpty() {
        return type() == Content.EMPTY;
    }

    default boolean isOk() {
        return type() == Content.VALUE;
    }

    default boolean isFail() {
        return type() == Content.ERROR;
    }

    // Unchecked access

    /**
     * Returns the held value.
     *
     * @throws InvalidStateAccessException if this result is not {@link Content#VALUE}
     */
    V get();

    /**
     * Returns the held error.
     *
     * @throws InvalidStateAccessException if this result is not {@link Content#ERROR}
     */
    ErrorInfo<C> error();

    // Checked access

    /**
     * Returns the value, or empty if this result holds no value (or holds {@code null}).
     */
    Optional<V> findValue();

    Optional<ErrorInfo<C>> findError();

    V getOrElse(V fallback);

    // Combinators

    /**
     * Runs {@code onValue} if this result holds a value, {@code onError} if it holds an error,
     * and neither if it is empty.
     */
    void match(Consumer<? super V> onValue, Consumer<? super ErrorInfo<C>> onError);

    /**
     * Chains a step that may itself fail.
     * Only a value is passed to {@code apply}; an error is carried into the new result unchanged
     * and an empty result stays empty.
     *
     * @param apply the next step
     * @return the result of {@code apply}, or this result's error or emptiness
     */
    <U> Result<U, C> onSuccess(Function<? super V, ? extends Result<U, C>> apply);

    /**
     * Transforms the value with a step that cannot fail. Errors and emptiness pass through.
     */
    <U> Result<U, C> map(Function<? super V, ? extends U> apply);

    /**
     * Converts this result into a plain value.
     * A value is returned as is, an error is handed to {@code apply}, and an empty result
     * yields {@code null}, the default of a reference type.
     *
     * @param apply produces a fallback value from the error
     * @return the value, the recovered value, or {@code null} when empty
     */
    default V recover(Function<? super ErrorInfo<C>, ? extends V> apply) {
        return recover(apply, () -> null);
    }

    /**
     * Converts this result into a plain value, taking the empty-state value from {@code onEmpty}.
     */
    V recover(Function<? super ErrorInfo<C>, ? extends V> apply, Supplier<? extends V> onEmpty);

    // Static factories

    static <V, C extends Enum<C>> Result<V, C> empty() {
        return new Empty<>();
    }

    static <V, C extends Enum<C>> Result<V, C> ok(V value) {
        return new Ok<>(value);
    }

    static <V, C extends Enum<C>> Result<V, C> fail(ErrorInfo<C> error) {
        return new Fail<>(error);
    }

    static <V, C extends Enum<C>> Result<V, C> fail(String message, C code) {
        return new Fail<>(ErrorInfo.of(message, code));
    }

    static <V, C extends Enum<C>> Result<V, C> fail(C code) {
        return new Fail<>(ErrorInfo.of(code));
    }
}
