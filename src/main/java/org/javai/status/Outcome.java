package org.javai.status;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Represents the outcome of an operation that may fail.
 * Either {@link Ok} containing a successful value, or {@link Fail} containing a {@link Status}.
 *
 * <p>Failures are enriched as they travel back up the call stack:
 * <pre>{@code
 * Outcome<Config> loadConfig(Path path) {
 *     return readFile(path)
 *             .withContext("config_path", path.toString())
 *             .wrapFailure(AppError.CONFIG_LOAD_FAILED)
 *             .flatMap(this::parse);
 * }
 * }</pre>
 *
 * @param <T> The type of the successful value
 */
public sealed interface Outcome<T> permits Outcome.Ok, Outcome.Fail {

    /**
     * A successful outcome containing a value.
     *
     * @param value the successful value
     */
    record Ok<T>(T value) implements Outcome<T> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public boolean isFail() {
            return false;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            return value;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }

        @Override
        public Outcome<T> recover(Function<? super Status, ? extends T> recovery) {
            return this;
        }

        @Override
        public Outcome<T> recoverWith(Function<? super Status, ? extends Outcome<T>> recovery) {
            return this;
        }

        @Override
        public Outcome<T> withContext(String key, ContextValue value) {
            return this;
        }

        @Override
        public Outcome<T> wrapFailure(Classification classification) {
            return this;
        }
    }

    /**
     * A failed outcome carrying the status that describes the failure.
     *
     * @param status the failure report
     */
    record Fail<T>(Status status) implements Outcome<T> {

        public Fail {
            Objects.requireNonNull(status, "status must not be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public boolean isFail() {
            return true;
        }

        @Override
        public T getOrThrow() {
            throw new StatusException(status);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            Objects.requireNonNull(supplier);
            return supplier.get();
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Fail<>(status);
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            return new Fail<>(status);
        }

        @Override
        public Outcome<T> recover(Function<? super Status, ? extends T> recovery) {
            Objects.requireNonNull(recovery);
            return new Ok<>(recovery.apply(status));
        }

        @Override
        public Outcome<T> recoverWith(Function<? super Status, ? extends Outcome<T>> recovery) {
            Objects.requireNonNull(recovery);
            return recovery.apply(status);
        }

        @Override
        public Outcome<T> withContext(String key, ContextValue value) {
            status.withContext(key, value);
            return this;
        }

        @Override
        public Outcome<T> wrapFailure(Classification classification) {
            return new Fail<>(status.wrap(classification));
        }
    }

    // Query methods
    boolean isOk();
    boolean isFail();

    /**
     * Returns the failure status, or empty for a successful outcome.
     */
    default Optional<Status> failure() {
        return this instanceof Fail<T> fail ? Optional.of(fail.status()) : Optional.empty();
    }

    // Value extraction
    T getOrThrow();
    T getOrElse(T defaultValue);
    T getOrElseGet(Supplier<? extends T> supplier);

    // Transformations
    <U> Outcome<U> map(Function<? super T, ? extends U> mapper);
    <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper);

    // Recovery
    Outcome<T> recover(Function<? super Status, ? extends T> recovery);
    Outcome<T> recoverWith(Function<? super Status, ? extends Outcome<T>> recovery);

    // Propagation
    /**
     * Appends context to the failure status. Has no effect on a successful outcome.
     */
    Outcome<T> withContext(String key, ContextValue value);

    default Outcome<T> withContext(String key, String value) {
        return withContext(key, ContextValue.of(value));
    }

    default Outcome<T> withContext(String key, long value) {
        return withContext(key, ContextValue.of(value));
    }

    default Outcome<T> withContext(String key, boolean value) {
        return withContext(key, ContextValue.of(value));
    }

    /**
     * Re-classifies a failure, keeping the original status as its cause.
     * Has no effect on a successful outcome.
     */
    Outcome<T> wrapFailure(Classification classification);

    // Static factories
    static Outcome<Void> ok() {
        return new Ok<>(null);
    }

    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Outcome<T> fail(Status status) {
        return new Fail<>(status);
    }

    /**
     * Creates a failed outcome with a fresh status of the given classification.
     */
    static <T> Outcome<T> fail(Classification classification) {
        return new Fail<>(Status.of(classification));
    }

    /**
     * Returns {@code ok()} if the condition holds, otherwise a failure built by the supplier.
     *
     * @param condition the condition that must hold
     * @param failure supplies the status when the condition does not hold
     */
    static Outcome<Void> ensure(boolean condition, Supplier<Status> failure) {
        Objects.requireNonNull(failure, "failure must not be null");
        return condition ? ok() : fail(failure.get());
    }
}
