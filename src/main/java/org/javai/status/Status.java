package org.javai.status;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A failure report: a {@link Classification}, the {@link Context} gathered while the failure
 * propagated, an optional literal message, and an optional cause.
 *
 * <p>A status is created where the failure happens, usually with little context:
 * <pre>{@code
 * Status status = Status.of(StorageError.NOT_FOUND)
 *         .withContext("path", path.toString());
 * }</pre>
 * Each caller on the way up may add what it knows, or re-classify the failure by wrapping it:
 * <pre>{@code
 * return Outcome.fail(status.wrap(AppError.CONFIG_LOAD_FAILED)
 *         .withContext("profile", profile));
 * }</pre>
 *
 * <p>Once a status has been attached as the cause of another, it is frozen: further context or
 * message changes throw {@link IllegalStateException}, and it cannot be attached a second time.
 * This keeps the cause chain singly owned and acyclic.
 *
 * <p>Statuses are built within one thread of control and treated as read-only once shared.
 */
public final class Status {

    /**
     * Context key under which {@link #fromException} records the exception class name.
     */
    public static final String EXCEPTION_TYPE_KEY = "exception.type";

    /**
     * Context key under which {@link #fromInternalException} records the exception message.
     */
    public static final String EXCEPTION_MESSAGE_KEY = "exception.message";

    private final Classification classification;
    private final Context context = new Context();
    private final Status cause;
    private String message;
    private boolean attached;

    private Status(Classification classification, Status cause) {
        this.classification = Objects.requireNonNull(classification, "classification must not be null");
        Classification.requireValidId(classification.id());
        this.cause = cause;
    }

    /**
     * Creates a status with empty context, no cause and no literal message.
     *
     * @param classification what kind of failure occurred
     * @return a new status
     */
    public static Status of(Classification classification) {
        return new Status(classification, null);
    }

    /**
     * Creates a status that re-classifies an earlier failure.
     *
     * <p>The new status has its own, empty context; {@code prior} becomes its cause unchanged and
     * is frozen from then on.
     *
     * @param classification the classification of the new, outer failure
     * @param prior the failure being wrapped
     * @return a new status whose cause is {@code prior}
     * @throws IllegalStateException if {@code prior} is already the cause of another status
     */
    public static Status wrap(Classification classification, Status prior) {
        Objects.requireNonNull(classification, "classification must not be null");
        Objects.requireNonNull(prior, "prior must not be null");
        Classification.requireValidId(classification.id());
        prior.attach();
        return new Status(classification, prior);
    }

    /**
     * Creates a status describing a caught exception whose message is fit for end users.
     *
     * <p>The exception message, if any, becomes the literal message and is rendered verbatim; the
     * exception class name is recorded under {@link #EXCEPTION_TYPE_KEY}. Use
     * {@link #fromInternalException} for exceptions whose text must not reach users.
     */
    public static Status fromException(Classification classification, Throwable throwable) {
        Objects.requireNonNull(throwable, "throwable must not be null");
        Status status = of(classification)
                .withContext(EXCEPTION_TYPE_KEY, throwable.getClass().getName());
        if (throwable.getMessage() != null && !throwable.getMessage().isBlank()) {
            status.withMessage(throwable.getMessage());
        }
        return status;
    }

    /**
     * Creates a status describing a caught exception whose details are internal.
     *
     * <p>No literal message is set, so rendering goes through the template catalog. The exception
     * class name and message are kept as context under {@link #EXCEPTION_TYPE_KEY} and
     * {@link #EXCEPTION_MESSAGE_KEY}, available to logs and programmatic inspection.
     */
    public static Status fromInternalException(Classification classification, Throwable throwable) {
        Objects.requireNonNull(throwable, "throwable must not be null");
        Status status = of(classification)
                .withContext(EXCEPTION_TYPE_KEY, throwable.getClass().getName());
        if (throwable.getMessage() != null && !throwable.getMessage().isBlank()) {
            status.withContext(EXCEPTION_MESSAGE_KEY, throwable.getMessage());
        }
        return status;
    }

    /**
     * Shorthand for {@link #wrap(Classification, Status) Status.wrap(classification, this)}.
     */
    public Status wrap(Classification classification) {
        return wrap(classification, this);
    }

    // === Context ===

    /**
     * Appends a context entry. Earlier entries, including ones with the same key, are kept.
     *
     * @return this status
     */
    public Status withContext(ContextEntry entry) {
        requireNotAttached();
        context.append(entry);
        return this;
    }

    public Status withContext(String key, ContextValue value) {
        return withContext(new ContextEntry(key, value));
    }

    public Status withContext(String key, String value) {
        return withContext(key, ContextValue.of(value));
    }

    public Status withContext(String key, long value) {
        return withContext(key, ContextValue.of(value));
    }

    public Status withContext(String key, boolean value) {
        return withContext(key, ContextValue.of(value));
    }

    /**
     * Sets the literal message, replacing any earlier one.
     *
     * <p>Rendering returns this text verbatim instead of consulting the localization catalog.
     * Context is kept for programmatic inspection.
     *
     * @return this status
     */
    public Status withMessage(String message) {
        Objects.requireNonNull(message, "message must not be null");
        requireNotAttached();
        this.message = message;
        return this;
    }

    // === Accessors ===

    public Classification classification() {
        return classification;
    }

    public Context context() {
        return context;
    }

    public List<ContextEntry> contextEntries() {
        return context.entries();
    }

    public Optional<String> message() {
        return Optional.ofNullable(message);
    }

    public Optional<Status> cause() {
        return Optional.ofNullable(cause);
    }

    /**
     * Returns the chain of statuses starting with this one and following causes inward.
     */
    public StatusChain chain() {
        return new StatusChain(this);
    }

    /**
     * Returns the innermost status of the chain, which is this status if it has no cause.
     */
    public Status rootCause() {
        return chain().root();
    }

    public boolean is(Classification classification) {
        return this.classification.equals(classification);
    }

    /**
     * Returns true if this status or any of its causes has the given classification.
     */
    public boolean hasInChain(Classification classification) {
        return chain().find(classification).isPresent();
    }

    /**
     * Returns true once this status has been attached as the cause of another.
     */
    public boolean isAttached() {
        return attached;
    }

    private void attach() {
        if (attached) {
            throw new IllegalStateException("status is already the cause of another status: " + this);
        }
        attached = true;
    }

    private void requireNotAttached() {
        if (attached) {
            throw new IllegalStateException("status is attached as a cause and can no longer change: "
                    + classification.id());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Status other)) {
            return false;
        }
        return classification.equals(other.classification)
                && context.equals(other.context)
                && Objects.equals(message, other.message)
                && Objects.equals(cause, other.cause);
    }

    @Override
    public int hashCode() {
        return Objects.hash(classification, context, message, cause);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Status[").append(classification.id());
        if (message != null) {
            sb.append(", message=").append(message);
        }
        if (!context.isEmpty()) {
            sb.append(", context=").append(context);
        }
        if (cause != null) {
            sb.append(", cause=").append(cause);
        }
        return sb.append("]").toString();
    }
}
