package org.javai.status;

/**
 * Thrown when {@link Outcome#getOrThrow()} is called on a failed outcome.
 * The caller should have checked {@link Outcome#isFail()} first, or used {@link Outcome#recover}.
 */
public class StatusException extends RuntimeException {

    private final transient Status status;

    public StatusException(Status status) {
        super("Outcome failed: " + status);
        this.status = status;
    }

    public Status status() {
        return status;
    }
}
