package org.javai.status.boundary;

import java.util.Objects;
import org.javai.status.Classification;
import org.javai.status.Status;

/**
 * Translates a checked exception caught at a {@link Boundary} into a status.
 *
 * <p>Translators compose from the general case to the specific ones; later rules are tried first:
 * <pre>{@code
 * ExceptionTranslator translator = ExceptionTranslator.to(StorageError.IO)
 *     .when(NoSuchFileException.class, StorageError.NOT_FOUND)
 *     .when(AccessDeniedException.class, StorageError.PERMISSION_DENIED);
 * }</pre>
 */
@FunctionalInterface
public interface ExceptionTranslator {

    /**
     * Describes the exception as a status.
     *
     * @param operation The operation that was being performed
     * @param exception The exception that occurred
     * @return a new status that is not yet the cause of another; {@link Boundary} adds context to it
     */
    Status translate(String operation, Exception exception);

    /**
     * Translates every exception to the given classification via {@link Status#fromException}.
     */
    static ExceptionTranslator to(Classification classification) {
        Objects.requireNonNull(classification, "classification must not be null");
        return (operation, exception) -> Status.fromException(classification, exception);
    }

    /**
     * Translates every exception to the given classification via {@link Status#fromInternalException},
     * keeping the exception text out of the rendered message.
     */
    static ExceptionTranslator toInternal(Classification classification) {
        Objects.requireNonNull(classification, "classification must not be null");
        return (operation, exception) -> Status.fromInternalException(classification, exception);
    }

    /**
     * Returns a translator that maps exceptions of the given type to a classification and
     * delegates everything else to this translator.
     */
    default ExceptionTranslator when(Class<? extends Exception> type, Classification classification) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(classification, "classification must not be null");
        return (operation, exception) -> type.isInstance(exception)
                ? Status.fromException(classification, exception)
                : translate(operation, exception);
    }
}
