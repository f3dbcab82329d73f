package org.javai.status.boundary;

import java.util.Objects;
import org.javai.status.Outcome;
import org.javai.status.Status;
import org.javai.status.ops.StatusReporter;

/**
 * The boundary adapter for integrating APIs that throw checked exceptions.
 * Catches exceptions, translates them into statuses, reports them, and returns Outcome.
 *
 * <p>After passing through a Boundary, code reports failures as {@link Status} values flowing
 * through {@link Outcome}, and each caller adds context as the failure travels up.</p>
 *
 * <p>RuntimeExceptions (defects) are not caught; they propagate unchanged.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Boundary boundary = Boundary.of(
 *     ExceptionTranslator.to(StorageError.IO).when(NoSuchFileException.class, StorageError.NOT_FOUND),
 *     new Log4jStatusReporter(renderer, Locale.ENGLISH));
 *
 * Outcome<String> content = boundary.call("Files.readString", () -> Files.readString(path))
 *     .withContext("path", path.toString());
 * }</pre>
 */
public final class Boundary {

    /**
     * Context key under which the operation name is recorded.
     */
    public static final String OPERATION_KEY = "operation";

    private final ExceptionTranslator translator;
    private final StatusReporter reporter;

    /**
     * Work that may throw a checked exception.
     *
     * @param <T> The type of value produced
     */
    @FunctionalInterface
    public interface Work<T> {
        T run() throws Exception;
    }

    /**
     * Creates a Boundary that translates failures but does not report them.
     */
    public static Boundary silent(ExceptionTranslator translator) {
        return new Boundary(translator, StatusReporter.noOp());
    }

    public static Boundary of(ExceptionTranslator translator, StatusReporter reporter) {
        return new Boundary(translator, reporter);
    }

    public Boundary(ExceptionTranslator translator, StatusReporter reporter) {
        this.translator = Objects.requireNonNull(translator, "translator must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Executes work that may throw checked exceptions, translating any exception into an Outcome.
     *
     * @param operation The operation name, recorded in the status context
     * @param work The work to execute
     * @return Ok with the result, or Fail with the translated status
     */
    public <T> Outcome<T> call(String operation, Work<T> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        try {
            return Outcome.ok(work.run());
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return handleException(operation, e);
        }
    }

    private <T> Outcome<T> handleException(String operation, Exception e) {
        Status status = Objects.requireNonNull(translator.translate(operation, e),
                "translator returned null status");
        if (status.isAttached()) {
            throw new IllegalStateException("translator returned a status that is already the cause of another: "
                    + status.classification().id(), e);
        }
        status.withContext(OPERATION_KEY, operation);
        reporter.report(status);
        return Outcome.fail(status);
    }
}
