package org.javai.result.boundary;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.result.ErrorInfo;
import org.javai.result.Result;

import java.util.Objects;

/**
 * The adapter for calling APIs that throw checked exceptions.
 * Catches the exception, translates it into an {@link ErrorInfo}, and returns a {@link Result}.
 *
 * <p>RuntimeExceptions are defects and are not caught: they propagate to the caller.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Boundary<IoError> boundary = Boundary.withCode(IoError.READ_FAILED);
 *
 * Result<String, IoError> content = boundary.call(
 *     "Files.readString",
 *     () -> Files.readString(path)
 * );
 * }</pre>
 *
 * @param <C> The error code enum
 */
public final class Boundary<C extends Enum<C>> {

    private static final Logger logger = LogManager.getLogger(Boundary.class);

    private final ExceptionTranslator<C> translator;

    /**
     * Creates a Boundary that reports every checked exception under {@code code},
     * keeping the exception's message.
     */
    public static <C extends Enum<C>> Boundary<C> withCode(C code) {
        Objects.requireNonNull(code, "code must not be null");
        return new Boundary<>((operation, e) -> ErrorInfo.of(messageOf(e), code));
    }

    public static <C extends Enum<C>> Boundary<C> of(ExceptionTranslator<C> translator) {
        return new Boundary<>(translator);
    }

    public Boundary(ExceptionTranslator<C> translator) {
        this.translator = Objects.requireNonNull(translator, "translator must not be null");
    }

    /**
     * Executes work that may throw checked exceptions, translating any such exception into an error.
     *
     * @param operation The operation name, passed to the translator and logged
     * @param work The work to execute
     * @return Ok with the work's value, or Fail with the translated error
     */
    public <V> Result<V, C> call(String operation, ThrowingSupplier<V, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        try {
            return Result.ok(work.get());
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            return handleException(operation, e);
        }
    }

    private <V> Result<V, C> handleException(String operation, Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        ErrorInfo<C> error = Objects.requireNonNull(
                translator.translate(operation, e), "translator returned null");

        logger.atDebug()
                .log("Operation [{}] failed with {}, translated to [{}]",
                        operation,
                        e.getClass().getSimpleName(),
                        error);
        return Result.fail(error);
    }

    private static String messageOf(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
