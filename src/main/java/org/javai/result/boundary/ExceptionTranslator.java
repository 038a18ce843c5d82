package org.javai.result.boundary;

import org.javai.result.ErrorInfo;

/**
 * Translates a checked exception into an {@link ErrorInfo}.
 *
 * @param <C> The error code enum
 */
@FunctionalInterface
public interface ExceptionTranslator<C extends Enum<C>> {

    /**
     * @param operation The operation that failed
     * @param exception The exception thrown by the operation
     * @return the error describing the failure, never null
     */
    ErrorInfo<C> translate(String operation, Exception exception);
}
