package org.javai.result;

import java.util.Objects;

/**
 * A failure description: a human-readable message paired with a machine-readable code.
 *
 * <p>The code is a constant of a caller-defined enum. When no code is given, the enum's
 * first-declared constant is used, so error-code enums usually declare their "no error"
 * sentinel first:
 * <pre>{@code
 * enum ParseError { NONE, SYNTAX, OVERFLOW }
 *
 * ErrorInfo<ParseError> info = ErrorInfo.of("unexpected token", ParseError.SYNTAX);
 * }</pre>
 *
 * @param message Human-readable description, never null (may be empty)
 * @param code Machine-readable code, never null
 * @param <C> The error code enum
 */
public record ErrorInfo<C extends Enum<C>>(String message, C code) {

    public ErrorInfo {
        Objects.requireNonNull(message, "message must not be null, use an empty string");
        Objects.requireNonNull(code, "code must not be null");
    }

    public static <C extends Enum<C>> ErrorInfo<C> of(String message, C code) {
        return new ErrorInfo<>(message, code);
    }

    /**
     * Creates an ErrorInfo with an empty message.
     */
    public static <C extends Enum<C>> ErrorInfo<C> of(C code) {
        return new ErrorInfo<>("", code);
    }

    /**
     * Creates an ErrorInfo carrying the default code of {@code codeType}.
     *
     * @param message Human-readable description
     * @param codeType The error code enum
     */
    public static <C extends Enum<C>> ErrorInfo<C> of(String message, Class<C> codeType) {
        return new ErrorInfo<>(message, defaultCode(codeType));
    }

    /**
     * Creates an ErrorInfo with an empty message and the default code of {@code codeType}.
     */
    public static <C extends Enum<C>> ErrorInfo<C> empty(Class<C> codeType) {
        return new ErrorInfo<>("", defaultCode(codeType));
    }

    /**
     * Returns the first-declared constant of {@code codeType}.
     *
     * @throws IllegalArgumentException if the enum declares no constants
     */
    public static <C extends Enum<C>> C defaultCode(Class<C> codeType) {
        Objects.requireNonNull(codeType, "codeType must not be null");
        C[] constants = codeType.getEnumConstants();
        if (constants == null || constants.length == 0) {
            throw new IllegalArgumentException(
                    "Error code enum " + codeType.getName() + " declares no constants");
        }
        return constants[0];
    }

    @Override
    public String toString() {
        return message.isEmpty() ? code.name() : code.name() + ": " + message;
    }
}
