package org.javai.result;

/**
 * Thrown when {@link Result#get()} or {@link Result#error()} is called on a result that is
 * not in the matching state.
 * This is an unchecked exception because it indicates misuse of the API: the caller should
 * have checked {@link Result#type()} first, or used {@link Result#match}, {@link Result#recover}
 * or one of the {@code find} accessors.
 */
public class InvalidStateAccessException extends IllegalStateException {

    private final Content expected;
    private final Content actual;

    public InvalidStateAccessException(Content expected, Content actual) {
        super("Invalid state access: expected " + expected + " but result is " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public Content expected() {
        return expected;
    }

    public Content actual() {
        return actual;
    }
}
