package org.javai.result;

/**
 * Identifies which of its three states a {@link Result} currently holds.
 */
public enum Content {
    /**
     * No outcome was ever assigned.
     */
    EMPTY,

    /**
     * The result holds a success value.
     */
    VALUE,

    /**
     * The result holds an {@link ErrorInfo}.
     */
    ERROR
}
