package org.javai.result.boundary;

/**
 * Work that produces a value or throws a checked exception.
 * Handed to {@link Boundary#call} so the exception can become an error result.
 *
 * @param <V> The type of value produced
 * @param <E> The checked exception the work may throw
 */
@FunctionalInterface
public interface ThrowingSupplier<V, E extends Exception> {

    V get() throws E;
}
