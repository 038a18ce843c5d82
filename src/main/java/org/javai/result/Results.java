package org.javai.result;

import java.util.function.Consumer;

/**
 * Static helpers for working with {@link Result}s.
 */
public final class Results {

    private Results() {
    }

    /**
     * Same as {@link Result#match(Consumer, Consumer)}, in call-site form.
     */
    public static <V, C extends Enum<C>> void match(
            Result<V, C> result,
            Consumer<? super V> onValue,
            Consumer<? super ErrorInfo<C>> onError
    ) {
        result.match(onValue, onError);
    }
}
