package io.credway.commons.guava;

import com.google.common.base.Throwables;

public class ThrowablesUtil
{
    private ThrowablesUtil()
    { }

    /**
     * Rethrows an unchecked throwable as is and wraps a checked one in a RuntimeException.
     * Declared to return RuntimeException so that callers can write {@code throw propagate(e)}.
     */
    public static RuntimeException propagate(Throwable throwable)
    {
        Throwables.throwIfUnchecked(throwable);
        throw new RuntimeException(throwable);
    }

    public static <X extends Throwable> void propagateIfInstanceOf(Throwable throwable, Class<X> declaredType)
            throws X
    {
        if (throwable != null) {
            Throwables.throwIfInstanceOf(throwable, declaredType);
        }
    }
}
