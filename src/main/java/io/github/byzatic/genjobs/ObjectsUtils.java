package io.github.byzatic.genjobs;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Null checks that throw a caller-chosen exception.
 */
public final class ObjectsUtils {

    private ObjectsUtils() {
    }

    /**
     * Returns {@code obj} if it is not null, otherwise throws {@code exception}.
     *
     * @param obj       value to check
     * @param exception exception thrown when {@code obj} is null
     * @return {@code obj}
     */
    public static <T, E extends Throwable> @NotNull T requireNonNull(@Nullable T obj, @NotNull E exception) throws E {
        if (obj == null) throw exception;
        return obj;
    }

    /**
     * Throws {@code exception} if {@code condition} is false.
     */
    public static <E extends Throwable> void requireTrue(boolean condition, @NotNull E exception) throws E {
        if (!condition) throw exception;
    }
}
