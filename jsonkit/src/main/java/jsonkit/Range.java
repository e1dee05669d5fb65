package jsonkit;

import org.jspecify.annotations.Nullable;

/**
 * Range with optional bounds, encoded as {@code {"start": v, "stop": v, "step": v}}.
 * A {@code null} component is an open bound.
 *
 * @param start first value, inclusive
 * @param stop  last value, exclusive
 * @param step  increment
 * @since 0.1.0
 */
public record Range(@Nullable Object start, @Nullable Object stop, @Nullable Object step) {

    public static Range of(@Nullable Object start, @Nullable Object stop, @Nullable Object step) {
        return new Range(start, stop, step);
    }

    public static Range to(@Nullable Object stop) {
        return new Range(null, stop, null);
    }
}
