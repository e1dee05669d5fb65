package jsonkit;

import org.jspecify.annotations.Nullable;

/**
 * Encoder chain link.
 *
 * <p> {@link #canSerialize(Object)} is a probe: it must not throw, it only tells whether this link takes the value.
 * The {@link Encoder} asks its serializers in order and fails only when none of them does.
 *
 * @since 0.1.0
 */
public interface Serializer {
    boolean canSerialize(@Nullable Object o);

    void serialize(Encoder encoder, StringBuilder out, @Nullable Object o);
}
