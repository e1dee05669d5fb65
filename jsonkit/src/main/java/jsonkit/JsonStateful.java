package jsonkit;

import java.util.Optional;

/**
 * Lets a type stand in an equivalent value for itself when encoded by the CUSTOM tier.
 *
 * <pre>{@code
 * class Account implements JsonStateful {
 *     public Optional<Object> jsonState() {
 *         return Optional.of(Map.of("id", id, "balance", balance));
 *     }
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public interface JsonStateful {

    /**
     * @return the value to encode instead of this one, or empty to fall back to the next strategy
     */
    Optional<Object> jsonState();
}
