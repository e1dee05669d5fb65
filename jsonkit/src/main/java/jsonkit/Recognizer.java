package jsonkit;

import java.util.Optional;

/**
 * Decoder chain link: reinterprets a plain decoded string or object as an extended value.
 *
 * <p> Recognizers never throw for values that are not theirs; they answer {@link Optional#empty()} and the
 * next recognizer of the chain is asked.
 *
 * @since 0.1.0
 */
public interface Recognizer {

    /**
     * @param raw a decoded {@link String} or {@code Map<String, Object>}
     * @return the extended value, or empty when {@code raw} is not of this kind
     */
    Optional<Object> recognize(Object raw);
}
