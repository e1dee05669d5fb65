package jsonkit;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import jsonkit.JsonException.MalformedInputException;
import lombok.Builder;
import lombok.Singular;
import org.jspecify.annotations.Nullable;

/**
 * Recursive-descent JSON decoder producing plain Java values.
 *
 * <p> JSON maps to {@code null}, {@link Boolean}, {@link Integer}/{@link Long}/{@link BigInteger}, {@link Double},
 * {@link String}, {@code List<Object>} and {@code Map<String, Object>} (insertion ordered). Each decoded string
 * value and object is then offered to the {@link Recognizer}s in order; the first one that claims it replaces
 * it. Object keys are never offered.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * Decoder decoder = Tier.ADVANCED.decoder();
 * Object v = decoder.decode("{\"real\": 1.0, \"imag\": 2.0}");
 * // -> Complex[real=1.0, imag=2.0]
 * }</pre>
 *
 * <p> Instances are immutable and may be shared between threads.
 *
 * @since 0.1.0
 */
@Builder(toBuilder = true)
public final class Decoder {

    public static final int DEFAULT_MAX_DEPTH = 512;

    /**
     * Charset for {@link #decode(byte[])}.
     */
    @Builder.Default
    private final Charset charset = StandardCharsets.UTF_8;

    @Builder.Default
    private final int maxDepth = DEFAULT_MAX_DEPTH;

    /**
     * Whether {@link #decode(String, TypeDescriptor)} is available.
     */
    private final boolean reconstruction;

    @Singular("recognizer")
    private final List<Recognizer> recognizers;

    public Charset charset() {
        return charset;
    }

    public @Nullable Object decode(String text) {
        Objects.requireNonNull(text, "text");
        var scanner = new Scanner(text, maxDepth);
        if (text.isEmpty()) throw scanner.error("Empty JSON text");
        scanner.skipBom();
        Object value = readValue(scanner);
        scanner.skipWhitespace();
        if (!scanner.eof()) throw scanner.error("Trailing characters after top-level value");
        return value;
    }

    public @Nullable Object decode(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return decode(new String(bytes, charset));
    }

    /**
     * Decode, then rebuild the result as an instance of {@code type}.
     *
     * @throws JsonException.CastingException if the decoded shape does not fit the type's fields
     * @throws IllegalStateException          if this decoder was not built with reconstruction enabled
     */
    public <T> T decode(String text, TypeDescriptor<T> type) {
        Objects.requireNonNull(type, "type");
        if (!reconstruction) throw new IllegalStateException("Typed decoding requires the CUSTOM tier");
        return Reconstructor.reconstruct(decode(text), type);
    }

    @Nullable Object readValue(Scanner s) {
        char c = s.peekSignificant();
        switch (c) {
            case 'n' -> {
                s.readKeyword("null");
                return null;
            }
            case 't', 'f' -> {
                return s.readBoolean();
            }
            case '"' -> {
                return recognize(s.readString());
            }
            case '[' -> {
                return readArray(s);
            }
            case '{' -> {
                return recognize(readObject(s));
            }
            default -> {
                if (Scanner.startsNumber(c)) return parseNumber(s.readNumber());
                throw s.error("Unexpected character: '" + c + "'");
            }
        }
    }

    List<Object> readArray(Scanner s) {
        s.enter();
        s.expect('[');
        List<Object> list = new ArrayList<>();
        if (s.peekSignificant() == ']') {
            s.skip();
            s.leave();
            return list;
        }
        while (true) {
            list.add(readValue(s));
            char c = s.peekSignificant();
            s.skip();
            if (c == ']') break;
            if (c != ',') throw arrayError(s);
        }
        s.leave();
        return list;
    }

    Map<String, Object> readObject(Scanner s) {
        s.enter();
        s.expect('{');
        Map<String, Object> m = new LinkedHashMap<>();
        if (s.peekSignificant() == '}') {
            s.skip();
            s.leave();
            return m;
        }
        while (true) {
            if (s.peekSignificant() != '"') throw s.error("Expected string key in object");
            String key = s.readString();
            if (s.peekSignificant() != ':') throw s.error("Expected ':' after object key");
            s.skip();
            m.put(key, readValue(s));
            char c = s.peekSignificant();
            s.skip();
            if (c == '}') break;
            if (c != ',') throw objectError(s);
        }
        s.leave();
        return m;
    }

    private Object recognize(Object raw) {
        for (var recognizer : recognizers) {
            Optional<Object> value = recognizer.recognize(raw);
            if (value.isPresent()) return value.get();
        }
        return raw;
    }

    /**
     * Integers become the narrowest of {@link Integer}, {@link Long} and {@link BigInteger}; anything with a
     * fraction or an exponent becomes a {@link Double}, or a {@link BigDecimal} when out of double range.
     */
    static Number parseNumber(String s) {
        boolean integral = true;
        for (int k = 0; k < s.length() && integral; k++) {
            char c = s.charAt(k);
            if (c == '.' || c == 'e' || c == 'E') integral = false;
        }
        if (!integral) {
            double d = Double.parseDouble(s);
            if (Double.isFinite(d)) return d;
            return new BigDecimal(s);
        }
        if (s.length() < 10) return Integer.parseInt(s);
        var big = new BigInteger(s);
        if (big.bitLength() < 32) return big.intValue(); // Do NOT use Ternary Operator here!
        if (big.bitLength() < 64) return big.longValue();
        return big;
    }

    private static MalformedInputException arrayError(Scanner s) {
        return MalformedInputException.at("Expected ',' or ']' in array", s.text(), s.position() - 1);
    }

    private static MalformedInputException objectError(Scanner s) {
        return MalformedInputException.at("Expected ',' or '}' in object", s.text(), s.position() - 1);
    }
}
