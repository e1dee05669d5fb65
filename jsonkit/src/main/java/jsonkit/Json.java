package jsonkit;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Entry points for encoding, decoding and formatting JSON.
 *
 * <p> Every operation takes a {@link Tier}; the overloads without one use {@link Tier#CUSTOM}.
 *
 * @since 0.1.0
 */
public final class Json {

    private static final Map<Tier, Encoder> encoders = new EnumMap<>(Tier.class);
    private static final Map<Tier, Decoder> decoders = new EnumMap<>(Tier.class);
    private static final Formatter defaultFormatter = Formatter.builder().build();

    static {
        for (Tier tier : Tier.values()) {
            encoders.put(tier, tier.encoder());
            decoders.put(tier, tier.decoder());
        }
    }

    private Json() {
        throw new UnsupportedOperationException();
    }

    // ============================================================
    // Encoding
    // ============================================================

    /**
     * Encode any Java value to single-line JSON text.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * record Point(int x, int y) {}
     * String json = Json.dumps(new Point(42, 21));
     * // -> {"x": 42, "y": 21}
     * }</pre>
     *
     * @param value any value, may be {@code null}
     * @return non-null JSON text
     * @throws JsonException.UnsupportedTypeException if the value, or a value inside it, cannot be encoded
     */
    public static String dumps(@Nullable Object value) {
        return dumps(value, Tier.CUSTOM);
    }

    public static String dumps(@Nullable Object value, Tier tier) {
        return dumps(value, tier, null);
    }

    /**
     * @param indent indentation width; when not {@code null} the text is laid out by a {@link Formatter} with
     *               otherwise default settings
     */
    public static String dumps(@Nullable Object value, Tier tier, @Nullable Integer indent) {
        return dumps(value, StandardCharsets.UTF_8, tier, indent);
    }

    /**
     * @param encoding charset for decoding a top-level {@code byte[]} value into text
     */
    public static String dumps(@Nullable Object value, Charset encoding, Tier tier, @Nullable Integer indent) {
        Objects.requireNonNull(encoding, "encoding");
        Objects.requireNonNull(tier, "tier");
        Encoder encoder = encoding.equals(StandardCharsets.UTF_8) ? encoders.get(tier) : tier.encoder(encoding);
        String json = encoder.encode(value);
        if (indent == null) return json;
        Formatter formatter = indent == 4 ? defaultFormatter : Formatter.builder().indentWidth(indent).build();
        return formatter.format(json);
    }

    public static void dump(@Nullable Object value, Writer destination) {
        dump(value, destination, Tier.CUSTOM, null);
    }

    public static void dump(@Nullable Object value, Writer destination, Tier tier, @Nullable Integer indent) {
        Objects.requireNonNull(destination, "destination");
        String json = dumps(value, tier, indent);
        try {
            destination.write(json);
            destination.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write JSON", e);
        }
    }

    /**
     * Encode and write the text to {@code destination} in the given charset. The stream is flushed, not closed.
     */
    public static void dump(
            @Nullable Object value,
            OutputStream destination,
            Charset encoding,
            Tier tier,
            @Nullable Integer indent) {
        Objects.requireNonNull(destination, "destination");
        String json = dumps(value, encoding, tier, indent);
        try {
            var writer = new OutputStreamWriter(destination, encoding);
            writer.write(json);
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write JSON", e);
        }
    }

    // ============================================================
    // Decoding
    // ============================================================

    /**
     * Decode JSON text into plain Java values, recognizing UUIDs, dates and times, complex numbers and ranges.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * Object v = Json.loads("[1, 2.0, \"x\"]");
     * // -> [1, 2.0, x] (Integer, Double, String)
     * }</pre>
     *
     * @param text JSON text, not {@code null}
     * @return decoded value, {@code null} for the JSON {@code null}
     * @throws JsonException.MalformedInputException if the text is not well-formed JSON
     */
    public static @Nullable Object loads(String text) {
        return loads(text, Tier.CUSTOM);
    }

    public static @Nullable Object loads(String text, Tier tier) {
        Objects.requireNonNull(tier, "tier");
        return decoders.get(tier).decode(text);
    }

    public static @Nullable Object loads(byte[] bytes, Charset encoding, Tier tier) {
        Objects.requireNonNull(bytes, "bytes");
        Objects.requireNonNull(encoding, "encoding");
        return loads(new String(bytes, encoding), tier);
    }

    /**
     * Decode JSON text and rebuild it as an instance of the described type. Always uses the CUSTOM tier.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * record Point(int x, int y) {}
     * Point p = Json.loads("[1, 2]", TypeDescriptor.of(Point.class));
     * // -> Point[x=1, y=2]
     * }</pre>
     *
     * @throws JsonException.CastingException if the decoded shape does not fit the type
     */
    public static <T> T loads(String text, TypeDescriptor<T> type) {
        return decoders.get(Tier.CUSTOM).decode(text, type);
    }

    public static <T> T loads(String text, Class<T> type) {
        return loads(text, TypeDescriptor.of(type));
    }

    /**
     * Read the whole source and decode it. The reader is not closed.
     */
    public static @Nullable Object load(Reader source) {
        return load(source, Tier.CUSTOM);
    }

    public static @Nullable Object load(Reader source, Tier tier) {
        return loads(readAll(source), tier);
    }

    public static <T> T load(Reader source, TypeDescriptor<T> type) {
        return loads(readAll(source), type);
    }

    public static @Nullable Object load(InputStream source, Charset encoding, Tier tier) {
        Objects.requireNonNull(source, "source");
        try {
            return loads(source.readAllBytes(), encoding, tier);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read JSON", e);
        }
    }

    // ============================================================
    // Formatting
    // ============================================================

    /**
     * Lay out JSON text with four-space indentation and CRLF line endings.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * Json.format("{\"a\": 1, \"b\": [true, false]}");
     * // -> "{\r\n    \"a\": 1,\r\n    \"b\": [\r\n        true,\r\n        false\r\n    ]\r\n}"
     * }</pre>
     */
    public static String format(String text) {
        return defaultFormatter.format(text);
    }

    public static String format(
            String text, int alignBase, int indentWidth, String itemSeparator, String keySeparator, String lineEnding) {
        return Formatter.builder()
                .alignBase(alignBase)
                .indentWidth(indentWidth)
                .itemSeparator(itemSeparator)
                .keySeparator(keySeparator)
                .lineEnding(lineEnding)
                .build()
                .format(text);
    }

    private static String readAll(Reader source) {
        Objects.requireNonNull(source, "source");
        var sw = new StringWriter();
        try {
            source.transferTo(sw);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read JSON", e);
        }
        return sw.toString();
    }
}
