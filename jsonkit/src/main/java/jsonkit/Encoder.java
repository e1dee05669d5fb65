package jsonkit;

import java.lang.reflect.Array;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import jsonkit.JsonException.UnsupportedTypeException;
import lombok.Builder;
import lombok.Singular;
import org.jspecify.annotations.Nullable;

/**
 * JSON encoder driven by an ordered chain of {@link Serializer}s.
 *
 * <p> Output is single-line, with {@code ", "} between items and {@code ": "} between a key and its value.
 * Pass the result through a {@link Formatter} for indented output.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * Encoder encoder = Tier.BASIC.encoder();
 * String json = encoder.encode(Map.of("a", List.of(true, false)));
 * // -> {"a": [true, false]}
 * }</pre>
 *
 * @since 0.1.0
 */
@Builder(toBuilder = true)
public final class Encoder {

    static final String ITEM_SEPARATOR = ", ";
    static final String KEY_SEPARATOR = ": ";

    /**
     * Charset used to turn a top-level {@code byte[]} into text.
     */
    @Builder.Default
    private final Charset charset = StandardCharsets.UTF_8;

    /**
     * Zone in which local date-times are placed before being written with an offset.
     */
    @Builder.Default
    private final ZoneId zone = ZoneId.systemDefault();

    @Singular("serializer")
    private final List<Serializer> serializers;

    public Charset charset() {
        return charset;
    }

    public ZoneId zone() {
        return zone;
    }

    public String encode(@Nullable Object o) {
        if (o instanceof byte[] bytes) o = new String(bytes, charset);
        var sb = new StringBuilder();
        write(sb, o);
        return sb.toString();
    }

    /**
     * Write one value with the first serializer that takes it.
     *
     * @throws UnsupportedTypeException if no serializer takes it
     */
    public void write(StringBuilder out, @Nullable Object o) {
        for (var serializer : serializers) {
            if (serializer.canSerialize(o)) {
                serializer.serialize(this, out, o);
                return;
            }
        }
        throw new UnsupportedTypeException("No serializer accepts this value", o == null ? Void.class : o.getClass());
    }

    public void writeString(StringBuilder out, String s) {
        out.append('"');
        escapeTo(out, s);
        out.append('"');
    }

    public void writeIterable(StringBuilder out, Iterable<?> items) {
        out.append('[');
        boolean first = true;
        for (Object e : items) {
            if (!first) out.append(ITEM_SEPARATOR);
            first = false;
            write(out, e);
        }
        out.append(']');
    }

    /**
     * Write a Java array, primitive or not.
     */
    public void writeArray(StringBuilder out, Object arr) {
        out.append('[');
        int len = Array.getLength(arr);
        for (int i = 0; i < len; i++) {
            if (i > 0) out.append(ITEM_SEPARATOR);
            write(out, Array.get(arr, i));
        }
        out.append(']');
    }

    public void writeMap(StringBuilder out, Map<?, ?> map) {
        out.append('{');
        boolean first = true;
        for (var en : map.entrySet()) {
            if (!first) out.append(ITEM_SEPARATOR);
            first = false;
            writeString(out, String.valueOf(en.getKey())); // JSON keys must be strings
            out.append(KEY_SEPARATOR);
            write(out, en.getValue());
        }
        out.append('}');
    }

    static void escapeTo(StringBuilder out, String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\b' -> out.append("\\b");
                case '\f' -> out.append("\\f");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c < 0x20) {
                        out.append("\\u");
                        String hex = Integer.toHexString(c);
                        for (int k = hex.length(); k < 4; k++) out.append('0');
                        out.append(hex);
                    } else {
                        out.append(c);
                    }
                }
            }
        }
    }
}
