package jsonkit;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;

/**
 * The serializers of the BASIC and ADVANCED tiers.
 *
 * @since 0.1.0
 */
public final class Serializers {

    static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ssXXX");
    static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");
    static final DateTimeFormatter OFFSET_TIME = DateTimeFormatter.ofPattern("HH:mm:ssXXX");

    // BASIC

    public static final Serializer NULL = of(o -> o == null, (encoder, out, o) -> out.append("null"));

    public static final Serializer BOOLEAN =
            of(o -> o instanceof Boolean, (encoder, out, o) -> out.append((Boolean) o ? "true" : "false"));

    /**
     * Decimal text of any finite number. NaN and the infinities have no JSON form and are not taken.
     */
    public static final Serializer NUMBER = of(Serializers::isFiniteNumber, (encoder, out, o) -> out.append(o));

    public static final Serializer STRING = of(
            o -> o instanceof CharSequence || o instanceof Character,
            (encoder, out, o) -> encoder.writeString(out, o.toString()));

    public static final Serializer LIST =
            of(o -> o instanceof List<?>, (encoder, out, o) -> encoder.writeIterable(out, (List<?>) o));

    public static final Serializer MAP =
            of(o -> o instanceof Map<?, ?>, (encoder, out, o) -> encoder.writeMap(out, (Map<?, ?>) o));

    // ADVANCED

    public static final Serializer UUIDS =
            of(o -> o instanceof UUID, (encoder, out, o) -> encoder.writeString(out, o.toString()));

    public static final Serializer COMPLEX_NUMBERS = of(o -> o instanceof Complex, (encoder, out, o) -> {
        var c = (Complex) o;
        out.append("{\"real\"").append(Encoder.KEY_SEPARATOR);
        encoder.write(out, c.real());
        out.append(Encoder.ITEM_SEPARATOR).append("\"imag\"").append(Encoder.KEY_SEPARATOR);
        encoder.write(out, c.imag());
        out.append('}');
    });

    public static final Serializer RANGES = of(o -> o instanceof Range, (encoder, out, o) -> {
        var r = (Range) o;
        out.append("{\"start\"").append(Encoder.KEY_SEPARATOR);
        encoder.write(out, r.start());
        out.append(Encoder.ITEM_SEPARATOR).append("\"stop\"").append(Encoder.KEY_SEPARATOR);
        encoder.write(out, r.stop());
        out.append(Encoder.ITEM_SEPARATOR).append("\"step\"").append(Encoder.KEY_SEPARATOR);
        encoder.write(out, r.step());
        out.append('}');
    });

    /**
     * ISO-8601 at seconds precision. Date-times always carry an offset, {@code Z} when it is zero.
     */
    public static final Serializer TEMPORALS = of(Serializers::isTemporal, (encoder, out, o) -> {
        encoder.writeString(out, formatTemporal(o, encoder));
    });

    public static final Serializer ENUMS =
            of(o -> o instanceof Enum<?>, (encoder, out, o) -> encoder.writeString(out, ((Enum<?>) o).name()));

    public static final Serializer OPTIONALS =
            of(o -> o instanceof Optional<?>, (encoder, out, o) -> encoder.write(out, ((Optional<?>) o).orElse(null)));

    /**
     * Sets, queues and any other collection.
     */
    public static final Serializer COLLECTIONS = of(
            o -> o instanceof Collection<?>, (encoder, out, o) -> encoder.writeIterable(out, (Collection<?>) o));

    public static final Serializer ARRAYS =
            of(o -> o != null && o.getClass().isArray(), (encoder, out, o) -> encoder.writeArray(out, o));

    private Serializers() {
        throw new UnsupportedOperationException();
    }

    /**
     * null, booleans, numbers, strings, lists and maps.
     */
    public static List<Serializer> basic() {
        return List.of(NULL, BOOLEAN, NUMBER, STRING, LIST, MAP);
    }

    /**
     * {@link #basic()}, then UUIDs, complex numbers, ranges, dates and times, enums, optionals, any collection and
     * any array.
     */
    public static List<Serializer> advanced() {
        var list = new ArrayList<>(basic());
        list.addAll(List.of(UUIDS, COMPLEX_NUMBERS, RANGES, TEMPORALS, ENUMS, OPTIONALS, COLLECTIONS, ARRAYS));
        return List.copyOf(list);
    }

    /**
     * {@link #advanced()}, then reflection over any remaining plain object.
     */
    public static List<Serializer> custom() {
        var list = new ArrayList<>(advanced());
        list.add(new ObjectSerializer());
        return List.copyOf(list);
    }

    static boolean isFiniteNumber(@Nullable Object o) {
        if (!(o instanceof Number n)) return false;
        if (o instanceof Double || o instanceof Float) return Double.isFinite(n.doubleValue());
        return true;
    }

    static boolean isTemporal(@Nullable Object o) {
        return o instanceof LocalDate
                || o instanceof LocalTime
                || o instanceof OffsetTime
                || o instanceof LocalDateTime
                || o instanceof OffsetDateTime
                || o instanceof ZonedDateTime
                || o instanceof Instant;
    }

    static String formatTemporal(Object o, Encoder encoder) {
        if (o instanceof LocalDate d) return d.toString();
        if (o instanceof LocalTime t) return TIME.format(t);
        if (o instanceof OffsetTime t) return OFFSET_TIME.format(t);
        OffsetDateTime odt;
        if (o instanceof OffsetDateTime v) odt = v;
        else if (o instanceof ZonedDateTime z) odt = z.toOffsetDateTime();
        else if (o instanceof Instant i) odt = i.atOffset(ZoneOffset.UTC);
        else odt = ((LocalDateTime) o).atZone(encoder.zone()).toOffsetDateTime();
        return DATE_TIME.format(odt.truncatedTo(ChronoUnit.SECONDS));
    }

    @FunctionalInterface
    interface Writing {
        void write(Encoder encoder, StringBuilder out, Object o);
    }

    static Serializer of(Predicate<@Nullable Object> accepts, Writing writing) {
        return new Serializer() {
            @Override
            public boolean canSerialize(@Nullable Object o) {
                return accepts.test(o);
            }

            @Override
            public void serialize(Encoder encoder, StringBuilder out, @Nullable Object o) {
                writing.write(encoder, out, o);
            }
        };
    }
}
