package jsonkit;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The recognizers of the ADVANCED and CUSTOM tiers.
 *
 * <p> String recognizers require the whole string to match; object recognizers compare key sets regardless of
 * key order. An object whose keys are exactly {@code real, imag} or {@code start, stop, step} is always taken
 * for a {@link Complex} or a {@link Range}, even when it was meant as a plain object.
 *
 * @since 0.1.0
 */
public final class Recognizers {

    static final Pattern UUID_PATTERN = Pattern.compile(
            "[a-f0-9]{8}-[a-f0-9]{4}-[1-5][a-f0-9]{3}-[89ab][a-f0-9]{3}-[a-f0-9]{12}", Pattern.CASE_INSENSITIVE);

    static final String DATE = "(?<year>[12]\\d{3})-(?<month>0[1-9]|1[0-2])-(?<day>0[1-9]|[12]\\d|3[01])";
    static final String TIME = "(?<hour>2[0-3]|[01]\\d):(?<minute>[0-5]\\d)"
            + "(?::(?<second>[0-5]\\d)(?:\\.(?<fraction>\\d{1,6})\\d{0,6})?)?";
    static final String OFFSET = "(?<offset>[Zz]|[+-]\\d{2}(?::?\\d{2})?)?";

    static final Pattern DATE_TIME_PATTERN = Pattern.compile(DATE + "[T ]" + TIME + OFFSET);
    static final Pattern DATE_PATTERN = Pattern.compile(DATE);
    static final Pattern TIME_PATTERN = Pattern.compile(TIME);

    static final Set<String> COMPLEX_KEYS = Set.of("real", "imag");
    static final Set<String> RANGE_KEYS = Set.of("start", "stop", "step");

    public static final Recognizer UUIDS = raw -> {
        if (raw instanceof String s && UUID_PATTERN.matcher(s).matches()) return Optional.of(UUID.fromString(s));
        return Optional.empty();
    };

    public static final Recognizer DATE_TIMES = lenient(raw -> matching(raw, DATE_TIME_PATTERN).<Object>map(m -> {
        LocalDateTime local = LocalDateTime.of(date(m), time(m));
        String offset = m.group("offset");
        return offset == null ? local : OffsetDateTime.of(local, offset(offset));
    }));

    public static final Recognizer DATES = lenient(raw -> matching(raw, DATE_PATTERN).<Object>map(Recognizers::date));

    public static final Recognizer TIMES = lenient(raw -> matching(raw, TIME_PATTERN).<Object>map(Recognizers::time));

    public static final Recognizer COMPLEX_NUMBERS = raw -> {
        if (!(raw instanceof Map<?, ?> m) || !m.keySet().equals(COMPLEX_KEYS)) return Optional.empty();
        Object real = m.get("real"), imag = m.get("imag");
        if (!isNumberOrNull(real) || !isNumberOrNull(imag)) return Optional.empty();
        return Optional.of(new Complex(doubleOrZero(real), doubleOrZero(imag)));
    };

    public static final Recognizer RANGES = raw -> {
        if (!(raw instanceof Map<?, ?> m) || !m.keySet().equals(RANGE_KEYS)) return Optional.empty();
        return Optional.of(new Range(m.get("start"), m.get("stop"), m.get("step")));
    };

    private Recognizers() {
        throw new UnsupportedOperationException();
    }

    /**
     * UUID, date-time, date, time, complex and range recognition, in that order.
     */
    public static List<Recognizer> advanced() {
        return List.of(UUIDS, DATE_TIMES, DATES, TIMES, COMPLEX_NUMBERS, RANGES);
    }

    private static Optional<Matcher> matching(Object raw, Pattern pattern) {
        if (!(raw instanceof String s)) return Optional.empty();
        Matcher m = pattern.matcher(s);
        return m.matches() ? Optional.of(m) : Optional.empty();
    }

    static LocalDate date(Matcher m) {
        return LocalDate.of(
                Integer.parseInt(m.group("year")),
                Integer.parseInt(m.group("month")),
                Integer.parseInt(m.group("day")));
    }

    static LocalTime time(Matcher m) {
        String second = m.group("second"), fraction = m.group("fraction");
        int micros = fraction == null ? 0 : Integer.parseInt(padRight(fraction, 6));
        return LocalTime.of(
                Integer.parseInt(m.group("hour")),
                Integer.parseInt(m.group("minute")),
                second == null ? 0 : Integer.parseInt(second),
                micros * 1000);
    }

    /**
     * Parses {@code Z}, {@code z}, {@code +HH}, {@code +HHMM} or {@code +HH:MM} (and the negative forms).
     */
    static ZoneOffset offset(String s) {
        if (s.equals("Z") || s.equals("z")) return ZoneOffset.UTC;
        int hours = Integer.parseInt(s.substring(1, 3));
        int minutes = s.length() > 3 ? Integer.parseInt(s.substring(s.length() - 2)) : 0;
        int total = hours * 60 + minutes;
        return ZoneOffset.ofTotalSeconds((s.charAt(0) == '-' ? -total : total) * 60);
    }

    private static String padRight(String s, int width) {
        var sb = new StringBuilder(s);
        while (sb.length() < width) sb.append('0');
        return sb.toString();
    }

    private static boolean isNumberOrNull(Object o) {
        return o == null || o instanceof Number;
    }

    private static double doubleOrZero(Object o) {
        return o == null ? 0d : ((Number) o).doubleValue();
    }

    /**
     * Wraps a recognizer so that a calendar-invalid match, such as {@code 2017-02-31}, counts as no match.
     */
    static Recognizer lenient(Recognizer recognizer) {
        return raw -> {
            try {
                return recognizer.recognize(raw);
            } catch (DateTimeException e) {
                LOGGER.trace("Keeping {} as a string: {}", raw, e.getMessage());
                return Optional.empty();
            }
        };
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(Recognizers.class);
}
