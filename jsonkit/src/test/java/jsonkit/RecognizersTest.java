package jsonkit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertAll;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RecognizersTest {

    private final Decoder advanced = Tier.ADVANCED.decoder();

    @Nested
    class Strings {

        @Test
        void recognizeStrings() {
            // @spotless:off
            var table = new Object[][] {
                    {"\"6ba7b810-9dad-11d1-80b4-00c04fd430c8\"", UUID.fromString("6ba7b810-9dad-11d1-80b4-00c04fd430c8")},
                    {"\"6BA7B810-9DAD-11D1-80B4-00C04FD430C8\"", UUID.fromString("6ba7b810-9dad-11d1-80b4-00c04fd430c8")},
                    {"\"2017-11-20T10:53:22-05:00\"", OffsetDateTime.of(2017, 11, 20, 10, 53, 22, 0, ZoneOffset.ofHours(-5))},
                    {"\"2017-11-20T10:53:22Z\"", OffsetDateTime.of(2017, 11, 20, 10, 53, 22, 0, ZoneOffset.UTC)},
                    {"\"2017-11-20T10:53:22z\"", OffsetDateTime.of(2017, 11, 20, 10, 53, 22, 0, ZoneOffset.UTC)},
                    {"\"2017-11-20T10:53:22+0530\"", OffsetDateTime.of(2017, 11, 20, 10, 53, 22, 0, ZoneOffset.ofHoursMinutes(5, 30))},
                    {"\"2017-11-20T10:53:22+05\"", OffsetDateTime.of(2017, 11, 20, 10, 53, 22, 0, ZoneOffset.ofHours(5))},
                    {"\"2017-11-20 10:53\"", LocalDateTime.of(2017, 11, 20, 10, 53)},
                    {"\"2017-11-20T10:53:22.5\"", LocalDateTime.of(2017, 11, 20, 10, 53, 22, 500_000_000)},
                    {"\"2017-11-20\"", LocalDate.of(2017, 11, 20)},
                    {"\"10:53\"", LocalTime.of(10, 53)},
                    {"\"10:53:22.123\"", LocalTime.of(10, 53, 22, 123_000_000)},
                    {"\"10:53:22.123456789012\"", LocalTime.of(10, 53, 22, 123_456_000)},
            };
            // @spotless:on

            assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
                var row = table[i];
                assertThat(advanced.decode((String) row[0]))
                        .as("Case %d: input=%s", i, row[0])
                        .isEqualTo(row[1]);
            }));
        }

        @Test
        void keepNearMissesAsStrings() {
            // @spotless:off
            var table = new String[] {
                    "6ba7b810-9dad-61d1-80b4-00c04fd430c8",
                    "6ba7b810-9dad-11d1-80b4-00c04fd430c8 ",
                    "2017-02-31",
                    "2017-13-01",
                    "0999-01-01",
                    "2017-11-20T24:00",
                    "25:00",
                    "10:60",
                    "2017-11-20T10:53:22+5",
                    "hello",
            };
            // @spotless:on

            assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
                var input = "\"" + table[i] + "\"";
                assertThat(advanced.decode(input)).as("Case %d: input=%s", i, input).isEqualTo(table[i]);
            }));
        }

        @Test
        void keysAreNeverRecognized() {
            @SuppressWarnings("unchecked")
            var value = (Map<String, Object>) advanced.decode("{\"2017-11-20\": \"2017-11-20\"}");

            assertThat(value.keySet()).containsExactly("2017-11-20");
            assertThat(value.get("2017-11-20")).isEqualTo(LocalDate.of(2017, 11, 20));
        }
    }

    @Nested
    class ObjectShapes {

        @Test
        void recognizeComplexNumbers() {
            assertThat(advanced.decode("{\"real\": 1, \"imag\": 2.5}")).isEqualTo(Complex.of(1, 2.5));
            assertThat(advanced.decode("{\"imag\": -1.0, \"real\": 0.5}")).isEqualTo(Complex.of(0.5, -1));
            assertThat(advanced.decode("{\"real\": null, \"imag\": 3}")).isEqualTo(Complex.of(0, 3));
        }

        @Test
        void keepNonNumericComplexShapeAsMap() {
            var value = advanced.decode("{\"real\": \"a\", \"imag\": 1}");

            assertThat(value).isInstanceOf(Map.class);
        }

        @Test
        void requireExactKeySet() {
            assertThat(advanced.decode("{\"real\": 1, \"imag\": 2, \"x\": 3}")).isInstanceOf(Map.class);
            assertThat(advanced.decode("{\"real\": 1}")).isInstanceOf(Map.class);
            assertThat(advanced.decode("{\"start\": 1, \"stop\": 2}")).isInstanceOf(Map.class);
        }

        @Test
        void recognizeRangesByKeyName() {
            assertThat(advanced.decode("{\"start\": 1, \"stop\": 5, \"step\": 2}")).isEqualTo(Range.of(1, 5, 2));
            assertThat(advanced.decode("{\"step\": 2, \"stop\": 5, \"start\": 1}")).isEqualTo(Range.of(1, 5, 2));
            assertThat(advanced.decode("{\"start\": null, \"stop\": 3, \"step\": null}")).isEqualTo(Range.to(3));
        }

        @Test
        void recognizeNestedValues() {
            var value = advanced.decode("[false, {\"haha\": {\"real\": 2.0, \"imag\": 3.0}, "
                    + "\"toto\": [false, \"2017-11-20T10:53:22-05:00\"]}]");

            var expected = new LinkedHashMap<String, Object>();
            expected.put("haha", Complex.of(2, 3));
            expected.put("toto", List.of(false, OffsetDateTime.of(2017, 11, 20, 10, 53, 22, 0, ZoneOffset.ofHours(-5))));
            assertThat(value).isEqualTo(List.of(false, expected));
        }
    }

    @Test
    void lenientRecognizerTreatsCalendarErrorsAsNoMatch() {
        Recognizer strict = raw -> {
            throw new DateTimeException("bad");
        };

        assertThat(Recognizers.lenient(strict).recognize("x")).isEqualTo(Optional.empty());
    }

    @Test
    void customRecognizerRunsAfterBuiltIns() {
        var decoder = Tier.ADVANCED.decoder().toBuilder()
                .recognizer(raw -> "yes".equals(raw) ? Optional.of(true) : Optional.empty())
                .build();

        assertThat(decoder.decode("[\"yes\", \"no\", \"2017-11-20\"]"))
                .isEqualTo(List.of(true, "no", LocalDate.of(2017, 11, 20)));
    }
}
