package jsonkit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertAll;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import jsonkit.JsonException.MalformedInputException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DecoderTest {

    private final Decoder basic = Tier.BASIC.decoder();

    @Nested
    class Literals {

        @Test
        void decodeLiterals() {
            // @spotless:off
            var table = new Object[][] {
                    {"null", null},
                    {"   null", null},
                    {"null   ", null},
                    {" \t\r\n null \t\r\n ", null},
                    {"true", true},
                    {"  false ", false},
                    {"123", 123},
                    {"-345", -345},
                    {"  0  ", 0},
                    {"0.23", 0.23},
                    {"-3.45", -3.45},
                    {"192.0", 192.0},
                    {"1e3", 1000.0},
                    {"1E-2", 0.01},
                    {"-0", 0},
                    {"\"hello\"", "hello"},
                    {"\"\"", ""},
                    {" \"l  sk \\n jfds\"  ", "l  sk \n jfds"},
                    {"[]", List.of()},
                    {"{}", Map.of()},
            };
            // @spotless:on

            assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
                var row = table[i];
                var input = (String) row[0];
                var actual = basic.decode(input);
                assertThat(actual).as("Case %d: input=%s", i, input).isEqualTo(row[1]);
            }));
        }

        @Test
        void integersAndFloatsStayDistinct() {
            assertThat(basic.decode("123")).isInstanceOf(Integer.class);
            assertThat(basic.decode("123.0")).isInstanceOf(Double.class);
            assertThat(basic.decode("1e2")).isInstanceOf(Double.class);
            assertThat(basic.decode("10000000000")).isEqualTo(10000000000L);
            assertThat(basic.decode("-2147483648")).isEqualTo(Integer.MIN_VALUE);
            assertThat(basic.decode("2147483648")).isEqualTo(2147483648L);
            assertThat(basic.decode("9999999999999999999999999"))
                    .isEqualTo(new BigInteger("9999999999999999999999999"));
        }

        @Test
        void hugeExponentsKeepTheirValue() {
            assertThat(basic.decode("1e400")).isEqualTo(new BigDecimal("1e400"));
            assertThat(basic.decode("-1e400")).isEqualTo(new BigDecimal("-1e400"));
            assertThat(basic.decode("[2.5E+999]")).isEqualTo(List.of(new BigDecimal("2.5E+999")));
            assertThat(basic.decode("1e300")).isInstanceOf(Double.class);
        }

        @Test
        void unescapeStrings() {
            // @spotless:off
            var table = new Object[][] {
                    {"\"a\\\"b\"", "a\"b"},
                    {"\"a\\\\b\"", "a\\b"},
                    {"\"a\\/b\"", "a/b"},
                    {"\"\\b\\f\\n\\r\\t\"", "\b\f\n\r\t"},
                    {"\"\\u7890\"", "\u7890"},
                    {"\"\\u00e9t\\u00E9\"", "été"},
                    {"\"\\ud83d\\ude00\"", "😀"},
                    {"\"\\ud83d\"", "\ud83d"},
            };
            // @spotless:on

            assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
                var row = table[i];
                assertThat(basic.decode((String) row[0])).as("Case %d", i).isEqualTo(row[1]);
            }));
        }

        @Test
        void skipByteOrderMark() {
            assertThat(basic.decode("\uFEFF{\"a\": 1}")).isEqualTo(Map.of("a", 1));
        }

        @Test
        void decodeBytesWithCharset() {
            var decoder = Tier.BASIC.decoder(StandardCharsets.UTF_16BE);
            byte[] bytes = "[\"é\"]".getBytes(StandardCharsets.UTF_16BE);
            assertThat(decoder.decode(bytes)).isEqualTo(List.of("é"));
        }
    }

    @Nested
    class Containers {

        @Test
        void nestedArrays() {
            var value = (List<?>) basic.decode("[[[[[[]]]]],[],[],[],[]     ]");

            assertThat(value).hasSize(5);
            Object level = value.get(0);
            int depth = 0;
            while (level instanceof List<?> l && !l.isEmpty()) {
                depth++;
                level = l.get(0);
            }
            assertThat(depth).isEqualTo(4);
            assertThat(level).isEqualTo(List.of());
            assertThat(value.subList(1, 5)).allMatch(List.of()::equals);
        }

        @Test
        void mixedArray() {
            var value = basic.decode(
                    "[ null , false , [\"ldskfjls\", null, [], [[]]],  true, \"x\\u7890\"  , 123, -12312, -0.111 ]   ");

            assertThat(value)
                    .isEqualTo(Arrays.asList(
                            null,
                            false,
                            Arrays.asList("ldskfjls", null, List.of(), List.of(List.of())),
                            true,
                            "x\u7890",
                            123,
                            -12312,
                            -0.111));
        }

        @Test
        void objectKeepsKeyOrder() {
            @SuppressWarnings("unchecked")
            var value = (Map<String, Object>) basic.decode("{\"b\":2,\"a\":1,\"c\":3}");

            assertThat(value.keySet()).containsExactly("b", "a", "c");
        }

        @Test
        void duplicateKeyKeepsFirstPositionAndLastValue() {
            @SuppressWarnings("unchecked")
            var value = (Map<String, Object>) basic.decode("{\"a\":1,\"b\":2,\"a\":3}");

            assertThat(value).containsExactly(Map.entry("a", 3), Map.entry("b", 2));
        }

        @Test
        void deeplyNestedObject() {
            var value = basic.decode("  { \"haha\": 123, \"dslkjf\": false, \"h\\naha1\": null ,"
                    + " \"haha4:\": {\"haha\":{\"haha\":{\"haha2:\":[null, true, -0.334, \"haha\"]}}}}   ");

            assertThat(value).isInstanceOf(Map.class);
            @SuppressWarnings("unchecked")
            var map = (Map<String, Object>) value;
            assertThat(map).containsOnlyKeys("haha", "dslkjf", "h\naha1", "haha4:");
        }

        @Test
        void basicTierLeavesExtendedShapesAlone() {
            assertThat(basic.decode("{\"real\": 1.0, \"imag\": 2.0}")).isEqualTo(Map.of("real", 1.0, "imag", 2.0));
            assertThat(basic.decode("\"2017-11-20\"")).isEqualTo("2017-11-20");
        }
    }

    @Nested
    class Malformed {

        @Test
        void rejectMalformedInput() {
            // @spotless:off
            var table = new String[] {
                    "",
                    "   ",
                    "nullx",
                    "nullsdkflsdf",
                    "djlfsdlnull",
                    "nul",
                    "truefalse",
                    "true false",
                    "  False",
                    "--0.123",
                    ".123",
                    "-.123 ",
                    "01",
                    "1.",
                    "1e",
                    "-",
                    "\"abc",
                    "\"a\\x\"",
                    "\"\\u12g4\"",
                    "\"tab\there\"",
                    "[1, 2",
                    "[1 2]",
                    "[1,]",
                    "{\"a\" 1}",
                    "{a: 1}",
                    "{\"a\": 1,}",
                    "{\"a\": 1] ",
                    "]",
                    "[] []",
            };
            // @spotless:on

            assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> assertThatThrownBy(
                            () -> basic.decode(table[i]))
                    .as("Case %d: input=%s", i, table[i])
                    .isInstanceOf(MalformedInputException.class)));
        }

        @Test
        void reportPosition() {
            assertThatThrownBy(() -> basic.decode("[1,\n  2,\n  x]"))
                    .isInstanceOfSatisfying(MalformedInputException.class, e -> {
                        assertThat(e.getPosition()).isEqualTo(11);
                        assertThat(e.getLine()).isEqualTo(3);
                        assertThat(e.getColumn()).isEqualTo(3);
                    })
                    .hasMessageContaining("Unexpected character: 'x'");
        }

        @Test
        void trailingContent() {
            assertThatThrownBy(() -> basic.decode("{} x"))
                    .isInstanceOf(MalformedInputException.class)
                    .hasMessageContaining("Trailing characters");
        }

        @Test
        void limitNestingDepth() {
            var shallow = Decoder.builder().maxDepth(3).build();

            assertThatCode(() -> shallow.decode("[[[1]]]")).doesNotThrowAnyException();
            assertThatThrownBy(() -> shallow.decode("[[[[1]]]]"))
                    .isInstanceOf(MalformedInputException.class)
                    .hasMessageContaining("Nesting too deep");
        }

        @Test
        void defaultDepthLimitStopsPathologicalInput() {
            String deep = "[".repeat(100_000) + "]".repeat(100_000);

            assertThatThrownBy(() -> basic.decode(deep))
                    .isInstanceOf(MalformedInputException.class)
                    .hasMessageContaining("Nesting too deep");
        }
    }

    @Test
    void typedDecodingNeedsCustomTier() {
        assertThatThrownBy(() -> Tier.ADVANCED.decoder().decode("1", TypeDescriptor.of(Wrapper.class)))
                .isInstanceOf(IllegalStateException.class);
    }

    record Wrapper(int value) {}
}
