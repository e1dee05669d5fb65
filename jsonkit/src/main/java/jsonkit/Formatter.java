package jsonkit;

import java.util.Objects;
import jsonkit.JsonException.MalformedInputException;
import lombok.Builder;

/**
 * Re-indents JSON text without decoding it.
 *
 * <p> The text is scanned with the same grammar as {@link Decoder}, but scalar tokens are copied exactly as they
 * appear in the input: numbers are not renormalized and string escapes are kept. Whitespace and a byte-order mark
 * before the top-level value, and whitespace after it, are kept too.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * Formatter.builder().lineEnding("\n").itemSeparator(",\n").build().format("{\"a\": [1, 2]}");
 * // {
 * //     "a": [
 * //         1,
 * //         2
 * //     ]
 * // }
 * }</pre>
 *
 * @since 0.1.0
 */
@Builder(toBuilder = true)
public final class Formatter {

    /**
     * Indentation of the top-level value.
     */
    @Builder.Default
    private final int alignBase = 0;

    /**
     * Additional indentation per nesting level.
     */
    @Builder.Default
    private final int indentWidth = 4;

    /**
     * Written between two array elements or object members.
     */
    @Builder.Default
    private final String itemSeparator = ",\r\n";

    @Builder.Default
    private final String keySeparator = ": ";

    /**
     * Written after an opening bracket and after the last element.
     */
    @Builder.Default
    private final String lineEnding = "\r\n";

    @Builder.Default
    private final int maxDepth = Decoder.DEFAULT_MAX_DEPTH;

    public String format(String text) {
        Objects.requireNonNull(text, "text");
        var s = new Scanner(text, maxDepth);
        if (text.isEmpty()) throw s.error("Empty JSON text");
        s.skipBom();
        s.skipWhitespace();
        var out = new StringBuilder(text.length() * 2);
        out.append(text, 0, s.position());
        formatValue(s, out, alignBase, true);
        int end = s.position();
        s.skipWhitespace();
        if (!s.eof()) throw s.error("Trailing characters after top-level value");
        out.append(text, end, text.length());
        return out.toString();
    }

    /**
     * @param indentFirst whether the value starts on a fresh line and needs its own indentation; object member
     *                    values follow their key on the same line
     */
    private void formatValue(Scanner s, StringBuilder out, int align, boolean indentFirst) {
        char c = s.peekSignificant();
        if (indentFirst) indent(out, align);
        switch (c) {
            case '[' -> formatArray(s, out, align);
            case '{' -> formatObject(s, out, align);
            default -> {
                int start = s.position();
                skipScalar(s, c);
                out.append(s.text(), start, s.position());
            }
        }
    }

    private static void skipScalar(Scanner s, char c) {
        switch (c) {
            case 'n' -> s.readKeyword("null");
            case 't', 'f' -> s.readBoolean();
            case '"' -> s.readString(null);
            default -> {
                if (Scanner.startsNumber(c)) s.readNumber();
                else throw s.error("Unexpected character: '" + c + "'");
            }
        }
    }

    private void formatArray(Scanner s, StringBuilder out, int align) {
        s.enter();
        s.expect('[');
        if (s.peekSignificant() == ']') {
            s.skip();
            s.leave();
            out.append("[]");
            return;
        }
        out.append('[').append(lineEnding);
        while (true) {
            formatValue(s, out, align + indentWidth, true);
            char c = s.peekSignificant();
            s.skip();
            if (c == ']') {
                out.append(lineEnding);
                break;
            }
            if (c != ',') throw error("Expected ',' or ']' in array", s);
            out.append(itemSeparator);
        }
        indent(out, align);
        out.append(']');
        s.leave();
    }

    private void formatObject(Scanner s, StringBuilder out, int align) {
        s.enter();
        s.expect('{');
        if (s.peekSignificant() == '}') {
            s.skip();
            s.leave();
            out.append("{}");
            return;
        }
        out.append('{').append(lineEnding);
        int inner = align + indentWidth;
        while (true) {
            if (s.peekSignificant() != '"') throw s.error("Expected string key in object");
            indent(out, inner);
            int start = s.position();
            s.readString(null);
            out.append(s.text(), start, s.position());
            if (s.peekSignificant() != ':') throw s.error("Expected ':' after object key");
            s.skip();
            out.append(keySeparator);
            formatValue(s, out, inner, false);
            char c = s.peekSignificant();
            s.skip();
            if (c == '}') {
                out.append(lineEnding);
                break;
            }
            if (c != ',') throw error("Expected ',' or '}' in object", s);
            out.append(itemSeparator);
        }
        indent(out, align);
        out.append('}');
        s.leave();
    }

    private static void indent(StringBuilder out, int n) {
        for (int k = 0; k < n; k++) out.append(' ');
    }

    private static MalformedInputException error(String msg, Scanner s) {
        return MalformedInputException.at(msg, s.text(), s.position() - 1);
    }
}
