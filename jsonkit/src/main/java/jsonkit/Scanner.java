package jsonkit;

import java.util.Objects;
import jsonkit.JsonException.MalformedInputException;
import org.jspecify.annotations.Nullable;

/**
 * Cursor over JSON text holding the token rules shared by {@link Decoder} and {@link Formatter}.
 *
 * <p> One instance per call. The cursor only moves forward; every {@code read*} method consumes exactly
 * the extent of its token and leaves the cursor on the next character.
 */
final class Scanner {

    static final char BOM = '\uFEFF';

    private final String s;
    private final int maxDepth;
    private int i = 0;
    private int depth = 0;

    Scanner(String s, int maxDepth) {
        this.s = Objects.requireNonNull(s);
        this.maxDepth = maxDepth;
    }

    String text() {
        return s;
    }

    int position() {
        return i;
    }

    boolean eof() {
        return i >= s.length();
    }

    void skip() {
        i++;
    }

    void skipBom() {
        if (!eof() && s.charAt(i) == BOM) i++;
    }

    void skipWhitespace() {
        while (!eof()) {
            char c = s.charAt(i);
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') i++;
            else break;
        }
    }

    /**
     * Skips whitespace and returns the next significant character without consuming it.
     */
    char peekSignificant() {
        skipWhitespace();
        if (eof()) throw error("Unexpected end of input while expecting a value");
        return s.charAt(i);
    }

    void expect(char c) {
        if (eof() || s.charAt(i) != c) throw error("Expected '" + c + "'");
        i++;
    }

    void enter() {
        if (++depth > maxDepth) throw error("Nesting too deep (max depth " + maxDepth + ")");
    }

    void leave() {
        depth--;
    }

    void readKeyword(String kw) {
        for (int k = 0; k < kw.length(); k++) {
            if (eof() || s.charAt(i) != kw.charAt(k)) throw error("Invalid literal, expected '" + kw + "'");
            i++;
        }
    }

    /**
     * Reads {@code true} or {@code false}.
     */
    boolean readBoolean() {
        if (!eof() && s.charAt(i) == 't') {
            readKeyword("true");
            return true;
        }
        readKeyword("false");
        return false;
    }

    /**
     * Reads a number matching {@code -?(0|[1-9]\d*)(\.\d+)?([eE][+-]?\d+)?} and returns its lexeme.
     */
    String readNumber() {
        int start = i;
        if (!eof() && s.charAt(i) == '-') i++;
        if (eof()) throw error("Unexpected end of input while parsing number");
        if (s.charAt(i) == '0') i++;
        else if (isDigit(s.charAt(i))) while (!eof() && isDigit(s.charAt(i))) i++;
        else throw error("Invalid number format (integer part)");
        if (!eof() && s.charAt(i) == '.') {
            i++;
            if (eof() || !isDigit(s.charAt(i))) throw error("Invalid number format (fractional part)");
            while (!eof() && isDigit(s.charAt(i))) i++;
        }
        if (!eof() && (s.charAt(i) == 'e' || s.charAt(i) == 'E')) {
            i++;
            if (!eof() && (s.charAt(i) == '+' || s.charAt(i) == '-')) i++;
            if (eof() || !isDigit(s.charAt(i))) throw error("Invalid number format (exponent part)");
            while (!eof() && isDigit(s.charAt(i))) i++;
        }
        return s.substring(start, i);
    }

    /**
     * Reads a quoted string.
     *
     * @param out receives the unescaped content, or {@code null} to only validate and skip the token
     */
    void readString(@Nullable StringBuilder out) {
        expect('"');
        while (!eof()) {
            char c = s.charAt(i++);
            if (c == '"') return;
            if (c == '\\') {
                if (eof()) throw error("Unterminated escape sequence");
                char e = s.charAt(i++);
                char unescaped;
                switch (e) {
                    case '"' -> unescaped = '"';
                    case '\\' -> unescaped = '\\';
                    case '/' -> unescaped = '/';
                    case 'b' -> unescaped = '\b';
                    case 'f' -> unescaped = '\f';
                    case 'n' -> unescaped = '\n';
                    case 'r' -> unescaped = '\r';
                    case 't' -> unescaped = '\t';
                    // one code unit per escape, surrogate halves included
                    case 'u' -> unescaped = (char) readHex4();
                    default -> throw error("Invalid escape sequence: \\" + e);
                }
                if (out != null) out.append(unescaped);
            } else {
                if (c < 0x20) throw error("Unescaped control character in string (ASCII " + (int) c + ")");
                if (out != null) out.append(c);
            }
        }
        throw error("Unterminated string literal");
    }

    String readString() {
        var sb = new StringBuilder();
        readString(sb);
        return sb.toString();
    }

    private int readHex4() {
        int cp = 0;
        for (int k = 0; k < 4; k++) {
            if (eof()) throw error("Unexpected end of input in \\u escape sequence");
            int v = hexVal(s.charAt(i++));
            if (v < 0) throw error("Invalid hexadecimal digit in \\u escape sequence");
            cp = (cp << 4) | v;
        }
        return cp;
    }

    private static int hexVal(char c) {
        if (c >= '0' && c <= '9') return c - '0';
        if (c >= 'a' && c <= 'f') return 10 + (c - 'a');
        if (c >= 'A' && c <= 'F') return 10 + (c - 'A');
        return -1;
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean startsNumber(char c) {
        return c == '-' || isDigit(c);
    }

    MalformedInputException error(String msg) {
        return MalformedInputException.at(msg, s, i);
    }
}
