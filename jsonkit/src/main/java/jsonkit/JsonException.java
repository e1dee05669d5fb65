package jsonkit;

/**
 * Exception thrown when JSON decoding, encoding, formatting or typed reconstruction fails.
 * This is the base exception for all jsonkit errors.
 *
 * @since 0.1.0
 */
public class JsonException extends RuntimeException {

    /**
     * Constructs a new JsonException with the specified detail message.
     *
     * @param message the detail message
     */
    public JsonException(String message) {
        super(message);
    }

    /**
     * Constructs a new JsonException with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause   the cause
     */
    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Thrown when the input text is not well-formed JSON, or when non-whitespace content follows
     * the top-level value.
     */
    public static class MalformedInputException extends JsonException {
        private final int position;
        private final int line;
        private final int column;

        public MalformedInputException(String message, int position, int line, int column) {
            super(String.format("%s at line %d, column %d", message, line, column));
            this.position = position;
            this.line = line;
            this.column = column;
        }

        /**
         * Builds the exception for a cursor offset, deriving the 1-based line and column from the text.
         */
        static MalformedInputException at(String message, CharSequence text, int position) {
            int line = 1, column = 1;
            int end = Math.min(position, text.length());
            for (int i = 0; i < end; i++) {
                if (text.charAt(i) == '\n') {
                    line++;
                    column = 1;
                } else column++;
            }
            return new MalformedInputException(message, position, line, column);
        }

        /**
         * @return zero-based cursor offset into the input text
         */
        public int getPosition() {
            return position;
        }

        public int getLine() {
            return line;
        }

        public int getColumn() {
            return column;
        }
    }

    /**
     * Thrown when no serializer of the encoder chain accepts a value.
     */
    public static class UnsupportedTypeException extends JsonException {
        private final Class<?> type;

        public UnsupportedTypeException(String message, Class<?> type) {
            super(String.format("%s (type: %s)", message, type.getName()));
            this.type = type;
        }

        public UnsupportedTypeException(String message, Class<?> type, Throwable cause) {
            super(String.format("%s (type: %s)", message, type.getName()), cause);
            this.type = type;
        }

        public Class<?> getType() {
            return type;
        }
    }

    /**
     * Thrown when a decoded value cannot be reconstructed as the requested target type.
     */
    public static class CastingException extends JsonException {
        private final Class<?> targetType;

        public CastingException(String message, Class<?> targetType) {
            super(String.format("%s (target: %s)", message, targetType.getName()));
            this.targetType = targetType;
        }

        public CastingException(String message, Class<?> targetType, Throwable cause) {
            super(String.format("%s (target: %s)", message, targetType.getName()), cause);
            this.targetType = targetType;
        }

        public Class<?> getTargetType() {
            return targetType;
        }
    }
}
