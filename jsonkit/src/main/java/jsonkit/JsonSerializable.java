package jsonkit;

/**
 * Lets a type write its own JSON text when encoded by the CUSTOM tier. The text is used as-is.
 *
 * @since 0.1.0
 */
public interface JsonSerializable {
    String toJson();
}
