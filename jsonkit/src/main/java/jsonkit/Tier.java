package jsonkit;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * How much of the Java type system a decoder or encoder maps to JSON.
 *
 * <pre>
 * +--------+---------------+--------------------------------+-------------------------------------+
 * | JSON   | BASIC         | ADVANCED                       | CUSTOM                              |
 * +--------+---------------+--------------------------------+-------------------------------------+
 * | object | Map           | Map, Complex, Range            | Map, Complex, Range, any object     |
 * | array  | List          | any Collection, arrays         | any Collection, arrays              |
 * | string | String        | String, UUID, dates and times  | String, UUID, dates and times       |
 * | number | Number        | Number                         | Number                              |
 * | bool   | Boolean       | Boolean                        | Boolean                             |
 * | null   | null          | null                           | null                                |
 * +--------+---------------+--------------------------------+-------------------------------------+
 * </pre>
 *
 * <p> The CUSTOM decoder recognizes the same values as the ADVANCED one and can also rebuild typed instances,
 * see {@link Decoder#decode(String, TypeDescriptor)}.
 *
 * @since 0.1.0
 */
public enum Tier {
    BASIC,
    ADVANCED,
    CUSTOM;

    public List<Serializer> serializers() {
        return switch (this) {
            case BASIC -> Serializers.basic();
            case ADVANCED -> Serializers.advanced();
            case CUSTOM -> Serializers.custom();
        };
    }

    public List<Recognizer> recognizers() {
        return this == BASIC ? List.of() : Recognizers.advanced();
    }

    public Encoder encoder() {
        return encoder(StandardCharsets.UTF_8);
    }

    public Encoder encoder(Charset charset) {
        return Encoder.builder().charset(charset).serializers(serializers()).build();
    }

    public Decoder decoder() {
        return decoder(StandardCharsets.UTF_8);
    }

    public Decoder decoder(Charset charset) {
        return Decoder.builder()
                .charset(charset)
                .recognizers(recognizers())
                .reconstruction(this == CUSTOM)
                .build();
    }
}
