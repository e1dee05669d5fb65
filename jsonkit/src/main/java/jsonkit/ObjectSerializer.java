package jsonkit;

import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last link of the CUSTOM tier: encodes any plain object.
 *
 * <ol>
 *     <li>{@link JsonStateful}: the equivalent state is encoded in place of the object, unless it is empty</li>
 *     <li>{@link JsonSerializable}: the object's own JSON text is copied as-is</li>
 *     <li>otherwise the fields found by {@link ObjectReflector} are written as a JSON object</li>
 * </ol>
 */
final class ObjectSerializer implements Serializer {

    @Override
    public boolean canSerialize(@Nullable Object o) {
        return ObjectReflector.isPlainObject(o);
    }

    @Override
    public void serialize(Encoder encoder, StringBuilder out, @Nullable Object o) {
        if (o instanceof JsonStateful stateful) {
            Optional<Object> state = stateful.jsonState();
            if (state.isPresent()) {
                encoder.write(out, state.get());
                return;
            }
        }
        if (o instanceof JsonSerializable serializable) {
            out.append(serializable.toJson());
            return;
        }
        LOGGER.debug("Encoding {} by reflection", o.getClass().getName());
        encoder.writeMap(out, ObjectReflector.fields(o));
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(ObjectSerializer.class);
}
