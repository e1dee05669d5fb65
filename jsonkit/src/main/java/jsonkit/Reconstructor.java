package jsonkit;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import jsonkit.JsonException.CastingException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds typed instances out of generic decoded values.
 *
 * <ul>
 *     <li>target without fields: constructed with no arguments, whatever was decoded</li>
 *     <li>scalar (including extended scalars such as UUID, dates, {@link Complex}, {@link Range}):
 *     the target must have exactly one field</li>
 *     <li>list: one field per element, matched by position</li>
 *     <li>map: every field must be present as a key, matched by name; extra keys are ignored</li>
 * </ul>
 */
final class Reconstructor {

    private Reconstructor() {
        throw new UnsupportedOperationException();
    }

    static <T> T reconstruct(@Nullable Object value, TypeDescriptor<T> target) {
        LOGGER.debug("Reconstructing {} from {}", target.type().getName(), value == null ? "null" : value.getClass());
        if (target.arity() == 0) return target.newInstance();

        if (value instanceof List<?> list) {
            if (list.size() != target.arity())
                throw new CastingException(
                        "Expected " + target.arity() + " elements, got " + list.size(), target.type());
            Object[] args = new Object[list.size()];
            for (int i = 0; i < args.length; i++) args[i] = adapt(list.get(i), target, i);
            return target.newInstance(args);
        }

        if (value instanceof Map<?, ?> map) {
            Object[] args = new Object[target.arity()];
            for (int i = 0; i < args.length; i++) {
                String name = target.fieldNames().get(i);
                if (!map.containsKey(name))
                    throw new CastingException("Missing field '" + name + "'", target.type());
                args[i] = adapt(map.get(name), target, i);
            }
            return target.newInstance(args);
        }

        if (target.arity() != 1)
            throw new CastingException(
                    "Expected a single-field target for a scalar, found " + target.arity() + " fields", target.type());
        return target.newInstance(adapt(value, target, 0));
    }

    /**
     * Fit a decoded value to the declared type of field {@code index}: numbers are converted between numeric
     * types, maps or lists meant for another reconstructible class are reconstructed in turn, and so are the
     * elements of a {@code List<T>}.
     */
    private static @Nullable Object adapt(@Nullable Object value, TypeDescriptor<?> target, int index) {
        return adapt(value, target.fieldTypes().get(index), target.fieldNames().get(index), target.type());
    }

    private static @Nullable Object adapt(@Nullable Object value, Type declared, String field, Class<?> owner) {
        Class<?> raw = raw(declared);
        if (value == null) {
            if (raw.isPrimitive()) throw new CastingException("Field '" + field + "' cannot be null", owner);
            return null;
        }
        if (value instanceof List<?> list && declared instanceof ParameterizedType p && raw.isAssignableFrom(List.class))
            return adaptElements(list, p.getActualTypeArguments()[0], field, owner);
        if (raw.isInstance(value)) return value;
        if (value instanceof Number n && isNumeric(raw)) return toNumber(n, raw, owner);
        if (raw == boolean.class && value instanceof Boolean) return value;
        if (raw == char.class || raw == Character.class) {
            if (value instanceof String s && s.length() == 1) return s.charAt(0);
        }
        if ((value instanceof Map<?, ?> || value instanceof Collection<?>) && TypeDescriptor.isReconstructible(raw)) {
            return reconstruct(value, TypeDescriptor.of(raw));
        }
        // left for the constructor to reject
        return value;
    }

    /**
     * Element types are erased at run time, so a mismatching element is rejected here rather than by the
     * constructor.
     */
    private static List<@Nullable Object> adaptElements(List<?> list, Type elementType, String field, Class<?> owner) {
        Class<?> elementRaw = raw(elementType);
        List<@Nullable Object> out = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            Object e = adapt(list.get(i), elementType, field + "[" + i + "]", owner);
            if (e != null && !elementRaw.isInstance(e))
                throw new CastingException(
                        "Element " + i + " of field '" + field + "' is not a " + elementRaw.getName(), owner);
            out.add(e);
        }
        return Collections.unmodifiableList(out);
    }

    static Class<?> raw(Type t) {
        if (t instanceof Class<?> c) return c;
        if (t instanceof ParameterizedType p) return (Class<?>) p.getRawType();
        return Object.class;
    }

    private static boolean isNumeric(Class<?> raw) {
        return Number.class.isAssignableFrom(raw) || (raw.isPrimitive() && raw != boolean.class && raw != char.class);
    }

    static Object toNumber(Number n, Class<?> raw, Class<?> owner) {
        if (raw == int.class || raw == Integer.class) return n.intValue();
        if (raw == long.class || raw == Long.class) return n.longValue();
        if (raw == double.class || raw == Double.class) return n.doubleValue();
        if (raw == float.class || raw == Float.class) return n.floatValue();
        if (raw == short.class || raw == Short.class) return n.shortValue();
        if (raw == byte.class || raw == Byte.class) return n.byteValue();
        if (raw == BigDecimal.class) return new BigDecimal(n.toString());
        if (raw == BigInteger.class) {
            if (n instanceof BigInteger b) return b;
            try {
                return new BigDecimal(n.toString()).toBigIntegerExact();
            } catch (ArithmeticException e) {
                throw new CastingException("Number " + n + " is not an integer", owner, e);
            }
        }
        return n;
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(Reconstructor.class);
}
