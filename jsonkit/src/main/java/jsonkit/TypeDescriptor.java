package jsonkit;

import java.beans.ConstructorProperties;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import jsonkit.JsonException.CastingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered field list of a reconstructible type, together with the constructor that takes those fields.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * record Point(int x, int y) {}
 * Point p = Json.loads("{\"y\": 2, \"x\": 1}", TypeDescriptor.of(Point.class));
 * // -> Point[x=1, y=2]
 * }</pre>
 *
 * @param type        the described type
 * @param fieldNames  constructor parameter names, in order
 * @param fieldTypes  constructor parameter types, same order
 * @param constructor constructor accepting the fields positionally
 * @param <T>         the described type
 * @since 0.1.0
 */
public record TypeDescriptor<T>(
        Class<T> type, List<String> fieldNames, List<Type> fieldTypes, Constructor<T> constructor) {

    public TypeDescriptor {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(constructor, "constructor");
        fieldNames = List.copyOf(fieldNames);
        fieldTypes = List.copyOf(fieldTypes);
        if (fieldNames.size() != fieldTypes.size() || fieldNames.size() != constructor.getParameterCount())
            throw new IllegalArgumentException("Field list does not match constructor arity of " + type.getName());
    }

    /**
     * Describe a class by one of its constructors, in order of preference:
     * <ol>
     *     <li>the canonical constructor of a record</li>
     *     <li>a constructor annotated with {@link ConstructorProperties}</li>
     *     <li>the public constructor with the most parameters, whose names must be present in the class file
     *     (compile with {@code -parameters})</li>
     * </ol>
     *
     * @throws IllegalArgumentException if no usable constructor exists
     */
    public static <T> TypeDescriptor<T> of(Class<T> type) {
        Objects.requireNonNull(type, "type");
        var descriptor = type.isRecord() ? ofRecord(type) : ofClass(type);
        LOGGER.debug("Resolved {} to fields {}", type.getName(), descriptor.fieldNames());
        return descriptor;
    }

    public int arity() {
        return fieldNames.size();
    }

    /**
     * Invoke the constructor with already adapted arguments.
     */
    public T newInstance(Object... args) {
        try {
            return constructor.newInstance(args);
        } catch (InvocationTargetException e) {
            throw new CastingException("Constructor rejected the decoded values", type, e.getCause());
        } catch (IllegalArgumentException | ReflectiveOperationException e) {
            throw new CastingException("Failed to construct instance", type, e);
        }
    }

    static boolean isReconstructible(Class<?> raw) {
        return !raw.isPrimitive()
                && !raw.isArray()
                && !raw.isInterface()
                && !raw.isEnum()
                && !Modifier.isAbstract(raw.getModifiers())
                && !ObjectReflector.isJdkClass(raw);
    }

    private static <T> TypeDescriptor<T> ofRecord(Class<T> type) {
        RecordComponent[] components = type.getRecordComponents();
        Class<?>[] raws = Arrays.stream(components).map(RecordComponent::getType).toArray(Class<?>[]::new);
        try {
            Constructor<T> canonical = type.getDeclaredConstructor(raws);
            makeAccessible(canonical);
            return new TypeDescriptor<>(
                    type,
                    Arrays.stream(components).map(RecordComponent::getName).toList(),
                    Arrays.stream(components).map(RecordComponent::getGenericType).toList(),
                    canonical);
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException("No canonical constructor for record " + type.getName(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> TypeDescriptor<T> ofClass(Class<T> type) {
        if (!isReconstructible(type))
            throw new IllegalArgumentException("Cannot reconstruct instances of " + type.getName());
        Constructor<T>[] constructors = (Constructor<T>[]) type.getDeclaredConstructors();

        for (var c : constructors) {
            var props = c.getAnnotation(ConstructorProperties.class);
            if (props != null) {
                makeAccessible(c);
                return new TypeDescriptor<>(type, List.of(props.value()), List.of(c.getGenericParameterTypes()), c);
            }
        }

        Constructor<T> widest = Arrays.stream(constructors)
                .filter(c -> Modifier.isPublic(c.getModifiers()))
                .max(Comparator.comparingInt(Constructor::getParameterCount))
                .orElseThrow(() -> new IllegalArgumentException("No public constructor in " + type.getName()));
        Parameter[] params = widest.getParameters();
        if (params.length > 0 && !params[0].isNamePresent())
            throw new IllegalArgumentException("Constructor parameter names of " + type.getName()
                    + " are not available, compile with -parameters or use @ConstructorProperties");
        makeAccessible(widest);
        return new TypeDescriptor<>(
                type,
                Arrays.stream(params).map(Parameter::getName).toList(),
                List.of(widest.getGenericParameterTypes()),
                widest);
    }

    private static void makeAccessible(Constructor<?> c) {
        if (!c.trySetAccessible())
            throw new IllegalArgumentException("Constructor is not accessible: " + c);
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(TypeDescriptor.class);
}
