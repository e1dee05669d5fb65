package jsonkit;

import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Field;
import java.lang.reflect.Member;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Spliterator;
import java.util.stream.BaseStream;
import jsonkit.JsonException.UnsupportedTypeException;
import org.jspecify.annotations.Nullable;

/**
 * Field-level view of plain objects for the CUSTOM tier.
 *
 * <p> Records expose their components, in declaration order. Other classes expose their own instance fields
 * first, then those of each superclass, nearest first; a name already collected hides the inherited field.
 * Static, transient and synthetic fields are skipped, as are callables: fields or record components holding
 * a lambda or typed with a functional interface.
 */
final class ObjectReflector {

    private ObjectReflector() {
        throw new UnsupportedOperationException();
    }

    /**
     * Whether {@code o} is ordinary data, as opposed to program structure (classes, modules, reflective members,
     * code, threads, iterators and streams, exceptions) or an opaque JDK object.
     */
    static boolean isPlainObject(@Nullable Object o) {
        if (o == null) return false;
        Class<?> c = o.getClass();
        return !(o instanceof AnnotatedElement
                || o instanceof Member
                || o instanceof ClassLoader
                || o instanceof Iterator<?>
                || o instanceof Spliterator<?>
                || o instanceof BaseStream<?, ?>
                || o instanceof Thread
                || o instanceof Throwable
                || o instanceof StackTraceElement
                || isCallable(c)
                || isJdkClass(c));
    }

    static boolean isJdkClass(Class<?> c) {
        String name = c.getName();
        return name.startsWith("java.")
                || name.startsWith("javax.")
                || name.startsWith("jdk.")
                || name.startsWith("sun.")
                || name.startsWith("com.sun.");
    }

    /**
     * Lambdas and method references, or a stateless class implementing a functional interface.
     */
    static boolean isCallable(Class<?> c) {
        if (c.isSynthetic() || c.getName().contains("$$Lambda")) return true;
        for (Class<?> i : c.getInterfaces()) {
            if (i.isAnnotationPresent(FunctionalInterface.class) && c.getDeclaredFields().length == 0) return true;
        }
        return false;
    }

    /**
     * Collect the name-to-value pairs of a plain object.
     */
    static Map<String, Object> fields(Object o) {
        Map<String, Object> values = new LinkedHashMap<>();
        Class<?> type = o.getClass();
        if (type.isRecord()) {
            for (RecordComponent rc : type.getRecordComponents()) {
                if (rc.getType().isAnnotationPresent(FunctionalInterface.class)) continue;
                var accessor = rc.getAccessor();
                try {
                    accessor.trySetAccessible();
                    Object v = accessor.invoke(o);
                    if (v != null && isCallable(v.getClass())) continue;
                    values.put(rc.getName(), v);
                } catch (ReflectiveOperationException e) {
                    throw new UnsupportedTypeException(
                            "Failed to access record component '" + rc.getName() + "'", type, e);
                }
            }
            return values;
        }
        for (Class<?> c = type; c != null && c != Object.class && !isJdkClass(c); c = c.getSuperclass()) {
            for (Field f : c.getDeclaredFields()) {
                if (!isDataField(f) || values.containsKey(f.getName())) continue;
                if (!f.trySetAccessible())
                    throw new UnsupportedTypeException("Field '" + f.getName() + "' is not accessible", type);
                try {
                    Object v = f.get(o);
                    if (v != null && isCallable(v.getClass())) continue;
                    values.put(f.getName(), v);
                } catch (IllegalAccessException e) {
                    throw new UnsupportedTypeException("Failed to read field '" + f.getName() + "'", type, e);
                }
            }
        }
        return values;
    }

    private static boolean isDataField(Field f) {
        int mod = f.getModifiers();
        return !Modifier.isStatic(mod)
                && !Modifier.isTransient(mod)
                && !f.isSynthetic()
                && !f.getType().isAnnotationPresent(FunctionalInterface.class);
    }
}
