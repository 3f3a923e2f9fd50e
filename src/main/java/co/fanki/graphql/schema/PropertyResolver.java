package co.fanki.graphql.schema;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The resolver used by fields that declare none.
 *
 * <p>Reads the property named like the field from the parent: a
 * {@link Map} entry, a record component or a {@code getX}/{@code isX}
 * getter. Accessors are looked up once per class and property.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PropertyResolver implements Resolver {

    /** The shared instance. */
    public static final PropertyResolver INSTANCE = new PropertyResolver();

    /** Marks a property the class does not have. */
    private static final Method MISSING;

    static {
        try {
            MISSING = Object.class.getMethod("toString");
        } catch (final NoSuchMethodException e) {
            throw new IllegalStateException(e);
        }
    }

    private final Map<String, Method> accessors = new ConcurrentHashMap<>();

    private PropertyResolver() {
    }

    @Override
    public Object resolve(final Object parent,
            final Map<String, Object> arguments,
            final ResolverContext context) throws Exception {
        return read(parent, context.fieldName());
    }

    /**
     * Reads a property.
     *
     * @param source the object to read from, may be null
     * @param property the property name
     * @return the value, or null if the source is null or has no such
     *         property
     * @throws Exception if the accessor fails
     */
    public Object read(final Object source, final String property)
            throws Exception {
        if (source == null) {
            return null;
        }
        if (source instanceof Map<?, ?> map) {
            return map.get(property);
        }

        final Method accessor = accessors.computeIfAbsent(
                source.getClass().getName() + "#" + property,
                key -> findAccessor(source.getClass(), property));
        if (accessor == MISSING) {
            return null;
        }
        try {
            return accessor.invoke(source);
        } catch (final InvocationTargetException e) {
            if (e.getCause() instanceof Exception cause) {
                throw cause;
            }
            throw e;
        }
    }

    private static Method findAccessor(final Class<?> type,
            final String property) {
        final String suffix = Character.toUpperCase(property.charAt(0))
                + property.substring(1);
        final String[] candidates = type.isRecord()
                ? new String[] {property}
                : new String[] {"get" + suffix, "is" + suffix, property};
        for (final String candidate : candidates) {
            for (final Method method : type.getMethods()) {
                if (method.getName().equals(candidate)
                        && method.getParameterCount() == 0
                        && method.getReturnType() != void.class
                        && !Modifier.isStatic(method.getModifiers())) {
                    method.trySetAccessible();
                    return method;
                }
            }
        }
        return MISSING;
    }
}
