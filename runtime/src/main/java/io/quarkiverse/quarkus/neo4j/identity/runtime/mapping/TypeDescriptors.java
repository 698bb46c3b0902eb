package io.quarkiverse.quarkus.neo4j.identity.runtime.mapping;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.jboss.logging.Logger;

import io.quarkiverse.quarkus.neo4j.identity.runtime.convert.TypeHandlerRegistry;
import io.quarkiverse.quarkus.neo4j.identity.runtime.mapping.util.MapperUtil;

/**
 * Process-wide cache of {@link TypeDescriptor}s keyed by class.
 * <p>
 * Lookups are lock-free. Two threads describing the same class for the first time may both
 * build a descriptor; the first one published is kept and both are equal anyway.
 */
public final class TypeDescriptors {

    private static final Logger LOG = Logger.getLogger(TypeDescriptors.class);

    private static final Map<Class<?>, TypeDescriptor<?>> CACHE = new ConcurrentHashMap<>();

    private static final TypeDescriptor<?> NONE = TypeDescriptor.empty(null);

    /**
     * Describes {@code type}. Never throws: unsupported types yield an empty descriptor.
     */
    @SuppressWarnings("unchecked")
    public static <T> TypeDescriptor<T> describe(Class<T> type) {
        if (type == null) {
            return (TypeDescriptor<T>) NONE;
        }
        TypeDescriptor<?> cached = CACHE.get(type);
        if (cached == null) {
            TypeDescriptor<T> built = build(type);
            cached = CACHE.putIfAbsent(type, built);
            if (cached == null) {
                cached = built;
            }
        }
        return (TypeDescriptor<T>) cached;
    }

    static void clear() {
        CACHE.clear();
    }

    private static <T> TypeDescriptor<T> build(Class<T> type) {
        if (!isSupported(type)) {
            LOG.tracef("Type %s is not mappable, using an empty descriptor", type.getName());
            return TypeDescriptor.empty(type);
        }
        try {
            Deque<Class<?>> hierarchy = hierarchyOf(type);

            List<String> labels = new ArrayList<>(new LinkedHashSet<>(labelsOf(hierarchy)));

            List<PropertyDescriptor> properties = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            PropertyDescriptor identifier = null;

            // base class first so inherited properties keep a stable leading position
            var baseFirst = hierarchy.descendingIterator();
            while (baseFirst.hasNext()) {
                for (Field field : baseFirst.next().getDeclaredFields()) {
                    if (!isCandidate(field)) {
                        continue;
                    }
                    boolean isId = field.isAnnotationPresent(NodeId.class);
                    Optional<PropertyDescriptor> property = propertyOf(type, field, !isId);
                    if (property.isEmpty()) {
                        continue;
                    }
                    if (isId) {
                        if (identifier == null) {
                            identifier = property.get();
                        }
                    } else if (seen.add(property.get().getName())) {
                        properties.add(property.get());
                    }
                }
            }

            if (identifier != null) {
                String idName = identifier.getName();
                properties.removeIf(p -> p.getName().equals(idName));
            }

            TypeDescriptor<T> descriptor = new TypeDescriptor<>(type, labels, properties, identifier,
                    relationshipTypeOf(type), constructorOf(type));
            LOG.tracef("Described %s", descriptor);
            return descriptor;
        } catch (SecurityException | LinkageError e) {
            LOG.debugf(e, "Cannot introspect %s, using an empty descriptor", type.getName());
            return TypeDescriptor.empty(type);
        }
    }

    private static boolean isSupported(Class<?> type) {
        return !type.isPrimitive()
                && !type.isArray()
                && !type.isInterface()
                && !type.isEnum()
                && !type.isAnnotation()
                && !isPlatformType(type);
    }

    private static boolean isPlatformType(Class<?> type) {
        String name = type.getName();
        return name.startsWith("java.") || name.startsWith("javax.") || name.startsWith("jdk.");
    }

    /**
     * @return the mappable classes of the hierarchy, most-derived first
     */
    private static Deque<Class<?>> hierarchyOf(Class<?> type) {
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> c = type; c != null && !isPlatformType(c); c = c.getSuperclass()) {
            hierarchy.addLast(c);
        }
        return hierarchy;
    }

    private static List<String> labelsOf(Deque<Class<?>> hierarchy) {
        List<String> labels = new ArrayList<>();
        for (Class<?> c : hierarchy) {
            NodeEntity nodeEntity = c.getAnnotation(NodeEntity.class);
            if (nodeEntity != null && !nodeEntity.label().isEmpty()) {
                labels.add(nodeEntity.label());
            } else if (!c.getSimpleName().isEmpty()) {
                labels.add(c.getSimpleName());
            }
        }
        return labels;
    }

    private static String relationshipTypeOf(Class<?> type) {
        RelationshipEntity relationship = type.getAnnotation(RelationshipEntity.class);
        if (relationship == null || relationship.type().isEmpty()) {
            return null;
        }
        return relationship.type();
    }

    private static boolean isCandidate(Field field) {
        int modifiers = field.getModifiers();
        return !Modifier.isStatic(modifiers)
                && !Modifier.isTransient(modifiers)
                && !field.isSynthetic()
                && !field.isAnnotationPresent(Transient.class);
    }

    private static Optional<PropertyDescriptor> propertyOf(Class<?> type, Field field, boolean writable) {
        Method getter = accessor(type, MapperUtil.resolveGetterName(field));
        Method setter = accessor(type, MapperUtil.resolveSetterName(field), field.getType());
        if (getter == null || setter == null || !field.getType().isAssignableFrom(getter.getReturnType())) {
            return Optional.empty();
        }
        return Optional.of(new PropertyDescriptor(MapperUtil.getPropertyName(field), field.getType(), getter, setter,
                writable, TypeHandlerRegistry.handlerFor(field.getType())));
    }

    private static Method accessor(Class<?> type, String name, Class<?>... parameterTypes) {
        try {
            Method method = type.getMethod(name, parameterTypes);
            if (Modifier.isStatic(method.getModifiers())) {
                return null;
            }
            method.trySetAccessible();
            return method;
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    private static <T> Constructor<T> constructorOf(Class<T> type) {
        if (Modifier.isAbstract(type.getModifiers())
                || (type.isMemberClass() && !Modifier.isStatic(type.getModifiers()))) {
            return null;
        }
        try {
            Constructor<T> constructor = type.getDeclaredConstructor();
            constructor.trySetAccessible();
            return constructor;
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    private TypeDescriptors() {
    }
}
