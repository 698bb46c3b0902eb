package io.quarkiverse.quarkus.neo4j.identity.runtime.mapping;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

import org.neo4j.driver.Record;
import org.neo4j.driver.Value;
import org.neo4j.driver.types.MapAccessor;
import org.neo4j.driver.types.TypeSystem;

import io.quarkiverse.quarkus.neo4j.identity.runtime.errors.MaterializationException;

/**
 * Turns returned graph records into typed instances.
 * <p>
 * Each mapped property of the target type is looked up by exact name on the node (or map) in the
 * record. Present values are coerced to the declared type, absent ones leave the field at its
 * default, and properties unknown to the target type are ignored.
 */
public final class ResultMaterializer {

    private static final TypeSystem TYPES = TypeSystem.getDefault();

    public static <T> T materialize(Record record, Class<T> type) {
        if (record == null) {
            throw new IllegalArgumentException("Record cannot be null");
        }
        if (record.size() == 0) {
            throw new MaterializationException("Record has no columns to materialize " + type.getName() + " from");
        }
        return materialize(record.get(0), type);
    }

    public static <T> T materialize(Record record, String alias, Class<T> type) {
        if (record == null) {
            throw new IllegalArgumentException("Record cannot be null");
        }
        if (!record.containsKey(alias)) {
            throw new MaterializationException("Record has no column '" + alias + "'");
        }
        return materialize(record.get(alias), type);
    }

    public static <T> T materialize(Value value, Class<T> type) {
        if (type == null) {
            throw new IllegalArgumentException("Target type cannot be null");
        }
        if (value == null || value.isNull()) {
            return null;
        }

        MapAccessor source;
        Long nodeId = null;
        if (value.hasType(TYPES.NODE())) {
            source = value.asNode();
            nodeId = idOf(value);
        } else if (value.hasType(TYPES.MAP())) {
            source = value;
        } else {
            throw new MaterializationException(
                    "Cannot materialize " + type.getName() + " from a value of type " + value.type().name());
        }

        TypeDescriptor<T> descriptor = TypeDescriptors.describe(type);
        T instance = newInstance(descriptor, type);

        for (PropertyDescriptor property : descriptor.getProperties()) {
            assign(instance, property, source);
        }

        descriptor.getIdentifier().ifPresent(identifier -> {
            if (source.containsKey(identifier.getName())) {
                assign(instance, identifier, source);
            }
        });
        if (nodeId != null) {
            Long engineId = nodeId;
            descriptor.getIdentifier().ifPresent(identifier -> identifier.assign(instance, coerceId(engineId, identifier)));
        }
        return instance;
    }

    private static void assign(Object instance, PropertyDescriptor property, MapAccessor source) {
        if (!source.containsKey(property.getName())) {
            return;
        }
        Value value = source.get(property.getName());
        if (value.isNull()) {
            return;
        }
        Object converted;
        try {
            converted = property.getHandler().fromGraph(value, property.getJavaType());
        } catch (RuntimeException e) {
            throw new MaterializationException("Cannot convert value of '" + property.getName() + "' ("
                    + value.type().name() + ") to " + property.getJavaType().getName(), e);
        }
        property.assign(instance, converted);
    }

    @SuppressWarnings("deprecation")
    private static Long idOf(Value value) {
        return value.asNode().id();
    }

    private static Object coerceId(Long id, PropertyDescriptor identifier) {
        Class<?> type = identifier.getJavaType();
        if (type == Long.class || type == long.class) {
            return id;
        }
        if ((type == Integer.class || type == int.class) && id >= Integer.MIN_VALUE && id <= Integer.MAX_VALUE) {
            return id.intValue();
        }
        if (type == String.class) {
            return String.valueOf(id);
        }
        throw new MaterializationException("Identifier '" + identifier.getName() + "' of type "
                + type.getName() + " cannot hold an engine-assigned id");
    }

    private static <T> T newInstance(TypeDescriptor<T> descriptor, Class<T> type) {
        Constructor<T> constructor = descriptor.getConstructor()
                .orElseThrow(() -> new MaterializationException(
                        "Type " + type.getName() + " needs an accessible no-arg constructor to be materialized"));
        try {
            return constructor.newInstance();
        } catch (InstantiationException | IllegalAccessException | InvocationTargetException e) {
            throw new MaterializationException("Cannot instantiate " + type.getName(), e);
        }
    }

    private ResultMaterializer() {
    }
}
