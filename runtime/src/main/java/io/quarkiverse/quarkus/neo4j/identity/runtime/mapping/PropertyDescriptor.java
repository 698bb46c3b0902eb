package io.quarkiverse.quarkus.neo4j.identity.runtime.mapping;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;

import io.quarkiverse.quarkus.neo4j.identity.runtime.convert.TypeHandler;
import io.quarkiverse.quarkus.neo4j.identity.runtime.errors.MaterializationException;
import io.quarkiverse.quarkus.neo4j.identity.runtime.errors.RepositoryException;

/**
 * A named, typed property of an entity backed by a getter/setter pair.
 */
public final class PropertyDescriptor {

    private final String name;
    private final Class<?> javaType;
    private final Method getter;
    private final Method setter;
    private final boolean writable;
    private final TypeHandler handler;

    PropertyDescriptor(String name, Class<?> javaType, Method getter, Method setter, boolean writable,
            TypeHandler handler) {
        this.name = name;
        this.javaType = javaType;
        this.getter = getter;
        this.setter = setter;
        this.writable = writable;
        this.handler = handler;
    }

    /**
     * @return the graph property name
     */
    public String getName() {
        return name;
    }

    public Class<?> getJavaType() {
        return javaType;
    }

    public boolean isReadable() {
        return getter != null;
    }

    /**
     * @return whether the property takes part in write projections
     */
    public boolean isWritable() {
        return writable;
    }

    TypeHandler getHandler() {
        return handler;
    }

    public Object read(Object instance) {
        try {
            return getter.invoke(instance);
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new RepositoryException("Cannot read property '" + name + "' of " + instance.getClass().getName(), e);
        }
    }

    void assign(Object instance, Object value) {
        try {
            setter.invoke(instance, value);
        } catch (IllegalAccessException | IllegalArgumentException | InvocationTargetException e) {
            throw new MaterializationException(
                    "Cannot assign property '" + name + "' of " + instance.getClass().getName(), e);
        }
    }

    @Override
    public String toString() {
        return name + ":" + javaType.getSimpleName() + (writable ? "" : " (read-only)");
    }
}
