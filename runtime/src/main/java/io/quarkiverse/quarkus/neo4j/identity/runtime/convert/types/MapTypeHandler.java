package io.quarkiverse.quarkus.neo4j.identity.runtime.convert.types;

import java.lang.reflect.Modifier;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.neo4j.driver.Value;

import io.quarkiverse.quarkus.neo4j.identity.runtime.convert.TypeHandler;
import io.quarkiverse.quarkus.neo4j.identity.runtime.convert.TypeHandlerRegistry;

public class MapTypeHandler implements TypeHandler {

    @Override
    public boolean supports(Class<?> type) {
        return Map.class.isAssignableFrom(type);
    }

    @Override
    public Object fromGraph(Value value, Class<?> type) {
        Map<Object, Object> target = newMap(type);
        target.putAll(value.asMap());
        return target;
    }

    @Override
    public Object toGraph(Object value) {
        Map<?, ?> source = (Map<?, ?>) value;
        Map<String, Object> converted = new LinkedHashMap<>();
        source.forEach((k, v) -> converted.put(String.valueOf(k), TypeHandlerRegistry.toGraph(v)));
        return converted;
    }

    @SuppressWarnings("unchecked")
    private static Map<Object, Object> newMap(Class<?> type) {
        if (!type.isInterface() && !Modifier.isAbstract(type.getModifiers())) {
            try {
                return (Map<Object, Object>) type.getDeclaredConstructor().newInstance();
            } catch (ReflectiveOperationException e) {
                throw new IllegalArgumentException("Cannot instantiate map type " + type.getName(), e);
            }
        }
        Map<Object, Object> map = SortedMap.class.isAssignableFrom(type) ? new TreeMap<>() : new LinkedHashMap<>();
        if (!type.isInstance(map)) {
            throw new IllegalArgumentException("No map implementation for " + type.getName());
        }
        return map;
    }
}
