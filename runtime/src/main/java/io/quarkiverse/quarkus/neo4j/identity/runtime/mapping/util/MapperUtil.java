package io.quarkiverse.quarkus.neo4j.identity.runtime.mapping.util;

import java.lang.reflect.Field;
import java.util.Locale;

import io.quarkiverse.quarkus.neo4j.identity.runtime.mapping.NodeId;
import io.quarkiverse.quarkus.neo4j.identity.runtime.mapping.Property;

public class MapperUtil {
    public static String capitalize(String input) {
        if (input == null || input.isEmpty())
            return input;
        return input.substring(0, 1).toUpperCase(Locale.ROOT) + input.substring(1);
    }

    public static String resolveSetterName(Field field) {
        return "set" + capitalize(field.getName());
    }

    public static String resolveGetterName(Field field) {
        String base = capitalize(field.getName());
        return (field.getType() == boolean.class) ? "is" + base : "get" + base;
    }

    public static String getPropertyName(Field field) {
        Property prop = field.getAnnotation(Property.class);
        NodeId nodeId = field.getAnnotation(NodeId.class);
        return (nodeId != null)
                ? field.getName()
                : (prop != null && !prop.name().isEmpty()) ? prop.name() : field.getName();
    }

    private MapperUtil() {
    }
}
