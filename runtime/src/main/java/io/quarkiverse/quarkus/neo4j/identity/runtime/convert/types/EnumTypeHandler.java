package io.quarkiverse.quarkus.neo4j.identity.runtime.convert.types;

import org.neo4j.driver.Value;

import io.quarkiverse.quarkus.neo4j.identity.runtime.convert.TypeHandler;

/**
 * Enums are stored by constant name.
 */
public class EnumTypeHandler implements TypeHandler {

    @Override
    public boolean supports(Class<?> type) {
        return Enum.class.isAssignableFrom(type);
    }

    @Override
    @SuppressWarnings({ "unchecked", "rawtypes" })
    public Object fromGraph(Value value, Class<?> type) {
        return Enum.valueOf((Class<? extends Enum>) type, value.asString());
    }

    @Override
    public Object toGraph(Object value) {
        return ((Enum<?>) value).name();
    }
}
