package io.quarkiverse.quarkus.neo4j.identity.runtime.convert.types;

import org.neo4j.driver.Value;

import io.quarkiverse.quarkus.neo4j.identity.runtime.convert.TypeHandler;

/**
 * Fallback for types no other handler knows. Values go to the driver unchanged and come back as
 * the driver's natural Java value, which must be assignable to the declared type.
 */
public class PassThroughTypeHandler implements TypeHandler {

    @Override
    public boolean supports(Class<?> type) {
        return true;
    }

    @Override
    public Object fromGraph(Value value, Class<?> type) {
        Object natural = value.asObject();
        if (natural == null || type.isInstance(natural)) {
            return natural;
        }
        throw new IllegalArgumentException(
                "Cannot assign " + natural.getClass().getName() + " to " + type.getName());
    }
}
