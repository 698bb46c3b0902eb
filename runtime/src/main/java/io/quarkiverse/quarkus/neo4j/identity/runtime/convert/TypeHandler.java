package io.quarkiverse.quarkus.neo4j.identity.runtime.convert;

import org.neo4j.driver.Value;

/**
 * Converts between a Java field type and the driver's value representation.
 */
public interface TypeHandler {

    boolean supports(Class<?> type);

    /**
     * Reads a non-null driver value as an instance of {@code type}.
     *
     * @param value the driver value, never {@code null} and never a NULL value
     * @param type the declared field type
     * @return the converted value
     */
    Object fromGraph(Value value, Class<?> type);

    /**
     * Converts a Java value into something the driver accepts as a query parameter.
     */
    default Object toGraph(Object value) {
        return value;
    }
}
