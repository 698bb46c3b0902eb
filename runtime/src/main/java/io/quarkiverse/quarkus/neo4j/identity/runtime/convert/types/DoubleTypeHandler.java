package io.quarkiverse.quarkus.neo4j.identity.runtime.convert.types;

import org.neo4j.driver.Value;

public class DoubleTypeHandler extends AbstractSimpleTypeHandler {
    @Override
    protected Class<?> getSupportedType() {
        return Double.class;
    }

    @Override
    protected Class<?> getPrimitiveType() {
        return double.class;
    }

    @Override
    protected Object read(Value value) {
        return value.asDouble();
    }
}
