package io.quarkiverse.quarkus.neo4j.identity.runtime.convert.types;

import org.neo4j.driver.Value;

public class FloatTypeHandler extends AbstractSimpleTypeHandler {
    @Override
    protected Class<?> getSupportedType() {
        return Float.class;
    }

    @Override
    protected Class<?> getPrimitiveType() {
        return float.class;
    }

    @Override
    protected Object read(Value value) {
        // floats are stored as 64-bit values, narrowing is expected
        return (float) value.asDouble();
    }
}
