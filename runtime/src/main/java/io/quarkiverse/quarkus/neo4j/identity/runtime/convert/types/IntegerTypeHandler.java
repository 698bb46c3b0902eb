package io.quarkiverse.quarkus.neo4j.identity.runtime.convert.types;

import org.neo4j.driver.Value;

public class IntegerTypeHandler extends AbstractSimpleTypeHandler {
    @Override
    protected Class<?> getSupportedType() {
        return Integer.class;
    }

    @Override
    protected Class<?> getPrimitiveType() {
        return int.class;
    }

    @Override
    protected Object read(Value value) {
        return value.asInt();
    }
}
