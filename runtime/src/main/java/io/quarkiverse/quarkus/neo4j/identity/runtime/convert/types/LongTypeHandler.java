package io.quarkiverse.quarkus.neo4j.identity.runtime.convert.types;

import org.neo4j.driver.Value;

public class LongTypeHandler extends AbstractSimpleTypeHandler {
    @Override
    protected Class<?> getSupportedType() {
        return Long.class;
    }

    @Override
    protected Class<?> getPrimitiveType() {
        return long.class;
    }

    @Override
    protected Object read(Value value) {
        return value.asLong();
    }
}
