package io.quarkiverse.quarkus.neo4j.identity.runtime.convert.types;

import org.neo4j.driver.Value;

public class BooleanTypeHandler extends AbstractSimpleTypeHandler {
    @Override
    protected Class<?> getSupportedType() {
        return Boolean.class;
    }

    @Override
    protected Class<?> getPrimitiveType() {
        return boolean.class;
    }

    @Override
    protected Object read(Value value) {
        return value.asBoolean();
    }
}
