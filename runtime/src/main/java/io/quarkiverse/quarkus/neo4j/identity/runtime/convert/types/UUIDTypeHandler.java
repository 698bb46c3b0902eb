package io.quarkiverse.quarkus.neo4j.identity.runtime.convert.types;

import java.util.UUID;

import org.neo4j.driver.Value;

public class UUIDTypeHandler extends AbstractSimpleTypeHandler {

    @Override
    protected Class<?> getSupportedType() {
        return UUID.class;
    }

    @Override
    protected Object read(Value value) {
        return UUID.fromString(value.asString());
    }

    @Override
    public Object toGraph(Object value) {
        return value.toString();
    }
}
