package io.quarkiverse.quarkus.neo4j.identity.runtime.convert.types;

import org.neo4j.driver.Value;

public class ByteArrayTypeHandler extends AbstractSimpleTypeHandler {

    @Override
    protected Class<?> getSupportedType() {
        return byte[].class;
    }

    @Override
    protected Object read(Value value) {
        return value.asByteArray();
    }
}
