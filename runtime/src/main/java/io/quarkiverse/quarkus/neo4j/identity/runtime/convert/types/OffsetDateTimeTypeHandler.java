package io.quarkiverse.quarkus.neo4j.identity.runtime.convert.types;

import java.time.OffsetDateTime;

import org.neo4j.driver.Value;

public class OffsetDateTimeTypeHandler extends AbstractSimpleTypeHandler {

    @Override
    protected Class<?> getSupportedType() {
        return OffsetDateTime.class;
    }

    @Override
    protected Object read(Value value) {
        return value.asOffsetDateTime();
    }
}
