package io.quarkiverse.quarkus.neo4j.identity.runtime.convert.types;

import java.time.LocalDateTime;

import org.neo4j.driver.Value;

public class LocalDateTimeTypeHandler extends AbstractSimpleTypeHandler {

    @Override
    protected Class<?> getSupportedType() {
        return LocalDateTime.class;
    }

    @Override
    protected Object read(Value value) {
        return value.asLocalDateTime();
    }
}
