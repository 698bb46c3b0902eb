package io.quarkiverse.quarkus.neo4j.identity.runtime.convert.types;

import java.time.LocalDate;

import org.neo4j.driver.Value;

public class LocalDateTypeHandler extends AbstractSimpleTypeHandler {

    @Override
    protected Class<?> getSupportedType() {
        return LocalDate.class;
    }

    @Override
    protected Object read(Value value) {
        return value.asLocalDate();
    }
}
