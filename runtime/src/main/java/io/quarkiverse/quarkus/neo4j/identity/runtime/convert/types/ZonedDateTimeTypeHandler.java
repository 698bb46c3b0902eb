package io.quarkiverse.quarkus.neo4j.identity.runtime.convert.types;

import java.time.ZonedDateTime;

import org.neo4j.driver.Value;

public class ZonedDateTimeTypeHandler extends AbstractSimpleTypeHandler {

    @Override
    protected Class<?> getSupportedType() {
        return ZonedDateTime.class;
    }

    @Override
    protected Object read(Value value) {
        return value.asZonedDateTime();
    }
}
