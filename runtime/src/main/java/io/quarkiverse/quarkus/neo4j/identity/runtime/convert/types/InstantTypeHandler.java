package io.quarkiverse.quarkus.neo4j.identity.runtime.convert.types;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import org.neo4j.driver.Value;

public class InstantTypeHandler extends AbstractSimpleTypeHandler {

    @Override
    protected Class<?> getSupportedType() {
        return Instant.class;
    }

    @Override
    protected Object read(Value value) {
        return value.asZonedDateTime().toInstant();
    }

    @Override
    public Object toGraph(Object value) {
        return ZonedDateTime.ofInstant((Instant) value, ZoneOffset.UTC);
    }
}
