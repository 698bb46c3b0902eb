package io.quarkiverse.quarkus.neo4j.identity.runtime.convert.types;

import java.time.LocalTime;

import org.neo4j.driver.Value;

public class LocalTimeTypeHandler extends AbstractSimpleTypeHandler {

    @Override
    protected Class<?> getSupportedType() {
        return LocalTime.class;
    }

    @Override
    protected Object read(Value value) {
        return value.asLocalTime();
    }
}
