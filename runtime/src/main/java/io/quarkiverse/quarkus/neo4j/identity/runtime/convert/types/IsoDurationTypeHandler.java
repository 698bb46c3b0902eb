package io.quarkiverse.quarkus.neo4j.identity.runtime.convert.types;

import org.neo4j.driver.Value;
import org.neo4j.driver.types.IsoDuration;

public class IsoDurationTypeHandler extends AbstractSimpleTypeHandler {

    @Override
    protected Class<?> getSupportedType() {
        return IsoDuration.class;
    }

    @Override
    protected Object read(Value value) {
        return value.asIsoDuration();
    }
}
