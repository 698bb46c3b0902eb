package io.quarkiverse.quarkus.neo4j.identity.runtime.convert.types;

import org.neo4j.driver.Value;

public class ShortTypeHandler extends AbstractSimpleTypeHandler {
    @Override
    protected Class<?> getSupportedType() {
        return Short.class;
    }

    @Override
    protected Class<?> getPrimitiveType() {
        return short.class;
    }

    @Override
    protected Object read(Value value) {
        long number = value.asLong();
        if (number < Short.MIN_VALUE || number > Short.MAX_VALUE) {
            throw new IllegalArgumentException(number + " does not fit in a short");
        }
        return (short) number;
    }

    @Override
    public Object toGraph(Object value) {
        return ((Short) value).longValue();
    }
}
