package io.quarkiverse.quarkus.neo4j.identity.runtime.convert.types;

import org.neo4j.driver.Value;

public class ByteTypeHandler extends AbstractSimpleTypeHandler {
    @Override
    protected Class<?> getSupportedType() {
        return Byte.class;
    }

    @Override
    protected Class<?> getPrimitiveType() {
        return byte.class;
    }

    @Override
    protected Object read(Value value) {
        long number = value.asLong();
        if (number < Byte.MIN_VALUE || number > Byte.MAX_VALUE) {
            throw new IllegalArgumentException(number + " does not fit in a byte");
        }
        return (byte) number;
    }

    @Override
    public Object toGraph(Object value) {
        return ((Byte) value).longValue();
    }
}
