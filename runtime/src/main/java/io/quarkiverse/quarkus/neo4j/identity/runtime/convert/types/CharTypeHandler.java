package io.quarkiverse.quarkus.neo4j.identity.runtime.convert.types;

import org.neo4j.driver.Value;

public class CharTypeHandler extends AbstractSimpleTypeHandler {
    @Override
    protected Class<?> getSupportedType() {
        return Character.class;
    }

    @Override
    protected Class<?> getPrimitiveType() {
        return char.class;
    }

    @Override
    protected Object read(Value value) {
        String s = value.asString();
        if (s.length() != 1) {
            throw new IllegalArgumentException("Expected a single character but got '" + s + "'");
        }
        return s.charAt(0);
    }

    @Override
    public Object toGraph(Object value) {
        return String.valueOf(value);
    }
}
