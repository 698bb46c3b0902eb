package io.quarkiverse.quarkus.neo4j.identity.runtime.convert.types;

import org.neo4j.driver.Value;

import io.quarkiverse.quarkus.neo4j.identity.runtime.convert.TypeHandler;

/**
 * Base for handlers of a boxed type and its primitive counterpart.
 */
public abstract class AbstractSimpleTypeHandler implements TypeHandler {

    protected abstract Class<?> getSupportedType();

    protected Class<?> getPrimitiveType() {
        return null;
    }

    protected abstract Object read(Value value);

    @Override
    public boolean supports(Class<?> type) {
        return type == getSupportedType() || (getPrimitiveType() != null && type == getPrimitiveType());
    }

    @Override
    public Object fromGraph(Value value, Class<?> type) {
        return read(value);
    }
}
