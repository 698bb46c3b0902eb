package io.quarkiverse.quarkus.neo4j.identity.runtime.repository;

import java.util.LinkedHashMap;
import java.util.Map;

import io.quarkiverse.quarkus.neo4j.identity.runtime.query.QueryExecutor;

/**
 * Common plumbing of the identity stores: the executor, argument checks and the closed state.
 */
public abstract class AbstractStore implements AutoCloseable {

    protected static final String ID = "id";
    protected static final String ENTITY_ID = "entityId";

    protected final QueryExecutor executor;

    private volatile boolean closed;

    protected AbstractStore(QueryExecutor executor) {
        if (executor == null) {
            throw new IllegalArgumentException("Query executor cannot be null");
        }
        this.executor = executor;
    }

    public QueryExecutor getExecutor() {
        return executor;
    }

    /**
     * Marks the store as closed. The executor and its sessions are owned elsewhere and stay open.
     */
    @Override
    public void close() {
        closed = true;
    }

    protected void throwIfClosed() {
        if (closed) {
            throw new IllegalStateException(getClass().getSimpleName() + " has been closed");
        }
    }

    protected static <T> T require(T value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
        return value;
    }

    protected static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or empty");
        }
        return value;
    }

    /**
     * Builds a parameter map from alternating names and values. Values may be {@code null}.
     */
    protected static Map<String, Object> parameters(Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Parameters must be given as name/value pairs");
        }
        Map<String, Object> parameters = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            parameters.put((String) namesAndValues[i], namesAndValues[i + 1]);
        }
        return parameters;
    }
}
