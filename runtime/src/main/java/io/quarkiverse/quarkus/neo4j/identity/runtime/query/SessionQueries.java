package io.quarkiverse.quarkus.neo4j.identity.runtime.query;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import org.neo4j.driver.Record;

/**
 * Statements bound to one open session. Each call re-checks the cancellation signal of the
 * surrounding {@link QueryExecutor#withSession} scope before it is dispatched.
 */
public interface SessionQueries {

    void run(String cypher, Map<String, Object> parameters);

    <T> QueryResult<T> queryMany(Class<T> type, String cypher, Map<String, Object> parameters);

    default <T> Optional<T> queryOptional(Class<T> type, String cypher, Map<String, Object> parameters) {
        return queryMany(type, cypher, parameters).first();
    }

    <R> Optional<R> queryScalar(String cypher, Map<String, Object> parameters, Function<Record, R> mapper);
}
