package io.quarkiverse.quarkus.neo4j.identity.runtime.query;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;

import io.quarkiverse.quarkus.neo4j.identity.runtime.convert.TypeHandlerRegistry;
import io.quarkiverse.quarkus.neo4j.identity.runtime.mapping.ResultMaterializer;

/**
 * Runs Cypher statements with a parameter payload, each in its own short-lived session.
 * <p>
 * Every dispatch is preceded by a cancellation check; a cancelled call fails with
 * {@link io.quarkiverse.quarkus.neo4j.identity.runtime.errors.OperationCancelledException} without
 * opening a session. Once a statement has been sent it runs to completion, cancellation is not
 * observed mid-flight. Statements run in auto-commit mode, no explicit transaction is opened.
 * Driver exceptions are propagated unchanged.
 */
@ApplicationScoped
public class QueryExecutor {

    private static final Logger LOG = Logger.getLogger(QueryExecutor.class);

    private final SessionFactory sessions;

    public QueryExecutor(SessionFactory sessions) {
        if (sessions == null) {
            throw new IllegalArgumentException("Session factory cannot be null");
        }
        this.sessions = sessions;
    }

    public void run(String cypher, Map<String, Object> parameters, Cancellation cancellation) {
        withSession(cancellation, queries -> {
            queries.run(cypher, parameters);
            return null;
        });
    }

    public <T> QueryResult<T> queryMany(Class<T> type, String cypher, Map<String, Object> parameters,
            Cancellation cancellation) {
        return withSession(cancellation, queries -> queries.queryMany(type, cypher, parameters));
    }

    public <T> Optional<T> queryOptional(Class<T> type, String cypher, Map<String, Object> parameters,
            Cancellation cancellation) {
        return withSession(cancellation, queries -> queries.queryOptional(type, cypher, parameters));
    }

    public <R> Optional<R> queryScalar(String cypher, Map<String, Object> parameters, Function<Record, R> mapper,
            Cancellation cancellation) {
        return withSession(cancellation, queries -> queries.queryScalar(cypher, parameters, mapper));
    }

    /**
     * Runs a short sequence of dependent statements, for example a lookup followed by a write, on one
     * session. The session is released before this method returns, whatever the outcome.
     */
    public <R> R withSession(Cancellation cancellation, Function<SessionQueries, R> work) {
        Cancellation signal = cancellation == null ? Cancellation.none() : cancellation;
        signal.throwIfCancelled();

        try (Session session = sessions.openSession()) {
            LOG.debug("Session opened");
            return work.apply(new BoundSession(session, signal));
        }
    }

    static Map<String, Object> toDriverParameters(Map<String, Object> parameters) {
        if (parameters == null || parameters.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> converted = new LinkedHashMap<>();
        parameters.forEach((name, value) -> converted.put(name, TypeHandlerRegistry.toGraph(value)));
        return converted;
    }

    private static final class BoundSession implements SessionQueries {

        private final Session session;
        private final Cancellation cancellation;

        private BoundSession(Session session, Cancellation cancellation) {
            this.session = session;
            this.cancellation = cancellation;
        }

        @Override
        public void run(String cypher, Map<String, Object> parameters) {
            dispatch(cypher, parameters).consume();
        }

        @Override
        public <T> QueryResult<T> queryMany(Class<T> type, String cypher, Map<String, Object> parameters) {
            List<Record> records = dispatch(cypher, parameters).list();
            return new QueryResult<>(records, record -> ResultMaterializer.materialize(record, type));
        }

        @Override
        public <R> Optional<R> queryScalar(String cypher, Map<String, Object> parameters, Function<Record, R> mapper) {
            List<Record> records = dispatch(cypher, parameters).list();
            return records.isEmpty() ? Optional.empty() : Optional.ofNullable(mapper.apply(records.get(0)));
        }

        private org.neo4j.driver.Result dispatch(String cypher, Map<String, Object> parameters) {
            cancellation.throwIfCancelled();
            if (cypher == null || cypher.isBlank()) {
                throw new IllegalArgumentException("Query cannot be empty");
            }
            LOG.debugf("Dispatching: %s", cypher);
            return session.run(cypher, toDriverParameters(parameters));
        }
    }
}
