package io.quarkiverse.quarkus.neo4j.identity.runtime.query;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.function.Function;

import org.neo4j.driver.Record;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;

/**
 * Mutiny view over {@link QueryExecutor}. Nothing is dispatched until subscription, the
 * cancellation signal is checked at that point, and the blocking work runs on the given executor.
 */
public class ReactiveQueryExecutor {

    private final QueryExecutor delegate;
    private final Executor executor;

    public ReactiveQueryExecutor(QueryExecutor delegate) {
        this(delegate, Infrastructure.getDefaultWorkerPool());
    }

    public ReactiveQueryExecutor(QueryExecutor delegate, Executor executor) {
        if (delegate == null) {
            throw new IllegalArgumentException("Query executor cannot be null");
        }
        this.delegate = delegate;
        this.executor = executor;
    }

    public Uni<Void> run(String cypher, Map<String, Object> parameters, Cancellation cancellation) {
        return Uni.createFrom().<Void> item(() -> {
            delegate.run(cypher, parameters, cancellation);
            return null;
        }).runSubscriptionOn(executor);
    }

    public <T> Multi<T> queryMany(Class<T> type, String cypher, Map<String, Object> parameters,
            Cancellation cancellation) {
        return Multi.createFrom()
                .<T> deferred(() -> Multi.createFrom().iterable(delegate.queryMany(type, cypher, parameters, cancellation)))
                .runSubscriptionOn(executor);
    }

    /**
     * Emits the first result, or {@code null} when nothing matched.
     */
    public <T> Uni<T> queryOptional(Class<T> type, String cypher, Map<String, Object> parameters,
            Cancellation cancellation) {
        return Uni.createFrom()
                .item(() -> delegate.queryOptional(type, cypher, parameters, cancellation).orElse(null))
                .runSubscriptionOn(executor);
    }

    public <R> Uni<R> queryScalar(String cypher, Map<String, Object> parameters, Function<Record, R> mapper,
            Cancellation cancellation) {
        return Uni.createFrom()
                .item(() -> delegate.queryScalar(cypher, parameters, mapper, cancellation).orElse(null))
                .runSubscriptionOn(executor);
    }
}
