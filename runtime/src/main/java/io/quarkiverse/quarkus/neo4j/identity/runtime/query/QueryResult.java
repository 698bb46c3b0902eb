package io.quarkiverse.quarkus.neo4j.identity.runtime.query;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.neo4j.driver.Record;

/**
 * The records returned by one statement, materialized on demand.
 * <p>
 * Records are fetched before the session is released, so a result can be iterated any number of
 * times after the call returned. An empty result means nothing matched.
 *
 * @param <T> the element type
 */
public final class QueryResult<T> implements Iterable<T> {

    private final List<Record> records;
    private final Function<Record, T> mapper;

    QueryResult(List<Record> records, Function<Record, T> mapper) {
        this.records = List.copyOf(records);
        this.mapper = mapper;
    }

    public static <T> QueryResult<T> empty() {
        return new QueryResult<>(List.of(), record -> null);
    }

    @Override
    public Iterator<T> iterator() {
        Iterator<Record> source = records.iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return source.hasNext();
            }

            @Override
            public T next() {
                return mapper.apply(source.next());
            }
        };
    }

    public Stream<T> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    public Optional<T> first() {
        return records.isEmpty() ? Optional.empty() : Optional.ofNullable(mapper.apply(records.get(0)));
    }

    public List<T> toList() {
        List<T> list = new ArrayList<>(records.size());
        forEach(list::add);
        return list;
    }

    public <R> QueryResult<R> map(Function<? super T, ? extends R> fn) {
        return new QueryResult<>(records, record -> fn.apply(mapper.apply(record)));
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }
}
