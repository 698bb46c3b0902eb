package io.quarkiverse.quarkus.neo4j.identity.runtime.query;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.neo4j.driver.Record;

import io.quarkiverse.quarkus.neo4j.identity.runtime.mapping.ResultMaterializer;
import io.quarkiverse.quarkus.neo4j.identity.runtime.model.IdentityRole;

class QueryResultTest {

    @Test
    void testMaterializationIsLazyAndRestartable() {
        AtomicInteger materialized = new AtomicInteger();
        List<Record> records = List.of(QueryExecutorTest.roleRecord(1L, "admin"),
                QueryExecutorTest.roleRecord(2L, "editor"));

        QueryResult<IdentityRole> result = new QueryResult<>(records, record -> {
            materialized.incrementAndGet();
            return ResultMaterializer.materialize(record, IdentityRole.class);
        });

        assertThat(result.size()).isEqualTo(2);
        assertThat(materialized).hasValue(0);

        assertThat(result.stream().map(IdentityRole::getName)).containsExactly("admin", "editor");
        assertThat(result.toList()).extracting(IdentityRole::getEntityId).containsExactly(1L, 2L);
        assertThat(materialized).hasValue(4);
    }

    @Test
    void testEmpty() {
        QueryResult<IdentityRole> result = QueryResult.empty();

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.first()).isEmpty();
        assertThat(result.toList()).isEmpty();
    }
}
