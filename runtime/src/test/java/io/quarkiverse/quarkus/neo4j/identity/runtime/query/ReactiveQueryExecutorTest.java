package io.quarkiverse.quarkus.neo4j.identity.runtime.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;

import io.quarkiverse.quarkus.neo4j.identity.runtime.errors.OperationCancelledException;
import io.quarkiverse.quarkus.neo4j.identity.runtime.model.IdentityRole;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.helpers.test.AssertSubscriber;
import io.smallrye.mutiny.helpers.test.UniAssertSubscriber;

class ReactiveQueryExecutorTest {

    private static final String CYPHER = "MATCH (p:IdentityRole) RETURN p";

    private Session session;
    private Result result;
    private QueryExecutorTest.CountingSessionFactory sessions;
    private ReactiveQueryExecutor executor;

    @BeforeEach
    void setUp() {
        session = mock(Session.class);
        result = mock(Result.class);
        when(session.run(anyString(), anyMap())).thenReturn(result);
        sessions = new QueryExecutorTest.CountingSessionFactory(session);
        executor = new ReactiveQueryExecutor(new QueryExecutor(sessions), Runnable::run);
    }

    @Test
    void testNothingRunsBeforeSubscription() {
        Multi<IdentityRole> roles = executor.queryMany(IdentityRole.class, CYPHER, Map.of(), Cancellation.none());
        Uni<Void> run = executor.run(CYPHER, Map.of(), Cancellation.none());

        assertThat(roles).isNotNull();
        assertThat(run).isNotNull();
        verifyNoInteractions(session);
    }

    @Test
    void testQueryManyEmitsMaterializedItems() {
        when(result.list()).thenReturn(List.of(QueryExecutorTest.roleRecord(1L, "admin"),
                QueryExecutorTest.roleRecord(2L, "editor")));

        AssertSubscriber<IdentityRole> subscriber = executor
                .queryMany(IdentityRole.class, CYPHER, Map.of(), Cancellation.none())
                .subscribe().withSubscriber(AssertSubscriber.create(10));

        subscriber.awaitCompletion();
        assertThat(subscriber.getItems()).extracting(IdentityRole::getName).containsExactly("admin", "editor");
    }

    @Test
    void testQueryOptionalEmitsNullWhenNothingMatched() {
        when(result.list()).thenReturn(List.of());

        executor.queryOptional(IdentityRole.class, CYPHER, Map.of(), Cancellation.none())
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .awaitItem()
                .assertItem(null);
    }

    @Test
    void testCancellationIsCheckedOnSubscription() {
        Cancellation cancellation = Cancellation.create();
        Uni<Void> run = executor.run(CYPHER, Map.of(), cancellation);
        cancellation.cancel();

        run.subscribe().withSubscriber(UniAssertSubscriber.create())
                .awaitFailure()
                .assertFailedWith(OperationCancelledException.class);
        assertThat(sessions.opened).isZero();
    }
}
