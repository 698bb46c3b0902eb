package io.quarkiverse.quarkus.neo4j.identity.runtime.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;

import io.quarkiverse.quarkus.neo4j.identity.runtime.errors.OperationCancelledException;
import io.quarkiverse.quarkus.neo4j.identity.runtime.model.Claim;
import io.quarkiverse.quarkus.neo4j.identity.runtime.model.IdentityResult;
import io.quarkiverse.quarkus.neo4j.identity.runtime.model.IdentityRole;
import io.quarkiverse.quarkus.neo4j.identity.runtime.query.Cancellation;
import io.quarkiverse.quarkus.neo4j.identity.runtime.query.QueryExecutor;

class RoleStoreTest {

    public static class TenantRole extends IdentityRole {
    }

    private Session session;
    private Result result;
    private RoleStore<IdentityRole> store;

    private final ArgumentCaptor<String> cypher = ArgumentCaptor.forClass(String.class);
    @SuppressWarnings("unchecked")
    private final ArgumentCaptor<Map<String, Object>> parameters = ArgumentCaptor.forClass(Map.class);

    @BeforeEach
    void setUp() {
        session = mock(Session.class);
        result = mock(Result.class);
        when(session.run(anyString(), anyMap())).thenReturn(result);
        store = RoleStore.of(new QueryExecutor(() -> session));
    }

    private void verifyStatement() {
        verify(session).run(cypher.capture(), parameters.capture());
    }

    @Test
    void testCreateAssignsEntityId() {
        when(result.list()).thenReturn(List.of(GraphRecords.node("p", 12L, List.of("IdentityRole"), "name", "Admin")));
        IdentityRole role = new IdentityRole("Admin");
        role.setNormalizedName("ADMIN");

        IdentityResult created = store.create(role, Cancellation.none());

        assertThat(created.isSucceeded()).isTrue();
        assertThat(role.getEntityId()).isEqualTo(12L);
        verifyStatement();
        assertThat(cypher.getValue()).isEqualTo("CREATE (p:IdentityRole) SET p += $role, p.entityId = id(p) RETURN p");
        @SuppressWarnings("unchecked")
        Map<String, Object> payload = (Map<String, Object>) parameters.getValue().get("role");
        assertThat(payload.keySet()).containsExactly("id", "name", "normalizedName", "concurrencyStamp");
        assertThat(payload).containsEntry("normalizedName", "ADMIN");
    }

    @Test
    void testCreateFailsWhenNothingIsReturned() {
        when(result.list()).thenReturn(List.of());

        assertThat(store.create(new IdentityRole("Admin"), Cancellation.none()).isSucceeded()).isFalse();
    }

    @Test
    void testSubclassLabels() {
        when(result.list()).thenReturn(List.of());
        RoleStore<TenantRole> tenantRoles = new RoleStore<>(new QueryExecutor(() -> session), TenantRole.class);

        tenantRoles.findAll(Cancellation.none());

        verifyStatement();
        assertThat(cypher.getValue()).isEqualTo("MATCH (p:TenantRole:IdentityRole) RETURN p");
    }

    @Test
    void testUpdateRegeneratesConcurrencyStamp() {
        IdentityRole role = new IdentityRole("Admin");
        role.setEntityId(3L);
        String stamp = role.getConcurrencyStamp();

        store.update(role, Cancellation.none());

        assertThat(role.getConcurrencyStamp()).isNotEqualTo(stamp);
        verifyStatement();
        assertThat(cypher.getValue()).isEqualTo("MATCH (p:IdentityRole {id:$id, entityId:$entityId}) SET p += $role");
        assertThat(parameters.getValue()).containsEntry("id", role.getId()).containsEntry("entityId", 3L);
    }

    @Test
    void testDelete() {
        IdentityRole role = new IdentityRole("Admin");
        role.setEntityId(3L);

        assertThat(store.delete(role, Cancellation.none()).isSucceeded()).isTrue();

        verifyStatement();
        assertThat(cypher.getValue()).isEqualTo("MATCH (p:IdentityRole {id:$id, entityId:$entityId}) DETACH DELETE p");
    }

    @Test
    void testFindByName() {
        when(result.list()).thenReturn(List.of(GraphRecords.node("p", 5L, List.of("IdentityRole"),
                "id", "r-5", "name", "Editor", "normalizedName", "EDITOR")));

        IdentityRole role = store.findByName("EDITOR", Cancellation.none()).orElseThrow();

        assertThat(role.getId()).isEqualTo("r-5");
        assertThat(role.getEntityId()).isEqualTo(5L);
        verifyStatement();
        assertThat(cypher.getValue()).isEqualTo("MATCH (p:IdentityRole {normalizedName:$name}) RETURN p");
        assertThat(parameters.getValue()).containsEntry("name", "EDITOR");
    }

    @Test
    void testFindByIdNotFound() {
        when(result.list()).thenReturn(List.of());

        assertThat(store.findById("missing", Cancellation.none())).isEmpty();
    }

    @Test
    void testGetClaims() {
        when(result.list()).thenReturn(List.of(
                GraphRecords.node("c", 20L, List.of("IdentityClaim"), "claimType", "scope", "claimValue", "read"),
                GraphRecords.node("c", 21L, List.of("IdentityClaim"), "claimType", "scope", "claimValue", "write")));
        IdentityRole role = new IdentityRole("Admin");

        List<Claim> claims = store.getClaims(role, Cancellation.none());

        assertThat(claims).containsExactly(Claim.of("scope", "read"), Claim.of("scope", "write"));
        verifyStatement();
        assertThat(cypher.getValue())
                .isEqualTo("MATCH (n:IdentityRole {id:$roleId})-[rel:Has]->(c:IdentityClaim) RETURN c");
    }

    @Test
    void testAddClaim() {
        IdentityRole role = new IdentityRole("Admin");

        store.addClaim(role, Claim.of("scope", "read"), Cancellation.none());

        verifyStatement();
        assertThat(cypher.getValue()).isEqualTo("MATCH (n:IdentityRole {id:$roleId})"
                + " CREATE (n)-[:Has]->(c:IdentityClaim) SET c += $claim, c.entityId = id(c)");
        assertThat(parameters.getValue()).containsEntry("roleId", role.getId())
                .containsEntry("claim", Map.of("claimType", "scope", "claimValue", "read"));
    }

    @Test
    void testRemoveClaim() {
        store.removeClaim(new IdentityRole("Admin"), Claim.of("scope", "read"), Cancellation.none());

        verifyStatement();
        assertThat(cypher.getValue()).isEqualTo("MATCH (n:IdentityRole {id:$roleId})-[:Has]->"
                + "(c:IdentityClaim {claimValue:$value, claimType:$type}) DETACH DELETE c");
        assertThat(parameters.getValue()).containsEntry("value", "read").containsEntry("type", "scope");
    }

    @Test
    void testAccessors() {
        IdentityRole role = new IdentityRole("Admin");

        store.setRoleName(role, "Administrator");
        store.setNormalizedRoleName(role, "ADMINISTRATOR");

        assertThat(store.getRoleName(role)).isEqualTo("Administrator");
        assertThat(store.getNormalizedRoleName(role)).isEqualTo("ADMINISTRATOR");
        assertThat(store.getRoleId(role)).isEqualTo(role.getId());
        verifyNoInteractions(session);
    }

    @Test
    void testPreconditions() {
        assertThatThrownBy(() -> store.create(null, Cancellation.none())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.findById(null, Cancellation.none()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.addClaim(new IdentityRole(), null, Cancellation.none()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RoleStore<>(new QueryExecutor(() -> session), null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testCancelledCallsNeverReachTheSession() {
        assertThatThrownBy(() -> store.findAll(Cancellation.cancelled()))
                .isInstanceOf(OperationCancelledException.class);
        verifyNoInteractions(session);
    }

    @Test
    void testClosedStoreRejectsCalls() {
        store.close();

        assertThatThrownBy(() -> store.findAll(Cancellation.none())).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> store.getRoleName(new IdentityRole())).isInstanceOf(IllegalStateException.class);
        verifyNoInteractions(session);
    }
}
