package io.quarkiverse.quarkus.neo4j.identity.runtime.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import io.quarkiverse.quarkus.neo4j.identity.runtime.enums.Direction;
import io.quarkiverse.quarkus.neo4j.identity.runtime.mapping.TypeDescriptor;
import io.quarkiverse.quarkus.neo4j.identity.runtime.mapping.TypeDescriptors;
import io.quarkiverse.quarkus.neo4j.identity.runtime.model.IdentityClaim;
import io.quarkiverse.quarkus.neo4j.identity.runtime.model.IdentityRole;
import io.quarkiverse.quarkus.neo4j.identity.runtime.model.IdentityUser;
import io.quarkiverse.quarkus.neo4j.identity.runtime.model.Relationships;

class PatternsTest {

    public static class Tenant {
    }

    public static class Admin extends IdentityUser {
    }

    @Test
    void testNodeWithSingleLabel() {
        assertEquals("(p:Tenant)", Patterns.node(TypeDescriptors.describe(Tenant.class), "p"));
    }

    @Test
    void testNodeWithInheritedLabels() {
        TypeDescriptor<Admin> admins = TypeDescriptors.describe(Admin.class);

        assertEquals(":Admin:IdentityUser", Patterns.labels(admins));
        assertEquals("(u:Admin:IdentityUser)", Patterns.node(admins, "u"));
    }

    @Test
    void testNodeWithFilter() {
        String pattern = Patterns.node(TypeDescriptors.describe(IdentityRole.class), "r",
                InlineFilter.where("id", "roleId").and("entityId", "entityId"));

        assertEquals("(r:IdentityRole {id:$roleId, entityId:$entityId})", pattern);
    }

    @Test
    void testNodeWithExpressionFilter() {
        String pattern = Patterns.node(TypeDescriptors.describe(IdentityClaim.class), "c",
                InlineFilter.whereExpression("claimValue", "row.value").andExpression("claimType", "row.type"));

        assertEquals("(c:IdentityClaim {claimValue:row.value, claimType:row.type})", pattern);
    }

    @Test
    void testNodeWithoutVariableOrLabels() {
        assertEquals("(:IdentityRole)", Patterns.node(TypeDescriptors.describe(IdentityRole.class)));
        assertEquals("(n)", Patterns.node(TypeDescriptors.describe(String.class), "n"));
        assertEquals("()", Patterns.node(TypeDescriptors.describe(String.class)));
    }

    @Test
    void testRelationshipDirections() {
        TypeDescriptor<Relationships.Has> has = TypeDescriptors.describe(Relationships.Has.class);

        assertEquals("-[rel:Has]->", Patterns.relationship(has, "rel", Direction.OUTGOING));
        assertEquals("<-[rel:Has]-", Patterns.relationship(has, "rel", Direction.INCOMING));
        assertEquals("-[:Has]-", Patterns.relationship(has, Direction.UNDIRECTED));
    }

    @Test
    void testFilterOnUnknownPropertyIsRejected() {
        TypeDescriptor<IdentityRole> roles = TypeDescriptors.describe(IdentityRole.class);

        assertThrows(IllegalArgumentException.class,
                () -> Patterns.node(roles, "r", InlineFilter.where("password", "password")));
    }

    @Test
    void testInvalidTokensAreRejected() {
        TypeDescriptor<IdentityRole> roles = TypeDescriptors.describe(IdentityRole.class);

        assertThrows(IllegalArgumentException.class, () -> Patterns.node(roles, "r) DETACH DELETE (x"));
        assertThrows(IllegalArgumentException.class, () -> InlineFilter.where("name", "name}) MATCH (x"));
        assertThrows(IllegalArgumentException.class, () -> InlineFilter.where("name", "a").and("name", "b"));
        assertThrows(IllegalArgumentException.class, () -> Patterns.relationship(roles, "r", null));
        assertThrows(IllegalArgumentException.class, () -> Patterns.node(null, "r"));
    }
}
