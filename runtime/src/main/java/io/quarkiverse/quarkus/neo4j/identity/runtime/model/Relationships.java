package io.quarkiverse.quarkus.neo4j.identity.runtime.model;

import io.quarkiverse.quarkus.neo4j.identity.runtime.mapping.RelationshipEntity;

/**
 * Relationship types used by the identity stores.
 */
public final class Relationships {

    /**
     * Owner to owned node: user or role to claim, user to login and token.
     */
    @RelationshipEntity
    public static final class Has {
    }

    /**
     * User to role membership.
     */
    @RelationshipEntity
    public static final class IsIn {
    }

    private Relationships() {
    }
}
