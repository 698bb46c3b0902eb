package io.quarkiverse.quarkus.neo4j.identity.runtime.repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.jboss.logging.Logger;

import io.quarkiverse.quarkus.neo4j.identity.runtime.enums.Direction;
import io.quarkiverse.quarkus.neo4j.identity.runtime.mapping.PropertyProjector;
import io.quarkiverse.quarkus.neo4j.identity.runtime.mapping.TypeDescriptor;
import io.quarkiverse.quarkus.neo4j.identity.runtime.mapping.TypeDescriptors;
import io.quarkiverse.quarkus.neo4j.identity.runtime.model.Claim;
import io.quarkiverse.quarkus.neo4j.identity.runtime.model.IdentityClaim;
import io.quarkiverse.quarkus.neo4j.identity.runtime.model.IdentityResult;
import io.quarkiverse.quarkus.neo4j.identity.runtime.model.IdentityRole;
import io.quarkiverse.quarkus.neo4j.identity.runtime.model.Relationships;
import io.quarkiverse.quarkus.neo4j.identity.runtime.query.Cancellation;
import io.quarkiverse.quarkus.neo4j.identity.runtime.query.InlineFilter;
import io.quarkiverse.quarkus.neo4j.identity.runtime.query.Patterns;
import io.quarkiverse.quarkus.neo4j.identity.runtime.query.QueryExecutor;

/**
 * Role persistence. Roles are stored as nodes labelled after the role class hierarchy, their
 * claims as {@link IdentityClaim} nodes attached through {@link Relationships.Has}.
 *
 * @param <R> the role type
 */
public class RoleStore<R extends IdentityRole> extends AbstractStore {

    private static final Logger LOG = Logger.getLogger(RoleStore.class);

    private static final String NORMALIZED_NAME = "normalizedName";
    private static final String CLAIM_TYPE = "claimType";
    private static final String CLAIM_VALUE = "claimValue";

    private final Class<R> roleType;

    public RoleStore(QueryExecutor executor, Class<R> roleType) {
        super(executor);
        this.roleType = require(roleType, "Role type");
    }

    public static RoleStore<IdentityRole> of(QueryExecutor executor) {
        return new RoleStore<>(executor, IdentityRole.class);
    }

    public Class<R> getRoleType() {
        return roleType;
    }

    // ========================= Roles =========================

    /**
     * Creates the role node and assigns the engine id to {@code entityId}.
     */
    public IdentityResult create(R role, Cancellation cancellation) {
        throwIfClosed();
        require(role, "Role");

        String cypher = "CREATE " + Patterns.node(roles(), "p")
                + " SET p += $role, p.entityId = id(p) RETURN p";
        Optional<R> created = executor.queryOptional(roleType, cypher,
                parameters("role", PropertyProjector.all(role)), cancellation);

        if (created.isEmpty()) {
            return IdentityResult.failed();
        }
        role.setEntityId(created.get().getEntityId());
        LOG.debugf("Created role %s with entity id %s", role.getId(), role.getEntityId());
        return IdentityResult.success();
    }

    /**
     * Writes all mapped properties of the role. A fresh concurrency stamp is generated first.
     */
    public IdentityResult update(R role, Cancellation cancellation) {
        throwIfClosed();
        require(role, "Role");

        role.setConcurrencyStamp(UUID.randomUUID().toString());
        String cypher = "MATCH " + Patterns.node(roles(), "p", InlineFilter.where(ID, "id").and(ENTITY_ID, "entityId"))
                + " SET p += $role";
        executor.run(cypher, parameters(
                "role", PropertyProjector.all(role),
                "id", role.getId(),
                "entityId", role.getEntityId()), cancellation);
        return IdentityResult.success();
    }

    public IdentityResult delete(R role, Cancellation cancellation) {
        throwIfClosed();
        require(role, "Role");

        String cypher = "MATCH " + Patterns.node(roles(), "p", InlineFilter.where(ID, "id").and(ENTITY_ID, "entityId"))
                + " DETACH DELETE p";
        executor.run(cypher, parameters("id", role.getId(), "entityId", role.getEntityId()), cancellation);
        return IdentityResult.success();
    }

    public Optional<R> findById(String roleId, Cancellation cancellation) {
        throwIfClosed();
        require(roleId, "Role id");

        String cypher = "MATCH " + Patterns.node(roles(), "p", InlineFilter.where(ID, "roleId")) + " RETURN p";
        return executor.queryOptional(roleType, cypher, parameters("roleId", roleId), cancellation);
    }

    public Optional<R> findByName(String normalizedRoleName, Cancellation cancellation) {
        throwIfClosed();
        require(normalizedRoleName, "Normalized role name");

        String cypher = "MATCH " + Patterns.node(roles(), "p", InlineFilter.where(NORMALIZED_NAME, "name"))
                + " RETURN p";
        return executor.queryOptional(roleType, cypher, parameters("name", normalizedRoleName), cancellation);
    }

    public List<R> findAll(Cancellation cancellation) {
        throwIfClosed();
        return executor.queryMany(roleType, "MATCH " + Patterns.node(roles(), "p") + " RETURN p", null, cancellation)
                .toList();
    }

    // ========================= Claims =========================

    public List<Claim> getClaims(R role, Cancellation cancellation) {
        throwIfClosed();
        require(role, "Role");

        String cypher = "MATCH " + Patterns.node(roles(), "n", InlineFilter.where(ID, "roleId"))
                + Patterns.relationship(has(), "rel", Direction.OUTGOING)
                + Patterns.node(claims(), "c")
                + " RETURN c";
        return executor.queryMany(IdentityClaim.class, cypher, parameters("roleId", role.getId()), cancellation)
                .map(IdentityClaim::toClaim)
                .toList();
    }

    public void addClaim(R role, Claim claim, Cancellation cancellation) {
        throwIfClosed();
        require(role, "Role");
        require(claim, "Claim");

        String cypher = "MATCH " + Patterns.node(roles(), "n", InlineFilter.where(ID, "roleId"))
                + " CREATE (n)" + Patterns.relationship(has(), Direction.OUTGOING) + Patterns.node(claims(), "c")
                + " SET c += $claim, c.entityId = id(c)";
        executor.run(cypher, parameters(
                "roleId", role.getId(),
                "claim", PropertyProjector.include(IdentityClaim.from(claim), CLAIM_TYPE, CLAIM_VALUE)), cancellation);
    }

    public void removeClaim(R role, Claim claim, Cancellation cancellation) {
        throwIfClosed();
        require(role, "Role");
        require(claim, "Claim");

        String cypher = "MATCH " + Patterns.node(roles(), "n", InlineFilter.where(ID, "roleId"))
                + Patterns.relationship(has(), Direction.OUTGOING)
                + Patterns.node(claims(), "c", InlineFilter.where(CLAIM_VALUE, "value").and(CLAIM_TYPE, "type"))
                + " DETACH DELETE c";
        executor.run(cypher, parameters(
                "roleId", role.getId(),
                "value", claim.value(),
                "type", claim.type()), cancellation);
    }

    // ========================= In-memory accessors =========================

    public String getRoleId(R role) {
        throwIfClosed();
        return require(role, "Role").getId();
    }

    public String getRoleName(R role) {
        throwIfClosed();
        return require(role, "Role").getName();
    }

    public void setRoleName(R role, String roleName) {
        throwIfClosed();
        require(role, "Role").setName(roleName);
    }

    public String getNormalizedRoleName(R role) {
        throwIfClosed();
        return require(role, "Role").getNormalizedName();
    }

    public void setNormalizedRoleName(R role, String normalizedName) {
        throwIfClosed();
        require(role, "Role").setNormalizedName(normalizedName);
    }

    private TypeDescriptor<R> roles() {
        return TypeDescriptors.describe(roleType);
    }

    private static TypeDescriptor<IdentityClaim> claims() {
        return TypeDescriptors.describe(IdentityClaim.class);
    }

    private static TypeDescriptor<Relationships.Has> has() {
        return TypeDescriptors.describe(Relationships.Has.class);
    }
}
