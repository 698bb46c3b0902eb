package io.quarkiverse.quarkus.neo4j.identity.runtime.model;

import java.util.UUID;

import io.quarkiverse.quarkus.neo4j.identity.runtime.mapping.NodeId;

/**
 * A role. Subclasses add their own label in front of {@code IdentityRole}.
 */
public class IdentityRole {

    @NodeId
    private Long entityId;

    private String id = UUID.randomUUID().toString();

    private String name;

    private String normalizedName;

    private String concurrencyStamp = UUID.randomUUID().toString();

    public IdentityRole() {
    }

    public IdentityRole(String name) {
        this.name = name;
    }

    public Long getEntityId() {
        return entityId;
    }

    public void setEntityId(Long entityId) {
        this.entityId = entityId;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getNormalizedName() {
        return normalizedName;
    }

    public void setNormalizedName(String normalizedName) {
        this.normalizedName = normalizedName;
    }

    /**
     * Opaque stamp regenerated on every update. It is not checked on write.
     */
    public String getConcurrencyStamp() {
        return concurrencyStamp;
    }

    public void setConcurrencyStamp(String concurrencyStamp) {
        this.concurrencyStamp = concurrencyStamp;
    }

    @Override
    public String toString() {
        return name;
    }
}
