package io.quarkiverse.quarkus.neo4j.identity.runtime.model;

import io.quarkiverse.quarkus.neo4j.identity.runtime.mapping.NodeId;

/**
 * A claim node owned by a user or a role.
 */
public class IdentityClaim {

    @NodeId
    private Long entityId;

    private String claimType;

    private String claimValue;

    public static IdentityClaim from(Claim claim) {
        IdentityClaim identityClaim = new IdentityClaim();
        identityClaim.initializeFromClaim(claim);
        return identityClaim;
    }

    public Long getEntityId() {
        return entityId;
    }

    public void setEntityId(Long entityId) {
        this.entityId = entityId;
    }

    public String getClaimType() {
        return claimType;
    }

    public void setClaimType(String claimType) {
        this.claimType = claimType;
    }

    public String getClaimValue() {
        return claimValue;
    }

    public void setClaimValue(String claimValue) {
        this.claimValue = claimValue;
    }

    public Claim toClaim() {
        return new Claim(claimType, claimValue);
    }

    public void initializeFromClaim(Claim claim) {
        this.claimType = claim.type();
        this.claimValue = claim.value();
    }
}
