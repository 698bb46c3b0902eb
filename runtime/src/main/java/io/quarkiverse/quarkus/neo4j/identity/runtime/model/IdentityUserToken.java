package io.quarkiverse.quarkus.neo4j.identity.runtime.model;

import io.quarkiverse.quarkus.neo4j.identity.runtime.mapping.NodeId;

/**
 * An authentication token of a user, keyed by login provider and name.
 */
public class IdentityUserToken {

    @NodeId
    private Long entityId;

    private String loginProvider;

    private String name;

    private String value;

    public Long getEntityId() {
        return entityId;
    }

    public void setEntityId(Long entityId) {
        this.entityId = entityId;
    }

    public String getLoginProvider() {
        return loginProvider;
    }

    public void setLoginProvider(String loginProvider) {
        this.loginProvider = loginProvider;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }
}
