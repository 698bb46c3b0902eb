package io.quarkiverse.quarkus.neo4j.identity.runtime.model;

import io.quarkiverse.quarkus.neo4j.identity.runtime.mapping.NodeId;

/**
 * A login and its associated provider for a user.
 */
public class IdentityUserLogin {

    @NodeId
    private Long entityId;

    private String loginProvider;

    private String providerKey;

    private String providerDisplayName;

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

    public String getProviderKey() {
        return providerKey;
    }

    public void setProviderKey(String providerKey) {
        this.providerKey = providerKey;
    }

    public String getProviderDisplayName() {
        return providerDisplayName;
    }

    public void setProviderDisplayName(String providerDisplayName) {
        this.providerDisplayName = providerDisplayName;
    }

    public UserLoginInfo toLoginInfo() {
        return new UserLoginInfo(loginProvider, providerKey, providerDisplayName);
    }
}
