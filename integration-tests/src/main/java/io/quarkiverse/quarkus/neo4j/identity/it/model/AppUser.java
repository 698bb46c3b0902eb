package io.quarkiverse.quarkus.neo4j.identity.it.model;

import io.quarkiverse.quarkus.neo4j.identity.runtime.model.IdentityUser;

public class AppUser extends IdentityUser {

    private String displayName;

    public AppUser() {
    }

    public AppUser(String userName) {
        super(userName);
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }
}
