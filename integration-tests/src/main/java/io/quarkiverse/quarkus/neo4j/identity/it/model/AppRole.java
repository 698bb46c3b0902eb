package io.quarkiverse.quarkus.neo4j.identity.it.model;

import io.quarkiverse.quarkus.neo4j.identity.runtime.model.IdentityRole;

public class AppRole extends IdentityRole {

    private String description;

    public AppRole() {
    }

    public AppRole(String name) {
        super(name);
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }
}
