package io.quarkiverse.quarkus.neo4j.identity.runtime.model;

public record IdentityError(String code, String description) {
}
