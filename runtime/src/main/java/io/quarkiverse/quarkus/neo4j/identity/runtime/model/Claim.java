package io.quarkiverse.quarkus.neo4j.identity.runtime.model;

/**
 * A statement about a subject, identified by its type and value.
 */
public record Claim(String type, String value) {
    public static Claim of(String type, String value) {
        return new Claim(type, value);
    }
}
