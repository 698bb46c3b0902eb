package io.quarkiverse.quarkus.neo4j.identity.runtime.enums;

/**
 * How a field-name set filters a property projection.
 */
public enum ProjectionMode {
    /**
     * Only the listed properties are projected.
     */
    INCLUDE,

    /**
     * Every property except the listed ones is projected.
     */
    EXCLUDE
}
