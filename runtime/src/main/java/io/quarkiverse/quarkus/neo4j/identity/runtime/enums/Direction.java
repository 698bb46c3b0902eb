package io.quarkiverse.quarkus.neo4j.identity.runtime.enums;

public enum Direction {
    OUTGOING,
    INCOMING,
    UNDIRECTED
}
