package io.quarkiverse.quarkus.neo4j.identity.runtime.query;

import org.neo4j.driver.Session;

/**
 * Source of short-lived sessions. Every session handed out is closed by the caller.
 */
@FunctionalInterface
public interface SessionFactory {
    Session openSession();
}
