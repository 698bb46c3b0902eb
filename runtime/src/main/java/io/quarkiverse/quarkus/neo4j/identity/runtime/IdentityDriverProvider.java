package io.quarkiverse.quarkus.neo4j.identity.runtime;

import java.util.concurrent.TimeUnit;

import org.jboss.logging.Logger;
import org.neo4j.driver.AuthToken;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Config;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;

import io.quarkiverse.quarkus.neo4j.identity.runtime.config.IdentityStoreConfig;
import io.quarkiverse.quarkus.neo4j.identity.runtime.query.SessionFactory;

/**
 * Owns the driver built from an {@link IdentityStoreConfig} and hands out sessions to the stores.
 */
public class IdentityDriverProvider implements SessionFactory, AutoCloseable {

    private static final Logger LOG = Logger.getLogger(IdentityDriverProvider.class);

    private final Driver driver;
    private final SessionConfig sessionConfig;

    public IdentityDriverProvider(IdentityStoreConfig config) {
        this(createDriver(config), sessionConfigOf(config));
    }

    public IdentityDriverProvider(Driver driver, SessionConfig sessionConfig) {
        if (driver == null) {
            throw new IllegalArgumentException("Driver cannot be null");
        }
        this.driver = driver;
        this.sessionConfig = sessionConfig == null ? SessionConfig.defaultConfig() : sessionConfig;
    }

    @Override
    public Session openSession() {
        return driver.session(sessionConfig);
    }

    public Driver getDriver() {
        return driver;
    }

    @Override
    public void close() {
        LOG.debug("Closing Neo4j driver");
        driver.close();
    }

    static AuthToken authTokenOf(IdentityStoreConfig config) {
        if (config.username().isEmpty()) {
            return AuthTokens.none();
        }
        return AuthTokens.basic(config.username().get(), config.password().orElse(""));
    }

    private static Driver createDriver(IdentityStoreConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Configuration cannot be null");
        }
        if (config.uri() == null || config.uri().isBlank()) {
            throw new IllegalArgumentException("neo4j.identity.uri cannot be empty");
        }
        Config driverConfig = Config.builder()
                .withMaxConnectionPoolSize(config.maxConnectionPoolSize())
                .withConnectionAcquisitionTimeout(config.connectionAcquisitionTimeout().toMillis(),
                        TimeUnit.MILLISECONDS)
                .build();
        LOG.debugf("Creating Neo4j driver for %s", config.uri());
        return GraphDatabase.driver(config.uri(), authTokenOf(config), driverConfig);
    }

    private static SessionConfig sessionConfigOf(IdentityStoreConfig config) {
        return config.database()
                .map(SessionConfig::forDatabase)
                .orElseGet(SessionConfig::defaultConfig);
    }
}
