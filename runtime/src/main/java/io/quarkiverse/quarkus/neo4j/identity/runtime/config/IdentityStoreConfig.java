package io.quarkiverse.quarkus.neo4j.identity.runtime.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.WithDefault;

/**
 * Connection settings of the identity stores. The values are handed to the driver as they are.
 */
@ConfigMapping(prefix = "neo4j.identity")
public interface IdentityStoreConfig {

    /**
     * Bolt or neo4j URI of the database, e.g. {@code bolt://localhost:7687}.
     */
    String uri();

    /**
     * User name for basic authentication. Without it no authentication is used.
     */
    Optional<String> username();

    Optional<String> password();

    /**
     * Target database, the server default when absent.
     */
    Optional<String> database();

    @WithDefault("100")
    int maxConnectionPoolSize();

    @WithDefault("PT60S")
    Duration connectionAcquisitionTimeout();

    /**
     * Reads the configuration from system properties, environment variables and
     * {@code META-INF/microprofile-config.properties}.
     */
    static IdentityStoreConfig load() {
        SmallRyeConfig config = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .addDefaultInterceptors()
                .withMapping(IdentityStoreConfig.class)
                .build();
        return config.getConfigMapping(IdentityStoreConfig.class);
    }
}
