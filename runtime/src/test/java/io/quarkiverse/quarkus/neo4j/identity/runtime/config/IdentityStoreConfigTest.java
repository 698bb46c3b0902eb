package io.quarkiverse.quarkus.neo4j.identity.runtime.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;

class IdentityStoreConfigTest {

    static IdentityStoreConfig configOf(Map<String, String> properties) {
        SmallRyeConfig config = new SmallRyeConfigBuilder()
                .withSources(new PropertiesConfigSource(properties, "test", 500))
                .withMapping(IdentityStoreConfig.class)
                .build();
        return config.getConfigMapping(IdentityStoreConfig.class);
    }

    @Test
    void testDefaults() {
        IdentityStoreConfig config = configOf(Map.of("neo4j.identity.uri", "bolt://localhost:7687"));

        assertThat(config.uri()).isEqualTo("bolt://localhost:7687");
        assertThat(config.username()).isEmpty();
        assertThat(config.password()).isEmpty();
        assertThat(config.database()).isEmpty();
        assertThat(config.maxConnectionPoolSize()).isEqualTo(100);
        assertThat(config.connectionAcquisitionTimeout()).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void testExplicitValues() {
        IdentityStoreConfig config = configOf(Map.of(
                "neo4j.identity.uri", "neo4j://db:7687",
                "neo4j.identity.username", "neo4j",
                "neo4j.identity.password", "secret",
                "neo4j.identity.database", "identity",
                "neo4j.identity.max-connection-pool-size", "10",
                "neo4j.identity.connection-acquisition-timeout", "PT5S"));

        assertThat(config.username()).contains("neo4j");
        assertThat(config.password()).contains("secret");
        assertThat(config.database()).contains("identity");
        assertThat(config.maxConnectionPoolSize()).isEqualTo(10);
        assertThat(config.connectionAcquisitionTimeout()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void testUriIsRequired() {
        assertThatThrownBy(() -> configOf(Map.of("neo4j.identity.username", "neo4j")))
                .isInstanceOf(RuntimeException.class);
    }

    @Test
    void testLoadReadsSystemProperties() {
        System.setProperty("neo4j.identity.uri", "bolt://identity-db:7687");
        try {
            assertThat(IdentityStoreConfig.load().uri()).isEqualTo("bolt://identity-db:7687");
        } finally {
            System.clearProperty("neo4j.identity.uri");
        }
    }
}
