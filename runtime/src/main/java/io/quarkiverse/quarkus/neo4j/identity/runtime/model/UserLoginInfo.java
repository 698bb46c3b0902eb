package io.quarkiverse.quarkus.neo4j.identity.runtime.model;

/**
 * An external login of a user.
 *
 * @param loginProvider the provider, e.g. google
 * @param providerKey the user's unique key at the provider
 * @param providerDisplayName the provider name shown in a UI
 */
public record UserLoginInfo(String loginProvider, String providerKey, String providerDisplayName) {
}
