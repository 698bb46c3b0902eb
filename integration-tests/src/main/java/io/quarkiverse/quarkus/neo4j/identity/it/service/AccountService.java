package io.quarkiverse.quarkus.neo4j.identity.it.service;

import java.util.Collection;
import java.util.Locale;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import io.quarkiverse.quarkus.neo4j.identity.it.model.AppRole;
import io.quarkiverse.quarkus.neo4j.identity.it.model.AppUser;
import io.quarkiverse.quarkus.neo4j.identity.runtime.model.Claim;
import io.quarkiverse.quarkus.neo4j.identity.runtime.model.IdentityResult;
import io.quarkiverse.quarkus.neo4j.identity.runtime.query.Cancellation;
import io.quarkiverse.quarkus.neo4j.identity.runtime.repository.RoleStore;
import io.quarkiverse.quarkus.neo4j.identity.runtime.repository.UserStore;

/**
 * Small account workflow on top of the stores, used to exercise them against a real database.
 */
@ApplicationScoped
public class AccountService {

    private static final Logger LOG = Logger.getLogger(AccountService.class);

    private final UserStore<AppUser, AppRole> users;
    private final RoleStore<AppRole> roles;

    public AccountService(UserStore<AppUser, AppRole> users, RoleStore<AppRole> roles) {
        this.users = users;
        this.roles = roles;
    }

    static String normalize(String value) {
        return value == null ? null : value.toUpperCase(Locale.ROOT);
    }

    public AppRole ensureRole(String name) {
        return roles.findByName(normalize(name), Cancellation.none()).orElseGet(() -> {
            AppRole role = new AppRole(name);
            role.setNormalizedName(normalize(name));
            IdentityResult result = roles.create(role, Cancellation.none());
            if (!result.isSucceeded()) {
                throw new IllegalStateException("Could not create role " + name + ": " + result);
            }
            return role;
        });
    }

    /**
     * Creates a user, puts it into the given roles and attaches the claims.
     */
    public AppUser register(String userName, String email, Collection<String> roleNames, Collection<Claim> claims) {
        AppUser user = new AppUser(userName);
        user.setNormalizedUserName(normalize(userName));
        user.setEmail(email);
        user.setNormalizedEmail(normalize(email));
        user.setSecurityStamp(UUID.randomUUID().toString());
        user.setLockoutEnabled(true);

        IdentityResult result = users.create(user, Cancellation.none());
        if (!result.isSucceeded()) {
            throw new IllegalStateException("Could not register " + userName + ": " + result);
        }
        for (String roleName : roleNames) {
            ensureRole(roleName);
            users.addToRole(user, normalize(roleName), Cancellation.none());
        }
        users.addClaims(user, claims, Cancellation.none());
        LOG.debugf("Registered %s in %d roles", userName, roleNames.size());
        return user;
    }

    /**
     * Records a failed sign-in and persists the counter.
     *
     * @return the number of failed attempts so far
     */
    public int recordFailedSignIn(AppUser user) {
        int failures = users.incrementAccessFailedCount(user);
        users.update(user, Cancellation.none());
        return failures;
    }
}
