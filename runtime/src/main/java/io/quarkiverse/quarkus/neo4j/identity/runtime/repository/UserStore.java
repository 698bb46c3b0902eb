package io.quarkiverse.quarkus.neo4j.identity.runtime.repository;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.jboss.logging.Logger;

import io.quarkiverse.quarkus.neo4j.identity.runtime.enums.Direction;
import io.quarkiverse.quarkus.neo4j.identity.runtime.mapping.PropertyProjector;
import io.quarkiverse.quarkus.neo4j.identity.runtime.mapping.TypeDescriptor;
import io.quarkiverse.quarkus.neo4j.identity.runtime.mapping.TypeDescriptors;
import io.quarkiverse.quarkus.neo4j.identity.runtime.model.Claim;
import io.quarkiverse.quarkus.neo4j.identity.runtime.model.IdentityClaim;
import io.quarkiverse.quarkus.neo4j.identity.runtime.model.IdentityResult;
import io.quarkiverse.quarkus.neo4j.identity.runtime.model.IdentityRole;
import io.quarkiverse.quarkus.neo4j.identity.runtime.model.IdentityUser;
import io.quarkiverse.quarkus.neo4j.identity.runtime.model.IdentityUserLogin;
import io.quarkiverse.quarkus.neo4j.identity.runtime.model.IdentityUserToken;
import io.quarkiverse.quarkus.neo4j.identity.runtime.model.Relationships;
import io.quarkiverse.quarkus.neo4j.identity.runtime.model.UserLoginInfo;
import io.quarkiverse.quarkus.neo4j.identity.runtime.query.Cancellation;
import io.quarkiverse.quarkus.neo4j.identity.runtime.query.InlineFilter;
import io.quarkiverse.quarkus.neo4j.identity.runtime.query.Patterns;
import io.quarkiverse.quarkus.neo4j.identity.runtime.query.QueryExecutor;
import io.quarkiverse.quarkus.neo4j.identity.runtime.query.SessionQueries;

/**
 * User persistence. Users are nodes labelled after the user class hierarchy. Claims, logins and
 * tokens hang off the user through {@link Relationships.Has}, role membership is an
 * {@link Relationships.IsIn} relationship to the role node.
 *
 * @param <U> the user type
 * @param <R> the role type
 */
public class UserStore<U extends IdentityUser, R extends IdentityRole> extends AbstractStore {

    private static final Logger LOG = Logger.getLogger(UserStore.class);

    /**
     * Login provider under which the store keeps its own tokens.
     */
    public static final String INTERNAL_LOGIN_PROVIDER = "[IdentityUserStore]";
    public static final String AUTHENTICATOR_KEY_TOKEN = "AuthenticatorKey";
    public static final String RECOVERY_CODES_TOKEN = "RecoveryCodes";

    private static final String NORMALIZED_USER_NAME = "normalizedUserName";
    private static final String NORMALIZED_EMAIL = "normalizedEmail";
    private static final String NORMALIZED_NAME = "normalizedName";
    private static final String CLAIM_TYPE = "claimType";
    private static final String CLAIM_VALUE = "claimValue";
    private static final String LOGIN_PROVIDER = "loginProvider";
    private static final String PROVIDER_KEY = "providerKey";
    private static final String NAME = "name";

    private final Class<U> userType;
    private final Class<R> roleType;

    public UserStore(QueryExecutor executor, Class<U> userType, Class<R> roleType) {
        super(executor);
        this.userType = require(userType, "User type");
        this.roleType = require(roleType, "Role type");
    }

    public static UserStore<IdentityUser, IdentityRole> of(QueryExecutor executor) {
        return new UserStore<>(executor, IdentityUser.class, IdentityRole.class);
    }

    public Class<U> getUserType() {
        return userType;
    }

    public Class<R> getRoleType() {
        return roleType;
    }

    // ========================= Users =========================

    /**
     * Creates the user node and assigns the engine id to {@code entityId}.
     */
    public IdentityResult create(U user, Cancellation cancellation) {
        throwIfClosed();
        require(user, "User");

        String cypher = "CREATE " + Patterns.node(users(), "p")
                + " SET p += $user, p.entityId = id(p) RETURN p";
        Optional<U> created = executor.queryOptional(userType, cypher,
                parameters("user", PropertyProjector.all(user)), cancellation);

        if (created.isEmpty()) {
            return IdentityResult.failed();
        }
        user.setEntityId(created.get().getEntityId());
        LOG.debugf("Created user %s with entity id %s", user.getId(), user.getEntityId());
        return IdentityResult.success();
    }

    /**
     * Writes all mapped properties of the user. A fresh concurrency stamp is generated first.
     */
    public IdentityResult update(U user, Cancellation cancellation) {
        throwIfClosed();
        require(user, "User");

        user.setConcurrencyStamp(UUID.randomUUID().toString());
        String cypher = "MATCH " + Patterns.node(users(), "p", InlineFilter.where(ID, "id").and(ENTITY_ID, "entityId"))
                + " SET p += $user";
        executor.run(cypher, parameters(
                "user", PropertyProjector.all(user),
                "id", user.getId(),
                "entityId", user.getEntityId()), cancellation);
        return IdentityResult.success();
    }

    /**
     * Deletes the user node and its relationships. Claim, login and token nodes are left in place.
     */
    public IdentityResult delete(U user, Cancellation cancellation) {
        throwIfClosed();
        require(user, "User");

        String cypher = "MATCH " + Patterns.node(users(), "p", InlineFilter.where(ID, "id").and(ENTITY_ID, "entityId"))
                + " DETACH DELETE p";
        executor.run(cypher, parameters("id", user.getId(), "entityId", user.getEntityId()), cancellation);
        return IdentityResult.success();
    }

    public Optional<U> findById(String userId, Cancellation cancellation) {
        throwIfClosed();
        require(userId, "User id");
        return findOne(InlineFilter.where(ID, "userId"), parameters("userId", userId), cancellation);
    }

    public Optional<U> findByName(String normalizedUserName, Cancellation cancellation) {
        throwIfClosed();
        require(normalizedUserName, "Normalized user name");
        return findOne(InlineFilter.where(NORMALIZED_USER_NAME, "name"), parameters("name", normalizedUserName),
                cancellation);
    }

    public Optional<U> findByEmail(String normalizedEmail, Cancellation cancellation) {
        throwIfClosed();
        require(normalizedEmail, "Normalized email");
        return findOne(InlineFilter.where(NORMALIZED_EMAIL, "email"), parameters("email", normalizedEmail),
                cancellation);
    }

    public List<U> findAll(Cancellation cancellation) {
        throwIfClosed();
        return executor.queryMany(userType, "MATCH " + Patterns.node(users(), "p") + " RETURN p", null, cancellation)
                .toList();
    }

    private Optional<U> findOne(InlineFilter filter, Map<String, Object> parameters, Cancellation cancellation) {
        String cypher = "MATCH " + Patterns.node(users(), "p", filter) + " RETURN p";
        return executor.queryOptional(userType, cypher, parameters, cancellation);
    }

    // ========================= Roles =========================

    /**
     * Adds the user to the role with the given normalized name. The role is looked up first and the
     * membership written on the same session.
     *
     * @throws IllegalStateException if no such role exists
     */
    public void addToRole(U user, String normalizedRoleName, Cancellation cancellation) {
        throwIfClosed();
        require(user, "User");
        requireText(normalizedRoleName, "Normalized role name");

        executor.withSession(cancellation, queries -> {
            R role = findRole(queries, normalizedRoleName);
            String cypher = "MATCH " + Patterns.node(users(), "n", InlineFilter.where(ID, "userId"))
                    + " MATCH " + Patterns.node(roles(), "r", InlineFilter.where(ID, "roleId"))
                    + " CREATE (n)" + Patterns.relationship(isIn(), Direction.OUTGOING) + "(r)";
            queries.run(cypher, parameters("userId", user.getId(), "roleId", role.getId()));
            return null;
        });
    }

    /**
     * @throws IllegalStateException if no such role exists
     */
    public void removeFromRole(U user, String normalizedRoleName, Cancellation cancellation) {
        throwIfClosed();
        require(user, "User");
        requireText(normalizedRoleName, "Normalized role name");

        executor.withSession(cancellation, queries -> {
            R role = findRole(queries, normalizedRoleName);
            String cypher = "MATCH " + Patterns.node(users(), "n", InlineFilter.where(ID, "userId"))
                    + Patterns.relationship(isIn(), "rel", Direction.OUTGOING)
                    + Patterns.node(roles(), "r", InlineFilter.where(ID, "roleId"))
                    + " DELETE rel";
            queries.run(cypher, parameters("userId", user.getId(), "roleId", role.getId()));
            return null;
        });
    }

    /**
     * @return the names of the roles the user is in
     */
    public List<String> getRoles(U user, Cancellation cancellation) {
        throwIfClosed();
        require(user, "User");

        String cypher = "MATCH " + Patterns.node(users(), "n", InlineFilter.where(ID, "userId"))
                + Patterns.relationship(isIn(), "rel", Direction.OUTGOING)
                + Patterns.node(roles(), "r")
                + " RETURN r";
        return executor.queryMany(roleType, cypher, parameters("userId", user.getId()), cancellation)
                .map(IdentityRole::getName)
                .toList();
    }

    public boolean isInRole(U user, String normalizedRoleName, Cancellation cancellation) {
        throwIfClosed();
        require(user, "User");
        requireText(normalizedRoleName, "Normalized role name");

        String cypher = "MATCH " + Patterns.node(users(), "n", InlineFilter.where(ID, "userId"))
                + Patterns.relationship(isIn(), "rel", Direction.OUTGOING)
                + Patterns.node(roles(), "r", InlineFilter.where(NORMALIZED_NAME, "roleName"))
                + " RETURN r";
        return !executor.queryMany(roleType, cypher,
                parameters("userId", user.getId(), "roleName", normalizedRoleName), cancellation).isEmpty();
    }

    public List<U> getUsersInRole(String normalizedRoleName, Cancellation cancellation) {
        throwIfClosed();
        requireText(normalizedRoleName, "Normalized role name");

        String cypher = "MATCH " + Patterns.node(users(), "n")
                + Patterns.relationship(isIn(), Direction.OUTGOING)
                + Patterns.node(roles(), "r", InlineFilter.where(NORMALIZED_NAME, "roleName"))
                + " RETURN n";
        return executor.queryMany(userType, cypher, parameters("roleName", normalizedRoleName), cancellation)
                .toList();
    }

    private R findRole(SessionQueries queries, String normalizedRoleName) {
        String cypher = "MATCH " + Patterns.node(roles(), "r", InlineFilter.where(NORMALIZED_NAME, "roleName"))
                + " RETURN r";
        return queries.queryOptional(roleType, cypher, parameters("roleName", normalizedRoleName))
                .orElseThrow(() -> new IllegalStateException("Role '" + normalizedRoleName + "' not found"));
    }

    // ========================= Claims =========================

    public List<Claim> getClaims(U user, Cancellation cancellation) {
        throwIfClosed();
        require(user, "User");

        String cypher = "MATCH " + Patterns.node(users(), "n", InlineFilter.where(ID, "userId"))
                + Patterns.relationship(has(), "rel", Direction.OUTGOING)
                + Patterns.node(claims(), "c")
                + " RETURN c";
        return executor.queryMany(IdentityClaim.class, cypher, parameters("userId", user.getId()), cancellation)
                .map(IdentityClaim::toClaim)
                .toList();
    }

    /**
     * Attaches all claims to the user in one statement. An empty collection sends nothing.
     */
    public void addClaims(U user, Collection<Claim> claims, Cancellation cancellation) {
        throwIfClosed();
        require(user, "User");
        require(claims, "Claims");
        if (claims.isEmpty()) {
            return;
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        for (Claim claim : claims) {
            rows.add(PropertyProjector.include(IdentityClaim.from(require(claim, "Claim")), CLAIM_TYPE, CLAIM_VALUE));
        }
        String cypher = "MATCH " + Patterns.node(users(), "n", InlineFilter.where(ID, "userId"))
                + " UNWIND $claims AS row"
                + " CREATE (n)" + Patterns.relationship(has(), Direction.OUTGOING) + Patterns.node(claims(), "c")
                + " SET c += row, c.entityId = id(c)";
        executor.run(cypher, parameters("userId", user.getId(), "claims", rows), cancellation);
    }

    public void replaceClaim(U user, Claim claim, Claim newClaim, Cancellation cancellation) {
        throwIfClosed();
        require(user, "User");
        require(claim, "Claim");
        require(newClaim, "New claim");

        String cypher = "MATCH " + Patterns.node(users(), "n", InlineFilter.where(ID, "userId"))
                + Patterns.relationship(has(), Direction.OUTGOING)
                + Patterns.node(claims(), "c", InlineFilter.where(CLAIM_VALUE, "oldValue").and(CLAIM_TYPE, "oldType"))
                + " SET c.claimValue = $newValue, c.claimType = $newType";
        executor.run(cypher, parameters(
                "userId", user.getId(),
                "oldValue", claim.value(),
                "oldType", claim.type(),
                "newValue", newClaim.value(),
                "newType", newClaim.type()), cancellation);
    }

    public void removeClaims(U user, Collection<Claim> claims, Cancellation cancellation) {
        throwIfClosed();
        require(user, "User");
        require(claims, "Claims");
        if (claims.isEmpty()) {
            return;
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        for (Claim claim : claims) {
            require(claim, "Claim");
            rows.add(parameters("type", claim.type(), "value", claim.value()));
        }
        String cypher = "UNWIND $claims AS row"
                + " MATCH " + Patterns.node(users(), "n", InlineFilter.where(ID, "userId"))
                + Patterns.relationship(has(), Direction.OUTGOING)
                + Patterns.node(claims(), "c",
                        InlineFilter.whereExpression(CLAIM_VALUE, "row.value").andExpression(CLAIM_TYPE, "row.type"))
                + " DETACH DELETE c";
        executor.run(cypher, parameters("userId", user.getId(), "claims", rows), cancellation);
    }

    public List<U> getUsersForClaim(Claim claim, Cancellation cancellation) {
        throwIfClosed();
        require(claim, "Claim");

        String cypher = "MATCH " + Patterns.node(users(), "n")
                + Patterns.relationship(has(), Direction.UNDIRECTED)
                + Patterns.node(claims(), "c", InlineFilter.where(CLAIM_TYPE, "type").and(CLAIM_VALUE, "value"))
                + " RETURN n";
        return executor.queryMany(userType, cypher, parameters("type", claim.type(), "value", claim.value()),
                cancellation).toList();
    }

    // ========================= Logins =========================

    public void addLogin(U user, UserLoginInfo login, Cancellation cancellation) {
        throwIfClosed();
        require(user, "User");
        require(login, "Login");

        IdentityUserLogin node = new IdentityUserLogin();
        node.setLoginProvider(login.loginProvider());
        node.setProviderKey(login.providerKey());
        node.setProviderDisplayName(login.providerDisplayName());

        String cypher = "MATCH " + Patterns.node(users(), "n", InlineFilter.where(ID, "userId"))
                + " CREATE (n)" + Patterns.relationship(has(), Direction.OUTGOING) + Patterns.node(logins(), "c")
                + " SET c += $login, c.entityId = id(c)";
        executor.run(cypher, parameters("userId", user.getId(), "login", PropertyProjector.all(node)), cancellation);
    }

    public void removeLogin(U user, String loginProvider, String providerKey, Cancellation cancellation) {
        throwIfClosed();
        require(user, "User");
        require(loginProvider, "Login provider");
        require(providerKey, "Provider key");

        String cypher = "MATCH " + Patterns.node(users(), "n", InlineFilter.where(ID, "userId"))
                + Patterns.relationship(has(), Direction.OUTGOING)
                + Patterns.node(logins(), "c",
                        InlineFilter.where(LOGIN_PROVIDER, "loginProvider").and(PROVIDER_KEY, "providerKey"))
                + " DETACH DELETE c";
        executor.run(cypher, parameters(
                "userId", user.getId(),
                "loginProvider", loginProvider,
                "providerKey", providerKey), cancellation);
    }

    public List<UserLoginInfo> getLogins(U user, Cancellation cancellation) {
        throwIfClosed();
        require(user, "User");

        String cypher = "MATCH " + Patterns.node(users(), "n", InlineFilter.where(ID, "userId"))
                + Patterns.relationship(has(), "rel", Direction.OUTGOING)
                + Patterns.node(logins(), "c")
                + " RETURN c";
        return executor.queryMany(IdentityUserLogin.class, cypher, parameters("userId", user.getId()), cancellation)
                .map(IdentityUserLogin::toLoginInfo)
                .toList();
    }

    public Optional<U> findByLogin(String loginProvider, String providerKey, Cancellation cancellation) {
        throwIfClosed();
        require(loginProvider, "Login provider");
        require(providerKey, "Provider key");

        String cypher = "MATCH " + Patterns.node(users(), "n")
                + Patterns.relationship(has(), Direction.OUTGOING)
                + Patterns.node(logins(), "c",
                        InlineFilter.where(LOGIN_PROVIDER, "loginProvider").and(PROVIDER_KEY, "providerKey"))
                + " RETURN n";
        return executor.queryOptional(userType, cypher,
                parameters("loginProvider", loginProvider, "providerKey", providerKey), cancellation);
    }

    // ========================= Tokens =========================

    /**
     * Stores a token. An existing token with the same provider and name is overwritten.
     */
    public void setToken(U user, String loginProvider, String name, String value, Cancellation cancellation) {
        throwIfClosed();
        require(user, "User");
        require(loginProvider, "Login provider");
        require(name, "Token name");

        String cypher = "MATCH " + Patterns.node(users(), "n", InlineFilter.where(ID, "userId"))
                + " MERGE (n)" + Patterns.relationship(has(), Direction.OUTGOING)
                + Patterns.node(tokens(), "c", InlineFilter.where(LOGIN_PROVIDER, "loginProvider").and(NAME, "name"))
                + " ON CREATE SET c.entityId = id(c)"
                + " SET c.value = $value";
        executor.run(cypher, parameters(
                "userId", user.getId(),
                "loginProvider", loginProvider,
                "name", name,
                "value", value), cancellation);
    }

    public void removeToken(U user, String loginProvider, String name, Cancellation cancellation) {
        throwIfClosed();
        require(user, "User");
        require(loginProvider, "Login provider");
        require(name, "Token name");

        String cypher = "MATCH " + Patterns.node(users(), "n", InlineFilter.where(ID, "userId"))
                + Patterns.relationship(has(), Direction.OUTGOING)
                + Patterns.node(tokens(), "c", InlineFilter.where(LOGIN_PROVIDER, "loginProvider").and(NAME, "name"))
                + " DETACH DELETE c";
        executor.run(cypher, parameters(
                "userId", user.getId(),
                "loginProvider", loginProvider,
                "name", name), cancellation);
    }

    public Optional<String> getToken(U user, String loginProvider, String name, Cancellation cancellation) {
        throwIfClosed();
        require(user, "User");
        require(loginProvider, "Login provider");
        require(name, "Token name");

        String cypher = "MATCH " + Patterns.node(users(), "n", InlineFilter.where(ID, "userId"))
                + Patterns.relationship(has(), Direction.OUTGOING)
                + Patterns.node(tokens(), "c", InlineFilter.where(LOGIN_PROVIDER, "loginProvider").and(NAME, "name"))
                + " RETURN c";
        return executor.queryOptional(IdentityUserToken.class, cypher, parameters(
                "userId", user.getId(),
                "loginProvider", loginProvider,
                "name", name), cancellation)
                .map(IdentityUserToken::getValue);
    }

    public void setAuthenticatorKey(U user, String key, Cancellation cancellation) {
        setToken(user, INTERNAL_LOGIN_PROVIDER, AUTHENTICATOR_KEY_TOKEN, key, cancellation);
    }

    public Optional<String> getAuthenticatorKey(U user, Cancellation cancellation) {
        return getToken(user, INTERNAL_LOGIN_PROVIDER, AUTHENTICATOR_KEY_TOKEN, cancellation);
    }

    /**
     * Replaces the recovery codes of the user. Codes are kept as one {@code ;} separated token.
     */
    public void replaceCodes(U user, Collection<String> recoveryCodes, Cancellation cancellation) {
        require(recoveryCodes, "Recovery codes");
        setToken(user, INTERNAL_LOGIN_PROVIDER, RECOVERY_CODES_TOKEN, String.join(";", recoveryCodes), cancellation);
    }

    /**
     * Consumes a recovery code.
     *
     * @return {@code true} if the code was valid and has been removed
     */
    public boolean redeemCode(U user, String code, Cancellation cancellation) {
        require(code, "Recovery code");

        List<String> codes = recoveryCodes(user, cancellation);
        if (!codes.remove(code)) {
            return false;
        }
        replaceCodes(user, codes, cancellation);
        return true;
    }

    public int countCodes(U user, Cancellation cancellation) {
        return recoveryCodes(user, cancellation).size();
    }

    private List<String> recoveryCodes(U user, Cancellation cancellation) {
        String merged = getToken(user, INTERNAL_LOGIN_PROVIDER, RECOVERY_CODES_TOKEN, cancellation).orElse("");
        if (merged.isEmpty()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(merged.split(";")));
    }

    // ========================= In-memory accessors =========================

    public String getUserId(U user) {
        return checked(user).getId();
    }

    public String getUserName(U user) {
        return checked(user).getUserName();
    }

    public void setUserName(U user, String userName) {
        checked(user).setUserName(userName);
    }

    public String getNormalizedUserName(U user) {
        return checked(user).getNormalizedUserName();
    }

    public void setNormalizedUserName(U user, String normalizedName) {
        checked(user).setNormalizedUserName(normalizedName);
    }

    public String getPasswordHash(U user) {
        return checked(user).getPasswordHash();
    }

    public void setPasswordHash(U user, String passwordHash) {
        checked(user).setPasswordHash(passwordHash);
    }

    public boolean hasPassword(U user) {
        return checked(user).getPasswordHash() != null;
    }

    public String getSecurityStamp(U user) {
        return checked(user).getSecurityStamp();
    }

    public void setSecurityStamp(U user, String stamp) {
        require(stamp, "Security stamp");
        checked(user).setSecurityStamp(stamp);
    }

    public String getEmail(U user) {
        return checked(user).getEmail();
    }

    public void setEmail(U user, String email) {
        checked(user).setEmail(email);
    }

    public boolean getEmailConfirmed(U user) {
        return checked(user).isEmailConfirmed();
    }

    public void setEmailConfirmed(U user, boolean confirmed) {
        checked(user).setEmailConfirmed(confirmed);
    }

    public String getNormalizedEmail(U user) {
        return checked(user).getNormalizedEmail();
    }

    public void setNormalizedEmail(U user, String normalizedEmail) {
        checked(user).setNormalizedEmail(normalizedEmail);
    }

    public String getPhoneNumber(U user) {
        return checked(user).getPhoneNumber();
    }

    public void setPhoneNumber(U user, String phoneNumber) {
        checked(user).setPhoneNumber(phoneNumber);
    }

    public boolean getPhoneNumberConfirmed(U user) {
        return checked(user).isPhoneNumberConfirmed();
    }

    public void setPhoneNumberConfirmed(U user, boolean confirmed) {
        checked(user).setPhoneNumberConfirmed(confirmed);
    }

    public boolean getTwoFactorEnabled(U user) {
        return checked(user).isTwoFactorEnabled();
    }

    public void setTwoFactorEnabled(U user, boolean enabled) {
        checked(user).setTwoFactorEnabled(enabled);
    }

    public OffsetDateTime getLockoutEndDate(U user) {
        return checked(user).getLockoutEnd();
    }

    public void setLockoutEndDate(U user, OffsetDateTime lockoutEnd) {
        checked(user).setLockoutEnd(lockoutEnd);
    }

    public boolean getLockoutEnabled(U user) {
        return checked(user).isLockoutEnabled();
    }

    public void setLockoutEnabled(U user, boolean enabled) {
        checked(user).setLockoutEnabled(enabled);
    }

    /**
     * @return the new number of failed attempts
     */
    public int incrementAccessFailedCount(U user) {
        U checked = checked(user);
        checked.setAccessFailedCount(checked.getAccessFailedCount() + 1);
        return checked.getAccessFailedCount();
    }

    public void resetAccessFailedCount(U user) {
        checked(user).setAccessFailedCount(0);
    }

    public int getAccessFailedCount(U user) {
        return checked(user).getAccessFailedCount();
    }

    private U checked(U user) {
        throwIfClosed();
        return require(user, "User");
    }

    private TypeDescriptor<U> users() {
        return TypeDescriptors.describe(userType);
    }

    private TypeDescriptor<R> roles() {
        return TypeDescriptors.describe(roleType);
    }

    private static TypeDescriptor<IdentityClaim> claims() {
        return TypeDescriptors.describe(IdentityClaim.class);
    }

    private static TypeDescriptor<IdentityUserLogin> logins() {
        return TypeDescriptors.describe(IdentityUserLogin.class);
    }

    private static TypeDescriptor<IdentityUserToken> tokens() {
        return TypeDescriptors.describe(IdentityUserToken.class);
    }

    private static TypeDescriptor<Relationships.Has> has() {
        return TypeDescriptors.describe(Relationships.Has.class);
    }

    private static TypeDescriptor<Relationships.IsIn> isIn() {
        return TypeDescriptors.describe(Relationships.IsIn.class);
    }
}
