package io.quarkiverse.quarkus.neo4j.identity.runtime.model;

import java.util.List;

/**
 * Outcome of a store write.
 */
public final class IdentityResult {

    private static final IdentityResult SUCCESS = new IdentityResult(true, List.of());

    private final boolean succeeded;
    private final List<IdentityError> errors;

    private IdentityResult(boolean succeeded, List<IdentityError> errors) {
        this.succeeded = succeeded;
        this.errors = List.copyOf(errors);
    }

    public static IdentityResult success() {
        return SUCCESS;
    }

    public static IdentityResult failed(IdentityError... errors) {
        return new IdentityResult(false, List.of(errors));
    }

    public boolean isSucceeded() {
        return succeeded;
    }

    public List<IdentityError> getErrors() {
        return errors;
    }

    @Override
    public String toString() {
        return succeeded ? "Succeeded" : "Failed : " + errors;
    }
}
