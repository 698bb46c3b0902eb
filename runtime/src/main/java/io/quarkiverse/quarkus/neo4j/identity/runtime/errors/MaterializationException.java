package io.quarkiverse.quarkus.neo4j.identity.runtime.errors;

/**
 * Thrown when a returned record cannot be turned into an instance of the requested type,
 * typically because a value does not coerce to the declared field type.
 */
public class MaterializationException extends RepositoryException {
    public MaterializationException(String message, Throwable cause) {
        super(message, cause);
    }

    public MaterializationException(String message) {
        super(message);
    }
}
