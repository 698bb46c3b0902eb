package io.quarkiverse.quarkus.neo4j.identity.runtime.errors;

import java.util.concurrent.CancellationException;

/**
 * Thrown when a cancellation was requested before a statement was dispatched.
 * The statement never reached the database.
 */
public class OperationCancelledException extends CancellationException {
    public OperationCancelledException(String message) {
        super(message);
    }
}
