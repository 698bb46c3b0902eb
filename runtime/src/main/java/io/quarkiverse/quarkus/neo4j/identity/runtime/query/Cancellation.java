package io.quarkiverse.quarkus.neo4j.identity.runtime.query;

import java.util.concurrent.atomic.AtomicBoolean;

import io.quarkiverse.quarkus.neo4j.identity.runtime.errors.OperationCancelledException;

/**
 * Cooperative cancellation signal observed before each statement is dispatched.
 * <p>
 * A statement that has already been sent is not interrupted when the signal fires afterwards:
 * the session protocol has no way to abort a running statement, so cancellation only prevents
 * statements that have not started yet.
 */
public final class Cancellation {

    private static final Cancellation NONE = new Cancellation(false);

    private final boolean cancellable;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    private Cancellation(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * @return a signal that can never be cancelled
     */
    public static Cancellation none() {
        return NONE;
    }

    public static Cancellation create() {
        return new Cancellation(true);
    }

    public static Cancellation cancelled() {
        Cancellation cancellation = new Cancellation(true);
        cancellation.cancel();
        return cancellation;
    }

    /**
     * @return {@code true} if this call moved the signal to the cancelled state
     */
    public boolean cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("Cancellation.none() cannot be cancelled");
        }
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new OperationCancelledException("Operation was cancelled before dispatch");
        }
    }
}
