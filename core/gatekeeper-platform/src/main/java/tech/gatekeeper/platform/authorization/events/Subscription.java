package tech.gatekeeper.platform.authorization.events;

/**
 * Handle returned by {@link InvalidationBroadcaster#subscribe}. Unsubscribing more
 * than once is a no-op.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}
