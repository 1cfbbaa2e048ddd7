package tech.gatekeeper.platform.authorization.events;

/**
 * Receives invalidation events from an {@link InvalidationBroadcaster}.
 */
@FunctionalInterface
public interface InvalidationListener {

    void onInvalidation(InvalidationEvent event);

    /**
     * A listener that reports false here is removed on the next publish instead of
     * being invoked. Lets a subscriber that was torn down without unsubscribing be
     * pruned safely.
     */
    default boolean isActive() {
        return true;
    }
}
