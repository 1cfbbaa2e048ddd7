package tech.gatekeeper.platform.authorization.events;

/**
 * Reach of an {@link InvalidationEvent}.
 */
public enum InvalidationScope {
    ALL,
    USER,
    RESOURCE
}
