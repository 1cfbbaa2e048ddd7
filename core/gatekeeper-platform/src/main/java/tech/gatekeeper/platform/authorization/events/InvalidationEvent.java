package tech.gatekeeper.platform.authorization.events;

import tech.gatekeeper.platform.cache.CacheKey;
import tech.gatekeeper.platform.common.errors.PermissionValidationException;

import java.time.Instant;
import java.util.Optional;

/**
 * Sealed hierarchy of cache invalidation events.
 *
 * <ul>
 *   <li>{@link Everything} - clear every cached decision</li>
 *   <li>{@link ForUser} - clear decisions cached for one principal</li>
 *   <li>{@link ForResource} - clear decisions that reference a resource type or owner</li>
 * </ul>
 *
 * <p>Converted to and from {@link InvalidationMessage} at the transport boundary.
 */
public sealed interface InvalidationEvent
    permits InvalidationEvent.Everything, InvalidationEvent.ForUser, InvalidationEvent.ForResource {

    Instant issuedAt();

    InvalidationScope scope();

    /**
     * @return the user or resource ID targeted, empty for {@link Everything}
     */
    Optional<String> targetId();

    /**
     * Whether a cached decision under {@code key} is stale after this event.
     */
    boolean appliesTo(CacheKey key);

    static Everything everything() {
        return new Everything(Instant.now());
    }

    static ForUser forUser(String userId) {
        return new ForUser(userId, Instant.now());
    }

    static ForResource forResource(String resourceId) {
        return new ForResource(resourceId, Instant.now());
    }

    record Everything(Instant issuedAt) implements InvalidationEvent {

        @Override
        public InvalidationScope scope() {
            return InvalidationScope.ALL;
        }

        @Override
        public Optional<String> targetId() {
            return Optional.empty();
        }

        @Override
        public boolean appliesTo(CacheKey key) {
            return true;
        }
    }

    record ForUser(String userId, Instant issuedAt) implements InvalidationEvent {

        public ForUser {
            if (userId == null || userId.isBlank()) {
                throw PermissionValidationException.required("userId");
            }
        }

        @Override
        public InvalidationScope scope() {
            return InvalidationScope.USER;
        }

        @Override
        public Optional<String> targetId() {
            return Optional.of(userId);
        }

        @Override
        public boolean appliesTo(CacheKey key) {
            return key.belongsTo(userId);
        }
    }

    record ForResource(String resourceId, Instant issuedAt) implements InvalidationEvent {

        public ForResource {
            if (resourceId == null || resourceId.isBlank()) {
                throw PermissionValidationException.required("resourceId");
            }
        }

        @Override
        public InvalidationScope scope() {
            return InvalidationScope.RESOURCE;
        }

        @Override
        public Optional<String> targetId() {
            return Optional.of(resourceId);
        }

        @Override
        public boolean appliesTo(CacheKey key) {
            return key.references(resourceId);
        }
    }
}
