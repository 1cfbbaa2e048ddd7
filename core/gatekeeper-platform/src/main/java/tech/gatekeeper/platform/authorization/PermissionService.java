package tech.gatekeeper.platform.authorization;

import io.micrometer.core.instrument.Timer;
import org.jboss.logging.Logger;
import tech.gatekeeper.platform.audit.DecisionSource;
import tech.gatekeeper.platform.audit.PermissionAuditListener;
import tech.gatekeeper.platform.audit.PermissionDecision;
import tech.gatekeeper.platform.authorization.events.InvalidationBroadcaster;
import tech.gatekeeper.platform.authorization.events.InvalidationEvent;
import tech.gatekeeper.platform.authorization.events.InvalidationListener;
import tech.gatekeeper.platform.authorization.events.Subscription;
import tech.gatekeeper.platform.cache.CacheKey;
import tech.gatekeeper.platform.cache.PermissionCache;
import tech.gatekeeper.platform.cache.PermissionCacheStats;
import tech.gatekeeper.platform.common.errors.PermissionValidationException;
import tech.gatekeeper.platform.shared.PermissionMetrics;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Cached permission checks.
 *
 * <p>Answers "may this principal do this" by consulting the decision cache first and
 * falling back to the {@link PermissionEvaluator} on a miss. The decision is the same
 * with or without the cache; the cache only saves the lookup.
 *
 * <p>Cache maintenance:
 * <ul>
 *   <li>Invalidations issued here are applied to this service's cache before the
 *       method returns, then published through the {@link InvalidationBroadcaster}
 *       to other services and execution contexts.</li>
 *   <li>Invalidations published elsewhere arrive through {@link #onInvalidation}.</li>
 * </ul>
 *
 * <p>If the cache fails, the decision is computed directly and the failure is logged
 * and counted. A denial is always a {@code false} return, never an exception.
 *
 * <p>Thread-safe.
 */
public class PermissionService implements InvalidationListener, AutoCloseable {

    private static final Logger LOG = Logger.getLogger(PermissionService.class);

    private final PermissionEvaluator evaluator;
    private final PermissionCache cache;
    private final InvalidationBroadcaster broadcaster;
    private final PermissionMetrics metrics;
    private final List<PermissionAuditListener> auditListeners;
    private final Subscription subscription;
    private volatile boolean active = true;

    public PermissionService(
        PermissionEvaluator evaluator,
        PermissionCache cache,
        InvalidationBroadcaster broadcaster,
        PermissionMetrics metrics
    ) {
        this(evaluator, cache, broadcaster, metrics, List.of());
    }

    public PermissionService(
        PermissionEvaluator evaluator,
        PermissionCache cache,
        InvalidationBroadcaster broadcaster,
        PermissionMetrics metrics,
        List<PermissionAuditListener> auditListeners
    ) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.auditListeners = List.copyOf(auditListeners);
        this.subscription = broadcaster.subscribe(this);
    }

    // ========================================================================
    // Permission checks
    // ========================================================================

    /**
     * Check if a principal may perform the requested action.
     *
     * @param principal The principal; null or inactive principals are denied
     * @param request   The permission request
     * @return true if access is permitted
     * @throws PermissionValidationException if the request is missing
     */
    public boolean checkPermission(Principal principal, PermissionRequest request) {
        if (request == null) {
            throw PermissionValidationException.required("request");
        }
        Timer.Sample sample = metrics.startCheck();

        // The cache key has no active flag, so inactive principals never reach the cache
        if (principal == null || !principal.active()) {
            return complete(sample, principal, request, false, DecisionSource.EVALUATOR);
        }

        CacheKey key = CacheKey.of(principal, request);
        Optional<Boolean> cached;
        try {
            cached = cache.get(key);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Permission cache read failed for %s, evaluating directly", key);
            metrics.recordCacheFailure("get");
            return complete(sample, principal, request, evaluator.evaluate(principal, request), DecisionSource.FALLBACK);
        }

        if (cached.isPresent()) {
            LOG.debugf("Permission cache hit for %s", key);
            return complete(sample, principal, request, cached.get(), DecisionSource.CACHE);
        }

        LOG.debugf("Permission cache miss for %s", key);
        boolean decision = evaluator.evaluate(principal, request);
        try {
            cache.put(key, decision);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Permission cache write failed for %s", key);
            metrics.recordCacheFailure("put");
            return complete(sample, principal, request, decision, DecisionSource.FALLBACK);
        }
        return complete(sample, principal, request, decision, DecisionSource.EVALUATOR);
    }

    /**
     * Capability-level check (no resource instance).
     */
    public boolean checkPermission(Principal principal, Resource resource, Action action) {
        return checkPermission(principal, PermissionRequest.of(resource, action));
    }

    /**
     * Instance-level check against a resource owned by {@code resourceOwnerId}.
     */
    public boolean checkPermission(Principal principal, Resource resource, Action action, String resourceOwnerId) {
        return checkPermission(principal, PermissionRequest.of(resource, action, resourceOwnerId));
    }

    /**
     * Check using string codes, as received from collaborators.
     *
     * @param principal The principal
     * @param resource  Resource code (e.g., "products")
     * @param action    Action code (e.g., "read")
     * @return true if access is permitted; false for unknown codes
     * @throws PermissionValidationException if a code is missing
     */
    public boolean checkPermission(Principal principal, String resource, String action) {
        return checkPermission(principal, resource, action, null);
    }

    /**
     * Check using string codes against a resource owned by {@code resourceOwnerId}.
     *
     * @param resourceOwnerId Owner ID, or null for a capability-only check
     * @return true if access is permitted; false for unknown codes
     * @throws PermissionValidationException if a code is missing or the owner ID is malformed
     */
    public boolean checkPermission(Principal principal, String resource, String action, String resourceOwnerId) {
        Optional<PermissionRequest> request = PermissionRequest.parse(resource, action, resourceOwnerId);
        if (request.isEmpty()) {
            metrics.recordUnknownPermission();
            return false;
        }
        return checkPermission(principal, request.get());
    }

    /**
     * Check a capability given as a {@code resource:action} string.
     *
     * @return true if access is permitted; false for unknown codes
     * @throws PermissionValidationException if the string is blank or not in {@code resource:action} form
     */
    public boolean checkPermissionString(Principal principal, String permission) {
        Optional<PermissionRequest> request = PermissionRequest.fromPermissionString(permission);
        if (request.isEmpty()) {
            metrics.recordUnknownPermission();
            return false;
        }
        return checkPermission(principal, request.get());
    }

    /**
     * Check several requests. Results are in request order.
     */
    public List<Boolean> checkMultiplePermissions(Principal principal, List<PermissionRequest> requests) {
        return requests.stream()
            .map(request -> checkPermission(principal, request))
            .toList();
    }

    /**
     * @return true if at least one request is permitted; false for an empty list
     */
    public boolean hasAnyPermission(Principal principal, List<PermissionRequest> requests) {
        return requests.stream().anyMatch(request -> checkPermission(principal, request));
    }

    /**
     * @return true if every request is permitted; true for an empty list
     */
    public boolean hasAllPermissions(Principal principal, List<PermissionRequest> requests) {
        return requests.stream().allMatch(request -> checkPermission(principal, request));
    }

    // ========================================================================
    // Invalidation
    // ========================================================================

    /**
     * Clear every cached decision, here and in every subscribed context.
     */
    public void invalidateCache() {
        applyAndPublish(InvalidationEvent.everything());
    }

    /**
     * Clear decisions cached for one principal, e.g. after a role change.
     *
     * @throws PermissionValidationException if the user ID is blank
     */
    public void invalidateUserCache(String userId) {
        applyAndPublish(InvalidationEvent.forUser(userId));
    }

    /**
     * Clear decisions that reference a resource type code or resource owner.
     *
     * @throws PermissionValidationException if the resource ID is blank
     */
    public void invalidateResourceCache(String resourceId) {
        applyAndPublish(InvalidationEvent.forResource(resourceId));
    }

    /**
     * Be notified of every invalidation that reaches this context.
     */
    public Subscription subscribeToUpdates(InvalidationListener listener) {
        return broadcaster.subscribe(listener);
    }

    @Override
    public void onInvalidation(InvalidationEvent event) {
        apply(event);
    }

    @Override
    public boolean isActive() {
        return active;
    }

    // ========================================================================
    // Cache management
    // ========================================================================

    /**
     * Pre-compute every capability-level decision for the given principals.
     * Inactive principals are skipped.
     *
     * @return number of decisions cached
     */
    public int warmCache(Collection<Principal> principals) {
        int warmed = 0;
        for (Principal principal : principals) {
            if (!principal.active()) {
                continue;
            }
            for (Resource resource : Resource.values()) {
                for (Action action : Action.values()) {
                    PermissionRequest request = PermissionRequest.of(resource, action);
                    try {
                        cache.put(CacheKey.of(principal, request), evaluator.evaluate(principal, request));
                        warmed++;
                    } catch (RuntimeException e) {
                        LOG.warnf(e, "Failed to warm permission cache for %s", principal.id());
                        metrics.recordCacheFailure("warm");
                        return warmed;
                    }
                }
            }
        }
        LOG.infof("Warmed permission cache with %d decisions for %d principals", warmed, principals.size());
        return warmed;
    }

    public PermissionCacheStats getCacheStats() {
        return cache.stats();
    }

    public PermissionEvaluator evaluator() {
        return evaluator;
    }

    /**
     * Stop receiving invalidations. Checks keep working against the local cache.
     */
    @Override
    public void close() {
        active = false;
        subscription.unsubscribe();
    }

    private void applyAndPublish(InvalidationEvent event) {
        apply(event);
        broadcaster.publish(event, this);
    }

    private void apply(InvalidationEvent event) {
        try {
            int removed = cache.invalidate(event);
            LOG.debugf("Applied %s invalidation, %d decisions removed", event.scope(), removed);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to apply %s to permission cache", event);
            metrics.recordCacheFailure("invalidate");
        }
    }

    private boolean complete(
        Timer.Sample sample,
        Principal principal,
        PermissionRequest request,
        boolean granted,
        DecisionSource source
    ) {
        metrics.recordCheck(sample, granted, source);
        if (!auditListeners.isEmpty()) {
            audit(PermissionDecision.builder()
                .principalId(principal != null ? principal.id() : null)
                .role(principal != null ? principal.role() : null)
                .resource(request.resource())
                .action(request.action())
                .resourceOwnerId(request.resourceOwnerId())
                .granted(granted)
                .source(source)
                .time(Instant.now())
                .build());
        }
        return granted;
    }

    private void audit(PermissionDecision decision) {
        for (PermissionAuditListener listener : auditListeners) {
            try {
                listener.onDecision(decision);
            } catch (RuntimeException e) {
                LOG.warnf(e, "Permission audit listener %s failed", listener);
            }
        }
    }
}
