package tech.gatekeeper.platform.shared;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import tech.gatekeeper.platform.audit.DecisionSource;
import tech.gatekeeper.platform.authorization.events.InvalidationScope;
import tech.gatekeeper.platform.cache.PermissionCache;

import java.util.Locale;
import java.util.Objects;

/**
 * Micrometer meters for the permission engine.
 *
 * Records:
 * - Permission checks (count by result and decision source, duration)
 * - Unknown resource/action codes
 * - Cache failures that forced a fallback to direct evaluation
 * - Invalidations applied (by scope, local or remote origin)
 * - Failed broadcasts to remote contexts
 */
public class PermissionMetrics {

    public static final String CHECKS = "gatekeeper.permission.checks";
    public static final String CHECK_DURATION = "gatekeeper.permission.check.duration";
    public static final String UNKNOWN = "gatekeeper.permission.unknown";
    public static final String CACHE_FAILURES = "gatekeeper.permission.cache.failures";
    public static final String INVALIDATIONS = "gatekeeper.permission.invalidations";
    public static final String BROADCAST_FAILURES = "gatekeeper.permission.broadcast.failures";

    public static final String CACHE_NAME = "permission-decisions";

    private final MeterRegistry registry;

    public PermissionMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public Timer.Sample startCheck() {
        return Timer.start(registry);
    }

    public void recordCheck(Timer.Sample sample, boolean granted, DecisionSource source) {
        String result = granted ? "granted" : "denied";
        sample.stop(Timer.builder(CHECK_DURATION)
            .tag("source", source.tagValue())
            .register(registry));

        registry.counter(CHECKS,
            "result", result,
            "source", source.tagValue()
        ).increment();
    }

    public void recordUnknownPermission() {
        registry.counter(UNKNOWN).increment();
    }

    public void recordCacheFailure(String operation) {
        registry.counter(CACHE_FAILURES, "operation", operation).increment();
    }

    public void recordInvalidation(InvalidationScope scope, boolean remote) {
        registry.counter(INVALIDATIONS,
            "scope", scope.name().toLowerCase(Locale.ROOT),
            "origin", remote ? "remote" : "local"
        ).increment();
    }

    public void recordBroadcastFailure() {
        registry.counter(BROADCAST_FAILURES).increment();
    }

    /**
     * Expose the decision cache's size, hit, miss and eviction meters.
     */
    public void bindCache(PermissionCache cache) {
        cache.bindTo(registry, CACHE_NAME);
    }

    public MeterRegistry registry() {
        return registry;
    }
}
