package tech.gatekeeper.platform.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import tech.gatekeeper.platform.audit.LoggingPermissionAuditListener;
import tech.gatekeeper.platform.audit.PermissionAuditListener;
import tech.gatekeeper.platform.authorization.BatchPermissionEvaluator;
import tech.gatekeeper.platform.authorization.CapabilityMatrix;
import tech.gatekeeper.platform.authorization.PermissionDataFilter;
import tech.gatekeeper.platform.authorization.PermissionEvaluator;
import tech.gatekeeper.platform.authorization.PermissionService;
import tech.gatekeeper.platform.authorization.events.InvalidationBroadcaster;
import tech.gatekeeper.platform.authorization.events.InvalidationTransport;
import tech.gatekeeper.platform.cache.PermissionCache;
import tech.gatekeeper.platform.shared.PermissionMetrics;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * CDI producer that wires the permission engine from configuration.
 *
 * <p>Optional collaborators are picked up when the application provides them:
 * <ul>
 *   <li>{@link MeterRegistry} - otherwise meters go to a private simple registry</li>
 *   <li>{@link InvalidationTransport} - otherwise invalidations stay in this process</li>
 *   <li>{@link PermissionAuditListener} beans - added after the logging listener</li>
 * </ul>
 */
@ApplicationScoped
public class PermissionEngineProducer {

    private static final Logger LOG = Logger.getLogger(PermissionEngineProducer.class);

    @Inject
    PermissionEngineConfig config;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    @Inject
    Instance<InvalidationTransport> transport;

    @Inject
    Instance<PermissionAuditListener> auditListeners;

    private final ExecutorService broadcastExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "permission-invalidation-broadcast");
        thread.setDaemon(true);
        return thread;
    });

    @Produces
    @Singleton
    public CapabilityMatrix capabilityMatrix() {
        return CapabilityMatrix.defaults();
    }

    @Produces
    @Singleton
    public PermissionEvaluator permissionEvaluator(CapabilityMatrix matrix) {
        return new PermissionEvaluator(matrix);
    }

    @Produces
    @Singleton
    public PermissionMetrics permissionMetrics() {
        if (meterRegistry.isResolvable()) {
            return new PermissionMetrics(meterRegistry.get());
        }
        LOG.info("No MeterRegistry available, permission metrics kept in a local registry");
        return new PermissionMetrics(new SimpleMeterRegistry());
    }

    @Produces
    @Singleton
    public PermissionCache permissionCache(PermissionMetrics metrics) {
        PermissionEngineConfig.Cache cacheConfig = config.cache();
        LOG.infof("Initializing permission cache: ttl=%s, maxSize=%d, sweepInterval=%s",
            cacheConfig.ttl(), cacheConfig.maxSize(), cacheConfig.sweepInterval());

        PermissionCache cache = new PermissionCache(cacheConfig.maxSize(), cacheConfig.ttl());
        metrics.bindCache(cache);
        return cache;
    }

    @Produces
    @Singleton
    public InvalidationBroadcaster invalidationBroadcaster(PermissionMetrics metrics) {
        InvalidationTransport selected = transport.isResolvable()
            ? transport.get()
            : InvalidationTransport.localOnly();
        String originId = config.broadcast().originId().orElse(null);

        InvalidationBroadcaster broadcaster = new InvalidationBroadcaster(originId, selected, broadcastExecutor, metrics);
        LOG.infof("Permission invalidations broadcast via %s as [%s]", selected, broadcaster.originId());
        return broadcaster;
    }

    @Produces
    @Singleton
    public PermissionService permissionService(
        PermissionEvaluator evaluator,
        PermissionCache cache,
        InvalidationBroadcaster broadcaster,
        PermissionMetrics metrics
    ) {
        return new PermissionService(evaluator, cache, broadcaster, metrics, resolveAuditListeners());
    }

    @Produces
    @Singleton
    public PermissionDataFilter permissionDataFilter(PermissionEvaluator evaluator, PermissionMetrics metrics) {
        return new PermissionDataFilter(evaluator, metrics);
    }

    @Produces
    @Singleton
    public BatchPermissionEvaluator batchPermissionEvaluator(PermissionService permissionService) {
        return new BatchPermissionEvaluator(permissionService);
    }

    void closePermissionService(@Disposes PermissionService service) {
        service.close();
    }

    void closeInvalidationBroadcaster(@Disposes InvalidationBroadcaster broadcaster) {
        broadcaster.close();
    }

    @PreDestroy
    void shutdown() {
        broadcastExecutor.shutdown();
    }

    List<PermissionAuditListener> resolveAuditListeners() {
        List<PermissionAuditListener> listeners = new ArrayList<>();
        PermissionEngineConfig.Audit audit = config.audit();
        if (audit.logDenials() || audit.logGrants()) {
            listeners.add(new LoggingPermissionAuditListener(audit.logDenials(), audit.logGrants()));
        }
        for (PermissionAuditListener listener : auditListeners) {
            listeners.add(listener);
        }
        return listeners;
    }
}
