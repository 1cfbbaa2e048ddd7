package tech.gatekeeper.platform.cache;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Periodically drops expired permission decisions.
 *
 * <p>Expired decisions are never served, so this only reclaims memory held by
 * entries nobody has looked up since they expired.
 */
@ApplicationScoped
public class PermissionCacheSweeper {

    private static final Logger LOG = Logger.getLogger(PermissionCacheSweeper.class);

    @Inject
    PermissionCache cache;

    @Scheduled(every = "${gatekeeper.permissions.cache.sweep-interval:1h}")
    void sweep() {
        try {
            long removed = cache.sweepExpired();
            LOG.debugf("Permission cache sweep removed %d expired decisions (%d remaining)", removed, cache.size());
        } catch (Exception e) {
            LOG.errorf(e, "Error sweeping permission cache");
        }
    }
}
