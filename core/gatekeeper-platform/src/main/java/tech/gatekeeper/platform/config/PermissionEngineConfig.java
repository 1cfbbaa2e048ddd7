package tech.gatekeeper.platform.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration for the permission engine.
 */
@ConfigMapping(prefix = "gatekeeper.permissions")
public interface PermissionEngineConfig {

    /**
     * Decision cache settings.
     */
    Cache cache();

    /**
     * Invalidation broadcast settings.
     */
    Broadcast broadcast();

    /**
     * Decision audit logging.
     */
    Audit audit();

    interface Cache {
        /**
         * Time-to-live of a cached decision.
         */
        @WithDefault("5m")
        Duration ttl();

        /**
         * Maximum number of cached decisions.
         */
        @WithDefault("10000")
        long maxSize();

        /**
         * How often expired decisions are swept out.
         */
        @WithDefault("1h")
        Duration sweepInterval();
    }

    interface Broadcast {
        /**
         * Identifier of this execution context on the invalidation transport.
         * A random ID is generated when unset.
         */
        Optional<String> originId();
    }

    interface Audit {
        @WithDefault("true")
        boolean logDenials();

        @WithDefault("false")
        boolean logGrants();
    }
}
