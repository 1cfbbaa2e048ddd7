package tech.gatekeeper.platform.audit;

import org.jboss.logging.Logger;

/**
 * Writes permission decisions to the application log.
 *
 * <p>Denials at INFO, grants at DEBUG. Either can be switched off through
 * {@code gatekeeper.permissions.audit.*}.
 */
public class LoggingPermissionAuditListener implements PermissionAuditListener {

    private static final Logger LOG = Logger.getLogger(LoggingPermissionAuditListener.class);

    private final boolean logDenials;
    private final boolean logGrants;

    public LoggingPermissionAuditListener(boolean logDenials, boolean logGrants) {
        this.logDenials = logDenials;
        this.logGrants = logGrants;
    }

    @Override
    public void onDecision(PermissionDecision decision) {
        if (decision.granted()) {
            if (logGrants) {
                LOG.debugf("Permission %s", decision.describe());
            }
        } else if (logDenials) {
            LOG.infof("Permission %s", decision.describe());
        }
    }

    public boolean logsDenials() {
        return logDenials;
    }

    public boolean logsGrants() {
        return logGrants;
    }
}
