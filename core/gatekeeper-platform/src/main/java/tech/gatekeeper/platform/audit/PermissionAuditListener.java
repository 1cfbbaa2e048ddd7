package tech.gatekeeper.platform.audit;

/**
 * Receives every permission decision. Implementations must not block; an
 * exception thrown here is logged and does not change the decision.
 */
@FunctionalInterface
public interface PermissionAuditListener {

    void onDecision(PermissionDecision decision);
}
