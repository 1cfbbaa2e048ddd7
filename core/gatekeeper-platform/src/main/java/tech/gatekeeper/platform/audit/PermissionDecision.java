package tech.gatekeeper.platform.audit;

import lombok.Builder;
import tech.gatekeeper.platform.authorization.Action;
import tech.gatekeeper.platform.authorization.Resource;
import tech.gatekeeper.platform.authorization.Role;

import java.time.Instant;

/**
 * Audit record of a single permission decision.
 *
 * <p>Emitted for every check answered by the permission service, whether it was
 * served from the cache or computed.
 */
@Builder
public record PermissionDecision(
    String principalId,
    Role role,
    Resource resource,
    Action action,
    String resourceOwnerId,
    boolean granted,
    DecisionSource source,
    Instant time
) {

    public String permissionString() {
        return resource.code() + ":" + action.code();
    }

    public String describe() {
        String target = resourceOwnerId != null
            ? permissionString() + " (owner " + resourceOwnerId + ")"
            : permissionString();
        return String.format("%s %s [%s] %s via %s",
            granted ? "GRANTED" : "DENIED", principalId, role, target, source);
    }
}
