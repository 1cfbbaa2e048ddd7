package tech.gatekeeper.platform.authorization;

import java.util.Objects;
import java.util.Optional;

/**
 * Uncached permission decisions against the {@link CapabilityMatrix}.
 *
 * <p>Pure and side-effect free: it never touches a cache, so it is safe to call from
 * any thread.
 *
 * <p>Decision rules:
 * <ol>
 *   <li>Inactive principal: deny.</li>
 *   <li>No grant for {@code (role, resource, action)}: deny (fail-closed).</li>
 *   <li>ALL-scoped grant: allow.</li>
 *   <li>Only OWN-scoped grant: allow iff the request carries an owner ID equal to the
 *       principal ID. A capability-only request (no owner) is denied here; use
 *       {@link PermissionDataFilter#getResourcePermissions} to ask whether the role
 *       can act on its own instances.</li>
 * </ol>
 */
public class PermissionEvaluator {

    private final CapabilityMatrix matrix;

    public PermissionEvaluator(CapabilityMatrix matrix) {
        this.matrix = Objects.requireNonNull(matrix, "matrix");
    }

    /**
     * Decide whether a principal may perform the requested action.
     *
     * @param principal The principal
     * @param request   The permission request
     * @return true if access is permitted
     */
    public boolean evaluate(Principal principal, PermissionRequest request) {
        if (principal == null || !principal.active()) {
            return false;
        }

        Optional<Scope> scope = matrix.scopeFor(principal.role(), request.resource(), request.action());
        if (scope.isEmpty()) {
            return false;
        }

        return switch (scope.get()) {
            case ALL -> true;
            case OWN -> !request.isCapabilityOnly() && principal.owns(request.resourceOwnerId());
        };
    }

    /**
     * Raw matrix lookup, ignoring ownership and principal state.
     *
     * @return the widest granted scope, or empty if the role holds no matching grant
     */
    public Optional<Scope> capabilityScope(Role role, Resource resource, Action action) {
        return matrix.scopeFor(role, resource, action);
    }

    /**
     * Check that an active principal's role ranks at or above {@code minimumRole}.
     */
    public boolean hasMinimumRole(Principal principal, Role minimumRole) {
        return principal != null && principal.active() && principal.role().isAtLeast(minimumRole);
    }

    public CapabilityMatrix matrix() {
        return matrix;
    }
}
