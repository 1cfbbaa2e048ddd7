package tech.gatekeeper.platform.authorization;

import tech.gatekeeper.platform.common.errors.PermissionValidationException;

/**
 * The authenticated actor a permission is checked for.
 *
 * <p>Supplied by the caller on every call; the engine never stores principal state.
 *
 * @param id     Principal ID
 * @param role   Role currently assigned to the principal
 * @param active Whether the account is active. Inactive principals are denied everything.
 */
public record Principal(String id, Role role, boolean active) {

    public Principal {
        if (id == null || id.isBlank()) {
            throw PermissionValidationException.required("principal.id");
        }
        if (role == null) {
            throw PermissionValidationException.required("principal.role");
        }
    }

    public static Principal active(String id, Role role) {
        return new Principal(id, role, true);
    }

    public static Principal inactive(String id, Role role) {
        return new Principal(id, role, false);
    }

    /**
     * @return true if {@code ownerId} identifies this principal
     */
    public boolean owns(String ownerId) {
        return id.equals(ownerId);
    }
}
