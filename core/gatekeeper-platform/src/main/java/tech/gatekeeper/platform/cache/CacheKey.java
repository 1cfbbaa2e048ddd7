package tech.gatekeeper.platform.cache;

import tech.gatekeeper.platform.authorization.Action;
import tech.gatekeeper.platform.authorization.PermissionRequest;
import tech.gatekeeper.platform.authorization.Principal;
import tech.gatekeeper.platform.authorization.Resource;
import tech.gatekeeper.platform.authorization.Role;

/**
 * Key of a cached permission decision.
 *
 * <p>Carries exactly the inputs the evaluator uses, so two requests that would be
 * evaluated the same way always map to the same key. The role is part of the key,
 * which means a role change never reads a decision cached for the previous role.
 *
 * @param principalId Principal ID
 * @param role        Role at the time of the check
 * @param resource    Requested resource
 * @param action      Requested action
 * @param ownerId     Resource owner ID, or {@link PermissionRequest#ANY_OWNER} for
 *                    capability-only checks
 */
public record CacheKey(String principalId, Role role, Resource resource, Action action, String ownerId) {

    public static CacheKey of(Principal principal, PermissionRequest request) {
        return new CacheKey(
            principal.id(),
            principal.role(),
            request.resource(),
            request.action(),
            request.ownerId().orElse(PermissionRequest.ANY_OWNER)
        );
    }

    public boolean belongsTo(String userId) {
        return principalId.equals(userId);
    }

    /**
     * Whether this key was computed for the given resource: either the resource type
     * code or the owner of the instance checked.
     */
    public boolean references(String resourceId) {
        return resource.code().equals(resourceId)
            || (!PermissionRequest.ANY_OWNER.equals(ownerId) && ownerId.equals(resourceId));
    }

    @Override
    public String toString() {
        return String.format("%s:%s:%s:%s:%s", principalId, role, resource.code(), action.code(), ownerId);
    }
}
