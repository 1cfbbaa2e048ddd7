package tech.gatekeeper.platform.authorization;

import java.util.Objects;

/**
 * A single capability held by a role: an action on a resource, at a scope.
 *
 * @param resource Resource the grant applies to
 * @param action   Granted action; {@link Action#MANAGE} covers every action
 * @param scope    Whether the grant reaches every instance or only owned ones
 */
public record CapabilityGrant(Resource resource, Action action, Scope scope) {

    public CapabilityGrant {
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(scope, "scope");
    }

    public static CapabilityGrant of(Resource resource, Action action, Scope scope) {
        return new CapabilityGrant(resource, action, scope);
    }

    public boolean matches(Resource requestedResource, Action requestedAction) {
        return resource == requestedResource && action.covers(requestedAction);
    }

    /**
     * @return Grant string (e.g., "products:read:all")
     */
    public String toGrantString() {
        return resource.code() + ":" + action.code() + ":" + scope.code();
    }
}
