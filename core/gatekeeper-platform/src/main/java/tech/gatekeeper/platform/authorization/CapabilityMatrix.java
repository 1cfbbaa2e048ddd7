package tech.gatekeeper.platform.authorization;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping of role to the capability grants it holds.
 *
 * <p>Built once at startup and never mutated. The matrix is total: every
 * {@code (role, resource, action)} either matches a grant or is denied. Roles with
 * no entry hold no grants.
 *
 * <p>Lookups only see grants that are listed explicitly. A higher-ranked role does
 * not inherit the grants of lower ones.
 */
public final class CapabilityMatrix {

    private final Map<Role, Set<CapabilityGrant>> grants;

    private CapabilityMatrix(Map<Role, Set<CapabilityGrant>> grants) {
        EnumMap<Role, Set<CapabilityGrant>> copy = new EnumMap<>(Role.class);
        for (Role role : Role.values()) {
            Set<CapabilityGrant> roleGrants = grants.getOrDefault(role, Set.of());
            copy.put(role, Collections.unmodifiableSet(new LinkedHashSet<>(roleGrants)));
        }
        this.grants = Collections.unmodifiableMap(copy);
    }

    /**
     * The default role configuration.
     *
     * <ul>
     *   <li>ADMIN - manage every resource</li>
     *   <li>EDITOR - manage content (products, categories, pages, media), read orders,
     *       manage own profile</li>
     *   <li>VIEWER - read content and orders, manage own profile</li>
     * </ul>
     */
    public static CapabilityMatrix defaults() {
        return builder()
            .grantEverything(Role.ADMIN, Scope.ALL)

            .grant(Role.EDITOR, Resource.PRODUCTS, Action.MANAGE, Scope.ALL)
            .grant(Role.EDITOR, Resource.CATEGORIES, Action.MANAGE, Scope.ALL)
            .grant(Role.EDITOR, Resource.PAGES, Action.MANAGE, Scope.ALL)
            .grant(Role.EDITOR, Resource.MEDIA, Action.MANAGE, Scope.ALL)
            .grant(Role.EDITOR, Resource.ORDERS, Action.READ, Scope.ALL)
            .grant(Role.EDITOR, Resource.PROFILE, Action.MANAGE, Scope.OWN)

            .grant(Role.VIEWER, Resource.PRODUCTS, Action.READ, Scope.ALL)
            .grant(Role.VIEWER, Resource.CATEGORIES, Action.READ, Scope.ALL)
            .grant(Role.VIEWER, Resource.PAGES, Action.READ, Scope.ALL)
            .grant(Role.VIEWER, Resource.MEDIA, Action.READ, Scope.ALL)
            .grant(Role.VIEWER, Resource.ORDERS, Action.READ, Scope.ALL)
            .grant(Role.VIEWER, Resource.PROFILE, Action.MANAGE, Scope.OWN)
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get all grants held by a role.
     *
     * @return Unmodifiable set of grants, empty if the role holds none
     */
    public Set<CapabilityGrant> grantsFor(Role role) {
        return role != null ? grants.get(role) : Set.of();
    }

    /**
     * Find the widest scope at which {@code role} may perform {@code action} on
     * {@code resource}. ALL wins over OWN when both match.
     *
     * @return the scope, or empty if no grant matches (implicit denial)
     */
    public Optional<Scope> scopeFor(Role role, Resource resource, Action action) {
        Scope widest = null;
        for (CapabilityGrant grant : grantsFor(role)) {
            if (grant.matches(resource, action)) {
                widest = Scope.widest(widest, grant.scope());
                if (widest == Scope.ALL) {
                    break;
                }
            }
        }
        return Optional.ofNullable(widest);
    }

    /**
     * Resources on which a role holds at least one grant, in enum order.
     */
    public Set<Resource> resourcesFor(Role role) {
        Set<Resource> resources = new LinkedHashSet<>();
        for (Resource resource : Resource.values()) {
            for (CapabilityGrant grant : grantsFor(role)) {
                if (grant.resource() == resource) {
                    resources.add(resource);
                    break;
                }
            }
        }
        return resources;
    }

    public static final class Builder {

        private final Map<Role, Set<CapabilityGrant>> grants = new EnumMap<>(Role.class);

        private Builder() {
        }

        public Builder grant(Role role, Resource resource, Action action, Scope scope) {
            return grant(role, CapabilityGrant.of(resource, action, scope));
        }

        public Builder grant(Role role, CapabilityGrant grant) {
            if (role == null) {
                throw new IllegalArgumentException("role is required");
            }
            grants.computeIfAbsent(role, r -> new LinkedHashSet<>()).add(grant);
            return this;
        }

        /**
         * Grant MANAGE on every resource at the given scope.
         */
        public Builder grantEverything(Role role, Scope scope) {
            for (Resource resource : Resource.values()) {
                grant(role, resource, Action.MANAGE, scope);
            }
            return this;
        }

        public CapabilityMatrix build() {
            return new CapabilityMatrix(grants);
        }
    }
}
