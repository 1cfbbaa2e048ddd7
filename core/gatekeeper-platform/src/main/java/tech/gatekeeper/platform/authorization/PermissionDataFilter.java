package tech.gatekeeper.platform.authorization;

import org.jboss.logging.Logger;
import tech.gatekeeper.platform.common.errors.PermissionValidationException;
import tech.gatekeeper.platform.shared.PermissionMetrics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Scope-aware queries over collections of resource instances.
 *
 * <p>Answers the questions a list view or a summary needs, where no single
 * resource instance is being checked:
 * <ul>
 *   <li>which of these records may the principal see</li>
 *   <li>what can the principal do with this resource type at all</li>
 * </ul>
 *
 * <p>Reads the {@link CapabilityMatrix} through the {@link PermissionEvaluator}; it
 * does not touch the decision cache.
 */
public class PermissionDataFilter {

    private static final Logger LOG = Logger.getLogger(PermissionDataFilter.class);

    private final PermissionEvaluator evaluator;
    private final PermissionMetrics metrics;

    public PermissionDataFilter(PermissionEvaluator evaluator, PermissionMetrics metrics) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Summarize the principal's grants on a resource type.
     *
     * @return flags per action plus the widest scope held; no access for an inactive principal
     */
    public ResourcePermissions getResourcePermissions(Principal principal, Resource resource) {
        if (resource == null) {
            throw PermissionValidationException.required("resource");
        }
        if (!isActive(principal)) {
            return ResourcePermissions.none(resource);
        }

        Scope widest = null;
        for (Action action : Action.STANDARD) {
            widest = Scope.widest(widest, scopeFor(principal, resource, action).orElse(null));
        }

        return new ResourcePermissions(
            resource,
            scopeFor(principal, resource, Action.CREATE).isPresent(),
            scopeFor(principal, resource, Action.READ).isPresent(),
            scopeFor(principal, resource, Action.UPDATE).isPresent(),
            scopeFor(principal, resource, Action.DELETE).isPresent(),
            scopeFor(principal, resource, Action.MANAGE).isPresent(),
            ResourcePermissions.AccessScope.of(widest)
        );
    }

    /**
     * String-code variant of {@link #getResourcePermissions(Principal, Resource)}.
     * An unknown resource code yields no access.
     */
    public Optional<ResourcePermissions> getResourcePermissions(Principal principal, String resource) {
        if (resource == null || resource.isBlank()) {
            throw PermissionValidationException.required("resource");
        }
        Optional<Resource> known = Resource.fromCode(resource);
        if (known.isEmpty()) {
            LOG.warnf("Unknown resource %s requested, reporting no access", resource);
            metrics.recordUnknownPermission();
        }
        return known.map(type -> getResourcePermissions(principal, type));
    }

    /**
     * Keep only the items the principal may act on.
     *
     * <ul>
     *   <li>ALL scope: every item, in input order</li>
     *   <li>OWN scope: items whose owner equals the principal ID, in input order</li>
     *   <li>No grant or inactive principal: empty</li>
     * </ul>
     *
     * @param ownerIdOf Extracts the owner ID from an item
     */
    public <T> List<T> filterDataByPermissions(
        Principal principal,
        Collection<T> items,
        Resource resource,
        Action action,
        Function<? super T, String> ownerIdOf
    ) {
        if (items == null) {
            throw PermissionValidationException.required("items");
        }
        if (resource == null || action == null) {
            throw PermissionValidationException.required(resource == null ? "resource" : "action");
        }
        if (!isActive(principal)) {
            return List.of();
        }

        Optional<Scope> scope = scopeFor(principal, resource, action);
        if (scope.isEmpty()) {
            return List.of();
        }
        if (scope.get() == Scope.ALL) {
            return Collections.unmodifiableList(new ArrayList<>(items));
        }
        return items.stream()
            .filter(item -> principal.owns(ownerIdOf.apply(item)))
            .toList();
    }

    public <T extends OwnedResource> List<T> filterDataByPermissions(
        Principal principal,
        Collection<T> items,
        Resource resource,
        Action action
    ) {
        return filterDataByPermissions(principal, items, resource, action, OwnedResource::ownerId);
    }

    /**
     * String-code variant. Unknown codes are logged and filter everything out.
     */
    public <T extends OwnedResource> List<T> filterDataByPermissions(
        Principal principal,
        Collection<T> items,
        String resource,
        String action
    ) {
        return filterDataByPermissions(principal, items, resource, action, OwnedResource::ownerId);
    }

    public <T> List<T> filterDataByPermissions(
        Principal principal,
        Collection<T> items,
        String resource,
        String action,
        Function<? super T, String> ownerIdOf
    ) {
        return parseCounted(resource, action, null)
            .map(request -> filterDataByPermissions(principal, items, request.resource(), request.action(), ownerIdOf))
            .orElse(List.of());
    }

    /**
     * Check one instance owned by {@code ownerId}. Without an owner ID this is a
     * capability-only check: OWN-scoped grants do not satisfy it.
     */
    public boolean canAccessOwnResource(Principal principal, Resource resource, Action action, String ownerId) {
        return evaluator.evaluate(principal, PermissionRequest.of(resource, action, ownerId));
    }

    public boolean canAccessOwnResource(Principal principal, String resource, String action, String ownerId) {
        return parseCounted(resource, action, ownerId)
            .map(request -> evaluator.evaluate(principal, request))
            .orElse(false);
    }

    /**
     * Resource types on which the principal holds at least one grant.
     */
    public Set<Resource> getAccessibleResources(Principal principal) {
        if (!isActive(principal)) {
            return Set.of();
        }
        return evaluator.matrix().resourcesFor(principal.role());
    }

    /**
     * Actions the principal may perform on a resource type, at any scope.
     */
    public Set<Action> getAvailableActions(Principal principal, Resource resource) {
        Set<Action> actions = EnumSet.noneOf(Action.class);
        if (!isActive(principal)) {
            return actions;
        }
        for (Action action : Action.STANDARD) {
            if (scopeFor(principal, resource, action).isPresent()) {
                actions.add(action);
            }
        }
        return actions;
    }

    private Optional<PermissionRequest> parseCounted(String resource, String action, String ownerId) {
        Optional<PermissionRequest> request = PermissionRequest.parse(resource, action, ownerId);
        if (request.isEmpty()) {
            metrics.recordUnknownPermission();
        }
        return request;
    }

    private Optional<Scope> scopeFor(Principal principal, Resource resource, Action action) {
        return evaluator.capabilityScope(principal.role(), resource, action);
    }

    private static boolean isActive(Principal principal) {
        return principal != null && principal.active();
    }
}
