package tech.gatekeeper.platform.authorization;

import org.jboss.logging.Logger;
import tech.gatekeeper.platform.common.errors.PermissionValidationException;
import tech.gatekeeper.platform.common.errors.PermissionValidationException.ValidationError;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A request to perform an action on a resource.
 *
 * <p>{@code resourceOwnerId} is supplied when checking access to one concrete
 * resource instance. It is null for capability-only checks ("can this role ever
 * create products").
 *
 * <p>String form: {@code {resource}:{action}}, e.g. {@code products:read}.
 *
 * @param resource        Resource type
 * @param action          Requested action
 * @param resourceOwnerId Owner of the resource instance, or null
 */
public record PermissionRequest(Resource resource, Action action, String resourceOwnerId) {

    private static final Logger LOG = Logger.getLogger(PermissionRequest.class);

    /**
     * Owner placeholder used when a request carries no ownership fact. Reserved, so
     * it cannot be used as a real owner ID.
     */
    public static final String ANY_OWNER = "*";

    public PermissionRequest {
        List<ValidationError> errors = new ArrayList<>();
        if (resource == null) {
            errors.add(new ValidationError("resource", "resource is required", PermissionValidationException.REQUIRED));
        }
        if (action == null) {
            errors.add(new ValidationError("action", "action is required", PermissionValidationException.REQUIRED));
        }
        if (resourceOwnerId != null && (resourceOwnerId.isBlank() || ANY_OWNER.equals(resourceOwnerId))) {
            errors.add(new ValidationError("resourceOwnerId",
                "resourceOwnerId must be a non-blank owner ID when present", PermissionValidationException.INVALID));
        }
        if (!errors.isEmpty()) {
            throw new PermissionValidationException("Malformed permission request", errors);
        }
    }

    public static PermissionRequest of(Resource resource, Action action) {
        return new PermissionRequest(resource, action, null);
    }

    public static PermissionRequest of(Resource resource, Action action, String resourceOwnerId) {
        return new PermissionRequest(resource, action, resourceOwnerId);
    }

    public Optional<String> ownerId() {
        return Optional.ofNullable(resourceOwnerId);
    }

    public boolean isCapabilityOnly() {
        return resourceOwnerId == null;
    }

    /**
     * @return Permission string (e.g., "products:read")
     */
    public String toPermissionString() {
        return resource.code() + ":" + action.code();
    }

    /**
     * Build a request from string codes, as received from collaborators.
     *
     * <p>Missing codes are a caller bug and raise a validation error. Codes that are
     * present but not known to the engine are a configuration problem: a warning is
     * logged and the result is empty, which callers treat as a denial.
     *
     * @param resource        Resource code (e.g., "products")
     * @param action          Action code (e.g., "read")
     * @param resourceOwnerId Owner ID, or null for a capability-only check
     * @return the request, or empty if the resource or action is unknown
     * @throws PermissionValidationException if a code is missing or the owner ID is malformed
     */
    public static Optional<PermissionRequest> parse(String resource, String action, String resourceOwnerId) {
        List<ValidationError> errors = new ArrayList<>();
        if (resource == null || resource.isBlank()) {
            errors.add(new ValidationError("resource", "resource is required", PermissionValidationException.REQUIRED));
        }
        if (action == null || action.isBlank()) {
            errors.add(new ValidationError("action", "action is required", PermissionValidationException.REQUIRED));
        }
        if (!errors.isEmpty()) {
            throw new PermissionValidationException("Malformed permission request", errors);
        }

        Optional<Resource> knownResource = Resource.fromCode(resource);
        Optional<Action> knownAction = Action.fromCode(action);
        if (knownResource.isEmpty() || knownAction.isEmpty()) {
            LOG.warnf("Unknown permission %s:%s requested, denying", resource, action);
            return Optional.empty();
        }
        return Optional.of(new PermissionRequest(knownResource.get(), knownAction.get(), resourceOwnerId));
    }

    /**
     * Parse a permission string into a capability-only request.
     * Format: resource:action
     *
     * @throws PermissionValidationException if the string is not in resource:action form
     */
    public static Optional<PermissionRequest> fromPermissionString(String permissionString) {
        if (permissionString == null || permissionString.isBlank()) {
            throw PermissionValidationException.required("permission");
        }
        String[] parts = permissionString.split(":");
        if (parts.length != 2) {
            throw PermissionValidationException.invalid("permission",
                "Invalid permission string format: " + permissionString);
        }
        return parse(parts[0], parts[1], null);
    }
}
