package tech.gatekeeper.platform.authorization;

import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks a list of requests against one principal in a single call.
 *
 * <p>Every item goes through {@link PermissionService#checkPermission}, so a batch
 * answers exactly what the same checks made one by one would, and shares their
 * cache entries.
 */
public class BatchPermissionEvaluator {

    private static final Logger LOG = Logger.getLogger(BatchPermissionEvaluator.class);

    private final PermissionService permissionService;

    public BatchPermissionEvaluator(PermissionService permissionService) {
        this.permissionService = Objects.requireNonNull(permissionService, "permissionService");
    }

    public BatchPermissionResult evaluate(Principal principal, List<PermissionRequest> requests) {
        List<Boolean> results = permissionService.checkMultiplePermissions(principal, requests);
        BatchPermissionResult result = BatchPermissionResult.of(results);
        LOG.debugf("Batch of %d permission checks: %d granted", result.size(), result.grantedCount());
        return result;
    }

    /**
     * Evaluate permission strings in {@code resource:action} form. Unknown resources or
     * actions are denied in place; the remaining items are still evaluated.
     */
    public BatchPermissionResult evaluatePermissionStrings(Principal principal, List<String> permissions) {
        List<Boolean> results = new ArrayList<>(permissions.size());
        for (String permission : permissions) {
            results.add(permissionService.checkPermissionString(principal, permission));
        }
        return BatchPermissionResult.of(results);
    }
}
