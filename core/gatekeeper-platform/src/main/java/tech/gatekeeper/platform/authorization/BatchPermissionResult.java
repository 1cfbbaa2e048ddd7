package tech.gatekeeper.platform.authorization;

import java.util.List;

/**
 * Outcome of checking a batch of requests against one principal.
 *
 * @param results Per-request decisions, in request order
 * @param hasAny  Whether at least one request was permitted (false for an empty batch)
 * @param hasAll  Whether every request was permitted (true for an empty batch)
 */
public record BatchPermissionResult(List<Boolean> results, boolean hasAny, boolean hasAll) {

    public BatchPermissionResult {
        results = List.copyOf(results);
    }

    public static BatchPermissionResult of(List<Boolean> results) {
        boolean any = results.stream().anyMatch(Boolean::booleanValue);
        boolean all = results.stream().allMatch(Boolean::booleanValue);
        return new BatchPermissionResult(results, any, all);
    }

    public int size() {
        return results.size();
    }

    public boolean isGranted(int index) {
        return results.get(index);
    }

    public long grantedCount() {
        return results.stream().filter(Boolean::booleanValue).count();
    }
}
