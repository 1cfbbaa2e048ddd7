package tech.gatekeeper.platform.authorization;

/**
 * Summary of what a principal may do with one resource type, independent of any
 * particular instance.
 *
 * @param resource  Resource type summarized
 * @param canCreate Whether any create grant exists
 * @param canRead   Whether any read grant exists
 * @param canUpdate Whether any update grant exists
 * @param canDelete Whether any delete grant exists
 * @param canManage Whether a manage grant exists
 * @param scope     ALL if any action is granted at ALL scope, OWN if only OWN grants
 *                  exist, NONE if nothing is granted
 */
public record ResourcePermissions(
    Resource resource,
    boolean canCreate,
    boolean canRead,
    boolean canUpdate,
    boolean canDelete,
    boolean canManage,
    AccessScope scope
) {

    public static ResourcePermissions none(Resource resource) {
        return new ResourcePermissions(resource, false, false, false, false, false, AccessScope.NONE);
    }

    public boolean can(Action action) {
        return switch (action) {
            case CREATE -> canCreate;
            case READ -> canRead;
            case UPDATE -> canUpdate;
            case DELETE -> canDelete;
            case MANAGE -> canManage;
        };
    }

    public boolean hasAnyAccess() {
        return scope != AccessScope.NONE;
    }

    /**
     * Aggregate reach of a principal's grants on a resource type.
     */
    public enum AccessScope {
        NONE("none"),
        OWN("own"),
        ALL("all");

        private final String code;

        AccessScope(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }

        static AccessScope of(Scope scope) {
            if (scope == null) {
                return NONE;
            }
            return scope == Scope.ALL ? ALL : OWN;
        }

        @Override
        public String toString() {
            return code;
        }
    }
}
