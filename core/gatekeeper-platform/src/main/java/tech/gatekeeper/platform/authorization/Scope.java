package tech.gatekeeper.platform.authorization;

/**
 * How far a capability grant reaches.
 */
public enum Scope {

    /** Only instances owned by the principal. */
    OWN("own"),

    /** Every instance of the resource. */
    ALL("all");

    private final String code;

    Scope(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Pick the wider of two scopes. A null argument is treated as "no grant".
     */
    public static Scope widest(Scope a, Scope b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a == ALL || b == ALL ? ALL : OWN;
    }

    @Override
    public String toString() {
        return code;
    }
}
