package tech.gatekeeper.platform.authorization;

import java.util.Arrays;
import java.util.Optional;

/**
 * Roles a principal can hold.
 *
 * <p>Roles are ordered by rank: ADMIN &gt; EDITOR &gt; VIEWER. Rank is only used for
 * minimum-role checks. It never grants permissions on its own; every capability a
 * role holds is listed explicitly in the {@link CapabilityMatrix}.
 */
public enum Role {

    ADMIN(3, "Administrator", "Full system access including user management and system settings"),
    EDITOR(2, "Editor", "Can create, edit, and manage content including products, pages, and media"),
    VIEWER(1, "Viewer", "Read-only access to content and basic profile management");

    private final int rank;
    private final String displayName;
    private final String description;

    Role(int rank, String displayName, String description) {
        this.rank = rank;
        this.displayName = displayName;
        this.description = description;
    }

    public int rank() {
        return rank;
    }

    public String displayName() {
        return displayName;
    }

    public String description() {
        return description;
    }

    /**
     * @return true if this role ranks strictly above {@code other}
     */
    public boolean isHigherThan(Role other) {
        return other != null && rank > other.rank;
    }

    /**
     * @return true if this role ranks equal to or above {@code minimum}
     */
    public boolean isAtLeast(Role minimum) {
        return minimum != null && rank >= minimum.rank;
    }

    /**
     * Resolve a role from its name, case-insensitively.
     *
     * @param name Role name (e.g., "editor")
     * @return the role, or empty if the name is blank or unknown
     */
    public static Optional<Role> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim();
        return Arrays.stream(values())
            .filter(r -> r.name().equalsIgnoreCase(normalized))
            .findFirst();
    }
}
