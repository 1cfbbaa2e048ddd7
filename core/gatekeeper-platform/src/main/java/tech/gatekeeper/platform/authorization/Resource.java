package tech.gatekeeper.platform.authorization;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Resource types the engine can authorize access to.
 *
 * <p>Each resource has a lowercase code used in permission strings
 * ({@code products:read}) and on the wire.
 */
public enum Resource {

    PRODUCTS("products"),
    CATEGORIES("categories"),
    PAGES("pages"),
    MEDIA("media"),
    USERS("users"),
    ORDERS("orders"),
    PROFILE("profile"),
    SETTINGS("settings"),
    SECURITY("security"),
    AUDIT("audit"),
    MONITORING("monitoring"),
    ANALYTICS("analytics");

    private static final Map<String, Resource> BY_CODE = Stream.of(values())
        .collect(Collectors.toUnmodifiableMap(Resource::code, Function.identity()));

    private final String code;

    Resource(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Resolve a resource from its code.
     *
     * @param code Resource code (e.g., "products"), case-insensitive
     * @return the resource, or empty if the code is not known
     */
    public static Optional<Resource> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_CODE.get(code.trim().toLowerCase(Locale.ROOT)));
    }

    @Override
    public String toString() {
        return code;
    }
}
