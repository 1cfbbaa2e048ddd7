package tech.gatekeeper.platform.authorization;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Operations that can be performed on a {@link Resource}.
 *
 * <p>{@link #MANAGE} is the action wildcard: a grant for MANAGE covers every action
 * on that resource.
 */
public enum Action {

    CREATE("create"),
    READ("read"),
    UPDATE("update"),
    DELETE("delete"),
    MANAGE("manage");

    /**
     * The actions reported by a resource permission summary, in display order.
     */
    public static final List<Action> STANDARD = List.of(CREATE, READ, UPDATE, DELETE, MANAGE);

    private static final Map<String, Action> BY_CODE = Stream.of(values())
        .collect(Collectors.toUnmodifiableMap(Action::code, Function.identity()));

    private final String code;

    Action(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Whether a grant for this action also covers {@code requested}.
     */
    public boolean covers(Action requested) {
        return this == MANAGE || this == requested;
    }

    /**
     * Resolve an action from its code.
     *
     * @param code Action code (e.g., "read"), case-insensitive
     * @return the action, or empty if the code is not known
     */
    public static Optional<Action> fromCode(String code) {
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
