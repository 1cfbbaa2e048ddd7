package tech.gatekeeper.platform.common.errors;

import java.util.Map;

/**
 * Base exception for authorization engine errors.
 *
 * <p>A denied permission is never reported through an exception. These are
 * raised for caller bugs (malformed input) and wire-format problems.
 */
public class PermissionEngineException extends RuntimeException {

    private final Map<String, Object> context;

    public PermissionEngineException(String message) {
        this(message, null, Map.of());
    }

    public PermissionEngineException(String message, Throwable cause) {
        this(message, cause, Map.of());
    }

    public PermissionEngineException(String message, Throwable cause, Map<String, Object> context) {
        super(message, cause);
        this.context = context != null ? context : Map.of();
    }

    public Map<String, Object> getContext() {
        return context;
    }
}
