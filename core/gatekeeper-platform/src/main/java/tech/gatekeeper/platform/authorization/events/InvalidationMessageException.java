package tech.gatekeeper.platform.authorization.events;

import tech.gatekeeper.platform.common.errors.PermissionEngineException;

/**
 * Raised when an invalidation message cannot be encoded or decoded.
 */
public class InvalidationMessageException extends PermissionEngineException {

    public InvalidationMessageException(String message) {
        super(message);
    }

    public InvalidationMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
