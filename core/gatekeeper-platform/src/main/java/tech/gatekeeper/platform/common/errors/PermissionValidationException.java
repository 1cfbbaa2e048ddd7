package tech.gatekeeper.platform.common.errors;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Thrown when a permission request or principal is malformed (missing required
 * fields, reserved values). Surfaced to the caller instead of being treated as a
 * denial, so bugs in collaborators are caught early.
 */
public class PermissionValidationException extends PermissionEngineException {

    public static final String REQUIRED = "REQUIRED";
    public static final String INVALID = "INVALID";

    private final List<ValidationError> errors;

    public PermissionValidationException(String message, List<ValidationError> errors) {
        super(message, null, Map.of("fields", fieldNames(errors)));
        this.errors = List.copyOf(errors);
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    /**
     * Shortcut for a single missing field.
     */
    public static PermissionValidationException required(String field) {
        return new PermissionValidationException(
            field + " is required",
            List.of(new ValidationError(field, field + " is required", REQUIRED))
        );
    }

    /**
     * Shortcut for a single field with an unacceptable value.
     */
    public static PermissionValidationException invalid(String field, String message) {
        return new PermissionValidationException(
            message,
            List.of(new ValidationError(field, message, INVALID))
        );
    }

    private static String fieldNames(List<ValidationError> errors) {
        return errors.stream().map(ValidationError::field).collect(Collectors.joining(","));
    }

    public record ValidationError(String field, String message, String code) {}
}
