package tech.gatekeeper.platform.authorization.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;

/**
 * Wire form of an {@link InvalidationEvent}, as carried by an {@link InvalidationTransport}.
 *
 * <pre>
 * { "type": "CACHE_INVALIDATED", "userId": "...", "resourceId": "...", "timestamp": 1700000000000, "origin": "..." }
 * </pre>
 *
 * <p>{@code userId} and {@code resourceId} are mutually exclusive; when both are absent
 * the message means "invalidate everything". {@code timestamp} is epoch milliseconds.
 * {@code origin} identifies the sending broadcaster so it can ignore its own echoes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record InvalidationMessage(
    String type,
    String userId,
    String resourceId,
    Long timestamp,
    String origin
) {

    public static final String TYPE_CACHE_INVALIDATED = "CACHE_INVALIDATED";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static InvalidationMessage fromEvent(InvalidationEvent event, String origin) {
        String userId = event instanceof InvalidationEvent.ForUser u ? u.userId() : null;
        String resourceId = event instanceof InvalidationEvent.ForResource r ? r.resourceId() : null;
        return new InvalidationMessage(
            TYPE_CACHE_INVALIDATED,
            userId,
            resourceId,
            event.issuedAt().toEpochMilli(),
            origin
        );
    }

    /**
     * Convert back to the event variant this message encodes.
     *
     * @throws InvalidationMessageException if the message is not a valid invalidation
     */
    public InvalidationEvent toEvent() {
        if (!TYPE_CACHE_INVALIDATED.equals(type)) {
            throw new InvalidationMessageException("Unsupported message type: " + type);
        }
        if (timestamp == null) {
            throw new InvalidationMessageException("Invalidation message has no timestamp");
        }
        boolean hasUser = userId != null && !userId.isBlank();
        boolean hasResource = resourceId != null && !resourceId.isBlank();
        if (hasUser && hasResource) {
            throw new InvalidationMessageException("Invalidation message targets both a user and a resource");
        }

        Instant issuedAt = Instant.ofEpochMilli(timestamp);
        if (hasUser) {
            return new InvalidationEvent.ForUser(userId, issuedAt);
        }
        if (hasResource) {
            return new InvalidationEvent.ForResource(resourceId, issuedAt);
        }
        return new InvalidationEvent.Everything(issuedAt);
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new InvalidationMessageException("Failed to serialize invalidation message", e);
        }
    }

    /**
     * @throws InvalidationMessageException if the payload is not a JSON invalidation message
     */
    public static InvalidationMessage fromJson(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new InvalidationMessageException("Empty invalidation payload");
        }
        InvalidationMessage message;
        try {
            message = MAPPER.readValue(payload, InvalidationMessage.class);
        } catch (JsonProcessingException e) {
            throw new InvalidationMessageException("Failed to parse invalidation message", e);
        }
        if (message == null) {
            throw new InvalidationMessageException("Invalidation payload is JSON null");
        }
        return message;
    }
}
