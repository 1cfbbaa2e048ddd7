package tech.gatekeeper.platform.authorization;

/**
 * A resource instance that knows its owner.
 */
public interface OwnedResource {

    /**
     * @return ID of the principal that owns this instance, or null if unowned
     */
    String ownerId();
}
