package tech.gatekeeper.platform.authorization.events;

import java.util.function.Consumer;

/**
 * External channel that carries serialized invalidation messages between execution
 * contexts (other workers, other sessions). The engine does not own the channel; it
 * only hands payloads to it and receives payloads from it.
 *
 * <p>Implementations: a message bus or pub/sub client in production,
 * {@link InMemoryInvalidationBus} for several contexts inside one JVM, and
 * {@link #localOnly()} when there are no remote peers.
 */
public interface InvalidationTransport {

    /**
     * Send a payload to every other connected context. May throw on transport
     * failure; the broadcaster logs and swallows it.
     */
    void send(String payload);

    /**
     * Register the handler for payloads arriving from other contexts.
     */
    void connect(Consumer<String> inbound);

    /**
     * Stop delivering inbound payloads.
     */
    default void disconnect() {
    }

    /**
     * Transport for a context without remote peers. Sends are dropped.
     */
    static InvalidationTransport localOnly() {
        return new InvalidationTransport() {
            @Override
            public void send(String payload) {
            }

            @Override
            public void connect(Consumer<String> inbound) {
            }

            @Override
            public String toString() {
                return "local-only";
            }
        };
    }
}
