package tech.gatekeeper.platform.authorization.events;

import org.jboss.logging.Logger;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * In-process stand-in for an external message bus.
 *
 * <p>Each {@link #endpoint()} is one execution context's transport. A payload sent from
 * an endpoint is delivered to every other connected endpoint, never back to the sender.
 * Delivery runs on the supplied executor; the default delivers on the sending thread.
 */
public class InMemoryInvalidationBus {

    private static final Logger LOG = Logger.getLogger(InMemoryInvalidationBus.class);

    private final List<Endpoint> endpoints = new CopyOnWriteArrayList<>();
    private final Executor deliveryExecutor;

    public InMemoryInvalidationBus() {
        this(Runnable::run);
    }

    public InMemoryInvalidationBus(Executor deliveryExecutor) {
        this.deliveryExecutor = Objects.requireNonNull(deliveryExecutor, "deliveryExecutor");
    }

    /**
     * Create a new transport attached to this bus.
     */
    public InvalidationTransport endpoint() {
        return new Endpoint();
    }

    public int connectedEndpoints() {
        return (int) endpoints.stream().filter(e -> e.inbound != null).count();
    }

    private void dispatch(Endpoint sender, String payload) {
        for (Endpoint endpoint : endpoints) {
            Consumer<String> inbound = endpoint.inbound;
            if (endpoint == sender || inbound == null) {
                continue;
            }
            deliveryExecutor.execute(() -> {
                try {
                    inbound.accept(payload);
                } catch (RuntimeException e) {
                    LOG.warnf(e, "Invalidation bus delivery failed");
                }
            });
        }
    }

    private final class Endpoint implements InvalidationTransport {

        private volatile Consumer<String> inbound;

        @Override
        public void send(String payload) {
            dispatch(this, payload);
        }

        @Override
        public void connect(Consumer<String> inbound) {
            this.inbound = Objects.requireNonNull(inbound, "inbound");
            if (!endpoints.contains(this)) {
                endpoints.add(this);
            }
        }

        @Override
        public void disconnect() {
            endpoints.remove(this);
            this.inbound = null;
        }
    }
}
