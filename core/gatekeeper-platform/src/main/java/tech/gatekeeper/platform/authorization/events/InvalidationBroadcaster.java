package tech.gatekeeper.platform.authorization.events;

import org.jboss.logging.Logger;
import tech.gatekeeper.platform.shared.PermissionMetrics;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fans invalidation events out to local subscribers and to other execution contexts.
 *
 * <p>Local delivery is synchronous: when {@link #publish} returns, every active local
 * subscriber (other than the source) has applied the event. Remote delivery is
 * fire-and-forget on the send executor; a transport failure is logged and counted,
 * never propagated to the publisher.
 *
 * <p>Messages received from the transport are decoded and delivered to every local
 * subscriber. Messages carrying this broadcaster's own origin ID are ignored, as are
 * malformed ones.
 *
 * <p>Subscribers are held in a copy-on-write list, so publishing never blocks
 * subscription and a subscriber may unsubscribe from inside its own callback.
 */
public class InvalidationBroadcaster implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(InvalidationBroadcaster.class);

    private final String originId;
    private final InvalidationTransport transport;
    private final Executor sendExecutor;
    private final PermissionMetrics metrics;
    private final List<InvalidationListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public InvalidationBroadcaster(
        String originId,
        InvalidationTransport transport,
        Executor sendExecutor,
        PermissionMetrics metrics
    ) {
        this.originId = originId != null && !originId.isBlank() ? originId : UUID.randomUUID().toString();
        this.transport = Objects.requireNonNull(transport, "transport");
        this.sendExecutor = Objects.requireNonNull(sendExecutor, "sendExecutor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        transport.connect(this::receive);
        LOG.debugf("Invalidation broadcaster [%s] connected to transport %s", this.originId, transport);
    }

    /**
     * Broadcaster for a single execution context with no remote peers.
     */
    public static InvalidationBroadcaster localOnly(PermissionMetrics metrics) {
        return new InvalidationBroadcaster(null, InvalidationTransport.localOnly(), Runnable::run, metrics);
    }

    public Subscription subscribe(InvalidationListener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void publish(InvalidationEvent event) {
        publish(event, null);
    }

    /**
     * Deliver an event locally and send it to other contexts.
     *
     * @param event  The invalidation event
     * @param source Subscriber that originated the event and has already applied it,
     *               or null. It is not called back.
     */
    public void publish(InvalidationEvent event, InvalidationListener source) {
        Objects.requireNonNull(event, "event");
        metrics.recordInvalidation(event.scope(), false);
        deliverLocally(event, source);
        sendRemote(event);
    }

    /**
     * Handle a payload arriving from the transport.
     */
    public void receive(String payload) {
        if (closed.get()) {
            return;
        }

        InvalidationMessage message;
        InvalidationEvent event;
        try {
            message = InvalidationMessage.fromJson(payload);
            event = message.toEvent();
        } catch (InvalidationMessageException e) {
            LOG.warnf("Dropping malformed invalidation message: %s", e.getMessage());
            return;
        }

        if (originId.equals(message.origin())) {
            LOG.debugf("Ignoring echo of own invalidation %s", event);
            return;
        }

        LOG.debugf("Received %s invalidation from [%s]", event.scope(), message.origin());
        metrics.recordInvalidation(event.scope(), true);
        deliverLocally(event, null);
    }

    public int subscriberCount() {
        return listeners.size();
    }

    public String originId() {
        return originId;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Disconnect from the transport and drop all subscribers.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            transport.disconnect();
            listeners.clear();
            LOG.debugf("Invalidation broadcaster [%s] closed", originId);
        }
    }

    private void deliverLocally(InvalidationEvent event, InvalidationListener source) {
        listeners.removeIf(listener -> !listener.isActive());

        for (InvalidationListener listener : listeners) {
            if (listener == source) {
                continue;
            }
            try {
                listener.onInvalidation(event);
            } catch (RuntimeException e) {
                LOG.warnf(e, "Invalidation listener %s failed on %s", listener, event);
            }
        }
    }

    private void sendRemote(InvalidationEvent event) {
        if (closed.get()) {
            return;
        }

        String payload = InvalidationMessage.fromEvent(event, originId).toJson();
        try {
            sendExecutor.execute(() -> send(payload));
        } catch (RejectedExecutionException e) {
            LOG.warnf("Invalidation broadcast rejected by executor: %s", e.getMessage());
            metrics.recordBroadcastFailure();
        }
    }

    private void send(String payload) {
        try {
            transport.send(payload);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to broadcast invalidation via %s", transport);
            metrics.recordBroadcastFailure();
        }
    }
}
