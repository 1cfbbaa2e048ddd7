package tech.gatekeeper.platform.authorization.events;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.gatekeeper.platform.authorization.Action;
import tech.gatekeeper.platform.authorization.CapabilityMatrix;
import tech.gatekeeper.platform.authorization.PermissionEvaluator;
import tech.gatekeeper.platform.authorization.PermissionService;
import tech.gatekeeper.platform.authorization.Resource;
import tech.gatekeeper.platform.cache.PermissionCache;
import tech.gatekeeper.platform.shared.PermissionMetrics;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static tech.gatekeeper.platform.test.Principals.VIEWER;

/**
 * Unit tests for InvalidationBroadcaster local fan-out and cross-context delivery.
 */
class InvalidationBroadcasterTest {

    private SimpleMeterRegistry registry;
    private PermissionMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PermissionMetrics(registry);
    }

    // ========================================
    // LOCAL DELIVERY
    // ========================================

    @Test
    @DisplayName("publish should deliver to every subscriber except the source")
    void publish_shouldSkipSource() {
        InvalidationBroadcaster broadcaster = InvalidationBroadcaster.localOnly(metrics);
        List<InvalidationEvent> first = new ArrayList<>();
        List<InvalidationEvent> second = new ArrayList<>();
        InvalidationListener source = first::add;
        broadcaster.subscribe(source);
        broadcaster.subscribe(second::add);

        broadcaster.publish(InvalidationEvent.everything(), source);

        assertThat(first).isEmpty();
        assertThat(second).hasSize(1);
    }

    @Test
    @DisplayName("inactive subscribers should be pruned instead of called")
    void publish_shouldPruneInactiveSubscribers() {
        InvalidationBroadcaster broadcaster = InvalidationBroadcaster.localOnly(metrics);
        AtomicBoolean called = new AtomicBoolean();
        broadcaster.subscribe(new InvalidationListener() {
            @Override
            public void onInvalidation(InvalidationEvent event) {
                called.set(true);
            }

            @Override
            public boolean isActive() {
                return false;
            }
        });

        broadcaster.publish(InvalidationEvent.forUser("u1"));

        assertThat(called).isFalse();
        assertThat(broadcaster.subscriberCount()).isZero();
    }

    @Test
    @DisplayName("a failing subscriber should not stop delivery to the others")
    void publish_shouldIsolateSubscriberFailures() {
        InvalidationBroadcaster broadcaster = InvalidationBroadcaster.localOnly(metrics);
        List<InvalidationEvent> seen = new ArrayList<>();
        broadcaster.subscribe(event -> {
            throw new IllegalStateException("listener bug");
        });
        broadcaster.subscribe(seen::add);

        assertThatCode(() -> broadcaster.publish(InvalidationEvent.forResource("products")))
            .doesNotThrowAnyException();
        assertThat(seen).hasSize(1);
    }

    @Test
    @DisplayName("a subscriber may unsubscribe from inside its own callback")
    void subscriber_shouldUnsubscribeDuringDelivery() {
        InvalidationBroadcaster broadcaster = InvalidationBroadcaster.localOnly(metrics);
        List<Subscription> holder = new ArrayList<>();
        holder.add(broadcaster.subscribe(event -> holder.get(0).unsubscribe()));

        broadcaster.publish(InvalidationEvent.everything());
        broadcaster.publish(InvalidationEvent.everything());

        assertThat(broadcaster.subscriberCount()).isZero();
    }

    // ========================================
    // REMOTE DELIVERY
    // ========================================

    @Test
    @DisplayName("transport failure should be logged and counted, never thrown")
    void publish_shouldSwallowTransportFailure() {
        InvalidationTransport transport = mock(InvalidationTransport.class);
        doThrow(new IllegalStateException("bus unavailable")).when(transport).send(anyString());
        InvalidationBroadcaster broadcaster = new InvalidationBroadcaster("ctx-a", transport, Runnable::run, metrics);
        List<InvalidationEvent> seen = new ArrayList<>();
        broadcaster.subscribe(seen::add);

        assertThatCode(() -> broadcaster.publish(InvalidationEvent.forUser("u1")))
            .doesNotThrowAnyException();

        assertThat(seen).hasSize(1);
        assertThat(registry.get(PermissionMetrics.BROADCAST_FAILURES).counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("invalidation in one context should clear caches in another")
    void publish_shouldPropagateAcrossContexts() {
        // Given two contexts on one bus
        InMemoryInvalidationBus bus = new InMemoryInvalidationBus();
        InvalidationBroadcaster contextA = new InvalidationBroadcaster("ctx-a", bus.endpoint(), Runnable::run, metrics);
        InvalidationBroadcaster contextB = new InvalidationBroadcaster("ctx-b", bus.endpoint(), Runnable::run, metrics);
        PermissionEvaluator evaluator = new PermissionEvaluator(CapabilityMatrix.defaults());
        PermissionCache cacheA = new PermissionCache(100, Duration.ofMinutes(5));
        PermissionCache cacheB = new PermissionCache(100, Duration.ofMinutes(5));
        PermissionService serviceA = new PermissionService(evaluator, cacheA, contextA, metrics);
        PermissionService serviceB = new PermissionService(evaluator, cacheB, contextB, metrics);
        serviceB.checkPermission(VIEWER, Resource.PRODUCTS, Action.READ);
        assertThat(cacheB.size()).isEqualTo(1);

        // When
        serviceA.invalidateUserCache("viewer-1");

        // Then
        assertThat(cacheB.size()).isZero();
        assertThat(registry.get(PermissionMetrics.INVALIDATIONS)
            .tag("scope", "user").tag("origin", "remote").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("own echoes and malformed payloads should be ignored")
    void receive_shouldIgnoreEchoesAndMalformedPayloads() {
        List<Consumer<String>> inbound = new ArrayList<>();
        InvalidationTransport transport = new InvalidationTransport() {
            @Override
            public void send(String payload) {
            }

            @Override
            public void connect(Consumer<String> handler) {
                inbound.add(handler);
            }
        };
        InvalidationBroadcaster broadcaster = new InvalidationBroadcaster("ctx-a", transport, Runnable::run, metrics);
        List<InvalidationEvent> seen = new ArrayList<>();
        broadcaster.subscribe(seen::add);

        inbound.get(0).accept(InvalidationMessage.fromEvent(InvalidationEvent.everything(), "ctx-a").toJson());
        inbound.get(0).accept("{\"type\":\"SOMETHING_ELSE\",\"timestamp\":1}");
        inbound.get(0).accept("garbage");
        inbound.get(0).accept("null");
        inbound.get(0).accept(InvalidationMessage.fromEvent(InvalidationEvent.forUser("u2"), "ctx-b").toJson());

        assertThat(seen).singleElement()
            .satisfies(event -> assertThat(event.targetId()).contains("u2"));
    }

    @Test
    @DisplayName("a JSON null payload should be dropped without reaching subscribers")
    void receive_shouldDropJsonNull() {
        InvalidationBroadcaster broadcaster = InvalidationBroadcaster.localOnly(metrics);
        List<InvalidationEvent> seen = new ArrayList<>();
        broadcaster.subscribe(seen::add);

        assertThatCode(() -> broadcaster.receive("null")).doesNotThrowAnyException();

        assertThat(seen).isEmpty();
        assertThat(registry.find(PermissionMetrics.INVALIDATIONS).counters()).isEmpty();
    }

    @Test
    @DisplayName("close should disconnect from the transport and drop subscribers")
    void close_shouldDisconnect() {
        InvalidationTransport transport = mock(InvalidationTransport.class);
        InvalidationBroadcaster broadcaster = new InvalidationBroadcaster(null, transport, Runnable::run, metrics);
        broadcaster.subscribe(event -> { });

        broadcaster.close();

        verify(transport).disconnect();
        assertThat(broadcaster.isClosed()).isTrue();
        assertThat(broadcaster.subscriberCount()).isZero();
        assertThat(broadcaster.originId()).isNotBlank();
    }

    @Test
    @DisplayName("bus should not deliver a payload back to its sender")
    void bus_shouldSkipSender() {
        InMemoryInvalidationBus bus = new InMemoryInvalidationBus();
        InvalidationTransport a = bus.endpoint();
        InvalidationTransport b = bus.endpoint();
        List<String> receivedByA = new ArrayList<>();
        List<String> receivedByB = new ArrayList<>();
        a.connect(receivedByA::add);
        b.connect(receivedByB::add);

        a.send("hello");
        b.disconnect();
        a.send("again");

        assertThat(receivedByA).isEmpty();
        assertThat(receivedByB).containsExactly("hello");
        assertThat(bus.connectedEndpoints()).isEqualTo(1);
    }
}
