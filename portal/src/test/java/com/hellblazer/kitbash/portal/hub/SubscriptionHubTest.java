package com.hellblazer.kitbash.portal.hub;

import com.hellblazer.kitbash.common.ChangeEvent;
import com.hellblazer.kitbash.common.ConnectionState;
import com.hellblazer.kitbash.common.FileEntry;
import com.hellblazer.kitbash.common.wire.EventCodec;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class SubscriptionHubTest {

    private final EventCodec codec = new EventCodec();

    private final AtomicReference<List<FileEntry>> registry = new AtomicReference<>(List.of());

    /**
     * Holds delivery tasks until the test runs them.
     */
    private static class ManualExecutor implements Executor {
        final Queue<Runnable> tasks = new ArrayDeque<>();

        @Override
        public synchronized void execute(Runnable command) {
            tasks.add(command);
        }

        void runAll() {
            Runnable next;
            while ((next = poll()) != null) {
                next.run();
            }
        }

        private synchronized Runnable poll() {
            return tasks.poll();
        }
    }

    private ChangeEvent.ResyncAll resync() {
        return new ChangeEvent.ResyncAll(registry.get(), 42);
    }

    private List<ChangeEvent> decoded(RecordingChannel channel) {
        return channel.sent.stream().map(codec::decodeEvent).toList();
    }

    private static ChangeEvent added(String name, long version) {
        return new ChangeEvent.Added(new FileEntry(name, version, 1, version));
    }

    @Test
    void testNewConnectionStartsWithResync() {
        registry.set(List.of(new FileEntry("a.obj", 5, 1, 2)));
        var delivery = new ManualExecutor();
        var hub = new SubscriptionHub(this::resync, codec, 16, delivery);
        var channel = new RecordingChannel("c1");

        hub.register(channel);
        assertEquals(ConnectionState.CONNECTING, hub.stats().get(0).state());
        delivery.runAll();

        assertEquals(List.of(new ChangeEvent.ResyncAll(registry.get(), 42)), decoded(channel));
        var stats = hub.stats().get(0);
        assertEquals(ConnectionState.CONNECTED, stats.state());
        assertEquals(1, stats.delivered());
        assertEquals(0, stats.queued());
    }

    @Test
    void testEventsArriveInPublicationOrder() {
        var delivery = new ManualExecutor();
        var hub = new SubscriptionHub(this::resync, codec, 16, delivery);
        var channel = new RecordingChannel("c1");
        hub.register(channel);

        var events = List.of(added("a.obj", 1), new ChangeEvent.Modified(new FileEntry("a.obj", 2, 1, 2)),
                             added("b.obj", 1), new ChangeEvent.Removed("a.obj", 3));
        events.forEach(hub);
        delivery.runAll();

        var received = decoded(channel);
        assertInstanceOf(ChangeEvent.ResyncAll.class, received.get(0));
        assertEquals(events, received.subList(1, received.size()));
    }

    @Test
    void testOverflowReplacesQueueWithSnapshot() {
        var delivery = new ManualExecutor();
        var hub = new SubscriptionHub(this::resync, codec, 3, delivery);
        var channel = new RecordingChannel("slow");
        hub.register(channel);

        hub.accept(added("e1.obj", 1));
        hub.accept(added("e2.obj", 1));
        registry.set(List.of(new FileEntry("e3.obj", 3, 1, 1), new FileEntry("e2.obj", 2, 1, 1),
                             new FileEntry("e1.obj", 1, 1, 1)));
        hub.accept(added("e3.obj", 1));
        hub.accept(added("e4.obj", 1));
        assertEquals(1, hub.stats().get(0).overflows());
        delivery.runAll();

        var received = decoded(channel);
        assertEquals(2, received.size());
        var resync = assertInstanceOf(ChangeEvent.ResyncAll.class, received.get(0));
        assertEquals(3, resync.files().size(), "Snapshot covers every dropped event");
        assertEquals(added("e4.obj", 1), received.get(1));
    }

    @Test
    void testPublishedResyncReplacesQueue() {
        var delivery = new ManualExecutor();
        var hub = new SubscriptionHub(this::resync, codec, 16, delivery);
        var channel = new RecordingChannel("c1");
        hub.register(channel);
        hub.accept(added("a.obj", 1));
        hub.accept(added("b.obj", 1));

        var resync = new ChangeEvent.ResyncAll(List.of(new FileEntry("c.obj", 1, 1, 1)));
        hub.accept(resync);
        delivery.runAll();

        assertEquals(List.of(resync), decoded(channel));
    }

    @Test
    void testSlowConnectionDoesNotHoldBackOthers() throws Exception {
        var pool = Executors.newCachedThreadPool();
        try {
            var hub = new SubscriptionHub(this::resync, codec, 3, pool);
            var slow = new RecordingChannel("slow");
            var gate = new CountDownLatch(1);
            slow.gate = gate;
            var fast = new RecordingChannel("fast");
            hub.register(slow);
            hub.register(fast);

            for (int i = 1; i <= 10; i++) {
                hub.accept(added("f" + i + ".obj", 1));
                var deadline = System.currentTimeMillis() + 5_000;
                while (fast.sent.size() < i + 1 && System.currentTimeMillis() < deadline) {
                    Thread.sleep(1);
                }
            }

            assertEquals(11, fast.sent.size(), "Fast viewer receives the full stream");
            assertTrue(slow.sent.isEmpty());
            var slowStats = hub.stats().stream().filter(s -> s.id().equals("slow")).findFirst().orElseThrow();
            assertTrue(slowStats.overflows() >= 1);
            assertTrue(slowStats.queued() <= 3);

            gate.countDown();
            var deadline = System.currentTimeMillis() + 5_000;
            while (slowStats.queued() > 0 && System.currentTimeMillis() < deadline) {
                slowStats = hub.stats().stream().filter(s -> s.id().equals("slow")).findFirst().orElseThrow();
                Thread.sleep(10);
            }
            assertEquals(0, slowStats.queued());
            hub.close();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testSendFailureDropsConnection() {
        var delivery = new ManualExecutor();
        var hub = new SubscriptionHub(this::resync, codec, 16, delivery);
        var channel = new RecordingChannel("broken");
        channel.failing = true;
        hub.register(channel);

        delivery.runAll();

        assertEquals(0, hub.connectionCount());
        assertFalse(channel.isOpen());
        hub.accept(added("a.obj", 1));
        delivery.runAll();
        assertTrue(channel.sent.isEmpty());
    }

    @Test
    void testQuitFlushesThenCloses() {
        var delivery = new ManualExecutor();
        var hub = new SubscriptionHub(this::resync, codec, 16, delivery);
        var quits = new ArrayList<String>();
        hub.setQuitListener(quits::add);
        var channel = new RecordingChannel("c1");
        hub.register(channel);
        hub.accept(added("a.obj", 1));

        hub.onMessage("c1", "{\"type\":\"quit\"}");
        assertEquals(ConnectionState.DRAINING, hub.stats().get(0).state());
        hub.accept(added("late.obj", 1));
        delivery.runAll();

        assertEquals(2, channel.sent.size(), "Queued events are flushed before closing");
        assertFalse(channel.isOpen());
        assertEquals(List.of("c1"), quits);
        assertEquals(0, hub.connectionCount());
    }

    @Test
    void testPingRefreshesLiveness() throws Exception {
        var hub = new SubscriptionHub(this::resync, codec, 16, new ManualExecutor());
        hub.register(new RecordingChannel("c1"));
        var before = hub.stats().get(0).lastSeen();

        Thread.sleep(20);
        hub.onMessage("c1", "{\"type\":\"ping\"}");

        assertTrue(hub.stats().get(0).lastSeen().isAfter(before));
    }

    @Test
    void testMalformedMessagesAreIgnored() {
        var hub = new SubscriptionHub(this::resync, codec, 16, new ManualExecutor());
        hub.register(new RecordingChannel("c1"));

        hub.onMessage("c1", "not json");
        hub.onMessage("c1", "{\"type\":\"dance\"}");
        hub.onMessage("unknown", "{\"type\":\"ping\"}");

        assertEquals(1, hub.connectionCount());
        assertEquals(ConnectionState.CONNECTING, hub.stats().get(0).state());
    }

    @Test
    void testUnregisterStopsDelivery() {
        var delivery = new ManualExecutor();
        var hub = new SubscriptionHub(this::resync, codec, 16, delivery);
        var channel = new RecordingChannel("c1");
        hub.register(channel);

        assertTrue(hub.unregister("c1"));
        assertFalse(hub.unregister("c1"));
        hub.accept(added("a.obj", 1));
        delivery.runAll();

        assertTrue(channel.sent.isEmpty());
    }

    @Test
    void testDuplicateIdIsRejected() {
        var hub = new SubscriptionHub(this::resync, codec, 16, new ManualExecutor());
        hub.register(new RecordingChannel("c1"));

        assertThrows(IllegalArgumentException.class, () -> hub.register(new RecordingChannel("c1")));
    }

    @Test
    void testCloseFlushesAndClosesEveryConnection() {
        var hub = new SubscriptionHub(this::resync, codec, 16, Runnable::run);
        var quits = new ArrayList<String>();
        hub.setQuitListener(quits::add);
        var first = new RecordingChannel("c1");
        var second = new RecordingChannel("c2");
        hub.register(first);
        hub.register(second);
        hub.accept(added("a.obj", 1));

        hub.close();

        assertEquals(2, first.sent.size());
        assertEquals(2, second.sent.size());
        assertFalse(first.isOpen());
        assertFalse(second.isOpen());
        assertEquals(0, hub.connectionCount());
        assertTrue(quits.isEmpty(), "Server shutdown is not a viewer quit");
        assertThrows(IllegalStateException.class, () -> hub.register(new RecordingChannel("c3")));
    }

    @Test
    void testRejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new SubscriptionHub(this::resync, codec, 0, Runnable::run));
    }
}
