package com.hellblazer.kitbash.viewer.connect;

import com.hellblazer.kitbash.common.ChangeEvent;
import com.hellblazer.kitbash.common.ConnectionState;
import com.hellblazer.kitbash.common.FileEntry;
import com.hellblazer.kitbash.common.wire.EventCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static com.hellblazer.kitbash.common.ConnectionState.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Drives the supervisor with a scripted connector and a mocked scheduler, so delays are observed rather than waited.
 *
 * @author hal.hildebrand
 */
class ReconnectSupervisorTest {

    private final EventCodec              codec     = new EventCodec();
    private final List<ChangeEvent>       events    = new ArrayList<>();
    private final List<ConnectionState>   states    = new ArrayList<>();
    private       ScheduledExecutorService scheduler;
    private       ScheduledFuture<?>      timer;
    private       FakeConnector           connector;
    private       ReconnectSupervisor     supervisor;

    @BeforeEach
    void setUp() {
        scheduler = mock(ScheduledExecutorService.class);
        timer = mock(ScheduledFuture.class);
        doReturn(timer).when(scheduler).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        connector = new FakeConnector();
        supervisor = supervisor(Duration.ZERO);
    }

    private ReconnectSupervisor supervisor(Duration pingInterval) {
        return new ReconnectSupervisor(connector, BackoffPolicy.defaults(), pingInterval, scheduler, codec,
                                       events::add, states::add);
    }

    /**
     * @return delays of every retry scheduled so far, and runs the most recent one
     */
    private List<Long> fireRetry() {
        var task = ArgumentCaptor.forClass(Runnable.class);
        var delay = ArgumentCaptor.forClass(Long.class);
        verify(scheduler, atLeastOnce()).schedule(task.capture(), delay.capture(), eq(TimeUnit.MILLISECONDS));
        task.getValue().run();
        return delay.getAllValues();
    }

    private List<Long> scheduledDelays() {
        var delay = ArgumentCaptor.forClass(Long.class);
        verify(scheduler, atLeastOnce()).schedule(any(Runnable.class), delay.capture(), eq(TimeUnit.MILLISECONDS));
        return delay.getAllValues();
    }

    @Test
    void testConsecutiveFailuresBackOffToTheCap() {
        supervisor.start();
        for (int i = 0; i < 5; i++) {
            connector.last().refuse();
            fireRetry();
        }

        assertEquals(List.of(1000L, 2000L, 4000L, 8000L, 8000L), scheduledDelays());
        assertEquals(6, connector.attempts.size());
        assertEquals(6, supervisor.attempts());
        assertEquals(CONNECTING, supervisor.state());
    }

    @Test
    void testSuccessfulConnectionResetsBackoff() {
        supervisor.start();
        connector.last().refuse();
        fireRetry();
        connector.last().refuse();
        fireRetry();
        connector.last().listener.onOpen();
        assertEquals(CONNECTED, supervisor.state());
        assertEquals(Duration.ofSeconds(1), supervisor.nextDelay());

        connector.last().listener.onClosed("1001 going away");

        assertEquals(List.of(1000L, 2000L, 1000L), scheduledDelays());
        assertEquals(List.of(CONNECTING, DISCONNECTED, CONNECTING, DISCONNECTED, CONNECTING, CONNECTED, DISCONNECTED),
                     states);
    }

    @Test
    void testReloadBypassesTimerWithoutResettingLadder() {
        supervisor.start();
        connector.last().refuse();

        assertTrue(supervisor.reloadNow());
        verify(timer).cancel(false);
        assertEquals(2, connector.attempts.size());

        connector.last().refuse();
        assertEquals(List.of(1000L, 2000L), scheduledDelays());
    }

    @Test
    void testReloadWhileConnectedDoesNothing() {
        supervisor.start();
        connector.last().listener.onOpen();

        assertFalse(supervisor.reloadNow());
        assertEquals(1, connector.attempts.size());
    }

    @Test
    void testShutdownSendsQuitAndStopsRetrying() {
        supervisor.start();
        var attempt = connector.last();
        attempt.listener.onOpen();

        supervisor.shutdown();

        assertEquals(List.of("{\"type\":\"quit\"}"), attempt.sent);
        assertTrue(attempt.closed);
        assertEquals(DRAINING, supervisor.state());

        attempt.listener.onClosed("1000 quit");
        verify(scheduler, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        assertFalse(supervisor.reloadNow());
        assertEquals(DRAINING, supervisor.state());
    }

    @Test
    void testShutdownDuringBackoffCancelsRetry() {
        supervisor.start();
        connector.last().refuse();

        supervisor.shutdown();
        verify(timer).cancel(false);

        fireRetry();
        assertEquals(1, connector.attempts.size());
        assertEquals(DRAINING, supervisor.state());
    }

    @Test
    void testEventsAreDecodedAndMalformedOnesSkipped() {
        supervisor.start();
        var attempt = connector.last();
        attempt.listener.onOpen();
        var resync = new ChangeEvent.ResyncAll(List.of(new FileEntry("cube.obj", 10, 4, 1)));

        attempt.listener.onMessage("{not json");
        attempt.listener.onMessage(codec.encode(resync));
        attempt.listener.onMessage("{\"type\":\"teleported\"}");

        assertEquals(List.of(resync), events);
        assertEquals(CONNECTED, supervisor.state());
    }

    @Test
    void testCallbacksFromSupersededAttemptsAreIgnored() {
        supervisor.start();
        var first = connector.last();
        first.refuse();
        supervisor.reloadNow();

        first.listener.onOpen();
        first.listener.onMessage(codec.encode(new ChangeEvent.ResyncAll(List.of())));
        first.listener.onClosed("late");

        assertEquals(CONNECTING, supervisor.state());
        assertTrue(events.isEmpty());
        assertEquals(List.of(1000L), scheduledDelays());
    }

    @Test
    void testSynchronousFailureCountsAsLoss() {
        connector.refuseImmediately = true;
        supervisor.start();

        assertEquals(DISCONNECTED, supervisor.state());
        assertTrue(connector.last().closed);
        assertEquals(List.of(1000L), scheduledDelays());
    }

    @Test
    void testConnectorExceptionCountsAsLoss() {
        var broken = new ReconnectSupervisor(listener -> {
            throw new IllegalArgumentException("bad address");
        }, BackoffPolicy.defaults(), Duration.ZERO, scheduler, codec, events::add, states::add);

        broken.start();

        assertEquals(DISCONNECTED, broken.state());
        assertEquals(List.of(1000L), scheduledDelays());
    }

    @Test
    void testPingsWhileConnected() {
        supervisor = supervisor(Duration.ofSeconds(15));
        supervisor.start();
        var attempt = connector.last();
        attempt.listener.onOpen();

        var ping = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).scheduleAtFixedRate(ping.capture(), eq(15_000L), eq(15_000L), eq(TimeUnit.MILLISECONDS));
        ping.getValue().run();
        assertEquals(List.of("{\"type\":\"ping\"}"), attempt.sent);

        attempt.listener.onFailure(new IOException("reset"));
        ping.getValue().run();
        assertEquals(1, attempt.sent.size(), "No pings after the connection is lost");
    }
}
