package com.hellblazer.kitbash.portal.sync;

import com.hellblazer.kitbash.portal.watch.FileMetadata;
import com.hellblazer.kitbash.portal.watch.RawChange;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

/**
 * @author hal.hildebrand
 */
class ChangeDebouncerTest {

    private static final Duration QUIET = Duration.ofMillis(100);

    private final LinkedBlockingQueue<SettledChange> settled = new LinkedBlockingQueue<>();
    private       ChangeDebouncer                    debouncer;

    @AfterEach
    void tearDown() {
        if (debouncer != null) {
            debouncer.close();
        }
    }

    private static ChangeDebouncer.MetadataSource present(long size) {
        return name -> Optional.of(new FileMetadata(name, 1_000L, size));
    }

    @Test
    void testBurstCoalescesIntoOneChange() throws Exception {
        debouncer = new ChangeDebouncer(QUIET, present(42), name -> true, settled::add);

        for (int i = 0; i < 10; i++) {
            debouncer.accept(new RawChange("a.obj", RawChange.Kind.MODIFY));
            Thread.sleep(5);
        }

        var change = settled.poll(2, TimeUnit.SECONDS);
        assertNotNull(change);
        var present = assertInstanceOf(SettledChange.Present.class, change);
        assertEquals("a.obj", present.name());
        assertEquals(42, present.metadata().size());
        assertNull(settled.poll(300, TimeUnit.MILLISECONDS), "Exactly one change per burst");
        assertEquals(0, debouncer.pendingCount());
    }

    @Test
    void testCreateThenDeleteIsDropped() throws Exception {
        debouncer = new ChangeDebouncer(QUIET, name -> Optional.empty(), name -> false, settled::add);

        debouncer.accept(new RawChange("temp.obj", RawChange.Kind.CREATE));
        debouncer.accept(new RawChange("temp.obj", RawChange.Kind.MODIFY));
        debouncer.accept(new RawChange("temp.obj", RawChange.Kind.DELETE));

        assertNull(settled.poll(400, TimeUnit.MILLISECONDS), "Net-zero burst produces nothing");
    }

    @Test
    void testDeleteOfKnownNameIsForwarded() throws Exception {
        debouncer = new ChangeDebouncer(QUIET, name -> Optional.empty(), "cube.obj"::equals, settled::add);

        debouncer.accept(new RawChange("cube.obj", RawChange.Kind.CREATE));
        debouncer.accept(new RawChange("cube.obj", RawChange.Kind.DELETE));

        var change = settled.poll(2, TimeUnit.SECONDS);
        assertEquals(new SettledChange.Absent("cube.obj"), change);
    }

    @Test
    void testDeleteAloneIsForwarded() throws Exception {
        debouncer = new ChangeDebouncer(QUIET, name -> Optional.empty(), name -> false, settled::add);

        debouncer.accept(new RawChange("gone.obj", RawChange.Kind.DELETE));

        assertEquals(new SettledChange.Absent("gone.obj"), settled.poll(2, TimeUnit.SECONDS));
    }

    @Test
    void testNamesDebounceIndependently() throws Exception {
        debouncer = new ChangeDebouncer(QUIET, present(1), name -> false, settled::add);

        debouncer.accept(new RawChange("a.obj", RawChange.Kind.CREATE));
        debouncer.accept(new RawChange("b.obj", RawChange.Kind.CREATE));
        debouncer.accept(new RawChange("a.obj", RawChange.Kind.MODIFY));

        var names = new ArrayList<String>();
        names.add(settled.poll(2, TimeUnit.SECONDS).name());
        names.add(settled.poll(2, TimeUnit.SECONDS).name());
        names.sort(String::compareTo);
        assertEquals(List.of("a.obj", "b.obj"), names);
        assertNull(settled.poll(300, TimeUnit.MILLISECONDS));
    }

    @Test
    void testMetadataIsReadWhenTheTimerExpires() throws Exception {
        var size = new AtomicLong(1);
        debouncer = new ChangeDebouncer(QUIET, name -> Optional.of(new FileMetadata(name, 5L, size.get())),
                                        name -> false, settled::add);

        debouncer.accept(new RawChange("big.obj", RawChange.Kind.CREATE));
        size.set(4_096);

        var present = assertInstanceOf(SettledChange.Present.class, settled.poll(2, TimeUnit.SECONDS));
        assertEquals(4_096, present.metadata().size(), "The final size is observed, not the first partial write");
    }

    @Test
    void testTransientStatFailureWaitsForNextChange() throws Exception {
        var failing = new AtomicBoolean(true);
        debouncer = new ChangeDebouncer(QUIET, name -> {
            if (failing.get()) {
                throw new IOException("busy");
            }
            return Optional.of(new FileMetadata(name, 1L, 1L));
        }, name -> false, settled::add);

        debouncer.accept(new RawChange("locked.obj", RawChange.Kind.MODIFY));
        assertNull(settled.poll(400, TimeUnit.MILLISECONDS));

        failing.set(false);
        debouncer.accept(new RawChange("locked.obj", RawChange.Kind.MODIFY));
        assertInstanceOf(SettledChange.Present.class, settled.poll(2, TimeUnit.SECONDS));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testEveryEventRestartsTheTimer() throws Exception {
        var timers = mock(ScheduledExecutorService.class);
        var future = mock(ScheduledFuture.class);
        doReturn(future).when(timers).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        debouncer = new ChangeDebouncer(QUIET, present(7), name -> false, settled::add, timers);

        debouncer.accept(new RawChange("a.obj", RawChange.Kind.CREATE));
        debouncer.accept(new RawChange("a.obj", RawChange.Kind.MODIFY));
        debouncer.accept(new RawChange("a.obj", RawChange.Kind.MODIFY));

        var tasks = ArgumentCaptor.forClass(Runnable.class);
        verify(timers, times(3)).schedule(tasks.capture(), eq(QUIET.toNanos()), eq(TimeUnit.NANOSECONDS));
        verify(future, times(2)).cancel(false);
        assertEquals(1, debouncer.pendingCount());

        // a timer that was cancelled while already firing must not settle
        tasks.getAllValues().get(0).run();
        tasks.getAllValues().get(1).run();
        assertTrue(settled.isEmpty());
        assertEquals(1, debouncer.pendingCount());

        tasks.getAllValues().get(2).run();
        assertEquals(1, settled.size());
        assertEquals(0, debouncer.pendingCount());
    }

    @Test
    void testClosedDebouncerIgnoresChanges() throws Exception {
        debouncer = new ChangeDebouncer(QUIET, present(1), name -> false, settled::add);
        debouncer.accept(new RawChange("a.obj", RawChange.Kind.CREATE));

        debouncer.close();
        debouncer.accept(new RawChange("b.obj", RawChange.Kind.CREATE));

        assertEquals(0, debouncer.pendingCount());
        assertNull(settled.poll(300, TimeUnit.MILLISECONDS));
    }

    @Test
    void testRejectsNonPositiveQuietPeriod() {
        assertThrows(IllegalArgumentException.class,
                     () -> new ChangeDebouncer(Duration.ZERO, present(1), name -> false, settled::add));
    }
}
