package com.hellblazer.kitbash.viewer.scene;

import com.hellblazer.kitbash.common.ChangeEvent;
import com.hellblazer.kitbash.common.FileEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

/**
 * Reconciler behavior with an inline loop, so every event and completion is applied before the call returns.
 *
 * @author hal.hildebrand
 */
class SceneReconcilerTest {

    private ManualFetcher                   fetcher;
    private RecordingRenderer               renderer;
    private SceneOverlay                    overlay;
    private SceneReconciler<String>         reconciler;

    @BeforeEach
    void setUp() {
        fetcher = new ManualFetcher();
        renderer = new RecordingRenderer();
        overlay = mock(SceneOverlay.class);
        reconciler = new SceneReconciler<>(fetcher, renderer, overlay, Runnable::run);
    }

    private static FileEntry entry(String name, long version) {
        return new FileEntry(name, 1_000 + version, 10, version);
    }

    private void added(String name, long version) {
        reconciler.accept(new ChangeEvent.Added(entry(name, version)));
    }

    private void modified(String name, long version) {
        reconciler.accept(new ChangeEvent.Modified(entry(name, version)));
    }

    private void removed(String name, long version) {
        reconciler.accept(new ChangeEvent.Removed(name, version));
    }

    private SceneObjectState state(String name) {
        return reconciler.object(name).orElseThrow(() -> new AssertionError(name + " not in replica"));
    }

    @Test
    void testAddedObjectIsFetchedAndSwappedIn() {
        added("cube.obj", 1);

        assertEquals(1, fetcher.requests.size());
        assertEquals("cube.obj", fetcher.last().name());
        assertEquals(1, fetcher.last().version());
        var pending = state("cube.obj");
        assertTrue(pending.visible());
        assertFalse(pending.selected());

        fetcher.last().complete("v 0 0 0");

        assertEquals(List.of("swap cube.obj v1 v 0 0 0"), renderer.calls);
        verify(overlay, atLeastOnce()).sceneChanged(anyList());
    }

    @Test
    void testReplayedAndOlderEventsAreDiscarded() {
        added("cube.obj", 1);
        modified("cube.obj", 2);
        modified("cube.obj", 2);
        modified("cube.obj", 1);
        added("cube.obj", 1);

        assertEquals(2, fetcher.requests.size());
        assertEquals(2, state("cube.obj").lastAppliedVersion());
    }

    @Test
    void testModifiedForUnknownNameCreatesObject() {
        modified("late.obj", 4);

        assertEquals(4, state("late.obj").lastAppliedVersion());
        assertEquals(1, fetcher.requests.size());
    }

    @Test
    void testRemovalUnloadsOnceAndLeavesTombstone() {
        added("cube.obj", 1);
        fetcher.last().complete("cube");

        removed("cube.obj", 2);
        removed("cube.obj", 2);
        added("cube.obj", 1);

        assertTrue(reconciler.objects().isEmpty());
        assertEquals(1, renderer.count("unload cube.obj"));
        assertEquals(1, fetcher.requests.size(), "Stale addition after removal is ignored");

        added("cube.obj", 3);
        assertEquals(3, state("cube.obj").lastAppliedVersion());
    }

    @Test
    void testRemovalOfUnknownNameSuppressesOlderAddition() {
        removed("ghost.obj", 5);
        added("ghost.obj", 4);

        assertTrue(reconciler.objects().isEmpty());
        assertTrue(fetcher.requests.isEmpty());
        verify(overlay, never()).sceneChanged(anyList());
    }

    @Test
    void testSupersededFetchIsDropped() {
        added("cube.obj", 1);
        var first = fetcher.last();
        modified("cube.obj", 2);
        var second = fetcher.last();

        assertTrue(first.future().isCancelled());
        first.future().obtrudeValue("old".getBytes());
        second.complete("new");

        assertEquals(List.of("swap cube.obj v2 new"), renderer.calls);
    }

    @Test
    void testFailedLoadKeepsPreviousRepresentation() {
        added("cube.obj", 1);
        fetcher.last().complete("good");
        modified("cube.obj", 2);
        fetcher.last().complete("bad triangle");

        var state = state("cube.obj");
        assertEquals("parse error in cube.obj", state.loadError());
        assertEquals(2, state.lastAppliedVersion());
        assertEquals(List.of("swap cube.obj v1 good"), renderer.calls);
        verify(overlay).loadFailed("cube.obj", "parse error in cube.obj");

        modified("cube.obj", 3);
        fetcher.last().complete("fixed");
        assertFalse(state("cube.obj").hasError());
    }

    @Test
    void testFetchFailureIsRecorded() {
        added("cube.obj", 1);
        fetcher.last().future().completeExceptionally(new IOException("connection reset"));

        assertEquals("connection reset", state("cube.obj").loadError());
        assertTrue(renderer.calls.isEmpty());
    }

    @Test
    void testRemovalDuringFetchCancelsIt() {
        added("cube.obj", 1);
        var pending = fetcher.last();

        removed("cube.obj", 2);
        assertTrue(pending.future().isCancelled());

        assertEquals(List.of("unload cube.obj"), renderer.calls);
    }

    @Test
    void testResyncReplacesReplica() {
        added("a.obj", 1);
        added("b.obj", 1);
        fetcher.completeAll("mesh");
        reconciler.toggleVisibility("b.obj");
        renderer.calls.clear();
        var before = fetcher.requests.size();

        reconciler.accept(new ChangeEvent.ResyncAll(List.of(entry("c.obj", 1), entry("b.obj", 1))));

        assertEquals(List.of("b.obj", "c.obj"), reconciler.objects().stream().map(SceneObjectState::name).toList());
        assertEquals(List.of("unload a.obj"), renderer.calls);
        assertEquals(before + 1, fetcher.requests.size(), "Only the new name is fetched");
        assertEquals("c.obj", fetcher.last().name());
        assertFalse(state("b.obj").visible(), "Flags survive a resync");
    }

    @Test
    void testResyncRefetchesMovedVersions() {
        added("a.obj", 1);
        fetcher.completeAll("one");

        reconciler.accept(new ChangeEvent.ResyncAll(List.of(entry("a.obj", 3))));
        reconciler.accept(new ChangeEvent.ResyncAll(List.of(entry("a.obj", 3))));

        assertEquals(2, fetcher.requests.size(), "A pending fetch of the same version is not repeated");
        assertEquals(3, fetcher.last().version());
        fetcher.last().complete("three");
        assertEquals("swap a.obj v3 three", renderer.calls.get(renderer.calls.size() - 1));

        reconciler.accept(new ChangeEvent.ResyncAll(List.of(entry("a.obj", 3))));
        assertEquals(2, fetcher.requests.size());
    }

    @Test
    void testResyncClearsTombstones() {
        added("a.obj", 1);
        removed("a.obj", 2);

        reconciler.accept(new ChangeEvent.ResyncAll(List.of(entry("a.obj", 1))));

        assertEquals(1, state("a.obj").lastAppliedVersion());
    }

    @Test
    void testResyncFromRestartedPortalRebasesVersions() {
        reconciler.accept(new ChangeEvent.ResyncAll(List.of(entry("cube.obj", 1), entry("gone.obj", 1)), 100));
        modified("cube.obj", 2);
        modified("cube.obj", 3);
        fetcher.completeAll("three");
        var before = fetcher.requests.size();

        reconciler.accept(new ChangeEvent.ResyncAll(List.of(entry("cube.obj", 1)), 200));

        assertEquals(1, state("cube.obj").lastAppliedVersion());
        assertEquals(before + 1, fetcher.requests.size(), "Content is refetched after a restart");
        assertEquals(1, renderer.count("unload gone.obj"));
        fetcher.last().complete("changed while down");
        assertTrue(renderer.calls.contains("swap cube.obj v1 changed while down"));

        removed("cube.obj", 2);
        assertTrue(reconciler.objects().isEmpty(), "Removal from the new run applies");
        assertEquals(1, renderer.count("unload cube.obj"));

        added("gone.obj", 1);
        assertEquals(1, state("gone.obj").lastAppliedVersion(), "Old tombstones do not block the new run");
    }

    @Test
    void testResyncFromSamePortalKeepsNewerVersions() {
        reconciler.accept(new ChangeEvent.ResyncAll(List.of(entry("cube.obj", 1)), 100));
        modified("cube.obj", 2);
        fetcher.completeAll("two");
        var before = fetcher.requests.size();

        reconciler.accept(new ChangeEvent.ResyncAll(List.of(entry("cube.obj", 2)), 100));

        assertEquals(2, state("cube.obj").lastAppliedVersion());
        assertEquals(before, fetcher.requests.size());
    }

    @Test
    void testEmptyResyncEmptiesScene() {
        added("a.obj", 1);

        reconciler.accept(new ChangeEvent.ResyncAll(List.of()));

        assertTrue(reconciler.objects().isEmpty());
        assertEquals(1, renderer.count("unload a.obj"));
    }

    @Test
    void testSelectionCyclesInNameOrder() {
        added("b.obj", 1);
        added("a.obj", 1);
        added("c.obj", 1);

        reconciler.selectNext();
        assertEquals("a.obj", reconciler.selected().orElseThrow());
        reconciler.selectNext();
        reconciler.selectNext();
        assertEquals("c.obj", reconciler.selected().orElseThrow());
        reconciler.selectNext();
        assertEquals("a.obj", reconciler.selected().orElseThrow());
        reconciler.selectPrevious();
        assertEquals("c.obj", reconciler.selected().orElseThrow());

        reconciler.select("b.obj");
        assertEquals(1, reconciler.objects().stream().filter(SceneObjectState::selected).count());
        reconciler.select("missing.obj");
        assertEquals("b.obj", reconciler.selected().orElseThrow());

        reconciler.clearSelection();
        assertTrue(reconciler.selected().isEmpty());
        reconciler.selectPrevious();
        assertEquals("c.obj", reconciler.selected().orElseThrow());
    }

    @Test
    void testSelectingOnEmptySceneDoesNothing() {
        reconciler.selectNext();
        reconciler.selectPrevious();

        assertTrue(reconciler.selected().isEmpty());
    }

    @Test
    void testVisibilityToggles() {
        added("a.obj", 1);
        added("b.obj", 1);

        reconciler.toggleVisibility("a.obj");
        reconciler.select("b.obj");
        reconciler.toggleSelectedVisibility();
        assertFalse(state("a.obj").visible());
        assertFalse(state("b.obj").visible());

        reconciler.showAll();
        assertTrue(reconciler.objects().stream().allMatch(SceneObjectState::visible));
        assertTrue(renderer.calls.contains("flags a.obj hidden"));
        assertTrue(renderer.calls.contains("flags a.obj visible"));
    }

    @Test
    void testReloadAllRefetchesCurrentVersions() {
        added("a.obj", 1);
        modified("a.obj", 2);
        added("b.obj", 1);
        fetcher.completeAll("first");
        renderer.calls.clear();

        reconciler.reloadAll();
        var reloads = fetcher.requests.subList(3, fetcher.requests.size());
        assertEquals(2, reloads.size());
        fetcher.completeAll("second");

        assertEquals(List.of("swap a.obj v2 second", "swap b.obj v1 second"), renderer.calls);
    }

    @Test
    void testReloadSupersedesPendingFetchOfSameVersion() {
        added("a.obj", 1);
        var pending = fetcher.last();

        reconciler.reloadAll();

        assertTrue(pending.future().isCancelled());
        assertNull(state("a.obj").loadError(), "Cancelled fetch is not reported as a failure");
        fetcher.last().complete("mesh");
        assertEquals(List.of("swap a.obj v1 mesh"), renderer.calls);
    }

    @Test
    void testObjectsViewIsImmutable() {
        added("a.obj", 1);
        var view = reconciler.objects();

        assertThrows(UnsupportedOperationException.class, () -> view.add(view.get(0)));
        removed("a.obj", 2);
        assertEquals(1, view.size(), "Earlier views are unaffected by later changes");
    }
}
