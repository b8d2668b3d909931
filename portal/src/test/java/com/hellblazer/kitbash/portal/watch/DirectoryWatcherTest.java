package com.hellblazer.kitbash.portal.watch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises the watcher against the real platform watch service.
 *
 * @author hal.hildebrand
 */
class DirectoryWatcherTest {

    @TempDir
    Path root;

    @Test
    void testReportsCreateModifyDelete() throws Exception {
        var changes = new LinkedBlockingQueue<RawChange>();
        try (var watcher = new DirectoryWatcher(new SceneDirectory(root, Set.of(".obj")), changes::add, () -> {
        }, e -> fail(e))) {
            watcher.start();
            assertTrue(watcher.isRunning());

            var file = root.resolve("cube.obj");
            Files.writeString(file, "v 0 0 0\n");
            var created = changes.poll(10, TimeUnit.SECONDS);
            assertNotNull(created, "No event for created file");
            assertEquals("cube.obj", created.name());
            assertEquals(RawChange.Kind.CREATE, created.kind());

            Files.delete(file);
            RawChange change;
            do {
                change = changes.poll(10, TimeUnit.SECONDS);
                assertNotNull(change, "No delete event");
            } while (change.kind() != RawChange.Kind.DELETE);
            assertEquals("cube.obj", change.name());
        }
    }

    @Test
    void testIgnoresNonSceneFiles() throws Exception {
        var changes = new LinkedBlockingQueue<RawChange>();
        try (var watcher = new DirectoryWatcher(new SceneDirectory(root, Set.of(".obj")), changes::add, () -> {
        }, e -> fail(e))) {
            watcher.start();

            Files.writeString(root.resolve("notes.txt"), "ignored");
            Files.writeString(root.resolve(".swap.obj"), "ignored");
            Files.writeString(root.resolve("cube.obj"), "v 0 0 0\n");

            var first = changes.poll(10, TimeUnit.SECONDS);
            assertNotNull(first);
            assertEquals("cube.obj", first.name(), "Only scene files are reported");
            RawChange next;
            while ((next = changes.poll(200, TimeUnit.MILLISECONDS)) != null) {
                assertEquals("cube.obj", next.name());
            }
        }
    }

    @Test
    void testMissingDirectoryFailsToStart() {
        var watcher = new DirectoryWatcher(new SceneDirectory(root.resolve("absent"), Set.of(".obj")), c -> {
        }, () -> {
        }, e -> {
        });

        var e = assertThrows(WatchLostException.class, watcher::start);
        assertEquals(root.resolve("absent").toAbsolutePath().normalize(), e.getDirectory());
        assertFalse(watcher.isRunning());
    }

    @Test
    void testDeletedDirectoryIsReportedAsLost() throws Exception {
        var scene = Files.createDirectory(root.resolve("scene"));
        var lost = new CompletableFuture<WatchLostException>();
        try (var watcher = new DirectoryWatcher(new SceneDirectory(scene, Set.of(".obj")), c -> {
        }, () -> {
        }, lost::complete)) {
            watcher.start();

            Files.delete(scene);

            var e = lost.get(10, TimeUnit.SECONDS);
            assertEquals(scene.toAbsolutePath().normalize(), e.getDirectory());
            assertFalse(watcher.isRunning());
        }
    }
}
