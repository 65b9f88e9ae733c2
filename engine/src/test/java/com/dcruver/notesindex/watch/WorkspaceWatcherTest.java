package com.dcruver.notesindex.watch;

import com.dcruver.notesindex.EngineFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the watcher against the real file system. Events arrive
 * asynchronously, so assertions poll with a deadline.
 */
class WorkspaceWatcherTest {

    private static final long TIMEOUT_MILLIS = 15_000;

    @TempDir
    Path tempDir;

    private EngineFixture engine;
    private WorkspaceWatcher watcher;

    @BeforeEach
    void setUp() throws Exception {
        engine = EngineFixture.create(tempDir);
        watcher = new WorkspaceWatcher(engine.scanner, engine.coordinator, engine.properties);
        watcher.start();
    }

    @AfterEach
    void tearDown() {
        watcher.stop();
        engine.close();
    }

    private static void waitFor(BooleanSupplier condition, String description) throws InterruptedException {
        long deadline = System.currentTimeMillis() + TIMEOUT_MILLIS;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return;
            }
            Thread.sleep(50);
        }
        fail("Timed out waiting for " + description);
    }

    @Test
    void testCreatedFileIsIndexed() throws Exception {
        engine.write("hello.md", "# Hello\nworld");

        waitFor(() -> engine.store.exists("hello.md"), "hello.md to be indexed");
        assertEquals("Hello", engine.store.get("hello.md").orElseThrow().getTitle());
    }

    @Test
    void testModifiedFileIsReindexed() throws Exception {
        engine.write("note.md", "original");
        waitFor(() -> engine.store.exists("note.md"), "note.md to be indexed");

        engine.write("note.md", "rewritten");

        waitFor(() -> !engine.store.search("rewritten", 10).isEmpty(), "new content to be searchable");
        assertTrue(engine.store.search("original", 10).isEmpty());
    }

    @Test
    void testDeletedFileIsRemoved() throws Exception {
        engine.write("gone.md", "temporary");
        waitFor(() -> engine.store.exists("gone.md"), "gone.md to be indexed");

        engine.delete("gone.md");

        waitFor(() -> !engine.store.exists("gone.md"), "gone.md to be removed");
    }

    @Test
    void testFilesInNewDirectoriesAreIndexed() throws Exception {
        Files.createDirectories(engine.workspace.resolve("projects/deep"));
        engine.write("projects/deep/plan.md", "plan");

        waitFor(() -> engine.store.exists("projects/deep/plan.md"), "nested file to be indexed");
    }

    @Test
    void testIgnoredFilesAreNotIndexed() throws Exception {
        engine.write("notes.txt", "plain text");
        engine.write("visible.md", "markdown");

        waitFor(() -> engine.store.exists("visible.md"), "visible.md to be indexed");
        engine.awaitIdle();
        assertEquals(1, engine.store.countDocuments());
    }

    @Test
    void testStopIsIdempotent() {
        assertTrue(watcher.isRunning());
        watcher.stop();
        watcher.stop();
        assertFalse(watcher.isRunning());
    }
}
