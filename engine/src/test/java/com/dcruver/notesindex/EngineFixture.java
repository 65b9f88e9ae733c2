package com.dcruver.notesindex;

import com.dcruver.notesindex.app.DataSourceConfig;
import com.dcruver.notesindex.app.ExecutorConfig;
import com.dcruver.notesindex.app.NotesIndexProperties;
import com.dcruver.notesindex.coordinator.IndexCoordinator;
import com.dcruver.notesindex.coordinator.WorkspaceScanner;
import com.dcruver.notesindex.graph.LinkGraph;
import com.dcruver.notesindex.io.MarkdownDocumentParser;
import com.dcruver.notesindex.service.KnowledgeBaseService;
import com.dcruver.notesindex.storage.IndexStore;
import com.dcruver.notesindex.tags.TagHierarchyManager;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * A fully wired engine over a temporary workspace, built without a Spring context.
 */
public class EngineFixture implements AutoCloseable {

    public final Path workspace;
    public final NotesIndexProperties properties;
    public final IndexStore store;
    public final MarkdownDocumentParser parser;
    public final LinkGraph linkGraph;
    public final TagHierarchyManager tagHierarchy;
    public final WorkspaceScanner scanner;
    public final IndexCoordinator coordinator;
    public final KnowledgeBaseService service;

    private final ThreadPoolTaskExecutor workers;
    private final ThreadPoolTaskScheduler scheduler;

    private EngineFixture(Path workspace, NotesIndexProperties properties) throws IOException {
        this.workspace = workspace;
        this.properties = properties;

        DataSource dataSource = DataSourceConfig.sqliteDataSource(
            properties.dataDirectory().resolve(DataSourceConfig.DATABASE_FILE), properties.getStorage());
        this.store = new IndexStore(dataSource, properties);
        this.store.init();

        this.parser = new MarkdownDocumentParser();
        this.linkGraph = new LinkGraph(store, properties);
        this.tagHierarchy = new TagHierarchyManager(store);
        this.scanner = new WorkspaceScanner(properties);
        this.workers = ExecutorConfig.workerExecutor(properties.getWorkers());
        this.scheduler = ExecutorConfig.debounceScheduler();
        this.coordinator = new IndexCoordinator(scanner, parser, store, linkGraph, tagHierarchy,
            workers, scheduler, properties);
        this.service = new KnowledgeBaseService(store, linkGraph, tagHierarchy, coordinator, parser, properties);
    }

    /**
     * Engine over {@code root/workspace} with its database in {@code root/data}.
     */
    public static EngineFixture create(Path root) throws IOException {
        return create(root, properties(root));
    }

    public static EngineFixture create(Path root, NotesIndexProperties properties) throws IOException {
        Files.createDirectories(properties.workspaceRoot());
        return new EngineFixture(properties.workspaceRoot(), properties);
    }

    public static NotesIndexProperties properties(Path root) {
        NotesIndexProperties properties = new NotesIndexProperties();
        properties.setWorkspace(root.resolve("workspace").toString());
        properties.setDataDir(root.resolve("data").toString());
        properties.getWatch().setDebounce(Duration.ofMillis(50));
        properties.getStorage().setRetryBackoff(Duration.ofMillis(10));
        return properties;
    }

    public Path write(String id, String content) throws IOException {
        Path file = workspace.resolve(id);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    public void delete(String id) throws IOException {
        Files.deleteIfExists(workspace.resolve(id));
    }

    /**
     * Write a file and index it synchronously.
     */
    public void index(String id, String content) throws IOException {
        write(id, content);
        coordinator.indexNow(id);
    }

    public void awaitIdle() throws InterruptedException {
        if (!coordinator.awaitIdle(Duration.ofSeconds(10))) {
            throw new AssertionError("Coordinator did not become idle");
        }
    }

    @Override
    public void close() {
        coordinator.shutdown();
        scheduler.shutdown();
        workers.shutdown();
    }
}
