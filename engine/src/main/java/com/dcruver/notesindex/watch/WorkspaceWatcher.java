package com.dcruver.notesindex.watch;

import com.dcruver.notesindex.app.NotesIndexProperties;
import com.dcruver.notesindex.coordinator.IndexCoordinator;
import com.dcruver.notesindex.coordinator.WorkspaceScanner;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * Watches the workspace tree and forwards file events to the coordinator.
 * New directories are registered as they appear; a lost-events overflow
 * triggers a reconcile.
 */
@Component
@Slf4j
public class WorkspaceWatcher {

    private final WorkspaceScanner scanner;
    private final IndexCoordinator coordinator;
    private final NotesIndexProperties properties;

    private final Map<WatchKey, Path> watchedDirectories = new ConcurrentHashMap<>();
    private WatchService watchService;
    private Thread thread;
    private volatile boolean running;

    public WorkspaceWatcher(WorkspaceScanner scanner, IndexCoordinator coordinator, NotesIndexProperties properties) {
        this.scanner = scanner;
        this.coordinator = coordinator;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.getWatch().isEnabled()) {
            log.info("Workspace watching disabled");
            return;
        }
        try {
            start();
        } catch (IOException e) {
            log.error("Could not watch workspace {}: {}", scanner.getRoot(), e.getMessage(), e);
        }
    }

    public synchronized void start() throws IOException {
        if (running) {
            return;
        }
        watchService = FileSystems.getDefault().newWatchService();
        registerTree(scanner.getRoot());
        running = true;

        thread = new Thread(this::pollEvents, "workspace-watcher");
        thread.setDaemon(true);
        thread.start();
        log.info("Watching {} ({} directories)", scanner.getRoot(), watchedDirectories.size());
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        try {
            watchService.close();
        } catch (IOException e) {
            log.warn("Error closing watch service: {}", e.getMessage());
        }
        if (thread != null) {
            thread.interrupt();
            thread = null;
        }
        watchedDirectories.clear();
        log.info("Stopped watching {}", scanner.getRoot());
    }

    public boolean isRunning() {
        return running;
    }

    private void pollEvents() {
        while (running) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException | ClosedWatchServiceException e) {
                return;
            }

            Path directory = watchedDirectories.get(key);
            for (WatchEvent<?> event : key.pollEvents()) {
                try {
                    handle(directory, event);
                } catch (RuntimeException e) {
                    log.error("Failed to handle {} event in {}: {}", event.kind().name(), directory, e.getMessage(), e);
                }
            }

            if (!key.reset()) {
                watchedDirectories.remove(key);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void handle(Path directory, WatchEvent<?> event) {
        if (event.kind() == OVERFLOW) {
            log.warn("Watch events overflowed, reconciling index");
            reconcile();
            return;
        }
        if (directory == null) {
            return;
        }

        Path path = directory.resolve(((WatchEvent<Path>) event).context());
        if (event.kind() == ENTRY_DELETE) {
            coordinator.onPathDeleted(path);
            return;
        }

        if (Files.isDirectory(path)) {
            if (event.kind() == ENTRY_CREATE && !scanner.isExcludedDirectory(path)) {
                // Files may land in a new directory before it is registered
                registerTree(path);
                forwardExisting(path);
            }
            return;
        }
        coordinator.onFileChanged(path);
    }

    private void registerTree(Path start) {
        try {
            Files.walkFileTree(start, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                    if (scanner.isExcludedDirectory(dir)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    WatchKey key = dir.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
                    watchedDirectories.put(key, dir);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.warn("Cannot watch {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("Failed to register {} for watching: {}", start, e.getMessage());
        }
    }

    private void forwardExisting(Path directory) {
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.filter(Files::isRegularFile).forEach(coordinator::onFileChanged);
        } catch (IOException e) {
            log.warn("Failed to list new directory {}: {}", directory, e.getMessage());
        }
    }

    private void reconcile() {
        try {
            coordinator.reconcile();
        } catch (IllegalStateException e) {
            log.info("Skipping reconcile: {}", e.getMessage());
        } catch (IOException e) {
            log.error("Reconcile after overflow failed: {}", e.getMessage(), e);
        }
    }
}
