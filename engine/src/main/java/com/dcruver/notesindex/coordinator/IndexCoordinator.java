package com.dcruver.notesindex.coordinator;

import com.dcruver.notesindex.app.NotesIndexProperties;
import com.dcruver.notesindex.domain.BacklinkEntry;
import com.dcruver.notesindex.domain.Document;
import com.dcruver.notesindex.domain.DocumentStatus;
import com.dcruver.notesindex.domain.Link;
import com.dcruver.notesindex.domain.PathState;
import com.dcruver.notesindex.domain.RebuildReport;
import com.dcruver.notesindex.graph.LinkGraph;
import com.dcruver.notesindex.io.Frontmatter;
import com.dcruver.notesindex.io.MarkdownDocumentParser;
import com.dcruver.notesindex.io.ParsedDocument;
import com.dcruver.notesindex.storage.FileStamp;
import com.dcruver.notesindex.storage.IndexStore;
import com.dcruver.notesindex.storage.IndexedDocument;
import com.dcruver.notesindex.tags.TagHierarchyManager;
import jakarta.annotation.PreDestroy;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps the index in step with the workspace.
 *
 * File events are debounced per document id and handed to a worker pool. For
 * any id there is at most one job running and one rerun pending; jobs for
 * different ids run in parallel. A job reads the file, parses it, resolves its
 * links, registers its tags and writes everything to the index, or removes
 * the document when its file is gone.
 */
@Component
@Slf4j
public class IndexCoordinator {

    public enum JobResult {
        INDEXED,
        DEGRADED,
        REMOVED,
        MISSING
    }

    private final WorkspaceScanner scanner;
    private final MarkdownDocumentParser parser;
    private final IndexStore store;
    private final LinkGraph linkGraph;
    private final TagHierarchyManager tagHierarchy;
    private final ThreadPoolTaskExecutor workers;
    private final ThreadPoolTaskScheduler debounceScheduler;
    private final NotesIndexProperties properties;

    private final Map<String, JobSlot> slots = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> documentLocks = new ConcurrentHashMap<>();
    private final Map<String, PathState> states = new ConcurrentHashMap<>();
    private final ReentrantLock batchLock = new ReentrantLock();
    private final AtomicBoolean cancelRequested = new AtomicBoolean();

    public IndexCoordinator(WorkspaceScanner scanner,
                            MarkdownDocumentParser parser,
                            IndexStore store,
                            LinkGraph linkGraph,
                            TagHierarchyManager tagHierarchy,
                            @Qualifier("indexWorkerExecutor") ThreadPoolTaskExecutor workers,
                            @Qualifier("indexDebounceScheduler") ThreadPoolTaskScheduler debounceScheduler,
                            NotesIndexProperties properties) {
        this.scanner = scanner;
        this.parser = parser;
        this.store = store;
        this.linkGraph = linkGraph;
        this.tagHierarchy = tagHierarchy;
        this.workers = workers;
        this.debounceScheduler = debounceScheduler;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.getWatch().isReconcileOnStartup()) {
            return;
        }
        workers.execute(() -> {
            try {
                reconcile();
            } catch (IOException | RuntimeException e) {
                log.error("Startup reconcile failed: {}", e.getMessage(), e);
            }
        });
    }

    @PreDestroy
    public void shutdown() {
        for (JobSlot slot : slots.values()) {
            synchronized (slot) {
                if (slot.timer != null) {
                    slot.timer.cancel(false);
                    slot.timer = null;
                }
            }
        }
    }

    // ------------------------------------------------------------------
    // Events
    // ------------------------------------------------------------------

    /**
     * A file was created or modified.
     */
    public void onFileChanged(Path file) {
        if (!scanner.isIndexable(file)) {
            return;
        }
        schedule(scanner.documentId(file));
    }

    /**
     * A file or directory was deleted. For a directory every document below it
     * is scheduled; each job removes its document if the file is really gone.
     */
    public void onPathDeleted(Path path) {
        String id = scanner.documentId(path);
        if (id.isEmpty() || id.startsWith("..")) {
            return;
        }
        if (store.exists(id)) {
            schedule(id);
        }
        for (String child : store.idsWithPrefix(id + "/")) {
            schedule(child);
        }
    }

    public PathState stateOf(String documentId) {
        return states.getOrDefault(documentId, PathState.UNSEEN);
    }

    private void schedule(String id) {
        states.computeIfPresent(id, (k, state) -> state == PathState.INDEXED ? PathState.MODIFIED : state);

        // compute keeps this atomic with slot removal
        slots.compute(id, (k, existing) -> {
            JobSlot slot = existing != null ? existing : new JobSlot();
            synchronized (slot) {
                if (slot.timer != null) {
                    slot.timer.cancel(false);
                }
                long generation = ++slot.generation;
                Instant due = Instant.now().plus(properties.getWatch().getDebounce());
                slot.timer = debounceScheduler.schedule(() -> dispatch(id, slot, generation), due);
            }
            return slot;
        });
    }

    private void dispatch(String id, JobSlot slot, long generation) {
        synchronized (slot) {
            if (generation != slot.generation) {
                return;
            }
            slot.timer = null;
            if (slot.running) {
                slot.rerun = true;
                return;
            }
            slot.running = true;
        }
        workers.execute(() -> runJob(id, slot));
    }

    private void runJob(String id, JobSlot slot) {
        try {
            indexNow(id);
        } catch (RuntimeException e) {
            log.error("Failed to index {}: {}", id, e.getMessage(), e);
        } finally {
            if (finishJob(id, slot)) {
                workers.execute(() -> runJob(id, slot));
            }
        }
    }

    /**
     * Mark the job finished, or claim the pending rerun. The slot of a
     * document that left the index is dropped once nothing is pending.
     *
     * @return true when the job must run again
     */
    private boolean finishJob(String id, JobSlot slot) {
        boolean gone = isGone(id);
        AtomicBoolean again = new AtomicBoolean();
        slots.compute(id, (k, current) -> {
            synchronized (slot) {
                again.set(slot.rerun);
                slot.rerun = false;
                slot.running = again.get();
                if (current == slot && gone && slot.timer == null && !slot.running) {
                    return null;
                }
            }
            return current;
        });
        return again.get();
    }

    private boolean isGone(String id) {
        PathState state = states.get(id);
        return state == null || state == PathState.REMOVED;
    }

    /**
     * Drop the job slot of a document that is not in the index, unless a
     * job for it is pending or running.
     */
    private void forgetSlot(String id) {
        slots.computeIfPresent(id, (k, slot) -> {
            synchronized (slot) {
                return slot.timer != null || slot.running ? slot : null;
            }
        });
    }

    /**
     * Wait until no debounce timer is pending and no job is running.
     *
     * @return false when the timeout elapsed first
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (isIdle()) {
                return true;
            }
            Thread.sleep(20);
        }
        return isIdle();
    }

    int jobSlotCount() {
        return slots.size();
    }

    int documentLockCount() {
        return documentLocks.size();
    }

    public boolean isIdle() {
        for (JobSlot slot : slots.values()) {
            synchronized (slot) {
                if (slot.timer != null || slot.running) {
                    return false;
                }
            }
        }
        return true;
    }

    // ------------------------------------------------------------------
    // Pipeline
    // ------------------------------------------------------------------

    /**
     * Bring one document in line with its file right away. When its title or
     * aliases changed, or it left the index, documents linking to it and
     * documents whose links now resolve differently are re-indexed.
     */
    public JobResult indexNow(String documentId) {
        Optional<NamespaceEntry> before = namespaceEntry(documentId);
        List<String> linkedFrom = backlinkSources(documentId);
        JobResult result = process(documentId);
        if (result == JobResult.REMOVED) {
            relink(Set.of());
            forgetSlot(documentId);
        } else if (result == JobResult.MISSING) {
            forgetSlot(documentId);
        } else if (!before.equals(namespaceEntry(documentId))) {
            relink(linkedFrom);
        }
        return result;
    }

    private List<String> backlinkSources(String documentId) {
        List<String> sources = new ArrayList<>();
        for (BacklinkEntry entry : store.backlinks(documentId)) {
            if (!entry.getSourceId().equals(documentId) && !sources.contains(entry.getSourceId())) {
                sources.add(entry.getSourceId());
            }
        }
        return sources;
    }

    /**
     * Index or remove a single document without relinking other documents.
     */
    JobResult process(String documentId) {
        ReentrantLock lock = lockDocument(documentId);
        try {
            Path file = scanner.resolve(documentId);
            if (!Files.isRegularFile(file) || !scanner.isIndexable(file)) {
                boolean existed = store.delete(documentId);
                // threads waiting on this lock retry with a fresh one
                documentLocks.remove(documentId, lock);
                if (existed) {
                    states.put(documentId, PathState.REMOVED);
                    log.info("Removed {} from index", documentId);
                    return JobResult.REMOVED;
                }
                states.remove(documentId);
                return JobResult.MISSING;
            }

            Document document = indexFile(documentId, file);
            states.put(documentId, PathState.INDEXED);
            return document.isDegraded() ? JobResult.DEGRADED : JobResult.INDEXED;
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockDocument(String documentId) {
        while (true) {
            ReentrantLock lock = documentLocks.computeIfAbsent(documentId, k -> new ReentrantLock());
            lock.lock();
            if (documentLocks.get(documentId) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }

    private Document indexFile(String id, Path file) {
        byte[] bytes;
        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(file, BasicFileAttributes.class);
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            log.warn("Could not read {}, indexing as degraded: {}", id, e.getMessage());
            return writeDegraded(id, file, "Unreadable file: " + e.getMessage());
        }

        String content = new String(bytes, StandardCharsets.UTF_8);
        ParsedDocument parsed;
        try {
            parsed = parser.parse(content);
        } catch (RuntimeException e) {
            log.warn("Could not parse {}, indexing as degraded: {}", id, e.getMessage());
            return writeDegraded(id, file, "Parse failure: " + e.getMessage());
        }

        Frontmatter frontmatter = parsed.getFrontmatter();
        Document document = Document.builder()
            .id(id)
            .title(parsed.getTitle() != null ? parsed.getTitle() : fileStem(id))
            .content(content)
            .body(parsed.getBody())
            .frontmatter(frontmatter.getFields())
            .date(frontmatter.getDate())
            .tags(parsed.getTags())
            .aliases(frontmatter.getAliases())
            .status(DocumentStatus.fromFrontmatter(frontmatter.getStatus()))
            .wordCount(parsed.getWordCount())
            .readingTimeMinutes(parsed.getReadingTimeMinutes())
            .modifiedAt(attributes.lastModifiedTime().toInstant())
            .fileSize(attributes.size())
            .contentHash(DigestUtils.sha256Hex(bytes))
            .degraded(parsed.hasFrontmatterProblem())
            .parseProblem(parsed.getFrontmatterProblem())
            .build();

        if (parsed.hasFrontmatterProblem()) {
            log.warn("Malformed frontmatter in {}: {}", id, parsed.getFrontmatterProblem());
        }

        List<Link> links = linkGraph.resolveLinks(document, parsed.getLinks());
        List<String> tags = tagHierarchy.canonicalize(parsed.getTags());
        boolean created = store.upsert(IndexedDocument.builder()
            .document(document)
            .links(links)
            .tags(tags)
            .build());

        log.debug("{} {} ({} words, {} links, {} tags)",
            created ? "Indexed" : "Re-indexed", id, document.getWordCount(), links.size(), tags.size());
        return document;
    }

    private Document writeDegraded(String id, Path file, String problem) {
        Instant modifiedAt = Instant.now();
        long size = 0L;
        try {
            modifiedAt = Files.getLastModifiedTime(file).toInstant();
            size = Files.size(file);
        } catch (IOException e) {
            log.debug("No file attributes for {}: {}", id, e.getMessage());
        }

        Document document = Document.builder()
            .id(id)
            .title(fileStem(id))
            .content("")
            .body("")
            .frontmatter(new LinkedHashMap<>())
            .tags(List.of())
            .aliases(List.of())
            .status(DocumentStatus.DRAFT)
            .modifiedAt(modifiedAt)
            .fileSize(size)
            .contentHash("")
            .degraded(true)
            .parseProblem(problem)
            .build();
        store.upsert(IndexedDocument.builder()
            .document(document)
            .links(List.of())
            .tags(List.of())
            .build());
        return document;
    }

    /**
     * Re-index every document holding a link that the current namespace
     * resolves differently from the stored edge, plus {@code alsoSources}.
     *
     * @return number of documents re-indexed
     */
    int relink(Collection<String> alsoSources) {
        Set<String> sources = new TreeSet<>(linkGraph.staleSources());
        sources.addAll(alsoSources);
        int relinked = 0;
        for (String source : sources) {
            try {
                process(source);
                relinked++;
            } catch (RuntimeException e) {
                log.warn("Failed to relink {}: {}", source, e.getMessage());
            }
        }
        if (relinked > 0) {
            log.info("Relinked {} documents whose links resolve differently", relinked);
        }
        return relinked;
    }

    // ------------------------------------------------------------------
    // Batches
    // ------------------------------------------------------------------

    /**
     * Re-index every document in the workspace, drop index entries whose file
     * is gone, then relink. Stops between documents when cancelled.
     *
     * @throws IllegalArgumentException if {@code workspace} is not the configured workspace
     * @throws IllegalStateException if another rebuild or reconcile is running
     */
    public RebuildReport rebuildIndex(Path workspace) throws IOException {
        Path requested = workspace.toAbsolutePath().normalize();
        if (!requested.equals(scanner.getRoot())) {
            throw new IllegalArgumentException("Workspace " + requested
                + " is not the configured workspace " + scanner.getRoot());
        }

        log.info("Rebuilding index for {}", requested);
        List<Path> files = scanner.scan();
        List<String> ids = new ArrayList<>();
        for (Path file : files) {
            ids.add(scanner.documentId(file));
        }
        return runBatch("rebuild", ids, new LinkedHashSet<>(ids));
    }

    /**
     * Re-index files changed since they were last indexed and drop documents
     * whose files have disappeared.
     */
    public RebuildReport reconcile() throws IOException {
        Map<String, FileStamp> stamps = store.fileStamps();
        List<String> changed = new ArrayList<>();
        Set<String> present = new LinkedHashSet<>();
        for (Path file : scanner.scan()) {
            String id = scanner.documentId(file);
            present.add(id);
            FileStamp stamp = stamps.get(id);
            if (stamp == null || isStale(stamp, file)) {
                changed.add(id);
            } else {
                states.putIfAbsent(id, PathState.INDEXED);
            }
        }
        log.info("Reconciling index: {} of {} files changed", changed.size(), stamps.size());
        return runBatch("reconcile", changed, present);
    }

    /**
     * Ask a running rebuild or reconcile to stop after the current document.
     *
     * @return true when a batch was running
     */
    public boolean cancelRebuild() {
        if (!batchLock.isLocked()) {
            return false;
        }
        cancelRequested.set(true);
        log.info("Rebuild cancellation requested");
        return true;
    }

    /**
     * Index {@code ids}, then remove every indexed document not in {@code present}.
     */
    private RebuildReport runBatch(String name, List<String> ids, Set<String> present) {
        if (!batchLock.tryLock()) {
            throw new IllegalStateException("Another rebuild or reconcile is already running");
        }
        try {
            long started = System.nanoTime();
            Map<String, String> failures = new LinkedHashMap<>();
            int indexed = 0;
            int degraded = 0;
            int removed = 0;
            int relinked = 0;
            boolean cancelled = false;

            for (String id : ids) {
                if (cancelRequested.get()) {
                    cancelled = true;
                    break;
                }
                try {
                    JobResult result = process(id);
                    if (result == JobResult.INDEXED) {
                        indexed++;
                    } else if (result == JobResult.DEGRADED) {
                        indexed++;
                        degraded++;
                        failures.put(id, store.get(id).map(Document::getParseProblem).orElse("degraded"));
                    } else if (result == JobResult.REMOVED) {
                        removed++;
                    }
                } catch (RuntimeException e) {
                    log.warn("Failed to index {} during {}: {}", id, name, e.getMessage());
                    failures.put(id, e.getMessage());
                }
            }

            if (!cancelled) {
                for (String id : store.allIds()) {
                    if (present.contains(id)) {
                        continue;
                    }
                    if (cancelRequested.get()) {
                        cancelled = true;
                        break;
                    }
                    try {
                        if (process(id) == JobResult.REMOVED) {
                            removed++;
                        }
                    } catch (RuntimeException e) {
                        log.warn("Failed to remove {} during {}: {}", id, name, e.getMessage());
                        failures.put(id, e.getMessage());
                    }
                }
            }

            if (!cancelled) {
                relinked = relink(Set.of());
            }

            RebuildReport report = RebuildReport.builder()
                .scanned(present.size())
                .indexed(indexed)
                .degraded(degraded)
                .removed(removed)
                .relinked(relinked)
                .cancelled(cancelled)
                .failures(failures)
                .elapsed(Duration.ofNanos(System.nanoTime() - started))
                .build();
            log.info("Finished {}: {} indexed ({} degraded), {} removed, {} relinked, {} failures{} in {} ms",
                name, indexed, degraded, removed, relinked, failures.size(),
                cancelled ? ", cancelled" : "", report.getElapsed().toMillis());
            return report;
        } finally {
            cancelRequested.set(false);
            batchLock.unlock();
        }
    }

    private static boolean isStale(FileStamp stamp, Path file) {
        try {
            return Files.getLastModifiedTime(file).toMillis() != stamp.getModifiedAt().toEpochMilli()
                || Files.size(file) != stamp.getFileSize();
        } catch (IOException e) {
            return true;
        }
    }

    private Optional<NamespaceEntry> namespaceEntry(String documentId) {
        return store.get(documentId).map(d -> new NamespaceEntry(d.getTitle(), d.getAliases()));
    }

    private static String fileStem(String id) {
        String name = id.substring(id.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * Title and aliases, the parts of a document other links resolve against.
     */
    @Data
    private static class NamespaceEntry {
        private final String title;
        private final List<String> aliases;
    }

    private static class JobSlot {
        private ScheduledFuture<?> timer;
        private boolean running;
        private boolean rerun;
        private long generation;    // bumped on every reschedule; stale timers do nothing
    }
}
