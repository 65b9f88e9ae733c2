package com.dcruver.notesindex.storage;

import com.dcruver.notesindex.app.NotesIndexProperties;
import com.dcruver.notesindex.domain.BacklinkEntry;
import com.dcruver.notesindex.domain.Document;
import com.dcruver.notesindex.domain.DocumentFilter;
import com.dcruver.notesindex.domain.DocumentStatus;
import com.dcruver.notesindex.domain.Link;
import com.dcruver.notesindex.domain.LinkKind;
import com.dcruver.notesindex.domain.LinkTarget;
import com.dcruver.notesindex.domain.RankedResult;
import com.dcruver.notesindex.tags.TagPath;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * SQLite-backed index of documents, full-text entries, links and tags.
 *
 * This is the only component that touches the database. Every write runs in
 * one transaction under a write lock acquired with a bounded wait, so a
 * reader sees either the old or the new state of a document, never a mix.
 */
@Component
@Slf4j
public class IndexStore {

    public static final int SCHEMA_VERSION = 1;

    private static final String EXPLICIT_KINDS = "('REFERENCE', 'EMBED')";
    private static final Pattern QUERY_TOKEN_SEPARATOR = Pattern.compile("\\s+");
    private static final Pattern HAS_WORD_CHARACTER = Pattern.compile(".*[\\p{L}\\p{N}].*");
    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final NotesIndexProperties.Storage storageProperties;
    private final NotesIndexProperties.Search searchProperties;
    private final ReentrantLock writeLock = new ReentrantLock();

    public IndexStore(DataSource dataSource, NotesIndexProperties properties) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.jdbcTemplate.setQueryTimeout((int) Math.max(1, properties.getStorage().getQueryTimeout().toSeconds()));
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.storageProperties = properties.getStorage();
        this.searchProperties = properties.getSearch();
    }

    @PostConstruct
    public void init() {
        write("schema initialisation", status -> {
            jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS documents (
                    id TEXT PRIMARY KEY,
                    title TEXT NOT NULL,
                    content TEXT NOT NULL DEFAULT '',
                    body TEXT NOT NULL DEFAULT '',
                    frontmatter TEXT NOT NULL DEFAULT '{}',
                    doc_date TEXT,
                    tags TEXT NOT NULL DEFAULT '[]',
                    aliases TEXT NOT NULL DEFAULT '[]',
                    status TEXT NOT NULL DEFAULT 'DRAFT',
                    word_count INTEGER NOT NULL DEFAULT 0,
                    reading_time INTEGER NOT NULL DEFAULT 0,
                    modified_at INTEGER NOT NULL DEFAULT 0,
                    file_size INTEGER NOT NULL DEFAULT 0,
                    content_hash TEXT NOT NULL DEFAULT '',
                    degraded INTEGER NOT NULL DEFAULT 0,
                    parse_problem TEXT
                )
                """);

            jdbcTemplate.execute("""
                CREATE VIRTUAL TABLE IF NOT EXISTS documents_fts USING fts5(
                    document_id UNINDEXED,
                    title,
                    body,
                    tags,
                    tokenize = 'porter unicode61 remove_diacritics 1'
                )
                """);

            jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS links (
                    source_id TEXT NOT NULL,
                    target_key TEXT NOT NULL,
                    target_ref TEXT NOT NULL,
                    target_id TEXT,
                    kind TEXT NOT NULL,
                    heading TEXT,
                    context TEXT,
                    line_number INTEGER NOT NULL DEFAULT 0,
                    occurrence_count INTEGER NOT NULL DEFAULT 1,
                    PRIMARY KEY (source_id, target_key, kind)
                )
                """);
            jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_links_target ON links(target_id)");

            jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS tags (
                    name TEXT PRIMARY KEY,
                    parent TEXT,
                    depth INTEGER NOT NULL
                )
                """);
            jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_tags_parent ON tags(parent)");

            jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS document_tags (
                    document_id TEXT NOT NULL,
                    tag_name TEXT NOT NULL,
                    PRIMARY KEY (document_id, tag_name)
                )
                """);
            jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_document_tags_tag ON document_tags(tag_name)");

            jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS schema_info (
                    key TEXT PRIMARY KEY,
                    value TEXT NOT NULL
                )
                """);
            jdbcTemplate.update("INSERT OR IGNORE INTO schema_info (key, value) VALUES ('version', ?)",
                String.valueOf(SCHEMA_VERSION));
            return null;
        });

        log.info("Initialized index store ({} documents)", countDocuments());
    }

    // ------------------------------------------------------------------
    // Documents
    // ------------------------------------------------------------------

    public Optional<Document> get(String id) {
        List<Document> results = read("get " + id, status -> jdbcTemplate.query(
            "SELECT * FROM documents WHERE id = ?", new DocumentRowMapper(), id));
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public boolean exists(String id) {
        Integer count = read("exists " + id, status -> jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM documents WHERE id = ?", Integer.class, id));
        return count != null && count > 0;
    }

    public int countDocuments() {
        Integer count = read("count documents", status ->
            jdbcTemplate.queryForObject("SELECT COUNT(*) FROM documents", Integer.class));
        return count != null ? count : 0;
    }

    /**
     * Replace a document's row, full-text entry, outgoing explicit links and tag
     * associations in one transaction.
     *
     * @return true when the document did not exist before
     */
    public boolean upsert(IndexedDocument indexed) {
        Document doc = indexed.getDocument();
        String frontmatterJson = toJson(doc.getFrontmatter() != null ? doc.getFrontmatter() : Map.of());
        String tagsJson = toJson(doc.getTags() != null ? doc.getTags() : List.of());
        String aliasesJson = toJson(doc.getAliases() != null ? doc.getAliases() : List.of());
        List<String> tags = indexed.getTags() != null ? indexed.getTags() : List.of();
        List<Link> links = indexed.getLinks() != null ? indexed.getLinks() : List.of();

        return write("upsert " + doc.getId(), status -> {
            Integer before = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM documents WHERE id = ?", Integer.class, doc.getId());

            jdbcTemplate.update("""
                INSERT INTO documents (id, title, content, body, frontmatter, doc_date, tags, aliases, status,
                    word_count, reading_time, modified_at, file_size, content_hash, degraded, parse_problem)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT(id) DO UPDATE SET
                    title = excluded.title,
                    content = excluded.content,
                    body = excluded.body,
                    frontmatter = excluded.frontmatter,
                    doc_date = excluded.doc_date,
                    tags = excluded.tags,
                    aliases = excluded.aliases,
                    status = excluded.status,
                    word_count = excluded.word_count,
                    reading_time = excluded.reading_time,
                    modified_at = excluded.modified_at,
                    file_size = excluded.file_size,
                    content_hash = excluded.content_hash,
                    degraded = excluded.degraded,
                    parse_problem = excluded.parse_problem
                """,
                doc.getId(),
                doc.getTitle(),
                nvl(doc.getContent()),
                nvl(doc.getBody()),
                frontmatterJson,
                doc.getDate() != null ? doc.getDate().toString() : null,
                tagsJson,
                aliasesJson,
                (doc.getStatus() != null ? doc.getStatus() : DocumentStatus.DRAFT).name(),
                doc.getWordCount(),
                doc.getReadingTimeMinutes(),
                doc.getModifiedAt() != null ? doc.getModifiedAt().toEpochMilli() : 0L,
                doc.getFileSize(),
                nvl(doc.getContentHash()),
                doc.isDegraded() ? 1 : 0,
                doc.getParseProblem());

            jdbcTemplate.update("DELETE FROM documents_fts WHERE document_id = ?", doc.getId());
            jdbcTemplate.update("INSERT INTO documents_fts (document_id, title, body, tags) VALUES (?, ?, ?, ?)",
                doc.getId(), doc.getTitle(), nvl(doc.getBody()), ftsTagText(doc.getTags()));

            jdbcTemplate.update("DELETE FROM links WHERE source_id = ? AND kind IN " + EXPLICIT_KINDS, doc.getId());
            for (Link link : links) {
                jdbcTemplate.update("""
                    INSERT INTO links (source_id, target_key, target_ref, target_id, kind, heading, context,
                        line_number, occurrence_count)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """,
                    doc.getId(), link.getTargetKey(), link.getTargetRef(), link.getTargetId(),
                    link.getKind().name(), link.getHeading(), link.getContext(),
                    link.getLineNumber(), link.getOccurrenceCount());
            }

            jdbcTemplate.update("DELETE FROM document_tags WHERE document_id = ?", doc.getId());
            insertTags(tags);
            for (String tag : tags) {
                jdbcTemplate.update("INSERT OR IGNORE INTO document_tags (document_id, tag_name) VALUES (?, ?)",
                    doc.getId(), tag);
            }

            log.debug("Indexed {} ({} links, {} tags)", doc.getId(), links.size(), tags.size());
            return before == null || before == 0;
        });
    }

    /**
     * Remove a document with its full-text entry, outgoing links and tag
     * associations. Resolved links pointing at it become broken links that keep
     * their original target text.
     *
     * @return true when the document existed
     */
    public boolean delete(String id) {
        return write("delete " + id, status -> {
            int removed = jdbcTemplate.update("DELETE FROM documents WHERE id = ?", id);
            jdbcTemplate.update("DELETE FROM documents_fts WHERE document_id = ?", id);
            jdbcTemplate.update("DELETE FROM links WHERE source_id = ?", id);
            jdbcTemplate.update("DELETE FROM document_tags WHERE document_id = ?", id);
            int detached = detachIncomingLinks(id);

            if (removed > 0) {
                log.debug("Removed {} from index ({} incoming links now broken)", id, detached);
            }
            return removed > 0;
        });
    }

    private int detachIncomingLinks(String targetId) {
        List<Link> incoming = jdbcTemplate.query(
            "SELECT * FROM links WHERE target_id = ?", new LinkRowMapper(), targetId);

        for (Link link : incoming) {
            String brokenKey = Link.targetKey(null, link.getTargetRef());
            List<Integer> existing = jdbcTemplate.queryForList(
                "SELECT occurrence_count FROM links WHERE source_id = ? AND target_key = ? AND kind = ?",
                Integer.class, link.getSourceId(), brokenKey, link.getKind().name());

            if (existing.isEmpty()) {
                jdbcTemplate.update(
                    "UPDATE links SET target_id = NULL, target_key = ? WHERE source_id = ? AND target_key = ? AND kind = ?",
                    brokenKey, link.getSourceId(), link.getTargetKey(), link.getKind().name());
            } else {
                jdbcTemplate.update(
                    "UPDATE links SET occurrence_count = occurrence_count + ? WHERE source_id = ? AND target_key = ? AND kind = ?",
                    link.getOccurrenceCount(), link.getSourceId(), brokenKey, link.getKind().name());
                jdbcTemplate.update(
                    "DELETE FROM links WHERE source_id = ? AND target_key = ? AND kind = ?",
                    link.getSourceId(), link.getTargetKey(), link.getKind().name());
            }
        }
        return incoming.size();
    }

    public List<Document> list(DocumentFilter filter) {
        DocumentFilter f = filter != null ? filter : DocumentFilter.ALL;
        StringBuilder sql = new StringBuilder("SELECT * FROM documents d WHERE 1 = 1");
        List<Object> args = new ArrayList<>();

        if (f.getPathPrefix() != null && !f.getPathPrefix().isEmpty()) {
            sql.append(" AND substr(d.id, 1, ?) = ?");
            args.add(f.getPathPrefix().length());
            args.add(f.getPathPrefix());
        }
        if (f.getTag() != null && !f.getTag().isBlank()) {
            // Associations include ancestors, so this also matches descendant tags
            sql.append(" AND EXISTS (SELECT 1 FROM document_tags dt WHERE dt.document_id = d.id AND dt.tag_name = ?)");
            args.add(TagPath.normalize(f.getTag()));
        }
        if (f.getStatus() != null) {
            sql.append(" AND d.status = ?");
            args.add(f.getStatus().name());
        }
        if (f.getDegraded() != null) {
            sql.append(" AND d.degraded = ?");
            args.add(f.getDegraded() ? 1 : 0);
        }
        if (f.getModifiedSince() != null) {
            sql.append(" AND d.modified_at >= ?");
            args.add(f.getModifiedSince().toEpochMilli());
        }
        sql.append(" ORDER BY d.id");
        if (f.getLimit() != null && f.getLimit() > 0) {
            sql.append(" LIMIT ?");
            args.add(f.getLimit());
            if (f.getOffset() != null && f.getOffset() > 0) {
                sql.append(" OFFSET ?");
                args.add(f.getOffset());
            }
        }

        return read("list documents", status ->
            jdbcTemplate.query(sql.toString(), new DocumentRowMapper(), args.toArray()));
    }

    public List<String> allIds() {
        return read("list ids", status ->
            jdbcTemplate.queryForList("SELECT id FROM documents ORDER BY id", String.class));
    }

    public List<String> idsWithPrefix(String prefix) {
        return read("list ids under " + prefix, status -> jdbcTemplate.queryForList(
            "SELECT id FROM documents WHERE substr(id, 1, ?) = ? ORDER BY id",
            String.class, prefix.length(), prefix));
    }

    public Map<String, FileStamp> fileStamps() {
        return read("load file stamps", status -> {
            Map<String, FileStamp> stamps = new HashMap<>();
            jdbcTemplate.query("SELECT id, modified_at, file_size, content_hash FROM documents", rs -> {
                stamps.put(rs.getString("id"), FileStamp.builder()
                    .modifiedAt(Instant.ofEpochMilli(rs.getLong("modified_at")))
                    .fileSize(rs.getLong("file_size"))
                    .contentHash(rs.getString("content_hash"))
                    .build());
            });
            return stamps;
        });
    }

    public List<LinkTarget> loadLinkTargets() {
        return read("load link targets", status -> jdbcTemplate.query(
            "SELECT id, title, aliases FROM documents ORDER BY id",
            (rs, rowNum) -> LinkTarget.builder()
                .id(rs.getString("id"))
                .title(rs.getString("title"))
                .aliases(fromJsonList(rs.getString("aliases")))
                .build()));
    }

    // ------------------------------------------------------------------
    // Full-text search
    // ------------------------------------------------------------------

    /**
     * Ranked full-text search over title, body and tags.
     * Every query word is matched literally; a trailing {@code *} makes it a prefix.
     */
    public List<RankedResult> search(String query, int limit) {
        String match = toMatchExpression(query);
        if (match.isEmpty() || limit <= 0) {
            return List.of();
        }

        return read("search", status -> jdbcTemplate.query("""
            SELECT documents_fts.document_id AS id,
                   d.title AS title,
                   bm25(documents_fts, 0.0, 10.0, 1.0, 5.0) AS bm25_rank,
                   snippet(documents_fts, -1, ?, ?, ?, ?) AS snippet
            FROM documents_fts
            JOIN documents d ON d.id = documents_fts.document_id
            WHERE documents_fts MATCH ?
            ORDER BY bm25_rank, d.id
            LIMIT ?
            """,
            (rs, rowNum) -> RankedResult.builder()
                .documentId(rs.getString("id"))
                .title(rs.getString("title"))
                .score(-rs.getDouble("bm25_rank"))
                .snippet(rs.getString("snippet"))
                .build(),
            searchProperties.getHighlightStart(),
            searchProperties.getHighlightEnd(),
            searchProperties.getEllipsis(),
            Math.min(64, Math.max(1, searchProperties.getSnippetTokens())),
            match,
            limit));
    }

    /**
     * Turn free text into an FTS5 expression of quoted terms joined by AND,
     * so user input can never be read as query syntax.
     */
    static String toMatchExpression(String query) {
        if (query == null || query.isBlank()) {
            return "";
        }
        List<String> terms = new ArrayList<>();
        for (String token : QUERY_TOKEN_SEPARATOR.split(query.trim())) {
            boolean prefix = token.endsWith("*");
            String term = token.replace("\"", "").replace("*", "");
            if (!HAS_WORD_CHARACTER.matcher(term).matches()) {
                continue;
            }
            terms.add("\"" + term + "\"" + (prefix ? "*" : ""));
        }
        return String.join(" ", terms);
    }

    // ------------------------------------------------------------------
    // Links
    // ------------------------------------------------------------------

    public List<Link> outgoingLinks(String sourceId) {
        return read("outgoing links of " + sourceId, status -> jdbcTemplate.query(
            "SELECT * FROM links WHERE source_id = ? AND kind IN " + EXPLICIT_KINDS + " ORDER BY line_number, target_key",
            new LinkRowMapper(), sourceId));
    }

    public List<BacklinkEntry> backlinks(String targetId) {
        return read("backlinks of " + targetId, status -> jdbcTemplate.query(
            "SELECT l.*, d.title AS source_title FROM links l JOIN documents d ON d.id = l.source_id"
                + " WHERE l.target_id = ? AND l.kind IN " + EXPLICIT_KINDS
                + " ORDER BY l.source_id, l.kind",
            (rs, rowNum) -> BacklinkEntry.builder()
                .sourceId(rs.getString("source_id"))
                .sourceTitle(rs.getString("source_title"))
                .kind(LinkKind.valueOf(rs.getString("kind")))
                .context(rs.getString("context"))
                .lineNumber(rs.getInt("line_number"))
                .occurrenceCount(rs.getInt("occurrence_count"))
                .build(),
            targetId));
    }

    public List<Link> brokenLinks() {
        return read("broken links", status -> jdbcTemplate.query(
            "SELECT * FROM links WHERE target_id IS NULL AND kind IN " + EXPLICIT_KINDS + " ORDER BY source_id, line_number",
            new LinkRowMapper()));
    }

    public List<Link> explicitLinks() {
        return read("explicit links", status -> jdbcTemplate.query(
            "SELECT * FROM links WHERE kind IN " + EXPLICIT_KINDS + " ORDER BY source_id, line_number",
            new LinkRowMapper()));
    }

    /**
     * Documents with no resolved incoming or outgoing explicit link.
     */
    public List<String> orphanIds() {
        return read("orphaned documents", status -> jdbcTemplate.queryForList("""
            SELECT d.id FROM documents d
            WHERE NOT EXISTS (SELECT 1 FROM links o WHERE o.source_id = d.id AND o.target_id IS NOT NULL)
              AND NOT EXISTS (SELECT 1 FROM links i WHERE i.target_id = d.id)
            ORDER BY d.id
            """, String.class));
    }

    public int countLinks(boolean resolved) {
        Integer count = read("count links", status -> jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM links WHERE target_id IS " + (resolved ? "NOT NULL" : "NULL"), Integer.class));
        return count != null ? count : 0;
    }

    /**
     * Resolved link targets and tags of a document and of every other document
     * sharing at least one of them.
     */
    public Neighbourhood neighbourhood(String id) {
        return read("neighbourhood of " + id, status -> {
            Set<String> targets = new TreeSet<>(jdbcTemplate.queryForList(
                "SELECT DISTINCT target_id FROM links WHERE source_id = ? AND target_id IS NOT NULL AND target_id <> ?",
                String.class, id, id));
            Set<String> tags = new TreeSet<>(jdbcTemplate.queryForList(
                "SELECT tag_name FROM document_tags WHERE document_id = ?", String.class, id));

            Set<String> candidates = new TreeSet<>();
            if (!targets.isEmpty()) {
                candidates.addAll(namedJdbcTemplate.queryForList(
                    "SELECT DISTINCT source_id FROM links WHERE target_id IN (:targets) AND source_id <> :id",
                    new MapSqlParameterSource().addValue("targets", targets).addValue("id", id), String.class));
            }
            if (!tags.isEmpty()) {
                candidates.addAll(namedJdbcTemplate.queryForList(
                    "SELECT DISTINCT document_id FROM document_tags WHERE tag_name IN (:tags) AND document_id <> :id",
                    new MapSqlParameterSource().addValue("tags", tags).addValue("id", id), String.class));
            }

            Map<String, Set<String>> candidateTargets = new TreeMap<>();
            Map<String, Set<String>> candidateTags = new TreeMap<>();
            Map<String, String> candidateTitles = new TreeMap<>();
            if (!candidates.isEmpty()) {
                MapSqlParameterSource params = new MapSqlParameterSource("ids", candidates);
                namedJdbcTemplate.query(
                    "SELECT source_id, target_id FROM links WHERE source_id IN (:ids) AND target_id IS NOT NULL",
                    params, rs -> {
                        String source = rs.getString("source_id");
                        String target = rs.getString("target_id");
                        if (!source.equals(target)) {
                            candidateTargets.computeIfAbsent(source, k -> new TreeSet<>()).add(target);
                        }
                    });
                namedJdbcTemplate.query(
                    "SELECT document_id, tag_name FROM document_tags WHERE document_id IN (:ids)",
                    params, rs -> {
                        candidateTags.computeIfAbsent(rs.getString("document_id"), k -> new TreeSet<>())
                            .add(rs.getString("tag_name"));
                    });
                namedJdbcTemplate.query(
                    "SELECT id, title FROM documents WHERE id IN (:ids)",
                    params, rs -> {
                        candidateTitles.put(rs.getString("id"), rs.getString("title"));
                    });
            }

            return Neighbourhood.builder()
                .documentId(id)
                .targets(targets)
                .tags(tags)
                .candidateTargets(candidateTargets)
                .candidateTags(candidateTags)
                .candidateTitles(candidateTitles)
                .build();
        });
    }

    // ------------------------------------------------------------------
    // Tags
    // ------------------------------------------------------------------

    /**
     * Create any missing tags. Names must be canonical, ancestors included.
     */
    public void registerTags(Collection<String> canonicalTags) {
        if (canonicalTags.isEmpty()) {
            return;
        }
        write("register tags", status -> {
            insertTags(canonicalTags);
            return null;
        });
    }

    private void insertTags(Collection<String> canonicalTags) {
        for (String tag : canonicalTags) {
            jdbcTemplate.update("INSERT OR IGNORE INTO tags (name, parent, depth) VALUES (?, ?, ?)",
                tag, TagPath.parentOf(tag).orElse(null), TagPath.depthOf(tag));
        }
    }

    /**
     * All tags with usage counts derived from document_tags: the number of
     * documents associated with the tag or any of its descendants.
     */
    public List<StoredTag> loadTags() {
        return read("load tags", status -> jdbcTemplate.query("""
            SELECT t.name, t.parent, t.depth,
                   (SELECT COUNT(DISTINCT dt.document_id) FROM document_tags dt
                    WHERE dt.tag_name = t.name
                       OR substr(dt.tag_name, 1, length(t.name) + 1) = t.name || '/') AS usage_count
            FROM tags t
            ORDER BY t.name
            """,
            (rs, rowNum) -> StoredTag.builder()
                .name(rs.getString("name"))
                .parent(rs.getString("parent"))
                .depth(rs.getInt("depth"))
                .usageCount(rs.getInt("usage_count"))
                .build()));
    }

    public List<String> tagsOf(String documentId) {
        return read("tags of " + documentId, status -> jdbcTemplate.queryForList(
            "SELECT tag_name FROM document_tags WHERE document_id = ? ORDER BY tag_name", String.class, documentId));
    }

    /**
     * Replace every tag and association from a full document to tags enumeration.
     * Associations for unknown documents are skipped.
     *
     * @return number of associations written
     */
    public int replaceAllTags(Map<String, List<String>> canonicalTagsByDocument) {
        return write("rebuild tags", status -> {
            Set<String> known = new LinkedHashSet<>(
                jdbcTemplate.queryForList("SELECT id FROM documents", String.class));

            jdbcTemplate.update("DELETE FROM document_tags");
            jdbcTemplate.update("DELETE FROM tags");

            int written = 0;
            for (Map.Entry<String, List<String>> entry : canonicalTagsByDocument.entrySet()) {
                insertTags(entry.getValue());
                if (!known.contains(entry.getKey())) {
                    log.warn("Skipping tag associations for unknown document {}", entry.getKey());
                    continue;
                }
                for (String tag : entry.getValue()) {
                    written += jdbcTemplate.update(
                        "INSERT OR IGNORE INTO document_tags (document_id, tag_name) VALUES (?, ?)",
                        entry.getKey(), tag);
                }
            }
            return written;
        });
    }

    /**
     * Delete tags with no usage and no children, repeating until nothing
     * changes, since removing a leaf can turn its parent into one.
     *
     * @return removed tag names in removal order
     */
    public List<String> removeUnusedLeafTags() {
        return write("clean up tags", status -> {
            List<String> removed = new ArrayList<>();
            while (true) {
                List<String> unused = jdbcTemplate.queryForList("""
                    SELECT t.name FROM tags t
                    WHERE NOT EXISTS (SELECT 1 FROM tags c WHERE c.parent = t.name)
                      AND NOT EXISTS (SELECT 1 FROM document_tags dt
                                      WHERE dt.tag_name = t.name
                                         OR substr(dt.tag_name, 1, length(t.name) + 1) = t.name || '/')
                    ORDER BY t.name
                    """, String.class);
                if (unused.isEmpty()) {
                    return removed;
                }
                for (String name : unused) {
                    jdbcTemplate.update("DELETE FROM tags WHERE name = ?", name);
                }
                removed.addAll(unused);
            }
        });
    }

    // ------------------------------------------------------------------
    // Transactions
    // ------------------------------------------------------------------

    <T> T write(String operation, TransactionCallback<T> callback) {
        boolean locked;
        try {
            locked = writeLock.tryLock(storageProperties.getLockTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted waiting for index write lock during " + operation, e);
        }
        if (!locked) {
            throw new StorageException("Timed out after " + storageProperties.getLockTimeout()
                + " waiting for index write lock during " + operation);
        }
        try {
            return execute(operation, callback);
        } finally {
            writeLock.unlock();
        }
    }

    private <T> T read(String operation, TransactionCallback<T> callback) {
        return execute(operation, callback);
    }

    /**
     * Run the callback in a transaction, retrying once after a backoff when
     * SQLite reports the database busy or locked.
     */
    private <T> T execute(String operation, TransactionCallback<T> callback) {
        for (int attempt = 1; ; attempt++) {
            try {
                return transactionTemplate.execute(callback);
            } catch (DataAccessException | TransactionException e) {
                if (attempt == 1 && isTransient(e)) {
                    log.warn("Transient storage failure during {}, retrying: {}", operation, e.getMessage());
                    sleep(storageProperties.getRetryBackoff().toMillis());
                    continue;
                }
                throw new StorageException("Storage failure during " + operation, e);
            } catch (IllegalStateException e) {
                throw new StorageException("Storage failure during " + operation, e);
            }
        }
    }

    static boolean isTransient(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof TransientDataAccessException) {
                return true;
            }
            if (t instanceof SQLException) {
                int code = ((SQLException) t).getErrorCode();
                String message = String.valueOf(t.getMessage());
                if (code == SQLITE_BUSY || code == SQLITE_LOCKED
                    || message.contains("SQLITE_BUSY") || message.contains("SQLITE_LOCKED")) {
                    return true;
                }
            }
        }
        return false;
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // ------------------------------------------------------------------
    // Mapping
    // ------------------------------------------------------------------

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private List<String> fromJsonList(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<List<String>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable JSON list column: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    private Map<String, Object> fromJsonMap(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable frontmatter column: {}", e.getOriginalMessage());
            return new LinkedHashMap<>();
        }
    }

    private static String ftsTagText(List<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return "";
        }
        // Index both the full path and its segments so "backend" finds project/backend
        Set<String> words = new LinkedHashSet<>();
        for (String tag : tags) {
            words.add(tag);
            words.addAll(List.of(tag.split("/")));
        }
        return String.join(" ", words);
    }

    private static String nvl(String s) {
        return s == null ? "" : s;
    }

    private class DocumentRowMapper implements RowMapper<Document> {
        @Override
        public Document mapRow(ResultSet rs, int rowNum) throws SQLException {
            String date = rs.getString("doc_date");
            return Document.builder()
                .id(rs.getString("id"))
                .title(rs.getString("title"))
                .content(rs.getString("content"))
                .body(rs.getString("body"))
                .frontmatter(fromJsonMap(rs.getString("frontmatter")))
                .date(date != null ? LocalDate.parse(date) : null)
                .tags(fromJsonList(rs.getString("tags")))
                .aliases(fromJsonList(rs.getString("aliases")))
                .status(DocumentStatus.valueOf(rs.getString("status")))
                .wordCount(rs.getInt("word_count"))
                .readingTimeMinutes(rs.getInt("reading_time"))
                .modifiedAt(Instant.ofEpochMilli(rs.getLong("modified_at")))
                .fileSize(rs.getLong("file_size"))
                .contentHash(rs.getString("content_hash"))
                .degraded(rs.getInt("degraded") != 0)
                .parseProblem(rs.getString("parse_problem"))
                .build();
        }
    }

    private static class LinkRowMapper implements RowMapper<Link> {
        @Override
        public Link mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Link.builder()
                .sourceId(rs.getString("source_id"))
                .targetRef(rs.getString("target_ref"))
                .targetId(rs.getString("target_id"))
                .kind(LinkKind.valueOf(rs.getString("kind")))
                .heading(rs.getString("heading"))
                .context(rs.getString("context"))
                .lineNumber(rs.getInt("line_number"))
                .occurrenceCount(rs.getInt("occurrence_count"))
                .build();
        }
    }
}
