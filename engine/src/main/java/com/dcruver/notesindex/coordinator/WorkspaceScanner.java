package com.dcruver.notesindex.coordinator;

import com.dcruver.notesindex.app.NotesIndexProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds indexable documents in the workspace and maps paths to document ids.
 */
@Component
@Slf4j
public class WorkspaceScanner {

    private final Path root;
    private final Path dataDirectory;
    private final List<PathMatcher> includes;
    private final List<PathMatcher> excludes;

    public WorkspaceScanner(NotesIndexProperties properties) {
        this.root = properties.workspaceRoot();
        this.dataDirectory = properties.dataDirectory();
        this.includes = matchers(properties.getInclude());
        this.excludes = matchers(properties.getExclude());
    }

    public Path getRoot() {
        return root;
    }

    /**
     * All indexable files under the workspace root, sorted by document id.
     */
    public List<Path> scan() throws IOException {
        if (!Files.isDirectory(root)) {
            log.warn("Workspace directory does not exist: {}", root);
            return List.of();
        }

        try (Stream<Path> paths = Files.walk(root)) {
            List<Path> files = paths
                .filter(Files::isRegularFile)
                .filter(this::isIndexable)
                .sorted((a, b) -> documentId(a).compareTo(documentId(b)))
                .collect(Collectors.toList());
            log.debug("Found {} indexable files under {}", files.size(), root);
            return files;
        }
    }

    /**
     * True when the path lies inside the workspace, outside the data
     * directory, matches an include glob and no exclude glob.
     */
    public boolean isIndexable(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        if (!absolute.startsWith(root) || absolute.equals(root) || absolute.startsWith(dataDirectory)) {
            return false;
        }
        Path relative = root.relativize(absolute);
        return matchesAny(includes, relative) && !matchesAny(excludes, relative);
    }

    /**
     * True when a directory should not be descended into.
     */
    public boolean isExcludedDirectory(Path directory) {
        Path absolute = directory.toAbsolutePath().normalize();
        if (absolute.startsWith(dataDirectory)) {
            return true;
        }
        if (!absolute.startsWith(root) || absolute.equals(root)) {
            return false;
        }
        // Probe with a child so "dir/**" globs match the directory itself
        Path probe = root.relativize(absolute).resolve("x");
        return matchesAny(excludes, probe);
    }

    /**
     * Workspace-relative path with {@code /} separators.
     */
    public String documentId(Path path) {
        Path relative = root.relativize(path.toAbsolutePath().normalize());
        return relative.toString().replace('\\', '/');
    }

    public Path resolve(String documentId) {
        return root.resolve(documentId).normalize();
    }

    private static boolean matchesAny(List<PathMatcher> matchers, Path relative) {
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(relative)) {
                return true;
            }
        }
        return false;
    }

    private static List<PathMatcher> matchers(List<String> globs) {
        return globs.stream()
            .map(glob -> FileSystems.getDefault().getPathMatcher("glob:" + glob))
            .collect(Collectors.toList());
    }
}
