package com.dcruver.notesindex.app;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Engine configuration, bound from {@code notesindex.*}.
 */
@ConfigurationProperties(prefix = "notesindex")
@Data
public class NotesIndexProperties {

    /**
     * Workspace root holding the user's documents.
     */
    private String workspace = ".";

    /**
     * Directory for the index database. Defaults to {@code <workspace>/.notesindex}.
     */
    private String dataDir;

    private List<String> include = new ArrayList<>(List.of(
        "*.md", "**/*.md", "*.markdown", "**/*.markdown"));

    private List<String> exclude = new ArrayList<>(List.of(
        ".notesindex/**", ".git/**", "**/.git/**", ".obsidian/**", "**/node_modules/**"));

    private Watch watch = new Watch();
    private Workers workers = new Workers();
    private Storage storage = new Storage();
    private Search search = new Search();
    private Similarity similarity = new Similarity();

    public Path workspaceRoot() {
        return Path.of(workspace).toAbsolutePath().normalize();
    }

    public Path dataDirectory() {
        if (dataDir == null || dataDir.isBlank()) {
            return workspaceRoot().resolve(".notesindex");
        }
        return Path.of(dataDir.replace("${user.home}", System.getProperty("user.home")))
            .toAbsolutePath().normalize();
    }

    @Data
    public static class Watch {
        private boolean enabled = true;
        private boolean reconcileOnStartup = true;
        private Duration debounce = Duration.ofMillis(300);
    }

    @Data
    public static class Workers {
        private int threads = 2;
        private String threadNamePrefix = "index-worker-";
    }

    @Data
    public static class Storage {
        private Duration lockTimeout = Duration.ofSeconds(10);
        private Duration busyTimeout = Duration.ofSeconds(5);
        private Duration queryTimeout = Duration.ofSeconds(30);
        private Duration retryBackoff = Duration.ofMillis(200);
    }

    @Data
    public static class Search {
        private int defaultLimit = 20;
        private int maxLimit = 200;
        private String highlightStart = "<mark>";
        private String highlightEnd = "</mark>";
        private String ellipsis = "…";
        private int snippetTokens = 12;
    }

    @Data
    public static class Similarity {
        // Weights are normalised to sum 1 before scoring
        private double linkWeight = 0.6;
        private double tagWeight = 0.4;
        private double minScore = 0.0;
        private int defaultLimit = 10;
    }
}
