package com.dcruver.notesindex;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the notes index engine.
 *
 * Watches a workspace of markdown documents and keeps a SQLite index of
 * their content, links and hierarchical tags in sync with on-disk edits.
 * Callers (a desktop shell, plugins) use {@link com.dcruver.notesindex.service.KnowledgeBaseService}.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class NotesIndexApplication {

    public static void main(String[] args) {
        log.info("Starting notes index engine...");
        SpringApplication.run(NotesIndexApplication.class, args);
    }
}
