package com.dcruver.notesindex.app;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Configuration for the SQLite data source backing the index.
 * The database lives under the workspace-scoped data directory.
 */
@Configuration
@Slf4j
public class DataSourceConfig {

    public static final String DATABASE_FILE = "index.db";

    @Bean
    public DataSource dataSource(NotesIndexProperties properties) throws IOException {
        Path dbPath = properties.dataDirectory().resolve(DATABASE_FILE);
        log.info("Using index database {}", dbPath);
        return sqliteDataSource(dbPath, properties.getStorage());
    }

    /**
     * Build a data source for the given database file, creating parent directories.
     * WAL journaling lets readers see the last committed snapshot while a write is in progress.
     */
    public static DataSource sqliteDataSource(Path dbPath, NotesIndexProperties.Storage storage) throws IOException {
        if (dbPath.getParent() != null) {
            Files.createDirectories(dbPath.getParent());
        }

        Properties connectionProperties = new Properties();
        connectionProperties.setProperty("journal_mode", "WAL");
        connectionProperties.setProperty("synchronous", "NORMAL");
        connectionProperties.setProperty("foreign_keys", "true");
        connectionProperties.setProperty("busy_timeout", String.valueOf(storage.getBusyTimeout().toMillis()));

        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.sqlite.JDBC");
        dataSource.setUrl("jdbc:sqlite:" + dbPath.toAbsolutePath());
        dataSource.setConnectionProperties(connectionProperties);

        return dataSource;
    }
}
