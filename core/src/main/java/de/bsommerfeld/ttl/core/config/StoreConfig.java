package de.bsommerfeld.ttl.core.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.bsommerfeld.ttl.core.util.StoragePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Settings of the corpus store, persisted as {@code store.json}.
 *
 * <p>
 * {@link #load(Path)} reads the file if present and writes the defaults
 * back if it is missing, so a fresh installation ends up with an editable
 * file listing every key.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoreConfig {

    private static final Logger LOG = LoggerFactory.getLogger(StoreConfig.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    @JsonProperty("database-file")
    @JsonPropertyDescription("Path of the SQLite corpus file. Empty: corpus.db in the platform data directory")
    private String databaseFile = "";

    @JsonProperty("journal-mode")
    @JsonPropertyDescription("SQLite journal mode. WAL lets readers run while a writer commits")
    private String journalMode = "WAL";

    @JsonProperty("busy-timeout-ms")
    @JsonPropertyDescription("How long a writer waits for a lock held by another process")
    private int busyTimeoutMs = 5000;

    @JsonProperty("import-batch-size")
    @JsonPropertyDescription("Sentences per transaction for chunked imports")
    private int importBatchSize = 500;

    /**
     * Reads the configuration at {@code path}. A missing file is created with
     * default values.
     *
     * @throws IOException if the file exists but cannot be read or parsed, or
     *                     the default file cannot be written
     */
    public static StoreConfig load(Path path) throws IOException {
        if (Files.exists(path)) {
            LOG.info("Loading store configuration from {}", path.toAbsolutePath());
            return MAPPER.readValue(path.toFile(), StoreConfig.class);
        }
        StoreConfig defaults = new StoreConfig();
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent))
            Files.createDirectories(parent);
        MAPPER.writeValue(path.toFile(), defaults);
        LOG.info("Wrote default store configuration to {}", path.toAbsolutePath());
        return defaults;
    }

    /**
     * Configuration pointing at the given corpus file, everything else default.
     */
    public static StoreConfig forFile(Path databaseFile) {
        StoreConfig config = new StoreConfig();
        config.setDatabaseFile(databaseFile.toAbsolutePath().toString());
        return config;
    }

    @JsonIgnore
    public Path getDatabasePath() {
        if (databaseFile == null || databaseFile.isBlank())
            return StoragePaths.defaultDatabaseFile();
        return Path.of(databaseFile);
    }

    @JsonIgnore
    public String getJdbcUrl() {
        return "jdbc:sqlite:" + getDatabasePath().toAbsolutePath();
    }

    public String getDatabaseFile() {
        return databaseFile;
    }

    public void setDatabaseFile(String databaseFile) {
        this.databaseFile = databaseFile;
    }

    public String getJournalMode() {
        return journalMode;
    }

    public void setJournalMode(String journalMode) {
        this.journalMode = journalMode;
    }

    public int getBusyTimeoutMs() {
        return busyTimeoutMs;
    }

    public void setBusyTimeoutMs(int busyTimeoutMs) {
        this.busyTimeoutMs = busyTimeoutMs;
    }

    public int getImportBatchSize() {
        return importBatchSize;
    }

    public void setImportBatchSize(int importBatchSize) {
        this.importBatchSize = importBatchSize;
    }
}
