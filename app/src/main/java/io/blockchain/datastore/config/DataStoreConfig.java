package io.blockchain.datastore.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.blockchain.datastore.consensus.ChainInfo;
import io.blockchain.datastore.storage.ReplicationChannel;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Simple config holder for a datastore process. */
public final class DataStoreConfig {
    public static final String DATABASE_SUBDIR = "database";

    private static final ObjectMapper JSON = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public final Path persistDir;
    public final Path databaseDir;
    public final int maturityDelay;
    public final String controlBind;
    public final int controlPort;
    public final long pollIntervalMillis;

    public DataStoreConfig(Path persistDir, Path databaseDir, int maturityDelay, String controlBind, int controlPort, long pollIntervalMillis) {
        if (persistDir == null) throw new IllegalArgumentException("persistDir is required");
        if (maturityDelay <= 0) throw new IllegalArgumentException("maturityDelay must be > 0");
        if (controlPort < 0 || controlPort > 65_535) throw new IllegalArgumentException("Invalid controlPort: " + controlPort);
        if (pollIntervalMillis <= 0) throw new IllegalArgumentException("pollIntervalMillis must be > 0");
        this.persistDir = persistDir;
        this.databaseDir = databaseDir != null ? databaseDir : persistDir.resolve(DATABASE_SUBDIR);
        this.maturityDelay = maturityDelay;
        this.controlBind = controlBind == null || controlBind.isBlank() ? "127.0.0.1" : controlBind;
        this.controlPort = controlPort;
        this.pollIntervalMillis = pollIntervalMillis;
    }

    public static DataStoreConfig defaults() {
        return new DataStoreConfig(
                Path.of("./data/datastore"),
                null,                                       // <persistDir>/database
                ChainInfo.DEFAULT_MATURITY_DELAY,
                "127.0.0.1",
                7480,
                ReplicationChannel.DEFAULT_POLL_INTERVAL_MILLIS
        );
    }

    /**
     * Read a JSON config file. Missing keys keep their default, unknown keys are rejected.
     */
    public static DataStoreConfig load(Path file) {
        if (!Files.exists(file)) {
            throw new IllegalArgumentException("Config file not found: " + file);
        }
        FileConfig raw;
        try {
            raw = JSON.readValue(file.toFile(), FileConfig.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read datastore config from " + file + ": " + e.getMessage(), e);
        }
        DataStoreConfig d = defaults();
        Path persist = raw.persistDir != null ? Path.of(raw.persistDir) : d.persistDir;
        return new DataStoreConfig(
                persist,
                raw.databaseDir != null ? Path.of(raw.databaseDir) : null,
                raw.maturityDelay != null ? raw.maturityDelay : d.maturityDelay,
                raw.controlBind != null ? raw.controlBind : d.controlBind,
                raw.controlPort != null ? raw.controlPort : d.controlPort,
                raw.pollIntervalMillis != null ? raw.pollIntervalMillis : d.pollIntervalMillis
        );
    }

    /** Moving the persist dir also moves a database dir that was derived from it. */
    public DataStoreConfig withPersistDir(Path dir) {
        boolean derived = databaseDir.equals(persistDir.resolve(DATABASE_SUBDIR));
        return new DataStoreConfig(dir, derived ? null : databaseDir, maturityDelay, controlBind, controlPort, pollIntervalMillis);
    }

    public DataStoreConfig withMaturityDelay(int delay) {
        return new DataStoreConfig(persistDir, databaseDir, delay, controlBind, controlPort, pollIntervalMillis);
    }

    public DataStoreConfig withControl(String bind, int port) {
        return new DataStoreConfig(persistDir, databaseDir, maturityDelay, bind, port, pollIntervalMillis);
    }

    /** JSON shape of the config file, every key optional. */
    static final class FileConfig {
        public String persistDir;
        public String databaseDir;
        public Integer maturityDelay;
        public String controlBind;
        public Integer controlPort;
        public Long pollIntervalMillis;
    }
}
