package io.blockchain.datastore.storage;

import io.blockchain.datastore.datastore.Namespace;
import org.rocksdb.*;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persistent Database using RocksDB.
 *
 * Layout (column families):
 *  - "data"     : key = namespace(4) || dataId(8, big-endian), val = payload
 *  - "managers" : key = namespace string (ISO-8859-1), val = serialized manager state
 *
 * RocksDB has no pub/sub, control events arrive through the in-process
 * {@link ReplicationChannel} (fed by {@link #publish(String)}, e.g. from the control server).
 */
public final class RocksDBDatabase implements Database {
    private static final Logger LOG = Logger.getLogger(RocksDBDatabase.class.getName());

    static {
        RocksDB.loadLibrary();
    }

    private final RocksDB db;
    private final ColumnFamilyHandle cfDefault;
    private final ColumnFamilyHandle cfData;
    private final ColumnFamilyHandle cfManagers;
    private final DBOptions dbOptions;
    private final ReplicationChannel channel;

    private volatile boolean closed;

    private RocksDBDatabase(RocksDB db,
                            ColumnFamilyHandle cfDefault,
                            ColumnFamilyHandle cfData,
                            ColumnFamilyHandle cfManagers,
                            DBOptions dbOptions,
                            ReplicationChannel channel) {
        this.db = db;
        this.cfDefault = cfDefault;
        this.cfData = cfData;
        this.cfManagers = cfManagers;
        this.dbOptions = dbOptions;
        this.channel = channel;
    }

    /** Factory: open/create a database in the given directory. */
    public static RocksDBDatabase open(Path dataDir, long pollIntervalMillis) throws DatabaseException {
        try {
            Files.createDirectories(dataDir);
        } catch (IOException e) {
            throw new DatabaseException("Failed to create database directory " + dataDir, e);
        }
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        try {
            List<ColumnFamilyDescriptor> cfDescs = Arrays.asList(
                    new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                    new ColumnFamilyDescriptor("data".getBytes(StandardCharsets.UTF_8)),
                    new ColumnFamilyDescriptor("managers".getBytes(StandardCharsets.UTF_8))
            );
            List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
            RocksDB db = RocksDB.open(dbOpts, dataDir.toString(), cfDescs, cfHandles);
            return new RocksDBDatabase(db, cfHandles.get(0), cfHandles.get(1), cfHandles.get(2),
                    dbOpts, new ReplicationChannel(pollIntervalMillis));
        } catch (RocksDBException e) {
            dbOpts.close();
            throw new DatabaseException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    // -------------- Database API ----------------

    @Override
    public void ping() throws DatabaseException {
        ensureOpen();
        try {
            db.getProperty(cfData, "rocksdb.estimate-num-keys");
        } catch (RocksDBException e) {
            throw new DatabaseException("ping failed", e);
        }
    }

    @Override
    public void storeData(Namespace namespace, long dataId, byte[] payload) throws DatabaseException {
        ensureOpen();
        try {
            db.put(cfData, dataKey(namespace, dataId), payload);
        } catch (RocksDBException e) {
            throw new DatabaseException("storeData failed for " + namespace + "/" + dataId, e);
        }
    }

    @Override
    public void deleteData(Namespace namespace, long dataId) throws DatabaseException {
        ensureOpen();
        try {
            db.delete(cfData, dataKey(namespace, dataId));
        } catch (RocksDBException e) {
            throw new DatabaseException("deleteData failed for " + namespace + "/" + dataId, e);
        }
    }

    @Override
    public void saveManagerState(Namespace namespace, byte[] state) throws DatabaseException {
        ensureOpen();
        try {
            db.put(cfManagers, managerKey(namespace), state);
        } catch (RocksDBException e) {
            throw new DatabaseException("saveManagerState failed for " + namespace, e);
        }
    }

    @Override
    public Map<Namespace, byte[]> loadManagerStates() throws DatabaseException {
        ensureOpen();
        Map<Namespace, byte[]> out = new LinkedHashMap<>();
        try (RocksIterator it = db.newIterator(cfManagers)) {
            for (it.seekToFirst(); it.isValid(); it.next()) {
                String key = new String(it.key(), StandardCharsets.ISO_8859_1);
                try {
                    out.put(Namespace.loadString(key), it.value());
                } catch (IllegalArgumentException e) {
                    LOG.warning(() -> "Skipping manager state with invalid namespace key '" + key + "'");
                }
            }
            it.status();
        } catch (RocksDBException e) {
            throw new DatabaseException("loadManagerStates failed", e);
        }
        return out;
    }

    @Override
    public void deleteManagerState(Namespace namespace) throws DatabaseException {
        ensureOpen();
        try {
            db.delete(cfManagers, managerKey(namespace));
        } catch (RocksDBException e) {
            throw new DatabaseException("deleteManagerState failed for " + namespace, e);
        }
    }

    @Override
    public void subscribe(Consumer<String> handler) {
        channel.subscribe(handler);
    }

    @Override
    public void unsubscribe() {
        channel.unsubscribe();
    }

    public void publish(String payload) {
        channel.publish(payload);
    }

    /** Read a replicated record, mostly for inspection and tests. */
    public byte[] getData(Namespace namespace, long dataId) throws DatabaseException {
        ensureOpen();
        try {
            return db.get(cfData, dataKey(namespace, dataId));
        } catch (RocksDBException e) {
            throw new DatabaseException("getData failed for " + namespace + "/" + dataId, e);
        }
    }

    /** Raw write into the manager key set, bypassing namespace validation. */
    void putRawManagerState(byte[] key, byte[] state) throws DatabaseException {
        ensureOpen();
        try {
            db.put(cfManagers, key, state);
        } catch (RocksDBException e) {
            throw new DatabaseException("putRawManagerState failed", e);
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        channel.unsubscribe();
        // Close CF handles first, then DB/options
        closeQuietly(cfData, "data column family");
        closeQuietly(cfManagers, "managers column family");
        closeQuietly(cfDefault, "default column family");
        closeQuietly(db, "database");
        closeQuietly(dbOptions, "options");
    }

    // -------------- helpers ----------------

    private void ensureOpen() throws DatabaseException {
        if (closed) {
            throw new DatabaseException("database is closed");
        }
    }

    static byte[] dataKey(Namespace namespace, long dataId) {
        ByteBuffer b = ByteBuffer.allocate(Namespace.LENGTH + 8);
        b.put(namespace.bytes());
        b.putLong(dataId);
        return b.array();
    }

    private static byte[] managerKey(Namespace namespace) {
        return namespace.toString().getBytes(StandardCharsets.ISO_8859_1);
    }

    private static void closeQuietly(AbstractNativeReference ref, String what) {
        try {
            ref.close();
        } catch (RuntimeException e) {
            LOG.log(Level.FINE, "Failed to close " + what, e);
        }
    }
}
