package io.blockchain.datastore.storage;

import io.blockchain.datastore.datastore.Namespace;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * In-memory implementation of Database.
 * Good for tests and local runs; failures can be switched on to exercise error paths.
 */
public final class InMemoryDatabase implements Database {

    /** Map: namespace -> (dataId -> payload) */
    private final Map<Namespace, TreeMap<Long, byte[]>> data = new HashMap<>();

    /** Map: namespace -> serialized manager state */
    private final Map<Namespace, byte[]> managers = new LinkedHashMap<>();

    private final ReplicationChannel channel;

    private boolean failPing;
    private boolean failWrites;
    private boolean closed;

    public InMemoryDatabase() {
        this(new ReplicationChannel());
    }

    public InMemoryDatabase(ReplicationChannel channel) {
        this.channel = channel;
    }

    @Override
    public synchronized void ping() throws DatabaseException {
        if (closed) {
            throw new DatabaseException("database is closed");
        }
        if (failPing) {
            throw new DatabaseException("ping failed");
        }
    }

    @Override
    public synchronized void storeData(Namespace namespace, long dataId, byte[] payload) throws DatabaseException {
        checkWritable();
        data.computeIfAbsent(namespace, k -> new TreeMap<>()).put(dataId, payload.clone());
    }

    @Override
    public synchronized void deleteData(Namespace namespace, long dataId) throws DatabaseException {
        checkWritable();
        TreeMap<Long, byte[]> rows = data.get(namespace);
        if (rows != null) {
            rows.remove(dataId);
        }
    }

    @Override
    public synchronized void saveManagerState(Namespace namespace, byte[] state) throws DatabaseException {
        checkOpen();
        managers.put(namespace, state.clone());
    }

    @Override
    public synchronized Map<Namespace, byte[]> loadManagerStates() throws DatabaseException {
        checkOpen();
        Map<Namespace, byte[]> out = new LinkedHashMap<>();
        managers.forEach((ns, state) -> out.put(ns, state.clone()));
        return out;
    }

    @Override
    public synchronized void deleteManagerState(Namespace namespace) throws DatabaseException {
        checkOpen();
        managers.remove(namespace);
    }

    @Override
    public void subscribe(Consumer<String> handler) {
        channel.subscribe(handler);
    }

    @Override
    public void unsubscribe() {
        channel.unsubscribe();
    }

    @Override
    public void close() {
        channel.unsubscribe();
        synchronized (this) {
            closed = true;
        }
    }

    /** Push a control payload onto the replication channel. */
    public void publish(String payload) {
        channel.publish(payload);
    }

    // -------------- inspection / fault injection ----------------

    /** Snapshot of the records of a namespace, ordered by data id. */
    public synchronized Map<Long, byte[]> data(Namespace namespace) {
        TreeMap<Long, byte[]> rows = data.get(namespace);
        return rows == null ? new TreeMap<>() : new TreeMap<>(rows);
    }

    public synchronized Optional<byte[]> managerState(Namespace namespace) {
        byte[] state = managers.get(namespace);
        return state == null ? Optional.empty() : Optional.of(state.clone());
    }

    public synchronized void setFailPing(boolean failPing) {
        this.failPing = failPing;
    }

    /** Make storeData/deleteData fail, manager state writes keep working. */
    public synchronized void setFailWrites(boolean failWrites) {
        this.failWrites = failWrites;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public boolean isSubscribed() {
        return channel.isSubscribed();
    }

    private void checkOpen() throws DatabaseException {
        if (closed) {
            throw new DatabaseException("database is closed");
        }
    }

    private void checkWritable() throws DatabaseException {
        checkOpen();
        if (failWrites) {
            throw new DatabaseException("write rejected");
        }
    }
}
