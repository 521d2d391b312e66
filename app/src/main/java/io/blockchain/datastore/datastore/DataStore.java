package io.blockchain.datastore.datastore;

import io.blockchain.datastore.consensus.ChainInfo;
import io.blockchain.datastore.consensus.ConsensusSet;
import io.blockchain.datastore.metrics.ReplicationMetrics;
import io.blockchain.datastore.storage.Database;
import io.blockchain.datastore.storage.DatabaseException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pulls namespaced arbitrary data from the chain and replicates it into a database.
 *
 * Owns one {@link NamespaceManager} per subscribed namespace. Managers persisted by a
 * previous run are resumed on open; the database's control channel starts and ends
 * subscriptions while the datastore runs. Subscribing a manager to the consensus set
 * replays its backlog, so it always happens on a background thread.
 */
public final class DataStore implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(DataStore.class.getName());

    private final ConsensusSet cs;
    private final Database db;
    private final ChainInfo chainInfo;
    private final DataStoreLog log;
    private final ExecutorService subscribers;

    // guarded by this
    private final Map<Namespace, NamespaceManager> managers = new HashMap<>();
    private boolean closed;

    private DataStore(ConsensusSet cs, Database db, ChainInfo chainInfo, DataStoreLog log) {
        this.cs = cs;
        this.db = db;
        this.chainInfo = chainInfo;
        this.log = log;
        AtomicInteger threads = new AtomicInteger();
        this.subscribers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "datastore-subscribe-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Open a datastore on top of a consensus set and a database.
     *
     * @param persistDir directory for the datastore log
     * @throws DataStoreException when a collaborator is missing, the database is unreachable,
     *                            the log cannot be created or persisted managers cannot be listed
     */
    public static DataStore open(ConsensusSet cs, Database db, Path persistDir, ChainInfo chainInfo) throws DataStoreException {
        if (cs == null) {
            throw new DataStoreException("datastore cannot use a nil consensus set");
        }
        if (db == null) {
            throw new DataStoreException("datastore cannot use a nil database");
        }
        if (persistDir == null || chainInfo == null) {
            throw new DataStoreException("datastore needs a persist directory and chain info");
        }
        try {
            db.ping();
        } catch (DatabaseException e) {
            throw new DataStoreException("Database is not reachable: " + e.getMessage(), e);
        }

        DataStoreLog log;
        try {
            log = DataStoreLog.open(persistDir, chainInfo);
        } catch (IOException e) {
            throw new DataStoreException("Failed to initialize datastore logger: " + e.getMessage(), e);
        }

        DataStore ds = new DataStore(cs, db, chainInfo, log);
        LOG.info("Datastore initialized");
        try {
            ds.recoverManagers();
        } catch (DatabaseException e) {
            ds.subscribers.shutdownNow();
            log.close();
            throw new DataStoreException("Failed to load existing namespace managers: " + e.getMessage(), e);
        }

        db.subscribe(ds::handlePayload);
        return ds;
    }

    private void recoverManagers() throws DatabaseException {
        Map<Namespace, byte[]> states = db.loadManagerStates();
        synchronized (this) {
            for (Map.Entry<Namespace, byte[]> entry : states.entrySet()) {
                NamespaceManager nsm;
                try {
                    nsm = NamespaceManager.fromSerializedState(entry.getKey(), entry.getValue(), db, bufferSize());
                } catch (IllegalArgumentException e) {
                    LOG.log(Level.SEVERE, "Skipping namespace manager " + entry.getKey() + ": " + e.getMessage(), e);
                    continue;
                }
                managers.put(nsm.namespace(), nsm);
                subscribeAsync(nsm);
            }
            LOG.info("Loaded " + managers.size() + " namespace managers from db");
        }
    }

    /**
     * Shut down: stop listening for control events, unsubscribe every manager in parallel,
     * then close the database and the log. Every step runs even if an earlier one failed.
     *
     * @throws DataStoreException when the database connection could not be closed
     */
    @Override
    public void close() throws DataStoreException {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        LOG.info("Datastore shutting down...");

        // without the lock: the listener may be waiting for it to drop a late event
        try {
            db.unsubscribe();
        } catch (DatabaseException e) {
            LOG.log(Level.SEVERE, "Failed to unsubscribe from the replication channel", e);
        }

        List<NamespaceManager> running;
        synchronized (this) {
            running = new ArrayList<>(managers.values());
        }
        CountDownLatch done = new CountDownLatch(running.size());
        for (NamespaceManager nsm : running) {
            Thread t = new Thread(() -> {
                try {
                    nsm.unSubscribeCs();
                    LOG.fine(() -> "Namespace manager " + nsm.namespace() + " shut down");
                } finally {
                    done.countDown();
                }
            }, "datastore-shutdown-" + nsm.namespace());
            t.setDaemon(true);
            t.start();
        }
        try {
            done.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warning("Interrupted while waiting for namespace managers to shut down");
        }
        LOG.fine("All namespace managers shut down");
        subscribers.shutdown();

        DatabaseException closeError = null;
        try {
            db.close();
            LOG.fine("DB connection closed");
        } catch (DatabaseException e) {
            closeError = e;
            LOG.log(Level.SEVERE, "Failed to close db connection", e);
        }
        log.close();
        if (closeError != null) {
            throw new DataStoreException("Failed to close db connection: " + closeError.getMessage(), closeError);
        }
    }

    private void handlePayload(String payload) {
        Optional<SubEvent> event = SubEvent.parse(payload);
        if (event.isEmpty()) {
            LOG.finest(() -> "Ignoring malformed control payload: " + payload);
            return;
        }
        handleSubEvent(event.get());
    }

    synchronized void handleSubEvent(SubEvent ev) {
        if (closed) {
            return;
        }
        ReplicationMetrics.controlEvent(ev.action().command());
        switch (ev.action()) {
            case START: {
                // a duplicate subscription replaces the running one
                NamespaceManager existing = managers.remove(ev.namespace());
                if (existing != null) {
                    LOG.fine(() -> "Removing duplicate namespace manager for " + ev.namespace());
                    existing.unSubscribeCs();
                }
                NamespaceManager nsm = NamespaceManager.fresh(ev.namespace(), ev.start(), db, bufferSize());
                try {
                    nsm.save();
                } catch (DatabaseException e) {
                    LOG.log(Level.SEVERE, "Failed to save namespace manager " + ev.namespace() + " during initialization", e);
                    return;
                }
                managers.put(ev.namespace(), nsm);
                subscribeAsync(nsm);
                LOG.info(() -> "Subscribed to namespace " + ev.namespace()
                        + " starting at " + Long.toUnsignedString(ev.start()));
                break;
            }
            case END: {
                NamespaceManager nsm = managers.remove(ev.namespace());
                if (nsm == null) {
                    LOG.fine(() -> "Failed to unsubscribe from namespace " + ev.namespace() + ", not subscribed");
                    return;
                }
                nsm.unSubscribeCs();
                try {
                    nsm.delete();
                } catch (DatabaseException e) {
                    LOG.log(Level.SEVERE, "Failed to delete namespace manager " + ev.namespace(), e);
                    return;
                }
                LOG.info(() -> "Deleted namespace manager for namespace " + ev.namespace());
                break;
            }
            default:
                throw new IllegalStateException("Unknown action " + ev.action());
        }
    }

    private void subscribeAsync(NamespaceManager nsm) {
        subscribers.execute(() -> nsm.subscribeCs(cs));
    }

    private int bufferSize() {
        return chainInfo.maturityDelay();
    }

    public synchronized Set<Namespace> managedNamespaces() {
        return Set.copyOf(managers.keySet());
    }

    public synchronized Optional<NamespaceManager> manager(Namespace namespace) {
        return Optional.ofNullable(managers.get(namespace));
    }
}
