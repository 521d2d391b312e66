package io.blockchain.datastore.datastore;

import io.blockchain.datastore.consensus.ConsensusChange;
import io.blockchain.datastore.consensus.ConsensusChangeId;
import io.blockchain.datastore.consensus.ConsensusException;
import io.blockchain.datastore.consensus.ConsensusSet;
import io.blockchain.datastore.consensus.ConsensusSetSubscriber;
import io.blockchain.datastore.metrics.ReplicationMetrics;
import io.blockchain.datastore.protocol.Block;
import io.blockchain.datastore.protocol.Transaction;
import io.blockchain.datastore.storage.Database;
import io.blockchain.datastore.storage.DatabaseException;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Replicates the records of one namespace from the chain into the database.
 *
 * Applying a block stores every matching record under the next data id; reverting a
 * block deletes them again in reverse order, so apply and revert are exact inverses.
 * Records from blocks older than the subscribe start still consume data ids but are
 * never written. After each consensus change the state is checkpointed.
 *
 * Lifecycle: created unsubscribed, {@link #subscribeCs} registers it with the consensus
 * set, {@link #unSubscribeCs} ends it for good.
 */
public final class NamespaceManager implements ConsensusSetSubscriber {
    private static final Logger LOG = Logger.getLogger(NamespaceManager.class.getName());

    private final Namespace namespace;
    private final NamespaceManagerState state;
    private final BlockBuffer buffer;
    private final Database db;

    private final Object lock = new Object();
    // guarded by lock
    private ConsensusSet cs;
    private boolean closed;

    public NamespaceManager(Namespace namespace, NamespaceManagerState state, Database db, int bufferSize) {
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.state = Objects.requireNonNull(state, "state");
        this.db = Objects.requireNonNull(db, "db");
        this.buffer = new BlockBuffer(bufferSize);
    }

    /** A manager for a new subscription, ignoring data from blocks before {@code subscribeStart}. */
    public static NamespaceManager fresh(Namespace namespace, long subscribeStart, Database db, int bufferSize) {
        return new NamespaceManager(namespace, NamespaceManagerState.initial(subscribeStart), db, bufferSize);
    }

    /** A manager resumed from a persisted checkpoint. */
    public static NamespaceManager fromSerializedState(Namespace namespace, byte[] state, Database db, int bufferSize) {
        return new NamespaceManager(namespace, NamespaceManagerState.deserialize(state), db, bufferSize);
    }

    public Namespace namespace() { return namespace; }

    /** Snapshot of the current state. */
    public NamespaceManagerState state() {
        synchronized (lock) {
            return state.copy();
        }
    }

    public boolean isSubscribed() {
        synchronized (lock) {
            return cs != null;
        }
    }

    /**
     * Register with the consensus set, resuming after the last processed change.
     * Blocks while the backlog is replayed.
     */
    public void subscribeCs(ConsensusSet consensusSet) {
        ConsensusChangeId since;
        synchronized (lock) {
            if (closed) {
                return;
            }
            this.cs = consensusSet;
            since = state.recentChangeId;
        }
        try {
            consensusSet.subscribe(this, since);
        } catch (ConsensusException e) {
            LOG.log(Level.SEVERE, "Failed to subscribe namespace " + namespace + " to the consensus set", e);
            synchronized (lock) {
                if (cs == consensusSet) {
                    cs = null;
                }
            }
            return;
        }
        boolean lateClose;
        synchronized (lock) {
            lateClose = closed;
        }
        if (lateClose) {
            // unsubscribed while we were registering
            consensusSet.unsubscribe(this);
        }
        LOG.fine(() -> "Namespace " + namespace + " subscribed, now at height " + state().blockHeight());
    }

    /** Stop receiving consensus changes. Idempotent. */
    public void unSubscribeCs() {
        ConsensusSet current;
        synchronized (lock) {
            closed = true;
            if (cs == null) {
                return;
            }
            current = cs;
            cs = null;
        }
        // outside the lock: the consensus set may be delivering to us right now
        current.unsubscribe(this);
    }

    @Override
    public void processConsensusChange(ConsensusChange cc) {
        if (cc.appliedBlocks().isEmpty()) {
            throw new IllegalStateException("processConsensusChange called with a consensus change that has no applied blocks");
        }
        synchronized (lock) {
            if (cs == null) {
                LOG.fine(() -> "No consensus set for namespace " + namespace + ", dropping " + cc);
                return;
            }
            ReplicationMetrics.recordChange(() -> apply(cc));
        }
    }

    // caller holds lock
    private void apply(ConsensusChange cc) {
        LOG.fine(() -> "Parsing " + cc + " for namespace " + namespace + ", now at height " + state.blockHeight);

        for (Block block : cc.revertedBlocks()) {
            if (buffer.pop(block.id()) == null) {
                LOG.warning(() -> "Reverting block " + block.id() + " outside of the maturity window for namespace " + namespace);
            }
            boolean replicated = isReplicated(block);
            List<Transaction> txs = block.transactions();
            for (int t = txs.size() - 1; t >= 0; t--) {
                int records = RecordExtractor.matching(txs.get(t), namespace).size();
                for (int r = 0; r < records; r++) {
                    state.dataId--;
                    if (replicated) {
                        deleteRecord(state.dataId);
                    }
                }
            }
            state.blockHeight--;
        }

        for (Block block : cc.appliedBlocks()) {
            boolean replicated = isReplicated(block);
            for (Transaction tx : block.transactions()) {
                for (byte[] payload : RecordExtractor.matching(tx, namespace)) {
                    if (replicated) {
                        storeRecord(state.dataId, payload);
                    }
                    state.dataId++;
                }
            }
            state.blockHeight++;
            BlockFrame matured = buffer.push(new BlockFrame(block, cc.id()));
            if (matured != null) {
                LOG.finest(() -> "Block " + matured.block().id() + " matured for namespace " + namespace);
            }
        }

        state.recentChangeId = cc.id();
        try {
            save();
        } catch (DatabaseException e) {
            ReplicationMetrics.replicationFailure();
            LOG.log(Level.SEVERE, "Failed to save namespace manager state for " + namespace, e);
        }
    }

    private boolean isReplicated(Block block) {
        return Long.compareUnsigned(block.timestamp(), state.subscribeStart) >= 0;
    }

    private void storeRecord(long dataId, byte[] payload) {
        try {
            db.storeData(namespace, dataId, payload);
            ReplicationMetrics.recordStored();
            LOG.finest(() -> "Saved data for " + namespace + ", dataId: " + dataId);
        } catch (DatabaseException e) {
            // counters still advance, the database may now lag behind the chain
            ReplicationMetrics.replicationFailure();
            LOG.log(Level.SEVERE, "Failed to save data " + namespace + "/" + dataId, e);
        }
    }

    private void deleteRecord(long dataId) {
        try {
            db.deleteData(namespace, dataId);
            ReplicationMetrics.recordDeleted();
            LOG.finest(() -> "Rolled back data for " + namespace + ", dataId: " + dataId);
        } catch (DatabaseException e) {
            ReplicationMetrics.replicationFailure();
            LOG.log(Level.SEVERE, "Failed to delete data " + namespace + "/" + dataId, e);
        }
    }

    /** Persist the current checkpoint. */
    public void save() throws DatabaseException {
        byte[] serialized;
        synchronized (lock) {
            serialized = state.serialize();
        }
        db.saveManagerState(namespace, serialized);
    }

    /** Remove the persisted checkpoint. */
    public void delete() throws DatabaseException {
        db.deleteManagerState(namespace);
    }

    /** Blocks currently held in the revert window. */
    int bufferedBlocks() {
        synchronized (lock) {
            return buffer.size();
        }
    }
}
