package io.blockchain.datastore.storage;

import io.blockchain.datastore.datastore.Namespace;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Key/value store that receives replicated data, plus the control channel through
 * which consumers subscribe to namespaces.
 *
 * Data records are keyed by (namespace, data id). Data ids are unique within a
 * namespace only. Namespace manager checkpoints live in a separate key set, keyed
 * by the namespace's string form.
 */
public interface Database extends AutoCloseable {

    /** Check that the backend is reachable. */
    void ping() throws DatabaseException;

    void storeData(Namespace namespace, long dataId, byte[] data) throws DatabaseException;

    void deleteData(Namespace namespace, long dataId) throws DatabaseException;

    void saveManagerState(Namespace namespace, byte[] state) throws DatabaseException;

    /** All persisted manager checkpoints. Entries whose key is not a namespace are skipped. */
    Map<Namespace, byte[]> loadManagerStates() throws DatabaseException;

    void deleteManagerState(Namespace namespace) throws DatabaseException;

    /**
     * Start delivering raw control payloads to {@code handler} from a background listener,
     * in arrival order, until {@link #unsubscribe()} or {@link #close()}.
     */
    void subscribe(Consumer<String> handler);

    void unsubscribe() throws DatabaseException;

    @Override
    void close() throws DatabaseException;
}
