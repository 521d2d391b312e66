package io.blockchain.datastore.datastore;

/** The datastore could not be opened or shut down cleanly. */
public class DataStoreException extends Exception {
    public DataStoreException(String message) {
        super(message);
    }

    public DataStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
