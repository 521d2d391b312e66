package io.blockchain.datastore.storage;

/** Failure reported by a {@link Database} backend. */
public class DatabaseException extends Exception {
    public DatabaseException(String message) {
        super(message);
    }

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
