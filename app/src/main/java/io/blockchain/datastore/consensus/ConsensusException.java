package io.blockchain.datastore.consensus;

public class ConsensusException extends Exception {
    public ConsensusException(String message) {
        super(message);
    }

    public ConsensusException(String message, Throwable cause) {
        super(message, cause);
    }
}
