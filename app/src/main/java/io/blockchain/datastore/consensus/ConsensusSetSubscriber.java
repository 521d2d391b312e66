package io.blockchain.datastore.consensus;

/**
 * Receives consensus changes. A consensus set never calls the same subscriber
 * concurrently and delivers changes in chain order.
 */
public interface ConsensusSetSubscriber {
    void processConsensusChange(ConsensusChange change);
}
