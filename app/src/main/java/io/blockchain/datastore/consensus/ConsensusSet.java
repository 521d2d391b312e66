package io.blockchain.datastore.consensus;

/**
 * The blockchain as seen by the datastore: a source of consensus changes.
 */
public interface ConsensusSet {

    /**
     * Register a subscriber. Every change after {@code since} is replayed before this
     * method returns; later changes are pushed as they happen.
     */
    void subscribe(ConsensusSetSubscriber subscriber, ConsensusChangeId since) throws ConsensusException;

    /** Stop delivering changes to the subscriber. Unknown subscribers are ignored. */
    void unsubscribe(ConsensusSetSubscriber subscriber);
}
