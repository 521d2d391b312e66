package io.blockchain.datastore.consensus;

import io.blockchain.datastore.protocol.Block;
import io.blockchain.datastore.protocol.Hashes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * In-memory consensus set for tests and local runs.
 * Keeps the full change history so subscribers can resume from any change id.
 *
 * All mutation and delivery happens under the instance lock, which gives every
 * subscriber serial, in-order delivery.
 */
public final class InMemoryConsensusSet implements ConsensusSet {
    private static final Logger LOG = Logger.getLogger(InMemoryConsensusSet.class.getName());

    /** Every change ever published, oldest first. */
    private final List<ConsensusChange> changes = new ArrayList<>();

    /** Current best chain, tip last. */
    private final List<Block> chain = new ArrayList<>();

    private final List<ConsensusSetSubscriber> subscribers = new ArrayList<>();

    @Override
    public synchronized void subscribe(ConsensusSetSubscriber subscriber, ConsensusChangeId since) throws ConsensusException {
        if (subscriber == null) {
            throw new IllegalArgumentException("subscriber is required");
        }
        int start = 0;
        if (since != null && !since.isBeginning()) {
            int idx = indexOf(since);
            if (idx < 0) {
                throw new ConsensusException("Unknown consensus change id " + since.hex());
            }
            start = idx + 1;
        }
        for (int i = start; i < changes.size(); i++) {
            subscriber.processConsensusChange(changes.get(i));
        }
        if (!subscribers.contains(subscriber)) {
            subscribers.add(subscriber);
        }
        int replayed = changes.size() - start;
        LOG.fine(() -> "Subscriber registered after replaying " + replayed + " changes");
    }

    @Override
    public synchronized void unsubscribe(ConsensusSetSubscriber subscriber) {
        subscribers.remove(subscriber);
    }

    /** Append blocks on top of the current tip. */
    public synchronized ConsensusChange extend(List<Block> blocks) {
        return publish(0, blocks);
    }

    /** Revert {@code depth} blocks from the tip, then apply {@code blocks}. */
    public synchronized ConsensusChange reorg(int depth, List<Block> blocks) {
        if (depth < 0 || depth > chain.size()) {
            throw new IllegalArgumentException("Invalid reorg depth " + depth + " for chain of " + chain.size());
        }
        return publish(depth, blocks);
    }

    public synchronized Optional<Block> tip() {
        return chain.isEmpty() ? Optional.empty() : Optional.of(chain.get(chain.size() - 1));
    }

    public synchronized int size() {
        return chain.size();
    }

    public synchronized List<ConsensusChange> changes() {
        return Collections.unmodifiableList(new ArrayList<>(changes));
    }

    public synchronized int subscriberCount() {
        return subscribers.size();
    }

    private ConsensusChange publish(int depth, List<Block> applied) {
        if (applied == null || applied.isEmpty()) {
            throw new IllegalArgumentException("a consensus change must apply at least one block");
        }
        List<Block> reverted = new ArrayList<>(depth);
        for (int i = 0; i < depth; i++) {
            reverted.add(chain.remove(chain.size() - 1));
        }
        chain.addAll(applied);

        ConsensusChange change = new ConsensusChange(nextId(reverted, applied), reverted, applied);
        changes.add(change);
        for (ConsensusSetSubscriber subscriber : new ArrayList<>(subscribers)) {
            subscriber.processConsensusChange(change);
        }
        return change;
    }

    private ConsensusChangeId nextId(List<Block> reverted, List<Block> applied) {
        byte[] previous = changes.isEmpty()
                ? ConsensusChangeId.BEGINNING.bytes()
                : changes.get(changes.size() - 1).id().bytes();
        List<byte[]> parts = new ArrayList<>();
        parts.add(previous);
        for (Block block : reverted) parts.add(block.id().bytes());
        for (Block block : applied) parts.add(block.id().bytes());
        return new ConsensusChangeId(Hashes.sha256(parts.toArray(new byte[0][])));
    }

    private int indexOf(ConsensusChangeId id) {
        for (int i = changes.size() - 1; i >= 0; i--) {
            if (changes.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }
}
