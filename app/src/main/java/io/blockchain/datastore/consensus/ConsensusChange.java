package io.blockchain.datastore.consensus;

import io.blockchain.datastore.protocol.Block;

import java.util.List;
import java.util.Objects;

/**
 * A batch of chain updates. Reverted blocks come first, highest block first;
 * applied blocks follow in ascending height order.
 */
public final class ConsensusChange {
    private final ConsensusChangeId id;
    private final List<Block> revertedBlocks;
    private final List<Block> appliedBlocks;

    public ConsensusChange(ConsensusChangeId id, List<Block> revertedBlocks, List<Block> appliedBlocks) {
        this.id = Objects.requireNonNull(id, "id");
        this.revertedBlocks = revertedBlocks != null ? List.copyOf(revertedBlocks) : List.of();
        this.appliedBlocks = appliedBlocks != null ? List.copyOf(appliedBlocks) : List.of();
    }

    public ConsensusChangeId id() { return id; }
    public List<Block> revertedBlocks() { return revertedBlocks; }
    public List<Block> appliedBlocks() { return appliedBlocks; }

    @Override public String toString() {
        return "ConsensusChange{" + id + ", reverted=" + revertedBlocks.size() + ", applied=" + appliedBlocks.size() + "}";
    }
}
