package io.blockchain.datastore.datastore;

import io.blockchain.datastore.consensus.ConsensusChangeId;
import io.blockchain.datastore.protocol.Block;

/**
 * Element of a {@link BlockBuffer}: a block and the id of the consensus change that applied it.
 */
public record BlockFrame(Block block, ConsensusChangeId changeId) {
}
