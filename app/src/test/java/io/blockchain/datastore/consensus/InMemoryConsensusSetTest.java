package io.blockchain.datastore.consensus;

import io.blockchain.datastore.protocol.Block;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.blockchain.datastore.ChainFixtures.block;
import static io.blockchain.datastore.ChainFixtures.blocks;
import static org.junit.jupiter.api.Assertions.*;

class InMemoryConsensusSetTest {

    private static final class Recorder implements ConsensusSetSubscriber {
        final List<ConsensusChange> seen = new ArrayList<>();

        @Override
        public void processConsensusChange(ConsensusChange cc) {
            seen.add(cc);
        }
    }

    @Test
    void replaysHistoryFromBeginning() throws Exception {
        InMemoryConsensusSet cs = new InMemoryConsensusSet();
        List<Block> chain = blocks(null, 3, "abcd", 100L);
        cs.extend(chain.subList(0, 1));
        cs.extend(chain.subList(1, 3));

        Recorder r = new Recorder();
        cs.subscribe(r, ConsensusChangeId.BEGINNING);

        assertEquals(cs.changes(), r.seen);
        assertEquals(1, cs.subscriberCount());
        assertEquals(3, cs.size());
        assertEquals(chain.get(2), cs.tip().orElseThrow());
    }

    @Test
    void resumesAfterGivenChange() throws Exception {
        InMemoryConsensusSet cs = new InMemoryConsensusSet();
        List<Block> chain = blocks(null, 2, "abcd", 100L);
        ConsensusChange first = cs.extend(chain.subList(0, 1));
        ConsensusChange second = cs.extend(chain.subList(1, 2));

        Recorder r = new Recorder();
        cs.subscribe(r, first.id());
        assertEquals(List.of(second), r.seen);

        Block next = block(chain.get(1), 200L);
        ConsensusChange third = cs.extend(List.of(next));
        assertEquals(List.of(second, third), r.seen);

        cs.unsubscribe(r);
        cs.extend(List.of(block(next, 300L)));
        assertEquals(2, r.seen.size());
    }

    @Test
    void unknownChangeIdIsRejected() {
        InMemoryConsensusSet cs = new InMemoryConsensusSet();
        ConsensusChangeId bogus = new ConsensusChangeId(new byte[] {
                1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16,
                17, 18, 19, 20, 21, 22, 23, 24, 25, 26, 27, 28, 29, 30, 31, 32});
        assertThrows(ConsensusException.class, () -> cs.subscribe(new Recorder(), bogus));
        assertEquals(0, cs.subscriberCount());
    }

    @Test
    void reorgRevertsFromTipDownwards() {
        InMemoryConsensusSet cs = new InMemoryConsensusSet();
        List<Block> chain = blocks(null, 3, "abcd", 100L);
        cs.extend(chain);

        Block fork = block(chain.get(0), 900L);
        ConsensusChange cc = cs.reorg(2, List.of(fork));

        assertEquals(List.of(chain.get(2), chain.get(1)), cc.revertedBlocks());
        assertEquals(List.of(fork), cc.appliedBlocks());
        assertEquals(2, cs.size());
        assertNotEquals(cs.changes().get(0).id(), cc.id());
    }

    @Test
    void changesMustApplyBlocks() {
        InMemoryConsensusSet cs = new InMemoryConsensusSet();
        assertThrows(IllegalArgumentException.class, () -> cs.extend(List.of()));
        assertThrows(IllegalArgumentException.class, () -> cs.reorg(1, List.of(block(null, 1L))));
    }
}
