package io.blockchain.datastore.datastore;

import io.blockchain.datastore.ChainFixtures;
import io.blockchain.datastore.consensus.ConsensusChangeId;
import io.blockchain.datastore.protocol.Block;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlockBufferTest {

    @Test
    void rejectsNonPositiveSize() {
        assertThrows(IllegalArgumentException.class, () -> new BlockBuffer(0));
        assertThrows(IllegalArgumentException.class, () -> new BlockBuffer(-3));
    }

    @Test
    void evictsOldestFramesInPushOrder() {
        int capacity = 4;
        int extra = 3;
        BlockBuffer buffer = new BlockBuffer(capacity);
        assertEquals(capacity, buffer.capacity());
        List<BlockFrame> frames = frames(capacity + extra);

        List<BlockFrame> evicted = new ArrayList<>();
        for (BlockFrame frame : frames) {
            BlockFrame out = buffer.push(frame);
            if (out != null) {
                evicted.add(out);
            }
        }

        assertEquals(frames.subList(0, extra), evicted);
        assertEquals(capacity, buffer.size());
        assertEquals(buffer.capacity(), buffer.size());
    }

    @Test
    void popsNewestFirst() {
        int capacity = 5;
        BlockBuffer buffer = new BlockBuffer(capacity);
        List<BlockFrame> frames = frames(capacity);
        for (BlockFrame frame : frames) {
            assertNull(buffer.push(frame));
        }

        for (int i = capacity - 1; i >= 0; i--) {
            BlockFrame expected = frames.get(i);
            assertSame(expected, buffer.pop(expected.block().id()));
        }
        assertTrue(buffer.isEmpty());
    }

    @Test
    void popOnEmptyBufferReturnsNull() {
        BlockBuffer buffer = new BlockBuffer(2);
        Block b = ChainFixtures.block(null, 1);
        assertNull(buffer.pop(b.id()));
    }

    @Test
    void popWithWrongIdIsAViolation() {
        BlockBuffer buffer = new BlockBuffer(3);
        List<BlockFrame> frames = frames(2);
        frames.forEach(buffer::push);

        // the older block is not on top
        assertThrows(IllegalStateException.class, () -> buffer.pop(frames.get(0).block().id()));
        assertEquals(2, buffer.size());
    }

    @Test
    void wrapsAroundAfterPops() {
        BlockBuffer buffer = new BlockBuffer(2);
        List<BlockFrame> frames = frames(4);
        buffer.push(frames.get(0));
        buffer.push(frames.get(1));
        assertSame(frames.get(1), buffer.pop(frames.get(1).block().id()));

        assertNull(buffer.push(frames.get(2)));
        assertSame(frames.get(0), buffer.push(frames.get(3)));
        assertSame(frames.get(3), buffer.pop(frames.get(3).block().id()));
        assertSame(frames.get(2), buffer.pop(frames.get(2).block().id()));
        assertNull(buffer.pop(frames.get(0).block().id()));
    }

    private static List<BlockFrame> frames(int n) {
        List<BlockFrame> out = new ArrayList<>();
        Block prev = null;
        for (int i = 0; i < n; i++) {
            Block b = ChainFixtures.block(prev, 100 + i);
            out.add(new BlockFrame(b, ConsensusChangeId.BEGINNING));
            prev = b;
        }
        return out;
    }
}
