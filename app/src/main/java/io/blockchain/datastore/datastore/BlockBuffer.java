package io.blockchain.datastore.datastore;

import io.blockchain.datastore.protocol.BlockId;

/**
 * Fixed-size ring of the most recently applied blocks.
 *
 * Sized to the chain maturity delay, it holds exactly the blocks that can still be
 * reverted. Pushing onto a full buffer evicts (and returns) the oldest frame; popping
 * always removes the newest one. Not thread safe, owned by one namespace manager.
 */
public final class BlockBuffer {
    private final BlockFrame[] buffer;
    private final int size;
    // index of the newest frame, -1 while nothing was pushed yet
    private int head;
    private int count;

    public BlockBuffer(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Trying to create an invalid sized buffer: " + size);
        }
        this.size = size;
        this.buffer = new BlockFrame[size];
        this.head = -1;
        this.count = 0;
    }

    /**
     * Store a frame as the newest element.
     *
     * @return the evicted oldest frame when the buffer was full, otherwise null
     */
    public BlockFrame push(BlockFrame frame) {
        head = (head + 1) % size;

        BlockFrame evicted = null;
        if (count == size) {
            evicted = buffer[head];
            if (evicted == null) {
                throw new IllegalStateException("Buffer should be full but found an empty slot at " + head);
            }
        } else {
            count++;
        }
        buffer[head] = frame;
        return evicted;
    }

    /**
     * Remove the newest frame. The caller names the block it expects on top; consensus
     * changes revert the chain tip first, so any other id is a broken delivery contract.
     *
     * @return the removed frame, or null when the buffer is empty
     */
    public BlockFrame pop(BlockId expected) {
        if (count == 0) {
            return null;
        }
        BlockFrame frame = buffer[head];
        if (!frame.block().id().equals(expected)) {
            throw new IllegalStateException("Trying to pop block " + expected
                    + " from a block buffer whose head is " + frame.block().id());
        }
        buffer[head] = null;
        head = (head - 1 + size) % size;
        count--;
        return frame;
    }

    public int size() { return count; }
    public int capacity() { return size; }
    public boolean isEmpty() { return count == 0; }
}
