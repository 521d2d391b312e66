package io.blockchain.datastore.protocol;

import java.nio.ByteBuffer;

/**
 * Minimal header: enough to identify a block and order it in time.
 * - parentId: link to previous block (32 zero bytes for genesis)
 * - height: block number (genesis = 0)
 * - timestamp: producer clock, unsigned seconds
 */
public final class BlockHeader {
    private final byte[] parentId;     // 32 bytes
    private final long height;
    private final long timestamp;

    public BlockHeader(byte[] parentId, long height, long timestamp) {
        this.parentId = parentId != null ? parentId.clone() : new byte[BlockId.LENGTH];
        this.height = height;
        this.timestamp = timestamp;
        basicValidate();
    }

    public byte[] parentId() { return parentId.clone(); }
    public long height() { return height; }
    public long timestamp() { return timestamp; }

    // Deterministic header bytes
    public byte[] serialize() {
        ByteBuffer buf = ByteBuffer.allocate(4 + parentId.length + 8 + 8);
        buf.putInt(parentId.length);
        buf.put(parentId);
        buf.putLong(height);
        buf.putLong(timestamp);
        return buf.array();
    }

    public BlockId id() {
        return new BlockId(Hashes.sha256(serialize()));
    }

    public void basicValidate() {
        if (parentId.length != BlockId.LENGTH) throw new IllegalArgumentException("parentId must be 32 bytes");
        if (height < 0) throw new IllegalArgumentException("height must be >= 0");
    }

    @Override public String toString() {
        return "BlockHeader{h=" + height + ", ts=" + Long.toUnsignedString(timestamp) + "}";
    }
}
