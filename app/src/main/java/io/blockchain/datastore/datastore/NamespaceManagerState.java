package io.blockchain.datastore.datastore;

import io.blockchain.datastore.consensus.ConsensusChangeId;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Persisted checkpoint of a namespace manager.
 *
 * Layout (big-endian, 56 bytes):
 *  - blockHeight    : 8
 *  - recentChangeId : 32
 *  - dataId         : 8
 *  - subscribeStart : 8 (unsigned timestamp)
 */
public final class NamespaceManagerState {
    public static final int SERIALIZED_LENGTH = 8 + ConsensusChangeId.LENGTH + 8 + 8;

    long blockHeight;
    ConsensusChangeId recentChangeId;
    long dataId;
    long subscribeStart;

    public NamespaceManagerState(long blockHeight, ConsensusChangeId recentChangeId, long dataId, long subscribeStart) {
        this.blockHeight = blockHeight;
        this.recentChangeId = Objects.requireNonNull(recentChangeId, "recentChangeId");
        this.dataId = dataId;
        this.subscribeStart = subscribeStart;
    }

    /** State of a manager that has not seen any block yet. */
    public static NamespaceManagerState initial(long subscribeStart) {
        return new NamespaceManagerState(0L, ConsensusChangeId.BEGINNING, 0L, subscribeStart);
    }

    public long blockHeight() { return blockHeight; }
    public ConsensusChangeId recentChangeId() { return recentChangeId; }
    public long dataId() { return dataId; }
    public long subscribeStart() { return subscribeStart; }

    public NamespaceManagerState copy() {
        return new NamespaceManagerState(blockHeight, recentChangeId, dataId, subscribeStart);
    }

    public byte[] serialize() {
        ByteBuffer buf = ByteBuffer.allocate(SERIALIZED_LENGTH);
        buf.putLong(blockHeight);
        buf.put(recentChangeId.bytes());
        buf.putLong(dataId);
        buf.putLong(subscribeStart);
        return buf.array();
    }

    public static NamespaceManagerState deserialize(byte[] bytes) {
        if (bytes == null || bytes.length != SERIALIZED_LENGTH) {
            throw new IllegalArgumentException("Malformed namespace manager state: expected "
                    + SERIALIZED_LENGTH + " bytes, got " + (bytes == null ? 0 : bytes.length));
        }
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        long height = buf.getLong();
        byte[] changeId = new byte[ConsensusChangeId.LENGTH];
        buf.get(changeId);
        long dataId = buf.getLong();
        long start = buf.getLong();
        return new NamespaceManagerState(height, new ConsensusChangeId(changeId), dataId, start);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof NamespaceManagerState)) return false;
        NamespaceManagerState other = (NamespaceManagerState) o;
        return blockHeight == other.blockHeight
                && dataId == other.dataId
                && subscribeStart == other.subscribeStart
                && recentChangeId.equals(other.recentChangeId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(blockHeight, recentChangeId, dataId, subscribeStart);
    }

    @Override
    public String toString() {
        return "NamespaceManagerState{height=" + blockHeight + ", dataId=" + dataId
                + ", start=" + Long.toUnsignedString(subscribeStart) + ", change=" + recentChangeId + "}";
    }
}
