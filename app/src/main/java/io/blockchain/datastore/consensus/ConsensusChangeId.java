package io.blockchain.datastore.consensus;

import io.blockchain.datastore.protocol.Hashes;

import java.util.Arrays;

/**
 * Opaque resumption cursor handed out with every consensus change.
 * The all-zero id ({@link #BEGINNING}) asks for the full history from genesis.
 */
public final class ConsensusChangeId {
    public static final int LENGTH = 32;
    public static final ConsensusChangeId BEGINNING = new ConsensusChangeId(new byte[LENGTH]);

    private final byte[] bytes;

    public ConsensusChangeId(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("ConsensusChangeId must be 32 bytes");
        }
        this.bytes = bytes.clone();
    }

    public byte[] bytes() { return bytes.clone(); }
    public String hex() { return Hashes.hex(bytes); }
    public boolean isBeginning() { return Arrays.equals(bytes, BEGINNING.bytes); }

    @Override public boolean equals(Object o){ return o instanceof ConsensusChangeId && Arrays.equals(bytes, ((ConsensusChangeId)o).bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }
    @Override public String toString(){ return "ConsensusChangeId("+hex().substring(0,8)+"…)"; }
}
