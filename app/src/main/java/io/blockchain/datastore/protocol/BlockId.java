package io.blockchain.datastore.protocol;

import java.util.Arrays;

/** 32-byte block identifier (SHA-256 of the header encoding). */
public final class BlockId {
    public static final int LENGTH = 32;
    private final byte[] bytes;

    public BlockId(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("BlockId must be 32 bytes");
        }
        this.bytes = bytes.clone();
    }

    public byte[] bytes() { return bytes.clone(); }
    public String hex() { return Hashes.hex(bytes); }

    @Override public boolean equals(Object o){ return o instanceof BlockId && Arrays.equals(bytes, ((BlockId)o).bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }
    @Override public String toString(){ return "BlockId("+hex().substring(0,8)+"…)"; }
}
