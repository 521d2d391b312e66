package io.blockchain.datastore.protocol;

import java.util.Arrays;

/**
 * Fixed-length reserved tag that prefixes a tagged record in arbitrary data.
 * The replication engine only relies on its length.
 */
public final class Specifier {
    public static final int LENGTH = 16;
    public static final Specifier EMPTY = new Specifier(new byte[LENGTH]);

    private final byte[] bytes;

    public Specifier(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Specifier must be " + LENGTH + " bytes");
        }
        this.bytes = bytes.clone();
    }

    public byte[] bytes() { return bytes.clone(); }

    @Override public boolean equals(Object o){ return o instanceof Specifier && Arrays.equals(bytes, ((Specifier)o).bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }
    @Override public String toString(){ return "Specifier(" + Hashes.hex(bytes) + ")"; }
}
