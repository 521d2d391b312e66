package io.blockchain.datastore.datastore;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 4-byte identifier grouping the data of one replicated stream.
 *
 * The string form maps every byte to one ISO-8859-1 character, so any namespace
 * round-trips through {@link #toString()} and {@link #loadString(String)}.
 */
public final class Namespace {
    public static final int LENGTH = 4;

    private final byte[] bytes;

    public Namespace(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw invalidLength();
        }
        this.bytes = bytes.clone();
    }

    /** Parse the string form of a namespace. Fails unless it encodes exactly 4 bytes. */
    public static Namespace loadString(String value) {
        if (value == null || value.length() != LENGTH) {
            throw invalidLength();
        }
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) > 0xff) {
                throw invalidLength();
            }
        }
        return new Namespace(value.getBytes(StandardCharsets.ISO_8859_1));
    }

    public byte[] bytes() { return bytes.clone(); }

    @Override
    public String toString() {
        return new String(bytes, StandardCharsets.ISO_8859_1);
    }

    @Override public boolean equals(Object o){ return o instanceof Namespace && Arrays.equals(bytes, ((Namespace)o).bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }

    private static IllegalArgumentException invalidLength() {
        return new IllegalArgumentException("Namespace identifier does not have the right length");
    }
}
