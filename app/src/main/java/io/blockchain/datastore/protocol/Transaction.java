package io.blockchain.datastore.protocol;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Transaction as seen by the datastore: only the free-form arbitrary data
 * blobs matter here, value transfers are left to the chain.
 */
public final class Transaction {

    private final int version;
    private final List<byte[]> arbitraryData;
    private final byte[] id;

    private Transaction(int version, List<byte[]> arbitraryData) {
        this.version = version;
        List<byte[]> copy = new ArrayList<>(arbitraryData.size());
        for (byte[] blob : arbitraryData) {
            copy.add(blob != null ? blob.clone() : new byte[0]);
        }
        this.arbitraryData = Collections.unmodifiableList(copy);
        basicValidate();
        this.id = Hashes.sha256(serialize());
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private int version = 1;
        private final List<byte[]> arbitraryData = new ArrayList<>();

        public Builder version(int v) { this.version = v; return this; }
        public Builder arbitraryData(byte[] blob) { this.arbitraryData.add(blob); return this; }
        public Builder arbitraryData(List<byte[]> blobs) {
            if (blobs != null) this.arbitraryData.addAll(blobs);
            return this;
        }

        public Transaction build() {
            return new Transaction(version, arbitraryData);
        }
    }

    public int version() { return version; }
    /** Blobs in transaction order. Callers must not modify the arrays. */
    public List<byte[]> arbitraryData() { return arbitraryData; }
    public byte[] id() { return id.clone(); }

    public byte[] serialize() {
        int size = 4 + 4;
        for (byte[] blob : arbitraryData) size += 4 + blob.length;
        ByteBuffer buf = ByteBuffer.allocate(size);
        buf.putInt(version);
        buf.putInt(arbitraryData.size());
        for (byte[] blob : arbitraryData) {
            buf.putInt(blob.length);
            buf.put(blob);
        }
        return buf.array();
    }

    public void basicValidate() {
        if (version != 1) throw new IllegalArgumentException("Unsupported version: " + version);
    }
}
