package io.blockchain.datastore.datastore;

import io.blockchain.datastore.protocol.Specifier;
import io.blockchain.datastore.protocol.Transaction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Parses tagged records out of transaction arbitrary data.
 */
public final class RecordExtractor {
    /** Blobs shorter than this cannot hold a record. */
    public static final int MIN_LENGTH = Specifier.LENGTH + Namespace.LENGTH;

    private RecordExtractor(){}

    /** Split a blob into specifier, namespace and payload. The payload may be empty. */
    public static Optional<TaggedRecord> extract(byte[] blob) {
        if (blob == null || blob.length < MIN_LENGTH) {
            return Optional.empty();
        }
        Specifier specifier = new Specifier(Arrays.copyOfRange(blob, 0, Specifier.LENGTH));
        Namespace namespace = new Namespace(Arrays.copyOfRange(blob, Specifier.LENGTH, MIN_LENGTH));
        byte[] payload = Arrays.copyOfRange(blob, MIN_LENGTH, blob.length);
        return Optional.of(new TaggedRecord(specifier, namespace, payload));
    }

    /**
     * Payloads of all records in the transaction addressed to {@code namespace}, in blob order.
     * Correctly addressed records without payload are dropped.
     */
    public static List<byte[]> matching(Transaction tx, Namespace namespace) {
        List<byte[]> out = new ArrayList<>();
        for (byte[] blob : tx.arbitraryData()) {
            Optional<TaggedRecord> parsed = extract(blob);
            if (parsed.isEmpty()) {
                continue;
            }
            TaggedRecord record = parsed.get();
            byte[] payload = record.payload();
            if (payload.length > 0 && record.namespace().equals(namespace)) {
                out.add(payload);
            }
        }
        return out;
    }
}
