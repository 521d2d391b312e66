package io.blockchain.datastore.datastore;

import io.blockchain.datastore.protocol.Specifier;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * A record embedded in arbitrary data: {@code specifier ‖ namespace ‖ payload}.
 * There is no length prefix, the payload is the rest of the blob.
 */
public record TaggedRecord(Specifier specifier, Namespace namespace, byte[] payload) {

    public TaggedRecord {
        Objects.requireNonNull(specifier, "specifier");
        Objects.requireNonNull(namespace, "namespace");
        payload = payload != null ? payload.clone() : new byte[0];
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    /** Wire form, as written into a transaction's arbitrary data. */
    public byte[] toBytes() {
        ByteBuffer buf = ByteBuffer.allocate(Specifier.LENGTH + Namespace.LENGTH + payload.length);
        buf.put(specifier.bytes());
        buf.put(namespace.bytes());
        buf.put(payload);
        return buf.array();
    }
}
