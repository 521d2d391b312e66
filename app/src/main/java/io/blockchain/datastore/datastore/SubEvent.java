package io.blockchain.datastore.datastore;

import java.util.Objects;
import java.util.Optional;

/**
 * Control event received on the replication channel.
 *
 * Wire format: {@code <subscribe|unsubscribe>:<namespace>[:<unsigned start timestamp>]}.
 * Segments after the third are ignored.
 */
public record SubEvent(SubAction action, Namespace namespace, long start) {

    public SubEvent {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(namespace, "namespace");
    }

    /**
     * Parse a raw payload. Returns empty for an unknown command or a malformed namespace.
     * A start timestamp that is not an unsigned integer is treated as 0.
     */
    public static Optional<SubEvent> parse(String payload) {
        if (payload == null) {
            return Optional.empty();
        }
        String[] parts = payload.split(":", -1);
        if (parts.length < 2) {
            return Optional.empty();
        }
        SubAction action = SubAction.fromCommand(parts[0]);
        if (action == null) {
            return Optional.empty();
        }
        Namespace namespace;
        try {
            namespace = Namespace.loadString(parts[1]);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        long start = 0L;
        if (parts.length > 2) {
            try {
                start = Long.parseUnsignedLong(parts[2]);
            } catch (NumberFormatException e) {
                start = 0L;
            }
        }
        return Optional.of(new SubEvent(action, namespace, start));
    }

    /** Wire form of this event. */
    public String toPayload() {
        String base = action.command() + ":" + namespace;
        return start == 0L ? base : base + ":" + Long.toUnsignedString(start);
    }
}
