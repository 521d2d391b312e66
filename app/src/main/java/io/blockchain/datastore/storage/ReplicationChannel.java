package io.blockchain.datastore.storage;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Control-event source shared by the database backends.
 * Publishers enqueue raw payloads; one listener thread polls the queue at a fixed
 * interval and hands every payload to the subscribed handler.
 */
public final class ReplicationChannel {
    private static final Logger LOG = Logger.getLogger(ReplicationChannel.class.getName());

    public static final long DEFAULT_POLL_INTERVAL_MILLIS = 1_000L;

    private final BlockingQueue<String> queue = new LinkedBlockingQueue<>();
    private final long pollIntervalMillis;

    private volatile boolean running;
    private Thread listener;

    public ReplicationChannel() {
        this(DEFAULT_POLL_INTERVAL_MILLIS);
    }

    public ReplicationChannel(long pollIntervalMillis) {
        this.pollIntervalMillis = Math.max(1L, pollIntervalMillis);
    }

    public void publish(String payload) {
        if (payload == null) {
            return;
        }
        queue.offer(payload);
    }

    public synchronized void subscribe(Consumer<String> handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler is required");
        }
        if (listener != null) {
            throw new IllegalStateException("Replication channel already has a subscriber");
        }
        running = true;
        listener = new Thread(() -> listen(handler), "replication-listener");
        listener.setDaemon(true);
        listener.start();
    }

    /** Stop the listener and wait for it to exit. Payloads still queued are kept. */
    public synchronized void unsubscribe() {
        if (listener == null) {
            return;
        }
        running = false;
        listener.interrupt();
        if (listener != Thread.currentThread()) {
            try {
                listener.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        listener = null;
    }

    public synchronized boolean isSubscribed() {
        return listener != null;
    }

    public int pending() {
        return queue.size();
    }

    private void listen(Consumer<String> handler) {
        while (running) {
            String payload;
            try {
                payload = queue.poll(pollIntervalMillis, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (payload == null) {
                continue;
            }
            try {
                handler.accept(payload);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Control event handler failed for payload " + payload, e);
            }
        }
    }
}
