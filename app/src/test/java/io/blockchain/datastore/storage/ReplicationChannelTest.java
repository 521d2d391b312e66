package io.blockchain.datastore.storage;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ReplicationChannelTest {

    private final ReplicationChannel channel = new ReplicationChannel(10);

    @AfterEach
    void tearDown() {
        channel.unsubscribe();
    }

    @Test
    void deliversPayloadsInOrder() throws Exception {
        List<String> received = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(3);
        channel.subscribe(p -> {
            received.add(p);
            latch.countDown();
        });

        channel.publish("subscribe:abcd");
        channel.publish("subscribe:wxyz:10");
        channel.publish("unsubscribe:abcd");

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertEquals(List.of("subscribe:abcd", "subscribe:wxyz:10", "unsubscribe:abcd"), received);
    }

    @Test
    void handlerFailureDoesNotStopListener() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        channel.subscribe(p -> {
            if (p.equals("boom")) {
                throw new IllegalStateException("boom");
            }
            latch.countDown();
        });

        channel.publish("boom");
        channel.publish("ok");
        assertTrue(latch.await(5, TimeUnit.SECONDS));
    }

    @Test
    void secondSubscriberIsRejected() {
        channel.subscribe(p -> { });
        assertThrows(IllegalStateException.class, () -> channel.subscribe(p -> { }));
    }

    @Test
    void unsubscribeStopsDeliveryAndKeepsQueue() {
        channel.subscribe(p -> { });
        assertTrue(channel.isSubscribed());
        channel.unsubscribe();
        assertFalse(channel.isSubscribed());

        channel.publish("subscribe:abcd");
        assertEquals(1, channel.pending());
        channel.unsubscribe();
    }
}
