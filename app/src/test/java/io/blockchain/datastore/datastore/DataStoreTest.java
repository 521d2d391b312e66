package io.blockchain.datastore.datastore;

import io.blockchain.datastore.consensus.ChainInfo;
import io.blockchain.datastore.consensus.InMemoryConsensusSet;
import io.blockchain.datastore.protocol.Block;
import io.blockchain.datastore.storage.InMemoryDatabase;
import io.blockchain.datastore.storage.ReplicationChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

import static io.blockchain.datastore.ChainFixtures.block;
import static io.blockchain.datastore.ChainFixtures.blocks;
import static io.blockchain.datastore.ChainFixtures.tagged;
import static io.blockchain.datastore.ChainFixtures.tx;
import static io.blockchain.datastore.ChainFixtures.utf8;
import static org.junit.jupiter.api.Assertions.*;

class DataStoreTest {

    private static final Namespace ABCD = Namespace.loadString("abcd");
    private static final Namespace WXYZ = Namespace.loadString("wxyz");

    @TempDir
    Path tempDir;

    private InMemoryConsensusSet chain;
    private ReplicationChannel channel;
    private InMemoryDatabase db;
    private DataStore ds;

    @BeforeEach
    void setUp() {
        chain = new InMemoryConsensusSet();
        channel = new ReplicationChannel(10);
        db = new InMemoryDatabase(channel);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (ds != null) {
            ds.close();
        }
    }

    private DataStore open() throws DataStoreException {
        ds = DataStore.open(chain, db, tempDir, ChainInfo.defaultLocal());
        return ds;
    }

    private static void await(BooleanSupplier condition, String what) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Timed out waiting for " + what);
            }
            Thread.sleep(10);
        }
    }

    private void awaitSubscribed(Namespace ns) throws InterruptedException {
        // registered with the chain once the backlog replay has finished
        await(() -> ds.manager(ns).map(NamespaceManager::isSubscribed).orElse(false)
                && chain.subscriberCount() == ds.managedNamespaces().size(), ns + " to subscribe");
    }

    @Test
    void openRejectsMissingCollaborators() {
        assertThrows(DataStoreException.class, () -> DataStore.open(null, db, tempDir, ChainInfo.defaultLocal()));
        assertThrows(DataStoreException.class, () -> DataStore.open(chain, null, tempDir, ChainInfo.defaultLocal()));
    }

    @Test
    void openFailsWhenDatabaseUnreachable() {
        db.setFailPing(true);
        DataStoreException ex = assertThrows(DataStoreException.class, this::open);
        assertTrue(ex.getMessage().contains("ping failed"));
        assertFalse(db.isSubscribed());
    }

    @Test
    void openCreatesLogAndListensForControlEvents() throws Exception {
        open();
        assertTrue(Files.exists(tempDir.resolve(DataStoreLog.LOG_FILE)));
        assertTrue(db.isSubscribed());
        assertTrue(ds.managedNamespaces().isEmpty());
    }

    @Test
    void recoversPersistedManagersAndSkipsCorruptOnes() throws Exception {
        List<Block> history = blocks(null, 2, "abcd", 100L);
        chain.extend(history);

        NamespaceManager previous = NamespaceManager.fresh(ABCD, 0L, db, 10);
        previous.save();
        db.saveManagerState(WXYZ, new byte[] {1, 2, 3});

        open();

        assertEquals(Set.of(ABCD), ds.managedNamespaces());
        awaitSubscribed(ABCD);
        assertEquals(2L, ds.manager(ABCD).orElseThrow().state().dataId());
        assertEquals("record-1", utf8(db.data(ABCD).get(1L)));
    }

    @Test
    void startEventCreatesAndPersistsManager() throws Exception {
        open();
        ds.handleSubEvent(new SubEvent(SubAction.START, ABCD, 0L));

        assertEquals(Set.of(ABCD), ds.managedNamespaces());
        assertTrue(db.managerState(ABCD).isPresent());
        awaitSubscribed(ABCD);

        chain.extend(List.of(block(null, 100L, tx(tagged("abcd", "hello")))));
        assertEquals("hello", utf8(db.data(ABCD).get(0L)));
    }

    @Test
    void duplicateStartReplacesRunningManager() throws Exception {
        open();
        ds.handleSubEvent(new SubEvent(SubAction.START, ABCD, 0L));
        awaitSubscribed(ABCD);
        NamespaceManager first = ds.manager(ABCD).orElseThrow();

        ds.handleSubEvent(new SubEvent(SubAction.START, ABCD, 500L));
        NamespaceManager second = ds.manager(ABCD).orElseThrow();

        assertNotSame(first, second);
        assertFalse(first.isSubscribed());
        assertEquals(500L, second.state().subscribeStart());
        awaitSubscribed(ABCD);
        assertEquals(1, chain.subscriberCount());
    }

    @Test
    void endEventRemovesManagerAndCheckpoint() throws Exception {
        open();
        ds.handleSubEvent(new SubEvent(SubAction.START, ABCD, 0L));
        awaitSubscribed(ABCD);
        NamespaceManager nsm = ds.manager(ABCD).orElseThrow();

        ds.handleSubEvent(new SubEvent(SubAction.END, ABCD, 0L));

        assertTrue(ds.managedNamespaces().isEmpty());
        assertFalse(nsm.isSubscribed());
        assertTrue(db.managerState(ABCD).isEmpty());
        assertEquals(0, chain.subscriberCount());
    }

    @Test
    void endEventForUnknownNamespaceIsIgnored() throws Exception {
        open();
        ds.handleSubEvent(new SubEvent(SubAction.END, WXYZ, 0L));
        assertTrue(ds.managedNamespaces().isEmpty());
    }

    @Test
    void startIsNotRegisteredWhenCheckpointCannotBeSaved() throws Exception {
        open();
        db.close();
        ds.handleSubEvent(new SubEvent(SubAction.START, ABCD, 0L));
        assertTrue(ds.managedNamespaces().isEmpty());
    }

    @Test
    void controlPayloadsDriveSubscriptions() throws Exception {
        open();

        db.publish("not a control message");
        db.publish("subscribe:abcd:0");
        await(() -> ds.manager(ABCD).isPresent(), "subscribe payload");
        awaitSubscribed(ABCD);

        chain.extend(List.of(block(null, 100L, tx(tagged("abcd", "over the wire")))));
        assertEquals("over the wire", utf8(db.data(ABCD).get(0L)));

        db.publish("unsubscribe:abcd");
        await(() -> ds.managedNamespaces().isEmpty(), "unsubscribe payload");
        assertTrue(db.managerState(ABCD).isEmpty());
    }

    @Test
    void closeShutsEverythingDown() throws Exception {
        open();
        ds.handleSubEvent(new SubEvent(SubAction.START, ABCD, 0L));
        ds.handleSubEvent(new SubEvent(SubAction.START, WXYZ, 0L));
        awaitSubscribed(ABCD);
        awaitSubscribed(WXYZ);
        NamespaceManager abcd = ds.manager(ABCD).orElseThrow();

        ds.close();

        assertTrue(db.isClosed());
        assertFalse(db.isSubscribed());
        assertFalse(abcd.isSubscribed());
        assertEquals(0, chain.subscriberCount());

        // idempotent, and later control events are ignored
        ds.close();
        ds.handleSubEvent(new SubEvent(SubAction.END, ABCD, 0L));
        assertEquals(Set.of(ABCD, WXYZ), ds.managedNamespaces());
    }

    @Test
    void closeDoesNotWaitOnListenerBlockedByPendingEvent() throws Exception {
        open();
        AtomicLong closeMillis = new AtomicLong(-1);
        Thread closer = new Thread(() -> {
            long start = System.nanoTime();
            try {
                ds.close();
            } catch (DataStoreException e) {
                throw new IllegalStateException(e);
            }
            closeMillis.set(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        }, "test-closer");

        synchronized (ds) {
            // the listener takes the payload, then waits for the datastore lock
            db.publish("subscribe:abcd");
            await(() -> channel.pending() == 0, "listener to take the payload");
            Thread.sleep(50);
            closer.start();
            await(() -> closer.getState() == Thread.State.BLOCKED, "close to contend for the lock");
        }

        closer.join(10_000);
        assertFalse(closer.isAlive());
        assertTrue(closeMillis.get() >= 0 && closeMillis.get() < 2_000, "close took " + closeMillis.get() + " ms");
        assertFalse(db.isSubscribed());
        assertTrue(db.isClosed());
    }
}
