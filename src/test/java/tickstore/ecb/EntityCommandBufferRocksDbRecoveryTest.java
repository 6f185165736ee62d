package tickstore.ecb;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tickstore.future.ListenableFuture;
import tickstore.messaging.JsonMessageDescriptor;
import tickstore.messaging.MessageDescriptor;
import tickstore.storage.RocksDbStorage;
import tickstore.txpool.TransactionPool;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static tickstore.TestUtils.await;
import static tickstore.TestUtils.signedTx;

/**
 * Crashes are simulated by closing the database with operations still queued, then
 * reopening it from the same directory.
 */
class EntityCommandBufferRocksDbRecoveryTest {

    record Deposit(String account, long amount) {}

    @TempDir
    Path tempDir;

    private final List<MessageDescriptor<?>> descriptors = List.of(new JsonMessageDescriptor<>("deposit", Deposit.class));

    private TransactionPool depositPool() {
        TransactionPool pool = new TransactionPool();
        pool.addTransaction("deposit", new Deposit("acc-1", 50), signedTx("alice", 1, "d1"));
        pool.addTransaction("deposit", new Deposit("acc-2", 75), signedTx("bob", 1, "d2"));
        return pool;
    }

    @Test
    void shouldRecoverJournaledPoolAfterCrashBeforeFinalize() {
        // Given a tick that was started and never finalized
        String path = tempDir.resolve("crash-after-start").toString();
        RocksDbStorage storage = new RocksDbStorage(path);
        EntityCommandBuffer ecb = new EntityCommandBuffer(storage);
        await(ecb.startNextTick(descriptors, depositPool()), storage);
        storage.close();

        // When the process restarts
        RocksDbStorage reopened = new RocksDbStorage(path);
        try {
            EntityCommandBuffer restarted = new EntityCommandBuffer(reopened);
            TickNumbers numbers = await(restarted.getTickNumbers(), reopened);
            TransactionPool recovered = await(restarted.recover(descriptors), reopened);
            await(restarted.finalizeTick(), reopened);

            // Then
            assertEquals(new TickNumbers(1, 0), numbers);
            assertEquals(depositPool(), recovered);
            assertEquals(new TickNumbers(1, 1), await(restarted.getTickNumbers(), reopened));
        } finally {
            reopened.close();
        }
    }

    @Test
    void shouldKeepTickInFlightWhenFinalizeNeverReachedDisk() {
        // Given
        String path = tempDir.resolve("crash-during-finalize").toString();
        RocksDbStorage storage = new RocksDbStorage(path);
        EntityCommandBuffer ecb = new EntityCommandBuffer(storage);
        await(ecb.load(), storage);
        await(ecb.startNextTick(descriptors, depositPool()), storage);
        long entity = ecb.createEntity("balance");
        ecb.setComponent(entity, "balance", 125L);

        // When the process dies with the finalize still queued
        ListenableFuture<Void> finalize = ecb.finalizeTick();
        storage.close();

        // Then
        assertTrue(finalize.isFailed());
        RocksDbStorage reopened = new RocksDbStorage(path);
        try {
            EntityCommandBuffer restarted = new EntityCommandBuffer(reopened);
            assertEquals(new TickNumbers(1, 0), await(restarted.getTickNumbers(), reopened));
            assertNull(await(restarted.getComponent(entity, "balance", Long.class), reopened));
            assertEquals(depositPool(), await(restarted.recover(descriptors), reopened));
        } finally {
            reopened.close();
        }
    }

    @Test
    void shouldContinueCountingAfterCleanRestart() {
        // Given
        String path = tempDir.resolve("clean").toString();
        RocksDbStorage storage = new RocksDbStorage(path);
        EntityCommandBuffer ecb = new EntityCommandBuffer(storage);
        for (int i = 0; i < 3; i++) {
            await(ecb.startNextTick(descriptors, new TransactionPool()), storage);
            await(ecb.finalizeTick(), storage);
        }
        storage.close();

        // When
        RocksDbStorage reopened = new RocksDbStorage(path);
        try {
            EntityCommandBuffer restarted = new EntityCommandBuffer(reopened);
            await(restarted.startNextTick(descriptors, depositPool()), reopened);

            // Then
            assertEquals(new TickNumbers(4, 3), await(restarted.getTickNumbers(), reopened));
        } finally {
            reopened.close();
        }
    }
}
