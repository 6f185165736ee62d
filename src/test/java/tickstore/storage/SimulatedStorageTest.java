package tickstore.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tickstore.future.ListenableFuture;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static tickstore.TestUtils.await;
import static tickstore.TestUtils.awaitFailure;

class SimulatedStorageTest {

    private SimulatedStorage storage;

    @BeforeEach
    void setUp() {
        storage = new SimulatedStorage(new Random(42L));
    }

    @Test
    void shouldRejectInvalidConstructorArguments() {
        assertThrows(IllegalArgumentException.class, () -> new SimulatedStorage(null));
        assertThrows(IllegalArgumentException.class, () -> new SimulatedStorage(new Random(), -1, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new SimulatedStorage(new Random(), 0, 1.5));
    }

    @Test
    void shouldKeepOperationsPendingUntilTick() {
        // Given
        ListenableFuture<VersionedValue> future = storage.get("key".getBytes());

        // Then
        assertTrue(future.isPending());
        assertEquals(1, storage.getPendingOperationCount());

        // When
        storage.tick();

        // Then
        assertTrue(future.isCompleted());
        assertNull(future.getResult());
        assertEquals(0, storage.getPendingOperationCount());
    }

    @Test
    void shouldReadBackStoredValue() {
        // Given
        VersionedValue value = new VersionedValue("player-1".getBytes(), 3L);
        await(storage.set("entity".getBytes(), value), storage);

        // When
        VersionedValue read = await(storage.get("entity".getBytes()), storage);

        // Then
        assertEquals(value, read);
    }

    @Test
    void shouldHonourConfiguredDelay() {
        // Given
        SimulatedStorage delayed = new SimulatedStorage(new Random(1L), 3, 0.0);
        ListenableFuture<Boolean> future = delayed.set("k".getBytes(), new VersionedValue("v".getBytes(), 1L));

        // When
        delayed.tick();
        delayed.tick();

        // Then
        assertTrue(future.isPending());

        // When
        delayed.tick();

        // Then
        assertTrue(future.isCompleted());
        assertEquals(3, delayed.getCurrentTick());
    }

    @Test
    void shouldApplyBatchAtomically() {
        // Given
        await(storage.set("doomed".getBytes(), new VersionedValue("x".getBytes(), 1L)), storage);
        StorageBatch batch = new StorageBatch()
                .set("a".getBytes(), new VersionedValue("1".getBytes(), 1L))
                .delete("doomed".getBytes())
                .increment("counter".getBytes());

        // When
        assertTrue(await(storage.commit(batch), storage));

        // Then
        assertNotNull(await(storage.get("a".getBytes()), storage));
        assertNull(await(storage.get("doomed".getBytes()), storage));
        assertEquals(1L, CounterCodec.decode(await(storage.get("counter".getBytes()), storage).value()));
        assertEquals(2, storage.size());
    }

    @Test
    void shouldApplyNothingWhenInjectedCommitFailureHits() {
        // Given
        storage.failNextCommits(1);
        StorageBatch batch = new StorageBatch()
                .set("a".getBytes(), new VersionedValue("1".getBytes(), 1L))
                .increment("counter".getBytes());

        // When
        Throwable error = awaitFailure(storage.commit(batch), storage);

        // Then
        assertInstanceOf(StorageException.class, error);
        assertEquals(0, storage.size());
    }

    @Test
    void shouldOnlyInjectFailuresIntoCommits() {
        // Given
        storage.failNextCommits(1);

        // When
        Boolean written = await(storage.set("k".getBytes(), new VersionedValue("v".getBytes(), 1L)), storage);

        // Then
        assertTrue(written);
        awaitFailure(storage.commit(new StorageBatch().increment("c".getBytes())), storage);
        assertTrue(await(storage.commit(new StorageBatch().increment("c".getBytes())), storage));
    }

    @Test
    void shouldApplyNothingWhenIncrementMeetsNonCounter() {
        // Given
        await(storage.set("counter".getBytes(), new VersionedValue("abc".getBytes(), 1L)), storage);
        StorageBatch batch = new StorageBatch()
                .set("a".getBytes(), new VersionedValue("1".getBytes(), 1L))
                .increment("counter".getBytes());

        // When
        awaitFailure(storage.commit(batch), storage);

        // Then
        assertNull(await(storage.get("a".getBytes()), storage));
    }

    @Test
    void shouldCompleteRemainingOperationsWhenCallbackThrows() {
        // Given
        ListenableFuture<Boolean> first = storage.set("a".getBytes(), new VersionedValue("1".getBytes(), 1L));
        first.onSuccess(written -> {
            throw new IllegalStateException("listener bug");
        });
        ListenableFuture<Boolean> second = storage.commit(new StorageBatch().increment("counter".getBytes()));

        // When
        assertDoesNotThrow(() -> storage.tick());

        // Then
        assertTrue(first.isCompleted());
        assertTrue(second.isCompleted());
        assertEquals(0, storage.getPendingOperationCount());
    }

    @Test
    void shouldRejectResubmittedBatch() {
        // Given
        StorageBatch batch = new StorageBatch().increment("c".getBytes());
        storage.commit(batch);

        // When & Then
        assertThrows(IllegalStateException.class, () -> storage.commit(batch));
    }

    @Test
    void shouldFailEveryOperationWithCertainFailureProbability() {
        // Given
        SimulatedStorage flaky = new SimulatedStorage(new Random(7L), 0, 1.0);

        // When
        Throwable error = awaitFailure(flaky.get("k".getBytes()), flaky);

        // Then
        assertTrue(error.getMessage().startsWith("Simulated storage failure at tick"));
    }

    @Test
    void shouldBeDeterministicForSameSeed() {
        // Given
        SimulatedStorage first = new SimulatedStorage(new Random(99L), 0, 0.5);
        SimulatedStorage second = new SimulatedStorage(new Random(99L), 0, 0.5);

        // When
        StringBuilder firstOutcomes = new StringBuilder();
        StringBuilder secondOutcomes = new StringBuilder();
        for (int i = 0; i < 20; i++) {
            ListenableFuture<VersionedValue> a = first.get("k".getBytes());
            ListenableFuture<VersionedValue> b = second.get("k".getBytes());
            first.tick();
            second.tick();
            firstOutcomes.append(a.isFailed() ? 'F' : 'S');
            secondOutcomes.append(b.isFailed() ? 'F' : 'S');
        }

        // Then
        assertEquals(firstOutcomes.toString(), secondOutcomes.toString());
    }
}
