package tickstore.txpool;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static tickstore.TestUtils.signedTx;

class TransactionPoolTest {

    @Test
    void shouldGroupTransactionsByTypeInSubmissionOrder() {
        // Given
        TransactionPool pool = new TransactionPool();

        // When
        pool.addTransaction("move", "m1", signedTx("alice", 1, "m1"));
        pool.addTransaction("attack", "a1", signedTx("bob", 1, "a1"));
        pool.addTransaction("move", "m2", signedTx("alice", 2, "m2"));

        // Then
        assertEquals(List.of("m1", "m2"), pool.forType("move").stream().map(TxData::payload).toList());
        assertEquals(Set.of("move", "attack"), pool.messageTypeIds());
        assertEquals(3, pool.size());
    }

    @Test
    void shouldReturnHashOfSourceTransaction() {
        // Given
        TransactionPool pool = new TransactionPool();
        SignedTransaction tx = signedTx("alice", 1, "m1");

        // When
        String hash = pool.addTransaction("move", "m1", tx);

        // Then
        assertEquals(tx.hash(), hash);
        assertEquals(hash, pool.forType("move").get(0).txHash());
    }

    @Test
    void shouldReturnEmptyListForAbsentType() {
        assertTrue(new TransactionPool().forType("trade").isEmpty());
    }

    @Test
    void shouldNotExposeInternalLists() {
        // Given
        TransactionPool pool = new TransactionPool();
        pool.addTransaction("move", "m1", signedTx("alice", 1, "m1"));

        // When & Then
        assertThrows(UnsupportedOperationException.class, () -> pool.forType("move").clear());
    }

    @Test
    void shouldMoveEverythingOnCopyAndClear() {
        // Given
        TransactionPool pool = new TransactionPool();
        pool.addTransaction("move", "m1", signedTx("alice", 1, "m1"));

        // When
        TransactionPool drained = pool.copyAndClear();
        pool.addTransaction("move", "m2", signedTx("alice", 2, "m2"));

        // Then
        assertEquals(1, drained.size());
        assertEquals("m1", drained.forType("move").get(0).payload());
        assertEquals("m2", pool.forType("move").get(0).payload());
    }

    @Test
    void shouldCompareContentsIgnoringTypeOrder() {
        // Given
        TransactionPool first = new TransactionPool();
        first.addTransaction("move", "m1", signedTx("alice", 1, "m1"));
        first.addTransaction("attack", "a1", signedTx("bob", 1, "a1"));
        TransactionPool second = new TransactionPool();
        second.addTransaction("attack", "a1", signedTx("bob", 1, "a1"));
        second.addTransaction("move", "m1", signedTx("alice", 1, "m1"));

        // Then
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void shouldDistinguishOrderWithinType() {
        // Given
        TransactionPool first = new TransactionPool();
        first.addTransaction("move", "m1", signedTx("alice", 1, "m1"));
        first.addTransaction("move", "m2", signedTx("alice", 2, "m2"));
        TransactionPool second = new TransactionPool();
        second.addTransaction("move", "m2", signedTx("alice", 2, "m2"));
        second.addTransaction("move", "m1", signedTx("alice", 1, "m1"));

        // Then
        assertNotEquals(first, second);
    }

    @Test
    void shouldRejectInvalidTransactions() {
        TransactionPool pool = new TransactionPool();
        assertThrows(IllegalArgumentException.class, () -> pool.addTransaction("", "p", signedTx("a", 1, "p")));
        assertThrows(IllegalArgumentException.class, () -> pool.addTransaction("move", "p", null));
        assertThrows(IllegalArgumentException.class, () -> pool.addTransaction("move", null, signedTx("a", 1, "p")));
        assertTrue(pool.isEmpty());
    }
}
