package com.ryuqq.parallel.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ResultLedger 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ResultLedgerTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void record_FirstResult_IsStored() {
        ResultLedger ledger = new ResultLedger();

        ledger.record(TaskResult.skipped("A", "r", NOW));

        assertTrue(ledger.contains("A"));
        assertEquals(1, ledger.size());
        assertEquals(TaskStatus.SKIPPED, ledger.get("A").orElseThrow().status());
        assertTrue(ledger.get("B").isEmpty());
    }

    @Test
    void record_SecondResultForSameTask_ThrowsException() {
        // Given
        ResultLedger ledger = new ResultLedger();
        ledger.record(TaskResult.success("A", null, NOW, NOW));

        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> ledger.record(TaskResult.skipped("A", "late", NOW))
        );
        assertTrue(exception.getMessage().contains("Result already recorded for task A"));
        assertTrue(ledger.get("A").orElseThrow().isSuccess());
    }

    @Test
    void record_ConcurrentWritersForSameTask_OnlyOneWins() throws InterruptedException {
        // Given
        ResultLedger ledger = new ResultLedger();
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger rejected = new AtomicInteger();
        List<Runnable> writers = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            writers.add(() -> {
                try {
                    start.await();
                    ledger.record(TaskResult.success("A", null, NOW, NOW));
                } catch (IllegalStateException e) {
                    rejected.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }

        // When
        writers.forEach(executor::submit);
        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        // Then
        assertEquals(threads - 1, rejected.get());
        assertEquals(1, ledger.size());
    }

    @Test
    void view_IsUnmodifiable() {
        ResultLedger ledger = new ResultLedger();

        assertThrows(UnsupportedOperationException.class, () -> ledger.view().clear());
    }

    @Test
    void tryRecord_KeepsFirstResult() {
        ResultLedger ledger = new ResultLedger();

        assertTrue(ledger.tryRecord(TaskResult.skipped("A", "first", NOW)));
        assertFalse(ledger.tryRecord(TaskResult.success("A", null, NOW, NOW)));
        assertEquals("first", ledger.get("A").orElseThrow().skipReason());
    }
}
