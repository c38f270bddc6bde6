package com.guardianplatform.common.audit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class AuditRingBufferTest {

    @Test
    @DisplayName("under capacity → all entries, oldest first")
    void underCapacity() {
        AuditRingBuffer<Integer> buffer = new AuditRingBuffer<>(5);
        buffer.append(1);
        buffer.append(2);
        buffer.append(3);
        assertEquals(List.of(1, 2, 3), buffer.snapshot());
        assertEquals(3, buffer.size());
    }

    @Test
    @DisplayName("over capacity → only the most recent N, in order")
    void overCapacity() {
        AuditRingBuffer<Integer> buffer = new AuditRingBuffer<>(3);
        IntStream.rangeClosed(1, 10).forEach(buffer::append);
        assertEquals(List.of(8, 9, 10), buffer.snapshot());
        assertEquals(3, buffer.size());
        assertEquals(3, buffer.capacity());
    }

    @Test
    @DisplayName("count scans retained entries only")
    void count() {
        AuditRingBuffer<Integer> buffer = new AuditRingBuffer<>(4);
        IntStream.rangeClosed(1, 6).forEach(buffer::append);
        assertEquals(2, buffer.count(i -> i % 2 == 0 && i > 3));
    }

    @Test
    @DisplayName("snapshot is a copy")
    void snapshotIsCopy() {
        AuditRingBuffer<Integer> buffer = new AuditRingBuffer<>(2);
        buffer.append(1);
        List<Integer> snapshot = buffer.snapshot();
        buffer.append(2);
        assertEquals(List.of(1), snapshot);
    }

    @Test
    @DisplayName("non-positive capacity → rejected")
    void invalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new AuditRingBuffer<>(0));
    }

    @Test
    @DisplayName("concurrent writers → size never exceeds capacity")
    void concurrentWriters() throws InterruptedException {
        AuditRingBuffer<Integer> buffer = new AuditRingBuffer<>(100);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(8);
        for (int t = 0; t < 8; t++) {
            int base = t * 1000;
            pool.submit(() -> {
                for (int i = 0; i < 500; i++) {
                    buffer.append(base + i);
                }
                done.countDown();
            });
        }
        assertTrue(done.await(5, TimeUnit.SECONDS));
        pool.shutdown();

        assertEquals(100, buffer.size());
        assertEquals(100, buffer.snapshot().size());
        assertFalse(buffer.snapshot().contains(null));
    }
}
