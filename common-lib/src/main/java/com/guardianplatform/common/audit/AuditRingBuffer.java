package com.guardianplatform.common.audit;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Fixed-capacity circular buffer. Once full, each append overwrites the oldest entry.
 *
 * <p>Appends and reads are serialized by one lock, so concurrent writers can never
 * corrupt the head/size bookkeeping, duplicate an entry, or let the buffer grow past
 * its capacity.
 *
 * @param <T> entry type
 */
public final class AuditRingBuffer<T> {

    private final Object[] slots;
    private final ReentrantLock lock = new ReentrantLock();
    private int head;   // index of the oldest entry
    private int size;

    public AuditRingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive but was " + capacity);
        }
        this.slots = new Object[capacity];
    }

    public void append(T entry) {
        lock.lock();
        try {
            int tail = (head + size) % slots.length;
            slots[tail] = entry;
            if (size < slots.length) {
                size++;
            } else {
                head = (head + 1) % slots.length;
            }
        } finally {
            lock.unlock();
        }
    }

    /** Copy of the retained entries, oldest first. */
    @SuppressWarnings("unchecked")
    public List<T> snapshot() {
        lock.lock();
        try {
            List<T> copy = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                copy.add((T) slots[(head + i) % slots.length]);
            }
            return copy;
        } finally {
            lock.unlock();
        }
    }

    /** Linear scan; bounded by capacity. */
    @SuppressWarnings("unchecked")
    public int count(Predicate<? super T> filter) {
        lock.lock();
        try {
            int n = 0;
            for (int i = 0; i < size; i++) {
                if (filter.test((T) slots[(head + i) % slots.length])) {
                    n++;
                }
            }
            return n;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return size;
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return slots.length;
    }
}
