package org.neuralchilli.rasterindex.core;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lock-scoped buffer of completed work shared between producer threads and a
 * single consumer. Producers publish; the consumer takes everything at once with
 * {@link #drain()}, so each item is delivered exactly once, in publish order.
 *
 * The consumer may block in {@link #await(Duration)} until something is published.
 */
public final class CompletionChannel<T> {

    private final Lock lock = new ReentrantLock();
    private final Condition published = lock.newCondition();
    private final List<T> items = new ArrayList<>();

    public void publish(T item) {
        if (item == null) {
            throw new IllegalArgumentException("Published item cannot be null");
        }

        lock.lock();
        try {
            items.add(item);
            published.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Atomically copy and clear the buffer.
     */
    public List<T> drain() {
        lock.lock();
        try {
            List<T> copy = List.copyOf(items);
            items.clear();
            return copy;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait up to {@code timeout} for the buffer to be non-empty.
     *
     * @return true if items are available
     */
    public boolean await(Duration timeout) throws InterruptedException {
        lock.lock();
        try {
            if (!items.isEmpty()) {
                return true;
            }
            published.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return !items.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        lock.lock();
        try {
            return items.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }
}
