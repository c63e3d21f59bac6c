package com.questrail.devicelink.queue;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * CommandQueue
 * =============================================================================
 * Bounded FIFO ingress buffer for one device.
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li>Accepted items leave in acceptance order.</li>
 *   <li>Size never exceeds {@link #capacity()}.</li>
 *   <li>Every blocking call is bounded by an explicit timeout.</li>
 * </ul>
 *
 * The queue holds items only; it has no knowledge of commands or devices and
 * never completes anything itself. An item evicted under
 * {@link OverflowPolicy#DROP_OLDEST} is handed back in the {@link EnqueueResult}
 * so the caller can resolve it.
 */
public final class CommandQueue<T> {

    private final int capacity;
    private final OverflowPolicy policy;
    private final Duration enqueueTimeout;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private final ArrayDeque<T> items;

    public CommandQueue(int capacity, OverflowPolicy policy, Duration enqueueTimeout) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.policy = Objects.requireNonNull(policy, "policy");
        this.enqueueTimeout = Objects.requireNonNull(enqueueTimeout, "enqueueTimeout");
        if (policy == OverflowPolicy.BLOCK_WITH_TIMEOUT && (enqueueTimeout.isZero() || enqueueTimeout.isNegative())) {
            throw new IllegalArgumentException("enqueueTimeout must be positive for BLOCK_WITH_TIMEOUT");
        }
        this.items = new ArrayDeque<>(capacity);
    }

    /**
     * Offers {@code item} according to the overflow policy.
     *
     * @throws InterruptedException if interrupted while waiting under {@link OverflowPolicy#BLOCK_WITH_TIMEOUT}
     */
    public EnqueueResult<T> enqueue(T item) throws InterruptedException {
        Objects.requireNonNull(item, "item");

        lock.lock();
        try {
            if (items.size() < capacity) {
                admit(item);
                return EnqueueResult.accepted();
            }

            switch (policy) {
                case REJECT_NEW:
                    return EnqueueResult.rejectedFull();

                case DROP_OLDEST: {
                    T evicted = items.pollFirst();
                    admit(item);
                    return EnqueueResult.acceptedEvicting(evicted);
                }

                case BLOCK_WITH_TIMEOUT: {
                    long remaining = enqueueTimeout.toNanos();
                    while (items.size() >= capacity) {
                        if (remaining <= 0L) {
                            return EnqueueResult.timedOut();
                        }
                        remaining = notFull.awaitNanos(remaining);
                    }
                    admit(item);
                    return EnqueueResult.accepted();
                }

                default:
                    throw new IllegalStateException("Unhandled overflow policy " + policy);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns the head, waiting up to {@code timeout} for one.
     */
    public Optional<T> dequeue(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");

        lock.lock();
        try {
            long remaining = timeout.toNanos();
            while (items.isEmpty()) {
                if (remaining <= 0L) {
                    return Optional.empty();
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            return Optional.of(take());
        } finally {
            lock.unlock();
        }
    }

    /** Removes and returns the head without waiting. */
    public Optional<T> poll() {
        lock.lock();
        try {
            return items.isEmpty() ? Optional.empty() : Optional.of(take());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a specific item, used to cancel work that has not started.
     *
     * @return {@code true} if the item was still queued
     */
    public boolean remove(T item) {
        lock.lock();
        try {
            boolean removed = items.removeFirstOccurrence(item);
            if (removed) {
                notFull.signal();
            }
            return removed;
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

    public int capacity() {
        return capacity;
    }

    public OverflowPolicy policy() {
        return policy;
    }

    // Caller holds lock.
    private void admit(T item) {
        items.addLast(item);
        notEmpty.signal();
    }

    // Caller holds lock; queue is non-empty.
    private T take() {
        T head = items.pollFirst();
        notFull.signal();
        return head;
    }
}
