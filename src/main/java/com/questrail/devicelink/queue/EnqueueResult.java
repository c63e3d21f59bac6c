package com.questrail.devicelink.queue;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of {@link CommandQueue#enqueue(Object)}.
 *
 * @param status  whether the item was admitted
 * @param evicted the head removed to make room under {@link OverflowPolicy#DROP_OLDEST}, or {@code null}
 */
public record EnqueueResult<T>(Status status, T evicted) {

    public enum Status {
        ACCEPTED,
        REJECTED_FULL,
        TIMED_OUT
    }

    public EnqueueResult {
        Objects.requireNonNull(status, "status");
        if (evicted != null && status != Status.ACCEPTED) {
            throw new IllegalArgumentException("Only an accepted enqueue can evict");
        }
    }

    static <T> EnqueueResult<T> accepted() {
        return new EnqueueResult<>(Status.ACCEPTED, null);
    }

    static <T> EnqueueResult<T> acceptedEvicting(T evicted) {
        return new EnqueueResult<>(Status.ACCEPTED, Objects.requireNonNull(evicted, "evicted"));
    }

    static <T> EnqueueResult<T> rejectedFull() {
        return new EnqueueResult<>(Status.REJECTED_FULL, null);
    }

    static <T> EnqueueResult<T> timedOut() {
        return new EnqueueResult<>(Status.TIMED_OUT, null);
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }

    public Optional<T> evictedItem() {
        return Optional.ofNullable(evicted);
    }
}
