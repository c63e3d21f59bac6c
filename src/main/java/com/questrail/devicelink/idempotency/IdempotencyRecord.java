package com.questrail.devicelink.idempotency;

import java.util.Objects;

/**
 * One cache entry: the recorded outcome and the monotonic tick at which it
 * was inserted. Expiry is measured from {@code recordedAtNanos} only.
 */
public record IdempotencyRecord(RecordedOutcome outcome, long recordedAtNanos) {

    public IdempotencyRecord {
        Objects.requireNonNull(outcome, "outcome");
    }

    boolean isExpired(long nowNanos, long ttlNanos) {
        return nowNanos - recordedAtNanos >= ttlNanos;
    }
}
