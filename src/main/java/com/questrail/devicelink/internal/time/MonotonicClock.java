package com.questrail.devicelink.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every correctness-relevant duration in the transport core.
 *
 * <h2>Binding invariant</h2>
 * Response timeouts, command deadlines, backoff spacing and idempotency TTLs
 * are all measured against this clock. Wall-clock time is used only to stamp
 * observability events.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Values are
     * only meaningful relative to one another.
     */
    long nowNanos();
}
