package com.questrail.devicelink.idempotency;

import com.questrail.devicelink.internal.time.MonotonicClock;
import com.questrail.devicelink.protocol.message.MessageId;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * IdempotencyCache
 * =============================================================================
 * Bounded store of outcomes keyed by {@link MessageId}.
 *
 * <h2>Eviction</h2>
 * <ul>
 *   <li>At capacity, the least-recently-used entry is evicted to admit a new one.
 *       A successful {@link #lookup(MessageId)} counts as use.</li>
 *   <li>Entries expire a fixed TTL after insertion. Lookups refresh recency but
 *       never the insertion time, so the TTL does not slide.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Every operation runs under one lock, which makes the cache linearizable per
 * key. Callers never lock externally.
 *
 * <p>The cache outlives the commands it describes so that a response arriving
 * after its command has already completed is still recognized.</p>
 */
public final class IdempotencyCache {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyCache.class);

    public static final int DEFAULT_CAPACITY = 1000;
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private final int capacity;
    private final long ttlNanos;
    private final MonotonicClock clock;

    private final ReentrantLock lock = new ReentrantLock();
    // Access-ordered: iteration starts at the least-recently-used entry.
    private final LinkedHashMap<MessageId, IdempotencyRecord> entries;

    private long hits;
    private long evictions;

    public IdempotencyCache(int capacity, Duration ttl, MonotonicClock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.capacity = capacity;
        this.ttlNanos = ttl.toNanos();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
    }

    /**
     * Stores {@code outcome} for {@code msgId}. Re-recording an existing key
     * replaces its outcome and restarts its TTL.
     */
    public void record(MessageId msgId, RecordedOutcome outcome) {
        Objects.requireNonNull(msgId, "msgId");
        Objects.requireNonNull(outcome, "outcome");

        lock.lock();
        try {
            long now = clock.nowNanos();
            entries.remove(msgId);
            purgeExpired(now);
            while (entries.size() >= capacity) {
                Iterator<Map.Entry<MessageId, IdempotencyRecord>> eldest = entries.entrySet().iterator();
                MessageId evicted = eldest.next().getKey();
                eldest.remove();
                evictions++;
                log.debug("Evicted least-recently-used idempotency record {}", evicted);
            }
            entries.put(msgId, new IdempotencyRecord(outcome, now));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the live outcome for {@code msgId}, or empty when absent or expired.
     */
    public Optional<RecordedOutcome> lookup(MessageId msgId) {
        Objects.requireNonNull(msgId, "msgId");

        lock.lock();
        try {
            IdempotencyRecord record = entries.get(msgId);
            if (record == null) {
                return Optional.empty();
            }
            if (record.isExpired(clock.nowNanos(), ttlNanos)) {
                entries.remove(msgId);
                evictions++;
                return Optional.empty();
            }
            hits++;
            return Optional.of(record.outcome());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every expired entry.
     *
     * @return the number of entries removed
     */
    public int evictExpired() {
        lock.lock();
        try {
            return purgeExpired(clock.nowNanos());
        } finally {
            lock.unlock();
        }
    }

    /** Number of entries currently held, including any not yet purged after expiry. */
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public long hits() {
        lock.lock();
        try {
            return hits;
        } finally {
            lock.unlock();
        }
    }

    public long evictions() {
        lock.lock();
        try {
            return evictions;
        } finally {
            lock.unlock();
        }
    }

    // Caller holds lock. Insertion times are not ordered by access, so scan all.
    private int purgeExpired(long now) {
        int removed = 0;
        Iterator<IdempotencyRecord> it = entries.values().iterator();
        while (it.hasNext()) {
            if (it.next().isExpired(now, ttlNanos)) {
                it.remove();
                removed++;
            }
        }
        evictions += removed;
        return removed;
    }
}
