package com.questrail.devicelink.queue;

/**
 * What {@link CommandQueue#enqueue(Object)} does when the queue is full.
 */
public enum OverflowPolicy {
    /** Refuse the new item immediately. */
    REJECT_NEW,

    /** Evict the head to admit the new item; only the latest request matters. */
    DROP_OLDEST,

    /** Wait up to the configured enqueue timeout for space, then refuse. */
    BLOCK_WITH_TIMEOUT
}
