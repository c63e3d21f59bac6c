package com.questrail.devicelink.engine;

import com.questrail.devicelink.api.FailureReason;
import com.questrail.devicelink.queue.CommandQueue;
import com.questrail.devicelink.queue.EnqueueResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Serializes command execution for one device.
 *
 * <p>Accepted commands wait in a bounded {@link CommandQueue}. A single drain
 * task, scheduled on the shared executor only while there is work, runs them
 * one at a time in acceptance order, so at most one command per device is ever
 * between SENT and its outcome. Lanes of different devices run in parallel.</p>
 */
final class DeviceLane {

    private static final Logger log = LoggerFactory.getLogger(DeviceLane.class);

    private final String deviceId;
    private final CommandQueue<CommandExecution> queue;
    private final SessionSource sessions;
    private final Executor executor;

    private final AtomicBoolean draining = new AtomicBoolean(false);
    private volatile CommandExecution running;
    private volatile boolean shutdown;

    DeviceLane(String deviceId, CommandQueue<CommandExecution> queue, SessionSource sessions, Executor executor) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Offers {@code execution} to the queue. Rejected, timed-out and superseded
     * commands are completed here; an accepted one is scheduled.
     */
    void submit(CommandExecution execution) throws InterruptedException {
        if (shutdown) {
            execution.reject(FailureReason.ENGINE_SHUTDOWN, "Engine is shut down");
            return;
        }

        execution.attachQueue(queue::remove);
        EnqueueResult<CommandExecution> result = queue.enqueue(execution);

        switch (result.status()) {
            case ACCEPTED:
                execution.markQueued();
                result.evictedItem().ifPresent(evicted ->
                        evicted.reject(FailureReason.SUPERSEDED,
                                "Superseded by " + execution.command().msgId() + " under drop-oldest"));
                scheduleDrain();
                if (shutdown) {
                    execution.abort(FailureReason.ENGINE_SHUTDOWN);
                }
                break;
            case REJECTED_FULL:
                execution.reject(FailureReason.QUEUE_FULL,
                        "Queue for device " + deviceId + " is full (" + queue.capacity() + ")");
                break;
            case TIMED_OUT:
                execution.reject(FailureReason.ENQUEUE_TIMEOUT,
                        "No queue space for device " + deviceId + " within the enqueue timeout");
                break;
            default:
                throw new IllegalStateException("Unhandled enqueue status " + result.status());
        }
    }

    int queued() {
        return queue.size();
    }

    /**
     * Fails queued commands with ENGINE_SHUTDOWN, aborts the running one and
     * closes any retained session.
     */
    void shutdown() {
        shutdown = true;
        Optional<CommandExecution> next;
        while ((next = queue.poll()).isPresent()) {
            next.get().reject(FailureReason.ENGINE_SHUTDOWN, "Engine shut down before the command was sent");
        }
        CommandExecution active = running;
        if (active != null) {
            active.abort(FailureReason.ENGINE_SHUTDOWN);
        }
        sessions.close();
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.warn("Executor rejected drain task for device {}", deviceId, e);
            shutdown();
        }
    }

    private void drain() {
        try {
            Optional<CommandExecution> next;
            while (!shutdown && (next = queue.poll()).isPresent()) {
                CommandExecution execution = next.get();
                running = execution;
                try {
                    execution.run(sessions);
                } finally {
                    running = null;
                }
            }
        } finally {
            draining.set(false);
        }
        // A command accepted between the last poll and clearing the flag.
        if (!shutdown && queue.size() > 0) {
            scheduleDrain();
        }
    }
}
