package com.questrail.devicelink.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of CommandObservabilitySink that emits logs via SLF4J.
 *
 * <p>Key/value pairs are written in {@code key=value} form so the external
 * structured-log formatter can lift them into fields.</p>
 */
public final class Slf4jCommandObservabilitySink implements CommandObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jCommandObservabilitySink.class);

    @Override
    public void onAttempt(AttemptEvent event) {
        log.debug("Attempt msg_id={} device_id={} attempt_number={} outcome={} elapsed_ms={} failure={}",
            event.msgId(),
            event.deviceId(),
            event.attemptNumber(),
            event.outcome(),
            event.elapsedMillis(),
            event.failure());
    }

    @Override
    public void onCommandCompleted(CommandCompletedEvent event) {
        if (event.outcome().isSuccess()) {
            log.info("Command succeeded msg_id={} device_id={} attempts={} elapsed_ms={}",
                event.msgId(),
                event.deviceId(),
                event.outcome().attempts(),
                event.elapsedMillis());
        } else {
            log.warn("Command failed msg_id={} device_id={} reason={} attempts={} elapsed_ms={} detail={}",
                event.msgId(),
                event.deviceId(),
                event.outcome().reason(),
                event.outcome().attempts(),
                event.elapsedMillis(),
                event.outcome().detail());
        }
    }

    @Override
    public void onSessionTransition(SessionTransitionEvent event) {
        if (event.isFailure()) {
            log.info("Session device_id={}: {} -> {} cause={}",
                event.deviceId(), event.from(), event.to(), event.cause());
        } else {
            log.debug("Session device_id={}: {} -> {}",
                event.deviceId(), event.from(), event.to());
        }
    }

    @Override
    public void onStrayResponse(StrayResponseEvent event) {
        log.warn("Discarded uncorrelated response device_id={} expected={} received={} detail={}",
            event.deviceId(), event.expected(), event.received(), event.detail());
    }

    @Override
    public void onDuplicateSuppressed(DuplicateSuppressedEvent event) {
        log.info("Suppressed duplicate send msg_id={} device_id={} attempt_number={}",
            event.msgId(), event.deviceId(), event.attemptNumber());
    }

    @Override
    public void onError(CommandErrorEvent event) {
        log.error("devicelink error: {}", event.message(), event.cause());
    }
}
