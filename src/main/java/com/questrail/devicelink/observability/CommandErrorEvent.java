package com.questrail.devicelink.observability;

import java.time.Instant;

/**
 * Record representing an unexpected error or anomaly in the transport core.
 */
public record CommandErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
