package com.questrail.devicelink.engine;

import com.questrail.devicelink.config.TransportConfig;
import com.questrail.devicelink.idempotency.IdempotencyCache;
import com.questrail.devicelink.internal.time.MonotonicClock;
import com.questrail.devicelink.internal.time.WallClock;
import com.questrail.devicelink.observability.CommandObservabilitySink;
import com.questrail.devicelink.protocol.codec.FrameEncoder;
import com.questrail.devicelink.protocol.message.PayloadCodec;

import java.util.Objects;

/**
 * Collaborators shared by every {@link CommandExecution} of one engine.
 */
record EngineContext(
        TransportConfig config,
        FrameEncoder frameEncoder,
        PayloadCodec payloadCodec,
        IdempotencyCache cache,
        BackoffPolicy backoff,
        CommandObservabilitySink sink,
        MonotonicClock clock,
        WallClock wallClock
) {
    EngineContext {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(frameEncoder, "frameEncoder");
        Objects.requireNonNull(payloadCodec, "payloadCodec");
        Objects.requireNonNull(cache, "cache");
        Objects.requireNonNull(backoff, "backoff");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(wallClock, "wallClock");
    }
}
