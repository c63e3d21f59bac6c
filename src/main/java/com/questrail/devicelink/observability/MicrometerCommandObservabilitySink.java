package com.questrail.devicelink.observability;

import com.questrail.devicelink.api.AttemptOutcome;
import com.questrail.devicelink.idempotency.IdempotencyCache;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * CommandObservabilitySink that records into a Micrometer {@link MeterRegistry}.
 *
 * <p>The registry is supplied by the owner of the process; this class never
 * creates a global one and never serves metrics itself. Exporting (for
 * example over HTTP) is the registry owner's concern.</p>
 *
 * <h2>Meters</h2>
 * <ul>
 *   <li>{@code devicelink.packet.sent} (device_id, outcome)</li>
 *   <li>{@code devicelink.packet.latency} (device_id), successful attempts only</li>
 *   <li>{@code devicelink.retransmit} (device_id), attempts after the first</li>
 *   <li>{@code devicelink.idempotent.drop} (device_id)</li>
 *   <li>{@code devicelink.message.abandoned} (device_id, reason)</li>
 *   <li>{@code devicelink.stray.response} (device_id)</li>
 *   <li>{@code devicelink.session.transition} (state)</li>
 *   <li>{@code devicelink.errors}</li>
 *   <li>{@code devicelink.idempotency.hits}, {@code devicelink.idempotency.evictions},
 *       {@code devicelink.idempotency.size}, once a cache is bound</li>
 * </ul>
 */
public final class MicrometerCommandObservabilitySink implements CommandObservabilitySink {

    private final MeterRegistry registry;

    public MicrometerCommandObservabilitySink(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Exposes the cache's own counters; they are read on each scrape, not pushed.
     */
    public void bindIdempotencyCache(IdempotencyCache cache) {
        Objects.requireNonNull(cache, "cache");
        FunctionCounter.builder("devicelink.idempotency.hits", cache, IdempotencyCache::hits)
                .description("Lookups that found a live record")
                .register(registry);
        FunctionCounter.builder("devicelink.idempotency.evictions", cache, IdempotencyCache::evictions)
                .description("Records removed by capacity or expiry")
                .register(registry);
        Gauge.builder("devicelink.idempotency.size", cache, IdempotencyCache::size)
                .description("Records currently held")
                .register(registry);
    }

    @Override
    public void onAttempt(AttemptEvent event) {
        Counter.builder("devicelink.packet.sent")
                .description("Command frames transmitted")
                .tag("device_id", event.deviceId())
                .tag("outcome", tagValue(event.outcome()))
                .register(registry)
                .increment();

        if (event.outcome() == AttemptOutcome.SUCCESS) {
            Timer.builder("devicelink.packet.latency")
                    .description("Send-to-response latency")
                    .tag("device_id", event.deviceId())
                    .register(registry)
                    .record(Duration.ofMillis(event.elapsedMillis()));
        }

        if (event.attemptNumber() > 1) {
            Counter.builder("devicelink.retransmit")
                    .description("Retransmissions of an already-sent command")
                    .tag("device_id", event.deviceId())
                    .register(registry)
                    .increment();
        }
    }

    @Override
    public void onCommandCompleted(CommandCompletedEvent event) {
        if (event.outcome().isSuccess()) {
            return;
        }
        Counter.builder("devicelink.message.abandoned")
                .description("Commands that ended without success")
                .tag("device_id", event.deviceId())
                .tag("reason", tagValue(event.outcome().reason()))
                .register(registry)
                .increment();
    }

    @Override
    public void onSessionTransition(SessionTransitionEvent event) {
        Counter.builder("devicelink.session.transition")
                .description("Device session state changes")
                .tag("state", tagValue(event.to()))
                .register(registry)
                .increment();
    }

    @Override
    public void onStrayResponse(StrayResponseEvent event) {
        Counter.builder("devicelink.stray.response")
                .description("Responses discarded because nothing awaited them")
                .tag("device_id", event.deviceId())
                .register(registry)
                .increment();
    }

    @Override
    public void onDuplicateSuppressed(DuplicateSuppressedEvent event) {
        Counter.builder("devicelink.idempotent.drop")
                .description("Sends skipped because the command had already succeeded")
                .tag("device_id", event.deviceId())
                .register(registry)
                .increment();
    }

    @Override
    public void onError(CommandErrorEvent event) {
        registry.counter("devicelink.errors").increment();
    }

    private static String tagValue(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
