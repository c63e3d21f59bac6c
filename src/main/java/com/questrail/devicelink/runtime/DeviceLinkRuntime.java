package com.questrail.devicelink.runtime;

import com.questrail.devicelink.api.Command;
import com.questrail.devicelink.api.CommandHandle;
import com.questrail.devicelink.api.CommandOutcome;
import com.questrail.devicelink.config.DeviceDirectory;
import com.questrail.devicelink.config.TransportConfig;
import com.questrail.devicelink.engine.BackoffPolicy;
import com.questrail.devicelink.engine.RetryCorrelationEngine;
import com.questrail.devicelink.idempotency.IdempotencyCache;
import com.questrail.devicelink.internal.time.MonotonicClock;
import com.questrail.devicelink.internal.time.SystemMonotonicClock;
import com.questrail.devicelink.internal.time.SystemWallClock;
import com.questrail.devicelink.internal.time.WallClock;
import com.questrail.devicelink.observability.CommandObservabilitySink;
import com.questrail.devicelink.observability.CompositeObservabilitySink;
import com.questrail.devicelink.observability.MicrometerCommandObservabilitySink;
import com.questrail.devicelink.observability.NullObservabilitySink;
import com.questrail.devicelink.session.DeviceSessionFactory;
import com.questrail.devicelink.session.netty.NettyDeviceSessionFactory;

import io.micrometer.core.instrument.MeterRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * DeviceLinkRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the production transport stack.
 *
 * <p>Created once at process start. {@link #close()} shuts the engine down and
 * then releases the network resources owned by the session factory. The
 * observability sink and meter registry belong to the caller and outlive the
 * runtime.</p>
 */
public final class DeviceLinkRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DeviceLinkRuntime.class);

    private final RetryCorrelationEngine engine;
    private final DeviceSessionFactory sessionFactory;

    private DeviceLinkRuntime(RetryCorrelationEngine engine, DeviceSessionFactory sessionFactory) {
        this.engine = engine;
        this.sessionFactory = sessionFactory;
    }

    public CommandHandle submit(Command command) {
        return engine.submit(command);
    }

    public CommandOutcome execute(Command command) {
        return engine.execute(command);
    }

    /**
     * Sends one toggle command with a fresh msg_id and waits for its outcome.
     */
    public CommandOutcome toggle(String deviceId, boolean desiredState) {
        return engine.execute(Command.toggle(deviceId, desiredState));
    }

    public RetryCorrelationEngine engine() {
        return engine;
    }

    @Override
    public void close() {
        engine.shutdown();
        try {
            sessionFactory.close();
        } catch (Exception e) {
            log.warn("Session factory did not close cleanly", e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private DeviceDirectory devices;
        private TransportConfig transportConfig = TransportConfig.defaults();
        private CommandObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private MeterRegistry meterRegistry;
        private DeviceSessionFactory sessionFactory;
        private MonotonicClock monotonicClock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withDevices(DeviceDirectory devices) {
            this.devices = devices;
            return this;
        }

        public Builder withTransportConfig(TransportConfig config) {
            this.transportConfig = config;
            return this;
        }

        public Builder withObservabilitySink(CommandObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Adds Micrometer meters alongside the configured sink.
         */
        public Builder withMeterRegistry(MeterRegistry registry) {
            this.meterRegistry = registry;
            return this;
        }

        /**
         * Replaces the Netty session factory, mainly for tests.
         */
        public Builder withSessionFactory(DeviceSessionFactory factory) {
            this.sessionFactory = factory;
            return this;
        }

        public Builder withMonotonicClock(MonotonicClock clock) {
            this.monotonicClock = clock;
            return this;
        }

        public Builder withWallClock(WallClock clock) {
            this.wallClock = clock;
            return this;
        }

        public DeviceLinkRuntime build() {
            Objects.requireNonNull(devices, "devices");
            Objects.requireNonNull(transportConfig, "transportConfig");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(monotonicClock, "monotonicClock");
            Objects.requireNonNull(wallClock, "wallClock");

            // 1. Observability
            List<CommandObservabilitySink> sinks = new ArrayList<>();
            sinks.add(observabilitySink);
            MicrometerCommandObservabilitySink meters = null;
            if (meterRegistry != null) {
                meters = new MicrometerCommandObservabilitySink(meterRegistry);
                sinks.add(meters);
            }
            CommandObservabilitySink effectiveSink = new CompositeObservabilitySink(sinks);

            // 2. Transport
            DeviceSessionFactory factory = sessionFactory != null
                    ? sessionFactory
                    : new NettyDeviceSessionFactory(transportConfig.maxPayloadSize(), effectiveSink, wallClock);

            // 3. Core
            IdempotencyCache cache = new IdempotencyCache(
                    transportConfig.cacheCapacity(),
                    transportConfig.cacheTtl(),
                    monotonicClock);
            if (meters != null) {
                meters.bindIdempotencyCache(cache);
            }

            RetryCorrelationEngine engine = new RetryCorrelationEngine(
                    transportConfig,
                    devices,
                    factory,
                    cache,
                    BackoffPolicy.from(transportConfig),
                    effectiveSink,
                    monotonicClock,
                    wallClock);

            return new DeviceLinkRuntime(engine, factory);
        }
    }
}
