package com.questrail.devicelink.engine;

import com.questrail.devicelink.api.Command;
import com.questrail.devicelink.api.CommandHandle;
import com.questrail.devicelink.api.CommandOutcome;
import com.questrail.devicelink.api.DeviceEndpoint;
import com.questrail.devicelink.api.FailureReason;
import com.questrail.devicelink.config.DeviceDirectory;
import com.questrail.devicelink.config.TransportConfig;
import com.questrail.devicelink.idempotency.IdempotencyCache;
import com.questrail.devicelink.internal.time.MonotonicClock;
import com.questrail.devicelink.internal.time.WallClock;
import com.questrail.devicelink.observability.CommandObservabilitySink;
import com.questrail.devicelink.protocol.codec.impl.DefaultFrameEncoder;
import com.questrail.devicelink.protocol.message.PayloadCodec;
import com.questrail.devicelink.queue.CommandQueue;
import com.questrail.devicelink.session.DeviceSessionFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * RetryCorrelationEngine
 * =============================================================================
 * Entry point of the transport core: accepts commands, serializes them per
 * device and resolves each to a terminal {@link CommandOutcome}.
 *
 * <h2>Architectural Role</h2>
 * <ul>
 *   <li>Owns one {@link DeviceLane} per device, created on first use.</li>
 *   <li>Shares one {@link IdempotencyCache} across all lanes.</li>
 *   <li>Never lets one device's failure reach another device's lane.</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * The engine owns its lane executor. {@link #shutdown()} fails queued commands
 * with {@link FailureReason#ENGINE_SHUTDOWN}, aborts running ones and stops the
 * executor. It does not close the session factory, which belongs to the caller.
 */
public final class RetryCorrelationEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RetryCorrelationEngine.class);

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    private final TransportConfig config;
    private final DeviceDirectory directory;
    private final DeviceSessionFactory sessionFactory;
    private final EngineContext context;
    private final ExecutorService executor;

    private final ConcurrentMap<String, DeviceLane> lanes = new ConcurrentHashMap<>();
    private volatile boolean running = true;

    public RetryCorrelationEngine(TransportConfig config,
                                  DeviceDirectory directory,
                                  DeviceSessionFactory sessionFactory,
                                  IdempotencyCache cache,
                                  BackoffPolicy backoff,
                                  CommandObservabilitySink sink,
                                  MonotonicClock clock,
                                  WallClock wallClock) {
        this(config, directory, sessionFactory, cache, backoff, sink, clock, wallClock,
                Executors.newCachedThreadPool(new LaneThreadFactory()));
    }

    public RetryCorrelationEngine(TransportConfig config,
                                  DeviceDirectory directory,
                                  DeviceSessionFactory sessionFactory,
                                  IdempotencyCache cache,
                                  BackoffPolicy backoff,
                                  CommandObservabilitySink sink,
                                  MonotonicClock clock,
                                  WallClock wallClock,
                                  ExecutorService executor) {
        this.config = Objects.requireNonNull(config, "config");
        this.directory = Objects.requireNonNull(directory, "directory");
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.context = new EngineContext(
                config,
                new DefaultFrameEncoder(config.maxPayloadSize()),
                new PayloadCodec(),
                cache,
                backoff,
                sink,
                clock,
                wallClock);
    }

    /**
     * Submits {@code command} and returns at once.
     *
     * <p>A command the queue cannot take is already terminal on return
     * ({@link FailureReason#QUEUE_FULL} or {@link FailureReason#ENQUEUE_TIMEOUT}).
     * Under block-with-timeout this call may wait up to the enqueue timeout.</p>
     *
     * @throws IllegalArgumentException if the device is not in the directory
     */
    public CommandHandle submit(Command command) {
        Objects.requireNonNull(command, "command");
        DeviceEndpoint endpoint = directory.resolve(command.deviceId());

        CommandExecution execution = new CommandExecution(command, context);
        if (!running) {
            execution.reject(FailureReason.ENGINE_SHUTDOWN, "Engine is shut down");
            return execution;
        }

        DeviceLane lane = lanes.computeIfAbsent(command.deviceId(), id -> newLane(id, endpoint));
        try {
            lane.submit(execution);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            execution.reject(FailureReason.CANCELLED, "Interrupted while waiting for queue space");
        }
        return execution;
    }

    /**
     * Submits {@code command} and waits for its outcome. The wait is bounded
     * by the command deadline plus the enqueue wait.
     */
    public CommandOutcome execute(Command command) {
        return submit(command).outcome().join();
    }

    /**
     * Number of commands waiting (not running) for {@code deviceId}.
     */
    public int queuedFor(String deviceId) {
        DeviceLane lane = lanes.get(deviceId);
        return lane == null ? 0 : lane.queued();
    }

    public TransportConfig config() {
        return config;
    }

    public IdempotencyCache idempotencyCache() {
        return context.cache();
    }

    public boolean isRunning() {
        return running;
    }

    public void shutdown() {
        if (!running) {
            return;
        }
        running = false;
        lanes.values().forEach(DeviceLane::shutdown);

        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Lane executor did not stop within {}; interrupting", SHUTDOWN_GRACE);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    private DeviceLane newLane(String deviceId, DeviceEndpoint endpoint) {
        log.debug("Opening lane for device {} at {}", deviceId, endpoint);
        return new DeviceLane(
                deviceId,
                new CommandQueue<>(config.queueCapacity(), config.overflowPolicy(), config.enqueueTimeout()),
                new SessionSource(deviceId, endpoint, sessionFactory, config.reuseSession()),
                executor);
    }

    private static final class LaneThreadFactory implements ThreadFactory {
        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "devicelink-lane-" + sequence.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
