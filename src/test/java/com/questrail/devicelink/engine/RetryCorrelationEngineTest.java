package com.questrail.devicelink.engine;

import com.questrail.devicelink.api.Command;
import com.questrail.devicelink.api.CommandHandle;
import com.questrail.devicelink.api.CommandOutcome;
import com.questrail.devicelink.api.CommandState;
import com.questrail.devicelink.api.FailureReason;
import com.questrail.devicelink.config.DeviceDirectory;
import com.questrail.devicelink.config.TransportConfig;
import com.questrail.devicelink.idempotency.IdempotencyCache;
import com.questrail.devicelink.internal.time.SystemMonotonicClock;
import com.questrail.devicelink.internal.time.SystemWallClock;
import com.questrail.devicelink.observability.CommandCompletedEvent;
import com.questrail.devicelink.observability.RecordingObservabilitySink;
import com.questrail.devicelink.protocol.codec.impl.DefaultFrameDecoder;
import com.questrail.devicelink.protocol.message.DeviceResponse;
import com.questrail.devicelink.protocol.message.MessageId;
import com.questrail.devicelink.protocol.message.PayloadCodec;
import com.questrail.devicelink.queue.OverflowPolicy;
import com.questrail.devicelink.session.ScriptedDeviceSessionFactory;
import com.questrail.devicelink.session.ScriptedDeviceSessionFactory.Script;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Queueing, ordering and lifecycle behavior of the engine, on real lane
 * threads against scripted sessions.
 */
class RetryCorrelationEngineTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final PayloadCodec payloads = new PayloadCodec();
    private final ScriptedDeviceSessionFactory sessions = new ScriptedDeviceSessionFactory();
    private RetryCorrelationEngine engine;

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.shutdown();
        }
    }

    @Test
    void executesCommandsForOneDeviceInSubmissionOrder() throws Exception {
        engine = newEngine(b -> b);
        Command first = Command.toggle("lamp-1", true);
        Command second = Command.toggle("lamp-1", false);
        Command third = Command.toggle("lamp-1", true);
        sessions.then(Script.connected().respond(ackFor(first)))
                .then(Script.connected().respond(ackFor(second)))
                .then(Script.connected().respond(ackFor(third)));

        CommandHandle h1 = engine.submit(first);
        CommandHandle h2 = engine.submit(second);
        CommandHandle h3 = engine.submit(third);

        assertTrue(await(h1).isSuccess());
        assertTrue(await(h2).isSuccess());
        assertTrue(await(h3).isSuccess());
        assertEquals(List.of(first.msgId(), second.msgId(), third.msgId()), sentMsgIds());
    }

    @Test
    void fullQueueRejectsWithoutAnyAttempt() throws Exception {
        engine = newEngine(b -> b.withQueueCapacity(1).withOverflowPolicy(OverflowPolicy.REJECT_NEW));
        sessions.then(Script.connected().blockReceiveUntilClosed());

        CommandHandle running = engine.submit(Command.toggle("lamp-1", true));
        awaitFirstSessionReceiving();
        CommandHandle queued = engine.submit(Command.toggle("lamp-1", false));
        CommandHandle rejected = engine.submit(Command.toggle("lamp-1", true));

        assertTrue(rejected.outcome().isDone(), "rejection is immediate");
        CommandOutcome outcome = await(rejected);
        assertEquals(FailureReason.QUEUE_FULL, outcome.reason());
        assertEquals(0, outcome.attempts());
        assertEquals(CommandState.QUEUED, queued.state());
        assertEquals(1, engine.queuedFor("lamp-1"));
        assertEquals(1, sessions.sessions().size());

        assertTrue(running.cancel());
    }

    @Test
    void dropOldestSupersedesTheQueuedCommand() throws Exception {
        engine = newEngine(b -> b.withQueueCapacity(1).withOverflowPolicy(OverflowPolicy.DROP_OLDEST));
        Command latest = Command.toggle("lamp-1", false);
        sessions.then(Script.connected().blockReceiveUntilClosed())
                .then(Script.connected().respond(ackFor(latest)));

        CommandHandle running = engine.submit(Command.toggle("lamp-1", true));
        awaitFirstSessionReceiving();
        CommandHandle superseded = engine.submit(Command.toggle("lamp-1", true));
        CommandHandle newest = engine.submit(latest);

        assertEquals(FailureReason.SUPERSEDED, await(superseded).reason());
        assertEquals(0, await(superseded).attempts());

        assertTrue(running.cancel());
        assertEquals(FailureReason.CANCELLED, await(running).reason());
        assertTrue(await(newest).isSuccess());
    }

    @Test
    void blockWithTimeoutFailsWhenNoSpaceFrees() throws Exception {
        engine = newEngine(b -> b.withQueueCapacity(1)
                .withOverflowPolicy(OverflowPolicy.BLOCK_WITH_TIMEOUT)
                .withEnqueueTimeout(Duration.ofMillis(50)));
        sessions.then(Script.connected().blockReceiveUntilClosed());

        CommandHandle running = engine.submit(Command.toggle("lamp-1", true));
        awaitFirstSessionReceiving();
        engine.submit(Command.toggle("lamp-1", false));
        CommandHandle timedOut = engine.submit(Command.toggle("lamp-1", true));

        assertEquals(FailureReason.ENQUEUE_TIMEOUT, await(timedOut).reason());
        assertTrue(running.cancel());
    }

    @Test
    void cancellingAQueuedCommandRemovesIt() throws Exception {
        engine = newEngine(b -> b);
        sessions.then(Script.connected().blockReceiveUntilClosed());

        CommandHandle running = engine.submit(Command.toggle("lamp-1", true));
        awaitFirstSessionReceiving();
        CommandHandle queued = engine.submit(Command.toggle("lamp-1", false));

        assertTrue(queued.cancel());
        CommandOutcome outcome = await(queued);
        assertEquals(FailureReason.CANCELLED, outcome.reason());
        assertEquals(0, outcome.attempts());
        assertEquals(0, engine.queuedFor("lamp-1"));

        assertTrue(running.cancel());
        assertEquals(FailureReason.CANCELLED, await(running).reason());
        assertEquals(1, sessions.sessions().size());
    }

    @Test
    void devicesProgressIndependently() throws Exception {
        engine = newEngine(b -> b);
        Command other = Command.toggle("lamp-2", true);
        sessions.then(Script.connected().blockReceiveUntilClosed())
                .then(Script.connected().respond(ackFor(other)));

        CommandHandle stuck = engine.submit(Command.toggle("lamp-1", true));
        awaitFirstSessionReceiving();

        assertTrue(await(engine.submit(other)).isSuccess());
        assertFalse(stuck.outcome().isDone());
        assertTrue(stuck.cancel());
    }

    @Test
    void shutdownFailsRunningAndQueuedCommands() throws Exception {
        engine = newEngine(b -> b);
        sessions.then(Script.connected().blockReceiveUntilClosed());

        CommandHandle running = engine.submit(Command.toggle("lamp-1", true));
        awaitFirstSessionReceiving();
        CommandHandle queued = engine.submit(Command.toggle("lamp-1", false));

        engine.shutdown();

        assertFalse(engine.isRunning());
        assertEquals(FailureReason.ENGINE_SHUTDOWN, await(queued).reason());
        assertEquals(FailureReason.ENGINE_SHUTDOWN, await(running).reason());
        assertEquals(FailureReason.ENGINE_SHUTDOWN, await(engine.submit(Command.toggle("lamp-1", true))).reason());
        assertEquals(3, sink.eventsOfType(CommandCompletedEvent.class).size());
    }

    @Test
    void unknownDeviceIsRefusedAtSubmission() {
        engine = newEngine(b -> b);

        assertThrows(IllegalArgumentException.class, () -> engine.submit(Command.toggle("fan-9", true)));
        assertTrue(sessions.sessions().isEmpty());
    }

    @Test
    void executeWaitsForTheOutcome() {
        engine = newEngine(b -> b);
        Command command = Command.toggle("lamp-1", true);
        sessions.then(Script.connected().respond(ackFor(command)));

        CommandOutcome outcome = engine.execute(command);

        assertTrue(outcome.isSuccess());
        assertTrue(engine.idempotencyCache().lookup(command.msgId()).isPresent());
    }

    // ---------------------------------------------------------------------

    private RetryCorrelationEngine newEngine(UnaryOperator<TransportConfig.Builder> tweak) {
        TransportConfig config = tweak.apply(TransportConfig.builder()
                        .withBackoffBase(Duration.ZERO)
                        .withBackoffMax(Duration.ZERO))
                .build();
        DeviceDirectory directory = DeviceDirectory.builder()
                .addDevice("lamp-1", "127.0.0.1", 9000)
                .addDevice("lamp-2", "127.0.0.1", 9001)
                .build();
        SystemMonotonicClock clock = SystemMonotonicClock.INSTANCE;
        return new RetryCorrelationEngine(
                config,
                directory,
                sessions,
                new IdempotencyCache(config.cacheCapacity(), config.cacheTtl(), clock),
                BackoffPolicy.from(config),
                sink,
                clock,
                SystemWallClock.INSTANCE);
    }

    private void awaitFirstSessionReceiving() throws InterruptedException {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (sessions.sessions().isEmpty()) {
            if (System.nanoTime() > deadline) {
                fail("Lane never opened a session");
            }
            Thread.sleep(5);
        }
        assertTrue(sessions.sessions().get(0).awaitReceiving(WAIT));
    }

    private static CommandOutcome await(CommandHandle handle) throws Exception {
        return handle.outcome().get(WAIT.toMillis(), TimeUnit.MILLISECONDS);
    }

    private byte[] ackFor(Command command) {
        return payloads.encodeResponse(DeviceResponse.ack(command.toRequest()));
    }

    private List<MessageId> sentMsgIds() {
        DefaultFrameDecoder decoder = new DefaultFrameDecoder();
        return sessions.sentFrames().stream()
                .map(frame -> payloads.decodeRequest(decoder.decode(frame).payload()).msgId())
                .collect(Collectors.toList());
    }
}
