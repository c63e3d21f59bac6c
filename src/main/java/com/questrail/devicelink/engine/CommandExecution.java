package com.questrail.devicelink.engine;

import com.questrail.devicelink.api.Attempt;
import com.questrail.devicelink.api.AttemptOutcome;
import com.questrail.devicelink.api.Command;
import com.questrail.devicelink.api.CommandHandle;
import com.questrail.devicelink.api.CommandOutcome;
import com.questrail.devicelink.api.CommandState;
import com.questrail.devicelink.api.FailureReason;
import com.questrail.devicelink.idempotency.RecordedOutcome;
import com.questrail.devicelink.observability.AttemptEvent;
import com.questrail.devicelink.observability.CommandCompletedEvent;
import com.questrail.devicelink.observability.CommandErrorEvent;
import com.questrail.devicelink.observability.DuplicateSuppressedEvent;
import com.questrail.devicelink.observability.StrayResponseEvent;
import com.questrail.devicelink.protocol.codec.FrameCodecException;
import com.questrail.devicelink.protocol.message.DeviceRequest;
import com.questrail.devicelink.protocol.message.DeviceResponse;
import com.questrail.devicelink.protocol.message.MessageId;
import com.questrail.devicelink.protocol.message.PayloadDecodeException;
import com.questrail.devicelink.session.DeviceSession;
import com.questrail.devicelink.session.DeviceSessionException;
import com.questrail.devicelink.session.SessionFailure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * CommandExecution
 * =============================================================================
 * Per-command retry/correlation state machine.
 *
 * <pre>
 *   CREATED → QUEUED → SENT → AWAITING_RESPONSE → SUCCESS
 *                        ↑              │
 *                        └── RETRY ←────┴──────→ FAILED
 * </pre>
 *
 * <h2>Execution model</h2>
 * {@link #run(SessionSource)} drives every attempt synchronously on the calling
 * thread; each wait is a bounded session call or a bounded backoff wait. This
 * keeps the transitions directly testable with a scripted session factory.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Every attempt sends the identical frame; the msg_id never changes.</li>
 *   <li>The idempotency cache is consulted before every attempt. A recorded
 *       success ends the command without sending.</li>
 *   <li>Only a response with the awaited msg_id and opcode resolves the attempt.
 *       Anything else is reported as stray and discarded.</li>
 *   <li>ACK resolves to SUCCESS, NACK to FAILED(DEVICE_REJECTED); neither is retried.</li>
 *   <li>Recoverable session failures are retried until {@code maxAttempts};
 *       terminal ones fail the command immediately.</li>
 *   <li>The command deadline runs from submission and bounds every wait.</li>
 * </ul>
 *
 * <h2>Cancellation</h2>
 * {@link #cancel()} removes a queued command, or closes the active session of a
 * running one so the blocked call returns at once.
 */
public final class CommandExecution implements CommandHandle {

    private static final Logger log = LoggerFactory.getLogger(CommandExecution.class);

    private final Command command;
    private final EngineContext ctx;
    private final long submittedAtNanos;
    private final long deadlineNanos;

    private final AtomicReference<CommandState> state = new AtomicReference<>(CommandState.CREATED);
    private final CompletableFuture<CommandOutcome> outcome = new CompletableFuture<>();
    private final AtomicBoolean completed = new AtomicBoolean(false);
    private final List<Attempt> attempts = new CopyOnWriteArrayList<>();

    private final AtomicReference<FailureReason> abortReason = new AtomicReference<>();
    private final CountDownLatch abortSignal = new CountDownLatch(1);

    private volatile DeviceSession activeSession;
    private volatile Predicate<CommandExecution> unqueue = e -> false;

    CommandExecution(Command command, EngineContext ctx) {
        this.command = Objects.requireNonNull(command, "command");
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.submittedAtNanos = ctx.clock().nowNanos();
        this.deadlineNanos = submittedAtNanos + ctx.config().commandDeadline().toNanos();
    }

    // -------------------------------------------------------------------------
    // CommandHandle
    // -------------------------------------------------------------------------

    @Override
    public Command command() {
        return command;
    }

    @Override
    public CommandState state() {
        return state.get();
    }

    @Override
    public CompletableFuture<CommandOutcome> outcome() {
        return outcome;
    }

    @Override
    public List<Attempt> attempts() {
        return List.copyOf(attempts);
    }

    @Override
    public boolean cancel() {
        return abort(FailureReason.CANCELLED);
    }

    // -------------------------------------------------------------------------
    // Lane hooks
    // -------------------------------------------------------------------------

    void attachQueue(Predicate<CommandExecution> unqueue) {
        this.unqueue = Objects.requireNonNull(unqueue, "unqueue");
    }

    void markQueued() {
        state.compareAndSet(CommandState.CREATED, CommandState.QUEUED);
    }

    /**
     * Terminates a command that never reached a session.
     */
    void reject(FailureReason reason, String detail) {
        complete(CommandOutcome.failed(reason, 0, detail));
    }

    /**
     * Stops the command with {@code reason}: removed if still queued, otherwise
     * its active session is closed and the running thread finishes it.
     */
    boolean abort(FailureReason reason) {
        if (completed.get()) {
            return false;
        }
        if (!abortReason.compareAndSet(null, reason)) {
            return !completed.get();
        }
        abortSignal.countDown();

        if (unqueue.test(this)) {
            complete(CommandOutcome.failed(reason, 0, describeAbort(reason) + " while queued"));
            return true;
        }
        DeviceSession session = activeSession;
        if (session != null) {
            session.close();
        }
        return true;
    }

    // -------------------------------------------------------------------------
    // State machine
    // -------------------------------------------------------------------------

    /**
     * Drives the command to a terminal outcome on the calling thread.
     */
    CommandOutcome run(SessionSource sessions) {
        Objects.requireNonNull(sessions, "sessions");
        if (completed.get()) {
            return outcome.join();
        }

        MDC.put("msg_id", command.msgId().value());
        MDC.put("device_id", command.deviceId());
        try {
            complete(drive(sessions));
        } catch (RuntimeException e) {
            log.error("Unexpected failure executing command {}", command.msgId(), e);
            emitError("Unexpected failure executing command " + command.msgId(), e);
            complete(CommandOutcome.failed(FailureReason.IO_ERROR, attempts.size(),
                    "Unexpected failure: " + e.getMessage()));
        } finally {
            MDC.remove("msg_id");
            MDC.remove("device_id");
        }
        return outcome.join();
    }

    private CommandOutcome drive(SessionSource sessions) {
        DeviceRequest request = command.toRequest();
        final byte[] frame;
        try {
            frame = ctx.frameEncoder().encode(ctx.payloadCodec().encodeRequest(request));
        } catch (FrameCodecException e) {
            return CommandOutcome.failed(FailureReason.PROTOCOL_ERROR, 0, "Request cannot be framed: " + e.getMessage());
        }

        int maxAttempts = ctx.config().maxAttempts();
        boolean onlyTimeouts = true;

        for (int attemptNumber = 1; ; attemptNumber++) {
            FailureReason aborted = abortReason.get();
            if (aborted != null) {
                return abortedOutcome(aborted);
            }

            Optional<RecordedOutcome> known = ctx.cache().lookup(command.msgId());
            if (known.isPresent()) {
                return fromCache(known.get(), attemptNumber);
            }

            if (remainingNanos() <= 0L) {
                return CommandOutcome.failed(FailureReason.DEADLINE_EXCEEDED, attempts.size(),
                        "Deadline of " + ctx.config().commandDeadline().toMillis() + "ms elapsed before attempt " + attemptNumber);
            }

            AttemptResult result = attempt(attemptNumber, frame, request, sessions);
            if (result.outcome() == AttemptOutcome.SUCCESS) {
                return CommandOutcome.success(attempts.size(), "Acknowledged on attempt " + attemptNumber);
            }
            if (result.outcome() == AttemptOutcome.REJECTED) {
                return CommandOutcome.failed(FailureReason.DEVICE_REJECTED, attempts.size(), result.detail());
            }

            aborted = abortReason.get();
            if (aborted != null) {
                return abortedOutcome(aborted);
            }

            SessionFailure failure = result.failure();
            if (!failure.isRecoverable()) {
                FailureReason reason = failure == SessionFailure.PROTOCOL_ERROR
                        ? FailureReason.PROTOCOL_ERROR
                        : FailureReason.IO_ERROR;
                return CommandOutcome.failed(reason, attempts.size(), result.detail());
            }
            onlyTimeouts &= failure.isTimeout();

            if (attemptNumber >= maxAttempts || remainingNanos() <= 0L) {
                if (ctx.cache().lookup(command.msgId()).filter(RecordedOutcome.SUCCESS::equals).isPresent()) {
                    return CommandOutcome.success(attempts.size(), "Acknowledged late, after attempt " + attemptNumber + " failed");
                }
                if (remainingNanos() <= 0L) {
                    return CommandOutcome.failed(FailureReason.DEADLINE_EXCEEDED, attempts.size(),
                            "Deadline elapsed during attempt " + attemptNumber + ": " + result.detail());
                }
                FailureReason reason = onlyTimeouts ? FailureReason.ALL_ATTEMPTS_TIMED_OUT : FailureReason.ATTEMPTS_EXHAUSTED;
                return CommandOutcome.failed(reason, attempts.size(),
                        "Attempt " + attemptNumber + " of " + maxAttempts + " failed: " + result.detail());
            }

            advance(CommandState.RETRY);
            long delayNanos = Math.min(ctx.backoff().delayFor(attemptNumber).toNanos(), remainingNanos());
            try {
                if (abortSignal.await(Math.max(0L, delayNanos), TimeUnit.NANOSECONDS)) {
                    return abortedOutcome(abortReason.get());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return CommandOutcome.failed(FailureReason.ENGINE_SHUTDOWN, attempts.size(), "Interrupted during retry backoff");
            }
        }
    }

    private AttemptResult attempt(int attemptNumber, byte[] frame, DeviceRequest request, SessionSource sessions) {
        long startNanos = ctx.clock().nowNanos();
        Instant startedAt = ctx.wallClock().now();

        DeviceSession session = sessions.acquire();
        activeSession = session;
        try {
            if (abortReason.get() != null) {
                session.close();
            }
            if (!session.isOpen()) {
                session.connect(bounded(ctx.config().connectTimeout()));
            }
            session.send(frame, bounded(ctx.config().sendTimeout()));
            advance(CommandState.SENT);
            advance(CommandState.AWAITING_RESPONSE);

            DeviceResponse response = awaitCorrelated(session, request);
            if (response.ack()) {
                ctx.cache().record(command.msgId(), RecordedOutcome.SUCCESS);
                return finish(attemptNumber, startedAt, startNanos, AttemptOutcome.SUCCESS, null, "Acknowledged");
            }
            ctx.cache().record(command.msgId(), RecordedOutcome.REJECTED);
            return finish(attemptNumber, startedAt, startNanos, AttemptOutcome.REJECTED, null,
                    "Device rejected command: " + response.rejectionReason().orElse("no reason given"));
        } catch (DeviceSessionException e) {
            recordLateResponses(session, request);
            AttemptOutcome kind = e.failure().isTimeout() ? AttemptOutcome.TIMEOUT : AttemptOutcome.ERROR;
            return finish(attemptNumber, startedAt, startNanos, kind, e.failure(), e.getMessage());
        } finally {
            activeSession = null;
            sessions.release(session);
        }
    }

    private DeviceResponse awaitCorrelated(DeviceSession session, DeviceRequest request) throws DeviceSessionException {
        long waitUntil = Math.min(ctx.clock().nowNanos() + ctx.config().responseTimeout().toNanos(), deadlineNanos);
        while (true) {
            long remaining = Math.max(0L, waitUntil - ctx.clock().nowNanos());
            byte[] payload = session.receive(Duration.ofNanos(remaining));
            Optional<DeviceResponse> response = correlate(payload, request);
            if (response.isPresent()) {
                return response.get();
            }
        }
    }

    /**
     * Decodes {@code payload} and returns it only if it answers {@code request}.
     * Uncorrelated responses are reported and discarded; an uncorrelated ACK is
     * still recorded under its own msg_id so a later retry of that command is
     * recognized as already applied.
     */
    private Optional<DeviceResponse> correlate(byte[] payload, DeviceRequest request) {
        final DeviceResponse response;
        try {
            response = ctx.payloadCodec().decodeResponse(payload);
        } catch (PayloadDecodeException e) {
            emitStray(null, "Undecodable response payload: " + e.getMessage());
            return Optional.empty();
        }

        if (response.correlatesWith(request)) {
            return Optional.of(response);
        }

        if (!response.msgId().equals(request.msgId())) {
            if (response.ack()) {
                ctx.cache().record(response.msgId(), RecordedOutcome.SUCCESS);
            }
            emitStray(response.msgId(), "msg_id does not match the awaited command");
        } else {
            emitStray(response.msgId(), "opcode " + response.opcode() + " does not match " + request.opcode());
        }
        return Optional.empty();
    }

    // Frames that arrived after the wait gave up.
    private void recordLateResponses(DeviceSession session, DeviceRequest request) {
        for (byte[] payload : session.drainBuffered()) {
            correlate(payload, request).ifPresent(late -> {
                log.debug("Late {} for msg_id {}", late.ack() ? "ACK" : "NACK", late.msgId());
                ctx.cache().record(late.msgId(), late.ack() ? RecordedOutcome.SUCCESS : RecordedOutcome.REJECTED);
            });
        }
    }

    private CommandOutcome fromCache(RecordedOutcome known, int attemptNumber) {
        if (known == RecordedOutcome.REJECTED) {
            return CommandOutcome.failed(FailureReason.DEVICE_REJECTED, attempts.size(), "Previously rejected by device");
        }
        emit(() -> ctx.sink().onDuplicateSuppressed(new DuplicateSuppressedEvent(
                ctx.wallClock().now(), command.msgId(), command.deviceId(), attemptNumber)));
        return CommandOutcome.success(attempts.size(), "Already acknowledged; attempt " + attemptNumber + " suppressed");
    }

    private AttemptResult finish(int attemptNumber,
                                 Instant startedAt,
                                 long startNanos,
                                 AttemptOutcome attemptOutcome,
                                 SessionFailure failure,
                                 String detail) {
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(ctx.clock().nowNanos() - startNanos);
        attempts.add(new Attempt(attemptNumber, startedAt, attemptOutcome, failure, elapsedMillis));
        emit(() -> ctx.sink().onAttempt(new AttemptEvent(
                ctx.wallClock().now(), command.msgId(), command.deviceId(),
                attemptNumber, attemptOutcome, failure, elapsedMillis)));
        return new AttemptResult(attemptOutcome, failure, detail);
    }

    private void complete(CommandOutcome result) {
        if (!completed.compareAndSet(false, true)) {
            return;
        }
        state.set(result.state());
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(ctx.clock().nowNanos() - submittedAtNanos);
        emit(() -> ctx.sink().onCommandCompleted(new CommandCompletedEvent(
                ctx.wallClock().now(), command.msgId(), command.deviceId(), result, elapsedMillis)));
        outcome.complete(result);
    }

    private void advance(CommandState next) {
        state.getAndUpdate(current -> current.isTerminal() ? current : next);
    }

    private CommandOutcome abortedOutcome(FailureReason reason) {
        return CommandOutcome.failed(reason, attempts.size(), describeAbort(reason));
    }

    private static String describeAbort(FailureReason reason) {
        return reason == FailureReason.CANCELLED ? "Cancelled by caller" : "Aborted: " + reason;
    }

    private long remainingNanos() {
        return deadlineNanos - ctx.clock().nowNanos();
    }

    private Duration bounded(Duration phaseTimeout) {
        long remaining = Math.max(0L, remainingNanos());
        return remaining < phaseTimeout.toNanos() ? Duration.ofNanos(remaining) : phaseTimeout;
    }

    private void emitStray(MessageId received, String detail) {
        emit(() -> ctx.sink().onStrayResponse(new StrayResponseEvent(
                ctx.wallClock().now(), command.deviceId(), command.msgId(), received, detail)));
    }

    private void emitError(String message, Throwable cause) {
        emit(() -> ctx.sink().onError(new CommandErrorEvent(ctx.wallClock().now(), message, cause)));
    }

    // The sink must never fail a command.
    private void emit(Runnable emission) {
        try {
            emission.run();
        } catch (RuntimeException e) {
            log.warn("Observability sink failed for msg_id {}", command.msgId(), e);
        }
    }

    private record AttemptResult(AttemptOutcome outcome, SessionFailure failure, String detail) {
    }
}
