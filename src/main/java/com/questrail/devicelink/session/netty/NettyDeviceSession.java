package com.questrail.devicelink.session.netty;

import com.questrail.devicelink.api.DeviceEndpoint;
import com.questrail.devicelink.internal.time.WallClock;
import com.questrail.devicelink.observability.CommandObservabilitySink;
import com.questrail.devicelink.observability.SessionTransitionEvent;
import com.questrail.devicelink.protocol.codec.DecodedFrame;
import com.questrail.devicelink.protocol.codec.FrameCodecException;
import com.questrail.devicelink.protocol.codec.FrameDecoder;
import com.questrail.devicelink.protocol.codec.FrameError;
import com.questrail.devicelink.session.DeviceSession;
import com.questrail.devicelink.session.DeviceSessionException;
import com.questrail.devicelink.session.SessionFailure;
import com.questrail.devicelink.session.SessionState;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelOption;
import io.netty.channel.ConnectTimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * NettyDeviceSession
 * =============================================================================
 * Netty-backed implementation of the {@link DeviceSession} port.
 *
 * <h2>Architectural Role</h2>
 * This class adapts Netty's asynchronous channel to the session's blocking,
 * timeout-bounded contract. The engine thread blocks on channel futures and on
 * an inbox queue; the event loop frames inbound bytes and fills that inbox.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Parse payloads or correlate responses</li>
 *   <li>Reconnect on its own</li>
 *   <li>Retry sends</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code ByteBuf}) MUST NOT escape this
 * package. Inbound payloads are copied into {@code byte[]} and all
 * reference-counted buffers are released internally.
 *
 * <h2>Failure model</h2>
 * The first failure wins and is sticky: it is recorded, the session moves to
 * {@link SessionState#DISCONNECTED}, the channel is closed and a blocked
 * {@link #receive(Duration)} is woken. Frames decoded before the failure stay
 * available through {@link #drainBuffered()}.
 */
public final class NettyDeviceSession implements DeviceSession
{
    private static final Logger log = LoggerFactory.getLogger(NettyDeviceSession.class);

    /** Inbox sentinel used to wake a blocked receiver; compared by identity. */
    private static final byte[] WAKEUP = new byte[0];

    /** Extra wait beyond CONNECT_TIMEOUT_MILLIS so Netty's own timeout fires first. */
    private static final long CONNECT_GRACE_MILLIS = 100;

    private final String deviceId;
    private final DeviceEndpoint endpoint;
    private final Bootstrap bootstrap;
    private final FrameDecoder frameDecoder;
    private final int inboxCapacity;
    private final BlockingQueue<byte[]> inbox;
    private final CommandObservabilitySink sink;
    private final WallClock wallClock;

    private final AtomicBoolean used = new AtomicBoolean(false);
    private final AtomicBoolean closedLocally = new AtomicBoolean(false);
    private final AtomicReference<DeviceSessionException> failure = new AtomicReference<>();

    private final Object stateLock = new Object();
    private SessionState state = SessionState.DISCONNECTED;

    private volatile ChannelFuture pendingConnect;
    private volatile Channel channel;
    private volatile FrameInboundHandler inboundHandler;

    NettyDeviceSession(String deviceId,
                       DeviceEndpoint endpoint,
                       Bootstrap bootstrap,
                       FrameDecoder frameDecoder,
                       int inboxCapacity,
                       CommandObservabilitySink sink,
                       WallClock wallClock)
    {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
        this.frameDecoder = Objects.requireNonNull(frameDecoder, "frameDecoder");
        this.inboxCapacity = inboxCapacity;
        this.inbox = new ArrayBlockingQueue<>(inboxCapacity + 1);
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    public String deviceId()
    {
        return deviceId;
    }

    @Override
    public DeviceEndpoint endpoint()
    {
        return endpoint;
    }

    @Override
    public SessionState state()
    {
        synchronized (stateLock) {
            return state;
        }
    }

    @Override
    public void connect(Duration timeout) throws DeviceSessionException
    {
        Objects.requireNonNull(timeout, "timeout");
        if (!used.compareAndSet(false, true)) {
            throw new IllegalStateException("DeviceSession is single-use; create a new session to reconnect");
        }
        if (closedLocally.get()) {
            throw failure.get();
        }

        transition(SessionState.CONNECTING, null);

        FrameInboundHandler handler = new FrameInboundHandler();
        inboundHandler = handler;
        int connectMillis = (int) Math.min(Integer.MAX_VALUE, Math.max(1L, timeout.toMillis()));
        ChannelFuture future = bootstrap.clone()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectMillis)
                .handler(handler)
                .connect(endpoint.toSocketAddress());
        pendingConnect = future;

        final boolean done;
        try {
            done = future.await(connectMillis + CONNECT_GRACE_MILLIS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.channel().close();
            throw fail(SessionFailure.IO_ERROR, null, "Interrupted while connecting to " + endpoint, e);
        }
        finally {
            pendingConnect = null;
        }

        if (!done) {
            future.cancel(false);
            future.channel().close();
            throw fail(SessionFailure.CONNECT_TIMEOUT, null,
                    "Connect to " + endpoint + " timed out after " + connectMillis + "ms", null);
        }
        if (!future.isSuccess()) {
            Throwable cause = future.cause();
            throw fail(classifyConnectFailure(cause), null, "Connect to " + endpoint + " failed: " + cause, cause);
        }

        channel = future.channel();
        synchronized (stateLock) {
            DeviceSessionException existing = failure.get();
            if (existing != null) {
                channel.close();
                throw existing;
            }
            setState(SessionState.CONNECTED, null);
        }
    }

    @Override
    public void send(byte[] frame, Duration timeout) throws DeviceSessionException
    {
        Objects.requireNonNull(frame, "frame");
        Objects.requireNonNull(timeout, "timeout");

        Channel ch = requireOpenChannel();
        transitionIfOpen(SessionState.SENDING);

        ChannelFuture write = ch.writeAndFlush(Unpooled.wrappedBuffer(frame));
        final boolean done;
        try {
            done = write.await(timeout.toMillis());
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw fail(SessionFailure.IO_ERROR, null, "Interrupted while sending to " + endpoint, e);
        }

        if (!done) {
            throw fail(SessionFailure.SEND_TIMEOUT, null,
                    "Send to " + endpoint + " did not complete within " + timeout.toMillis() + "ms", null);
        }
        if (!write.isSuccess()) {
            SessionFailure kind = ch.isActive() ? SessionFailure.IO_ERROR : SessionFailure.PEER_CLOSED;
            throw fail(kind, null, "Send to " + endpoint + " failed: " + write.cause(), write.cause());
        }

        transitionIfOpen(SessionState.CONNECTED);
    }

    @Override
    public byte[] receive(Duration timeout) throws DeviceSessionException
    {
        Objects.requireNonNull(timeout, "timeout");

        byte[] next = inbox.poll();
        if (next == null) {
            if (!state().isOpen()) {
                throw notOpen();
            }
            transitionIfOpen(SessionState.RECEIVING);
            try {
                next = inbox.poll(Math.max(0L, timeout.toNanos()), TimeUnit.NANOSECONDS);
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw fail(SessionFailure.IO_ERROR, null, "Interrupted while awaiting response", e);
            }
            if (next == null) {
                throw fail(SessionFailure.RECV_TIMEOUT, null,
                        "No frame from " + endpoint + " within " + timeout.toMillis() + "ms", null);
            }
        }

        if (next == WAKEUP) {
            throw notOpen();
        }
        resumeReading();

        synchronized (stateLock) {
            if (state == SessionState.RECEIVING) {
                setState(SessionState.CONNECTED, null);
            }
        }
        return next;
    }

    @Override
    public List<byte[]> drainBuffered()
    {
        List<byte[]> drained = new ArrayList<>();
        byte[] next;
        while ((next = inbox.poll()) != null) {
            if (next != WAKEUP) {
                drained.add(next);
            }
        }
        if (!drained.isEmpty()) {
            resumeReading();
        }
        return drained;
    }

    @Override
    public void close()
    {
        if (!closedLocally.compareAndSet(false, true)) {
            return;
        }
        failure.compareAndSet(null, new DeviceSessionException(SessionFailure.CLOSED, "Session closed locally"));

        synchronized (stateLock) {
            if (state.isOpen()) {
                setState(SessionState.CLOSING, null);
            }
        }
        inbox.offer(WAKEUP);

        ChannelFuture connecting = pendingConnect;
        if (connecting != null) {
            connecting.channel().close();
        }
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }

        transition(SessionState.DISCONNECTED, null);
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    static SessionFailure classifyConnectFailure(Throwable cause)
    {
        // ConnectTimeoutException extends ConnectException; test it first.
        if (cause instanceof ConnectTimeoutException) {
            return SessionFailure.CONNECT_TIMEOUT;
        }
        if (cause instanceof ConnectException) {
            return SessionFailure.CONNECT_REFUSED;
        }
        return SessionFailure.IO_ERROR;
    }

    /**
     * Asks the event loop to decode frames held back while the inbox was full.
     * Runs after every take; the pause decision is only made on the event loop.
     */
    private void resumeReading()
    {
        Channel ch = channel;
        FrameInboundHandler handler = inboundHandler;
        if (ch == null || handler == null || !ch.isActive()) {
            return;
        }
        try {
            ch.eventLoop().execute(() -> handler.resume(ch));
        }
        catch (RejectedExecutionException e) {
            log.debug("Event loop for device {} is shut down; not resuming reads", deviceId);
        }
    }

    private Channel requireOpenChannel() throws DeviceSessionException
    {
        Channel ch = channel;
        if (ch == null || !state().isOpen()) {
            throw notOpen();
        }
        return ch;
    }

    private DeviceSessionException notOpen()
    {
        DeviceSessionException existing = failure.get();
        if (existing != null) {
            return new DeviceSessionException(existing.failure(), existing.frameError().orElse(null),
                    "Session to " + endpoint + " is not connected: " + existing.getMessage(), existing);
        }
        return new DeviceSessionException(SessionFailure.CLOSED, "Session to " + endpoint + " is not connected");
    }

    /**
     * Records {@code kind} unless an earlier failure exists, disconnects, and
     * returns whichever failure won.
     */
    private DeviceSessionException fail(SessionFailure kind, FrameError frameError, String message, Throwable cause)
    {
        failure.compareAndSet(null, new DeviceSessionException(kind, frameError, message, cause));
        DeviceSessionException winner = failure.get();

        transition(SessionState.DISCONNECTED, winner.failure());
        inbox.offer(WAKEUP);

        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
        return winner;
    }

    private void transition(SessionState to, SessionFailure cause)
    {
        synchronized (stateLock) {
            setState(to, cause);
        }
    }

    private void transitionIfOpen(SessionState to)
    {
        synchronized (stateLock) {
            if (state.isOpen()) {
                setState(to, null);
            }
        }
    }

    // Caller holds stateLock.
    private void setState(SessionState to, SessionFailure cause)
    {
        SessionState from = state;
        if (from == to) {
            return;
        }
        state = to;
        try {
            sink.onSessionTransition(new SessionTransitionEvent(wallClock.now(), deviceId, from, to, cause));
        }
        catch (RuntimeException e) {
            log.warn("Observability sink rejected session transition for device {}", deviceId, e);
        }
    }

    /**
     * FrameInboundHandler
     * -------------------------------------------------------------------------
     * Accumulates inbound bytes, cuts them into frames with the stateless
     * {@link FrameDecoder} and hands payload copies to the inbox. The decoder
     * rejects an oversized declared length from the 7-byte header alone.
     *
     * <p>When the inbox is full the next frame stays in the accumulation
     * buffer and auto-read is switched off, so the socket applies
     * backpressure instead of frames being lost. A consumer taking frames
     * out of the inbox resumes decoding on the event loop.</p>
     */
    private final class FrameInboundHandler extends ChannelInboundHandlerAdapter
    {
        private ByteBuf cumulation;

        @Override
        public void handlerAdded(ChannelHandlerContext ctx)
        {
            cumulation = ctx.alloc().buffer();
        }

        @Override
        public void handlerRemoved(ChannelHandlerContext ctx)
        {
            if (cumulation != null) {
                cumulation.release();
                cumulation = null;
            }
        }

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg)
        {
            ByteBuf in = (ByteBuf) msg;
            try {
                if (failure.get() != null || cumulation == null) {
                    return;
                }
                cumulation.writeBytes(in);
            }
            finally {
                in.release();
            }
            drainFrames(ctx.channel());
        }

        void resume(Channel ch)
        {
            if (failure.get() != null || cumulation == null) {
                return;
            }
            drainFrames(ch);
        }

        private void drainFrames(Channel ch)
        {
            while (cumulation.isReadable()) {
                if (inbox.size() >= inboxCapacity) {
                    if (ch.config().isAutoRead()) {
                        log.debug("Inbox full for device {}; pausing reads", deviceId);
                        ch.config().setAutoRead(false);
                    }
                    return;
                }
                final DecodedFrame frame;
                try {
                    frame = frameDecoder.decode(ByteBufUtil.getBytes(cumulation));
                }
                catch (FrameCodecException e) {
                    if (e.isRecoverable()) {
                        break;
                    }
                    fail(SessionFailure.PROTOCOL_ERROR, e.error(),
                            "Invalid frame from " + endpoint + ": " + e.getMessage(), e);
                    return;
                }

                cumulation.skipBytes(frame.bytesConsumed());
                inbox.offer(frame.payload());
            }
            cumulation.discardSomeReadBytes();
            if (!ch.config().isAutoRead()) {
                ch.config().setAutoRead(true);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            if (!closedLocally.get()) {
                fail(SessionFailure.PEER_CLOSED, null, "Device " + endpoint + " closed the connection", null);
            }
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            fail(SessionFailure.IO_ERROR, null, "I/O error on " + endpoint + ": " + cause.getMessage(), cause);
            ctx.close();
        }
    }
}
