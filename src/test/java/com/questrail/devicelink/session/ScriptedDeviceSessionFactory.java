package com.questrail.devicelink.session;

import com.questrail.devicelink.api.DeviceEndpoint;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * ScriptedDeviceSessionFactory
 * -----------------------------------------------------------------------------
 * Test-only {@link DeviceSessionFactory} whose sessions follow canned scripts.
 *
 * <p>Each call to {@link #create(String, DeviceEndpoint)} consumes the next
 * {@link Script}. Sessions perform no I/O: connect and send succeed or fail as
 * scripted, and receive returns scripted payloads in order, then times out.
 * Every frame passed to {@code send} is recorded across all sessions.</p>
 */
public final class ScriptedDeviceSessionFactory implements DeviceSessionFactory {

    private final Deque<Script> scripts = new ArrayDeque<>();
    private final List<ScriptedSession> created = new CopyOnWriteArrayList<>();
    private final List<byte[]> sentFrames = new CopyOnWriteArrayList<>();

    public synchronized ScriptedDeviceSessionFactory then(Script script) {
        scripts.addLast(Objects.requireNonNull(script, "script"));
        return this;
    }

    @Override
    public synchronized DeviceSession create(String deviceId, DeviceEndpoint endpoint) {
        Script script = scripts.pollFirst();
        if (script == null) {
            throw new IllegalStateException("No scripted session left for device " + deviceId);
        }
        ScriptedSession session = new ScriptedSession(deviceId, endpoint, script);
        created.add(session);
        return session;
    }

    public List<byte[]> sentFrames() {
        return Collections.unmodifiableList(new ArrayList<>(sentFrames));
    }

    public List<ScriptedSession> sessions() {
        return Collections.unmodifiableList(new ArrayList<>(created));
    }

    public synchronized int remainingScripts() {
        return scripts.size();
    }

    // ---------------------------------------------------------------------
    // Script
    // ---------------------------------------------------------------------

    public static final class Script {
        private SessionFailure connectFailure;
        private SessionFailure sendFailure;
        private final Deque<Object> receiveSteps = new ArrayDeque<>();
        private final List<byte[]> lateFrames = new ArrayList<>();
        private boolean blockReceiveUntilClosed;

        public static Script connected() {
            return new Script();
        }

        public static Script connectFails(SessionFailure failure) {
            Script script = new Script();
            script.connectFailure = failure;
            return script;
        }

        public Script sendFails(SessionFailure failure) {
            this.sendFailure = failure;
            return this;
        }

        /** Next {@code receive} returns {@code payload}. */
        public Script respond(byte[] payload) {
            receiveSteps.addLast(payload.clone());
            return this;
        }

        /** Next {@code receive} fails with {@code failure}. */
        public Script failReceive(SessionFailure failure) {
            receiveSteps.addLast(failure);
            return this;
        }

        /** Payload returned by {@code drainBuffered} after the session fails. */
        public Script lateFrame(byte[] payload) {
            lateFrames.add(payload.clone());
            return this;
        }

        /** Once the steps run out, {@code receive} blocks until the session is closed. */
        public Script blockReceiveUntilClosed() {
            this.blockReceiveUntilClosed = true;
            return this;
        }
    }

    // ---------------------------------------------------------------------
    // Session
    // ---------------------------------------------------------------------

    public final class ScriptedSession implements DeviceSession {
        private final String deviceId;
        private final DeviceEndpoint endpoint;
        private final Script script;
        private final CountDownLatch closedSignal = new CountDownLatch(1);
        private final CountDownLatch receiving = new CountDownLatch(1);

        private volatile SessionState state = SessionState.DISCONNECTED;
        private volatile boolean connectCalled;
        private volatile boolean closed;
        private final List<byte[]> buffered = new ArrayList<>();

        ScriptedSession(String deviceId, DeviceEndpoint endpoint, Script script) {
            this.deviceId = deviceId;
            this.endpoint = endpoint;
            this.script = script;
        }

        @Override
        public String deviceId() {
            return deviceId;
        }

        @Override
        public DeviceEndpoint endpoint() {
            return endpoint;
        }

        @Override
        public SessionState state() {
            return state;
        }

        @Override
        public void connect(Duration timeout) throws DeviceSessionException {
            if (connectCalled) {
                throw new IllegalStateException("DeviceSession is single-use");
            }
            connectCalled = true;
            requireNotClosed();
            if (script.connectFailure != null) {
                throw fail(script.connectFailure);
            }
            state = SessionState.CONNECTED;
        }

        @Override
        public void send(byte[] frame, Duration timeout) throws DeviceSessionException {
            requireNotClosed();
            if (!state.isOpen()) {
                throw new DeviceSessionException(SessionFailure.CLOSED, "Not connected");
            }
            if (script.sendFailure != null) {
                throw fail(script.sendFailure);
            }
            sentFrames.add(frame.clone());
        }

        @Override
        public byte[] receive(Duration timeout) throws DeviceSessionException {
            requireNotClosed();
            if (!state.isOpen()) {
                throw new DeviceSessionException(SessionFailure.CLOSED, "Not connected");
            }
            Object step;
            synchronized (script) {
                step = script.receiveSteps.pollFirst();
            }
            if (step instanceof byte[]) {
                return (byte[]) step;
            }
            if (step instanceof SessionFailure) {
                throw fail((SessionFailure) step);
            }
            if (script.blockReceiveUntilClosed) {
                receiving.countDown();
                try {
                    closedSignal.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                throw new DeviceSessionException(SessionFailure.CLOSED, "Session closed while receiving");
            }
            throw fail(SessionFailure.RECV_TIMEOUT);
        }

        @Override
        public synchronized List<byte[]> drainBuffered() {
            List<byte[]> out = new ArrayList<>(buffered);
            buffered.clear();
            return out;
        }

        @Override
        public void close() {
            closed = true;
            state = SessionState.DISCONNECTED;
            closedSignal.countDown();
        }

        public boolean isClosed() {
            return closed;
        }

        /** Waits until a receive call is parked in {@link Script#blockReceiveUntilClosed()}. */
        public boolean awaitReceiving(Duration timeout) throws InterruptedException {
            return receiving.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        private void requireNotClosed() throws DeviceSessionException {
            if (closed) {
                throw new DeviceSessionException(SessionFailure.CLOSED, "Session closed");
            }
        }

        private DeviceSessionException fail(SessionFailure failure) {
            state = SessionState.DISCONNECTED;
            synchronized (this) {
                buffered.addAll(script.lateFrames);
            }
            return new DeviceSessionException(failure, "Scripted " + failure);
        }
    }
}
