package com.questrail.devicelink.session.netty;

import com.questrail.devicelink.api.DeviceEndpoint;
import com.questrail.devicelink.internal.time.SystemWallClock;
import com.questrail.devicelink.observability.RecordingObservabilitySink;
import com.questrail.devicelink.observability.SessionTransitionEvent;
import com.questrail.devicelink.protocol.codec.FrameError;
import com.questrail.devicelink.protocol.codec.impl.DefaultFrameEncoder;
import com.questrail.devicelink.protocol.message.DeviceRequest;
import com.questrail.devicelink.protocol.message.DeviceResponse;
import com.questrail.devicelink.protocol.message.MessageId;
import com.questrail.devicelink.protocol.message.Opcode;
import com.questrail.devicelink.protocol.message.PayloadCodec;
import com.questrail.devicelink.session.DeviceSession;
import com.questrail.devicelink.session.DeviceSessionException;
import com.questrail.devicelink.session.SessionFailure;
import com.questrail.devicelink.session.SessionState;

import io.netty.channel.ConnectTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises the Netty session against a loopback {@link MockDeviceServer}.
 */
final class NettyDeviceSessionTest {

    private static final Duration CONNECT = Duration.ofSeconds(2);
    private static final Duration SEND = Duration.ofSeconds(2);

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final NettyDeviceSessionFactory factory =
            new NettyDeviceSessionFactory(65_536, sink, SystemWallClock.INSTANCE);
    private final PayloadCodec payloads = new PayloadCodec();
    private final DefaultFrameEncoder frameEncoder = new DefaultFrameEncoder();

    private MockDeviceServer server;

    @AfterEach
    void tearDown() {
        factory.close();
        if (server != null) {
            server.close();
        }
    }

    @Test
    void requestIsAnsweredOverTheSameConnection() throws Exception {
        server = new MockDeviceServer(MockDeviceServer.Mode.ACK);
        DeviceSession session = openSession();
        DeviceRequest request = request();

        session.send(frame(request), SEND);
        DeviceResponse response = payloads.decodeResponse(session.receive(Duration.ofSeconds(2)));

        assertTrue(response.ack());
        assertEquals(request.msgId(), response.msgId());
        assertEquals(SessionState.CONNECTED, session.state());
        assertEquals(List.of(request), server.requests());

        session.close();
        assertEquals(SessionState.DISCONNECTED, session.state());
    }

    @Test
    void transitionsAreReported() throws Exception {
        server = new MockDeviceServer(MockDeviceServer.Mode.ACK);
        DeviceSession session = openSession();

        List<SessionTransitionEvent> transitions = sink.getSessionTransitions();
        assertEquals(SessionState.DISCONNECTED, transitions.get(0).from());
        assertEquals(SessionState.CONNECTING, transitions.get(0).to());
        assertEquals(SessionState.CONNECTED, transitions.get(1).to());
        assertEquals("lamp-1", transitions.get(1).deviceId());

        session.close();
    }

    @Test
    void refusedConnectionIsClassified() throws Exception {
        int port = freePort();
        DeviceSession session = factory.create("lamp-1", new DeviceEndpoint("127.0.0.1", port));

        DeviceSessionException e = assertThrows(DeviceSessionException.class, () -> session.connect(CONNECT));

        assertEquals(SessionFailure.CONNECT_REFUSED, e.failure());
        assertEquals(SessionState.DISCONNECTED, session.state());
        SessionTransitionEvent last = lastTransition();
        assertEquals(SessionState.DISCONNECTED, last.to());
        assertEquals(SessionFailure.CONNECT_REFUSED, last.cause());
    }

    @Test
    void silentDeviceTimesOutAndDisconnects() throws Exception {
        server = new MockDeviceServer(MockDeviceServer.Mode.SILENT);
        DeviceSession session = openSession();
        session.send(frame(request()), SEND);

        DeviceSessionException e = assertThrows(DeviceSessionException.class,
                () -> session.receive(Duration.ofMillis(150)));

        assertEquals(SessionFailure.RECV_TIMEOUT, e.failure());
        assertFalse(session.isOpen());
        DeviceSessionException again = assertThrows(DeviceSessionException.class,
                () -> session.receive(Duration.ofMillis(10)));
        assertEquals(SessionFailure.RECV_TIMEOUT, again.failure());
    }

    @Test
    void peerCloseIsReported() throws Exception {
        server = new MockDeviceServer(MockDeviceServer.Mode.DISCONNECT);
        DeviceSession session = openSession();
        session.send(frame(request()), SEND);

        DeviceSessionException e = assertThrows(DeviceSessionException.class,
                () -> session.receive(Duration.ofSeconds(2)));

        assertEquals(SessionFailure.PEER_CLOSED, e.failure());
        assertEquals(SessionState.DISCONNECTED, session.state());
    }

    @Test
    void badMagicIsAProtocolError() throws Exception {
        server = new MockDeviceServer(MockDeviceServer.Mode.GARBAGE);
        DeviceSession session = openSession();
        session.send(frame(request()), SEND);

        DeviceSessionException e = assertThrows(DeviceSessionException.class,
                () -> session.receive(Duration.ofSeconds(2)));

        assertEquals(SessionFailure.PROTOCOL_ERROR, e.failure());
        assertEquals(FrameError.BAD_MAGIC, e.frameError().orElseThrow());
        assertFalse(e.failure().isRecoverable());
    }

    @Test
    void framesAreDeliveredInArrivalOrderWithoutCorrelation() throws Exception {
        server = new MockDeviceServer(MockDeviceServer.Mode.STRAY_THEN_ACK);
        DeviceSession session = openSession();
        DeviceRequest request = request();
        session.send(frame(request), SEND);

        DeviceResponse first = payloads.decodeResponse(session.receive(Duration.ofSeconds(2)));
        DeviceResponse second = payloads.decodeResponse(session.receive(Duration.ofSeconds(2)));

        assertNotEquals(request.msgId(), first.msgId());
        assertEquals(request.msgId(), second.msgId());
        session.close();
    }

    @Test
    void burstBeyondInboxCapacityStillDeliversTheAwaitedFrame() throws Exception {
        server = new MockDeviceServer(MockDeviceServer.Mode.STRAY_BURST_THEN_ACK);
        DeviceSession session = openSession();
        DeviceRequest request = request();
        session.send(frame(request), SEND);

        int seen = 0;
        DeviceResponse response;
        do {
            response = payloads.decodeResponse(session.receive(Duration.ofSeconds(2)));
            seen++;
        } while (!response.msgId().equals(request.msgId()));

        assertEquals(MockDeviceServer.STRAY_BURST + 1, seen);
        assertTrue(response.ack());
        assertEquals(SessionState.CONNECTED, session.state());
        session.close();
    }

    @Test
    void burstIsAlsoRecoverableThroughDrain() throws Exception {
        server = new MockDeviceServer(MockDeviceServer.Mode.STRAY_BURST_THEN_ACK);
        DeviceSession session = openSession();
        DeviceRequest request = request();
        session.send(frame(request), SEND);
        session.receive(Duration.ofSeconds(2));

        List<byte[]> collected = new ArrayList<>();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (collected.size() < MockDeviceServer.STRAY_BURST && System.nanoTime() < deadline) {
            collected.addAll(session.drainBuffered());
            Thread.sleep(5);
        }

        assertEquals(MockDeviceServer.STRAY_BURST, collected.size());
        DeviceResponse last = payloads.decodeResponse(collected.get(collected.size() - 1));
        assertEquals(request.msgId(), last.msgId());
        session.close();
    }

    @Test
    void frameSplitAcrossSegmentsIsReassembled() throws Exception {
        server = new MockDeviceServer(MockDeviceServer.Mode.FRAGMENTED_ACK);
        DeviceSession session = openSession();
        DeviceRequest request = request();
        session.send(frame(request), SEND);

        DeviceResponse response = payloads.decodeResponse(session.receive(Duration.ofSeconds(2)));

        assertTrue(response.ack());
        assertEquals(request.msgId(), response.msgId());
        assertEquals(SessionState.CONNECTED, session.state());
        session.close();
    }

    @Test
    void declaredLengthAboveCapIsRejectedFromTheHeader() throws Exception {
        server = new MockDeviceServer(MockDeviceServer.Mode.OVERSIZED_HEADER);
        DeviceSession session = openSession();
        session.send(frame(request()), SEND);

        DeviceSessionException e = assertThrows(DeviceSessionException.class,
                () -> session.receive(Duration.ofSeconds(2)));

        assertEquals(SessionFailure.PROTOCOL_ERROR, e.failure());
        assertEquals(FrameError.FRAME_TOO_LARGE, e.frameError().orElseThrow());
        assertEquals(SessionState.DISCONNECTED, session.state());
    }

    @Test
    void closeUnblocksAPendingReceive() throws Exception {
        server = new MockDeviceServer(MockDeviceServer.Mode.SILENT);
        DeviceSession session = openSession();
        session.send(frame(request()), SEND);

        CompletableFuture<byte[]> pending = CompletableFuture.supplyAsync(() -> {
            try {
                return session.receive(Duration.ofSeconds(10));
            } catch (DeviceSessionException e) {
                throw new IllegalStateException(e);
            }
        });
        awaitState(session, SessionState.RECEIVING);

        session.close();

        ExecutionException e = assertThrows(ExecutionException.class, () -> pending.get(2, TimeUnit.SECONDS));
        DeviceSessionException cause = (DeviceSessionException) e.getCause().getCause();
        assertEquals(SessionFailure.CLOSED, cause.failure());
    }

    @Test
    void sessionsAreSingleUse() throws Exception {
        server = new MockDeviceServer(MockDeviceServer.Mode.ACK);
        DeviceSession session = openSession();
        session.close();

        assertThrows(IllegalStateException.class, () -> session.connect(CONNECT));
    }

    @Test
    void sendOnClosedSessionFails() throws Exception {
        server = new MockDeviceServer(MockDeviceServer.Mode.ACK);
        DeviceSession session = openSession();
        session.close();

        DeviceSessionException e = assertThrows(DeviceSessionException.class,
                () -> session.send(frame(request()), SEND));
        assertEquals(SessionFailure.CLOSED, e.failure());
    }

    @Test
    void connectFailuresAreClassifiedByCause() {
        assertEquals(SessionFailure.CONNECT_TIMEOUT,
                NettyDeviceSession.classifyConnectFailure(new ConnectTimeoutException("timed out")));
        assertEquals(SessionFailure.CONNECT_REFUSED,
                NettyDeviceSession.classifyConnectFailure(new ConnectException("refused")));
        assertEquals(SessionFailure.IO_ERROR,
                NettyDeviceSession.classifyConnectFailure(new IOException("boom")));
    }

    // ---------------------------------------------------------------------

    private DeviceSession openSession() throws DeviceSessionException {
        DeviceSession session = factory.create("lamp-1", new DeviceEndpoint(server.host(), server.port()));
        session.connect(CONNECT);
        return session;
    }

    private static DeviceRequest request() {
        return new DeviceRequest(Opcode.TOGGLE, "lamp-1", MessageId.random(), true);
    }

    private byte[] frame(DeviceRequest request) {
        return frameEncoder.encode(payloads.encodeRequest(request));
    }

    private SessionTransitionEvent lastTransition() {
        List<SessionTransitionEvent> transitions = sink.getSessionTransitions();
        return transitions.get(transitions.size() - 1);
    }

    private static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    private static void awaitState(DeviceSession session, SessionState expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (session.state() != expected) {
            if (System.nanoTime() > deadline) {
                fail("Session never reached " + expected + ", is " + session.state());
            }
            Thread.sleep(5);
        }
    }
}
