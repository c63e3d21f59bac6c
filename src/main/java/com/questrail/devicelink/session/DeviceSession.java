package com.questrail.devicelink.session;

import com.questrail.devicelink.api.DeviceEndpoint;

import java.time.Duration;
import java.util.List;

/**
 * DeviceSession
 * =============================================================================
 * One TCP connection to one device, for the lifetime of that connection.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Single use: {@link #connect(Duration)} may be called once. A caller that
 *       needs a new connection asks the factory for a new session.</li>
 *   <li>No implicit reconnect. Reconnection policy belongs to the engine.</li>
 *   <li>Every blocking operation takes an explicit timeout.</li>
 *   <li>Any failure or timeout leaves the session {@link SessionState#DISCONNECTED}
 *       and surfaces as a {@link DeviceSessionException}.</li>
 *   <li>Inbound bytes are framed by the session; callers receive payloads.
 *       Buffered inbound data is capped at one maximum-size frame.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * One caller thread drives connect/send/receive. {@link #close()} may be called
 * from any thread and unblocks a pending send or receive.
 */
public interface DeviceSession extends AutoCloseable
{
    String deviceId();

    DeviceEndpoint endpoint();

    SessionState state();

    default boolean isOpen()
    {
        return state().isOpen();
    }

    /**
     * Open the TCP connection.
     *
     * @throws DeviceSessionException {@link SessionFailure#CONNECT_TIMEOUT},
     *         {@link SessionFailure#CONNECT_REFUSED} or {@link SessionFailure#IO_ERROR}
     * @throws IllegalStateException if this session was already used
     */
    void connect(Duration timeout) throws DeviceSessionException;

    /**
     * Write one complete, already-encoded frame.
     *
     * @throws DeviceSessionException {@link SessionFailure#SEND_TIMEOUT},
     *         {@link SessionFailure#PEER_CLOSED}, {@link SessionFailure#IO_ERROR}
     *         or {@link SessionFailure#CLOSED}
     */
    void send(byte[] frame, Duration timeout) throws DeviceSessionException;

    /**
     * Wait for the next inbound frame and return its payload.
     *
     * <p>Frames already buffered are returned without waiting.</p>
     *
     * @throws DeviceSessionException {@link SessionFailure#RECV_TIMEOUT},
     *         {@link SessionFailure#PEER_CLOSED}, {@link SessionFailure#PROTOCOL_ERROR},
     *         {@link SessionFailure#IO_ERROR} or {@link SessionFailure#CLOSED}
     */
    byte[] receive(Duration timeout) throws DeviceSessionException;

    /**
     * Remove and return payloads that were received but not yet consumed,
     * without waiting. Works after the session has disconnected.
     */
    List<byte[]> drainBuffered();

    /**
     * Close the connection. Idempotent; never throws.
     */
    @Override
    void close();
}
