package com.questrail.devicelink.engine;

import com.questrail.devicelink.api.DeviceEndpoint;
import com.questrail.devicelink.session.DeviceSession;
import com.questrail.devicelink.session.DeviceSessionFactory;

import java.util.Objects;

/**
 * Hands out device sessions for one device.
 *
 * <p>Without reuse every attempt gets a fresh session that is closed when the
 * attempt ends. With reuse a session that is still connected after an attempt
 * is kept and handed to the next attempt or command for the same device. A
 * session that failed is never kept: sessions are single-use per connection.</p>
 */
final class SessionSource {

    private final String deviceId;
    private final DeviceEndpoint endpoint;
    private final DeviceSessionFactory factory;
    private final boolean reuse;

    private DeviceSession retained;

    SessionSource(String deviceId, DeviceEndpoint endpoint, DeviceSessionFactory factory, boolean reuse) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.reuse = reuse;
    }

    /**
     * Returns the retained session if it is still connected, otherwise a new
     * unconnected one.
     */
    synchronized DeviceSession acquire() {
        DeviceSession kept = retained;
        retained = null;
        if (kept != null) {
            if (kept.isOpen()) {
                return kept;
            }
            kept.close();
        }
        return factory.create(deviceId, endpoint);
    }

    synchronized void release(DeviceSession session) {
        if (session == null) {
            return;
        }
        if (reuse && session.isOpen() && retained == null) {
            retained = session;
        } else if (session != retained) {
            session.close();
        }
    }

    synchronized void close() {
        if (retained != null) {
            retained.close();
            retained = null;
        }
    }
}
