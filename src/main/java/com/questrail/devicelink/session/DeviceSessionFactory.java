package com.questrail.devicelink.session;

import com.questrail.devicelink.api.DeviceEndpoint;

/**
 * Creates fresh, unconnected {@link DeviceSession}s.
 *
 * <p>The factory owns any resources shared by its sessions (for the Netty
 * implementation, the event loop group) and releases them on {@link #close()}.</p>
 */
public interface DeviceSessionFactory extends AutoCloseable
{
    DeviceSession create(String deviceId, DeviceEndpoint endpoint);

    @Override
    default void close()
    {
    }
}
