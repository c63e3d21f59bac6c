package com.questrail.devicelink.api;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Network location of one device.
 */
public record DeviceEndpoint(String host, int port) {

    public DeviceEndpoint {
        Objects.requireNonNull(host, "host");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 1 || port > 65_535) {
            throw new IllegalArgumentException("port must be 1-65535");
        }
    }

    /**
     * Unresolved so that name resolution happens at connect time.
     */
    public InetSocketAddress toSocketAddress() {
        return InetSocketAddress.createUnresolved(host, port);
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
