package com.questrail.devicelink.config;

import com.questrail.devicelink.api.DeviceEndpoint;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Maps device ids to their network endpoints.
 */
public final class DeviceDirectory {
    private final Map<String, DeviceEndpoint> devices;

    private DeviceDirectory(Map<String, DeviceEndpoint> devices) {
        this.devices = Collections.unmodifiableMap(new HashMap<>(devices));
    }

    /**
     * Resolves a device id to its endpoint.
     * @throws IllegalArgumentException if the device is unknown
     */
    public DeviceEndpoint resolve(String deviceId) {
        DeviceEndpoint endpoint = devices.get(deviceId);
        if (endpoint == null) {
            throw new IllegalArgumentException("Unknown device: " + deviceId);
        }
        return endpoint;
    }

    public Optional<DeviceEndpoint> find(String deviceId) {
        return Optional.ofNullable(devices.get(deviceId));
    }

    public Set<String> allDevices() {
        return devices.keySet();
    }

    /**
     * Directory holding a single device, as used by the command-line harness.
     */
    public static DeviceDirectory single(String deviceId, DeviceEndpoint endpoint) {
        return builder().addDevice(deviceId, endpoint).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, DeviceEndpoint> devices = new HashMap<>();

        public Builder addDevice(String deviceId, DeviceEndpoint endpoint) {
            Objects.requireNonNull(deviceId, "deviceId");
            if (deviceId.isBlank()) {
                throw new IllegalArgumentException("deviceId must not be blank");
            }
            devices.put(deviceId, Objects.requireNonNull(endpoint, "endpoint"));
            return this;
        }

        public Builder addDevice(String deviceId, String host, int port) {
            return addDevice(deviceId, new DeviceEndpoint(host, port));
        }

        public DeviceDirectory build() {
            if (devices.isEmpty()) {
                throw new IllegalStateException("At least one device required");
            }
            return new DeviceDirectory(devices);
        }
    }
}
