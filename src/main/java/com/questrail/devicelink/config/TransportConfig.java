package com.questrail.devicelink.config;

import com.questrail.devicelink.protocol.codec.impl.FrameLayout;
import com.questrail.devicelink.queue.OverflowPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * TransportConfig
 * -----------------------------------------------------------------------------
 * Validated operational configuration for the transport core.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>queueCapacity</b> / <b>overflowPolicy</b> / <b>enqueueTimeout</b>: per-device
 *       ingress bound and what happens when it is reached. The timeout applies only to
 *       {@link OverflowPolicy#BLOCK_WITH_TIMEOUT}.</li>
 *   <li><b>maxAttempts</b>: upper bound on frames sent per command, first attempt included.</li>
 *   <li><b>backoffBase</b> / <b>backoffMax</b> / <b>jitterFraction</b>: retry spacing. The delay
 *       before attempt {@code k + 1} is {@code min(backoffBase * k, backoffMax)} scaled by a
 *       random factor in {@code [1 - jitter, 1 + jitter]}.</li>
 *   <li><b>cacheCapacity</b> / <b>cacheTtl</b>: idempotency cache bounds; TTL is measured
 *       from insertion.</li>
 *   <li><b>maxPayloadSize</b>: frame payload cap in both directions, at most
 *       {@link FrameLayout#LIMIT_MAX_PAYLOAD_SIZE}.</li>
 *   <li><b>connectTimeout</b> / <b>sendTimeout</b> / <b>responseTimeout</b>: per-phase I/O bounds.</li>
 *   <li><b>commandDeadline</b>: overall bound from submission to terminal outcome.</li>
 *   <li><b>reuseSession</b>: keep a connected session for the next command instead of opening one per attempt.</li>
 * </ul>
 *
 * <p>Invalid combinations fail here, at construction, never mid-flight.</p>
 */
public record TransportConfig(
        int queueCapacity,
        OverflowPolicy overflowPolicy,
        Duration enqueueTimeout,
        int maxAttempts,
        Duration backoffBase,
        Duration backoffMax,
        double jitterFraction,
        int cacheCapacity,
        Duration cacheTtl,
        int maxPayloadSize,
        Duration connectTimeout,
        Duration sendTimeout,
        Duration responseTimeout,
        Duration commandDeadline,
        boolean reuseSession
) {
    public TransportConfig {
        Objects.requireNonNull(overflowPolicy, "overflowPolicy");
        Objects.requireNonNull(enqueueTimeout, "enqueueTimeout");
        Objects.requireNonNull(backoffBase, "backoffBase");
        Objects.requireNonNull(backoffMax, "backoffMax");
        Objects.requireNonNull(cacheTtl, "cacheTtl");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(sendTimeout, "sendTimeout");
        Objects.requireNonNull(responseTimeout, "responseTimeout");
        Objects.requireNonNull(commandDeadline, "commandDeadline");

        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be > 0");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (cacheCapacity <= 0) {
            throw new IllegalArgumentException("cacheCapacity must be > 0");
        }
        FrameLayout.requireValidMax(maxPayloadSize);
        if (Double.isNaN(jitterFraction) || jitterFraction < 0.0 || jitterFraction >= 1.0) {
            throw new IllegalArgumentException("jitterFraction must be in [0, 1)");
        }
        if (backoffBase.isNegative()) {
            throw new IllegalArgumentException("backoffBase must be non-negative");
        }
        if (backoffMax.compareTo(backoffBase) < 0) {
            throw new IllegalArgumentException("backoffMax must be >= backoffBase");
        }
        if (enqueueTimeout.isNegative()) {
            throw new IllegalArgumentException("enqueueTimeout must be non-negative");
        }
        if (overflowPolicy == OverflowPolicy.BLOCK_WITH_TIMEOUT && enqueueTimeout.isZero()) {
            throw new IllegalArgumentException("enqueueTimeout must be positive for BLOCK_WITH_TIMEOUT");
        }
        requirePositive(cacheTtl, "cacheTtl");
        requirePositive(connectTimeout, "connectTimeout");
        requirePositive(sendTimeout, "sendTimeout");
        requirePositive(responseTimeout, "responseTimeout");
        requirePositive(commandDeadline, "commandDeadline");
        if (commandDeadline.compareTo(connectTimeout.plus(responseTimeout)) < 0) {
            throw new IllegalArgumentException(
                    "commandDeadline must allow at least one connect and one response wait");
        }
    }

    private static void requirePositive(Duration value, String name) {
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    /**
     * Configuration with every parameter at its default:
     *
     * <ul>
     *   <li>queueCapacity: 32, overflowPolicy: REJECT_NEW, enqueueTimeout: 1s</li>
     *   <li>maxAttempts: 2</li>
     *   <li>backoffBase: 250ms, backoffMax: 5s, jitterFraction: 0.1</li>
     *   <li>cacheCapacity: 1000, cacheTtl: 5min</li>
     *   <li>maxPayloadSize: 65536</li>
     *   <li>connectTimeout: 1s, sendTimeout: 1.5s, responseTimeout: 1.5s, commandDeadline: 30s</li>
     *   <li>reuseSession: false</li>
     * </ul>
     */
    public static TransportConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .withQueueCapacity(queueCapacity)
                .withOverflowPolicy(overflowPolicy)
                .withEnqueueTimeout(enqueueTimeout)
                .withMaxAttempts(maxAttempts)
                .withBackoffBase(backoffBase)
                .withBackoffMax(backoffMax)
                .withJitterFraction(jitterFraction)
                .withCacheCapacity(cacheCapacity)
                .withCacheTtl(cacheTtl)
                .withMaxPayloadSize(maxPayloadSize)
                .withConnectTimeout(connectTimeout)
                .withSendTimeout(sendTimeout)
                .withResponseTimeout(responseTimeout)
                .withCommandDeadline(commandDeadline)
                .withReuseSession(reuseSession);
    }

    public static final class Builder {
        private int queueCapacity = 32;
        private OverflowPolicy overflowPolicy = OverflowPolicy.REJECT_NEW;
        private Duration enqueueTimeout = Duration.ofSeconds(1);
        private int maxAttempts = 2;
        private Duration backoffBase = Duration.ofMillis(250);
        private Duration backoffMax = Duration.ofSeconds(5);
        private double jitterFraction = 0.1;
        private int cacheCapacity = 1000;
        private Duration cacheTtl = Duration.ofMinutes(5);
        private int maxPayloadSize = FrameLayout.DEFAULT_MAX_PAYLOAD_SIZE;
        private Duration connectTimeout = Duration.ofSeconds(1);
        private Duration sendTimeout = Duration.ofMillis(1500);
        private Duration responseTimeout = Duration.ofMillis(1500);
        private Duration commandDeadline = Duration.ofSeconds(30);
        private boolean reuseSession = false;

        private Builder() {
        }

        public Builder withQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder withOverflowPolicy(OverflowPolicy overflowPolicy) {
            this.overflowPolicy = overflowPolicy;
            return this;
        }

        public Builder withEnqueueTimeout(Duration enqueueTimeout) {
            this.enqueueTimeout = enqueueTimeout;
            return this;
        }

        public Builder withMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder withBackoffBase(Duration backoffBase) {
            this.backoffBase = backoffBase;
            return this;
        }

        public Builder withBackoffMax(Duration backoffMax) {
            this.backoffMax = backoffMax;
            return this;
        }

        public Builder withJitterFraction(double jitterFraction) {
            this.jitterFraction = jitterFraction;
            return this;
        }

        public Builder withCacheCapacity(int cacheCapacity) {
            this.cacheCapacity = cacheCapacity;
            return this;
        }

        public Builder withCacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
            return this;
        }

        public Builder withMaxPayloadSize(int maxPayloadSize) {
            this.maxPayloadSize = maxPayloadSize;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withSendTimeout(Duration sendTimeout) {
            this.sendTimeout = sendTimeout;
            return this;
        }

        public Builder withResponseTimeout(Duration responseTimeout) {
            this.responseTimeout = responseTimeout;
            return this;
        }

        public Builder withCommandDeadline(Duration commandDeadline) {
            this.commandDeadline = commandDeadline;
            return this;
        }

        public Builder withReuseSession(boolean reuseSession) {
            this.reuseSession = reuseSession;
            return this;
        }

        public TransportConfig build() {
            return new TransportConfig(
                    queueCapacity,
                    overflowPolicy,
                    enqueueTimeout,
                    maxAttempts,
                    backoffBase,
                    backoffMax,
                    jitterFraction,
                    cacheCapacity,
                    cacheTtl,
                    maxPayloadSize,
                    connectTimeout,
                    sendTimeout,
                    responseTimeout,
                    commandDeadline,
                    reuseSession
            );
        }
    }
}
