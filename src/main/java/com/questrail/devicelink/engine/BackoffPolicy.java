package com.questrail.devicelink.engine;

import com.questrail.devicelink.config.TransportConfig;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Retry spacing.
 *
 * <p>The nominal delay after failed attempt {@code k} grows with the attempt
 * number, {@code min(base * k, max)}. The returned delay is the nominal one
 * scaled by a uniform random factor in {@code [1 - jitter, 1 + jitter]} so that
 * many devices failing together do not retry in lockstep.</p>
 *
 * This policy only decides <em>when</em> a retry happens. Whether one happens
 * is decided by the execution state machine.
 */
public final class BackoffPolicy {

    private final Duration base;
    private final Duration max;
    private final double jitterFraction;
    private final DoubleSupplier unitRandom;

    public BackoffPolicy(Duration base, Duration max, double jitterFraction) {
        this(base, max, jitterFraction, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param unitRandom source of values in {@code [0, 1)}; tests pin it
     */
    public BackoffPolicy(Duration base, Duration max, double jitterFraction, DoubleSupplier unitRandom) {
        this.base = Objects.requireNonNull(base, "base");
        this.max = Objects.requireNonNull(max, "max");
        this.unitRandom = Objects.requireNonNull(unitRandom, "unitRandom");
        if (base.isNegative()) {
            throw new IllegalArgumentException("base must be non-negative");
        }
        if (max.compareTo(base) < 0) {
            throw new IllegalArgumentException("max must be >= base");
        }
        if (Double.isNaN(jitterFraction) || jitterFraction < 0.0 || jitterFraction >= 1.0) {
            throw new IllegalArgumentException("jitterFraction must be in [0, 1)");
        }
        this.jitterFraction = jitterFraction;
    }

    public static BackoffPolicy from(TransportConfig config) {
        return new BackoffPolicy(config.backoffBase(), config.backoffMax(), config.jitterFraction());
    }

    /**
     * Delay before the attempt that follows failed attempt {@code attemptNumber}, without jitter.
     */
    public Duration nominalDelay(int attemptNumber) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber is 1-based");
        }
        long baseNanos = base.toNanos();
        if (baseNanos != 0 && attemptNumber > max.toNanos() / baseNanos) {
            return max;
        }
        Duration grown = Duration.ofNanos(baseNanos * attemptNumber);
        return grown.compareTo(max) > 0 ? max : grown;
    }

    /**
     * Jittered delay before the attempt that follows failed attempt {@code attemptNumber}.
     */
    public Duration delayFor(int attemptNumber) {
        long nominal = nominalDelay(attemptNumber).toNanos();
        if (nominal == 0L || jitterFraction == 0.0) {
            return Duration.ofNanos(nominal);
        }
        double r = unitRandom.getAsDouble();
        double factor = 1.0 + jitterFraction * (2.0 * r - 1.0);
        return Duration.ofNanos(Math.round(nominal * factor));
    }

    public Duration base() {
        return base;
    }

    public Duration max() {
        return max;
    }

    public double jitterFraction() {
        return jitterFraction;
    }
}
