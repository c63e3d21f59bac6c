package com.questrail.devicelink.api;

import com.questrail.devicelink.session.SessionFailure;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One transmission of a command over one device session.
 *
 * @param attemptNumber 1-based
 * @param sentAt        wall-clock time the attempt started (observability only)
 * @param outcome       result of the attempt
 * @param failure       transport failure behind a TIMEOUT/ERROR outcome, if any
 * @param elapsedMillis time from attempt start to its outcome
 */
public record Attempt(
        int attemptNumber,
        Instant sentAt,
        AttemptOutcome outcome,
        SessionFailure failure,
        long elapsedMillis
) {
    public Attempt {
        Objects.requireNonNull(sentAt, "sentAt");
        Objects.requireNonNull(outcome, "outcome");
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber is 1-based");
        }
    }

    public Optional<SessionFailure> sessionFailure() {
        return Optional.ofNullable(failure);
    }
}
