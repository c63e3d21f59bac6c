package com.questrail.devicelink.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Terminal result of a command, the only thing surfaced to callers.
 *
 * @param state    {@link CommandState#SUCCESS} or {@link CommandState#FAILED}
 * @param reason   failure reason; {@code null} on success
 * @param attempts number of attempts made, including ones that failed before a frame was written
 * @param detail   human-readable explanation, never {@code null}
 */
public record CommandOutcome(
        CommandState state,
        FailureReason reason,
        int attempts,
        String detail
) {
    public CommandOutcome {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(detail, "detail");
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("Outcome state must be terminal: " + state);
        }
        if ((state == CommandState.FAILED) != (reason != null)) {
            throw new IllegalArgumentException("A reason is required exactly when the command failed");
        }
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be >= 0");
        }
    }

    public static CommandOutcome success(int attempts, String detail) {
        return new CommandOutcome(CommandState.SUCCESS, null, attempts, detail);
    }

    public static CommandOutcome failed(FailureReason reason, int attempts, String detail) {
        return new CommandOutcome(CommandState.FAILED, Objects.requireNonNull(reason, "reason"), attempts, detail);
    }

    public boolean isSuccess() {
        return state == CommandState.SUCCESS;
    }

    public Optional<FailureReason> failureReason() {
        return Optional.ofNullable(reason);
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "Success(attempts=" + attempts + ")"
                : "Failed(" + reason + ", attempts=" + attempts + ": " + detail + ")";
    }
}
