package com.questrail.devicelink.api;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Caller's view of a submitted command.
 */
public interface CommandHandle
{
    Command command();

    /**
     * Current lifecycle state. Advances monotonically to a terminal state.
     */
    CommandState state();

    /**
     * Completes exactly once with the terminal outcome. Never completes
     * exceptionally.
     */
    CompletableFuture<CommandOutcome> outcome();

    /**
     * Cancel a command that is still queued or in flight.
     *
     * <p>A queued command is removed from its queue. An in-flight command has
     * its device session closed, which unblocks any pending read or write; it
     * then terminates as {@link FailureReason#CANCELLED}.</p>
     *
     * @return {@code true} if the command had not yet reached a terminal state
     */
    boolean cancel();

    /**
     * Snapshot of the attempts made so far, in order.
     */
    List<Attempt> attempts();
}
