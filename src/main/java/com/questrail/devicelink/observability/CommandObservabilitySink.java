package com.questrail.devicelink.observability;

/**
 * Receives the structured events the transport core emits.
 *
 * <h2>Lifecycle</h2>
 * A sink is created once at process start, passed explicitly to the runtime
 * and torn down by its owner at shutdown. There is no global registry.
 *
 * <h2>Threading</h2>
 * Callbacks arrive on engine worker threads and Netty event-loop threads,
 * concurrently across devices. Implementations must be thread-safe and must
 * not block: the core calls them inline and never waits for a slow consumer.
 */
public interface CommandObservabilitySink {

    /**
     * Called after each transmission attempt resolves.
     */
    void onAttempt(AttemptEvent event);

    /**
     * Called once when a command reaches its terminal outcome.
     */
    void onCommandCompleted(CommandCompletedEvent event);

    /**
     * Called on every device session state change.
     */
    void onSessionTransition(SessionTransitionEvent event);

    /**
     * Called when a response is discarded because nothing awaits it.
     */
    void onStrayResponse(StrayResponseEvent event);

    /**
     * Called when a retry is skipped because the command already succeeded.
     */
    void onDuplicateSuppressed(DuplicateSuppressedEvent event);

    /**
     * Called when an unexpected error occurs.
     */
    void onError(CommandErrorEvent event);
}
