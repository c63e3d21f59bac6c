package com.questrail.devicelink.observability;

/**
 * No-op implementation of CommandObservabilitySink.
 */
public final class NullObservabilitySink implements CommandObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onAttempt(AttemptEvent event) {}

    @Override
    public void onCommandCompleted(CommandCompletedEvent event) {}

    @Override
    public void onSessionTransition(SessionTransitionEvent event) {}

    @Override
    public void onStrayResponse(StrayResponseEvent event) {}

    @Override
    public void onDuplicateSuppressed(DuplicateSuppressedEvent event) {}

    @Override
    public void onError(CommandErrorEvent event) {}
}
