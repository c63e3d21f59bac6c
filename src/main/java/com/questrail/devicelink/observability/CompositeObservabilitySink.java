package com.questrail.devicelink.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Fans events out to several sinks.
 *
 * <p>A sink that throws is logged and skipped; the remaining sinks still
 * receive the event and the exception never reaches the engine.</p>
 */
public final class CompositeObservabilitySink implements CommandObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(CompositeObservabilitySink.class);

    private final List<CommandObservabilitySink> delegates;

    public CompositeObservabilitySink(List<CommandObservabilitySink> delegates) {
        this.delegates = List.copyOf(Objects.requireNonNull(delegates, "delegates"));
    }

    public static CommandObservabilitySink of(CommandObservabilitySink... sinks) {
        return new CompositeObservabilitySink(List.of(sinks));
    }

    @Override
    public void onAttempt(AttemptEvent event) {
        forEach(s -> s.onAttempt(event));
    }

    @Override
    public void onCommandCompleted(CommandCompletedEvent event) {
        forEach(s -> s.onCommandCompleted(event));
    }

    @Override
    public void onSessionTransition(SessionTransitionEvent event) {
        forEach(s -> s.onSessionTransition(event));
    }

    @Override
    public void onStrayResponse(StrayResponseEvent event) {
        forEach(s -> s.onStrayResponse(event));
    }

    @Override
    public void onDuplicateSuppressed(DuplicateSuppressedEvent event) {
        forEach(s -> s.onDuplicateSuppressed(event));
    }

    @Override
    public void onError(CommandErrorEvent event) {
        forEach(s -> s.onError(event));
    }

    private void forEach(Consumer<CommandObservabilitySink> call) {
        for (CommandObservabilitySink sink : delegates) {
            try {
                call.accept(sink);
            } catch (RuntimeException e) {
                log.warn("Observability sink {} failed", sink.getClass().getSimpleName(), e);
            }
        }
    }
}
