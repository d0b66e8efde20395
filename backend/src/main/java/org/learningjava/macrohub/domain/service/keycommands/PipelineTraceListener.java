package org.learningjava.macrohub.domain.service.keycommands;

/**
 * Caller-supplied hook receiving {@link TraceEvent}s from the engine.
 * Implementations must not throw; the engine does not guard against it.
 */
@FunctionalInterface
public interface PipelineTraceListener {

    PipelineTraceListener NONE = event -> { };

    void onEvent(TraceEvent event);
}
