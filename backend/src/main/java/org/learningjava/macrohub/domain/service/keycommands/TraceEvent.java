package org.learningjava.macrohub.domain.service.keycommands;

/**
 * One observation made while a Key Commands file moves through the pipeline.
 *
 * @param stage     pipeline stage that emitted the event
 * @param macroName macro the event is about, null for file-level events
 * @param severity  DEBUG for progress, WARN for recovered problems
 * @param detail    human readable detail
 */
public record TraceEvent(
        PipelineStage stage,
        String macroName,
        Severity severity,
        String detail
) {

    public enum Severity { DEBUG, WARN }

    public static TraceEvent debug(PipelineStage stage, String macroName, String detail) {
        return new TraceEvent(stage, macroName, Severity.DEBUG, detail);
    }

    public static TraceEvent warn(PipelineStage stage, String macroName, String detail) {
        return new TraceEvent(stage, macroName, Severity.WARN, detail);
    }
}
