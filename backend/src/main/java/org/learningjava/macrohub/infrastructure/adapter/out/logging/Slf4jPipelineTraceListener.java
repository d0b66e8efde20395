package org.learningjava.macrohub.infrastructure.adapter.out.logging;

import org.learningjava.macrohub.domain.service.keycommands.PipelineTraceListener;
import org.learningjava.macrohub.domain.service.keycommands.TraceEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards pipeline events to SLF4J: recovered problems at WARN, progress at DEBUG.
 */
public class Slf4jPipelineTraceListener implements PipelineTraceListener {

    private static final Logger log = LoggerFactory.getLogger(Slf4jPipelineTraceListener.class);

    @Override
    public void onEvent(TraceEvent event) {
        String macro = event.macroName() == null ? "-" : event.macroName();
        if (event.severity() == TraceEvent.Severity.WARN) {
            log.warn("[{}] {}: {}", event.stage(), macro, event.detail());
        } else if (log.isDebugEnabled()) {
            log.debug("[{}] {}: {}", event.stage(), macro, event.detail());
        }
    }
}
