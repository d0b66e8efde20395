package org.learningjava.macrohub.config;

import org.learningjava.macrohub.domain.service.keycommands.GeneratorOptions;
import org.learningjava.macrohub.domain.service.keycommands.KeyCommandsEngine;
import org.learningjava.macrohub.domain.service.keycommands.PipelineTraceListener;
import org.learningjava.macrohub.infrastructure.adapter.out.logging.Slf4jPipelineTraceListener;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {

    // the engine is plain Java, wired here
    @Bean
    PipelineTraceListener pipelineTraceListener(KeyCommandsProperties props) {
        return props.isTraceEnabled() ? new Slf4jPipelineTraceListener() : PipelineTraceListener.NONE;
    }

    @Bean
    KeyCommandsEngine keyCommandsEngine(KeyCommandsProperties props, PipelineTraceListener trace) {
        return new KeyCommandsEngine(
                new GeneratorOptions(props.isIndentOutput(), props.getIndentAmount()),
                trace
        );
    }
}
