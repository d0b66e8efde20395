package org.learningjava.macrohub.application.usecase;

import org.learningjava.macrohub.config.KeyCommandsProperties;
import org.learningjava.macrohub.domain.model.keycommands.GeneratedKeyCommands;
import org.learningjava.macrohub.domain.model.keycommands.MacroRecord;
import org.learningjava.macrohub.domain.service.keycommands.KeyCommandsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class GenerateKeyCommandsUseCase {

    private static final Logger log = LoggerFactory.getLogger(GenerateKeyCommandsUseCase.class);

    static final String FILE_SUFFIX = "_selected_macros.xml";

    private final KeyCommandsEngine engine;
    private final KeyCommandsProperties props;

    public GenerateKeyCommandsUseCase(KeyCommandsEngine engine, KeyCommandsProperties props) {
        this.engine = engine;
        this.props = props;
    }

    public GeneratedKeyCommands generate(List<MacroRecord> records, List<String> order, String baseName) {
        String xml = engine.generateStandalone(records, order);
        String fileName = DownloadNames.fileName(baseName, props.getDownloadBaseName(), FILE_SUFFIX);
        log.info("Generated {} with {} macros", fileName, records.size());
        return new GeneratedKeyCommands(fileName, xml, records.size());
    }
}
