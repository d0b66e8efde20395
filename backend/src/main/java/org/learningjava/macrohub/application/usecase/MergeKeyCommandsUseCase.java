package org.learningjava.macrohub.application.usecase;

import org.learningjava.macrohub.config.KeyCommandsProperties;
import org.learningjava.macrohub.domain.error.InputTooLargeException;
import org.learningjava.macrohub.domain.model.keycommands.GeneratedKeyCommands;
import org.learningjava.macrohub.domain.model.keycommands.MacroRecord;
import org.learningjava.macrohub.domain.service.keycommands.KeyCommandsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.List;

@Service
public class MergeKeyCommandsUseCase {

    private static final Logger log = LoggerFactory.getLogger(MergeKeyCommandsUseCase.class);

    static final String FILE_SUFFIX = "_with_macros.xml";

    private final KeyCommandsEngine engine;
    private final KeyCommandsProperties props;

    public MergeKeyCommandsUseCase(KeyCommandsEngine engine, KeyCommandsProperties props) {
        this.engine = engine;
        this.props = props;
    }

    /**
     * @throws InputTooLargeException the user file exceeds {@code keycommands.max-input-bytes}
     */
    public GeneratedKeyCommands merge(String userXml, List<MacroRecord> records, String baseName) {
        long size = userXml.getBytes(StandardCharsets.UTF_8).length;
        if (size > props.getMaxInputBytes()) {
            throw new InputTooLargeException(size, props.getMaxInputBytes());
        }
        String xml = engine.mergeInto(userXml, records);
        String fileName = DownloadNames.fileName(baseName, props.getDownloadBaseName(), FILE_SUFFIX);
        if (records.isEmpty()) {
            log.info("Nothing selected, {} returned unchanged", fileName);
        } else {
            log.info("Merged {} macros into {}", records.size(), fileName);
        }
        return new GeneratedKeyCommands(fileName, xml, records.size());
    }
}
