package org.learningjava.macrohub.application.usecase;

import org.learningjava.macrohub.config.KeyCommandsProperties;
import org.learningjava.macrohub.domain.error.InputTooLargeException;
import org.learningjava.macrohub.domain.model.keycommands.ParseResult;
import org.learningjava.macrohub.domain.service.keycommands.KeyCommandsEngine;
import org.learningjava.macrohub.domain.service.keycommands.KeyCommandsLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ParseKeyCommandsUseCase {

    private static final Logger log = LoggerFactory.getLogger(ParseKeyCommandsUseCase.class);

    private final KeyCommandsEngine engine;
    private final KeyCommandsProperties props;

    public ParseKeyCommandsUseCase(KeyCommandsEngine engine, KeyCommandsProperties props) {
        this.engine = engine;
        this.props = props;
    }

    /**
     * Validates an uploaded file (size, UTF-8) and parses it.
     *
     * @throws InputTooLargeException the upload exceeds {@code keycommands.max-input-bytes}
     */
    public ParseResult parse(String fileName, byte[] content) {
        if (content.length > props.getMaxInputBytes()) {
            log.warn("Rejected {}: {} bytes over limit {}", fileName, content.length, props.getMaxInputBytes());
            throw new InputTooLargeException(content.length, props.getMaxInputBytes());
        }
        String text = KeyCommandsLoader.decodeUtf8(content);
        ParseResult result = engine.parse(text);

        if (result.skippedCount() > 0) {
            log.warn("{}: {} macros parsed, {} skipped", fileName, result.records().size(), result.skippedCount());
        } else {
            log.info("{}: {} macros parsed", fileName, result.records().size());
        }
        return result;
    }

    public static String summaryMessage(ParseResult result) {
        String message = "Successfully parsed Key Commands file with " + result.records().size() + " macros";
        if (result.skippedCount() > 0) {
            message += " (" + result.skippedCount() + " macros skipped due to errors)";
        }
        return message;
    }
}
