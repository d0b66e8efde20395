package org.learningjava.macrohub.domain.error;

/**
 * Base of every structural failure of the Key Commands pipeline.
 * <p>
 * {@link #getMessage()} carries the technical detail for logs, {@link #userMessage()} the text
 * shown to the person who uploaded the file. Each kind has its own user message so that callers
 * never collapse distinct conditions into one generic failure.
 */
public abstract class KeyCommandsException extends RuntimeException {

    public enum Kind {
        MALFORMED_XML,
        SCHEMA,
        NO_MACRO_DATA,
        SNIPPET_REPARSE,
        INPUT_TOO_LARGE
    }

    protected KeyCommandsException(String message) {
        super(message);
    }

    protected KeyCommandsException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract Kind kind();

    public abstract String userMessage();
}
