package org.learningjava.macrohub.domain.error;

public class InputTooLargeException extends KeyCommandsException {

    private final long maxBytes;

    public InputTooLargeException(long actualBytes, long maxBytes) {
        super("Input of " + actualBytes + " bytes exceeds the limit of " + maxBytes + " bytes");
        this.maxBytes = maxBytes;
    }

    @Override
    public Kind kind() {
        return Kind.INPUT_TOO_LARGE;
    }

    @Override
    public String userMessage() {
        return "File size cannot exceed " + (maxBytes / (1024 * 1024)) + "MB.";
    }
}
