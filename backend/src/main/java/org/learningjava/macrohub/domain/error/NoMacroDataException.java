package org.learningjava.macrohub.domain.error;

public class NoMacroDataException extends KeyCommandsException {

    public NoMacroDataException(String message) {
        super(message);
    }

    @Override
    public Kind kind() {
        return Kind.NO_MACRO_DATA;
    }

    @Override
    public String userMessage() {
        return "No macros found in this file.";
    }
}
