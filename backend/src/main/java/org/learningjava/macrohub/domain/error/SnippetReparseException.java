package org.learningjava.macrohub.domain.error;

/**
 * A stored verbatim snippet no longer parses. Callers can retry with
 * {@code MacroRecord.withoutSnippets()} to fall back to the structured form.
 */
public class SnippetReparseException extends KeyCommandsException {

    private final String macroName;

    public SnippetReparseException(String macroName, Throwable cause) {
        super("Stored XML of macro '" + macroName + "' does not parse", cause);
        this.macroName = macroName;
    }

    public String macroName() {
        return macroName;
    }

    @Override
    public Kind kind() {
        return Kind.SNIPPET_REPARSE;
    }

    @Override
    public String userMessage() {
        return "A stored macro could not be re-inserted.";
    }
}
