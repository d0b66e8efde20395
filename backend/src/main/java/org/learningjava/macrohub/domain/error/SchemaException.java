package org.learningjava.macrohub.domain.error;

public class SchemaException extends KeyCommandsException {

    private final String rootTag;

    public SchemaException(String rootTag) {
        super("Unexpected root element '" + rootTag + "', expected 'KeyCommands'");
        this.rootTag = rootTag;
    }

    public String rootTag() {
        return rootTag;
    }

    @Override
    public Kind kind() {
        return Kind.SCHEMA;
    }

    @Override
    public String userMessage() {
        return "Not a Key Commands file: root element must be 'KeyCommands'.";
    }
}
