package org.learningjava.macrohub.domain.error;

public class MalformedXmlException extends KeyCommandsException {

    public MalformedXmlException(String message) {
        super(message);
    }

    public MalformedXmlException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public Kind kind() {
        return Kind.MALFORMED_XML;
    }

    @Override
    public String userMessage() {
        return "The uploaded file is not a valid XML file.";
    }
}
