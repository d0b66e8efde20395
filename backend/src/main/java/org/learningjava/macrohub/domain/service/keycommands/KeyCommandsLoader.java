package org.learningjava.macrohub.domain.service.keycommands;

import org.learningjava.macrohub.domain.error.MalformedXmlException;
import org.learningjava.macrohub.domain.error.SchemaException;
import org.learningjava.macrohub.domain.model.keycommands.KeyCommandsDocument;
import org.learningjava.macrohub.domain.model.keycommands.KeyCommandsXml;
import org.w3c.dom.Document;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

public class KeyCommandsLoader {

    /**
     * @throws MalformedXmlException the text is not well-formed XML
     * @throws SchemaException       the root element is not {@code KeyCommands}
     */
    public KeyCommandsDocument load(String text) {
        Document dom = XmlSnippets.parse(stripByteOrderMark(text));
        String rootTag = dom.getDocumentElement().getTagName();
        if (!KeyCommandsXml.ROOT.equals(rootTag)) {
            throw new SchemaException(rootTag);
        }
        return new KeyCommandsDocument(dom);
    }

    /**
     * Decodes an upload strictly as UTF-8; anything else is reported as malformed.
     */
    public static String decodeUtf8(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new MalformedXmlException("File must be a valid UTF-8 encoded XML file", e);
        }
    }

    private static String stripByteOrderMark(String text) {
        if (text != null && !text.isEmpty() && text.charAt(0) == '\uFEFF') {
            return text.substring(1);
        }
        return text;
    }
}
