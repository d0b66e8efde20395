package org.learningjava.macrohub.domain.service.keycommands;

import org.learningjava.macrohub.domain.error.MalformedXmlException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.Text;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;

/**
 * Parsing and serialization of whole documents and single nodes.
 * <p>
 * Every call builds its own factory; nothing is shared between calls. DOCTYPE declarations are
 * refused, the host application never writes one.
 */
public final class XmlSnippets {

    private static final Logger log = LoggerFactory.getLogger(XmlSnippets.class);

    public static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"utf-8\"?>";

    private static final String INDENT_AMOUNT = "{http://xml.apache.org/xslt}indent-amount";

    private XmlSnippets() {
    }

    public static Document parse(String text) {
        if (text == null || text.isBlank()) {
            throw new MalformedXmlException("Input is empty");
        }
        try {
            DocumentBuilder builder = newBuilder();
            return builder.parse(new InputSource(new StringReader(text)));
        } catch (SAXParseException e) {
            throw new MalformedXmlException(
                    "XML parsing error at line " + e.getLineNumber() + ", column " + e.getColumnNumber()
                            + ": " + e.getMessage(), e);
        } catch (SAXException | IOException e) {
            throw new MalformedXmlException("Invalid XML: " + e.getMessage(), e);
        }
    }

    /**
     * Parses a snippet that holds exactly one element and returns that element.
     */
    public static Element parseFragment(String snippet) {
        return parse(snippet).getDocumentElement();
    }

    public static Document newDocument() {
        return newBuilder().newDocument();
    }

    /**
     * Serializes one node without XML declaration and without re-indenting it.
     */
    public static String serialize(Node node) {
        StringWriter out = new StringWriter();
        try {
            Transformer t = newTransformer();
            t.setOutputProperty(OutputKeys.INDENT, "no");
            t.transform(new DOMSource(node), new StreamResult(out));
        } catch (TransformerException e) {
            throw new IllegalStateException("Could not serialize <" + node.getNodeName() + ">", e);
        }
        return out.toString();
    }

    /**
     * Serializes a whole document, prefixed with a UTF-8 XML declaration.
     *
     * @param indentAmount spaces per level, 0 keeps the whitespace already in the tree
     */
    public static String toXml(Document dom, int indentAmount) {
        StringWriter out = new StringWriter();
        out.write(XML_DECLARATION);
        out.write('\n');
        try {
            Transformer t = newTransformer();
            if (indentAmount > 0) {
                t.setOutputProperty(OutputKeys.INDENT, "yes");
                t.setOutputProperty(INDENT_AMOUNT, Integer.toString(indentAmount));
            } else {
                t.setOutputProperty(OutputKeys.INDENT, "no");
            }
            t.transform(new DOMSource(dom), new StreamResult(out));
        } catch (TransformerException e) {
            throw new IllegalStateException("Could not serialize document", e);
        }
        return out.toString();
    }

    /**
     * Removes whitespace-only text nodes below {@code node}, so that an indenting transformer
     * does not mix its own line breaks with the ones captured in a snippet.
     */
    public static void stripWhitespace(Node node) {
        Node child = node.getFirstChild();
        while (child != null) {
            Node next = child.getNextSibling();
            if (child instanceof Text text && text.getNodeValue().isBlank()) {
                node.removeChild(child);
            } else if (child.hasChildNodes()) {
                stripWhitespace(child);
            }
            child = next;
        }
    }

    private static DocumentBuilder newBuilder() {
        try {
            DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
            dbf.setNamespaceAware(false);
            dbf.setValidating(false);
            dbf.setExpandEntityReferences(false);
            dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder builder = dbf.newDocumentBuilder();
            builder.setErrorHandler(new RethrowingErrorHandler());
            return builder;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException(e);
        }
    }

    private static Transformer newTransformer() throws TransformerException {
        TransformerFactory tf = TransformerFactory.newInstance();
        tf.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
        tf.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
        Transformer t = tf.newTransformer();
        t.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
        t.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
        return t;
    }

    // The default handler prints "[Fatal Error]" lines to stderr before throwing
    private static final class RethrowingErrorHandler implements ErrorHandler {

        @Override
        public void warning(SAXParseException e) {
            log.debug("XML warning at line {}: {}", e.getLineNumber(), e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    }
}
