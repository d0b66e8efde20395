package org.learningjava.macrohub.domain.service.keycommands;

import org.learningjava.macrohub.domain.model.keycommands.MacroRecord;
import org.learningjava.macrohub.domain.model.keycommands.SubCommand;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.Map;

import static org.learningjava.macrohub.domain.model.keycommands.KeyCommandsXml.*;

/**
 * Builds definition and reference items, either from a record's verbatim snippets or, when
 * those are missing, from its structured fields.
 */
class MacroNodeFactory {

    private final Document dom;

    MacroNodeFactory(Document dom) {
        this.dom = dom;
    }

    /**
     * Re-parses a stored snippet and imports it into the target document.
     *
     * @throws org.learningjava.macrohub.domain.error.MalformedXmlException the snippet does not parse
     */
    Element importSnippet(String snippet, boolean stripWhitespace) {
        Element parsed = XmlSnippets.parseFragment(snippet);
        if (stripWhitespace) {
            XmlSnippets.stripWhitespace(parsed);
        }
        return (Element) dom.importNode(parsed, true);
    }

    Element definitionItem(MacroRecord record) {
        Element item = dom.createElement(TAG_ITEM);
        item.appendChild(stringLeaf(FIELD_NAME, record.name()));
        if (!record.description().isBlank()) {
            item.appendChild(stringLeaf(FIELD_DESCRIPTION, record.description()));
        }
        if (!record.commands().isEmpty()) {
            Element commands = list(LIST_COMMANDS);
            for (SubCommand command : record.commands()) {
                commands.appendChild(commandItem(command));
            }
            item.appendChild(commands);
        }
        return item;
    }

    /**
     * Name plus one Key leaf per binding; without bindings this is a Name-only reference.
     */
    Element referenceItem(MacroRecord record) {
        Element item = dom.createElement(TAG_ITEM);
        item.appendChild(stringLeaf(FIELD_NAME, record.name()));
        for (String key : record.keyBindings()) {
            item.appendChild(stringLeaf(FIELD_KEY, key));
        }
        return item;
    }

    Element list(String name) {
        Element list = dom.createElement(TAG_LIST);
        list.setAttribute(ATTR_NAME, name);
        list.setAttribute(ATTR_TYPE, "list");
        return list;
    }

    Element stringLeaf(String name, String value) {
        Element leaf = dom.createElement(TAG_STRING);
        leaf.setAttribute(ATTR_NAME, name);
        leaf.setAttribute(ATTR_VALUE, value);
        return leaf;
    }

    // the host application writes Category before Name
    private Element commandItem(SubCommand command) {
        Element item = dom.createElement(TAG_ITEM);
        String category = command.parameter(FIELD_CATEGORY);
        if (category != null) {
            item.appendChild(stringLeaf(FIELD_CATEGORY, category));
        }
        item.appendChild(stringLeaf(FIELD_NAME, command.name()));
        for (Map.Entry<String, String> parameter : command.parameters().entrySet()) {
            if (!FIELD_CATEGORY.equals(parameter.getKey())) {
                item.appendChild(stringLeaf(parameter.getKey(), parameter.getValue()));
            }
        }
        return item;
    }

    /**
     * Appends {@code child} to {@code list} and, when the list is already laid out on several
     * lines, repeats the indentation of its existing items.
     */
    static void appendIndented(Element list, Node child) {
        Node last = list.getLastChild();
        if (last == null || last.getNodeType() != Node.TEXT_NODE || !last.getNodeValue().isBlank()) {
            list.appendChild(child);
            return;
        }
        String closing = last.getNodeValue();
        String itemIndent = closing + "   ";
        for (Node n = list.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n.getNodeType() == Node.ELEMENT_NODE) {
                Node before = n.getPreviousSibling();
                if (before != null && before.getNodeType() == Node.TEXT_NODE && before.getNodeValue().isBlank()) {
                    itemIndent = before.getNodeValue();
                }
                break;
            }
        }
        Document owner = list.getOwnerDocument();
        list.insertBefore(owner.createTextNode(itemIndent), last);
        list.insertBefore(child, last);
    }
}
