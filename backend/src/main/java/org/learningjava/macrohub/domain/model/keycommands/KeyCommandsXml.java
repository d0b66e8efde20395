package org.learningjava.macrohub.domain.model.keycommands;

import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Vocabulary and small DOM helpers for the list/item/string dialect of Key Commands files.
 * <pre>
 * &lt;KeyCommands&gt;
 *    &lt;list name="Categories" type="list"&gt;
 *       &lt;item&gt;
 *          &lt;string name="Name" value="Macro"/&gt;
 *          &lt;list name="Commands" type="list"&gt;
 *             &lt;item&gt;
 *                &lt;string name="Name" value="My Macro"/&gt;
 *                &lt;string name="Key" value="Ctrl+Alt+M"/&gt;
 *             &lt;/item&gt;
 *          &lt;/list&gt;
 *       &lt;/item&gt;
 *    &lt;/list&gt;
 *    &lt;list name="Macros" type="list"&gt;
 *       &lt;item&gt;
 *          &lt;string name="Name" value="My Macro"/&gt;
 *          &lt;list name="Commands" type="list"&gt;
 *             &lt;item&gt;
 *                &lt;string name="Category" value="Edit"/&gt;
 *                &lt;string name="Name" value="Undo"/&gt;
 *             &lt;/item&gt;
 *          &lt;/list&gt;
 *       &lt;/item&gt;
 *    &lt;/list&gt;
 * &lt;/KeyCommands&gt;
 * </pre>
 */
public final class KeyCommandsXml {

    public static final String ROOT = "KeyCommands";

    public static final String TAG_LIST = "list";
    public static final String TAG_ITEM = "item";
    public static final String TAG_STRING = "string";

    public static final String ATTR_NAME = "name";
    public static final String ATTR_VALUE = "value";
    public static final String ATTR_TYPE = "type";

    public static final String LIST_CATEGORIES = "Categories";
    public static final String LIST_MACROS = "Macros";
    public static final String LIST_COMMANDS = "Commands";

    public static final String FIELD_NAME = "Name";
    public static final String FIELD_DESCRIPTION = "Description";
    public static final String FIELD_CATEGORY = "Category";
    public static final String FIELD_KEY = "Key";

    private KeyCommandsXml() {
    }

    public static List<Element> childElements(Element parent) {
        List<Element> out = new ArrayList<>();
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element e) {
                out.add(e);
            }
        }
        return out;
    }

    public static List<Element> childElements(Element parent, String tag) {
        List<Element> out = new ArrayList<>();
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element e && tag.equals(e.getTagName())) {
                out.add(e);
            }
        }
        return out;
    }

    /**
     * Value of the first direct leaf child named {@code field}, e.g. {@code <string name="Name" value="x"/>}.
     */
    public static Optional<String> leafValue(Element item, String field) {
        for (Element child : childElements(item)) {
            if (!TAG_LIST.equals(child.getTagName())
                    && field.equals(child.getAttribute(ATTR_NAME))
                    && child.hasAttribute(ATTR_VALUE)) {
                return Optional.of(child.getAttribute(ATTR_VALUE));
            }
        }
        return Optional.empty();
    }

    /**
     * Key bindings of an item in both spellings the host application writes:
     * repeated {@code <string name="Key" value="..."/>} leaves and
     * {@code <list name="Key"><item value="..."/></list>}.
     */
    public static List<String> keyBindings(Element item) {
        List<String> keys = new ArrayList<>();
        for (Element child : childElements(item)) {
            if (!FIELD_KEY.equals(child.getAttribute(ATTR_NAME))) {
                continue;
            }
            if (TAG_LIST.equals(child.getTagName())) {
                for (Element keyItem : childElements(child, TAG_ITEM)) {
                    addIfPresent(keys, keyItem.getAttribute(ATTR_VALUE));
                }
            } else {
                addIfPresent(keys, child.getAttribute(ATTR_VALUE));
            }
        }
        return keys;
    }

    private static void addIfPresent(List<String> keys, String value) {
        if (value != null && !value.isBlank()) {
            keys.add(value);
        }
    }
}
