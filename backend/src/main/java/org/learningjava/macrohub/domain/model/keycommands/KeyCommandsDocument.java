package org.learningjava.macrohub.domain.model.keycommands;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.learningjava.macrohub.domain.model.keycommands.KeyCommandsXml.*;

/**
 * A loaded Key Commands file: the DOM tree plus lookup indexes built once at load time.
 * <p>
 * Two indexes are kept: every {@code list} element keyed by (parent, name) and the items of the
 * root Categories list keyed by their {@code Name}. For duplicate keys the first occurrence in
 * document order wins. Nodes created through this class are registered in the indexes, so the
 * merge step can keep using them after mutating the tree.
 * <p>
 * Nesting outside of what is looked up is never validated.
 */
public class KeyCommandsDocument {

    private final Document dom;
    private final Element root;
    private final Map<Element, Map<String, Element>> listsByParent = new IdentityHashMap<>();
    private final Map<String, Element> categoriesByName = new HashMap<>();

    public KeyCommandsDocument(Document dom) {
        this.dom = dom;
        this.root = dom.getDocumentElement();
        indexLists();
        indexCategories();
    }

    public Document dom() {
        return dom;
    }

    public Element root() {
        return root;
    }

    /**
     * Direct child list of {@code parent} whose {@code name} attribute equals {@code name}.
     */
    public Optional<Element> findNamedList(Element parent, String name) {
        Map<String, Element> lists = listsByParent.get(parent);
        return lists == null ? Optional.empty() : Optional.ofNullable(lists.get(name));
    }

    public Optional<Element> findNamedList(String name) {
        return findNamedList(root, name);
    }

    public Optional<Element> findCategory(String name) {
        return Optional.ofNullable(categoriesByName.get(name));
    }

    /**
     * Creates {@code <list name=".." type="list"/>} under {@code parent}, before {@code before}
     * when given, otherwise as last child.
     */
    public Element createNamedList(Element parent, String name, Node before) {
        Element list = dom.createElement(TAG_LIST);
        list.setAttribute(ATTR_NAME, name);
        list.setAttribute(ATTR_TYPE, "list");
        if (before != null && before.getParentNode() == parent) {
            parent.insertBefore(list, before);
        } else {
            parent.appendChild(list);
        }
        listsByParent.computeIfAbsent(parent, k -> new HashMap<>()).putIfAbsent(name, list);
        return list;
    }

    public Element createNamedList(Element parent, String name) {
        return createNamedList(parent, name, null);
    }

    /**
     * Appends a new category item to the given Categories list.
     */
    public Element createCategory(Element categoriesList, String name) {
        Element item = dom.createElement(TAG_ITEM);
        Element nameLeaf = dom.createElement(TAG_STRING);
        nameLeaf.setAttribute(ATTR_NAME, FIELD_NAME);
        nameLeaf.setAttribute(ATTR_VALUE, name);
        item.appendChild(nameLeaf);
        categoriesList.appendChild(item);
        if (categoriesList.getParentNode() == root) {
            categoriesByName.putIfAbsent(name, item);
        }
        return item;
    }

    public List<CategoryNode> categories() {
        Optional<Element> categories = findNamedList(LIST_CATEGORIES);
        if (categories.isEmpty()) {
            return List.of();
        }
        List<CategoryNode> out = new ArrayList<>();
        for (Element item : childElements(categories.get(), TAG_ITEM)) {
            Optional<String> name = leafValue(item, FIELD_NAME);
            if (name.isEmpty()) {
                continue;
            }
            List<String> commandNames = new ArrayList<>();
            findNamedList(item, LIST_COMMANDS).ifPresent(commands -> {
                for (Element command : childElements(commands, TAG_ITEM)) {
                    leafValue(command, FIELD_NAME).ifPresent(commandNames::add);
                }
            });
            out.add(new CategoryNode(name.get(), commandNames));
        }
        return out;
    }

    private void indexLists() {
        NodeList lists = dom.getElementsByTagName(TAG_LIST);
        for (int i = 0; i < lists.getLength(); i++) {
            Element list = (Element) lists.item(i);
            if (!(list.getParentNode() instanceof Element parent) || !list.hasAttribute(ATTR_NAME)) {
                continue;
            }
            listsByParent.computeIfAbsent(parent, k -> new HashMap<>())
                    .putIfAbsent(list.getAttribute(ATTR_NAME), list);
        }
    }

    private void indexCategories() {
        findNamedList(LIST_CATEGORIES).ifPresent(categories -> {
            for (Element item : childElements(categories, TAG_ITEM)) {
                leafValue(item, FIELD_NAME).ifPresent(name -> categoriesByName.putIfAbsent(name, item));
            }
        });
    }
}
