package org.learningjava.macrohub.domain.service.keycommands;

import org.learningjava.macrohub.domain.error.MalformedXmlException;
import org.learningjava.macrohub.domain.model.keycommands.CategoryNode;
import org.learningjava.macrohub.domain.model.keycommands.MacroRecord;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.learningjava.macrohub.domain.model.keycommands.KeyCommandsXml.*;

/**
 * Builds a fresh, minimal Key Commands document that holds only the given macros.
 * <p>
 * Verbatim snippets are preferred; a record without one, or with one that no longer parses,
 * is rebuilt from its structured fields.
 */
public class StandaloneXmlGenerator {

    private final GeneratorOptions options;

    public StandaloneXmlGenerator(GeneratorOptions options) {
        this.options = options;
    }

    public String generate(List<MacroRecord> records, List<String> order, PipelineTraceListener trace) {
        Document dom = XmlSnippets.newDocument();
        MacroNodeFactory nodes = new MacroNodeFactory(dom);

        Element root = dom.createElement(ROOT);
        dom.appendChild(root);
        Element categories = nodes.list(LIST_CATEGORIES);
        root.appendChild(categories);
        Element macroCategory = dom.createElement(TAG_ITEM);
        macroCategory.appendChild(nodes.stringLeaf(FIELD_NAME, CategoryNode.MACRO_CATEGORY));
        categories.appendChild(macroCategory);
        Element references = nodes.list(LIST_COMMANDS);
        macroCategory.appendChild(references);
        Element macros = nodes.list(LIST_MACROS);
        root.appendChild(macros);

        for (MacroRecord record : applyOrder(records, order)) {
            macros.appendChild(definition(nodes, record, trace));
            references.appendChild(reference(nodes, record, trace));
            trace.onEvent(TraceEvent.debug(PipelineStage.GENERATE, record.name(),
                    record.hasDefinitionSnippet() ? "from snippet" : "synthesized"));
        }
        return XmlSnippets.toXml(dom, options.indentOutput() ? options.indentAmount() : 0);
    }

    /**
     * Records named in {@code order} come first, in hint order; the rest follow in caller order.
     * Without a hint the caller order is kept as-is.
     */
    static List<MacroRecord> applyOrder(List<MacroRecord> records, List<String> order) {
        if (order == null || order.isEmpty()) {
            return records;
        }
        Map<String, Integer> rank = new HashMap<>();
        for (int i = 0; i < order.size(); i++) {
            rank.putIfAbsent(order.get(i), i);
        }
        List<MacroRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparingInt(r -> rank.getOrDefault(r.name(), Integer.MAX_VALUE)));
        return sorted;
    }

    private Element definition(MacroNodeFactory nodes, MacroRecord record, PipelineTraceListener trace) {
        if (record.hasDefinitionSnippet()) {
            try {
                return nodes.importSnippet(record.rawDefinitionSnippet(), options.indentOutput());
            } catch (MalformedXmlException e) {
                trace.onEvent(TraceEvent.warn(PipelineStage.GENERATE, record.name(),
                        "definition snippet does not parse, synthesized instead: " + e.getMessage()));
            }
        }
        return nodes.definitionItem(record);
    }

    private Element reference(MacroNodeFactory nodes, MacroRecord record, PipelineTraceListener trace) {
        if (record.hasReferenceSnippet()) {
            try {
                return nodes.importSnippet(record.rawReferenceSnippet(), options.indentOutput());
            } catch (MalformedXmlException e) {
                trace.onEvent(TraceEvent.warn(PipelineStage.GENERATE, record.name(),
                        "reference snippet does not parse, synthesized instead: " + e.getMessage()));
            }
        }
        return nodes.referenceItem(record);
    }
}
