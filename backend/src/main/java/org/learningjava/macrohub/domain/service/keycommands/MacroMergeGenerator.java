package org.learningjava.macrohub.domain.service.keycommands;

import org.learningjava.macrohub.domain.error.MalformedXmlException;
import org.learningjava.macrohub.domain.error.SnippetReparseException;
import org.learningjava.macrohub.domain.model.keycommands.CategoryNode;
import org.learningjava.macrohub.domain.model.keycommands.KeyCommandsDocument;
import org.learningjava.macrohub.domain.model.keycommands.MacroRecord;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Optional;

import static org.learningjava.macrohub.domain.model.keycommands.KeyCommandsXml.*;

/**
 * Splices macros into a caller-supplied Key Commands file.
 * <p>
 * Only two places of the user's tree are touched: the root "Macros" list and the Commands list
 * of the "Macro" category. Missing containers are created; everything else is written back as it
 * was parsed. Names are not deduplicated, a macro that already exists in the file is appended
 * again.
 */
public class MacroMergeGenerator {

    private final KeyCommandsLoader loader;

    public MacroMergeGenerator(KeyCommandsLoader loader) {
        this.loader = loader;
    }

    /**
     * @return the merged document; {@code userText} itself when {@code records} is empty
     * @throws MalformedXmlException    {@code userText} is not well-formed
     * @throws SnippetReparseException  a record's stored snippet does not parse
     */
    public String merge(String userText, List<MacroRecord> records, PipelineTraceListener trace) {
        KeyCommandsDocument document = loader.load(userText);
        if (records.isEmpty()) {
            trace.onEvent(TraceEvent.debug(PipelineStage.MERGE, null, "nothing to merge"));
            return userText;
        }

        Element root = document.root();
        Optional<Element> existingMacros = document.findNamedList(LIST_MACROS);
        Element macros = existingMacros.orElseGet(() -> {
            trace.onEvent(TraceEvent.debug(PipelineStage.MERGE, null, "created Macros list"));
            return document.createNamedList(root, LIST_MACROS);
        });
        Element categories = document.findNamedList(LIST_CATEGORIES).orElseGet(() -> {
            trace.onEvent(TraceEvent.debug(PipelineStage.MERGE, null, "created Categories list"));
            return document.createNamedList(root, LIST_CATEGORIES, macros);
        });
        Element macroCategory = document.findCategory(CategoryNode.MACRO_CATEGORY).orElseGet(() -> {
            trace.onEvent(TraceEvent.debug(PipelineStage.MERGE, null, "created 'Macro' category"));
            return document.createCategory(categories, CategoryNode.MACRO_CATEGORY);
        });
        Element references = document.findNamedList(macroCategory, LIST_COMMANDS)
                .orElseGet(() -> document.createNamedList(macroCategory, LIST_COMMANDS));

        MacroNodeFactory nodes = new MacroNodeFactory(document.dom());
        for (MacroRecord record : records) {
            MacroNodeFactory.appendIndented(macros, definition(nodes, record));
            MacroNodeFactory.appendIndented(references, reference(nodes, record));
            trace.onEvent(TraceEvent.debug(PipelineStage.MERGE, record.name(), "appended"));
        }
        return XmlSnippets.toXml(document.dom(), 0);
    }

    private Element definition(MacroNodeFactory nodes, MacroRecord record) {
        if (!record.hasDefinitionSnippet()) {
            return nodes.definitionItem(record);
        }
        try {
            return nodes.importSnippet(record.rawDefinitionSnippet(), false);
        } catch (MalformedXmlException e) {
            throw new SnippetReparseException(record.name(), e);
        }
    }

    private Element reference(MacroNodeFactory nodes, MacroRecord record) {
        if (!record.hasReferenceSnippet()) {
            return nodes.referenceItem(record);
        }
        try {
            return nodes.importSnippet(record.rawReferenceSnippet(), false);
        } catch (MalformedXmlException e) {
            throw new SnippetReparseException(record.name(), e);
        }
    }
}
