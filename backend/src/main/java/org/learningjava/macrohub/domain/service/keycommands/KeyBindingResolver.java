package org.learningjava.macrohub.domain.service.keycommands;

import org.learningjava.macrohub.domain.model.keycommands.CategoryNode;
import org.learningjava.macrohub.domain.model.keycommands.KeyCommandsDocument;
import org.learningjava.macrohub.domain.model.keycommands.MacroRecord;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.learningjava.macrohub.domain.model.keycommands.KeyCommandsXml.*;

/**
 * Attaches key bindings and the verbatim reference item from Categories / "Macro" / Commands
 * to extracted macros.
 * <p>
 * Names are matched exactly through an index. Several records sharing a name all receive the
 * bindings of the matching reference; when several references share a name, the last one in
 * document order wins. Duplicates are neither merged nor rejected.
 */
public class KeyBindingResolver {

    public List<MacroRecord> resolve(List<MacroRecord> records, KeyCommandsDocument document,
                                     PipelineTraceListener trace) {
        Optional<Element> references = document.findCategory(CategoryNode.MACRO_CATEGORY)
                .flatMap(category -> document.findNamedList(category, LIST_COMMANDS));
        if (references.isEmpty()) {
            trace.onEvent(TraceEvent.debug(PipelineStage.RESOLVE, null, "no 'Macro' category, bindings left empty"));
            return List.copyOf(records);
        }

        Map<String, List<Integer>> positionsByName = new HashMap<>();
        for (int i = 0; i < records.size(); i++) {
            positionsByName.computeIfAbsent(records.get(i).name(), k -> new ArrayList<>()).add(i);
        }

        List<MacroRecord> resolved = new ArrayList<>(records);
        for (Element reference : childElements(references.get(), TAG_ITEM)) {
            Optional<String> name = leafValue(reference, FIELD_NAME);
            if (name.isEmpty()) {
                trace.onEvent(TraceEvent.warn(PipelineStage.RESOLVE, null, "reference item without Name ignored"));
                continue;
            }
            List<Integer> positions = positionsByName.get(name.get());
            if (positions == null) {
                trace.onEvent(TraceEvent.debug(PipelineStage.RESOLVE, name.get(), "reference without macro definition"));
                continue;
            }
            List<String> bindings = keyBindings(reference);
            String snippet = XmlSnippets.serialize(reference);
            for (int position : positions) {
                if (resolved.get(position).hasReferenceSnippet()) {
                    trace.onEvent(TraceEvent.warn(PipelineStage.RESOLVE, name.get(),
                            "duplicate reference, earlier bindings overwritten"));
                }
                resolved.set(position, resolved.get(position).withKeyBindings(bindings, snippet));
            }
            trace.onEvent(TraceEvent.debug(PipelineStage.RESOLVE, name.get(), "bindings " + bindings));
        }
        return List.copyOf(resolved);
    }
}
