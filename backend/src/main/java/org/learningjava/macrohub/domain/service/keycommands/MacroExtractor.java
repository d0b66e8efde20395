package org.learningjava.macrohub.domain.service.keycommands;

import org.learningjava.macrohub.domain.error.NoMacroDataException;
import org.learningjava.macrohub.domain.model.keycommands.ExtractionResult;
import org.learningjava.macrohub.domain.model.keycommands.KeyCommandsDocument;
import org.learningjava.macrohub.domain.model.keycommands.MacroRecord;
import org.learningjava.macrohub.domain.model.keycommands.SubCommand;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.learningjava.macrohub.domain.model.keycommands.KeyCommandsXml.*;

/**
 * Walks the root "Macros" list and turns every readable item into an unresolved {@link MacroRecord}.
 * <p>
 * An item that cannot be read is dropped and counted; it never aborts the rest of the list.
 */
public class MacroExtractor {

    static final int DESCRIBED_COMMANDS = 3;

    public ExtractionResult extract(KeyCommandsDocument document, PipelineTraceListener trace) {
        Optional<Element> macros = document.findNamedList(LIST_MACROS);
        if (macros.isEmpty()) {
            if (document.findNamedList(LIST_CATEGORIES).isEmpty()) {
                throw new NoMacroDataException("Neither a 'Macros' nor a 'Categories' list was found");
            }
            trace.onEvent(TraceEvent.debug(PipelineStage.EXTRACT, null, "no Macros list, only Categories"));
            return new ExtractionResult(List.of(), 0);
        }

        List<MacroRecord> records = new ArrayList<>();
        int skipped = 0;
        int position = 0;
        for (Element item : childElements(macros.get(), TAG_ITEM)) {
            position++;
            Optional<String> name = leafValue(item, FIELD_NAME).filter(n -> !n.isBlank());
            if (name.isEmpty()) {
                skipped++;
                trace.onEvent(TraceEvent.warn(PipelineStage.EXTRACT, null,
                        "macro item #" + position + " has no Name, skipped"));
                continue;
            }
            try {
                // captured before anything else reads the item
                String snippet = XmlSnippets.serialize(item);
                MacroRecord record = toRecord(name.get(), item, snippet, document, trace);
                records.add(record);
                trace.onEvent(TraceEvent.debug(PipelineStage.EXTRACT, record.name(),
                        record.commands().size() + " commands"));
            } catch (RuntimeException e) {
                skipped++;
                trace.onEvent(TraceEvent.warn(PipelineStage.EXTRACT, name.get(),
                        "macro item #" + position + " could not be read: " + e.getMessage()));
            }
        }
        return new ExtractionResult(records, skipped);
    }

    private MacroRecord toRecord(String name, Element item, String snippet,
                                 KeyCommandsDocument document, PipelineTraceListener trace) {
        List<SubCommand> commands = new ArrayList<>();
        Optional<Element> commandList = document.findNamedList(item, LIST_COMMANDS);
        if (commandList.isPresent()) {
            for (Element command : childElements(commandList.get(), TAG_ITEM)) {
                Optional<SubCommand> sub = toSubCommand(command);
                if (sub.isPresent()) {
                    commands.add(sub.get());
                } else {
                    trace.onEvent(TraceEvent.warn(PipelineStage.EXTRACT, name, "command without Name ignored"));
                }
            }
        }

        String description = leafValue(item, FIELD_DESCRIPTION)
                .filter(d -> !d.isBlank())
                .orElseGet(() -> synthesizeDescription(commands));

        return new MacroRecord(name, description, commands, List.of(), snippet, null);
    }

    private Optional<SubCommand> toSubCommand(Element command) {
        Optional<String> name = leafValue(command, FIELD_NAME).filter(n -> !n.isBlank());
        if (name.isEmpty()) {
            return Optional.empty();
        }
        Map<String, String> parameters = new LinkedHashMap<>();
        for (Element leaf : childElements(command)) {
            String key = leaf.getAttribute(ATTR_NAME);
            if (key.isEmpty() || FIELD_NAME.equals(key) || !leaf.hasAttribute(ATTR_VALUE)) {
                continue;
            }
            parameters.putIfAbsent(key, leaf.getAttribute(ATTR_VALUE));
        }
        return Optional.of(new SubCommand(name.get(), parameters));
    }

    /**
     * "Executes: A, B, C" for up to three commands, "Executes: A, B, C and N more commands" beyond.
     */
    static String synthesizeDescription(List<SubCommand> commands) {
        if (commands.isEmpty()) {
            return "";
        }
        List<String> names = commands.stream().map(SubCommand::name).toList();
        String head = String.join(", ", names.subList(0, Math.min(DESCRIBED_COMMANDS, names.size())));
        if (names.size() <= DESCRIBED_COMMANDS) {
            return "Executes: " + head;
        }
        return "Executes: " + head + " and " + (names.size() - DESCRIBED_COMMANDS) + " more commands";
    }
}
