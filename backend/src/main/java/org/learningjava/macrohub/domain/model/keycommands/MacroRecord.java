package org.learningjava.macrohub.domain.model.keycommands;

import java.util.Arrays;
import java.util.List;

/**
 * A user macro read from a Key Commands file.
 * <p>
 * Holds two views of the same macro: the structured fields used for display, search and
 * editing, and the optional verbatim XML of its definition item and binding-reference item.
 * Generators prefer the verbatim form whenever it is present.
 *
 * @param name                 macro name, never blank
 * @param description          explicit or synthesized description, never null
 * @param commands             sub-commands in document order
 * @param keyBindings          shortcuts as shown by the host application, e.g. "Ctrl+Alt+M"
 * @param rawDefinitionSnippet serialized definition item from the Macros list (nullable)
 * @param rawReferenceSnippet  serialized reference item from the "Macro" category (nullable)
 */
public record MacroRecord(
        String name,
        String description,
        List<SubCommand> commands,
        List<String> keyBindings,
        String rawDefinitionSnippet,
        String rawReferenceSnippet
) {

    public static final String KEY_BINDING_SEPARATOR = ", ";

    public MacroRecord {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Macro name must not be blank");
        }
        description = description == null ? "" : description;
        commands = commands == null ? List.of() : List.copyOf(commands);
        keyBindings = keyBindings == null ? List.of() : List.copyOf(keyBindings);
    }

    public MacroRecord(String name, String description, List<SubCommand> commands, List<String> keyBindings) {
        this(name, description, commands, keyBindings, null, null);
    }

    public boolean hasDefinitionSnippet() {
        return rawDefinitionSnippet != null && !rawDefinitionSnippet.isBlank();
    }

    public boolean hasReferenceSnippet() {
        return rawReferenceSnippet != null && !rawReferenceSnippet.isBlank();
    }

    public MacroRecord withKeyBindings(List<String> bindings, String referenceSnippet) {
        return new MacroRecord(name, description, commands, bindings, rawDefinitionSnippet, referenceSnippet);
    }

    // what gets persisted when the original file is not kept
    public MacroRecord withoutSnippets() {
        return new MacroRecord(name, description, commands, keyBindings, null, null);
    }

    public String keyBindingDisplay() {
        return String.join(KEY_BINDING_SEPARATOR, keyBindings);
    }

    public static List<String> splitKeyBindings(String display) {
        if (display == null || display.isBlank()) {
            return List.of();
        }
        return Arrays.stream(display.split(KEY_BINDING_SEPARATOR))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
