package org.learningjava.macrohub.domain.model.keycommands;

import java.util.List;

// An entry of the Categories list; "Macro" holds the bindings of user macros
public record CategoryNode(
        String name,
        List<String> commandNames
) {

    public static final String MACRO_CATEGORY = "Macro";

    public CategoryNode {
        commandNames = commandNames == null ? List.of() : List.copyOf(commandNames);
    }

    public boolean isMacroCategory() {
        return MACRO_CATEGORY.equals(name);
    }
}
