package org.learningjava.macrohub.domain.model.keycommands;

import java.util.List;

// Output of the Macros list walk, before key bindings are attached
public record ExtractionResult(
        List<MacroRecord> records,
        int skippedCount
) {

    public ExtractionResult {
        records = List.copyOf(records);
    }
}
