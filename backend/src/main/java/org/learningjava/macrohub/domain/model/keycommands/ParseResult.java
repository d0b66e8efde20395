package org.learningjava.macrohub.domain.model.keycommands;

import java.util.List;
import java.util.Optional;

/**
 * Resolved macros of one Key Commands file.
 *
 * @param records      one record per readable macro item, in document order
 * @param skippedCount macro items dropped because they could not be read
 * @param categories   the Categories list as found in the file
 */
public record ParseResult(
        List<MacroRecord> records,
        int skippedCount,
        List<CategoryNode> categories
) {

    public ParseResult {
        records = List.copyOf(records);
        categories = categories == null ? List.of() : List.copyOf(categories);
    }

    public Optional<PartialExtractionNotice> notice() {
        return skippedCount > 0 ? Optional.of(new PartialExtractionNotice(skippedCount)) : Optional.empty();
    }
}
