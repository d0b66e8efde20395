package org.learningjava.macrohub.domain.model.keycommands;

/**
 * Non-fatal outcome of a parse: some macro items were dropped because they could not be read.
 */
public record PartialExtractionNotice(int skippedCount) {

    public String message() {
        return skippedCount + " macros were skipped due to errors";
    }
}
