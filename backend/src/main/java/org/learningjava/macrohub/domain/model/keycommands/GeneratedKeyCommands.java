package org.learningjava.macrohub.domain.model.keycommands;

// Generated XML ready to be offered as a download
public record GeneratedKeyCommands(
        String fileName,
        String xml,
        int macroCount
) {
}
