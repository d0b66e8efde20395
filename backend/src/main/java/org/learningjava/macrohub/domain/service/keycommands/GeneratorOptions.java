package org.learningjava.macrohub.domain.service.keycommands;

/**
 * @param indentOutput indent standalone output
 * @param indentAmount spaces per level of standalone output
 */
public record GeneratorOptions(boolean indentOutput, int indentAmount) {

    // the host application indents its exports by three spaces
    public static final GeneratorOptions DEFAULTS = new GeneratorOptions(true, 3);
}
