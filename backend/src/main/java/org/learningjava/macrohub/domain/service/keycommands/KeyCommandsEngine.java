package org.learningjava.macrohub.domain.service.keycommands;

import org.learningjava.macrohub.domain.error.NoMacroDataException;
import org.learningjava.macrohub.domain.model.keycommands.ExtractionResult;
import org.learningjava.macrohub.domain.model.keycommands.KeyCommandsDocument;
import org.learningjava.macrohub.domain.model.keycommands.MacroRecord;
import org.learningjava.macrohub.domain.model.keycommands.ParseResult;

import java.util.List;

/**
 * Entry point of the Key Commands pipeline: parse, standalone generation and merge.
 * <p>
 * Stateless; every call works on its own document and may run concurrently with others.
 */
public class KeyCommandsEngine {

    private final KeyCommandsLoader loader;
    private final MacroExtractor extractor;
    private final KeyBindingResolver resolver;
    private final StandaloneXmlGenerator standaloneGenerator;
    private final MacroMergeGenerator mergeGenerator;
    private final PipelineTraceListener defaultTrace;

    public KeyCommandsEngine(GeneratorOptions options, PipelineTraceListener defaultTrace) {
        this.loader = new KeyCommandsLoader();
        this.extractor = new MacroExtractor();
        this.resolver = new KeyBindingResolver();
        this.standaloneGenerator = new StandaloneXmlGenerator(options);
        this.mergeGenerator = new MacroMergeGenerator(loader);
        this.defaultTrace = defaultTrace == null ? PipelineTraceListener.NONE : defaultTrace;
    }

    public KeyCommandsEngine() {
        this(GeneratorOptions.DEFAULTS, PipelineTraceListener.NONE);
    }

    public ParseResult parse(String text) {
        return parse(text, defaultTrace);
    }

    /**
     * @throws org.learningjava.macrohub.domain.error.MalformedXmlException not well-formed XML
     * @throws org.learningjava.macrohub.domain.error.SchemaException       root is not KeyCommands
     * @throws NoMacroDataException                                         no usable macro in the file
     */
    public ParseResult parse(String text, PipelineTraceListener trace) {
        KeyCommandsDocument document = loader.load(text);
        trace.onEvent(TraceEvent.debug(PipelineStage.LOAD, null, "root <" + document.root().getTagName() + "> loaded"));

        ExtractionResult extracted = extractor.extract(document, trace);
        if (extracted.records().isEmpty()) {
            throw new NoMacroDataException(extracted.skippedCount() > 0
                    ? "All " + extracted.skippedCount() + " macro items were unreadable"
                    : "The Macros list holds no items");
        }
        List<MacroRecord> resolved = resolver.resolve(extracted.records(), document, trace);
        return new ParseResult(resolved, extracted.skippedCount(), document.categories());
    }

    public String generateStandalone(List<MacroRecord> records, List<String> order) {
        return generateStandalone(records, order, defaultTrace);
    }

    public String generateStandalone(List<MacroRecord> records, List<String> order, PipelineTraceListener trace) {
        return standaloneGenerator.generate(records, order, trace);
    }

    public String mergeInto(String userText, List<MacroRecord> records) {
        return mergeInto(userText, records, defaultTrace);
    }

    /**
     * @throws org.learningjava.macrohub.domain.error.MalformedXmlException   {@code userText} is not well-formed
     * @throws org.learningjava.macrohub.domain.error.SnippetReparseException a stored snippet does not parse
     */
    public String mergeInto(String userText, List<MacroRecord> records, PipelineTraceListener trace) {
        return mergeGenerator.merge(userText, records, trace);
    }
}
