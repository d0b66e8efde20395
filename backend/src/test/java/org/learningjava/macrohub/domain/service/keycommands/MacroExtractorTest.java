package org.learningjava.macrohub.domain.service.keycommands;

import org.junit.jupiter.api.Test;
import org.learningjava.macrohub.domain.error.NoMacroDataException;
import org.learningjava.macrohub.domain.model.keycommands.ExtractionResult;
import org.learningjava.macrohub.domain.model.keycommands.MacroRecord;
import org.learningjava.macrohub.domain.model.keycommands.SubCommand;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MacroExtractorTest {

    private final MacroExtractor extractor = new MacroExtractor();
    private final KeyCommandsLoader loader = new KeyCommandsLoader();

    @Test
    void extracts_named_items_and_counts_the_unnamed_one() {
        var trace = new KeyCommandsFixtures.RecordingTrace();

        ExtractionResult result = extractor.extract(KeyCommandsFixtures.load(KeyCommandsFixtures.SAMPLE), trace);

        assertEquals(List.of("Mix Prep", "Render Setup", "Quick Save", "Empty Macro"),
                result.records().stream().map(MacroRecord::name).toList());
        assertEquals(1, result.skippedCount());
        assertEquals(1, trace.warnings(PipelineStage.EXTRACT).size());
        assertTrue(trace.warnings(PipelineStage.EXTRACT).get(0).detail().contains("#3"));
    }

    @Test
    void keeps_explicit_description_and_synthesizes_missing_ones() {
        List<MacroRecord> records = extractor.extract(
                KeyCommandsFixtures.load(KeyCommandsFixtures.SAMPLE), PipelineTraceListener.NONE).records();

        assertEquals("Prepare the mix", records.get(0).description());
        assertEquals("Executes: Solo, Mute, Undo and 1 more commands", records.get(1).description());
        assertEquals("Executes: Save", records.get(2).description());
        assertEquals("", records.get(3).description());
    }

    @Test
    void reads_sub_commands_with_all_named_parameters() {
        List<MacroRecord> records = extractor.extract(
                KeyCommandsFixtures.load(KeyCommandsFixtures.SAMPLE), PipelineTraceListener.NONE).records();

        assertEquals(List.of(
                new SubCommand("Solo", Map.of("Category", "Transport")),
                new SubCommand("Mute", Map.of("Category", "Edit"))
        ), records.get(0).commands());

        SubCommand save = records.get(2).commands().get(0);
        assertEquals("Save", save.name());
        assertEquals(List.of("Category", "Flags"), List.copyOf(save.parameters().keySet()));
        assertEquals("1", save.parameter("Flags"));
        assertTrue(records.get(3).commands().isEmpty());
    }

    @Test
    void captures_definition_snippet_and_leaves_bindings_unresolved() {
        MacroRecord mixPrep = extractor.extract(
                KeyCommandsFixtures.load(KeyCommandsFixtures.SAMPLE), PipelineTraceListener.NONE).records().get(0);

        assertTrue(mixPrep.rawDefinitionSnippet().startsWith("<item>"));
        assertTrue(mixPrep.rawDefinitionSnippet().contains("<string name=\"Description\" value=\"Prepare the mix\"/>"));
        assertNull(mixPrep.rawReferenceSnippet());
        assertTrue(mixPrep.keyBindings().isEmpty());
    }

    @Test
    void drops_sub_commands_without_name() {
        String xml = """
                <KeyCommands>
                  <list name="Macros" type="list">
                    <item>
                      <string name="Name" value="DoThing"/>
                      <list name="Commands" type="list">
                        <item><string name="Category" value="Edit"/></item>
                        <item><string name="Category" value="Edit"/><string name="Name" value="Undo"/></item>
                      </list>
                    </item>
                  </list>
                </KeyCommands>
                """;
        var trace = new KeyCommandsFixtures.RecordingTrace();

        ExtractionResult result = extractor.extract(loader.load(xml), trace);

        assertEquals(0, result.skippedCount());
        assertEquals(List.of(new SubCommand("Undo", Map.of("Category", "Edit"))), result.records().get(0).commands());
        assertEquals(1, trace.warnings(PipelineStage.EXTRACT).size());
    }

    @Test
    void treats_blank_name_as_missing() {
        String xml = """
                <KeyCommands>
                  <list name="Macros" type="list">
                    <item><string name="Name" value="  "/></item>
                    <item><string name="Name" value="Kept"/></item>
                  </list>
                </KeyCommands>
                """;

        ExtractionResult result = extractor.extract(loader.load(xml), PipelineTraceListener.NONE);

        assertEquals(1, result.records().size());
        assertEquals(1, result.skippedCount());
    }

    @Test
    void fails_when_neither_macros_nor_categories_exist() {
        assertThrows(NoMacroDataException.class,
                () -> extractor.extract(loader.load("<KeyCommands><list name=\"Presets\"/></KeyCommands>"),
                        PipelineTraceListener.NONE));
    }

    @Test
    void returns_nothing_when_only_categories_exist() {
        ExtractionResult result = extractor.extract(
                loader.load("<KeyCommands><list name=\"Categories\" type=\"list\"/></KeyCommands>"),
                PipelineTraceListener.NONE);

        assertTrue(result.records().isEmpty());
        assertEquals(0, result.skippedCount());
    }

    @Test
    void synthesized_description_lists_up_to_three_commands() {
        assertEquals("", MacroExtractor.synthesizeDescription(List.of()));
        assertEquals("Executes: Solo, Mute, Undo", MacroExtractor.synthesizeDescription(List.of(
                new SubCommand("Solo"), new SubCommand("Mute"), new SubCommand("Undo"))));
        assertEquals("Executes: Solo, Mute, Undo and 2 more commands", MacroExtractor.synthesizeDescription(List.of(
                new SubCommand("Solo"), new SubCommand("Mute"), new SubCommand("Undo"),
                new SubCommand("Redo"), new SubCommand("Cut"))));
    }
}
