package org.learningjava.macrohub.domain.service.keycommands;

import org.junit.jupiter.api.Test;
import org.learningjava.macrohub.domain.model.keycommands.MacroRecord;
import org.learningjava.macrohub.domain.model.keycommands.SubCommand;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StandaloneXmlGeneratorTest {

    private final StandaloneXmlGenerator generator = new StandaloneXmlGenerator(GeneratorOptions.DEFAULTS);

    private static MacroRecord macro(String name) {
        return new MacroRecord(name, "", List.of(new SubCommand("Undo", Map.of("Category", "Edit"))), List.of());
    }

    private static String macrosSection(String xml) {
        return xml.substring(xml.indexOf("<list name=\"Macros\""));
    }

    @Test
    void emits_definitions_in_hint_order() {
        String xml = generator.generate(
                List.of(macro("a"), macro("b"), macro("c")), List.of("c", "a", "b"), PipelineTraceListener.NONE);

        String macros = macrosSection(xml);
        int c = macros.indexOf("value=\"c\"");
        int a = macros.indexOf("value=\"a\"");
        int b = macros.indexOf("value=\"b\"");
        assertTrue(c >= 0 && c < a && a < b, macros);
    }

    @Test
    void keeps_caller_order_when_hint_matches() {
        String xml = generator.generate(
                List.of(macro("c"), macro("a"), macro("b")), List.of("c", "a", "b"), PipelineTraceListener.NONE);

        String macros = macrosSection(xml);
        assertTrue(macros.indexOf("value=\"c\"") < macros.indexOf("value=\"a\""));
        assertTrue(macros.indexOf("value=\"a\"") < macros.indexOf("value=\"b\""));
    }

    @Test
    void synthesizes_definition_and_reference_from_fields() {
        MacroRecord doThing = new MacroRecord("DoThing", "Does it",
                List.of(new SubCommand("Undo", Map.of("Category", "Edit"))), List.of("Ctrl+D"));

        String xml = generator.generate(List.of(doThing), null, PipelineTraceListener.NONE);

        assertTrue(xml.startsWith("<?xml version=\"1.0\" encoding=\"utf-8\"?>\n<KeyCommands>"), xml);
        assertTrue(xml.contains("\n   <list name=\"Categories\" type=\"list\">"), xml);
        assertTrue(xml.indexOf("name=\"Categories\"") < xml.indexOf("name=\"Macros\""));
        assertTrue(xml.contains("<string name=\"Name\" value=\"Macro\"/>"));
        assertTrue(xml.contains("<string name=\"Key\" value=\"Ctrl+D\"/>"));

        String macros = macrosSection(xml);
        assertTrue(macros.contains("<string name=\"Name\" value=\"DoThing\"/>"));
        assertTrue(macros.contains("<string name=\"Description\" value=\"Does it\"/>"));
        assertTrue(macros.indexOf("<string name=\"Category\" value=\"Edit\"/>")
                < macros.indexOf("<string name=\"Name\" value=\"Undo\"/>"));
        assertFalse(macros.contains("name=\"Key\""));
    }

    @Test
    void prefers_stored_snippets() {
        MacroRecord snip = new MacroRecord("Snip", "", List.of(), List.of("F9"),
                "<item>\n   <string name=\"Name\" value=\"Snip\"/>\n   <string name=\"Custom\" value=\"kept\"/>\n</item>",
                "<item><string name=\"Name\" value=\"Snip\"/><string name=\"Key\" value=\"F9\"/><int name=\"Flags\" value=\"2\"/></item>");

        String xml = generator.generate(List.of(snip), List.of(), PipelineTraceListener.NONE);

        assertTrue(xml.contains("<string name=\"Custom\" value=\"kept\"/>"));
        assertTrue(xml.contains("<int name=\"Flags\" value=\"2\"/>"));
    }

    @Test
    void falls_back_to_fields_when_snippet_is_corrupt() {
        MacroRecord broken = new MacroRecord("Broken", "Still here", List.of(), List.of("F3"),
                "<item><string name=", "<item>");
        var trace = new KeyCommandsFixtures.RecordingTrace();

        String xml = generator.generate(List.of(broken), null, trace);

        assertTrue(macrosSection(xml).contains("<string name=\"Description\" value=\"Still here\"/>"));
        assertTrue(xml.contains("<string name=\"Key\" value=\"F3\"/>"));
        assertEquals(2, trace.warnings(PipelineStage.GENERATE).size());
    }

    @Test
    void writes_flat_output_when_indentation_is_off() {
        StandaloneXmlGenerator flat = new StandaloneXmlGenerator(new GeneratorOptions(false, 3));

        String xml = flat.generate(List.of(macro("a")), null, PipelineTraceListener.NONE);

        assertEquals(2, xml.split("\n").length, xml);
        assertTrue(xml.contains("<KeyCommands><list name=\"Categories\" type=\"list\">"), xml);
    }

    @Test
    void order_hint_puts_unnamed_records_last_and_stays_stable() {
        List<MacroRecord> sorted = StandaloneXmlGenerator.applyOrder(
                List.of(macro("x"), macro("b"), macro("y"), macro("a")), List.of("a", "b"));

        assertEquals(List.of("a", "b", "x", "y"), sorted.stream().map(MacroRecord::name).toList());
    }

    @Test
    void order_hint_absent_keeps_input() {
        List<MacroRecord> input = List.of(macro("b"), macro("a"));

        assertSame(input, StandaloneXmlGenerator.applyOrder(input, null));
        assertSame(input, StandaloneXmlGenerator.applyOrder(input, List.of()));
    }
}
