package org.learningjava.macrohub.domain.service.keycommands;

import org.junit.jupiter.api.Test;
import org.learningjava.macrohub.domain.error.KeyCommandsException;
import org.learningjava.macrohub.domain.error.MalformedXmlException;
import org.learningjava.macrohub.domain.error.SchemaException;
import org.learningjava.macrohub.domain.model.keycommands.CategoryNode;
import org.learningjava.macrohub.domain.model.keycommands.KeyCommandsDocument;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeyCommandsLoaderTest {

    private final KeyCommandsLoader loader = new KeyCommandsLoader();

    @Test
    void loads_fixture_and_indexes_root_lists() {
        KeyCommandsDocument doc = loader.load(KeyCommandsFixtures.read(KeyCommandsFixtures.SAMPLE));

        assertEquals("KeyCommands", doc.root().getTagName());
        assertTrue(doc.findNamedList("Macros").isPresent());
        assertTrue(doc.findNamedList("Categories").isPresent());
        assertTrue(doc.findNamedList("Presets").isEmpty());
        assertTrue(doc.findCategory("Macro").isPresent());
    }

    @Test
    void exposes_categories_with_command_names() {
        KeyCommandsDocument doc = KeyCommandsFixtures.load(KeyCommandsFixtures.SAMPLE);

        List<CategoryNode> categories = doc.categories();

        assertEquals(2, categories.size());
        assertEquals(new CategoryNode("Edit", List.of("Undo", "Redo")), categories.get(0));
        assertTrue(categories.get(1).isMacroCategory());
        assertEquals(List.of("Mix Prep", "Render Setup", "Orphan Reference"), categories.get(1).commandNames());
    }

    @Test
    void strips_leading_byte_order_mark() {
        KeyCommandsDocument doc = loader.load("\uFEFF<KeyCommands/>");

        assertEquals("KeyCommands", doc.root().getTagName());
    }

    @Test
    void rejects_text_that_is_not_xml() {
        MalformedXmlException e = assertThrows(MalformedXmlException.class, () -> loader.load("<KeyCommands><list>"));

        assertEquals(KeyCommandsException.Kind.MALFORMED_XML, e.kind());
        assertEquals("The uploaded file is not a valid XML file.", e.userMessage());
        assertNotNull(e.getCause());
    }

    @Test
    void rejects_blank_input_as_malformed() {
        assertThrows(MalformedXmlException.class, () -> loader.load("   "));
        assertThrows(MalformedXmlException.class, () -> loader.load(null));
    }

    @Test
    void rejects_foreign_root_element() {
        SchemaException e = assertThrows(SchemaException.class, () -> loader.load("<Preferences/>"));

        assertEquals(KeyCommandsException.Kind.SCHEMA, e.kind());
        assertTrue(e.getMessage().contains("Preferences"));
    }

    @Test
    void refuses_doctype_declarations() {
        String xxe = """
                <?xml version="1.0"?>
                <!DOCTYPE KeyCommands [<!ENTITY x SYSTEM "file:///etc/passwd">]>
                <KeyCommands>&x;</KeyCommands>
                """;

        assertThrows(MalformedXmlException.class, () -> loader.load(xxe));
    }

    @Test
    void decodes_valid_utf8_and_rejects_invalid_bytes() {
        assertEquals("<KeyCommands name=\"Müller\"/>",
                KeyCommandsLoader.decodeUtf8("<KeyCommands name=\"Müller\"/>".getBytes(StandardCharsets.UTF_8)));

        byte[] latin1 = "<KeyCommands name=\"Müller\"/>".getBytes(StandardCharsets.ISO_8859_1);
        assertThrows(MalformedXmlException.class, () -> KeyCommandsLoader.decodeUtf8(latin1));
    }
}
