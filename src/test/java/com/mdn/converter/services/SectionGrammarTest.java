package com.mdn.converter.services;

import com.mdn.converter.config.MdnProperties;
import com.mdn.converter.exceptions.MalformedSectionException;
import com.mdn.converter.exceptions.OrderViolationException;
import com.mdn.converter.models.Section;
import com.mdn.converter.models.SectionKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for splitting document text into sections.
 */
class SectionGrammarTest {

    private SectionGrammar sectionGrammar;

    private static final String HEADER = String.join("\n",
            "--- MDN:HEADER YAML",
            "source: data.xlsx",
            "version: \"1.0\"",
            "created: \"2024-03-01T09:30:00Z\"",
            "sheets: [Data]",
            "---");
    private static final String SHEET = String.join("\n",
            "--- MDN:SHEET CSV name=Data",
            "Name,Score",
            "Ada,12",
            "---");
    private static final String FORMULAS = String.join("\n",
            "--- MDN:FORMULAS JSON",
            "{}",
            "---");

    @BeforeEach
    void setUp() {
        sectionGrammar = new SectionGrammar(new MdnProperties());
    }

    private static String document(String... parts) {
        return String.join("\n", parts) + "\n";
    }

    @Test
    void testParseMinimalDocument() {
        List<Section> sections = sectionGrammar.parse(document(HEADER, SHEET, FORMULAS, "END DOCUMENT"));

        assertEquals(3, sections.size());
        assertEquals(SectionKind.HEADER, sections.get(0).getKind());
        assertEquals("YAML", sections.get(0).getFormat());
        assertEquals(SectionKind.SHEET, sections.get(1).getKind());
        assertEquals("Data", sections.get(1).getAttribute("name"));
        assertEquals("Name,Score\nAda,12", sections.get(1).getBody());
        assertEquals(7, sections.get(1).getLineNumber());
    }

    /**
     * A document without END DOCUMENT is rejected rather than truncated.
     */
    @Test
    void testMissingEndMarker() {
        assertThrows(MalformedSectionException.class, () ->
                sectionGrammar.parse(document(HEADER, SHEET, FORMULAS)));
    }

    @Test
    void testUnclosedSection() {
        String unclosed = document(HEADER, "--- MDN:SHEET CSV name=Data", "Name,Score", FORMULAS, "END DOCUMENT");
        MalformedSectionException ex = assertThrows(MalformedSectionException.class, () -> sectionGrammar.parse(unclosed));
        assertEquals("MALFORMED_SECTION", ex.getCode());
        assertEquals("line 9", ex.getLocation());
    }

    @Test
    void testMisspelledDelimiters() {
        assertThrows(MalformedSectionException.class, () ->
                sectionGrammar.parse(document(HEADER, "--- MDN-SHEET CSV name=Data", "a", "---", FORMULAS, "END DOCUMENT")));
        assertThrows(MalformedSectionException.class, () ->
                sectionGrammar.parse(document(HEADER, "--- MDN:SHEET,CSV name=Data", "a", "---", FORMULAS, "END DOCUMENT")));
        // wrong format token for a known kind
        assertThrows(MalformedSectionException.class, () ->
                sectionGrammar.parse(document(HEADER, SHEET, "--- MDN:FORMULAS YAML", "{}", "---", "END DOCUMENT")));
        assertThrows(MalformedSectionException.class, () ->
                sectionGrammar.parse(document(HEADER, "--- MDN:SHEET CSV", "a", "---", FORMULAS, "END DOCUMENT")));
    }

    @Test
    void testTextOutsideSections() {
        assertThrows(MalformedSectionException.class, () ->
                sectionGrammar.parse(document(HEADER, SHEET, "stray text", FORMULAS, "END DOCUMENT")));
        assertThrows(MalformedSectionException.class, () ->
                sectionGrammar.parse(document(HEADER, SHEET, FORMULAS, "END DOCUMENT", "trailing")));
    }

    @Test
    void testOrderViolations() {
        assertThrows(OrderViolationException.class, () ->
                sectionGrammar.parse(document(SHEET, HEADER, FORMULAS, "END DOCUMENT")));
        assertThrows(OrderViolationException.class, () ->
                sectionGrammar.parse(document(HEADER, FORMULAS, SHEET, "END DOCUMENT")));
        assertThrows(OrderViolationException.class, () ->
                sectionGrammar.parse(document(HEADER, SHEET, FORMULAS, FORMULAS, "END DOCUMENT")));
        OrderViolationException missing = assertThrows(OrderViolationException.class, () ->
                sectionGrammar.parse(document(HEADER, SHEET, "END DOCUMENT")));
        assertTrue(missing.getMessage().contains("FORMULAS"));
    }

    /**
     * The HEADER may be reopened once for its context part.
     */
    @Test
    void testHeaderContextPart() {
        String context = String.join("\n", "# optional context section", "purpose: demo", "---");
        List<Section> sections = sectionGrammar.parse(document(HEADER, context, SHEET, FORMULAS, "END DOCUMENT"));

        Section header = sections.get(0);
        assertTrue(header.hasContext());
        assertEquals("# optional context section\npurpose: demo", header.getContextBody());
        assertEquals(SectionKind.SHEET, sections.get(1).getKind());
    }

    /**
     * Unknown kinds and foreign namespaces are kept, in place, as UNKNOWN.
     */
    @Test
    void testUnknownSectionsAreKept() {
        String charts = String.join("\n", "--- MDN:CHARTS JSON", "{\"type\": \"bar\"}", "---");
        String foreign = String.join("\n", "--- ACME:SHEET CSV name=X", "a,b", "---");
        List<Section> sections = sectionGrammar.parse(document(HEADER, SHEET, charts, foreign, FORMULAS, "END DOCUMENT"));

        assertEquals(5, sections.size());
        assertEquals(SectionKind.UNKNOWN, sections.get(2).getKind());
        assertEquals("CHARTS", sections.get(2).getKindToken());
        assertEquals(SectionKind.UNKNOWN, sections.get(3).getKind());
        assertEquals("ACME", sections.get(3).getNamespace());
    }

    @Test
    void testSerializeIsInverseOfParse() {
        String context = String.join("\n", "# optional context section", "purpose: demo", "---");
        String prompt = String.join("\n", "--- MDN:AI_PROMPT", "Scores are out of 20.", "---");
        String text = document(HEADER, context, SHEET, FORMULAS, prompt, "END DOCUMENT");

        assertEquals(text, sectionGrammar.serialize(sectionGrammar.parse(text)));
    }

    @Test
    void testSerializeBuiltSections() {
        List<Section> sections = List.of(
                Section.of("MDN", SectionKind.HEADER, Map.of(), "source: a.xlsx"),
                Section.of("MDN", SectionKind.SHEET, Map.of("name", "Data"), "Name\nAda"),
                Section.of("MDN", SectionKind.AI_PROMPT, Map.of(), "Hello"));

        String text = sectionGrammar.serialize(sections);
        assertEquals(String.join("\n",
                "--- MDN:HEADER YAML", "source: a.xlsx", "---",
                "--- MDN:SHEET CSV name=Data", "Name", "Ada", "---",
                "--- MDN:AI_PROMPT", "Hello", "---",
                "END DOCUMENT", ""), text);
    }
}
