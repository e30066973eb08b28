package com.mdn.converter.services;

import com.mdn.converter.config.MdnProperties;
import com.mdn.converter.exceptions.InvalidReferenceException;
import com.mdn.converter.exceptions.MalformedSectionException;
import com.mdn.converter.exceptions.OutOfRangeException;
import com.mdn.converter.models.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for decoding and encoding whole documents, wired by hand
 * (no Spring context).
 */
class DocumentServiceTest {

    private MdnProperties properties;
    private DocumentService documentService;
    private DocumentReader documentReader;

    @BeforeEach
    void setUp() {
        properties = new MdnProperties();
        documentService = createService(properties);
        documentReader = createReader(properties);
    }

    static DocumentReader createReader(MdnProperties properties) {
        ReferenceAlgebra referenceAlgebra = new ReferenceAlgebra();
        return new DocumentReader(new SectionGrammar(properties), new BlockCodec(), referenceAlgebra,
                new CascadeResolver(referenceAlgebra));
    }

    static DocumentService createService(MdnProperties properties) {
        SectionGrammar sectionGrammar = new SectionGrammar(properties);
        BlockCodec blockCodec = new BlockCodec();
        ReferenceAlgebra referenceAlgebra = new ReferenceAlgebra();
        CascadeResolver cascadeResolver = new CascadeResolver(referenceAlgebra);
        DocumentReader reader = new DocumentReader(sectionGrammar, blockCodec, referenceAlgebra, cascadeResolver);
        DocumentWriter writer = new DocumentWriter(sectionGrammar, blockCodec, new RangeCoalescer(cascadeResolver), properties);
        DocumentValidator validator = new DocumentValidator(sectionGrammar, blockCodec, referenceAlgebra,
                cascadeResolver, reader, writer, properties);
        return new DocumentService(reader, writer, validator);
    }

    static String load(String name) throws IOException {
        try (InputStream in = DocumentServiceTest.class.getResourceAsStream("/documents/" + name)) {
            assertNotNull(in, "missing test document " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Sheets, formulas, merged formats, metadata and guidance of the revenue document.
     */
    @Test
    void testDecodeRevenueDocument() throws IOException {
        DecodeResult result = documentService.decode(load("revenue.mdn"));
        Workbook workbook = result.getWorkbook();

        assertTrue(result.getReport().isValid(), () -> "unexpected errors: " + result.getReport().getErrors());
        assertEquals(List.of("Revenue", "Costs"), workbook.getSheetNames());

        Sheet revenue = workbook.getSheet("Revenue");
        assertEquals(List.of("Month", "Revenue", "Growth", "Projected"), revenue.getHeaders());
        assertEquals(Arrays.asList("Jan", new BigDecimal("10000"), new BigDecimal("0.05"), null), revenue.getRows().get(0));
        assertEquals("=B2*(1+C2)", revenue.getFormulas().get("D2"));
        assertEquals(Map.of("numberFormat", "$#,##0", "bold", true, "color", "#1F4E79"), revenue.getFormats().get("D2"));
        assertEquals(Map.of("numberFormat", "$#,##0"), revenue.getFormats().get("D3"));
        assertEquals(Map.of("numberFormat", "$#,##0", "bold", true), revenue.getFormats().get("D1"));
        assertEquals(Map.of("bold", true), revenue.getFormats().get("A1"));

        Sheet costs = workbook.getSheet("Costs");
        assertEquals("Salaries, staff", costs.valueAt(2, 0));
        assertNull(costs.valueAt(3, 1));
        assertEquals("=SUM(B2:B3)", costs.getFormulas().get("B4"));

        DocumentMetadata metadata = workbook.getMetadata();
        assertEquals("revenue.xlsx", metadata.getSource());
        assertEquals("1.0", metadata.getVersion());
        assertEquals("finance", metadata.getContext().get("owner"));
        assertEquals("Projected revenue grows each month by the growth rate in column C.", workbook.getGuidance());
    }

    /**
     * Decode, encode, decode: same sheets, same effective formulas and formats.
     */
    @Test
    void testRoundTrip() throws IOException {
        Workbook first = documentService.decode(load("revenue.mdn")).getWorkbook();
        String encoded = documentService.encode(first);
        Workbook second = documentReader.read(encoded);

        assertEquals(first.getSheetNames(), second.getSheetNames());
        for (String name : first.getSheetNames()) {
            assertEquals(first.getSheet(name).getHeaders(), second.getSheet(name).getHeaders());
            assertEquals(first.getSheet(name).getRows(), second.getSheet(name).getRows());
        }
        assertEquals(first.formulaState(), second.formulaState());
        assertEquals(first.formatState(), second.formatState());
        assertEquals(first.getMetadata().toCoreMap(), second.getMetadata().toCoreMap());
        assertEquals(first.getMetadata().getContext(), second.getMetadata().getContext());
        assertEquals(first.getGuidance(), second.getGuidance());

        // encoding is stable once the document is canonical
        assertEquals(encoded, documentService.encode(second));
    }

    @Test
    void testEncodedLayout() throws IOException {
        String encoded = documentService.encode(documentService.decode(load("revenue.mdn")).getWorkbook());

        assertTrue(encoded.startsWith("--- MDN:HEADER YAML\n"));
        assertTrue(encoded.contains("---\n# optional context section\n"));
        assertTrue(encoded.contains("--- MDN:SHEET CSV name=Revenue\nMonth,Revenue,Growth,Projected\nJan,10000,0.05,\n"));
        assertTrue(encoded.contains("\"Salaries, staff\",8000"));
        assertTrue(encoded.contains("\"Revenue!D2\" : \"=B2*(1+C2)\""));
        assertTrue(encoded.contains("\"Revenue!A1:D1\""));
        assertTrue(encoded.contains("\"Revenue!D1:D3\""));
        assertTrue(encoded.indexOf("--- MDN:FORMAT JSON") < encoded.indexOf("--- MDN:AI_PROMPT"));
        assertTrue(encoded.endsWith("---\nEND DOCUMENT\n"));
    }

    /**
     * A workbook built in code gets configured metadata, an empty FORMULAS
     * block and no FORMAT block.
     */
    @Test
    void testEncodeBareWorkbook() {
        Sheet data = new Sheet("Data", List.of("Name", "Score"), List.of(List.of("Ada", 12)));
        String encoded = documentService.encode(new Workbook(null, List.of(data), null));

        assertTrue(encoded.contains("source: workbook.xlsx"));
        assertTrue(encoded.contains("--- MDN:FORMULAS JSON\n{ }\n---"));
        assertFalse(encoded.contains("MDN:FORMAT"));
        assertFalse(encoded.contains("MDN:AI_PROMPT"));

        Workbook decoded = documentReader.read(encoded);
        assertEquals(List.of("Data"), decoded.getMetadata().getSheets());
        assertEquals(new BigDecimal("12"), decoded.getSheet("Data").valueAt(1, 1));
    }

    @Test
    void testCoalescedFormulasWhenConfigured() {
        properties.getEncode().setCoalesceFormulas(true);
        DocumentService coalescing = createService(properties);

        Sheet sheet = new Sheet("Data", List.of("A", "B"), List.of(List.of(1, 2), List.of(3, 4)));
        sheet.putFormula(CellCoordinate.of("Data", "B2"), "=A2*2");
        sheet.putFormula(CellCoordinate.of("Data", "B3"), "=A2*2");

        String encoded = coalescing.encode(new Workbook(null, List.of(sheet), null));
        assertTrue(encoded.contains("\"Data!B2:B3\" : \"=A2*2\""));
    }

    /**
     * A cell value that looks like a delimiter is quoted so it cannot end the section.
     */
    @Test
    void testDelimiterLikeCellValues() {
        Sheet sheet = new Sheet("Notes", List.of("Text"), List.of(List.of("---"), List.of("END DOCUMENT"),
                Arrays.asList((Object) null)));
        String encoded = documentService.encode(new Workbook(null, List.of(sheet), null));

        Sheet decoded = documentReader.read(encoded).getSheet("Notes");
        assertEquals(sheet.getRows(), decoded.getRows());
    }

    /**
     * A multi-line cell is written as one quoted CSV field, so its inner lines
     * are physical body lines; one that reads as a delimiter is refused.
     */
    @Test
    void testMultiLineCellWithDelimiterLineIsRejected() {
        Sheet closing = new Sheet("Notes", List.of("Text"), List.of(List.of("first\n---")));
        Sheet opening = new Sheet("Notes", List.of("Text"), List.of(List.of("first\n--- note")));
        Sheet ending = new Sheet("Notes", List.of("Text", "More"), List.of(List.of("x", "a\nEND DOCUMENT\nb")));

        for (Sheet sheet : List.of(closing, opening, ending)) {
            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () ->
                    documentService.encode(new Workbook(null, List.of(sheet), null)));
            assertTrue(ex.getMessage().contains("SHEET 'Notes'"), ex.getMessage());
        }
    }

    @Test
    void testMultiLineCellRoundTrip() {
        Sheet sheet = new Sheet("Notes", List.of("Text"), List.of(List.of("first\n- second\n  --- indented")));
        String encoded = documentService.encode(new Workbook(null, List.of(sheet), null));

        assertEquals(sheet.getRows(), documentReader.read(encoded).getSheet("Notes").getRows());
    }

    @Test
    void testGuidanceWithDelimiterLineIsRejected() {
        Sheet data = new Sheet("Data", List.of("Name"), List.of(List.of("Ada")));

        for (String guidance : List.of("Intro\n---\nMore", "Intro\n-----", "Intro\nEND DOCUMENT  ", "--- MDN:SHEET CSV")) {
            assertThrows(IllegalArgumentException.class, () ->
                    documentService.encode(new Workbook(null, List.of(data), guidance)), guidance);
        }
    }

    /**
     * Only trailing newlines are dropped from guidance; indentation survives.
     */
    @Test
    void testGuidanceKeepsLeadingIndentation() {
        Sheet data = new Sheet("Data", List.of("Name"), List.of(List.of("Ada")));
        String guidance = "    indented code sample\n  - nested item\n\n";

        Workbook decoded = documentReader.read(documentService.encode(new Workbook(null, List.of(data), guidance)));
        assertEquals("    indented code sample\n  - nested item", decoded.getGuidance());
    }

    /**
     * The CSV block has no cell types: text that is a plain decimal reads back as a number.
     */
    @Test
    void testNumericTextReadsBackAsNumber() {
        Sheet sheet = new Sheet("Data", List.of("Code", "Label"), List.of(List.of("10", "007")));
        Workbook decoded = documentReader.read(documentService.encode(new Workbook(null, List.of(sheet), null)));

        assertEquals(new BigDecimal("10"), decoded.getSheet("Data").valueAt(1, 0));
        assertEquals("007", decoded.getSheet("Data").valueAt(1, 1));
    }

    /**
     * Unknown sections are kept, and written after the known ones just before END DOCUMENT.
     */
    @Test
    void testUnknownSectionsArePassedThrough() throws IOException {
        String text = load("minimal.mdn").replace("--- MDN:FORMULAS JSON",
                "--- MDN:CHARTS JSON\n{\"type\": \"bar\"}\n---\n--- MDN:FORMULAS JSON");
        Workbook workbook = documentReader.read(text);

        assertEquals(1, workbook.getPassthroughSections().size());
        String encoded = documentService.encode(new Workbook(workbook.getMetadata(), workbook.getSheets(),
                "Explain the scores.", workbook.getPassthroughSections()));
        assertTrue(encoded.endsWith("--- MDN:CHARTS JSON\n{\"type\": \"bar\"}\n---\nEND DOCUMENT\n"));
        assertTrue(encoded.indexOf("--- MDN:AI_PROMPT") < encoded.indexOf("--- MDN:CHARTS JSON"));
    }

    @Test
    void testStructuralErrorsAbortDecode() throws IOException {
        String minimal = load("minimal.mdn");

        assertThrows(MalformedSectionException.class, () ->
                documentService.decode(minimal.replace("END DOCUMENT", "")));
        assertThrows(MalformedSectionException.class, () ->
                documentService.decode(minimal.replace("Ada,12", "Ada,12,extra")));
        assertThrows(InvalidReferenceException.class, () ->
                documentService.decode(minimal.replace("{}", "{\"Other!A1\": \"=1\"}")));
        assertThrows(OutOfRangeException.class, () ->
                documentService.decode(minimal.replace("{}", "{\"Data!B2:A1\": \"=1\"}")));
    }

    /**
     * References without a sheet bind to the first sheet; a formula keyed by a
     * column applies to every cell of it.
     */
    @Test
    void testUnqualifiedAndRangeKeyedFormulas() throws IOException {
        String text = load("minimal.mdn").replace("{}", "{\"C:C\": \"=B2+1\"}")
                .replace("Name,Score", "Name,Score,Next").replace("Ada,12", "Ada,12,");
        DecodeResult result = documentService.decode(text);

        Sheet data = result.getWorkbook().getSheet("Data");
        assertEquals(Map.of("C1", "=B2+1", "C2", "=B2+1"), data.getFormulas());
        assertTrue(result.getReport().hasWarning("FORMULA_RANGE_KEY"));
    }
}
