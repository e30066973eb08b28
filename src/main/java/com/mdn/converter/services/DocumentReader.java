package com.mdn.converter.services;

import com.mdn.converter.exceptions.MalformedSectionException;
import com.mdn.converter.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Turns document text into a {@link Workbook}: sections are split, each SHEET
 * becomes a grid, FORMULAS and FORMAT entries become declarations, and the
 * cascade attaches the effective formula and format to every cell.
 * Structural and reference errors abort the read.
 */
@Service
public class DocumentReader {

    private static final Logger logger = LoggerFactory.getLogger(DocumentReader.class);

    private final SectionGrammar sectionGrammar;
    private final BlockCodec blockCodec;
    private final ReferenceAlgebra referenceAlgebra;
    private final CascadeResolver cascadeResolver;

    public DocumentReader(SectionGrammar sectionGrammar, BlockCodec blockCodec,
                          ReferenceAlgebra referenceAlgebra, CascadeResolver cascadeResolver) {
        this.sectionGrammar = sectionGrammar;
        this.blockCodec = blockCodec;
        this.referenceAlgebra = referenceAlgebra;
        this.cascadeResolver = cascadeResolver;
    }

    public Workbook read(String text) {
        List<Section> sections = sectionGrammar.parse(text);

        DocumentMetadata metadata = null;
        List<Sheet> sheets = new ArrayList<>();
        Section formulasSection = null;
        Section formatSection = null;
        String guidance = null;
        List<Section> passthrough = new ArrayList<>();
        Set<String> sheetNames = new LinkedHashSet<>();

        for (Section section : sections) {
            switch (section.getKind()) {
                case HEADER:
                    metadata = readMetadata(section);
                    break;
                case SHEET:
                    Sheet sheet = readSheet(section);
                    if (!sheetNames.add(sheet.getName())) {
                        throw new MalformedSectionException("Duplicate sheet name '" + sheet.getName() + "'",
                                section.getLineNumber());
                    }
                    sheets.add(sheet);
                    break;
                case FORMULAS:
                    formulasSection = section;
                    break;
                case FORMAT:
                    formatSection = section;
                    break;
                case AI_PROMPT:
                    guidance = section.getBody();
                    break;
                default:
                    logger.debug("Carrying unknown section {} through unchanged", section.openLine());
                    passthrough.add(section);
            }
        }

        Workbook workbook = new Workbook(metadata, sheets, guidance, passthrough);
        List<String> names = workbook.getSheetNames();
        Map<String, SheetExtent> extents = workbook.getExtents();

        List<Declaration> formulas = formulaDeclarations(formulasSection, names);
        EffectiveState formulaState = cascadeResolver.resolve(formulas, extents);
        formulaState.asMap().forEach((cell, attributes) -> workbook.getSheet(cell.getSheet())
                .putFormula(cell, String.valueOf(attributes.get(Declaration.FORMULA_KEY))));

        List<Declaration> formats = formatSection == null ? List.of() : formatDeclarations(formatSection, names);
        EffectiveState formatState = cascadeResolver.resolve(formats, extents);
        formatState.asMap().forEach((cell, attributes) -> workbook.getSheet(cell.getSheet()).putFormat(cell, attributes));

        logger.info("Decoded {} sheets, {} formula cells, {} formatted cells",
                sheets.size(), formulaState.cells().size(), formatState.cells().size());
        return workbook;
    }

    public DocumentMetadata readMetadata(Section header) {
        Map<String, Object> core = blockCodec.readMapping(header, header.getBody());
        Map<String, Object> context = header.hasContext()
                ? blockCodec.readMapping(header, header.getContextBody()) : Map.of();

        List<String> sheets = new ArrayList<>();
        if (core.get("sheets") instanceof List) {
            for (Object name : (List<?>) core.get("sheets")) {
                sheets.add(String.valueOf(name));
            }
        }
        Map<String, Object> extras = new LinkedHashMap<>(core);
        DocumentMetadata.REQUIRED_KEYS.forEach(extras::remove);
        return new DocumentMetadata(text(core.get("source")), text(core.get("version")),
                text(core.get("created")), sheets, extras, context);
    }

    /**
     * First CSV record is the header row, the rest are data rows.
     */
    public Sheet readSheet(Section section) {
        String name = section.getAttribute("name");
        List<String[]> records = blockCodec.readRows(section);
        List<String> headers = new ArrayList<>();
        List<List<Object>> rows = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            String[] record = records.get(i);
            if (i == 0) {
                headers.addAll(Arrays.asList(record));
                continue;
            }
            if (record.length > headers.size()) {
                throw new MalformedSectionException("Row " + (i + 1) + " of sheet '" + name + "' has "
                        + record.length + " values but the header has " + headers.size() + " columns",
                        section.getLineNumber() + i + 1);
            }
            List<Object> row = new ArrayList<>();
            for (String value : record) {
                row.add(blockCodec.parseScalar(value));
            }
            rows.add(row);
        }
        return new Sheet(name, headers, rows);
    }

    /**
     * FORMULAS entries in document order, each formula stored under the "value" key.
     */
    public List<Declaration> formulaDeclarations(Section section, List<String> sheetNames) {
        List<Declaration> declarations = new ArrayList<>();
        if (section == null) {
            return declarations;
        }
        for (Map.Entry<String, Object> entry : blockCodec.readMapping(section, section.getBody()).entrySet()) {
            RangeReference reference = parseKey(entry.getKey(), sheetNames);
            Object formula = entry.getValue();
            if (formula == null) {
                continue;
            }
            declarations.add(Declaration.formula(reference, String.valueOf(formula), declarations.size(), entry.getKey()));
        }
        return declarations;
    }

    /**
     * FORMAT entries in document order; entries whose value is not a mapping are skipped.
     */
    public List<Declaration> formatDeclarations(Section section, List<String> sheetNames) {
        List<Declaration> declarations = new ArrayList<>();
        for (Map.Entry<String, Object> entry : blockCodec.readMapping(section, section.getBody()).entrySet()) {
            RangeReference reference = parseKey(entry.getKey(), sheetNames);
            if (!(entry.getValue() instanceof Map)) {
                logger.warn("Ignoring format entry {}: value is not a mapping", entry.getKey());
                continue;
            }
            Map<String, Object> attributes = new LinkedHashMap<>();
            ((Map<?, ?>) entry.getValue()).forEach((key, value) -> attributes.put(String.valueOf(key), value));
            declarations.add(new Declaration(reference, attributes, declarations.size(), entry.getKey()));
        }
        return declarations;
    }

    /**
     * A key without "Sheet!" binds to the first sheet of the workbook.
     */
    public RangeReference parseKey(String key, List<String> sheetNames) {
        String contextSheet = sheetNames.isEmpty() ? null : sheetNames.get(0);
        return referenceAlgebra.parse(key, contextSheet, sheetNames);
    }

    private static String text(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
