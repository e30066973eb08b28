package com.mdn.converter.services;

import com.mdn.converter.config.MdnProperties;
import com.mdn.converter.exceptions.InvalidReferenceException;
import com.mdn.converter.exceptions.MdnFormatException;
import com.mdn.converter.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Checks a document without aborting on the first problem. Structural errors
 * stop the check early since nothing past them can be trusted; every other
 * issue is collected into the report.
 */
@Service
public class DocumentValidator {

    private static final Logger logger = LoggerFactory.getLogger(DocumentValidator.class);

    private static final Pattern SEMANTIC_VERSION = Pattern.compile("^\\d+\\.\\d+(\\.\\d+)?$");
    // "Sheet!A1", optionally with absolute markers
    private static final Pattern QUALIFIED_CELL_KEY = Pattern.compile("^[^!]+!\\$?[A-Z]+\\$?\\d+$");

    private final SectionGrammar sectionGrammar;
    private final BlockCodec blockCodec;
    private final ReferenceAlgebra referenceAlgebra;
    private final CascadeResolver cascadeResolver;
    private final DocumentReader documentReader;
    private final DocumentWriter documentWriter;
    private final MdnProperties properties;

    public DocumentValidator(SectionGrammar sectionGrammar, BlockCodec blockCodec, ReferenceAlgebra referenceAlgebra,
                             CascadeResolver cascadeResolver, DocumentReader documentReader,
                             DocumentWriter documentWriter, MdnProperties properties) {
        this.sectionGrammar = sectionGrammar;
        this.blockCodec = blockCodec;
        this.referenceAlgebra = referenceAlgebra;
        this.cascadeResolver = cascadeResolver;
        this.documentReader = documentReader;
        this.documentWriter = documentWriter;
        this.properties = properties;
    }

    public ValidationReport validate(String text) {
        ValidationReport report = new ValidationReport();
        List<Section> sections;
        try {
            sections = sectionGrammar.parse(text);
        } catch (MdnFormatException e) {
            addError(report, e);
            return report;
        }

        Map<String, SheetExtent> extents = new LinkedHashMap<>();
        List<Section> sheetSections = new ArrayList<>();
        Section header = null;
        Section formulas = null;
        Section format = null;
        Section prompt = null;
        for (Section section : sections) {
            switch (section.getKind()) {
                case HEADER:
                    header = section;
                    break;
                case SHEET:
                    sheetSections.add(section);
                    break;
                case FORMULAS:
                    formulas = section;
                    break;
                case FORMAT:
                    format = section;
                    break;
                case AI_PROMPT:
                    prompt = section;
                    break;
                default:
                    report.addWarning("UNKNOWN_SECTION", "Unknown section " + section.getNamespace() + ":"
                            + section.getKindToken() + " is carried through unchanged", line(section));
            }
        }

        for (Section section : sheetSections) {
            try {
                checkSheetBody(report, section);
                Sheet sheet = documentReader.readSheet(section);
                if (extents.putIfAbsent(sheet.getName(), sheet.getExtent()) != null) {
                    report.addError("MALFORMED_SECTION", "Duplicate sheet name '" + sheet.getName() + "'", line(section));
                }
            } catch (MdnFormatException e) {
                addError(report, e);
            }
        }
        List<String> sheetNames = new ArrayList<>(extents.keySet());

        checkHeader(report, header, sheetSections);
        if (formulas != null) {
            checkFormulas(report, formulas, sheetNames, extents);
        }
        if (format != null) {
            checkFormats(report, format, sheetNames, extents);
        }
        if (prompt != null) {
            checkPrompt(report, prompt);
        }

        if (report.isValid()) {
            checkRoundTrip(report, text);
        }
        if (!report.isValid()) {
            logger.warn("Document has {} errors and {} warnings", report.getErrors().size(), report.getWarnings().size());
        } else {
            logger.debug("Document is valid with {} warnings", report.getWarnings().size());
        }
        return report;
    }

    private void checkHeader(ValidationReport report, Section header, List<Section> sheetSections) {
        Map<String, Object> metadata;
        try {
            metadata = blockCodec.readMapping(header, header.getBody());
            if (header.hasContext()) {
                blockCodec.readMapping(header, header.getContextBody());
            }
        } catch (MdnFormatException e) {
            addError(report, e);
            return;
        }

        for (String key : DocumentMetadata.REQUIRED_KEYS) {
            if (!metadata.containsKey(key)) {
                report.addError("MISSING_METADATA_KEY", "Metadata is missing required key '" + key + "'", line(header));
            }
        }
        for (String key : metadata.keySet()) {
            if (!DocumentMetadata.REQUIRED_KEYS.contains(key)) {
                report.addWarning("UNKNOWN_METADATA_KEY", "Unknown metadata key '" + key + "'", line(header));
            }
        }

        Object version = metadata.get("version");
        if (version != null && !SEMANTIC_VERSION.matcher(String.valueOf(version)).matches()) {
            report.addWarning("NON_SEMANTIC_VERSION", "Version '" + version + "' is not of the form 1.0 or 1.0.0",
                    line(header));
        }

        if (!metadata.containsKey("sheets")) {
            return;
        }
        Object sheets = metadata.get("sheets");
        if (!(sheets instanceof List) || ((List<?>) sheets).isEmpty()) {
            report.addError("INVALID_SHEET_LIST", "Metadata 'sheets' must be a non-empty list", line(header));
            return;
        }
        List<String> declared = new ArrayList<>();
        Set<String> unique = new LinkedHashSet<>();
        for (Object name : (List<?>) sheets) {
            String sheetName = String.valueOf(name);
            declared.add(sheetName);
            if (!unique.add(sheetName)) {
                report.addWarning("DUPLICATE_SHEET_NAME", "Sheet '" + sheetName + "' is listed twice in the metadata",
                        line(header));
            }
        }
        Set<String> present = new LinkedHashSet<>();
        for (Section section : sheetSections) {
            present.add(section.getAttribute("name"));
        }
        if (!unique.equals(present)) {
            report.addError("SHEET_LIST_MISMATCH", "Metadata lists sheets " + declared
                    + " but the document contains " + present, line(header));
        }
    }

    /**
     * A sheet needs CSV content; a header alone or short rows are only suspicious.
     */
    private void checkSheetBody(ValidationReport report, Section section) {
        String name = section.getAttribute("name");
        if (section.getBody().isBlank()) {
            report.addError("EMPTY_SHEET", "Sheet '" + name + "' has no CSV content", line(section));
            return;
        }
        List<String[]> records = blockCodec.readRows(section);
        if (records.size() < 2) {
            report.addWarning("FEW_ROWS", "Sheet '" + name + "' has no data rows below its header", line(section));
        }
        int width = records.isEmpty() ? 0 : records.get(0).length;
        for (int i = 1; i < records.size(); i++) {
            int length = records.get(i).length;
            if (length < width) {
                report.addWarning("INCONSISTENT_COLUMN_COUNT", "Row " + (i + 1) + " of sheet '" + name + "' has "
                        + length + " values but the header has " + width + " columns",
                        "line " + (section.getLineNumber() + i + 1));
            }
        }
    }

    private void checkFormulas(ValidationReport report, Section section, List<String> sheetNames,
                               Map<String, SheetExtent> extents) {
        if (section.getBody().isBlank()) {
            report.addError("EMPTY_FORMULAS", "FORMULAS section is empty, write {} for a workbook without formulas",
                    line(section));
            return;
        }
        Map<String, Object> entries = readEntries(report, section);
        List<Declaration> declarations = new ArrayList<>();
        for (Map.Entry<String, Object> entry : entries.entrySet()) {
            RangeReference reference = parseReference(report, entry.getKey(), sheetNames);
            Object formula = entry.getValue();
            if (!(formula instanceof String)) {
                report.addError("FORMULA_NOT_STRING", "Formula for " + entry.getKey() + " must be a string", entry.getKey());
                continue;
            }
            if (!((String) formula).startsWith("=")) {
                report.addWarning("FORMULA_MISSING_EQUALS", "Formula for " + entry.getKey() + " does not start with '='",
                        entry.getKey());
            }
            if (reference == null) {
                continue;
            }
            if (reference.getKind() != ReferenceKind.SINGLE_CELL) {
                report.addWarning("FORMULA_RANGE_KEY", "Formula is keyed by the multi-cell reference "
                        + entry.getKey() + " and applies unchanged to every cell", entry.getKey());
            } else if (!QUALIFIED_CELL_KEY.matcher(entry.getKey().strip()).matches()) {
                report.addWarning("FORMULA_KEY_FORMAT", "Formula key " + entry.getKey()
                        + " is not of the form Sheet!A1", entry.getKey());
            }
            declarations.add(Declaration.formula(reference, (String) formula, declarations.size(), entry.getKey()));
        }
        checkCoverage(report, declarations, extents);
    }

    private void checkFormats(ValidationReport report, Section section, List<String> sheetNames,
                              Map<String, SheetExtent> extents) {
        Map<String, Object> entries = readEntries(report, section);
        List<Declaration> declarations = new ArrayList<>();
        for (Map.Entry<String, Object> entry : entries.entrySet()) {
            RangeReference reference = parseReference(report, entry.getKey(), sheetNames);
            if (!(entry.getValue() instanceof Map)) {
                report.addError("FORMAT_NOT_MAPPING", "Format for " + entry.getKey() + " must be a mapping", entry.getKey());
                continue;
            }
            if (reference == null) {
                continue;
            }
            Map<String, Object> attributes = new LinkedHashMap<>();
            ((Map<?, ?>) entry.getValue()).forEach((key, value) -> attributes.put(String.valueOf(key), value));
            declarations.add(new Declaration(reference, attributes, declarations.size(), entry.getKey()));
        }
        checkCoverage(report, declarations, extents);
    }

    /**
     * Bounded references must stay inside their sheet; declarations covering no cell are reported.
     */
    private void checkCoverage(ValidationReport report, List<Declaration> declarations,
                               Map<String, SheetExtent> extents) {
        List<Declaration> resolvable = new ArrayList<>();
        for (Declaration declaration : declarations) {
            RangeReference reference = declaration.getReference();
            SheetExtent extent = extents.get(reference.getSheet());
            if (extent == null) {
                continue;
            }
            try {
                referenceAlgebra.resolve(reference, extent);
            } catch (MdnFormatException e) {
                addError(report, e);
                continue;
            }
            if (referenceAlgebra.exceedsExtent(reference, extent)) {
                report.addError("REFERENCE_OUT_OF_EXTENT", "Reference " + declaration.getSourceText()
                        + " reaches outside sheet extent " + extent, declaration.getSourceText());
            }
            resolvable.add(declaration);
        }
        for (Declaration inert : cascadeResolver.inertDeclarations(resolvable, extents)) {
            report.addWarning("INERT_DECLARATION", "Declaration " + inert.getSourceText() + " covers no cell",
                    inert.getSourceText());
        }
    }

    private void checkPrompt(ValidationReport report, Section prompt) {
        String body = prompt.getBody().strip();
        int limit = properties.getValidation().getPromptLengthLimit();
        if (body.isEmpty()) {
            report.addWarning("EMPTY_PROMPT", "AI_PROMPT section is empty", line(prompt));
        } else if (body.length() > limit) {
            report.addWarning("PROMPT_TOO_LONG", "AI_PROMPT section has " + body.length()
                    + " characters, more than " + limit, line(prompt));
        }
    }

    /**
     * Decoding, encoding and decoding again must give the same formulas and formats.
     */
    private void checkRoundTrip(ValidationReport report, String text) {
        try {
            Workbook first = documentReader.read(text);
            Workbook second = documentReader.read(documentWriter.encode(first));
            if (!first.formulaState().equals(second.formulaState())) {
                report.addError("ROUND_TRIP_MISMATCH", "Formulas change when the document is re-encoded", null);
            }
            if (!first.formatState().equals(second.formatState())) {
                report.addError("ROUND_TRIP_MISMATCH", "Formats change when the document is re-encoded", null);
            }
        } catch (MdnFormatException e) {
            addError(report, e);
        } catch (IllegalArgumentException e) {
            report.addError("ROUND_TRIP_MISMATCH", "Document cannot be re-encoded: " + e.getMessage(), null);
        }
    }

    private Map<String, Object> readEntries(ValidationReport report, Section section) {
        try {
            return blockCodec.readMapping(section, section.getBody());
        } catch (MdnFormatException e) {
            addError(report, e);
            return Map.of();
        }
    }

    private RangeReference parseReference(ValidationReport report, String key, List<String> sheetNames) {
        try {
            return documentReader.parseKey(key, sheetNames);
        } catch (InvalidReferenceException e) {
            addError(report, e);
            return null;
        }
    }

    private static void addError(ValidationReport report, MdnFormatException e) {
        report.addError(e.getCode(), e.getMessage(), e.getLocation());
    }

    private static String line(Section section) {
        return "line " + section.getLineNumber();
    }
}
