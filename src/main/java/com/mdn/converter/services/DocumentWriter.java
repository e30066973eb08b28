package com.mdn.converter.services;

import com.mdn.converter.config.MdnProperties;
import com.mdn.converter.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;

/**
 * Writes a {@link Workbook} as document text. Per-cell formulas and formats are
 * folded back into range declarations by the {@link RangeCoalescer}.
 * <p>
 * Sections are written in canonical order. Unknown sections kept from a decoded
 * document come last, just before END DOCUMENT, whatever their original position.
 * A line of a multi-line cell or of the guidance that would read as a delimiter
 * is rejected with {@link IllegalArgumentException}.
 */
@Service
public class DocumentWriter {

    private static final Logger logger = LoggerFactory.getLogger(DocumentWriter.class);

    static final String CONTEXT_MARKER = "# optional context section";

    private final SectionGrammar sectionGrammar;
    private final BlockCodec blockCodec;
    private final RangeCoalescer rangeCoalescer;
    private final MdnProperties properties;

    public DocumentWriter(SectionGrammar sectionGrammar, BlockCodec blockCodec,
                          RangeCoalescer rangeCoalescer, MdnProperties properties) {
        this.sectionGrammar = sectionGrammar;
        this.blockCodec = blockCodec;
        this.rangeCoalescer = rangeCoalescer;
        this.properties = properties;
    }

    public String encode(Workbook workbook) {
        String namespace = properties.getNamespace();
        List<String> sheetNames = workbook.getSheetNames();
        List<Section> sections = new ArrayList<>();

        DocumentMetadata metadata = completeMetadata(workbook.getMetadata(), sheetNames);
        Section header = Section.of(namespace, SectionKind.HEADER, Map.of(), blockCodec.writeYaml(metadata.toCoreMap()));
        if (!metadata.getContext().isEmpty()) {
            header = header.withContext(CONTEXT_MARKER + "\n" + blockCodec.writeYaml(metadata.getContext()));
        }
        sections.add(header);

        for (Sheet sheet : workbook.getSheets()) {
            if (sheet.getName().chars().anyMatch(Character::isWhitespace)) {
                throw new IllegalArgumentException("Sheet name '" + sheet.getName() + "' cannot contain whitespace");
            }
            sections.add(Section.of(namespace, SectionKind.SHEET, Map.of("name", sheet.getName()),
                    blockCodec.writeRows(sheet.getHeaders(), sheet.getRows())));
        }

        EffectiveState formulaState = workbook.formulaState();
        List<Declaration> formulas = properties.getEncode().isCoalesceFormulas()
                ? rangeCoalescer.coalesce(formulaState, sheetNames)
                : rangeCoalescer.coalesceCells(formulaState, sheetNames);
        Map<String, Object> formulaBlock = new LinkedHashMap<>();
        for (Declaration declaration : formulas) {
            formulaBlock.put(declaration.getReference().toText(), declaration.getAttributes().get(Declaration.FORMULA_KEY));
        }
        sections.add(Section.of(namespace, SectionKind.FORMULAS, Map.of(), blockCodec.writeJson(formulaBlock)));

        EffectiveState formatState = workbook.formatState();
        if (!formatState.isEmpty()) {
            Map<String, Object> formatBlock = new LinkedHashMap<>();
            for (Declaration declaration : rangeCoalescer.coalesce(formatState, sheetNames)) {
                formatBlock.put(declaration.getReference().toText(), declaration.getAttributes());
            }
            sections.add(Section.of(namespace, SectionKind.FORMAT, Map.of(), blockCodec.writeJson(formatBlock)));
        }

        if (workbook.getGuidance() != null && !workbook.getGuidance().isBlank()) {
            sections.add(Section.of(namespace, SectionKind.AI_PROMPT, Map.of(), guidanceBody(workbook.getGuidance())));
        }
        sections.addAll(workbook.getPassthroughSections());
        for (Section section : sections) {
            rejectDelimiterLines(section, section.getBodyLines());
            rejectDelimiterLines(section, section.getContextLines());
        }

        logger.info("Encoded {} sheets, {} formula declarations for {} cells",
                sheetNames.size(), formulas.size(), formulaState.cells().size());
        return sectionGrammar.serialize(sections);
    }

    /**
     * Guidance is free text: line endings are normalized and trailing blank lines
     * dropped, leading indentation is kept.
     */
    static String guidanceBody(String guidance) {
        String body = guidance.replace("\r\n", "\n");
        int end = body.length();
        while (end > 0 && (body.charAt(end - 1) == '\n' || body.charAt(end - 1) == '\r')) {
            end--;
        }
        return body.substring(0, end);
    }

    /**
     * A body line that reads as a delimiter would end the section early, so the
     * document could not be decoded again.
     */
    private static void rejectDelimiterLines(Section section, List<String> lines) {
        for (String line : lines) {
            if (SectionGrammar.isDelimiterLine(line)) {
                String where = section.getAttribute("name") == null
                        ? section.getKindToken()
                        : section.getKindToken() + " '" + section.getAttribute("name") + "'";
                throw new IllegalArgumentException(where + " contains a line that reads as a section delimiter: " + line);
            }
        }
    }

    /**
     * Missing header fields are filled from configuration; the sheet list always
     * follows the workbook.
     */
    private DocumentMetadata completeMetadata(DocumentMetadata metadata, List<String> sheetNames) {
        if (metadata == null) {
            return new DocumentMetadata(properties.getEncode().getDefaultSource(), properties.getFormatVersion(),
                    now(), sheetNames, null, null);
        }
        return new DocumentMetadata(
                metadata.getSource() == null ? properties.getEncode().getDefaultSource() : metadata.getSource(),
                metadata.getVersion() == null ? properties.getFormatVersion() : metadata.getVersion(),
                metadata.getCreated() == null ? now() : metadata.getCreated(),
                sheetNames, metadata.getExtras(), metadata.getContext());
    }

    private static String now() {
        return Instant.now().truncatedTo(ChronoUnit.SECONDS).toString();
    }
}
