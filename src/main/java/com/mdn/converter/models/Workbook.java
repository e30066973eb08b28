package com.mdn.converter.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.*;

/**
 * Represents a whole converted document:
 * - The HEADER metadata
 * - Sheets in declaration order (the order is meaningful)
 * - Optional free-text guidance from the AI_PROMPT block
 * - Unknown sections, carried through verbatim
 */
public class Workbook {

    private final DocumentMetadata metadata;
    private final Map<String, Sheet> sheets = new LinkedHashMap<>();
    private final String guidance;
    private final List<Section> passthroughSections;

    public Workbook(DocumentMetadata metadata, List<Sheet> sheets, String guidance, List<Section> passthroughSections) {
        this.metadata = metadata;
        this.guidance = guidance;
        this.passthroughSections = Collections.unmodifiableList(
                new ArrayList<>(passthroughSections == null ? List.of() : passthroughSections));
        for (Sheet sheet : sheets == null ? List.<Sheet>of() : sheets) {
            if (this.sheets.putIfAbsent(sheet.getName(), sheet) != null) {
                throw new IllegalArgumentException("Duplicate sheet name: " + sheet.getName());
            }
        }
    }

    @JsonCreator
    public Workbook(@JsonProperty("metadata") DocumentMetadata metadata,
                    @JsonProperty("sheets") List<Sheet> sheets,
                    @JsonProperty("guidance") String guidance) {
        this(metadata, sheets, guidance, null);
    }

    public DocumentMetadata getMetadata() {
        return metadata;
    }

    public List<Sheet> getSheets() {
        return new ArrayList<>(sheets.values());
    }

    public String getGuidance() {
        return guidance;
    }

    @JsonIgnore
    public List<Section> getPassthroughSections() {
        return passthroughSections;
    }

    /**
     * Retrieves a sheet by name, or null if the workbook doesn't declare it.
     */
    public Sheet getSheet(String name) {
        return sheets.get(name);
    }

    @JsonIgnore
    public List<String> getSheetNames() {
        return new ArrayList<>(sheets.keySet());
    }

    @JsonIgnore
    public Map<String, SheetExtent> getExtents() {
        Map<String, SheetExtent> extents = new LinkedHashMap<>();
        sheets.forEach((name, sheet) -> extents.put(name, sheet.getExtent()));
        return extents;
    }

    /**
     * Total cell order: sheet declaration order, then row, then column.
     */
    public Comparator<CellCoordinate> coordinateOrder() {
        return CellCoordinate.inSheetOrder(getSheetNames());
    }

    /**
     * Every formula as a single-key attribute map, the shape the cascade works on.
     */
    public EffectiveState formulaState() {
        Map<CellCoordinate, Map<String, Object>> state = new TreeMap<>(coordinateOrder());
        for (Sheet sheet : sheets.values()) {
            sheet.formulaCells().forEach((cell, formula) ->
                    state.put(cell, Map.of(Declaration.FORMULA_KEY, formula)));
        }
        return new EffectiveState(state);
    }

    public EffectiveState formatState() {
        Map<CellCoordinate, Map<String, Object>> state = new TreeMap<>(coordinateOrder());
        for (Sheet sheet : sheets.values()) {
            state.putAll(sheet.formatCells());
        }
        return new EffectiveState(state);
    }
}
