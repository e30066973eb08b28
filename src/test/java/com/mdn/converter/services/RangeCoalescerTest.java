package com.mdn.converter.services;

import com.mdn.converter.models.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for folding per-cell attributes back into range declarations.
 */
class RangeCoalescerTest {

    private CascadeResolver cascadeResolver;
    private RangeCoalescer rangeCoalescer;

    @BeforeEach
    void setUp() {
        cascadeResolver = new CascadeResolver(new ReferenceAlgebra());
        rangeCoalescer = new RangeCoalescer(cascadeResolver);
    }

    private static void put(Map<CellCoordinate, Map<String, Object>> cells, String sheet, String a1,
                            Map<String, Object> attributes) {
        cells.put(CellCoordinate.of(sheet, a1), attributes);
    }

    /**
     * A uniform 3x2 block becomes one declaration.
     */
    @Test
    void testUniformBlockBecomesOneDeclaration() {
        Map<CellCoordinate, Map<String, Object>> cells = new LinkedHashMap<>();
        for (String a1 : List.of("B2", "C2", "B3", "C3", "B4", "C4")) {
            put(cells, "Data", a1, Map.of("numberFormat", "0.00"));
        }

        List<Declaration> declarations = rangeCoalescer.coalesce(new EffectiveState(cells), List.of("Data"));

        assertEquals(1, declarations.size());
        assertEquals("Data!B2:C4", declarations.get(0).getReference().toText());
        assertEquals(ReferenceKind.RECT_BLOCK, declarations.get(0).getReference().getKind());
    }

    @Test
    void testSingleCellsStaySingleCells() {
        Map<CellCoordinate, Map<String, Object>> cells = new LinkedHashMap<>();
        put(cells, "Data", "A1", Map.of("bold", true));
        put(cells, "Data", "C3", Map.of("bold", true));

        List<Declaration> declarations = rangeCoalescer.coalesce(new EffectiveState(cells), List.of("Data"));

        assertEquals(2, declarations.size());
        assertEquals(ReferenceKind.SINGLE_CELL, declarations.get(0).getReference().getKind());
        assertEquals("Data!A1", declarations.get(0).getReference().toText());
        assertEquals("Data!C3", declarations.get(1).getReference().toText());
    }

    /**
     * Resolving the coalesced declarations gives back the input, and
     * coalescing that result again gives the same declarations.
     */
    @Test
    void testCoalesceThenResolveIsIdentity() {
        Map<CellCoordinate, Map<String, Object>> cells = new LinkedHashMap<>();
        for (String a1 : List.of("A1", "B1", "C1", "D1")) {
            put(cells, "Revenue", a1, Map.of("bold", true, "color", "#1F4E79"));
        }
        for (String a1 : List.of("B2", "B3")) {
            put(cells, "Revenue", a1, Map.of("numberFormat", "#,##0"));
        }
        put(cells, "Revenue", "D2", Map.of("numberFormat", "$#,##0", "italic", true));
        put(cells, "Revenue", "D3", Map.of("numberFormat", "$#,##0"));
        put(cells, "Costs", "A1", Map.of("bold", true));
        EffectiveState assignment = new EffectiveState(cells);

        List<String> sheetOrder = List.of("Revenue", "Costs");
        List<Declaration> declarations = rangeCoalescer.coalesce(assignment, sheetOrder);
        Map<String, SheetExtent> extents = new LinkedHashMap<>();
        extents.put("Revenue", new SheetExtent(3, 4));
        extents.put("Costs", new SheetExtent(2, 2));

        assertEquals(assignment, cascadeResolver.resolve(declarations, extents));

        List<Declaration> again = rangeCoalescer.coalesce(cascadeResolver.resolve(declarations, extents), sheetOrder);
        assertEquals(declarations, again);
    }

    /**
     * Rectangles of different keys with the same bounds share one declaration;
     * the broadest declaration comes first.
     */
    @Test
    void testSameBoundsMergeAcrossKeys() {
        Map<CellCoordinate, Map<String, Object>> cells = new LinkedHashMap<>();
        put(cells, "Data", "A1", Map.of("bold", true, "color", "#FF0000"));
        put(cells, "Data", "B1", Map.of("bold", true, "color", "#FF0000"));
        put(cells, "Data", "C5", Map.of("italic", true));

        List<Declaration> declarations = rangeCoalescer.coalesce(new EffectiveState(cells), List.of("Data"));

        assertEquals(2, declarations.size());
        assertEquals("Data!A1:B1", declarations.get(0).getReference().toText());
        assertEquals(Map.of("bold", true, "color", "#FF0000"), declarations.get(0).getAttributes());
        assertEquals(0, declarations.get(0).getIndex());
        assertEquals("Data!C5", declarations.get(1).getReference().toText());
    }

    @Test
    void testCoalesceCellsKeepsOneDeclarationPerCell() {
        Map<CellCoordinate, Map<String, Object>> cells = new LinkedHashMap<>();
        put(cells, "Revenue", "D3", Map.of(Declaration.FORMULA_KEY, "=B3*(1+C3)"));
        put(cells, "Revenue", "D2", Map.of(Declaration.FORMULA_KEY, "=B2*(1+C2)"));

        List<Declaration> declarations = rangeCoalescer.coalesceCells(new EffectiveState(cells), List.of("Revenue"));

        assertEquals(2, declarations.size());
        assertEquals("Revenue!D2", declarations.get(0).getReference().toText());
        assertEquals("=B2*(1+C2)", declarations.get(0).getAttributes().get(Declaration.FORMULA_KEY));
        assertEquals("Revenue!D3", declarations.get(1).getReference().toText());
    }

    @Test
    void testEmptyAssignment() {
        assertTrue(rangeCoalescer.coalesce(EffectiveState.empty(), List.of("Data")).isEmpty());
    }
}
