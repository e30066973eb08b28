package com.mdn.converter.services;

import com.mdn.converter.exceptions.CoalesceInvariantViolationException;
import com.mdn.converter.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Compresses a per-cell attribute assignment into a short list of range declarations
 * whose cascade reproduces it exactly.
 * <p>
 * Per sheet and per key, rows are scanned top to bottom; each row is cut into runs of
 * equal values and a run extends the rectangle above it only when its column span
 * and value match exactly. This is linear and deterministic, not a minimum cover.
 * Rectangles of one key never overlap, so rectangles of different keys with the same
 * bounds are merged into one declaration.
 */
@Service
public class RangeCoalescer {

    private static final Logger logger = LoggerFactory.getLogger(RangeCoalescer.class);

    private final CascadeResolver resolver;

    public RangeCoalescer(CascadeResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Coalesces into block and single-cell declarations, broadest first.
     *
     * @param sheetOrder sheet declaration order; sheets not listed follow by name
     * @throws CoalesceInvariantViolationException if the result does not re-resolve to the input (a defect)
     */
    public List<Declaration> coalesce(EffectiveState assignment, List<String> sheetOrder) {
        List<String> sheets = orderedSheets(assignment, sheetOrder);
        List<Rectangle> rectangles = new ArrayList<>();
        for (String sheet : sheets) {
            Map<String, NavigableMap<Integer, NavigableMap<Integer, Object>>> grids = gridsByKey(assignment, sheet);
            grids.forEach((key, grid) -> rectangles.addAll(mergeRuns(sheet, key, grid)));
        }

        rectangles.sort(Comparator.comparingLong(Rectangle::area).reversed()
                .thenComparingInt(r -> sheets.indexOf(r.sheet))
                .thenComparingInt(r -> r.top)
                .thenComparingInt(r -> r.left)
                .thenComparingInt(r -> r.bottom)
                .thenComparingInt(r -> r.right)
                .thenComparing(r -> r.key));

        Map<List<Object>, Map<String, Object>> merged = new LinkedHashMap<>();
        Map<List<Object>, Rectangle> bounds = new HashMap<>();
        for (Rectangle rectangle : rectangles) {
            List<Object> boundsKey = List.of(rectangle.sheet, rectangle.top, rectangle.left, rectangle.bottom, rectangle.right);
            merged.computeIfAbsent(boundsKey, k -> new LinkedHashMap<>()).put(rectangle.key, rectangle.value);
            bounds.putIfAbsent(boundsKey, rectangle);
        }

        List<Declaration> declarations = new ArrayList<>();
        merged.forEach((boundsKey, attributes) -> {
            Rectangle r = bounds.get(boundsKey);
            RangeReference reference = RangeReference.block(r.sheet, r.top, r.left, r.bottom, r.right);
            declarations.add(new Declaration(reference, attributes, declarations.size()));
        });

        verify(assignment, declarations, sheets);
        logger.debug("Coalesced {} cells into {} declarations", assignment.cells().size(), declarations.size());
        return declarations;
    }

    /**
     * One single-cell declaration per cell, in sheet then row-major order.
     */
    public List<Declaration> coalesceCells(EffectiveState assignment, List<String> sheetOrder) {
        List<String> sheets = orderedSheets(assignment, sheetOrder);
        List<CellCoordinate> cells = new ArrayList<>(assignment.cells());
        cells.sort(CellCoordinate.inSheetOrder(sheets));

        List<Declaration> declarations = new ArrayList<>();
        for (CellCoordinate cell : cells) {
            Map<String, Object> attributes = withoutNulls(assignment.attributesAt(cell));
            if (!attributes.isEmpty()) {
                RangeReference reference = RangeReference.cell(cell.getSheet(), cell.getRow(), cell.getColumn());
                declarations.add(new Declaration(reference, attributes, declarations.size()));
            }
        }
        verify(assignment, declarations, sheets);
        return declarations;
    }

    private static List<String> orderedSheets(EffectiveState assignment, List<String> sheetOrder) {
        List<String> sheets = new ArrayList<>(sheetOrder);
        SortedSet<String> unlisted = new TreeSet<>();
        for (CellCoordinate cell : assignment.cells()) {
            if (!sheets.contains(cell.getSheet())) {
                unlisted.add(cell.getSheet());
            }
        }
        sheets.addAll(unlisted);
        return sheets;
    }

    /**
     * key -> row -> column -> value for one sheet, keys in name order.
     */
    private static Map<String, NavigableMap<Integer, NavigableMap<Integer, Object>>> gridsByKey(
            EffectiveState assignment, String sheet) {
        Map<String, NavigableMap<Integer, NavigableMap<Integer, Object>>> grids = new TreeMap<>();
        assignment.asMap().forEach((cell, attributes) -> {
            if (!cell.getSheet().equals(sheet)) {
                return;
            }
            attributes.forEach((key, value) -> {
                if (value != null) {
                    grids.computeIfAbsent(key, k -> new TreeMap<>())
                            .computeIfAbsent(cell.getRow(), r -> new TreeMap<>())
                            .put(cell.getColumn(), value);
                }
            });
        });
        return grids;
    }

    private static List<Rectangle> mergeRuns(String sheet, String key, NavigableMap<Integer, NavigableMap<Integer, Object>> grid) {
        List<Rectangle> finished = new ArrayList<>();
        // rectangles whose bottom edge is the previous row, by column span
        Map<List<Integer>, Rectangle> open = new HashMap<>();
        int previousRow = -2;

        for (Map.Entry<Integer, NavigableMap<Integer, Object>> rowEntry : grid.entrySet()) {
            int row = rowEntry.getKey();
            if (row != previousRow + 1) {
                finished.addAll(open.values());
                open.clear();
            }
            Map<List<Integer>, Rectangle> extended = new HashMap<>();
            for (Rectangle run : runs(sheet, key, row, rowEntry.getValue())) {
                List<Integer> span = List.of(run.left, run.right);
                Rectangle above = open.remove(span);
                if (above != null && above.value.equals(run.value)) {
                    above.bottom = row;
                    extended.put(span, above);
                } else {
                    if (above != null) {
                        finished.add(above);
                    }
                    extended.put(span, run);
                }
            }
            finished.addAll(open.values());
            open = extended;
            previousRow = row;
        }
        finished.addAll(open.values());
        return finished;
    }

    /**
     * Maximal runs of adjacent columns holding equal values in one row.
     */
    private static List<Rectangle> runs(String sheet, String key, int row, NavigableMap<Integer, Object> columns) {
        List<Rectangle> runs = new ArrayList<>();
        Rectangle current = null;
        for (Map.Entry<Integer, Object> entry : columns.entrySet()) {
            int column = entry.getKey();
            if (current != null && column == current.right + 1 && current.value.equals(entry.getValue())) {
                current.right = column;
            } else {
                current = new Rectangle(sheet, key, entry.getValue(), row, column);
                runs.add(current);
            }
        }
        return runs;
    }

    private void verify(EffectiveState assignment, List<Declaration> declarations, List<String> sheets) {
        Map<String, int[]> bounds = new LinkedHashMap<>();
        for (String sheet : sheets) {
            bounds.put(sheet, new int[]{0, 0});
        }
        for (CellCoordinate cell : assignment.cells()) {
            int[] size = bounds.get(cell.getSheet());
            size[0] = Math.max(size[0], cell.getRow() + 1);
            size[1] = Math.max(size[1], cell.getColumn() + 1);
        }
        Map<String, SheetExtent> extents = new LinkedHashMap<>();
        bounds.forEach((sheet, size) -> extents.put(sheet, new SheetExtent(size[0], size[1])));

        Map<CellCoordinate, Map<String, Object>> expected = new HashMap<>();
        assignment.asMap().forEach((cell, attributes) -> expected.put(cell, withoutNulls(attributes)));
        EffectiveState expectedState = new EffectiveState(expected);
        EffectiveState actual = resolver.resolve(declarations, extents);
        if (!actual.equals(expectedState)) {
            CellCoordinate first = firstDifference(expectedState, actual);
            throw new CoalesceInvariantViolationException("Coalesced declarations do not reproduce the assignment: expected "
                    + expectedState.attributesAt(first) + " but resolved " + actual.attributesAt(first),
                    String.valueOf(first));
        }
    }

    private static CellCoordinate firstDifference(EffectiveState expected, EffectiveState actual) {
        Set<CellCoordinate> cells = new LinkedHashSet<>(expected.cells());
        cells.addAll(actual.cells());
        for (CellCoordinate cell : cells) {
            if (!expected.attributesAt(cell).equals(actual.attributesAt(cell))) {
                return cell;
            }
        }
        return null;
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> attributes) {
        Map<String, Object> result = new LinkedHashMap<>();
        attributes.forEach((key, value) -> {
            if (value != null) {
                result.put(key, value);
            }
        });
        return result;
    }

    private static final class Rectangle {
        private final String sheet;
        private final String key;
        private final Object value;
        private final int top;
        private final int left;
        private int bottom;
        private int right;

        private Rectangle(String sheet, String key, Object value, int row, int column) {
            this.sheet = sheet;
            this.key = key;
            this.value = value;
            this.top = row;
            this.left = column;
            this.bottom = row;
            this.right = column;
        }

        long area() {
            return (long) (bottom - top + 1) * (right - left + 1);
        }
    }
}
