package com.mdn.converter.models;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Canonical meaning of a reference string: the sheet it binds to, its syntactic
 * kind and the regions it is made of.
 * <p>
 * Two references are equal when they denote the same cells of the same sheet,
 * whatever their spelling ("A1:A1" equals "A1", "A:A,B:B" equals "A:B").
 * Equality deliberately ignores the kind; {@link #specificity()} does not.
 */
public final class RangeReference {

    private static final Pattern PLAIN_SHEET_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");

    private final String sheet;
    private final ReferenceKind kind;
    private final List<CellRegion> parts;
    private final Coverage coverage;

    public RangeReference(String sheet, ReferenceKind kind, List<CellRegion> parts) {
        if (parts == null || parts.isEmpty()) {
            throw new IllegalArgumentException("A reference needs at least one region");
        }
        this.sheet = Objects.requireNonNull(sheet, "sheet");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.parts = Collections.unmodifiableList(new ArrayList<>(parts));
        this.coverage = Coverage.of(this.parts);
    }

    public static RangeReference cell(String sheet, int row, int column) {
        return new RangeReference(sheet, ReferenceKind.SINGLE_CELL, List.of(CellRegion.cell(row, column)));
    }

    public static RangeReference block(String sheet, int firstRow, int firstColumn, int lastRow, int lastColumn) {
        if (firstRow == lastRow && firstColumn == lastColumn) {
            return cell(sheet, firstRow, firstColumn);
        }
        return new RangeReference(sheet, ReferenceKind.RECT_BLOCK,
                List.of(CellRegion.block(firstRow, firstColumn, lastRow, lastColumn)));
    }

    public String getSheet() {
        return sheet;
    }

    public ReferenceKind getKind() {
        return kind;
    }

    public List<CellRegion> getParts() {
        return parts;
    }

    /**
     * Rank used by the cascade. A union is only as specific as its broadest part.
     */
    public Specificity specificity() {
        Specificity fixed = kind.fixedSpecificity();
        if (fixed != null) {
            return fixed;
        }
        Specificity lowest = Specificity.SINGLE_CELL;
        for (CellRegion part : parts) {
            Specificity partRank = part.getKind().fixedSpecificity();
            if (lowest.isMoreSpecificThan(partRank)) {
                lowest = partRank;
            }
        }
        return lowest;
    }

    /**
     * Canonical text with an explicit sheet prefix, e.g. "Revenue!A1:B3,D:D".
     */
    public String toText() {
        return quoteSheetName(sheet) + "!" + parts.stream().map(CellRegion::toText).collect(Collectors.joining(","));
    }

    public static String quoteSheetName(String name) {
        if (PLAIN_SHEET_NAME.matcher(name).matches()) {
            return name;
        }
        return "'" + name.replace("'", "''") + "'";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RangeReference)) {
            return false;
        }
        RangeReference other = (RangeReference) o;
        return sheet.equals(other.sheet) && coverage.equals(other.coverage);
    }

    @Override
    public int hashCode() {
        return 31 * sheet.hashCode() + coverage.hashCode();
    }

    @Override
    public String toString() {
        return toText() + " [" + kind + "]";
    }

    /**
     * Spelling-independent description of the covered cells: the row and column
     * boundaries where coverage actually changes, and which bands are covered.
     * Redundant boundaries are removed, which makes the form unique.
     */
    private static final class Coverage {
        private final int[] rowBreaks;
        private final int[] columnBreaks;
        private final boolean[][] covered;

        private Coverage(int[] rowBreaks, int[] columnBreaks, boolean[][] covered) {
            this.rowBreaks = rowBreaks;
            this.columnBreaks = columnBreaks;
            this.covered = covered;
        }

        static Coverage of(List<CellRegion> parts) {
            TreeSet<Integer> rowSet = new TreeSet<>();
            TreeSet<Integer> columnSet = new TreeSet<>();
            for (CellRegion part : parts) {
                rowSet.add(part.top());
                rowSet.add(part.bottom() + 1);
                columnSet.add(part.left());
                columnSet.add(part.right() + 1);
            }
            int[] rows = rowSet.stream().mapToInt(Integer::intValue).toArray();
            int[] columns = columnSet.stream().mapToInt(Integer::intValue).toArray();

            boolean[][] grid = new boolean[rows.length - 1][columns.length - 1];
            for (CellRegion part : parts) {
                for (int r = 0; r < rows.length - 1; r++) {
                    if (rows[r] < part.top() || rows[r] > part.bottom()) {
                        continue;
                    }
                    for (int c = 0; c < columns.length - 1; c++) {
                        if (columns[c] >= part.left() && columns[c] <= part.right()) {
                            grid[r][c] = true;
                        }
                    }
                }
            }

            Bands rowBands = Bands.reduce(rows, grid);
            Bands columnBands = Bands.reduce(columns, transpose(rowBands.cells, columns.length - 1));
            return new Coverage(rowBands.breaks, columnBands.breaks, transpose(columnBands.cells, rowBands.cells.length));
        }

        private static boolean[][] transpose(boolean[][] grid, int width) {
            boolean[][] result = new boolean[width][grid.length];
            for (int i = 0; i < grid.length; i++) {
                for (int j = 0; j < width; j++) {
                    result[j][i] = grid[i][j];
                }
            }
            return result;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Coverage)) {
                return false;
            }
            Coverage other = (Coverage) o;
            return Arrays.equals(rowBreaks, other.rowBreaks)
                    && Arrays.equals(columnBreaks, other.columnBreaks)
                    && Arrays.deepEquals(covered, other.covered);
        }

        @Override
        public int hashCode() {
            return 31 * (31 * Arrays.hashCode(rowBreaks) + Arrays.hashCode(columnBreaks)) + Arrays.deepHashCode(covered);
        }
    }

    /**
     * Bands along one axis after merging identical neighbours and dropping empty edges.
     */
    private static final class Bands {
        private final int[] breaks;
        private final boolean[][] cells;

        private Bands(int[] breaks, boolean[][] cells) {
            this.breaks = breaks;
            this.cells = cells;
        }

        static Bands reduce(int[] breaks, boolean[][] bands) {
            List<Integer> keptBreaks = new ArrayList<>();
            List<boolean[]> keptBands = new ArrayList<>();
            for (int i = 0; i < bands.length; i++) {
                if (!keptBands.isEmpty() && Arrays.equals(keptBands.get(keptBands.size() - 1), bands[i])) {
                    continue;
                }
                keptBreaks.add(breaks[i]);
                keptBands.add(bands[i]);
            }
            keptBreaks.add(breaks[breaks.length - 1]);

            if (!keptBands.isEmpty() && isEmpty(keptBands.get(0))) {
                keptBands.remove(0);
                keptBreaks.remove(0);
            }
            if (!keptBands.isEmpty() && isEmpty(keptBands.get(keptBands.size() - 1))) {
                keptBands.remove(keptBands.size() - 1);
                keptBreaks.remove(keptBreaks.size() - 1);
            }
            return new Bands(keptBreaks.stream().mapToInt(Integer::intValue).toArray(),
                    keptBands.toArray(new boolean[0][]));
        }

        private static boolean isEmpty(boolean[] band) {
            for (boolean b : band) {
                if (b) {
                    return false;
                }
            }
            return true;
        }
    }
}
