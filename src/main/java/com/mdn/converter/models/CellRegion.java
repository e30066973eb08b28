package com.mdn.converter.models;

import java.util.Objects;

/**
 * One comma-separated part of a reference: a cell, a block, a column span,
 * a row span or the whole sheet, with its bounds kept as written.
 * Unbounded ends are stored as the spreadsheet limits, so every region is a
 * finite rectangle and clipping to a sheet is a plain intersection.
 */
public final class CellRegion {

    public static final int MAX_ROWS = 1_048_576;
    public static final int MAX_COLUMNS = 16_384;

    private final ReferenceKind kind;
    private final int firstRow;
    private final int lastRow;
    private final int firstColumn;
    private final int lastColumn;

    private CellRegion(ReferenceKind kind, int firstRow, int lastRow, int firstColumn, int lastColumn) {
        this.kind = kind;
        this.firstRow = firstRow;
        this.lastRow = lastRow;
        this.firstColumn = firstColumn;
        this.lastColumn = lastColumn;
    }

    public static CellRegion cell(int row, int column) {
        return new CellRegion(ReferenceKind.SINGLE_CELL, row, row, column, column);
    }

    public static CellRegion block(int firstRow, int firstColumn, int lastRow, int lastColumn) {
        return new CellRegion(ReferenceKind.RECT_BLOCK, firstRow, lastRow, firstColumn, lastColumn);
    }

    public static CellRegion columns(int firstColumn, int lastColumn) {
        return new CellRegion(ReferenceKind.FULL_COLUMN, 0, MAX_ROWS - 1, firstColumn, lastColumn);
    }

    public static CellRegion rows(int firstRow, int lastRow) {
        return new CellRegion(ReferenceKind.FULL_ROW, firstRow, lastRow, 0, MAX_COLUMNS - 1);
    }

    public static CellRegion wholeSheet() {
        return new CellRegion(ReferenceKind.SHEET_WIDE, 0, MAX_ROWS - 1, 0, MAX_COLUMNS - 1);
    }

    public ReferenceKind getKind() {
        return kind;
    }

    public boolean isInverted() {
        return firstRow > lastRow || firstColumn > lastColumn;
    }

    public int top() {
        return Math.min(firstRow, lastRow);
    }

    public int bottom() {
        return Math.max(firstRow, lastRow);
    }

    public int left() {
        return Math.min(firstColumn, lastColumn);
    }

    public int right() {
        return Math.max(firstColumn, lastColumn);
    }

    public long area() {
        return (long) (bottom() - top() + 1) * (right() - left() + 1);
    }

    /**
     * True if this is a bounded part (cell or block) reaching past the sheet.
     * Column spans, row spans and the wildcard are clipped by definition.
     */
    public boolean exceeds(SheetExtent extent) {
        if (kind != ReferenceKind.SINGLE_CELL && kind != ReferenceKind.RECT_BLOCK) {
            return false;
        }
        return bottom() >= extent.getRows() || right() >= extent.getColumns();
    }

    public String toText() {
        switch (kind) {
            case SINGLE_CELL:
                return cellText(firstRow, firstColumn);
            case RECT_BLOCK:
                return cellText(firstRow, firstColumn) + ":" + cellText(lastRow, lastColumn);
            case FULL_COLUMN:
                return columnLetters(firstColumn) + ":" + columnLetters(lastColumn);
            case FULL_ROW:
                return (firstRow + 1) + ":" + (lastRow + 1);
            case SHEET_WIDE:
                return "*";
            default:
                throw new IllegalStateException("Not a single-part kind: " + kind);
        }
    }

    /**
     * Zero-based column index to letters: 0 -> "A", 25 -> "Z", 26 -> "AA".
     */
    public static String columnLetters(int column) {
        if (column < 0) {
            throw new IllegalArgumentException("Column index must be 0 or greater: " + column);
        }
        StringBuilder letters = new StringBuilder();
        int remaining = column + 1;
        while (remaining > 0) {
            remaining--;
            letters.insert(0, (char) ('A' + remaining % 26));
            remaining /= 26;
        }
        return letters.toString();
    }

    /**
     * Letters to zero-based column index: "A" -> 0, "AA" -> 26.
     * Returns -1 for anything that is not upper-case letters.
     */
    public static int columnIndex(String letters) {
        if (letters == null || letters.isEmpty() || letters.length() > 3) {
            return -1;
        }
        int index = 0;
        for (int i = 0; i < letters.length(); i++) {
            char c = letters.charAt(i);
            if (c < 'A' || c > 'Z') {
                return -1;
            }
            index = index * 26 + (c - 'A' + 1);
        }
        return index - 1;
    }

    public static String cellText(int row, int column) {
        return columnLetters(column) + (row + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof CellRegion)) {
            return false;
        }
        CellRegion other = (CellRegion) o;
        return kind == other.kind && firstRow == other.firstRow && lastRow == other.lastRow
                && firstColumn == other.firstColumn && lastColumn == other.lastColumn;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, firstRow, lastRow, firstColumn, lastColumn);
    }

    @Override
    public String toString() {
        return toText();
    }
}
