package com.mdn.converter.models;

/**
 * Current size of a sheet grid: header row plus data rows, by header columns.
 * Unbounded references are clipped against this, never extrapolated beyond it.
 */
public final class SheetExtent {
    private final int rows;
    private final int columns;

    public SheetExtent(int rows, int columns) {
        if (rows < 0 || columns < 0) {
            throw new IllegalArgumentException("Negative extent: " + rows + "x" + columns);
        }
        this.rows = rows;
        this.columns = columns;
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    public boolean contains(int row, int column) {
        return row >= 0 && row < rows && column >= 0 && column < columns;
    }

    public boolean isEmpty() {
        return rows == 0 || columns == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof SheetExtent)) {
            return false;
        }
        SheetExtent other = (SheetExtent) o;
        return rows == other.rows && columns == other.columns;
    }

    @Override
    public int hashCode() {
        return 31 * rows + columns;
    }

    @Override
    public String toString() {
        return rows + "x" + columns;
    }
}
