package com.mdn.converter.models;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Zero-based address of a single cell inside a named sheet.
 * Row 0 is the header row of the sheet (spreadsheet row 1).
 */
public final class CellCoordinate {

    /**
     * Row-major order that ignores the sheet; only meaningful for cells of one sheet.
     */
    public static final Comparator<CellCoordinate> ROW_MAJOR =
            Comparator.comparingInt(CellCoordinate::getRow).thenComparingInt(CellCoordinate::getColumn);

    /**
     * Total order over cells of several sheets: the given sheet order, then row-major.
     * Sheets missing from the list sort last, by name.
     */
    public static Comparator<CellCoordinate> inSheetOrder(List<String> sheets) {
        return Comparator.<CellCoordinate>comparingInt(cell -> {
                    int index = sheets.indexOf(cell.getSheet());
                    return index < 0 ? Integer.MAX_VALUE : index;
                })
                .thenComparing(CellCoordinate::getSheet)
                .thenComparing(ROW_MAJOR);
    }

    private static final Pattern CELL_TEXT = Pattern.compile("\\$?([A-Z]{1,3})\\$?([1-9][0-9]{0,6})");

    private final String sheet;
    private final int row;
    private final int column;

    public CellCoordinate(String sheet, int row, int column) {
        if (row < 0 || column < 0) {
            throw new IllegalArgumentException("Negative cell coordinate: row=" + row + ", column=" + column);
        }
        this.sheet = Objects.requireNonNull(sheet, "sheet");
        this.row = row;
        this.column = column;
    }

    /**
     * Parses plain A1 notation ("D2", "$D$2") without a sheet prefix.
     *
     * @throws IllegalArgumentException if the text is not a single cell
     */
    public static CellCoordinate of(String sheet, String cellText) {
        Matcher matcher = CELL_TEXT.matcher(cellText == null ? "" : cellText.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a cell address: " + cellText);
        }
        int column = CellRegion.columnIndex(matcher.group(1));
        int row = Integer.parseInt(matcher.group(2)) - 1;
        if (column < 0 || column >= CellRegion.MAX_COLUMNS || row >= CellRegion.MAX_ROWS) {
            throw new IllegalArgumentException("Cell address beyond sheet limits: " + cellText);
        }
        return new CellCoordinate(sheet, row, column);
    }

    public String getSheet() {
        return sheet;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    /**
     * The cell in A1 notation without the sheet, e.g. "D2" for row 1, column 3.
     */
    public String toCellText() {
        return CellRegion.columnLetters(column) + (row + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellCoordinate)) {
            return false;
        }
        CellCoordinate other = (CellCoordinate) o;
        return row == other.row && column == other.column && sheet.equals(other.sheet);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sheet, row, column);
    }

    @Override
    public String toString() {
        return sheet + "!" + toCellText();
    }
}
