package com.mdn.converter.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.*;

/**
 * Represents one tabular block of a workbook:
 * - A unique name
 * - Column headers (row 0 of the grid)
 * - Data rows of scalar values: String, BigDecimal or null for blank
 * - The effective formula and format of each cell, after cascade resolution
 * <p>
 * Rows shorter than the header are right-padded with blanks; longer rows are rejected.
 * <p>
 * The CSV block carries no cell types. Text that is a plain decimal, such as "10",
 * is written unquoted and reads back as a BigDecimal.
 */
public class Sheet {

    private final String name;
    private final List<String> headers;
    private final List<List<Object>> rows;
    private final Map<CellCoordinate, String> formulas = new TreeMap<>(CellCoordinate.ROW_MAJOR);
    private final Map<CellCoordinate, Map<String, Object>> formats = new TreeMap<>(CellCoordinate.ROW_MAJOR);

    public Sheet(String name, List<String> headers, List<List<Object>> rows) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Sheet name must not be blank");
        }
        this.name = name;
        this.headers = Collections.unmodifiableList(new ArrayList<>(headers == null ? List.of() : headers));
        List<List<Object>> padded = new ArrayList<>();
        int rowNumber = 2;
        for (List<Object> row : rows == null ? List.<List<Object>>of() : rows) {
            if (row.size() > this.headers.size()) {
                throw new IllegalArgumentException("Row " + rowNumber + " of sheet '" + name + "' has "
                        + row.size() + " values but only " + this.headers.size() + " columns");
            }
            List<Object> values = new ArrayList<>(this.headers.size());
            for (Object value : row) {
                values.add(normalizeCellValue(value));
            }
            while (values.size() < this.headers.size()) {
                values.add(null);
            }
            padded.add(Collections.unmodifiableList(values));
            rowNumber++;
        }
        this.rows = Collections.unmodifiableList(padded);
    }

    /**
     * JSON form: formulas and formats keyed by A1 cell text ("D2").
     */
    @JsonCreator
    public Sheet(@JsonProperty("name") String name,
                 @JsonProperty("headers") List<String> headers,
                 @JsonProperty("rows") List<List<Object>> rows,
                 @JsonProperty("formulas") Map<String, String> formulas,
                 @JsonProperty("formats") Map<String, Map<String, Object>> formats) {
        this(name, headers, rows);
        if (formulas != null) {
            formulas.forEach((cell, formula) -> putFormula(CellCoordinate.of(name, cell), formula));
        }
        if (formats != null) {
            formats.forEach((cell, attributes) -> putFormat(CellCoordinate.of(name, cell), attributes));
        }
    }

    public String getName() {
        return name;
    }

    public List<String> getHeaders() {
        return headers;
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    /**
     * Header row plus data rows, by header columns.
     */
    @JsonIgnore
    public SheetExtent getExtent() {
        return new SheetExtent(rows.size() + 1, headers.size());
    }

    /**
     * Value at a grid position; row 0 is the header row.
     */
    public Object valueAt(int row, int column) {
        if (!getExtent().contains(row, column)) {
            return null;
        }
        return row == 0 ? headers.get(column) : rows.get(row - 1).get(column);
    }

    public void putFormula(CellCoordinate cell, String formula) {
        checkInside(cell);
        if (formula == null) {
            formulas.remove(cell);
        } else {
            formulas.put(cell, formula);
        }
    }

    public void putFormat(CellCoordinate cell, Map<String, Object> attributes) {
        checkInside(cell);
        if (attributes == null || attributes.isEmpty()) {
            formats.remove(cell);
            return;
        }
        Map<String, Object> normalized = new LinkedHashMap<>();
        attributes.forEach((key, value) -> normalized.put(key, normalizeAttribute(value)));
        formats.put(cell, Collections.unmodifiableMap(normalized));
    }

    public Map<CellCoordinate, String> formulaCells() {
        return Collections.unmodifiableMap(formulas);
    }

    public Map<CellCoordinate, Map<String, Object>> formatCells() {
        return Collections.unmodifiableMap(formats);
    }

    /**
     * Formulas keyed by A1 cell text, in row-major order.
     */
    public Map<String, String> getFormulas() {
        Map<String, String> byCell = new LinkedHashMap<>();
        formulas.forEach((cell, formula) -> byCell.put(cell.toCellText(), formula));
        return byCell;
    }

    public Map<String, Map<String, Object>> getFormats() {
        Map<String, Map<String, Object>> byCell = new LinkedHashMap<>();
        formats.forEach((cell, attributes) -> byCell.put(cell.toCellText(), attributes));
        return byCell;
    }

    private void checkInside(CellCoordinate cell) {
        if (!name.equals(cell.getSheet())) {
            throw new IllegalArgumentException("Cell " + cell + " does not belong to sheet '" + name + "'");
        }
        if (!getExtent().contains(cell.getRow(), cell.getColumn())) {
            throw new IllegalArgumentException("Cell " + cell + " is outside sheet extent " + getExtent());
        }
    }

    /**
     * Blank strings become null, numbers become BigDecimal, anything else its text.
     */
    static Object normalizeCellValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String) {
            return ((String) value).isEmpty() ? null : value;
        }
        if (value instanceof BigDecimal) {
            return value;
        }
        if (value instanceof Number) {
            return new BigDecimal(value.toString());
        }
        return value.toString();
    }

    /**
     * Integral numbers that fit become Integer, other numbers Double, so that
     * values built in code compare equal to values parsed from JSON.
     */
    static Object normalizeAttribute(Object value) {
        if (value instanceof Integer || !(value instanceof Number)) {
            return value;
        }
        if (value instanceof Long || value instanceof Short || value instanceof Byte || value instanceof BigInteger) {
            long asLong = ((Number) value).longValue();
            if (asLong >= Integer.MIN_VALUE && asLong <= Integer.MAX_VALUE) {
                return (int) asLong;
            }
            return asLong;
        }
        return ((Number) value).doubleValue();
    }
}
