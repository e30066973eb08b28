package com.mdn.converter.services;

import com.mdn.converter.exceptions.InvalidReferenceException;
import com.mdn.converter.exceptions.OutOfRangeException;
import com.mdn.converter.models.*;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses reference strings such as "Revenue!D2", "Revenue!A1:C3", "D:D", "2:4",
 * "'Q1 Plan'!A1,B4" or "Revenue!*" into {@link RangeReference}s, and resolves
 * them against the current extent of a sheet.
 */
@Service
public class ReferenceAlgebra {

    private static final Pattern CELL = Pattern.compile("\\$?([A-Z]{1,3})\\$?([0-9]{1,7})");
    private static final Pattern COLUMN = Pattern.compile("\\$?([A-Z]{1,3})");
    private static final Pattern ROW = Pattern.compile("\\$?([0-9]{1,7})");

    /**
     * Parses without checking the sheet name against a workbook.
     */
    public RangeReference parse(String reference, String contextSheet) {
        return parse(reference, contextSheet, null);
    }

    /**
     * Parses a reference. A part without "Sheet!" binds to the sheet of the first part,
     * or to {@code contextSheet} when the first part has none.
     *
     * @param declaredSheets sheet names the reference may name; null to skip the check
     * @throws InvalidReferenceException on malformed tokens, mixed sheets or an unknown sheet
     */
    public RangeReference parse(String reference, String contextSheet, Collection<String> declaredSheets) {
        if (reference == null || reference.isBlank()) {
            throw new InvalidReferenceException("Empty reference", reference);
        }
        String sheet = null;
        List<CellRegion> parts = new ArrayList<>();
        for (String rawPart : splitParts(reference)) {
            String[] sheetAndRange = splitSheet(rawPart, reference);
            String partSheet = sheetAndRange[0];
            if (sheet == null) {
                sheet = partSheet != null ? partSheet : contextSheet;
                if (sheet == null) {
                    throw new InvalidReferenceException("Reference names no sheet and has no context sheet", reference);
                }
            } else if (partSheet != null && !partSheet.equals(sheet)) {
                throw new InvalidReferenceException("All parts of a reference must name the same sheet", reference);
            }
            parts.add(parseRegion(sheetAndRange[1], reference));
        }
        if (declaredSheets != null && !declaredSheets.contains(sheet)) {
            throw new InvalidReferenceException("Unknown sheet '" + sheet + "'", reference);
        }
        return new RangeReference(sheet, kindOf(parts), parts);
    }

    /**
     * Cells the reference denotes inside the given extent, in row-major order.
     * Column spans, row spans and the wildcard are clipped to the extent and so are
     * bounded parts; nothing beyond the sheet's data is ever produced.
     *
     * @throws OutOfRangeException if a part has its start after its end
     */
    public NavigableSet<CellCoordinate> resolve(RangeReference reference, SheetExtent extent) {
        NavigableSet<CellCoordinate> cells = new TreeSet<>(CellCoordinate.ROW_MAJOR);
        for (CellRegion part : reference.getParts()) {
            if (part.isInverted()) {
                throw new OutOfRangeException("Range start is after its end", reference.toText());
            }
            int lastRow = Math.min(part.bottom(), extent.getRows() - 1);
            int lastColumn = Math.min(part.right(), extent.getColumns() - 1);
            for (int row = part.top(); row <= lastRow; row++) {
                for (int column = part.left(); column <= lastColumn; column++) {
                    cells.add(new CellCoordinate(reference.getSheet(), row, column));
                }
            }
        }
        return cells;
    }

    public Specificity specificityRank(RangeReference reference) {
        return reference.specificity();
    }

    /**
     * True if a cell or block part reaches past the sheet's rows or columns.
     */
    public boolean exceedsExtent(RangeReference reference, SheetExtent extent) {
        return reference.getParts().stream().anyMatch(part -> part.exceeds(extent));
    }

    private static ReferenceKind kindOf(List<CellRegion> parts) {
        if (parts.size() == 1) {
            return parts.get(0).getKind();
        }
        boolean allCells = parts.stream().allMatch(part -> part.getKind() == ReferenceKind.SINGLE_CELL);
        return allCells ? ReferenceKind.EXPLICIT_LIST : ReferenceKind.UNION;
    }

    /**
     * Splits on commas that are not inside a quoted sheet name.
     */
    private static List<String> splitParts(String reference) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < reference.length(); i++) {
            char c = reference.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            }
            if (c == ',' && !quoted) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (quoted) {
            throw new InvalidReferenceException("Unterminated quoted sheet name", reference);
        }
        parts.add(current.toString());
        for (String part : parts) {
            if (part.isBlank()) {
                throw new InvalidReferenceException("Empty part in reference list", reference);
            }
        }
        return parts;
    }

    /**
     * Returns {sheet or null, range text}.
     */
    private static String[] splitSheet(String rawPart, String reference) {
        String part = rawPart.trim();
        if (part.startsWith("'")) {
            StringBuilder sheet = new StringBuilder();
            int i = 1;
            while (i < part.length()) {
                char c = part.charAt(i);
                if (c == '\'' && i + 1 < part.length() && part.charAt(i + 1) == '\'') {
                    sheet.append('\'');
                    i += 2;
                } else if (c == '\'') {
                    break;
                } else {
                    sheet.append(c);
                    i++;
                }
            }
            if (i + 1 >= part.length() || part.charAt(i + 1) != '!') {
                throw new InvalidReferenceException("Quoted sheet name must be followed by '!'", reference);
            }
            if (sheet.length() == 0) {
                throw new InvalidReferenceException("Empty sheet name", reference);
            }
            return new String[]{sheet.toString(), part.substring(i + 2)};
        }
        int bang = part.indexOf('!');
        if (bang < 0) {
            return new String[]{null, part};
        }
        String sheet = part.substring(0, bang);
        if (sheet.isEmpty() || sheet.indexOf('\'') >= 0 || part.indexOf('!', bang + 1) >= 0) {
            throw new InvalidReferenceException("Malformed sheet prefix", reference);
        }
        return new String[]{sheet, part.substring(bang + 1)};
    }

    private static CellRegion parseRegion(String rawRange, String reference) {
        String range = rawRange.trim().toUpperCase(Locale.ROOT);
        if (range.equals("*")) {
            return CellRegion.wholeSheet();
        }
        String[] ends = range.split(":", -1);
        if (ends.length > 2 || range.isEmpty()) {
            throw new InvalidReferenceException("Malformed range '" + rawRange + "'", reference);
        }
        String first = ends[0];
        String last = ends.length == 2 ? ends[1] : null;

        Matcher firstCell = CELL.matcher(first);
        if (firstCell.matches()) {
            int[] start = cell(firstCell, reference);
            if (last == null) {
                return CellRegion.cell(start[0], start[1]);
            }
            Matcher lastCell = CELL.matcher(last);
            if (!lastCell.matches()) {
                throw new InvalidReferenceException("Malformed block end '" + last + "'", reference);
            }
            int[] end = cell(lastCell, reference);
            return CellRegion.block(start[0], start[1], end[0], end[1]);
        }

        Matcher firstColumn = COLUMN.matcher(first);
        if (firstColumn.matches()) {
            int start = column(firstColumn.group(1), reference);
            int end = start;
            if (last != null) {
                Matcher lastColumn = COLUMN.matcher(last);
                if (!lastColumn.matches()) {
                    throw new InvalidReferenceException("Malformed column span end '" + last + "'", reference);
                }
                end = column(lastColumn.group(1), reference);
            }
            return CellRegion.columns(start, end);
        }

        Matcher firstRow = ROW.matcher(first);
        if (firstRow.matches()) {
            int start = row(firstRow.group(1), reference);
            int end = start;
            if (last != null) {
                Matcher lastRow = ROW.matcher(last);
                if (!lastRow.matches()) {
                    throw new InvalidReferenceException("Malformed row span end '" + last + "'", reference);
                }
                end = row(lastRow.group(1), reference);
            }
            return CellRegion.rows(start, end);
        }
        throw new InvalidReferenceException("Malformed range '" + rawRange + "'", reference);
    }

    private static int[] cell(Matcher matcher, String reference) {
        return new int[]{row(matcher.group(2), reference), column(matcher.group(1), reference)};
    }

    private static int column(String letters, String reference) {
        int index = CellRegion.columnIndex(letters);
        if (index < 0 || index >= CellRegion.MAX_COLUMNS) {
            throw new InvalidReferenceException("Column '" + letters + "' is beyond the sheet limits", reference);
        }
        return index;
    }

    private static int row(String digits, String reference) {
        int number = Integer.parseInt(digits);
        if (number < 1 || number > CellRegion.MAX_ROWS) {
            throw new InvalidReferenceException("Row " + digits + " is beyond the sheet limits", reference);
        }
        return number - 1;
    }
}
