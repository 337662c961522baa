package io.sheetcompiler.core.model;

import java.util.Objects;

/** Rectangular block of cells on one sheet. Corners are normalised to top-left/bottom-right. */
public record CellRange(String sheet, int firstColumn, int firstRow, int lastColumn, int lastRow) {

    public CellRange {
        Objects.requireNonNull(sheet, "sheet must not be null");
        int left = Math.min(firstColumn, lastColumn);
        int right = Math.max(firstColumn, lastColumn);
        int top = Math.min(firstRow, lastRow);
        int bottom = Math.max(firstRow, lastRow);
        firstColumn = left;
        lastColumn = right;
        firstRow = top;
        lastRow = bottom;
        if (firstColumn < 1 || firstRow < 1 || lastColumn > CellAddress.MAX_COLUMN || lastRow > CellAddress.MAX_ROW) {
            throw new IllegalArgumentException("range outside the sheet: " + sheet + "!" + firstColumn + ","
                    + firstRow + ":" + lastColumn + "," + lastRow);
        }
    }

    /** Parses {@code A1:B2} (or a single coordinate) on the given sheet. */
    public static CellRange parse(String sheet, String text) {
        int colon = text.indexOf(':');
        CellAddress first = CellAddress.parse(sheet, colon < 0 ? text : text.substring(0, colon));
        CellAddress last = colon < 0 ? first : CellAddress.parse(sheet, text.substring(colon + 1));
        return new CellRange(sheet, first.column(), first.row(), last.column(), last.row());
    }

    public static CellRange of(CellAddress cell) {
        return new CellRange(cell.sheet(), cell.column(), cell.row(), cell.column(), cell.row());
    }

    public boolean contains(CellAddress cell) {
        return sheet.equals(cell.sheet())
                && cell.column() >= firstColumn
                && cell.column() <= lastColumn
                && cell.row() >= firstRow
                && cell.row() <= lastRow;
    }

    public int width() {
        return lastColumn - firstColumn + 1;
    }

    public int height() {
        return lastRow - firstRow + 1;
    }

    public CellAddress first() {
        return new CellAddress(sheet, firstColumn, firstRow);
    }

    @Override
    public String toString() {
        String start = CellAddress.columnName(firstColumn) + firstRow;
        if (firstColumn == lastColumn && firstRow == lastRow) {
            return sheet + "!" + start;
        }
        return sheet + "!" + start + ":" + CellAddress.columnName(lastColumn) + lastRow;
    }
}
