package io.sheetcompiler.core.model;

import java.util.Objects;

/**
 * One reference inside a formula, in the order it appears in the text.
 *
 * <p>
 * Coordinates are raw target coordinates with a per-axis {@link AxisMode}; offsets against the
 * owning cell are computed by the pattern normaliser, not stored here. A single-cell reference
 * has {@code last == null}. Structured table references carry the table name and are resolved
 * to absolute coordinates, except {@code [@Column]} which keeps a relative row.
 *
 * @param text            the reference exactly as written, qualifier included
 * @param start           offset of the first character in the formula text
 * @param end             offset one past the last character
 * @param coordinateStart offset where the coordinate part begins (after any {@code Sheet!})
 * @param sheet           target sheet inside the target workbook
 * @param externalFile    external workbook name, or {@code null} for this workbook
 * @param qualified       whether the text names a sheet explicitly
 * @param first           the (top-left) coordinate
 * @param last            the second corner of a range, or {@code null}
 * @param table           table name for structured references, else {@code null}
 */
public record Reference(
        String text,
        int start,
        int end,
        int coordinateStart,
        String sheet,
        String externalFile,
        boolean qualified,
        Coordinate first,
        Coordinate last,
        String table) {

    /** One corner of a reference. */
    public record Coordinate(int column, AxisMode columnMode, int row, AxisMode rowMode) {

        public Coordinate {
            Objects.requireNonNull(columnMode, "columnMode");
            Objects.requireNonNull(rowMode, "rowMode");
        }

        public static Coordinate absolute(int column, int row) {
            return new Coordinate(column, AxisMode.ABSOLUTE, row, AxisMode.ABSOLUTE);
        }

        /** Moves the relative axes by the given amounts; absolute axes stay put. */
        public Coordinate shift(int columns, int rows) {
            return new Coordinate(
                    columnMode == AxisMode.RELATIVE ? column + columns : column,
                    columnMode,
                    rowMode == AxisMode.RELATIVE ? row + rows : row,
                    rowMode);
        }
    }

    public Reference {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(sheet, "sheet must not be null");
        Objects.requireNonNull(first, "first must not be null");
    }

    public boolean isRange() {
        return last != null;
    }

    public boolean isExternal() {
        return externalFile != null;
    }

    public boolean isTable() {
        return table != null;
    }

    /** {@code true} if this reference reads a sheet other than {@code ownerSheet} of this workbook. */
    public boolean isCrossSheet(String ownerSheet) {
        return !isExternal() && !sheet.equals(ownerSheet);
    }

    /** The sheet key used in the generated cell store: composite for external references. */
    public String storeSheet() {
        return isExternal() ? externalFile + "|" + sheet : sheet;
    }

    /** The bottom-right corner; equals {@link #first()} for a single cell. */
    public Coordinate lastOrFirst() {
        return last != null ? last : first;
    }

    /** The rectangle this reference reads, keyed by {@link #storeSheet()}. */
    public CellRange target() {
        Coordinate end = lastOrFirst();
        return new CellRange(storeSheet(), first.column(), first.row(), end.column(), end.row());
    }

    /** The reference as it reads from a cell {@code columns}/{@code rows} away from its owner. */
    public Reference shift(int columns, int rows) {
        if (columns == 0 && rows == 0) {
            return this;
        }
        return new Reference(
                text,
                start,
                end,
                coordinateStart,
                sheet,
                externalFile,
                qualified,
                first.shift(columns, rows),
                last == null ? null : last.shift(columns, rows),
                table);
    }
}
