package io.sheetcompiler.runtime;

import java.util.Objects;

/**
 * Key of one cell in a {@link CellStore}. External workbook cells use the composite sheet
 * identifier {@code "<file>|<sheet>"} (see {@link #externalSheet(String, String)}).
 *
 * @param sheet  sheet identifier, never null
 * @param column 1-based column index
 * @param row    1-based row index
 */
public record CellKey(String sheet, int column, int row) {

    /** Separator between file name and sheet name in composite sheet identifiers. */
    public static final String EXTERNAL_SEPARATOR = "|";

    public CellKey {
        Objects.requireNonNull(sheet, "sheet must not be null");
        if (column < 1 || row < 1) {
            throw new IllegalArgumentException("column and row must be >= 1, got column=" + column + ", row=" + row);
        }
    }

    /**
     * Builds the composite sheet identifier used to store cells of an external workbook.
     *
     * @param file  the external file name as written in the formula, e.g. {@code Ext.xlsx}
     * @param sheet the sheet inside that file
     * @return {@code file + "|" + sheet}
     */
    public static String externalSheet(String file, String sheet) {
        return file + EXTERNAL_SEPARATOR + sheet;
    }
}
