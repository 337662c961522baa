package io.sheetcompiler.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * A named table (list object) used to resolve structured references such as
 * {@code Sales[Amount]}.
 *
 * @param name       table name, matched case-insensitively
 * @param sheet      sheet holding the table
 * @param range      the whole table, header and totals rows included
 * @param columns    column names, left to right; one per column of {@code range}
 * @param headerRows 0 or 1
 * @param totalsRows 0 or 1
 */
public record TableDefinition(
        String name, String sheet, CellRange range, List<String> columns, int headerRows, int totalsRows) {

    public TableDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(sheet, "sheet must not be null");
        Objects.requireNonNull(range, "range must not be null");
        if (!range.sheet().equals(sheet)) {
            throw new IllegalArgumentException("table '" + name + "' range is not on sheet '" + sheet + "'");
        }
        columns = List.copyOf(columns);
        if (columns.size() != range.width()) {
            throw new IllegalArgumentException(String.format(
                    "table '%s' has %d column names for a range %d columns wide", name, columns.size(), range.width()));
        }
        if (headerRows < 0 || headerRows > 1 || totalsRows < 0 || totalsRows > 1) {
            throw new IllegalArgumentException("table '" + name + "' header and totals rows must be 0 or 1");
        }
        if (range.height() <= headerRows + totalsRows) {
            throw new IllegalArgumentException("table '" + name + "' has no data rows");
        }
    }

    /** 0-based position of a column, matched case-insensitively. */
    public OptionalInt columnIndex(String column) {
        String wanted = column.trim().toLowerCase(Locale.ROOT);
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).trim().toLowerCase(Locale.ROOT).equals(wanted)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    public int firstDataRow() {
        return range.firstRow() + headerRows;
    }

    public int lastDataRow() {
        return range.lastRow() - totalsRows;
    }
}
