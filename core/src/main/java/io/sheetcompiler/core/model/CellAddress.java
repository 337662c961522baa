package io.sheetcompiler.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of one cell: sheet, 1-based column and 1-based row. Ordered by sheet, then row,
 * then column, which is the order every deterministic iteration in the compiler uses.
 *
 * @param sheet  sheet name (or composite {@code "<file>|<sheet>"} for external cells)
 * @param column 1-based column, {@code 1..16384}
 * @param row    1-based row, {@code 1..1048576}
 */
public record CellAddress(String sheet, int column, int row) implements Comparable<CellAddress> {

    public static final int MAX_COLUMN = 16_384;
    public static final int MAX_ROW = 1_048_576;

    private static final Comparator<CellAddress> ORDER = Comparator.comparing(CellAddress::sheet)
            .thenComparingInt(CellAddress::row)
            .thenComparingInt(CellAddress::column);

    public CellAddress {
        Objects.requireNonNull(sheet, "sheet must not be null");
        if (column < 1 || column > MAX_COLUMN) {
            throw new IllegalArgumentException("column out of range: " + column);
        }
        if (row < 1 || row > MAX_ROW) {
            throw new IllegalArgumentException("row out of range: " + row);
        }
    }

    /**
     * Parses an A1-style coordinate such as {@code B2} or {@code $B$2}.
     *
     * @throws IllegalArgumentException if {@code a1} is not a valid coordinate
     */
    public static CellAddress parse(String sheet, String a1) {
        String text = a1.replace("$", "").trim();
        int split = 0;
        while (split < text.length() && Character.isLetter(text.charAt(split))) {
            split++;
        }
        if (split == 0 || split == text.length()) {
            throw new IllegalArgumentException("not a cell coordinate: '" + a1 + "'");
        }
        int row;
        try {
            row = Integer.parseInt(text.substring(split));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a cell coordinate: '" + a1 + "'", e);
        }
        return new CellAddress(sheet, columnIndex(text.substring(0, split)), row);
    }

    /** Column letters to a 1-based index ({@code A} = 1, {@code XFD} = 16384). */
    public static int columnIndex(String letters) {
        if (letters.isEmpty() || letters.length() > 3) {
            throw new IllegalArgumentException("not a column name: '" + letters + "'");
        }
        int index = 0;
        for (int i = 0; i < letters.length(); i++) {
            char ch = Character.toUpperCase(letters.charAt(i));
            if (ch < 'A' || ch > 'Z') {
                throw new IllegalArgumentException("not a column name: '" + letters + "'");
            }
            index = index * 26 + (ch - 'A' + 1);
        }
        if (index > MAX_COLUMN) {
            throw new IllegalArgumentException("column beyond XFD: '" + letters + "'");
        }
        return index;
    }

    /** 1-based column index to letters. */
    public static String columnName(int column) {
        StringBuilder name = new StringBuilder();
        int n = column;
        while (n > 0) {
            int rem = (n - 1) % 26;
            name.insert(0, (char) ('A' + rem));
            n = (n - 1) / 26;
        }
        return name.toString();
    }

    /** The coordinate without sheet, e.g. {@code D2}. */
    public String a1() {
        return columnName(column) + row;
    }

    public CellAddress offset(int columns, int rows) {
        return new CellAddress(sheet, column + columns, row + rows);
    }

    @Override
    public int compareTo(CellAddress other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return sheet + "!" + a1();
    }
}
