package io.sheetcompiler.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rectangular block of cell values read from a range reference, stored row-major. Values
 * are whatever the store holds: {@code null} for blank cells, {@link ExcelError} for error
 * results, otherwise a number, string or boolean.
 */
public final class Area {

    private final int rows;
    private final int columns;
    private final List<Object> values;

    /**
     * Creates an area.
     *
     * @param rows    number of rows, at least 1
     * @param columns number of columns, at least 1
     * @param values  row-major values; size must equal {@code rows * columns}
     */
    public Area(int rows, int columns, List<Object> values) {
        if (rows < 1 || columns < 1) {
            throw new IllegalArgumentException("area must be at least 1x1, got " + rows + "x" + columns);
        }
        if (values.size() != rows * columns) {
            throw new IllegalArgumentException(
                    "area " + rows + "x" + columns + " needs " + rows * columns + " values, got " + values.size());
        }
        this.rows = rows;
        this.columns = columns;
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns;
    }

    /**
     * Returns the value at a 1-based position.
     *
     * @throws IndexOutOfBoundsException if the position lies outside the area
     */
    public Object get(int row, int column) {
        if (row < 1 || row > rows || column < 1 || column > columns) {
            throw new IndexOutOfBoundsException(
                    "(" + row + ", " + column + ") outside area " + rows + "x" + columns);
        }
        return values.get((row - 1) * columns + (column - 1));
    }

    /** All values in row-major order. */
    public List<Object> values() {
        return values;
    }

    /** Extracts one 1-based row as a single-row area. */
    public Area row(int row) {
        List<Object> out = new ArrayList<>(columns);
        for (int c = 1; c <= columns; c++) {
            out.add(get(row, c));
        }
        return new Area(1, columns, out);
    }

    /** Extracts one 1-based column as a single-column area. */
    public Area column(int column) {
        List<Object> out = new ArrayList<>(rows);
        for (int r = 1; r <= rows; r++) {
            out.add(get(r, column));
        }
        return new Area(rows, 1, out);
    }

    /** {@code true} for a single row or a single column. */
    public boolean isVector() {
        return rows == 1 || columns == 1;
    }

    @Override
    public String toString() {
        return "Area[" + rows + "x" + columns + "]";
    }
}
