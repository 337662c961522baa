package io.sheetcompiler.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sparse cell store threaded through a generated program: every value a run reads or writes
 * lives here, keyed by (sheet, column, row). A store belongs to one run and is not
 * thread-safe.
 *
 * <p>Absent keys read as blank ({@code null}). Formula cells are written through
 * {@link #evaluate}, which applies the per-cell failure boundary and remembers failures so
 * they can be told apart from formulas that legitimately produced a blank.
 */
public final class CellStore {

    private static final Logger LOG = LoggerFactory.getLogger(CellStore.class);

    private final Map<CellKey, Object> values = new HashMap<>();
    private final Map<CellKey, String> failures = new LinkedHashMap<>();
    private final InputValues inputs;

    public CellStore() {
        this(InputValues.NONE);
    }

    /** @param inputs source of input values that override the program's baked-in defaults */
    public CellStore(InputValues inputs) {
        this.inputs = Objects.requireNonNull(inputs, "inputs must not be null");
    }

    /** Reads one cell; coordinates outside the sheet read as {@link ExcelError#REF}. */
    public Object get(String sheet, int column, int row) {
        if (column < 1 || row < 1) {
            return ExcelError.REF;
        }
        return values.get(new CellKey(sheet, column, row));
    }

    /**
     * Reads a rectangular range. Corners may be given in any order.
     *
     * @return the values row by row, or {@link ExcelError#REF} if the range leaves the sheet
     */
    public Object range(String sheet, int column1, int row1, int column2, int row2) {
        int left = Math.min(column1, column2);
        int right = Math.max(column1, column2);
        int top = Math.min(row1, row2);
        int bottom = Math.max(row1, row2);
        if (left < 1 || top < 1) {
            return ExcelError.REF;
        }
        List<Object> block = new ArrayList<>((bottom - top + 1) * (right - left + 1));
        for (int r = top; r <= bottom; r++) {
            for (int c = left; c <= right; c++) {
                block.add(values.get(new CellKey(sheet, c, r)));
            }
        }
        return new Area(bottom - top + 1, right - left + 1, block);
    }

    /** Writes a value; {@code null} clears the cell. */
    public void put(String sheet, int column, int row, Object value) {
        CellKey key = new CellKey(sheet, column, row);
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
    }

    /** Writes a hardcoded cell: the input value if the input source has one, else the default. */
    public void seed(String sheet, int column, int row, Object defaultValue) {
        Object input = inputs.valueAt(sheet, column, row);
        put(sheet, column, row, input != null ? input : defaultValue);
    }

    /**
     * Evaluates a formula cell inside the failure boundary and stores the outcome. An area result
     * is reduced to a scalar. A failure stores {@code null} and is recorded in {@link #failures()}.
     */
    public CellResult evaluate(String sheet, int column, int row, CellFormula formula) {
        CellResult result = CellResult.of(formula);
        CellKey key = new CellKey(sheet, column, row);
        if (result instanceof CellResult.Failed failed) {
            LOG.debug("Cell {}!{}:{} failed: {}", sheet, column, row, failed.diagnostic());
            failures.put(key, failed.diagnostic());
            values.remove(key);
        } else {
            failures.remove(key);
            put(sheet, column, row, Values.scalar(result.value()));
        }
        return result;
    }

    /**
     * Loads one external sheet into this store under the composite sheet identifier
     * {@code "<file>|<sheet>"}.
     */
    public void loadExternal(ExternalWorkbooks externals, String file, String sheet) {
        String composite = CellKey.externalSheet(file, sheet);
        for (Map.Entry<CellKey, Object> cell : externals.loadSheet(file, sheet).entrySet()) {
            CellKey source = cell.getKey();
            put(composite, source.column(), source.row(), cell.getValue());
        }
    }

    /** Cells whose evaluation failed, with their diagnostics, in evaluation order. */
    public Map<CellKey, String> failures() {
        return Collections.unmodifiableMap(failures);
    }

    /** {@code true} if the cell's last evaluation failed. */
    public boolean isFailure(String sheet, int column, int row) {
        return failures.containsKey(new CellKey(sheet, column, row));
    }

    /** A copy of every non-blank value. */
    public Map<CellKey, Object> snapshot() {
        return Map.copyOf(values);
    }

    public int size() {
        return values.size();
    }
}
