package io.sheetcompiler.runtime;

/**
 * The translated expression of one formula cell, as emitted into a generated program.
 * Evaluated exactly once by {@link CellStore#evaluate(String, int, int, CellFormula)}.
 */
@FunctionalInterface
public interface CellFormula {

    /**
     * Computes the cell value.
     *
     * @return a number, string, boolean, {@link ExcelError}, or {@code null} for blank
     */
    Object compute();
}
