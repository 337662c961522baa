package io.sheetcompiler.runtime;

/**
 * Source of user-supplied input values for the hardcoded cells of a generated program,
 * typically backed by an input workbook shaped like the original one.
 */
@FunctionalInterface
public interface InputValues {

    /** An input source that supplies nothing, so every seed keeps its baked-in default. */
    InputValues NONE = (sheet, column, row) -> null;

    /**
     * Returns the input value of a cell.
     *
     * @return the value, or {@code null} if the input does not provide this cell
     */
    Object valueAt(String sheet, int column, int row);
}
