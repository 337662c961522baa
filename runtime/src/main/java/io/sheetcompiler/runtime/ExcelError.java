package io.sheetcompiler.runtime;

import java.util.Optional;

/**
 * Spreadsheet error values. An {@code ExcelError} is an ordinary cell value that flows through
 * operators and functions; it is never {@code null} and never thrown.
 *
 * <p>{@code null} in a {@link CellStore} means "blank/missing"; an {@code ExcelError} means the
 * formula produced an error result, exactly as the spreadsheet would display it.
 */
public enum ExcelError {
    NULL("#NULL!"),
    DIV_ZERO("#DIV/0!"),
    VALUE("#VALUE!"),
    REF("#REF!"),
    NAME("#NAME?"),
    NUM("#NUM!"),
    NA("#N/A");

    private final String code;

    ExcelError(String code) {
        this.code = code;
    }

    /** The code as it appears in a formula or a cell, e.g. {@code #DIV/0!}. */
    public String code() {
        return code;
    }

    /**
     * Looks up an error by its display code (case-insensitive).
     *
     * @param code the display code, e.g. {@code "#N/A"}
     * @return the matching error, or empty if the code is not a spreadsheet error
     */
    public static Optional<ExcelError> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (ExcelError error : values()) {
            if (error.code.equalsIgnoreCase(code)) {
                return Optional.of(error);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return code;
    }
}
