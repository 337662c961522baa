package io.sheetcompiler.core.error;

import io.sheetcompiler.core.model.CellAddress;

/**
 * Thrown when a formula cannot be parsed: malformed syntax, an unsupported reference (defined
 * name, whole-row or whole-column range, unknown sheet or table), or a wrong argument count.
 */
public final class FormulaParseException extends ConversionException {

    private static final long serialVersionUID = 1L;

    private final int offset;
    private final boolean unsupportedReference;

    public FormulaParseException(String message, CellAddress cell, String formula, int offset) {
        this(message, cell, formula, offset, false);
    }

    public FormulaParseException(
            String message, CellAddress cell, String formula, int offset, boolean unsupportedReference) {
        super(describe(message, cell, formula, offset), cell, formula, Stage.PARSE);
        this.offset = offset;
        this.unsupportedReference = unsupportedReference;
    }

    /** Character offset into the formula text, or -1 if unknown. */
    public int offset() {
        return offset;
    }

    /** {@code true} when the failure is a reference the compiler cannot resolve. */
    public boolean isUnsupportedReference() {
        return unsupportedReference;
    }

    private static String describe(String message, CellAddress cell, String formula, int offset) {
        String where = offset >= 0 ? " at offset " + offset : "";
        return String.format("%s: %s in '%s'%s", cell, message, formula, where);
    }
}
