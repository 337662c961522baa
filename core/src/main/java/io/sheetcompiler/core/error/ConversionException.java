package io.sheetcompiler.core.error;

import io.sheetcompiler.core.model.CellAddress;

/**
 * Abstract base for all conversion failures. Never thrown directly; use the concrete
 * subclasses. Every conversion-time error names the offending cell and formula where one
 * exists.
 */
public abstract class ConversionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Pipeline stage in which the error occurred. */
    public enum Stage {
        PARSE,
        SCHEDULE,
        TRANSLATE
    }

    private final transient CellAddress cell;
    private final String formula;
    private final Stage stage;

    protected ConversionException(String message, CellAddress cell, String formula, Stage stage) {
        super(message);
        this.cell = cell;
        this.formula = formula;
        this.stage = stage;
    }

    protected ConversionException(String message, Throwable cause, CellAddress cell, String formula, Stage stage) {
        super(message, cause);
        this.cell = cell;
        this.formula = formula;
        this.stage = stage;
    }

    /** The cell that triggered the error, or {@code null} if it concerns no single cell. */
    public CellAddress cell() {
        return cell;
    }

    /** The formula text of {@link #cell()}, or {@code null}. */
    public String formula() {
        return formula;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    public Stage stage() {
        return stage;
    }
}
