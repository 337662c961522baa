package io.sheetcompiler.runtime;

import java.util.Objects;

/**
 * Outcome of evaluating one formula cell. Exactly one of two states:
 *
 * <ul>
 *   <li>{@link Computed}: evaluation finished; the value may itself be {@code null} (blank) or
 *       an {@link ExcelError}.
 *   <li>{@link Failed}: evaluation raised an unexpected runtime failure; the cell degrades to
 *       {@code null} and the diagnostic says why.
 * </ul>
 *
 * <p>Keeping the failure as data lets a run finish with partial results and lets callers tell
 * a substituted {@code null} apart from a computed one.
 */
public sealed interface CellResult {

    /** The value to store: the computed value, or {@code null} for a failure. */
    Object value();

    /** {@code true} when evaluation failed and the value was substituted. */
    boolean isFailure();

    /**
     * Runs a formula inside the per-cell failure boundary.
     *
     * @param formula the translated expression
     * @return {@link Computed} on normal completion, {@link Failed} on any runtime exception
     */
    static CellResult of(CellFormula formula) {
        Objects.requireNonNull(formula, "formula must not be null");
        try {
            return new Computed(formula.compute());
        } catch (RuntimeException e) {
            return new Failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /** A normally computed value. */
    record Computed(Object value) implements CellResult {
        @Override
        public boolean isFailure() {
            return false;
        }
    }

    /** A failed evaluation; always stores {@code null}. */
    record Failed(String diagnostic) implements CellResult {
        public Failed {
            Objects.requireNonNull(diagnostic, "diagnostic must not be null");
        }

        @Override
        public Object value() {
            return null;
        }

        @Override
        public boolean isFailure() {
            return true;
        }
    }
}
