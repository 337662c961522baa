package io.sheetcompiler.core.model;

import java.util.List;
import java.util.Objects;

/** A classified workbook cell. Created once per conversion and never mutated. */
public sealed interface Cell {

    CellAddress address();

    /** A cell holding a literal; seeds the generated store. */
    record HardcodedCell(CellAddress address, LiteralValue value) implements Cell {
        public HardcodedCell {
            Objects.requireNonNull(address, "address must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /**
     * A cell computed from a formula.
     *
     * @param formula    the formula text, including the leading {@code =}
     * @param references the references in text order; slot {@code i} of {@code expression} is entry {@code i}
     * @param expression the parsed expression tree
     */
    record FormulaCell(CellAddress address, String formula, List<Reference> references, FormulaNode expression)
            implements Cell {
        public FormulaCell {
            Objects.requireNonNull(address, "address must not be null");
            Objects.requireNonNull(formula, "formula must not be null");
            Objects.requireNonNull(expression, "expression must not be null");
            references = List.copyOf(references);
        }
    }
}
