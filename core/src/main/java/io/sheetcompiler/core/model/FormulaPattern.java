package io.sheetcompiler.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Position-independent shape of a formula. Two formulas share a pattern iff their skeletons
 * and signatures are equal, which is exactly when one is a drag-copy of the other.
 *
 * @param skeleton  formula text with each reference coordinate replaced by {@code @0}, {@code @1}, ...
 * @param signature per reference, per axis: a relative delta or an absolute coordinate
 */
public record FormulaPattern(String skeleton, List<AxisOffset> signature) {

    public FormulaPattern {
        Objects.requireNonNull(skeleton, "skeleton must not be null");
        signature = List.copyOf(signature);
    }

    @Override
    public String toString() {
        return skeleton + " " + signature;
    }
}
