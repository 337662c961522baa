package io.sheetcompiler.core.pattern;

import io.sheetcompiler.core.model.AxisMode;
import io.sheetcompiler.core.model.AxisOffset;
import io.sheetcompiler.core.model.Cell.FormulaCell;
import io.sheetcompiler.core.model.CellAddress;
import io.sheetcompiler.core.model.FormulaPattern;
import io.sheetcompiler.core.model.Reference;
import io.sheetcompiler.core.model.Reference.Coordinate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes the position-independent {@link FormulaPattern} of a formula.
 *
 * <p>
 * The skeleton replaces the coordinate part of each reference with {@code @i} and keeps every
 * other character, sheet and file qualifiers included. The signature lists, per reference and
 * per axis, the absolute coordinate or the distance from the owning cell. {@code B2*C2} in D2
 * and {@code B3*C3} in D3 therefore share a pattern, while {@code $B$2*C2} in D2 does not.
 */
public final class PatternNormaliser {

    private PatternNormaliser() {
        // utility class
    }

    /** Grouping key: formulas only group with formulas on the same sheet. */
    public record BucketKey(String sheet, FormulaPattern pattern) {
        public BucketKey {
            Objects.requireNonNull(sheet, "sheet");
            Objects.requireNonNull(pattern, "pattern");
        }
    }

    public static FormulaPattern normalise(FormulaCell cell) {
        return new FormulaPattern(
                skeleton(cell.formula(), cell.references()), signature(cell.address(), cell.references()));
    }

    /** The formula text with each reference coordinate replaced by its ordinal placeholder. */
    public static String skeleton(String formula, List<Reference> references) {
        StringBuilder out = new StringBuilder(formula.length());
        int cursor = 0;
        for (int i = 0; i < references.size(); i++) {
            Reference reference = references.get(i);
            out.append(formula, cursor, reference.coordinateStart()).append('@').append(i);
            cursor = reference.end();
        }
        return out.append(formula.substring(cursor)).toString();
    }

    /**
     * Per reference: column and row of the first corner, then of the second corner for ranges.
     */
    public static List<AxisOffset> signature(CellAddress owner, List<Reference> references) {
        List<AxisOffset> signature = new ArrayList<>(references.size() * 2);
        for (Reference reference : references) {
            addCorner(signature, owner, reference.first());
            if (reference.isRange()) {
                addCorner(signature, owner, reference.last());
            }
        }
        return signature;
    }

    /** Buckets formulas by (sheet, pattern), preserving the order of first appearance. */
    public static Map<BucketKey, List<FormulaCell>> bucket(Collection<FormulaCell> cells) {
        Map<BucketKey, List<FormulaCell>> buckets = new LinkedHashMap<>();
        for (FormulaCell cell : cells) {
            BucketKey key = new BucketKey(cell.address().sheet(), normalise(cell));
            buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(cell);
        }
        return buckets;
    }

    private static void addCorner(List<AxisOffset> signature, CellAddress owner, Coordinate corner) {
        signature.add(axis(corner.columnMode(), corner.column(), owner.column()));
        signature.add(axis(corner.rowMode(), corner.row(), owner.row()));
    }

    private static AxisOffset axis(AxisMode mode, int coordinate, int ownerCoordinate) {
        return mode == AxisMode.ABSOLUTE
                ? new AxisOffset.Absolute(coordinate)
                : new AxisOffset.Relative(coordinate - ownerCoordinate);
    }
}
