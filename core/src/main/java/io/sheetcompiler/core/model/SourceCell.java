package io.sheetcompiler.core.model;

import java.util.Objects;

/**
 * A cell as supplied by the workbook I/O layer, before classification.
 *
 * @param address where the cell is
 * @param formula formula text starting with {@code =}, or {@code null} for a value cell
 * @param value   the stored value (the cached result for formula cells); any Java object
 */
public record SourceCell(CellAddress address, String formula, Object value) {

    public SourceCell {
        Objects.requireNonNull(address, "address must not be null");
    }

    public boolean isFormula() {
        return formula != null;
    }
}
