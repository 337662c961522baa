package io.sheetcompiler.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The workbook as handed over by the I/O layer: sheet names in workbook order, every
 * non-empty cell, and the table definitions. Immutable; build one with {@link #builder()}.
 */
public final class WorkbookModel {

    private final List<String> sheets;
    private final Map<String, String> sheetsByLowerName;
    private final Map<CellAddress, SourceCell> cells;
    private final Map<String, TableDefinition> tablesByLowerName;

    private WorkbookModel(Builder builder) {
        this.sheets = List.copyOf(builder.sheets);
        Map<String, String> byLower = new LinkedHashMap<>();
        for (String sheet : sheets) {
            byLower.put(sheet.toLowerCase(Locale.ROOT), sheet);
        }
        this.sheetsByLowerName = Collections.unmodifiableMap(byLower);
        this.cells = Collections.unmodifiableMap(new TreeMap<>(builder.cells));
        this.tablesByLowerName = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tables));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Sheet names in workbook order. */
    public List<String> sheets() {
        return sheets;
    }

    /** Resolves a sheet name case-insensitively to its canonical spelling. */
    public Optional<String> resolveSheet(String name) {
        return Optional.ofNullable(sheetsByLowerName.get(name.toLowerCase(Locale.ROOT)));
    }

    /** All cells, ordered by {@link CellAddress}. */
    public Collection<SourceCell> cells() {
        return cells.values();
    }

    public Optional<SourceCell> cell(CellAddress address) {
        return Optional.ofNullable(cells.get(address));
    }

    public Collection<TableDefinition> tables() {
        return tablesByLowerName.values();
    }

    /** Looks a table up by name, case-insensitively. */
    public Optional<TableDefinition> table(String name) {
        return Optional.ofNullable(tablesByLowerName.get(name.toLowerCase(Locale.ROOT)));
    }

    /** Builder for {@link WorkbookModel}. Sheets are added on first mention. */
    public static final class Builder {

        private final List<String> sheets = new ArrayList<>();
        private final Map<CellAddress, SourceCell> cells = new LinkedHashMap<>();
        private final Map<String, TableDefinition> tables = new LinkedHashMap<>();

        private Builder() {}

        public Builder sheet(String name) {
            Objects.requireNonNull(name, "sheet name must not be null");
            if (name.isBlank() || name.contains("|")) {
                throw new IllegalArgumentException("invalid sheet name: '" + name + "'");
            }
            boolean known = sheets.stream().anyMatch(s -> s.equalsIgnoreCase(name));
            if (!known) {
                sheets.add(name);
            }
            return this;
        }

        /** Adds a value cell, e.g. {@code value("Sheet1", "B2", 10)}. */
        public Builder value(String sheet, String a1, Object value) {
            return cell(new SourceCell(CellAddress.parse(canonical(sheet), a1), null, value));
        }

        /** Adds a formula cell; a missing leading {@code =} is added. */
        public Builder formula(String sheet, String a1, String formula) {
            return formula(sheet, a1, formula, null);
        }

        /** Adds a formula cell together with its cached value. */
        public Builder formula(String sheet, String a1, String formula, Object cachedValue) {
            Objects.requireNonNull(formula, "formula must not be null");
            String text = formula.startsWith("=") ? formula : "=" + formula;
            return cell(new SourceCell(CellAddress.parse(canonical(sheet), a1), text, cachedValue));
        }

        public Builder cell(SourceCell cell) {
            sheet(cell.address().sheet());
            if (cells.putIfAbsent(cell.address(), cell) != null) {
                throw new IllegalArgumentException("cell defined twice: " + cell.address());
            }
            return this;
        }

        public Builder table(TableDefinition table) {
            sheet(table.sheet());
            if (tables.putIfAbsent(table.name().toLowerCase(Locale.ROOT), table) != null) {
                throw new IllegalArgumentException("table defined twice: " + table.name());
            }
            return this;
        }

        public WorkbookModel build() {
            return new WorkbookModel(this);
        }

        private String canonical(String sheet) {
            sheet(sheet);
            return sheets.stream().filter(s -> s.equalsIgnoreCase(sheet)).findFirst().orElse(sheet);
        }
    }
}
