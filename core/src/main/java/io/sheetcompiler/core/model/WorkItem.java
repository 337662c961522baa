package io.sheetcompiler.core.model;

import io.sheetcompiler.core.model.Cell.FormulaCell;
import java.util.List;
import java.util.Objects;

/** Unit of scheduling and emission: a group, or a formula cell that belongs to no group. */
public sealed interface WorkItem {

    /** Top-left covered address; orders ready items deterministically. */
    CellAddress anchor();

    /** The formula cells this item writes, in evaluation order. */
    List<FormulaCell> cells();

    boolean covers(CellAddress address);

    /** Human-readable location, e.g. {@code Sheet1!D2:D6}. */
    String label();

    record Singleton(FormulaCell cell) implements WorkItem {
        public Singleton {
            Objects.requireNonNull(cell, "cell must not be null");
        }

        @Override
        public CellAddress anchor() {
            return cell.address();
        }

        @Override
        public List<FormulaCell> cells() {
            return List.of(cell);
        }

        @Override
        public boolean covers(CellAddress address) {
            return cell.address().equals(address);
        }

        @Override
        public String label() {
            return cell.address().toString();
        }
    }

    record GroupItem(Group group) implements WorkItem {
        public GroupItem {
            Objects.requireNonNull(group, "group must not be null");
        }

        @Override
        public CellAddress anchor() {
            return group.anchor();
        }

        @Override
        public List<FormulaCell> cells() {
            return group.members();
        }

        @Override
        public boolean covers(CellAddress address) {
            return group.range().contains(address);
        }

        @Override
        public String label() {
            return group.range().toString();
        }
    }
}
