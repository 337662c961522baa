package io.sheetcompiler.core.model;

import io.sheetcompiler.core.model.Cell.FormulaCell;
import java.util.List;
import java.util.Objects;

/**
 * A maximal contiguous run of at least two formula cells with the same pattern, emitted as one
 * loop. Members are in iteration order: top to bottom, or left to right.
 *
 * @param direction layout axis
 * @param pattern   the shared pattern
 * @param members   the cells, starting with the anchor
 */
public record Group(GroupDirection direction, FormulaPattern pattern, List<FormulaCell> members) {

    public Group {
        Objects.requireNonNull(direction, "direction must not be null");
        Objects.requireNonNull(pattern, "pattern must not be null");
        members = List.copyOf(members);
        if (members.size() < 2) {
            throw new IllegalArgumentException("a group needs at least two members, got " + members.size());
        }
        CellAddress anchor = members.get(0).address();
        for (int i = 1; i < members.size(); i++) {
            CellAddress expected = direction == GroupDirection.VERTICAL ? anchor.offset(0, i) : anchor.offset(i, 0);
            if (!members.get(i).address().equals(expected)) {
                throw new IllegalArgumentException(
                        "group members are not contiguous: expected " + expected + ", got " + members.get(i).address());
            }
        }
    }

    /** The first member; its formula stands in for every member when translating. */
    public FormulaCell representative() {
        return members.get(0);
    }

    public CellAddress anchor() {
        return members.get(0).address();
    }

    public CellAddress last() {
        return members.get(members.size() - 1).address();
    }

    public int extent() {
        return members.size();
    }

    public CellRange range() {
        CellAddress a = anchor();
        CellAddress b = last();
        return new CellRange(a.sheet(), a.column(), a.row(), b.column(), b.row());
    }

    /**
     * The references of the {@code index}-th member, derived from the representative's
     * references shifted by the member's distance from the anchor.
     */
    public List<Reference> referencesOf(int index) {
        int columns = direction == GroupDirection.HORIZONTAL ? index : 0;
        int rows = direction == GroupDirection.VERTICAL ? index : 0;
        return representative().references().stream().map(r -> r.shift(columns, rows)).toList();
    }

    /** Position of an address in iteration order, or -1 if it is not a member. */
    public int indexOf(CellAddress address) {
        if (!range().contains(address)) {
            return -1;
        }
        return direction == GroupDirection.VERTICAL
                ? address.row() - anchor().row()
                : address.column() - anchor().column();
    }
}
