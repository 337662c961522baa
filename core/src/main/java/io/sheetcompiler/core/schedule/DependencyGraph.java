package io.sheetcompiler.core.schedule;

import io.sheetcompiler.core.model.Cell.FormulaCell;
import io.sheetcompiler.core.model.CellAddress;
import io.sheetcompiler.core.model.CellRange;
import io.sheetcompiler.core.model.Group;
import io.sheetcompiler.core.model.GroupDirection;
import io.sheetcompiler.core.model.Reference;
import io.sheetcompiler.core.model.WorkItem;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Producer/consumer edges between work items. Item {@code c} depends on item {@code p} when
 * some cell read by {@code c} is written by {@code p}.
 *
 * <p>
 * Items are numbered by anchor address, so a lower number is always the deterministic
 * tie-break. Producers are indexed per sheet by row and column, so a range read costs one
 * sub-map walk rather than a scan of every item. A singleton that reads its own cell depends
 * on itself; a group never gets an edge to itself.
 */
public final class DependencyGraph {

    private final List<WorkItem> items;
    private final List<SortedSet<Integer>> producers;
    private final List<SortedSet<Integer>> consumers;

    private DependencyGraph(List<WorkItem> items) {
        this.items = items;
        this.producers = new ArrayList<>(items.size());
        this.consumers = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            producers.add(new TreeSet<>());
            consumers.add(new TreeSet<>());
        }
    }

    public static DependencyGraph build(List<WorkItem> workItems) {
        List<WorkItem> sorted = new ArrayList<>(workItems);
        sorted.sort(Comparator.comparing(WorkItem::anchor));
        DependencyGraph graph = new DependencyGraph(Collections.unmodifiableList(sorted));

        Map<String, NavigableMap<Integer, NavigableMap<Integer, Integer>>> index = new HashMap<>();
        for (int i = 0; i < sorted.size(); i++) {
            for (FormulaCell cell : sorted.get(i).cells()) {
                CellAddress a = cell.address();
                index.computeIfAbsent(a.sheet(), s -> new TreeMap<>())
                        .computeIfAbsent(a.row(), r -> new TreeMap<>())
                        .put(a.column(), i);
            }
        }

        for (int consumer = 0; consumer < sorted.size(); consumer++) {
            WorkItem item = sorted.get(consumer);
            for (CellRange read : reads(item)) {
                NavigableMap<Integer, NavigableMap<Integer, Integer>> rows = index.get(read.sheet());
                if (rows == null) {
                    continue;
                }
                for (NavigableMap<Integer, Integer> columns :
                        rows.subMap(read.firstRow(), true, read.lastRow(), true).values()) {
                    for (int producer : columns.subMap(read.firstColumn(), true, read.lastColumn(), true).values()) {
                        if (producer == consumer && item instanceof WorkItem.GroupItem) {
                            continue;
                        }
                        graph.producers.get(consumer).add(producer);
                        graph.consumers.get(producer).add(consumer);
                    }
                }
            }
        }
        return graph;
    }

    /**
     * Every rectangle an item reads. For a group this is, per reference, the bounding box of the
     * first and last member's targets: consecutive members' targets overlap or touch, so the
     * box is exactly their union.
     */
    static List<CellRange> reads(WorkItem item) {
        List<CellRange> reads = new ArrayList<>();
        if (item instanceof WorkItem.Singleton singleton) {
            for (Reference reference : singleton.cell().references()) {
                if (!reference.isExternal()) {
                    reads.add(reference.target());
                }
            }
            return reads;
        }
        Group group = ((WorkItem.GroupItem) item).group();
        int span = group.extent() - 1;
        int columns = group.direction() == GroupDirection.HORIZONTAL ? span : 0;
        int rows = group.direction() == GroupDirection.VERTICAL ? span : 0;
        for (Reference reference : group.representative().references()) {
            if (reference.isExternal()) {
                continue;
            }
            CellRange first = reference.target();
            CellRange last = reference.shift(columns, rows).target();
            reads.add(new CellRange(
                    first.sheet(),
                    Math.min(first.firstColumn(), last.firstColumn()),
                    Math.min(first.firstRow(), last.firstRow()),
                    Math.max(first.lastColumn(), last.lastColumn()),
                    Math.max(first.lastRow(), last.lastRow())));
        }
        return reads;
    }

    /** Items in anchor order; indices into this list identify items in the other accessors. */
    public List<WorkItem> items() {
        return items;
    }

    public int size() {
        return items.size();
    }

    public SortedSet<Integer> producersOf(int item) {
        return Collections.unmodifiableSortedSet(producers.get(item));
    }

    public SortedSet<Integer> consumersOf(int item) {
        return Collections.unmodifiableSortedSet(consumers.get(item));
    }
}
