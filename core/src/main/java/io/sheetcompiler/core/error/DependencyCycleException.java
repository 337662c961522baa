package io.sheetcompiler.core.error;

import io.sheetcompiler.core.model.CellAddress;
import java.util.List;

/**
 * Thrown when the dependency graph has a cycle. Carries the cells of one concrete cycle, in
 * dependency order, so the report can point at them.
 */
public final class DependencyCycleException extends ConversionException {

    private static final long serialVersionUID = 1L;

    private final transient List<CellAddress> cycle;
    private final List<String> items;

    /**
     * @param cycle cells on the cycle, each reading the next, the last reading the first
     * @param items labels of the work items on the cycle, in the same order
     */
    public DependencyCycleException(List<CellAddress> cycle, List<String> items) {
        super("Circular reference: " + String.join(" -> ", items) + " -> " + items.get(0),
                cycle.get(0), null, Stage.SCHEDULE);
        this.cycle = List.copyOf(cycle);
        this.items = List.copyOf(items);
    }

    public List<CellAddress> cycle() {
        return cycle;
    }

    public List<String> items() {
        return items;
    }
}
