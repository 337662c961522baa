package io.sheetcompiler.core.schedule;

import io.sheetcompiler.core.error.DependencyCycleException;
import io.sheetcompiler.core.model.Cell.FormulaCell;
import io.sheetcompiler.core.model.CellAddress;
import io.sheetcompiler.core.model.CellRange;
import io.sheetcompiler.core.model.Group;
import io.sheetcompiler.core.model.GroupDirection;
import io.sheetcompiler.core.model.Reference;
import io.sheetcompiler.core.model.WorkItem;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orders work items so that every item runs after the items it reads from.
 *
 * <p>
 * A group runs its members in iteration order, so a member may read earlier members of the
 * same group but not itself or later ones. Groups breaking that rule are dissolved into
 * singletons before the graph is built. Among items that are ready at the same time the one
 * with the smallest anchor goes first, so the order is a pure function of the workbook.
 */
public final class DependencyScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(DependencyScheduler.class);

    /**
     * @throws DependencyCycleException if the items read each other in a cycle; nothing is
     *     returned in that case
     */
    public Schedule schedule(List<WorkItem> items) {
        List<WorkItem> valid = new ArrayList<>(items.size());
        List<Group> dissolved = new ArrayList<>();
        for (WorkItem item : items) {
            if (item instanceof WorkItem.GroupItem groupItem) {
                Optional<String> violation = intraGroupViolation(groupItem.group());
                if (violation.isPresent()) {
                    LOG.info("Dissolving group {} into singletons: {}", groupItem.label(), violation.get());
                    dissolved.add(groupItem.group());
                    groupItem.group().members().forEach(m -> valid.add(new WorkItem.Singleton(m)));
                    continue;
                }
            }
            valid.add(item);
        }

        DependencyGraph graph = DependencyGraph.build(valid);
        int[] pending = new int[graph.size()];
        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < graph.size(); i++) {
            pending[i] = graph.producersOf(i).size();
            if (pending[i] == 0) {
                ready.add(i);
            }
        }
        List<WorkItem> order = new ArrayList<>(graph.size());
        while (!ready.isEmpty()) {
            int next = ready.poll();
            order.add(graph.items().get(next));
            for (int consumer : graph.consumersOf(next)) {
                if (consumer != next && --pending[consumer] == 0) {
                    ready.add(consumer);
                }
            }
        }
        if (order.size() < graph.size()) {
            throw cycle(graph, pending);
        }
        Schedule schedule = new Schedule(order, dissolved);
        LOG.info("Scheduled {} work items ({} groups, {} singletons, {} groups dissolved)",
                order.size(), schedule.groupCount(), schedule.singletonCount(), dissolved.size());
        return schedule;
    }

    /**
     * Describes the first member reading itself or a later member of its own group, if any.
     */
    static Optional<String> intraGroupViolation(Group group) {
        CellRange line = group.range();
        boolean vertical = group.direction() == GroupDirection.VERTICAL;
        for (int i = 0; i < group.extent(); i++) {
            FormulaCell member = group.members().get(i);
            for (Reference reference : group.referencesOf(i)) {
                if (reference.isExternal() || !reference.sheet().equals(line.sheet())) {
                    continue;
                }
                CellRange target = reference.target();
                int fixedLow = vertical ? target.firstColumn() : target.firstRow();
                int fixedHigh = vertical ? target.lastColumn() : target.lastRow();
                int fixed = vertical ? line.firstColumn() : line.firstRow();
                if (fixed < fixedLow || fixed > fixedHigh) {
                    continue;
                }
                int start = vertical ? line.firstRow() : line.firstColumn();
                int low = Math.max(vertical ? target.firstRow() : target.firstColumn(), start);
                int high = Math.min(vertical ? target.lastRow() : target.lastColumn(), start + group.extent() - 1);
                if (low <= high && high - start >= i) {
                    CellAddress read = group.members().get(high - start).address();
                    return Optional.of(member.address().a1() + " reads " + read.a1());
                }
            }
        }
        return Optional.empty();
    }

    /** Walks unresolved producer edges from the smallest stuck item until one repeats. */
    private static DependencyCycleException cycle(DependencyGraph graph, int[] pending) {
        int start = -1;
        for (int i = 0; i < pending.length && start < 0; i++) {
            if (pending[i] > 0) {
                start = i;
            }
        }
        List<Integer> path = new ArrayList<>();
        Map<Integer, Integer> seenAt = new HashMap<>();
        int current = start;
        while (!seenAt.containsKey(current)) {
            seenAt.put(current, path.size());
            path.add(current);
            int from = current;
            current = graph.producersOf(from).stream()
                    .filter(p -> pending[p] > 0)
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("stuck item without stuck producer: " + from));
        }
        List<CellAddress> cells = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        for (int node : path.subList(seenAt.get(current), path.size())) {
            WorkItem item = graph.items().get(node);
            cells.add(item.anchor());
            labels.add(item.label());
        }
        LOG.error("Circular reference between {}", labels);
        return new DependencyCycleException(cells, labels);
    }
}
