package io.sheetcompiler.core.group;

import io.sheetcompiler.core.model.Cell.FormulaCell;
import io.sheetcompiler.core.model.CellAddress;
import io.sheetcompiler.core.model.FormulaPattern;
import io.sheetcompiler.core.model.Group;
import io.sheetcompiler.core.model.GroupDirection;
import io.sheetcompiler.core.model.WorkItem;
import io.sheetcompiler.core.pattern.PatternNormaliser;
import io.sheetcompiler.core.pattern.PatternNormaliser.BucketKey;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Clusters same-pattern formulas into maximal contiguous vertical or horizontal runs.
 *
 * <p>
 * Within one bucket the builder repeatedly takes the best run among the cells not yet used:
 * the longest one, then vertical before horizontal, then the one with the smaller anchor. A
 * cell that could start either a column run or a row run thus joins the longer one, and a
 * square block becomes column groups. Runs shorter than two stay singletons.
 */
public final class GroupBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(GroupBuilder.class);

    private static final Comparator<Run> BEST_FIRST = Comparator.comparingInt(Run::length)
            .reversed()
            .thenComparing(Run::direction)
            .thenComparing(Run::anchor);

    /** Outcome of grouping: groups plus the cells left on their own. */
    public record Grouping(List<Group> groups, List<FormulaCell> singletons) {

        public Grouping {
            groups = List.copyOf(groups);
            singletons = List.copyOf(singletons);
        }

        /** Groups and singletons as work items, ordered by anchor address. */
        public List<WorkItem> workItems() {
            List<WorkItem> items = new ArrayList<>(groups.size() + singletons.size());
            groups.forEach(g -> items.add(new WorkItem.GroupItem(g)));
            singletons.forEach(c -> items.add(new WorkItem.Singleton(c)));
            items.sort(Comparator.comparing(WorkItem::anchor));
            return items;
        }
    }

    private record Run(GroupDirection direction, CellAddress anchor, int length) {}

    public Grouping build(Collection<FormulaCell> cells) {
        List<Group> groups = new ArrayList<>();
        List<FormulaCell> singletons = new ArrayList<>();
        for (Map.Entry<BucketKey, List<FormulaCell>> bucket : PatternNormaliser.bucket(cells).entrySet()) {
            buildBucket(bucket.getKey().pattern(), bucket.getValue(), groups, singletons);
        }
        groups.sort(Comparator.comparing(Group::anchor));
        singletons.sort(Comparator.comparing(FormulaCell::address));
        LOG.info("Grouped {} formulas into {} groups and {} singletons", cells.size(), groups.size(), singletons.size());
        return new Grouping(groups, singletons);
    }

    private void buildBucket(
            FormulaPattern pattern, List<FormulaCell> bucket, List<Group> groups, List<FormulaCell> singletons) {
        TreeMap<CellAddress, FormulaCell> unused = new TreeMap<>();
        bucket.forEach(c -> unused.put(c.address(), c));
        while (unused.size() >= 2) {
            Run best = null;
            for (CellAddress address : unused.keySet()) {
                for (GroupDirection direction : GroupDirection.values()) {
                    Run run = runFrom(unused, address, direction);
                    if (run != null && (best == null || BEST_FIRST.compare(run, best) < 0)) {
                        best = run;
                    }
                }
            }
            if (best == null || best.length() < 2) {
                break;
            }
            List<FormulaCell> members = new ArrayList<>(best.length());
            for (int i = 0; i < best.length(); i++) {
                members.add(unused.remove(step(best.anchor(), best.direction(), i)));
            }
            Group group = new Group(best.direction(), pattern, members);
            LOG.debug("Group {} ({} cells, {})", group.range(), group.extent(), group.direction());
            groups.add(group);
        }
        singletons.addAll(unused.values());
    }

    /** The run starting at {@code start}, or {@code null} if {@code start} is not the first cell of one. */
    private static Run runFrom(TreeMap<CellAddress, FormulaCell> unused, CellAddress start, GroupDirection direction) {
        boolean vertical = direction == GroupDirection.VERTICAL;
        int position = vertical ? start.row() : start.column();
        if (position > 1 && unused.containsKey(step(start, direction, -1))) {
            return null;
        }
        int limit = vertical ? CellAddress.MAX_ROW : CellAddress.MAX_COLUMN;
        int length = 1;
        while (position + length <= limit && unused.containsKey(step(start, direction, length))) {
            length++;
        }
        return new Run(direction, start, length);
    }

    private static CellAddress step(CellAddress from, GroupDirection direction, int distance) {
        return direction == GroupDirection.VERTICAL ? from.offset(0, distance) : from.offset(distance, 0);
    }
}
