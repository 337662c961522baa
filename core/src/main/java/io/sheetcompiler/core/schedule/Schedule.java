package io.sheetcompiler.core.schedule;

import io.sheetcompiler.core.model.Group;
import io.sheetcompiler.core.model.WorkItem;
import java.util.List;

/**
 * Evaluation order of the work items.
 *
 * @param order     every work item; each comes after all items it reads from
 * @param dissolved groups that read their own later members and were split into singletons
 */
public record Schedule(List<WorkItem> order, List<Group> dissolved) {

    public Schedule {
        order = List.copyOf(order);
        dissolved = List.copyOf(dissolved);
    }

    public long groupCount() {
        return order.stream().filter(WorkItem.GroupItem.class::isInstance).count();
    }

    public long singletonCount() {
        return order.size() - groupCount();
    }
}
