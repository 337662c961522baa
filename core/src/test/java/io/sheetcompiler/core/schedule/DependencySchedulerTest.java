package io.sheetcompiler.core.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.sheetcompiler.core.error.DependencyCycleException;
import io.sheetcompiler.core.formula.FormulaParser;
import io.sheetcompiler.core.formula.ReferenceExtractor;
import io.sheetcompiler.core.group.GroupBuilder;
import io.sheetcompiler.core.model.Cell.FormulaCell;
import io.sheetcompiler.core.model.CellAddress;
import io.sheetcompiler.core.model.Group;
import io.sheetcompiler.core.model.WorkItem;
import io.sheetcompiler.core.model.WorkbookModel;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DependencyScheduler")
class DependencySchedulerTest {

    private final FormulaParser parser = new FormulaParser(
            new ReferenceExtractor(WorkbookModel.builder().sheet("Sheet1").sheet("Sheet2").build()));
    private final DependencyScheduler scheduler = new DependencyScheduler();

    /** Parses alternating sheet-qualified A1 addresses and formulas, e.g. {@code "Sheet1!A1", "=B1"}. */
    private List<WorkItem> items(String... cellsAndFormulas) {
        List<FormulaCell> cells = new ArrayList<>();
        for (int i = 0; i < cellsAndFormulas.length; i += 2) {
            String[] parts = cellsAndFormulas[i].split("!");
            cells.add(parser.parse(CellAddress.parse(parts[0], parts[1]), cellsAndFormulas[i + 1]));
        }
        return new GroupBuilder().build(cells).workItems();
    }

    private static List<String> labels(Schedule schedule) {
        return schedule.order().stream().map(WorkItem::label).toList();
    }

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        @DisplayName("producers run before their consumers")
        void producersFirst() {
            Schedule schedule = scheduler.schedule(items(
                    "Sheet1!A1", "=B1*2",
                    "Sheet1!B1", "=C1+1",
                    "Sheet1!C1", "=5"));

            assertThat(labels(schedule)).containsExactly("Sheet1!C1", "Sheet1!B1", "Sheet1!A1");
        }

        @Test
        @DisplayName("cross-sheet reads order items across sheets")
        void crossSheet() {
            Schedule schedule = scheduler.schedule(items(
                    "Sheet1!A1", "=Sheet2!A1+1",
                    "Sheet2!A1", "=5"));

            assertThat(labels(schedule)).containsExactly("Sheet2!A1", "Sheet1!A1");
        }

        @Test
        @DisplayName("a group reading another sheet's group waits for it")
        void crossSheetGroups() {
            Schedule schedule = scheduler.schedule(items(
                    "Sheet1!D2", "=Sheet2!B2+1",
                    "Sheet1!D3", "=Sheet2!B3+1",
                    "Sheet1!D4", "=Sheet2!B4+1",
                    "Sheet1!D5", "=Sheet2!B5+1",
                    "Sheet2!B2", "=A2*10",
                    "Sheet2!B3", "=A3*10",
                    "Sheet2!B4", "=A4*10",
                    "Sheet2!B5", "=A5*10"));

            assertThat(labels(schedule)).containsExactly("Sheet2!B2:B5", "Sheet1!D2:D5");
        }

        @Test
        @DisplayName("independent items come out in anchor order")
        void anchorOrder() {
            Schedule schedule = scheduler.schedule(items(
                    "Sheet2!A1", "=1",
                    "Sheet1!C3", "=2",
                    "Sheet1!B7", "=3"));

            assertThat(labels(schedule)).containsExactly("Sheet1!C3", "Sheet1!B7", "Sheet2!A1");
        }

        @Test
        @DisplayName("a range read waits for every formula inside the range")
        void rangeRead() {
            Schedule schedule = scheduler.schedule(items(
                    "Sheet1!A1", "=SUM(B1:B3)",
                    "Sheet1!B1", "=C1*2",
                    "Sheet1!B2", "=C2*2",
                    "Sheet1!B3", "=C3*2"));

            assertThat(labels(schedule)).containsExactly("Sheet1!B1:B3", "Sheet1!A1");
        }

        @Test
        @DisplayName("the same input always yields the same order")
        void deterministic() {
            String[] input = {
                "Sheet1!D1", "=A1+B1", "Sheet1!D2", "=A2+B2", "Sheet1!E1", "=SUM(D1:D2)", "Sheet2!A1", "=Sheet1!E1"
            };

            List<String> first = labels(scheduler.schedule(items(input)));
            List<String> second = labels(scheduler.schedule(items(input)));

            assertThat(first).isEqualTo(second).containsExactly("Sheet1!D1:D2", "Sheet1!E1", "Sheet2!A1");
        }
    }

    @Nested
    @DisplayName("Groups")
    class Groups {

        @Test
        @DisplayName("a running total may read earlier members of its own group")
        void runningTotal() {
            Schedule schedule = scheduler.schedule(items(
                    "Sheet1!B2", "=B1+A2",
                    "Sheet1!B3", "=B2+A3",
                    "Sheet1!B4", "=B3+A4"));

            assertThat(schedule.dissolved()).isEmpty();
            assertThat(schedule.groupCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("a group reading its later members is dissolved and scheduled cell by cell")
        void dissolvesBackwardRun() {
            Schedule schedule = scheduler.schedule(items(
                    "Sheet1!A2", "=A3+1",
                    "Sheet1!A3", "=A4+1",
                    "Sheet1!A4", "=A5+1"));

            assertThat(schedule.dissolved()).extracting(g -> g.range().toString()).containsExactly("Sheet1!A2:A4");
            assertThat(labels(schedule)).containsExactly("Sheet1!A4", "Sheet1!A3", "Sheet1!A2");
            assertThat(schedule.singletonCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("the violation names the member and the cell it reads")
        void violationMessage() {
            Group group = ((WorkItem.GroupItem) items(
                    "Sheet1!C1", "=SUM(C1:C3)",
                    "Sheet1!C2", "=SUM(C2:C4)").get(0)).group();

            assertThat(DependencyScheduler.intraGroupViolation(group)).contains("C1 reads C2");
        }
    }

    @Nested
    @DisplayName("Cycles")
    class Cycles {

        @Test
        @DisplayName("a two-cell cycle is reported in dependency order")
        void twoCells() {
            assertThatThrownBy(() -> scheduler.schedule(items(
                    "Sheet1!A1", "=B1",
                    "Sheet1!B1", "=A1+1",
                    "Sheet1!C1", "=A1")))
                    .isInstanceOfSatisfying(DependencyCycleException.class, e -> {
                        assertThat(e.items()).containsExactly("Sheet1!A1", "Sheet1!B1");
                        assertThat(e.getMessage())
                                .isEqualTo("Circular reference: Sheet1!A1 -> Sheet1!B1 -> Sheet1!A1");
                    });
        }

        @Test
        @DisplayName("a formula reading itself is a cycle")
        void selfReference() {
            assertThatThrownBy(() -> scheduler.schedule(items("Sheet1!A1", "=SUM(A1:A3)")))
                    .isInstanceOfSatisfying(DependencyCycleException.class,
                            e -> assertThat(e.cycle()).containsExactly(CellAddress.parse("Sheet1", "A1")));
        }

        @Test
        @DisplayName("cycles across sheets are detected")
        void acrossSheets() {
            assertThatThrownBy(() -> scheduler.schedule(items(
                    "Sheet1!A1", "=Sheet2!A1",
                    "Sheet2!A1", "=Sheet1!A1*2")))
                    .isInstanceOf(DependencyCycleException.class)
                    .hasMessageContaining("Sheet1!A1 -> Sheet2!A1");
        }
    }
}
