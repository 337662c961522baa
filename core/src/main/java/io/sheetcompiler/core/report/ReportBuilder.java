package io.sheetcompiler.core.report;

import io.sheetcompiler.core.model.Cell.FormulaCell;
import io.sheetcompiler.core.model.Cell.HardcodedCell;
import io.sheetcompiler.core.model.FormulaPattern;
import io.sheetcompiler.core.model.Reference;
import io.sheetcompiler.core.model.WorkItem;
import io.sheetcompiler.core.pattern.PatternNormaliser;
import io.sheetcompiler.core.report.ConversionReport.ItemEntry;
import io.sheetcompiler.core.report.ConversionReport.ReferenceEntry;
import io.sheetcompiler.core.report.ConversionReport.SheetBreakdown;
import io.sheetcompiler.core.report.ConversionReport.Summary;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Assembles a {@link ConversionReport} from the intermediate results of a conversion. */
public final class ReportBuilder {

    private ReportBuilder() {
        // utility class
    }

    /**
     * @param sheets      sheet names in workbook order
     * @param hardcoded   classified value cells
     * @param formulas    formulas that parsed
     * @param items       work items covering {@code formulas}
     * @param diagnostics findings collected so far
     */
    public static ConversionReport build(
            List<String> sheets,
            List<HardcodedCell> hardcoded,
            List<FormulaCell> formulas,
            List<WorkItem> items,
            List<Diagnostic> diagnostics) {
        List<WorkItem> ordered = new ArrayList<>(items);
        ordered.sort(Comparator.comparing(WorkItem::anchor));

        Map<String, int[]> counts = new LinkedHashMap<>();
        sheets.forEach(s -> counts.put(s, new int[4]));
        hardcoded.forEach(c -> counts.computeIfAbsent(c.address().sheet(), s -> new int[4])[1]++);

        List<ItemEntry> entries = new ArrayList<>(ordered.size());
        int groups = 0;
        int cellsInGroups = 0;
        for (WorkItem item : ordered) {
            FormulaCell anchor = item.cells().get(0);
            FormulaPattern pattern = PatternNormaliser.normalise(anchor);
            List<String> signature = pattern.signature().stream().map(Object::toString).toList();
            int[] sheet = counts.computeIfAbsent(item.anchor().sheet(), s -> new int[4]);
            sheet[0] += item.cells().size();
            if (item instanceof WorkItem.GroupItem groupItem) {
                groups++;
                cellsInGroups += item.cells().size();
                sheet[2]++;
                entries.add(new ItemEntry(item.label(), "group", groupItem.group().direction().name(),
                        item.cells().size(), anchor.formula(), pattern.skeleton(), signature));
            } else {
                sheet[3]++;
                entries.add(new ItemEntry(item.label(), "singleton", null, 1, anchor.formula(), pattern.skeleton(),
                        signature));
            }
        }

        List<ReferenceEntry> crossSheet = new ArrayList<>();
        List<ReferenceEntry> external = new ArrayList<>();
        List<FormulaCell> byAddress = new ArrayList<>(formulas);
        byAddress.sort(Comparator.comparing(FormulaCell::address));
        for (FormulaCell formula : byAddress) {
            for (Reference reference : formula.references()) {
                ReferenceEntry entry = new ReferenceEntry(
                        formula.address().toString(), reference.text(), reference.sheet(), reference.externalFile());
                if (reference.isExternal()) {
                    external.add(entry);
                } else if (reference.isCrossSheet(formula.address().sheet())) {
                    crossSheet.add(entry);
                }
            }
        }

        Map<String, SheetBreakdown> breakdown = new LinkedHashMap<>();
        counts.forEach((name, c) -> breakdown.put(name, new SheetBreakdown(c[0], c[1], c[2], c[3])));

        int externalFiles = ExternalFileManifest.of(formulas).files().size();
        Summary summary = new Summary(
                formulas.size(),
                hardcoded.size(),
                groups,
                cellsInGroups,
                ordered.size() - groups,
                crossSheet.size(),
                external.size(),
                externalFiles,
                breakdown.size());
        return new ConversionReport(summary, entries, crossSheet, external, breakdown, diagnostics);
    }
}
