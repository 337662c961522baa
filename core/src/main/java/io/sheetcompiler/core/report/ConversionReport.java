package io.sheetcompiler.core.report;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Machine-readable analysis of a workbook: how formulas were grouped, which references
 * leave their sheet or the workbook, and what was found on the way. Serialised as JSON by
 * {@link ReportWriter}.
 *
 * @param summary              headline counts
 * @param items                one entry per work item, in anchor order
 * @param crossSheetReferences references to another sheet of the same workbook
 * @param externalReferences   references into other workbooks
 * @param sheets               per-sheet counts, in workbook order
 * @param diagnostics          findings, in cell order
 */
public record ConversionReport(
        Summary summary,
        List<ItemEntry> items,
        List<ReferenceEntry> crossSheetReferences,
        List<ReferenceEntry> externalReferences,
        Map<String, SheetBreakdown> sheets,
        List<Diagnostic> diagnostics) {

    public ConversionReport {
        items = List.copyOf(items);
        crossSheetReferences = List.copyOf(crossSheetReferences);
        externalReferences = List.copyOf(externalReferences);
        sheets = Collections.unmodifiableMap(new LinkedHashMap<>(sheets));
        diagnostics = List.copyOf(diagnostics);
    }

    public record Summary(
            int totalFormulas,
            int hardcodedCells,
            int groups,
            int cellsInGroups,
            int singletons,
            int crossSheetReferences,
            int externalReferences,
            int externalFiles,
            int sheets) {}

    /**
     * @param label     the cell or range the item covers
     * @param kind      {@code group} or {@code singleton}
     * @param direction {@code VERTICAL} or {@code HORIZONTAL} for groups, else {@code null}
     * @param cells     number of cells covered
     * @param formula   formula text of the anchor cell
     * @param skeleton  pattern skeleton
     * @param signature pattern signature, one element per reference axis
     */
    public record ItemEntry(
            String label,
            String kind,
            String direction,
            int cells,
            String formula,
            String skeleton,
            List<String> signature) {}

    /**
     * @param cell      the cell holding the formula
     * @param reference the reference text as written
     * @param sheet     target sheet
     * @param file      target workbook file, {@code null} within this workbook
     */
    public record ReferenceEntry(String cell, String reference, String sheet, String file) {}

    public record SheetBreakdown(int formulas, int hardcodedCells, int groups, int singletons) {}
}
