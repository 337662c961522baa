package io.sheetcompiler.core.pattern;

import static org.assertj.core.api.Assertions.assertThat;

import io.sheetcompiler.core.formula.FormulaParser;
import io.sheetcompiler.core.formula.ReferenceExtractor;
import io.sheetcompiler.core.model.AxisOffset;
import io.sheetcompiler.core.model.Cell.FormulaCell;
import io.sheetcompiler.core.model.CellAddress;
import io.sheetcompiler.core.model.FormulaPattern;
import io.sheetcompiler.core.model.WorkbookModel;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PatternNormaliser")
class PatternNormaliserTest {

    private final FormulaParser parser = new FormulaParser(
            new ReferenceExtractor(WorkbookModel.builder().sheet("Sheet1").sheet("Sheet2").build()));

    private FormulaCell cell(String a1, String formula) {
        return parser.parse(CellAddress.parse("Sheet1", a1), formula);
    }

    private FormulaPattern pattern(String a1, String formula) {
        return PatternNormaliser.normalise(cell(a1, formula));
    }

    @Test
    @DisplayName("drag-copied formulas share a pattern")
    void dragCopiesMatch() {
        FormulaPattern d2 = pattern("D2", "=B2*C2");
        FormulaPattern d3 = pattern("D3", "=B3*C3");

        assertThat(d2).isEqualTo(d3);
        assertThat(d2.skeleton()).isEqualTo("=@0*@1");
        assertThat(d2.signature()).containsExactly(
                new AxisOffset.Relative(-2), new AxisOffset.Relative(0),
                new AxisOffset.Relative(-1), new AxisOffset.Relative(0));
    }

    @Test
    @DisplayName("an absolute anchor distinguishes otherwise similar formulas")
    void absoluteAnchorDiffers() {
        assertThat(pattern("D2", "=$B$2*C2")).isNotEqualTo(pattern("D3", "=B3*C3"));
        assertThat(pattern("D2", "=$B$2*C2")).isEqualTo(pattern("D3", "=$B$2*C3"));
    }

    @Test
    @DisplayName("ranges contribute four signature elements")
    void rangeSignature() {
        FormulaPattern running = pattern("B5", "=SUM($A$1:A5)");

        assertThat(running.signature()).containsExactly(
                new AxisOffset.Absolute(1), new AxisOffset.Absolute(1),
                new AxisOffset.Relative(-1), new AxisOffset.Relative(0));
        assertThat(running).isEqualTo(pattern("B6", "=SUM($A$1:A6)"));
    }

    @Test
    @DisplayName("sheet qualifiers stay in the skeleton")
    void qualifierKept() {
        FormulaPattern qualified = pattern("A1", "=Sheet2!B1+1");

        assertThat(qualified.skeleton()).isEqualTo("=Sheet2!@0+1");
        assertThat(qualified).isNotEqualTo(pattern("A1", "=B1+1"));
    }

    @Test
    @DisplayName("literals and function names are part of the skeleton")
    void literalsMatter() {
        assertThat(pattern("C1", "=A1*2")).isNotEqualTo(pattern("C2", "=A2*3"));
        assertThat(pattern("C1", "=MAX(A1,B1)")).isNotEqualTo(pattern("C2", "=MIN(A2,B2)"));
    }

    @Test
    @DisplayName("buckets are keyed by sheet and pattern, in first-seen order")
    void buckets() {
        Map<PatternNormaliser.BucketKey, List<FormulaCell>> buckets = PatternNormaliser.bucket(List.of(
                cell("D2", "=B2*C2"), cell("E2", "=B2+C2"), cell("D3", "=B3*C3")));

        assertThat(buckets).hasSize(2);
        assertThat(buckets.values().iterator().next())
                .extracting(c -> c.address().a1())
                .containsExactly("D2", "D3");
    }
}
