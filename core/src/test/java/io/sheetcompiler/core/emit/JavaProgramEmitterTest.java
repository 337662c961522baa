package io.sheetcompiler.core.emit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

import io.sheetcompiler.core.config.ConverterConfig;
import io.sheetcompiler.core.formula.FormulaParser;
import io.sheetcompiler.core.formula.ReferenceExtractor;
import io.sheetcompiler.core.group.GroupBuilder;
import io.sheetcompiler.core.model.Cell.FormulaCell;
import io.sheetcompiler.core.model.Cell.HardcodedCell;
import io.sheetcompiler.core.model.CellAddress;
import io.sheetcompiler.core.model.GroupDirection;
import io.sheetcompiler.core.model.LiteralValue;
import io.sheetcompiler.core.model.WorkbookModel;
import io.sheetcompiler.core.schedule.DependencyScheduler;
import io.sheetcompiler.core.schedule.Schedule;
import io.sheetcompiler.core.translate.ExpressionTranslator;
import io.sheetcompiler.core.translate.ExpressionTranslator.LoopContext;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("JavaProgramEmitter")
class JavaProgramEmitterTest {

    private final FormulaParser parser =
            new FormulaParser(new ReferenceExtractor(WorkbookModel.builder().sheet("Sheet1").build()));

    private Schedule schedule(String... cellsAndFormulas) {
        List<FormulaCell> cells = new ArrayList<>();
        for (int i = 0; i < cellsAndFormulas.length; i += 2) {
            cells.add(parser.parse(CellAddress.parse("Sheet1", cellsAndFormulas[i]), cellsAndFormulas[i + 1]));
        }
        return new DependencyScheduler().schedule(new GroupBuilder().build(cells).workItems());
    }

    private static HardcodedCell seed(String a1, long value) {
        return new HardcodedCell(CellAddress.parse("Sheet1", a1), new LiteralValue.IntegerValue(value));
    }

    private static SortedMap<String, SortedSet<String>> noExternals() {
        return new TreeMap<>();
    }

    @Test
    @DisplayName("a drag-copied column is emitted as one loop")
    void groupLoop() {
        String source = new JavaProgramEmitter(ConverterConfig.DEFAULT).emit(
                schedule("D2", "=B2-C2", "D3", "=B3-C3", "D4", "=B4-C4"), List.of(), noExternals());

        assertThat(source)
                .contains("// Sheet1!D2:D4 (3 cells): =B2-C2")
                .contains("for (int r = 2; r <= 4; r++) {")
                .contains("final int row = r;")
                .contains("store.evaluate(\"Sheet1\", 4, row, () -> "
                        + "Operators.subtract(store.get(\"Sheet1\", 2, row), store.get(\"Sheet1\", 3, row)));");
        assertThat(source.split("store\\.evaluate", -1)).hasSize(2);
    }

    @Test
    @DisplayName("a row group loops over columns")
    void horizontalLoop() {
        String source = new JavaProgramEmitter(ConverterConfig.DEFAULT).emit(
                schedule("B5", "=SUM(B1:B4)", "C5", "=SUM(C1:C4)"), List.of(), noExternals());

        assertThat(source)
                .contains("for (int c = 2; c <= 3; c++) {")
                .contains("final int col = c;")
                .contains("store.evaluate(\"Sheet1\", col, 5, () -> Functions.sum(store.range(\"Sheet1\", col, 1, col, 4)));");
    }

    @Test
    @DisplayName("the class header carries the configured names")
    void header() {
        ConverterConfig config = ConverterConfig.builder().packageName("com.acme.model").className("Budget").build();

        String source = new JavaProgramEmitter(config).emit(schedule("A1", "=1+1"), List.of(), noExternals());

        assertThat(source)
                .startsWith("package com.acme.model;\n")
                .contains("import io.sheetcompiler.runtime.CellStore;")
                .contains("public final class Budget implements CompiledWorkbook {")
                .contains("new TreeSet<String>(List.of())")
                .contains("public void compute(CellStore store, ExternalWorkbooks externals) {")
                .endsWith("}\n");
    }

    @Test
    @DisplayName("the default package emits no package declaration")
    void defaultPackage() {
        ConverterConfig config = ConverterConfig.builder().packageName("").build();

        String source = new JavaProgramEmitter(config).emit(schedule("A1", "=1"), List.of(), noExternals());

        assertThat(source).startsWith("import ");
    }

    @Test
    @DisplayName("seeds precede steps and statements are split across methods")
    void chunking() {
        ConverterConfig config = ConverterConfig.builder().statementsPerMethod(2).build();
        List<HardcodedCell> seeds = List.of(seed("A1", 1), seed("A2", 2), seed("A3", -3));

        String source = new JavaProgramEmitter(config).emit(
                schedule("B1", "=A1*2", "C9", "=A3+A2"), seeds, noExternals());

        assertThat(source)
                .contains("store.seed(\"Sheet1\", 1, 1, 1L);")
                .contains("store.seed(\"Sheet1\", 1, 3, (-3L));")
                .contains("private static void seed0(CellStore store) {")
                .contains("private static void seed1(CellStore store) {")
                .contains("private static void step0(CellStore store) {")
                .doesNotContain("step1(");
        assertThat(source.indexOf("seed0(store);")).isLessThan(source.indexOf("seed1(store);"));
        assertThat(source.indexOf("seed1(store);")).isLessThan(source.indexOf("step0(store);"));
    }

    @Test
    @DisplayName("methods are spread over nested part classes that run in order")
    void parts() {
        ConverterConfig config = ConverterConfig.builder().statementsPerMethod(1).build();
        List<HardcodedCell> seeds = List.of(seed("A1", 1), seed("A2", 2));

        String source = new JavaProgramEmitter(config, new ExpressionTranslator(), 1)
                .emit(schedule("B1", "=A1*2"), seeds, noExternals());

        assertThat(source)
                .contains("private static final class Part0 {")
                .contains("private static final class Part2 {")
                .doesNotContain("class Part3")
                .contains("static void run(CellStore store, ExternalWorkbooks externals) {");
        assertThat(source.indexOf("Part0.run(store, externals);"))
                .isLessThan(source.indexOf("Part1.run(store, externals);"));
        assertThat(source.indexOf("Part1.run(store, externals);"))
                .isLessThan(source.indexOf("Part2.run(store, externals);"));
        assertThat(source.indexOf("class Part1 {")).isLessThan(source.indexOf("private static void seed1("));
        assertThat(source.indexOf("class Part2 {")).isLessThan(source.indexOf("private static void step0("));
    }

    @Test
    @DisplayName("methods share a part while they fit its budget")
    void singlePart() {
        ConverterConfig config = ConverterConfig.builder().statementsPerMethod(1).build();

        String source = new JavaProgramEmitter(config).emit(
                schedule("B1", "=A1*2"), List.of(seed("A1", 1), seed("A2", 2)), noExternals());

        assertThat(source).containsOnlyOnce("class Part0 {").doesNotContain("class Part1");
    }

    @Test
    @DisplayName("external sheets are loaded before seeding")
    void externals() {
        SortedMap<String, SortedSet<String>> externals = new TreeMap<>();
        externals.put("Ext.xlsx", new TreeSet<>(List.of("Sheet1", "Rates")));

        String source = new JavaProgramEmitter(ConverterConfig.DEFAULT).emit(
                schedule("A1", "=[Ext.xlsx]Sheet1!A1*2"), List.of(seed("B1", 1)), externals);

        assertThat(source)
                .contains("new TreeSet<String>(List.of(\"Ext.xlsx\"))")
                .contains("private static void load0(CellStore store, ExternalWorkbooks externals) {")
                .contains("store.loadExternal(externals, \"Ext.xlsx\", \"Rates\");")
                .contains("store.loadExternal(externals, \"Ext.xlsx\", \"Sheet1\");")
                .contains("store.get(\"Ext.xlsx|Sheet1\", 1, 1)");
        assertThat(source.indexOf("load0(store, externals);")).isLessThan(source.indexOf("seed0(store);"));
    }

    @Test
    @DisplayName("a group is translated once, through its representative, with its loop")
    void translatesRepresentativeOnce() {
        Schedule schedule = schedule("D2", "=B2-C2", "D3", "=B3-C3", "D4", "=B4-C4", "F9", "=1");
        ExpressionTranslator translator = mock(ExpressionTranslator.class);
        when(translator.translate(any(FormulaCell.class), any(LoopContext.class))).thenReturn("LOOP");
        when(translator.translate(any(FormulaCell.class))).thenReturn("SINGLE");

        String source = new JavaProgramEmitter(ConverterConfig.DEFAULT, translator)
                .emit(schedule, List.of(), noExternals());

        FormulaCell representative = schedule.order().get(0).cells().get(0);
        verify(translator).translate(representative, LoopContext.of(GroupDirection.VERTICAL));
        verify(translator).translate(eq(schedule.order().get(1).cells().get(0)));
        verifyNoMoreInteractions(translator);
        assertThat(source).contains("() -> LOOP);").contains("() -> SINGLE);");
    }

    @Test
    @DisplayName("formula comments cannot break out of their line")
    void commentSanitising() {
        assertThat(JavaProgramEmitter.comment("=\"a\nb\"&\"\\u000a\""))
                .isEqualTo("// =\"a b\"&\"\\\\u000a\"");
    }
}
