package io.sheetcompiler.core.engine;

import io.sheetcompiler.core.config.ConverterConfig;
import io.sheetcompiler.core.emit.JavaProgramEmitter;
import io.sheetcompiler.core.error.DependencyCycleException;
import io.sheetcompiler.core.error.FormulaParseException;
import io.sheetcompiler.core.error.InvalidFormulasException;
import io.sheetcompiler.core.formula.FormulaParser;
import io.sheetcompiler.core.formula.ReferenceExtractor;
import io.sheetcompiler.core.group.GroupBuilder;
import io.sheetcompiler.core.model.Cell.FormulaCell;
import io.sheetcompiler.core.model.Cell.HardcodedCell;
import io.sheetcompiler.core.model.CellAddress;
import io.sheetcompiler.core.model.CellRange;
import io.sheetcompiler.core.model.FormulaNode;
import io.sheetcompiler.core.model.Group;
import io.sheetcompiler.core.model.LiteralValue;
import io.sheetcompiler.core.model.Reference;
import io.sheetcompiler.core.model.SourceCell;
import io.sheetcompiler.core.model.WorkItem;
import io.sheetcompiler.core.model.WorkbookModel;
import io.sheetcompiler.core.report.ConversionReport;
import io.sheetcompiler.core.report.Diagnostic;
import io.sheetcompiler.core.report.ExternalFileManifest;
import io.sheetcompiler.core.report.ReportBuilder;
import io.sheetcompiler.core.schedule.DependencyScheduler;
import io.sheetcompiler.core.schedule.Schedule;
import io.sheetcompiler.core.translate.FunctionTable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a workbook into the source of a program that recomputes it.
 *
 * <p>
 * The pipeline: classify cells into hardcoded values and formulas, parse every formula,
 * group drag-copied formulas, schedule the work items, then translate and emit. Parsing runs
 * to completion before anything fails, so one run reports every bad formula. A converter is
 * stateless and may be shared.
 */
public final class WorkbookConverter {

    private static final Logger LOG = LoggerFactory.getLogger(WorkbookConverter.class);

    private final ConverterConfig config;

    public WorkbookConverter() {
        this(ConverterConfig.DEFAULT);
    }

    public WorkbookConverter(ConverterConfig config) {
        this.config = config;
    }

    /**
     * @throws InvalidFormulasException if any formula fails to parse
     * @throws DependencyCycleException if formulas read each other in a cycle
     * @throws io.sheetcompiler.core.error.UnsupportedFunctionException if a formula calls a
     *     function the runtime does not implement
     */
    public ConversionResult convert(WorkbookModel workbook) {
        Classified classified = classify(workbook);
        if (!classified.failures().isEmpty()) {
            ConversionReport report = ReportBuilder.build(workbook.sheets(), classified.hardcoded(),
                    classified.formulas(), List.of(), classified.diagnostics());
            throw new InvalidFormulasException(classified.failures(), report);
        }

        List<WorkItem> items = new GroupBuilder().build(classified.formulas()).workItems();
        Schedule schedule = new DependencyScheduler().schedule(items);
        List<Diagnostic> diagnostics = new ArrayList<>(classified.diagnostics());
        schedule.dissolved().forEach(g -> diagnostics.add(dissolved(g)));

        List<HardcodedCell> seeds = config.deleteUnreferencedHardcodedValues()
                ? referencedOnly(classified.hardcoded(), classified.formulas())
                : classified.hardcoded();
        ExternalFileManifest manifest = ExternalFileManifest.of(classified.formulas());
        String source = new JavaProgramEmitter(config).emit(schedule, seeds, manifest.sheets());

        ConversionReport report = ReportBuilder.build(
                workbook.sheets(), classified.hardcoded(), classified.formulas(), schedule.order(), diagnostics);
        LOG.info("Converted {} formulas and {} hardcoded cells into {}",
                classified.formulas().size(), seeds.size(), config.qualifiedClassName());
        return new ConversionResult(config, source, manifest, report, schedule);
    }

    /**
     * Analyses a workbook without emitting code. Parse failures, unsupported functions and
     * circular references are reported as diagnostics instead of thrown.
     */
    public ConversionReport analyse(WorkbookModel workbook) {
        Classified classified = classify(workbook);
        List<Diagnostic> diagnostics = new ArrayList<>(classified.diagnostics());
        for (FormulaCell formula : classified.formulas()) {
            unsupportedFunction(formula.expression()).ifPresent(name -> diagnostics.add(new Diagnostic(
                    Diagnostic.Kind.UNSUPPORTED_FUNCTION, formula.address().toString(), formula.formula(),
                    "Unsupported function " + name)));
        }
        List<WorkItem> items = new GroupBuilder().build(classified.formulas()).workItems();
        try {
            Schedule schedule = new DependencyScheduler().schedule(items);
            schedule.dissolved().forEach(g -> diagnostics.add(dissolved(g)));
            items = schedule.order();
        } catch (DependencyCycleException e) {
            for (int i = 0; i < e.cycle().size(); i++) {
                diagnostics.add(new Diagnostic(Diagnostic.Kind.CIRCULAR_REFERENCE, e.cycle().get(i).toString(),
                        null, e.getMessage()));
            }
        }
        return ReportBuilder.build(workbook.sheets(), classified.hardcoded(), classified.formulas(), items,
                diagnostics);
    }

    private record Classified(
            List<HardcodedCell> hardcoded,
            List<FormulaCell> formulas,
            List<FormulaParseException> failures,
            List<Diagnostic> diagnostics) {}

    /** Splits the workbook into literals and parsed formulas, gating literal types on the way. */
    private Classified classify(WorkbookModel workbook) {
        FormulaParser parser = new FormulaParser(new ReferenceExtractor(workbook));
        List<HardcodedCell> hardcoded = new ArrayList<>();
        List<FormulaCell> formulas = new ArrayList<>();
        List<FormulaParseException> failures = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (SourceCell cell : workbook.cells()) {
            if (cell.isFormula()) {
                try {
                    formulas.add(parser.parse(cell.address(), cell.formula()));
                } catch (FormulaParseException e) {
                    LOG.debug("Parse failure: {}", e.getMessage());
                    failures.add(e);
                    diagnostics.add(Diagnostic.of(e));
                }
                continue;
            }
            Optional<LiteralValue> literal = LiteralValue.gate(cell.value());
            if (literal.isEmpty()) {
                String type = cell.value().getClass().getName();
                LOG.warn("Cell {} holds a {} with no literal form; it is seeded as blank", cell.address(), type);
                diagnostics.add(new Diagnostic(Diagnostic.Kind.SERIALIZATION, cell.address().toString(), null,
                        "Value of type " + type + " replaced by blank"));
            }
            hardcoded.add(new HardcodedCell(cell.address(), literal.orElse(LiteralValue.NULL)));
        }
        LOG.info("Classified {} cells: {} formulas, {} hardcoded, {} parse failures",
                workbook.cells().size(), formulas.size(), hardcoded.size(), failures.size());
        return new Classified(hardcoded, formulas, failures, diagnostics);
    }

    /** The hardcoded cells some formula reads directly, through a range or through a table. */
    static List<HardcodedCell> referencedOnly(List<HardcodedCell> hardcoded, List<FormulaCell> formulas) {
        Map<String, NavigableMap<Integer, NavigableMap<Integer, HardcodedCell>>> index = new HashMap<>();
        for (HardcodedCell cell : hardcoded) {
            CellAddress a = cell.address();
            index.computeIfAbsent(a.sheet(), s -> new TreeMap<>())
                    .computeIfAbsent(a.row(), r -> new TreeMap<>())
                    .put(a.column(), cell);
        }
        Set<CellAddress> referenced = new HashSet<>();
        for (FormulaCell formula : formulas) {
            for (Reference reference : formula.references()) {
                if (reference.isExternal()) {
                    continue;
                }
                CellRange target = reference.target();
                NavigableMap<Integer, NavigableMap<Integer, HardcodedCell>> rows = index.get(target.sheet());
                if (rows == null) {
                    continue;
                }
                for (NavigableMap<Integer, HardcodedCell> columns :
                        rows.subMap(target.firstRow(), true, target.lastRow(), true).values()) {
                    columns.subMap(target.firstColumn(), true, target.lastColumn(), true)
                            .values()
                            .forEach(c -> referenced.add(c.address()));
                }
            }
        }
        List<HardcodedCell> kept = hardcoded.stream().filter(c -> referenced.contains(c.address())).toList();
        LOG.info("Dropping {} unreferenced hardcoded cells", hardcoded.size() - kept.size());
        return kept;
    }

    private static Diagnostic dissolved(Group group) {
        return new Diagnostic(Diagnostic.Kind.DISSOLVED_GROUP, group.range().toString(),
                group.representative().formula(), "Members read later members of the same run; emitted one by one");
    }

    private static Optional<String> unsupportedFunction(FormulaNode node) {
        if (node instanceof FormulaNode.FunctionCall call) {
            if (FunctionTable.lookup(call.name()).isEmpty()) {
                return Optional.of(call.name());
            }
            for (FormulaNode argument : call.arguments()) {
                Optional<String> inner = unsupportedFunction(argument);
                if (inner.isPresent()) {
                    return inner;
                }
            }
        } else if (node instanceof FormulaNode.Unary unary) {
            return unsupportedFunction(unary.operand());
        } else if (node instanceof FormulaNode.Binary binary) {
            Optional<String> left = unsupportedFunction(binary.left());
            return left.isPresent() ? left : unsupportedFunction(binary.right());
        }
        return Optional.empty();
    }
}
