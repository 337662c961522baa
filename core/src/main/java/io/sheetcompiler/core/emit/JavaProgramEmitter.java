package io.sheetcompiler.core.emit;

import io.sheetcompiler.core.config.ConverterConfig;
import io.sheetcompiler.core.model.Cell.FormulaCell;
import io.sheetcompiler.core.model.Cell.HardcodedCell;
import io.sheetcompiler.core.model.CellAddress;
import io.sheetcompiler.core.model.Group;
import io.sheetcompiler.core.model.GroupDirection;
import io.sheetcompiler.core.model.WorkItem;
import io.sheetcompiler.core.schedule.Schedule;
import io.sheetcompiler.core.translate.ExpressionTranslator;
import io.sheetcompiler.core.translate.ExpressionTranslator.LoopContext;
import io.sheetcompiler.core.translate.JavaLiterals;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a schedule as the Java source of one {@code CompiledWorkbook} class.
 *
 * <p>
 * {@code compute} loads external sheets, seeds hardcoded cells, then runs the work items in
 * schedule order. Statements are spread over {@code loadN}, {@code seedN} and {@code stepN}
 * methods so no generated method grows past the JVM's code size limit, and the methods are
 * spread over nested {@code PartN} classes so no class overflows its constant pool. Every
 * cell is written through {@code store.evaluate}, which turns a failing cell into a recorded
 * failure and a blank value.
 */
public final class JavaProgramEmitter {

    private static final Logger LOG = LoggerFactory.getLogger(JavaProgramEmitter.class);

    private static final String INDENT = "    ";

    /**
     * Source characters per nested class. Every constant pool entry costs at least a few
     * characters of emitted source, so this keeps a part well below 65535 entries.
     */
    static final int CLASS_SOURCE_BUDGET = 200_000;

    private final ConverterConfig config;
    private final ExpressionTranslator translator;
    private final int classSourceBudget;

    public JavaProgramEmitter(ConverterConfig config) {
        this(config, new ExpressionTranslator());
    }

    public JavaProgramEmitter(ConverterConfig config, ExpressionTranslator translator) {
        this(config, translator, CLASS_SOURCE_BUDGET);
    }

    JavaProgramEmitter(ConverterConfig config, ExpressionTranslator translator, int classSourceBudget) {
        this.config = config;
        this.translator = translator;
        this.classSourceBudget = classSourceBudget;
    }

    /** A generated method: the call that runs it and its declaration. */
    private record Method(String call, String source) {}

    /**
     * @param schedule       the work items in evaluation order
     * @param seeds          hardcoded cells to write before any formula runs
     * @param externalSheets external file name to the sheets read from it
     * @return the complete compilation unit
     * @throws io.sheetcompiler.core.error.UnsupportedFunctionException if a formula calls an
     *     untranslatable function; no partial source is returned
     */
    public String emit(
            Schedule schedule, List<HardcodedCell> seeds, SortedMap<String, SortedSet<String>> externalSheets) {
        List<String> loads = new ArrayList<>();
        for (Map.Entry<String, SortedSet<String>> file : externalSheets.entrySet()) {
            for (String sheet : file.getValue()) {
                loads.add("store.loadExternal(externals, " + JavaLiterals.stringLiteral(file.getKey()) + ", "
                        + JavaLiterals.stringLiteral(sheet) + ");");
            }
        }
        List<String> seedStatements = new ArrayList<>(seeds.size());
        for (HardcodedCell seed : seeds) {
            CellAddress a = seed.address();
            seedStatements.add("store.seed(" + JavaLiterals.stringLiteral(a.sheet()) + ", " + a.column() + ", "
                    + a.row() + ", " + JavaLiterals.literal(seed.value()) + ");");
        }
        List<String> steps = new ArrayList<>(schedule.order().size());
        for (WorkItem item : schedule.order()) {
            if (item instanceof WorkItem.GroupItem groupItem) {
                steps.add(group(groupItem.group()));
            } else {
                steps.add(singleton(((WorkItem.Singleton) item).cell()));
            }
        }

        List<Method> methods = new ArrayList<>();
        chunked(methods, "load", "CellStore store, ExternalWorkbooks externals", "(store, externals)", loads);
        chunked(methods, "seed", "CellStore store", "(store)", seedStatements);
        chunked(methods, "step", "CellStore store", "(store)", steps);
        List<List<Method>> parts = parts(methods);

        int size = methods.stream().mapToInt(m -> m.source().length()).sum();
        StringBuilder out = new StringBuilder(2048 + size + 256 * parts.size());
        header(out, externalSheets.keySet(), parts.size());
        for (int n = 0; n < parts.size(); n++) {
            part(out, n, parts.get(n));
        }
        out.append("}\n");
        LOG.info("Emitted {} with {} external loads, {} seeds and {} work items in {} methods across {} parts",
                config.qualifiedClassName(), loads.size(), seedStatements.size(), steps.size(), methods.size(),
                parts.size());
        return out.toString();
    }

    /** Packs methods, in order, into parts of at most {@code classSourceBudget} characters. */
    private List<List<Method>> parts(List<Method> methods) {
        List<List<Method>> parts = new ArrayList<>();
        List<Method> current = new ArrayList<>();
        int size = 0;
        for (Method method : methods) {
            if (!current.isEmpty() && size + method.source().length() > classSourceBudget) {
                parts.add(current);
                current = new ArrayList<>();
                size = 0;
            }
            current.add(method);
            size += method.source().length();
        }
        if (!current.isEmpty()) {
            parts.add(current);
        }
        return parts;
    }

    private static void part(StringBuilder out, int n, List<Method> methods) {
        out.append('\n').append(INDENT).append("private static final class Part").append(n).append(" {\n\n")
                .append(INDENT).append(INDENT)
                .append("static void run(CellStore store, ExternalWorkbooks externals) {\n");
        for (Method method : methods) {
            out.append(INDENT).append(INDENT).append(INDENT).append(method.call()).append(";\n");
        }
        out.append(INDENT).append(INDENT).append("}\n");
        for (Method method : methods) {
            out.append(method.source());
        }
        out.append(INDENT).append("}\n");
    }

    private String singleton(FormulaCell cell) {
        CellAddress a = cell.address();
        return comment(a + ": " + cell.formula()) + "\n"
                + "store.evaluate(" + JavaLiterals.stringLiteral(a.sheet()) + ", " + a.column() + ", " + a.row()
                + ", () -> " + translator.translate(cell) + ");";
    }

    private String group(Group group) {
        LoopContext loop = LoopContext.of(group.direction());
        boolean vertical = group.direction() == GroupDirection.VERTICAL;
        CellAddress anchor = group.anchor();
        CellAddress last = group.last();
        String counter = vertical ? "r" : "c";
        String variable = loop.variable();
        String column = vertical ? Integer.toString(anchor.column()) : variable;
        String row = vertical ? variable : Integer.toString(anchor.row());
        String expression = translator.translate(group.representative(), loop);
        LOG.debug("Group {} emitted as a {}-cell loop", group.range(), group.extent());
        return comment(group.range() + " (" + group.extent() + " cells): " + group.representative().formula()) + "\n"
                + "for (int " + counter + " = " + (vertical ? anchor.row() : anchor.column()) + "; " + counter
                + " <= " + (vertical ? last.row() : last.column()) + "; " + counter + "++) {\n"
                + INDENT + "final int " + variable + " = " + counter + ";\n"
                + INDENT + "store.evaluate(" + JavaLiterals.stringLiteral(anchor.sheet()) + ", " + column + ", " + row
                + ", () -> " + expression + ");\n"
                + "}";
    }

    private void header(StringBuilder out, Collection<String> externalFiles, int parts) {
        if (!config.packageName().isEmpty()) {
            out.append("package ").append(config.packageName()).append(";\n\n");
        }
        out.append("import io.sheetcompiler.runtime.CellStore;\n")
                .append("import io.sheetcompiler.runtime.CompiledWorkbook;\n")
                .append("import io.sheetcompiler.runtime.ExcelError;\n")
                .append("import io.sheetcompiler.runtime.ExternalWorkbooks;\n")
                .append("import io.sheetcompiler.runtime.Functions;\n")
                .append("import io.sheetcompiler.runtime.Operators;\n")
                .append("import java.util.Collections;\n")
                .append("import java.util.List;\n")
                .append("import java.util.Set;\n")
                .append("import java.util.TreeSet;\n\n")
                .append("/** Generated from a workbook by sheet-compiler. Do not edit. */\n")
                .append("@SuppressWarnings(\"unused\")\n")
                .append("public final class ").append(config.className()).append(" implements CompiledWorkbook {\n\n");

        List<String> literals = externalFiles.stream().map(JavaLiterals::stringLiteral).toList();
        out.append(INDENT).append("private static final Set<String> EXTERNAL_FILES =\n")
                .append(INDENT).append(INDENT).append("Collections.unmodifiableSortedSet(new TreeSet<String>(List.of(")
                .append(String.join(", ", literals)).append(")));\n\n");

        out.append(INDENT).append("@Override\n")
                .append(INDENT).append("public Set<String> externalFiles() {\n")
                .append(INDENT).append(INDENT).append("return EXTERNAL_FILES;\n")
                .append(INDENT).append("}\n\n");

        out.append(INDENT).append("@Override\n")
                .append(INDENT).append("public void compute(CellStore store, ExternalWorkbooks externals) {\n");
        for (int n = 0; n < parts; n++) {
            out.append(INDENT).append(INDENT).append("Part").append(n).append(".run(store, externals);\n");
        }
        out.append(INDENT).append("}\n");
    }

    /** Splits {@code statements} into methods of at most {@code statementsPerMethod} each. */
    private void chunked(
            List<Method> methods, String prefix, String parameters, String arguments, List<String> statements) {
        int perMethod = config.statementsPerMethod();
        String body = INDENT + INDENT + INDENT;
        for (int from = 0, n = 0; from < statements.size(); from += perMethod, n++) {
            String name = prefix + n;
            StringBuilder out = new StringBuilder();
            out.append('\n').append(INDENT).append(INDENT).append("private static void ").append(name).append('(')
                    .append(parameters).append(") {\n");
            for (String statement : statements.subList(from, Math.min(from + perMethod, statements.size()))) {
                for (String line : statement.split("\n", -1)) {
                    out.append(body).append(line).append('\n');
                }
            }
            out.append(INDENT).append(INDENT).append("}\n");
            methods.add(new Method(name + arguments, out.toString()));
        }
    }

    /**
     * A single-line comment. Line breaks become spaces and backslashes are doubled so that no
     * unicode escape in formula text is decoded by the Java compiler.
     */
    static String comment(String text) {
        return "// " + text.replace("\\", "\\\\").replace('\r', ' ').replace('\n', ' ');
    }
}
