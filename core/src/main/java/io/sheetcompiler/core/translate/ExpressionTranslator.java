package io.sheetcompiler.core.translate;

import io.sheetcompiler.core.error.UnsupportedFunctionException;
import io.sheetcompiler.core.model.AxisMode;
import io.sheetcompiler.core.model.Cell.FormulaCell;
import io.sheetcompiler.core.model.CellAddress;
import io.sheetcompiler.core.model.FormulaNode;
import io.sheetcompiler.core.model.FormulaNode.Binary;
import io.sheetcompiler.core.model.FormulaNode.BooleanLiteral;
import io.sheetcompiler.core.model.FormulaNode.ErrorLiteral;
import io.sheetcompiler.core.model.FormulaNode.FunctionCall;
import io.sheetcompiler.core.model.FormulaNode.NumberLiteral;
import io.sheetcompiler.core.model.FormulaNode.Omitted;
import io.sheetcompiler.core.model.FormulaNode.ReferenceSlot;
import io.sheetcompiler.core.model.FormulaNode.TextLiteral;
import io.sheetcompiler.core.model.FormulaNode.Unary;
import io.sheetcompiler.core.model.GroupDirection;
import io.sheetcompiler.core.model.Reference;
import io.sheetcompiler.core.model.Reference.Coordinate;
import io.sheetcompiler.runtime.ExcelError;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders a parsed formula as a Java expression over the runtime library.
 *
 * <p>
 * Cell reads become {@code store.get(sheet, column, row)}, ranges become
 * {@code store.range(...)}, operators and functions become calls on {@code Operators} and
 * {@code Functions}. Inside a group loop, relative coordinates along the loop axis are
 * rendered against the loop variable instead of the representative's position.
 */
public final class ExpressionTranslator {

    /** Name of the cell store parameter in generated code. */
    public static final String STORE = "store";

    /**
     * The loop a group expression is emitted in.
     *
     * @param direction the axis the loop walks
     * @param variable  the {@code int} variable holding the current row or column
     */
    public record LoopContext(GroupDirection direction, String variable) {
        public LoopContext {
            Objects.requireNonNull(direction, "direction");
            Objects.requireNonNull(variable, "variable");
        }

        public static LoopContext of(GroupDirection direction) {
            return new LoopContext(direction, direction == GroupDirection.VERTICAL ? "row" : "col");
        }
    }

    /** Translates a formula evaluated at its own address. */
    public String translate(FormulaCell cell) {
        return translate(cell, null);
    }

    /**
     * Translates a formula; with a loop context, the cell is the group's representative and
     * the result is valid for every member.
     *
     * @throws UnsupportedFunctionException if the formula calls a function outside {@link FunctionTable}
     */
    public String translate(FormulaCell cell, LoopContext loop) {
        return new Rendering(cell, loop).render(cell.expression());
    }

    /** The owner's row or column along an axis, as a Java {@code int} expression. */
    static String position(CellAddress owner, LoopContext loop, boolean columnAxis) {
        if (loop != null && axisFollowsLoop(loop, columnAxis)) {
            return loop.variable();
        }
        return Integer.toString(columnAxis ? owner.column() : owner.row());
    }

    private static boolean axisFollowsLoop(LoopContext loop, boolean columnAxis) {
        return columnAxis ? loop.direction() == GroupDirection.HORIZONTAL : loop.direction() == GroupDirection.VERTICAL;
    }

    private static final class Rendering {

        private final FormulaCell cell;
        private final LoopContext loop;

        Rendering(FormulaCell cell, LoopContext loop) {
            this.cell = cell;
            this.loop = loop;
        }

        String render(FormulaNode node) {
            if (node instanceof NumberLiteral n) {
                return JavaLiterals.doubleLiteral(n.value());
            }
            if (node instanceof TextLiteral t) {
                return JavaLiterals.stringLiteral(t.value());
            }
            if (node instanceof BooleanLiteral b) {
                return Boolean.toString(b.value());
            }
            if (node instanceof ErrorLiteral e) {
                return error(e.code());
            }
            if (node instanceof ReferenceSlot slot) {
                return reference(cell.references().get(slot.index()), false);
            }
            if (node instanceof Unary u) {
                return "Operators." + u.operator().runtimeMethod() + "(" + render(u.operand()) + ")";
            }
            if (node instanceof Binary b) {
                return "Operators." + b.operator().runtimeMethod() + "(" + render(b.left()) + ", "
                        + render(b.right()) + ")";
            }
            if (node instanceof FunctionCall call) {
                return call(call);
            }
            return "(Object) null";
        }

        private String call(FunctionCall call) {
            FunctionTable.Entry entry = FunctionTable.lookup(call.name())
                    .orElseThrow(() -> new UnsupportedFunctionException(call.name(), cell.address(), cell.formula()));
            if (entry.kind() == FunctionTable.Kind.POSITION) {
                return "Functions." + entry.javaMethod() + "(" + positionArgument(entry, call) + ")";
            }
            List<String> arguments = new ArrayList<>(call.arguments().size());
            for (FormulaNode argument : call.arguments()) {
                if (entry.rangeArguments() && argument instanceof ReferenceSlot slot) {
                    arguments.add(reference(cell.references().get(slot.index()), true));
                } else {
                    arguments.add(render(argument));
                }
            }
            return "Functions." + entry.javaMethod() + "(" + String.join(", ", arguments) + ")";
        }

        /** ROW() and COLUMN() are resolved here; with a reference, its first row or column. */
        private String positionArgument(FunctionTable.Entry entry, FunctionCall call) {
            boolean columnAxis = "COLUMN".equals(entry.name());
            if (call.arguments().isEmpty() || call.arguments().get(0) instanceof Omitted) {
                return position(cell.address(), loop, columnAxis);
            }
            if (call.arguments().get(0) instanceof ReferenceSlot slot) {
                Coordinate first = cell.references().get(slot.index()).first();
                return columnAxis
                        ? axis(first.column(), first.columnMode(), cell.address().column(), true)
                        : axis(first.row(), first.rowMode(), cell.address().row(), false);
            }
            throw new UnsupportedFunctionException(
                    entry.name() + " with a non-reference argument", cell.address(), cell.formula());
        }

        private String reference(Reference reference, boolean asRange) {
            String sheet = JavaLiterals.stringLiteral(reference.storeSheet());
            Coordinate first = reference.first();
            if (!reference.isRange() && !asRange) {
                return STORE + ".get(" + sheet + ", " + column(first) + ", " + row(first) + ")";
            }
            Coordinate last = reference.lastOrFirst();
            return STORE + ".range(" + sheet + ", " + column(first) + ", " + row(first) + ", " + column(last) + ", "
                    + row(last) + ")";
        }

        private String column(Coordinate coordinate) {
            return axis(coordinate.column(), coordinate.columnMode(), cell.address().column(), true);
        }

        private String row(Coordinate coordinate) {
            return axis(coordinate.row(), coordinate.rowMode(), cell.address().row(), false);
        }

        private String axis(int target, AxisMode mode, int owner, boolean columnAxis) {
            if (mode == AxisMode.ABSOLUTE || loop == null || !axisFollowsLoop(loop, columnAxis)) {
                return Integer.toString(target);
            }
            int delta = target - owner;
            if (delta == 0) {
                return loop.variable();
            }
            return delta > 0 ? loop.variable() + " + " + delta : loop.variable() + " - " + (-delta);
        }

        private static String error(String code) {
            ExcelError error = ExcelError.fromCode(code)
                    .orElseThrow(() -> new IllegalArgumentException("unknown error literal " + code));
            return "ExcelError." + error.name();
        }
    }
}
