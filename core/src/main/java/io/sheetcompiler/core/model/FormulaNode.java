package io.sheetcompiler.core.model;

import java.util.List;
import java.util.Objects;

/** Parsed expression tree of a formula. References are slots into the formula's reference list. */
public sealed interface FormulaNode {

    record NumberLiteral(double value) implements FormulaNode {}

    record TextLiteral(String value) implements FormulaNode {
        public TextLiteral {
            Objects.requireNonNull(value, "value");
        }
    }

    record BooleanLiteral(boolean value) implements FormulaNode {}

    /** An error constant such as {@code #N/A}, kept as its spreadsheet code. */
    record ErrorLiteral(String code) implements FormulaNode {}

    /** The {@code index}-th reference of the owning formula. */
    record ReferenceSlot(int index) implements FormulaNode {}

    record Unary(Operator operator, FormulaNode operand) implements FormulaNode {}

    record Binary(Operator operator, FormulaNode left, FormulaNode right) implements FormulaNode {}

    /** A function call; {@code name} is upper-case without {@code _xlfn.} prefixes. */
    record FunctionCall(String name, List<FormulaNode> arguments) implements FormulaNode {
        public FunctionCall {
            arguments = List.copyOf(arguments);
        }
    }

    /** An argument left empty, as in {@code IF(A1,,0)}. */
    record Omitted() implements FormulaNode {}
}
