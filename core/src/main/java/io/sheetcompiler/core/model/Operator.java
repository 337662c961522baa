package io.sheetcompiler.core.model;

/**
 * Formula operators with their runtime counterparts in {@code io.sheetcompiler.runtime.Operators}.
 */
public enum Operator {
    ADD("+", "add"),
    SUBTRACT("-", "subtract"),
    MULTIPLY("*", "multiply"),
    DIVIDE("/", "divide"),
    POWER("^", "power"),
    CONCAT("&", "concat"),
    EQ("=", "eq"),
    NE("<>", "ne"),
    LT("<", "lt"),
    LE("<=", "le"),
    GT(">", "gt"),
    GE(">=", "ge"),
    NEGATE("-", "negate"),
    PLUS("+", "identity"),
    PERCENT("%", "percent");

    private final String symbol;
    private final String runtimeMethod;

    Operator(String symbol, String runtimeMethod) {
        this.symbol = symbol;
        this.runtimeMethod = runtimeMethod;
    }

    public String symbol() {
        return symbol;
    }

    /** Name of the static method in the runtime {@code Operators} class. */
    public String runtimeMethod() {
        return runtimeMethod;
    }
}
