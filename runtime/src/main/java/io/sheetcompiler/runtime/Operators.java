package io.sheetcompiler.runtime;

import java.util.function.DoubleBinaryOperator;
import java.util.function.IntPredicate;

/**
 * Spreadsheet operators, called by generated programs in place of Java's own. Every operator
 * accepts any cell value, propagates the leftmost {@link ExcelError}, and returns an error value
 * instead of throwing: division by zero is {@link ExcelError#DIV_ZERO}, non-numeric text in
 * arithmetic is {@link ExcelError#VALUE}, and non-finite results are {@link ExcelError#NUM}.
 */
public final class Operators {

    private Operators() {
        // utility class
    }

    public static Object add(Object left, Object right) {
        return arithmetic(left, right, Double::sum);
    }

    public static Object subtract(Object left, Object right) {
        return arithmetic(left, right, (a, b) -> a - b);
    }

    public static Object multiply(Object left, Object right) {
        return arithmetic(left, right, (a, b) -> a * b);
    }

    public static Object divide(Object left, Object right) {
        Object a = Values.numberOf(left);
        if (a instanceof ExcelError) {
            return a;
        }
        Object b = Values.numberOf(right);
        if (b instanceof ExcelError) {
            return b;
        }
        double divisor = (Double) b;
        if (divisor == 0.0) {
            return ExcelError.DIV_ZERO;
        }
        return Values.finite((Double) a / divisor);
    }

    public static Object power(Object left, Object right) {
        Object a = Values.numberOf(left);
        if (a instanceof ExcelError) {
            return a;
        }
        Object b = Values.numberOf(right);
        if (b instanceof ExcelError) {
            return b;
        }
        double base = (Double) a;
        double exponent = (Double) b;
        if (base == 0.0 && exponent == 0.0) {
            return ExcelError.NUM;
        }
        if (base == 0.0 && exponent < 0.0) {
            return ExcelError.DIV_ZERO;
        }
        return Values.finite(Math.pow(base, exponent));
    }

    public static Object negate(Object operand) {
        Object a = Values.numberOf(operand);
        return a instanceof ExcelError ? a : (Object) (-(Double) a);
    }

    /** Unary plus returns its operand unchanged, as the spreadsheet does. */
    public static Object identity(Object operand) {
        return Values.scalar(operand);
    }

    /** Postfix {@code %}. */
    public static Object percent(Object operand) {
        Object a = Values.numberOf(operand);
        return a instanceof ExcelError ? a : (Object) ((Double) a / 100.0);
    }

    /** The {@code &} operator. */
    public static Object concat(Object left, Object right) {
        Object a = Values.scalar(left);
        Object b = Values.scalar(right);
        ExcelError error = Values.firstError(a, b);
        if (error != null) {
            return error;
        }
        return Values.textOf(a) + Values.textOf(b);
    }

    public static Object eq(Object left, Object right) {
        return comparison(left, right, c -> c == 0);
    }

    public static Object ne(Object left, Object right) {
        return comparison(left, right, c -> c != 0);
    }

    public static Object lt(Object left, Object right) {
        return comparison(left, right, c -> c < 0);
    }

    public static Object le(Object left, Object right) {
        return comparison(left, right, c -> c <= 0);
    }

    public static Object gt(Object left, Object right) {
        return comparison(left, right, c -> c > 0);
    }

    public static Object ge(Object left, Object right) {
        return comparison(left, right, c -> c >= 0);
    }

    private static Object arithmetic(Object left, Object right, DoubleBinaryOperator op) {
        Object a = Values.numberOf(left);
        if (a instanceof ExcelError) {
            return a;
        }
        Object b = Values.numberOf(right);
        if (b instanceof ExcelError) {
            return b;
        }
        return Values.finite(op.applyAsDouble((Double) a, (Double) b));
    }

    private static Object comparison(Object left, Object right, IntPredicate outcome) {
        Object a = Values.scalar(left);
        Object b = Values.scalar(right);
        ExcelError error = Values.firstError(a, b);
        if (error != null) {
            return error;
        }
        return outcome.test(Values.compare(a, b));
    }
}
