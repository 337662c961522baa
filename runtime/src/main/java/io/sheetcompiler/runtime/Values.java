package io.sheetcompiler.runtime;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Locale;

/**
 * Coercion and comparison rules shared by {@link Operators} and {@link Functions}. These are
 * the places where spreadsheet semantics differ from Java's: blanks act as zero or empty text,
 * numeric text converts to numbers, booleans sort after text, and text compares
 * case-insensitively.
 */
public final class Values {

    private static final MathContext DISPLAY_PRECISION = new MathContext(15);

    private Values() {
        // utility class
    }

    /**
     * Reduces a value to a scalar. A 1x1 {@link Area} yields its only value; any larger area
     * yields {@link ExcelError#VALUE}.
     */
    public static Object scalar(Object value) {
        if (value instanceof Area area) {
            return area.rows() == 1 && area.columns() == 1 ? area.get(1, 1) : ExcelError.VALUE;
        }
        return value;
    }

    /**
     * Coerces a value to a number.
     *
     * @return a {@link Double}, or the {@link ExcelError} that prevents coercion
     */
    public static Object numberOf(Object value) {
        Object v = scalar(value);
        if (v == null) {
            return 0.0;
        }
        if (v instanceof ExcelError) {
            return v;
        }
        if (v instanceof Number n) {
            return n.doubleValue();
        }
        if (v instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        if (v instanceof String s) {
            return parseNumber(s);
        }
        return ExcelError.VALUE;
    }

    /**
     * Coerces a value to a logical.
     *
     * @return a {@link Boolean}, or the {@link ExcelError} that prevents coercion
     */
    public static Object booleanOf(Object value) {
        Object v = scalar(value);
        if (v == null) {
            return Boolean.FALSE;
        }
        if (v instanceof ExcelError || v instanceof Boolean) {
            return v;
        }
        if (v instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        if (v instanceof String s) {
            if ("TRUE".equalsIgnoreCase(s.trim())) {
                return Boolean.TRUE;
            }
            if ("FALSE".equalsIgnoreCase(s.trim())) {
                return Boolean.FALSE;
            }
        }
        return ExcelError.VALUE;
    }

    /**
     * Renders a non-error value as text the way the {@code &} operator does: blank is empty,
     * booleans are {@code TRUE}/{@code FALSE}, integral numbers have no fraction.
     */
    public static String textOf(Object value) {
        Object v = scalar(value);
        if (v == null) {
            return "";
        }
        if (v instanceof Boolean b) {
            return b ? "TRUE" : "FALSE";
        }
        if (v instanceof Number n) {
            return formatNumber(n.doubleValue());
        }
        return v.toString();
    }

    /** Formats a number with at most 15 significant digits and no trailing zeros. */
    public static String formatNumber(double d) {
        if (d == Math.rint(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return new BigDecimal(d).round(DISPLAY_PRECISION).stripTrailingZeros().toPlainString();
    }

    /** Wraps a computed double, mapping NaN and infinities to {@link ExcelError#NUM}. */
    public static Object finite(double d) {
        return Double.isNaN(d) || Double.isInfinite(d) ? ExcelError.NUM : (Object) d;
    }

    /** Returns the first {@link ExcelError} among the values, or {@code null} if there is none. */
    public static ExcelError firstError(Object... values) {
        for (Object value : values) {
            if (value instanceof ExcelError error) {
                return error;
            }
        }
        return null;
    }

    /**
     * Parses numeric text ({@code " 12.5 "}, {@code "1e3"}, {@code "50%"}).
     *
     * @return a {@link Double}, or {@link ExcelError#VALUE} if the text is not a number
     */
    public static Object parseNumber(String text) {
        String s = text.trim();
        if (s.isEmpty()) {
            return ExcelError.VALUE;
        }
        double scale = 1.0;
        if (s.endsWith("%")) {
            s = s.substring(0, s.length() - 1).trim();
            scale = 0.01;
        }
        try {
            return Double.parseDouble(s.replace(",", "")) * scale;
        } catch (NumberFormatException e) {
            return ExcelError.VALUE;
        }
    }

    /** {@code true} if the value is text that parses as a number. */
    public static boolean isNumericText(Object value) {
        return value instanceof String s && parseNumber(s) instanceof Double;
    }

    /**
     * Compares two non-error scalars using spreadsheet ordering: numbers before text before
     * logicals, text case-insensitive. A blank takes the empty value of the other operand's type.
     */
    public static int compare(Object left, Object right) {
        Object a = left == null ? blankLike(right) : left;
        Object b = right == null ? blankLike(left) : right;
        int rankA = rank(a);
        int rankB = rank(b);
        if (rankA != rankB) {
            return Integer.compare(rankA, rankB);
        }
        if (a instanceof Number x && b instanceof Number y) {
            return Double.compare(x.doubleValue(), y.doubleValue());
        }
        if (a instanceof Boolean x && b instanceof Boolean y) {
            return Boolean.compare(x, y);
        }
        return a.toString().toLowerCase(Locale.ROOT).compareTo(b.toString().toLowerCase(Locale.ROOT));
    }

    /** Spreadsheet equality for lookups: numbers numerically, text case-insensitively. */
    public static boolean looselyEquals(Object left, Object right) {
        if (left == null || right == null) {
            return left == null && right == null;
        }
        if (left instanceof ExcelError || right instanceof ExcelError) {
            return left == right;
        }
        return rank(left) == rank(right) && compare(left, right) == 0;
    }

    private static Object blankLike(Object other) {
        if (other instanceof String) {
            return "";
        }
        if (other instanceof Boolean) {
            return Boolean.FALSE;
        }
        return 0.0;
    }

    private static int rank(Object v) {
        if (v instanceof Number) {
            return 0;
        }
        if (v instanceof Boolean) {
            return 2;
        }
        return 1;
    }
}
