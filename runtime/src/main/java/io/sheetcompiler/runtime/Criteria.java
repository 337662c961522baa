package io.sheetcompiler.runtime;

import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Parses spreadsheet criteria as used by SUMIF, COUNTIF and friends: {@code ">5"},
 * {@code "<=x"}, {@code "<>"}, {@code "=apple"}, {@code "a*"}, or a plain number, text or
 * logical. Text matching is case-insensitive and supports the {@code *}, {@code ?} and
 * {@code ~} wildcards.
 */
public final class Criteria {

    private static final String[] OPERATORS = {"<>", ">=", "<=", "=", ">", "<"};

    private Criteria() {
        // utility class
    }

    /**
     * Builds a predicate over cell values for a criterion.
     *
     * @param criterion the criterion argument (a scalar, or a 1x1 area)
     * @return a predicate that accepts the matching cell values
     */
    public static Predicate<Object> parse(Object criterion) {
        Object c = Values.scalar(criterion);
        if (c == null) {
            return v -> v == null || "".equals(v);
        }
        if (c instanceof ExcelError error) {
            return v -> v == error;
        }
        if (c instanceof Number n) {
            double target = n.doubleValue();
            return v -> numericValue(v) != null && numericValue(v) == target;
        }
        if (c instanceof Boolean b) {
            return v -> b.equals(v);
        }
        String text = c.toString();
        for (String op : OPERATORS) {
            if (text.startsWith(op)) {
                return withOperator(op, text.substring(op.length()));
            }
        }
        return withOperator("=", text);
    }

    /**
     * Compiles a wildcard pattern ({@code *}, {@code ?}, {@code ~} escape) into a
     * case-insensitive regular expression matching the whole text.
     */
    public static Pattern wildcard(String pattern) {
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < pattern.length(); i++) {
            char ch = pattern.charAt(i);
            if (ch == '~' && i + 1 < pattern.length()) {
                regex.append(Pattern.quote(String.valueOf(pattern.charAt(++i))));
            } else if (ch == '*') {
                regex.append(".*");
            } else if (ch == '?') {
                regex.append('.');
            } else {
                regex.append(Pattern.quote(String.valueOf(ch)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    }

    private static Predicate<Object> withOperator(String op, String operand) {
        if (operand.isEmpty()) {
            Predicate<Object> blank = v -> v == null || "".equals(v);
            return switch (op) {
                case "=" -> blank;
                case "<>" -> blank.negate();
                default -> v -> false;
            };
        }
        Object number = Values.parseNumber(operand);
        if (number instanceof Double target) {
            return numeric(op, target);
        }
        if ("TRUE".equalsIgnoreCase(operand) || "FALSE".equalsIgnoreCase(operand)) {
            Boolean target = Boolean.valueOf(operand.toUpperCase(Locale.ROOT).equals("TRUE"));
            return switch (op) {
                case "=" -> target::equals;
                case "<>" -> v -> !target.equals(v);
                default -> v -> v instanceof Boolean && compareWith(op, Values.compare(v, target));
            };
        }
        return textual(op, operand);
    }

    private static Predicate<Object> numeric(String op, double target) {
        return switch (op) {
            case "=" -> v -> numericValue(v) != null && numericValue(v) == target;
            case "<>" -> v -> numericValue(v) == null || numericValue(v) != target;
            default -> v -> v instanceof Number n && compareWith(op, Double.compare(n.doubleValue(), target));
        };
    }

    private static Predicate<Object> textual(String op, String operand) {
        Pattern pattern = wildcard(operand);
        return switch (op) {
            case "=" -> v -> v instanceof String s && pattern.matcher(s).matches();
            case "<>" -> v -> !(v instanceof String s && pattern.matcher(s).matches());
            default -> v -> v instanceof String s
                    && compareWith(op, s.toLowerCase(Locale.ROOT).compareTo(operand.toLowerCase(Locale.ROOT)));
        };
    }

    private static boolean compareWith(String op, int comparison) {
        return switch (op) {
            case ">" -> comparison > 0;
            case ">=" -> comparison >= 0;
            case "<" -> comparison < 0;
            case "<=" -> comparison <= 0;
            default -> throw new IllegalArgumentException("not an ordering operator: " + op);
        };
    }

    private static Double numericValue(Object v) {
        if (v instanceof Number n) {
            return n.doubleValue();
        }
        if (v instanceof String s && Values.parseNumber(s) instanceof Double d) {
            return d;
        }
        return null;
    }
}
