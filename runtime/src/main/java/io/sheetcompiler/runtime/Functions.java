package io.sheetcompiler.runtime;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.function.BiFunction;
import java.util.function.DoubleConsumer;
import java.util.function.DoubleFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The spreadsheet function library that generated programs call. Each public method
 * implements one spreadsheet function; the compiler's function table maps spreadsheet names
 * to these methods and checks arity before emitting a call.
 *
 * <p>Conventions shared by every function:
 *
 * <ul>
 *   <li>Arguments are raw cell values or {@link Area}s. A single-cell reference passed where a
 *       function accepts ranges arrives as a 1x1 area.
 *   <li>Errors are returned, never thrown. The first {@link ExcelError} among the arguments
 *       propagates unless the function exists to inspect errors (IFERROR, ISERROR, ...).
 *   <li>Aggregates ignore text, logicals and blanks inside areas but coerce direct scalar
 *       arguments, so {@code SUM("3", 4)} is 7 while a range holding {@code "3"} adds nothing.
 *   <li>Positions are 1-based.
 * </ul>
 */
public final class Functions {

    private Functions() {
        // utility class
    }

    // ---------------------------------------------------------------- aggregation

    public static Object sum(Object... args) {
        List<Double> xs = new ArrayList<>();
        ExcelError error = numbers(args, xs::add);
        if (error != null) {
            return error;
        }
        double total = 0.0;
        for (double x : xs) {
            total += x;
        }
        return Values.finite(total);
    }

    public static Object average(Object... args) {
        List<Double> xs = new ArrayList<>();
        ExcelError error = numbers(args, xs::add);
        if (error != null) {
            return error;
        }
        return xs.isEmpty() ? ExcelError.DIV_ZERO : Values.finite(mean(xs));
    }

    /** Counts numbers; direct arguments count when they coerce to a number, errors never count. */
    public static Object count(Object... args) {
        int n = 0;
        for (Object arg : args) {
            if (arg instanceof Area area) {
                for (Object v : area.values()) {
                    if (v instanceof Number) {
                        n++;
                    }
                }
            } else if (arg instanceof Number || arg instanceof Boolean || Values.isNumericText(arg)) {
                n++;
            }
        }
        return (double) n;
    }

    /** Counts non-blank values, errors included. */
    public static Object counta(Object... args) {
        int n = 0;
        for (Object arg : args) {
            if (arg instanceof Area area) {
                for (Object v : area.values()) {
                    if (v != null) {
                        n++;
                    }
                }
            } else if (arg != null) {
                n++;
            }
        }
        return (double) n;
    }

    /** Counts blank cells; empty text counts as blank. */
    public static Object countblank(Object range) {
        int n = 0;
        for (Object v : asArea(range).values()) {
            if (v == null || "".equals(v)) {
                n++;
            }
        }
        return (double) n;
    }

    public static Object min(Object... args) {
        List<Double> xs = new ArrayList<>();
        ExcelError error = numbers(args, xs::add);
        if (error != null) {
            return error;
        }
        return xs.isEmpty() ? 0.0 : Collections.min(xs);
    }

    public static Object max(Object... args) {
        List<Double> xs = new ArrayList<>();
        ExcelError error = numbers(args, xs::add);
        if (error != null) {
            return error;
        }
        return xs.isEmpty() ? 0.0 : Collections.max(xs);
    }

    public static Object median(Object... args) {
        List<Double> xs = new ArrayList<>();
        ExcelError error = numbers(args, xs::add);
        if (error != null) {
            return error;
        }
        if (xs.isEmpty()) {
            return ExcelError.NUM;
        }
        Collections.sort(xs);
        int mid = xs.size() / 2;
        return xs.size() % 2 == 1 ? xs.get(mid) : (xs.get(mid - 1) + xs.get(mid)) / 2.0;
    }

    public static Object product(Object... args) {
        List<Double> xs = new ArrayList<>();
        ExcelError error = numbers(args, xs::add);
        if (error != null) {
            return error;
        }
        if (xs.isEmpty()) {
            return 0.0;
        }
        double p = 1.0;
        for (double x : xs) {
            p *= x;
        }
        return Values.finite(p);
    }

    /** k-th largest number, k starting at 1. */
    public static Object large(Object array, Object k) {
        return kth(array, k, true);
    }

    /** k-th smallest number, k starting at 1. */
    public static Object small(Object array, Object k) {
        return kth(array, k, false);
    }

    /** Sum of element-wise products; all arrays must share dimensions, non-numbers count as 0. */
    public static Object sumproduct(Object... arrays) {
        List<Area> areas = new ArrayList<>();
        for (Object array : arrays) {
            if (array instanceof ExcelError) {
                return array;
            }
            areas.add(asArea(array));
        }
        Area first = areas.get(0);
        for (Area area : areas) {
            if (area.rows() != first.rows() || area.columns() != first.columns()) {
                return ExcelError.VALUE;
            }
        }
        double total = 0.0;
        for (int i = 0; i < first.values().size(); i++) {
            double p = 1.0;
            for (Area area : areas) {
                Object v = area.values().get(i);
                if (v instanceof ExcelError) {
                    return v;
                }
                p *= v instanceof Number n ? n.doubleValue() : 0.0;
            }
            total += p;
        }
        return Values.finite(total);
    }

    // ---------------------------------------------------------------- conditional aggregation

    public static Object sumif(Object range, Object criterion) {
        return sumif(range, criterion, range);
    }

    /**
     * Sums {@code sumRange} cells at the positions where {@code range} matches the criterion.
     * Positions outside {@code sumRange} are skipped.
     */
    public static Object sumif(Object range, Object criterion, Object sumRange) {
        Area tested = asArea(range);
        Area summed = asArea(sumRange);
        Predicate<Object> test = Criteria.parse(criterion);
        double total = 0.0;
        for (int r = 1; r <= tested.rows(); r++) {
            for (int c = 1; c <= tested.columns(); c++) {
                if (r > summed.rows() || c > summed.columns() || !test.test(tested.get(r, c))) {
                    continue;
                }
                Object v = summed.get(r, c);
                if (v instanceof ExcelError) {
                    return v;
                }
                if (v instanceof Number n) {
                    total += n.doubleValue();
                }
            }
        }
        return Values.finite(total);
    }

    public static Object sumifs(Object sumRange, Object... rangeCriteria) {
        return conditional(sumRange, rangeCriteria, xs -> {
            double total = 0.0;
            for (double x : xs) {
                total += x;
            }
            return Values.finite(total);
        });
    }

    public static Object countif(Object range, Object criterion) {
        return countifs(range, criterion);
    }

    public static Object countifs(Object... rangeCriteria) {
        Object selection = select(rangeCriteria);
        if (selection instanceof ExcelError) {
            return selection;
        }
        int n = 0;
        for (boolean selected : ((Selection) selection).selected()) {
            if (selected) {
                n++;
            }
        }
        return (double) n;
    }

    public static Object averageif(Object range, Object criterion) {
        return averageif(range, criterion, range);
    }

    public static Object averageif(Object range, Object criterion, Object averageRange) {
        return averageifs(averageRange, range, criterion);
    }

    public static Object averageifs(Object averageRange, Object... rangeCriteria) {
        return conditional(averageRange, rangeCriteria,
                xs -> xs.isEmpty() ? ExcelError.DIV_ZERO : Values.finite(mean(xs)));
    }

    public static Object maxifs(Object maxRange, Object... rangeCriteria) {
        return conditional(maxRange, rangeCriteria, xs -> xs.isEmpty() ? 0.0 : Collections.max(xs));
    }

    public static Object minifs(Object minRange, Object... rangeCriteria) {
        return conditional(minRange, rangeCriteria, xs -> xs.isEmpty() ? 0.0 : Collections.min(xs));
    }

    // ---------------------------------------------------------------- logical

    public static Object ifElse(Object condition, Object whenTrue) {
        return ifElse(condition, whenTrue, Boolean.FALSE);
    }

    public static Object ifElse(Object condition, Object whenTrue, Object whenFalse) {
        Object test = Values.booleanOf(condition);
        if (test instanceof ExcelError) {
            return test;
        }
        return (Boolean) test ? whenTrue : whenFalse;
    }

    public static Object and(Object... args) {
        return logical(args, (all, any) -> all);
    }

    public static Object or(Object... args) {
        return logical(args, (all, any) -> any);
    }

    public static Object xor(Object... args) {
        List<Boolean> flags = new ArrayList<>();
        ExcelError error = logicals(args, flags);
        if (error != null) {
            return error;
        }
        if (flags.isEmpty()) {
            return ExcelError.VALUE;
        }
        return flags.stream().filter(Boolean::booleanValue).count() % 2 == 1;
    }

    public static Object not(Object value) {
        Object b = Values.booleanOf(value);
        return b instanceof ExcelError ? b : (Object) !(Boolean) b;
    }

    public static Object iferror(Object value, Object fallback) {
        Object v = Values.scalar(value);
        return v instanceof ExcelError ? fallback : v;
    }

    public static Object ifna(Object value, Object fallback) {
        Object v = Values.scalar(value);
        return v == ExcelError.NA ? fallback : v;
    }

    public static Object isblank(Object value) {
        return Values.scalar(value) == null;
    }

    public static Object iserror(Object value) {
        return Values.scalar(value) instanceof ExcelError;
    }

    public static Object isna(Object value) {
        return Values.scalar(value) == ExcelError.NA;
    }

    public static Object isnumber(Object value) {
        return Values.scalar(value) instanceof Number;
    }

    public static Object istext(Object value) {
        return Values.scalar(value) instanceof String;
    }

    public static Object na() {
        return ExcelError.NA;
    }

    public static Object trueValue() {
        return Boolean.TRUE;
    }

    public static Object falseValue() {
        return Boolean.FALSE;
    }

    // ---------------------------------------------------------------- math

    public static Object abs(Object number) {
        return unary(number, Math::abs);
    }

    public static Object sign(Object number) {
        return unary(number, Math::signum);
    }

    /** Rounds half away from zero, as the spreadsheet does (not banker's rounding). */
    public static Object round(Object number, Object digits) {
        return rounded(number, digits, RoundingMode.HALF_UP);
    }

    public static Object roundup(Object number, Object digits) {
        return rounded(number, digits, RoundingMode.UP);
    }

    public static Object rounddown(Object number, Object digits) {
        return rounded(number, digits, RoundingMode.DOWN);
    }

    /** INT: rounds down to the nearest integer, so {@code INT(-1.5)} is -2. */
    public static Object integer(Object number) {
        return unary(number, Math::floor);
    }

    public static Object trunc(Object number) {
        return rounddown(number, 0.0);
    }

    public static Object trunc(Object number, Object digits) {
        return rounddown(number, digits);
    }

    /** Remainder with the sign of the divisor. */
    public static Object mod(Object number, Object divisor) {
        return binary(number, divisor, (n, d) -> d == 0.0 ? ExcelError.DIV_ZERO : Values.finite(n - d * Math.floor(n / d)));
    }

    public static Object power(Object number, Object exponent) {
        return Operators.power(number, exponent);
    }

    public static Object sqrt(Object number) {
        return unary(number, x -> x < 0 ? ExcelError.NUM : Values.finite(Math.sqrt(x)));
    }

    public static Object exp(Object number) {
        return unary(number, x -> Values.finite(Math.exp(x)));
    }

    public static Object ln(Object number) {
        return unary(number, x -> x <= 0 ? ExcelError.NUM : Values.finite(Math.log(x)));
    }

    public static Object log(Object number) {
        return log(number, 10.0);
    }

    public static Object log(Object number, Object base) {
        return binary(number, base, (x, b) -> {
            if (x <= 0 || b <= 0) {
                return ExcelError.NUM;
            }
            return b == 1.0 ? ExcelError.DIV_ZERO : Values.finite(Math.log(x) / Math.log(b));
        });
    }

    public static Object log10(Object number) {
        return unary(number, x -> x <= 0 ? ExcelError.NUM : Values.finite(Math.log10(x)));
    }

    public static Object ceiling(Object number) {
        return ceiling(number, 1.0);
    }

    public static Object ceiling(Object number, Object significance) {
        return binary(number, significance, (x, s) -> {
            if (s == 0.0) {
                return 0.0;
            }
            if (x > 0 && s < 0) {
                return ExcelError.NUM;
            }
            return multiple(Math.ceil(snap(x / s)), s);
        });
    }

    public static Object floor(Object number) {
        return floor(number, 1.0);
    }

    public static Object floor(Object number, Object significance) {
        return binary(number, significance, (x, s) -> {
            if (s == 0.0) {
                return ExcelError.DIV_ZERO;
            }
            if (x > 0 && s < 0) {
                return ExcelError.NUM;
            }
            return multiple(Math.floor(snap(x / s)), s);
        });
    }

    public static Object pi() {
        return Math.PI;
    }

    // ---------------------------------------------------------------- text

    public static Object len(Object text) {
        Object s = text(text);
        return s instanceof ExcelError ? s : (Object) (double) ((String) s).length();
    }

    public static Object left(Object text) {
        return left(text, 1.0);
    }

    public static Object left(Object text, Object count) {
        return substring(text, count, (s, n) -> s.substring(0, Math.min(n, s.length())));
    }

    public static Object right(Object text) {
        return right(text, 1.0);
    }

    public static Object right(Object text, Object count) {
        return substring(text, count, (s, n) -> s.substring(Math.max(0, s.length() - n)));
    }

    public static Object mid(Object text, Object start, Object count) {
        Object from = Values.numberOf(start);
        if (from instanceof ExcelError) {
            return from;
        }
        int begin = (int) Math.floor((Double) from);
        if (begin < 1) {
            return ExcelError.VALUE;
        }
        return substring(text, count, (s, n) -> {
            int b = Math.min(begin - 1, s.length());
            return s.substring(b, Math.min(s.length(), b + n));
        });
    }

    public static Object upper(Object text) {
        Object s = text(text);
        return s instanceof ExcelError ? s : ((String) s).toUpperCase(Locale.ROOT);
    }

    public static Object lower(Object text) {
        Object s = text(text);
        return s instanceof ExcelError ? s : ((String) s).toLowerCase(Locale.ROOT);
    }

    /** Strips leading and trailing spaces and collapses inner runs of spaces to one. */
    public static Object trim(Object text) {
        Object s = text(text);
        return s instanceof ExcelError ? s : ((String) s).trim().replaceAll(" +", " ");
    }

    public static Object concatenate(Object... parts) {
        StringBuilder out = new StringBuilder();
        for (Object part : parts) {
            Object s = text(part);
            if (s instanceof ExcelError) {
                return s;
            }
            out.append(s);
        }
        return out.toString();
    }

    /** CONCAT: like CONCATENATE but also accepts ranges, joined row by row. */
    public static Object concatAll(Object... parts) {
        StringBuilder out = new StringBuilder();
        for (Object part : parts) {
            List<Object> values = part instanceof Area area ? area.values() : Collections.singletonList(part);
            for (Object v : values) {
                if (v instanceof ExcelError) {
                    return v;
                }
                out.append(Values.textOf(v));
            }
        }
        return out.toString();
    }

    /** Case-sensitive comparison. */
    public static Object exact(Object left, Object right) {
        Object a = text(left);
        Object b = text(right);
        ExcelError error = Values.firstError(a, b);
        return error != null ? error : (Object) a.equals(b);
    }

    public static Object rept(Object text, Object times) {
        Object s = text(text);
        Object n = Values.numberOf(times);
        ExcelError error = Values.firstError(s, n);
        if (error != null) {
            return error;
        }
        int count = (int) Math.floor((Double) n);
        return count < 0 ? ExcelError.VALUE : ((String) s).repeat(count);
    }

    public static Object find(Object needle, Object haystack) {
        return find(needle, haystack, 1.0);
    }

    /** Case-sensitive position of {@code needle}, 1-based; {@code #VALUE!} when absent. */
    public static Object find(Object needle, Object haystack, Object start) {
        return locate(needle, haystack, start, (n, h, from) -> {
            int at = h.indexOf(n, from);
            return at < 0 ? -1 : at;
        });
    }

    public static Object search(Object needle, Object haystack) {
        return search(needle, haystack, 1.0);
    }

    /** Case-insensitive, wildcard-aware position of {@code needle}, 1-based. */
    public static Object search(Object needle, Object haystack, Object start) {
        return locate(needle, haystack, start, (n, h, from) -> {
            Matcher m = Criteria.wildcard(n).matcher(h);
            return m.find(from) ? m.start() : -1;
        });
    }

    public static Object substitute(Object text, Object oldText, Object newText) {
        Object s = text(text);
        Object o = text(oldText);
        Object n = text(newText);
        ExcelError error = Values.firstError(s, o, n);
        if (error != null) {
            return error;
        }
        return ((String) o).isEmpty() ? s : ((String) s).replace((String) o, (String) n);
    }

    /** Replaces only the {@code instance}-th occurrence (1-based). */
    public static Object substitute(Object text, Object oldText, Object newText, Object instance) {
        Object s = text(text);
        Object o = text(oldText);
        Object n = text(newText);
        Object i = Values.numberOf(instance);
        ExcelError error = Values.firstError(s, o, n, i);
        if (error != null) {
            return error;
        }
        int wanted = (int) Math.floor((Double) i);
        if (wanted < 1) {
            return ExcelError.VALUE;
        }
        String str = (String) s;
        String old = (String) o;
        if (old.isEmpty()) {
            return str;
        }
        int at = -1;
        for (int k = 0; k < wanted; k++) {
            at = str.indexOf(old, at + 1);
            if (at < 0) {
                return str;
            }
        }
        return str.substring(0, at) + n + str.substring(at + old.length());
    }

    /** Converts numeric text to a number. */
    public static Object value(Object text) {
        Object v = Values.scalar(text);
        if (v instanceof ExcelError || v instanceof Number) {
            return v instanceof Number n ? (Object) n.doubleValue() : v;
        }
        if (v == null) {
            return 0.0;
        }
        return v instanceof String s ? Values.parseNumber(s) : ExcelError.VALUE;
    }

    // ---------------------------------------------------------------- lookup

    public static Object vlookup(Object value, Object table, Object columnIndex) {
        return vlookup(value, table, columnIndex, Boolean.TRUE);
    }

    /**
     * Looks {@code value} up in the first column of {@code table} and returns the cell in
     * column {@code columnIndex} (1-based) of the matching row.
     *
     * @param approximate when true, the first column is assumed ascending and the last row not
     *     greater than {@code value} matches; when false, the first equal row matches
     */
    public static Object vlookup(Object value, Object table, Object columnIndex, Object approximate) {
        Area area = asArea(table);
        return tableLookup(value, area.column(1), columnIndex, approximate, area.columns(),
                (row, col) -> area.get(row, col));
    }

    public static Object hlookup(Object value, Object table, Object rowIndex) {
        return hlookup(value, table, rowIndex, Boolean.TRUE);
    }

    /** Row-wise counterpart of {@link #vlookup(Object, Object, Object, Object)}. */
    public static Object hlookup(Object value, Object table, Object rowIndex, Object approximate) {
        Area area = asArea(table);
        return tableLookup(value, area.row(1), rowIndex, approximate, area.rows(),
                (col, row) -> area.get(row, col));
    }

    public static Object index(Object array, Object position) {
        Area area = asArea(array);
        return area.rows() == 1 ? index(area, 1.0, position) : index(area, position, 1.0);
    }

    /**
     * Returns the value at a 1-based position. A zero row or column selects the whole column
     * or row as an area.
     */
    public static Object index(Object array, Object row, Object column) {
        Object r = Values.numberOf(row);
        Object c = Values.numberOf(column);
        ExcelError error = Values.firstError(r, c);
        if (error != null) {
            return error;
        }
        Area area = asArea(array);
        int ri = (int) Math.floor((Double) r);
        int ci = (int) Math.floor((Double) c);
        if (ri < 0 || ci < 0) {
            return ExcelError.VALUE;
        }
        if (ri > area.rows() || ci > area.columns()) {
            return ExcelError.REF;
        }
        if (ri == 0 && ci == 0) {
            return area;
        }
        if (ri == 0) {
            return area.column(ci);
        }
        if (ci == 0) {
            return area.row(ri);
        }
        return area.get(ri, ci);
    }

    public static Object match(Object value, Object array) {
        return match(value, array, 1.0);
    }

    /**
     * Position (1-based) of {@code value} in a one-dimensional area.
     *
     * @param matchType 1: largest value not greater (ascending data); 0: first equal value,
     *     with wildcards for text; -1: smallest value not less (descending data)
     */
    public static Object match(Object value, Object array, Object matchType) {
        Object v = lookupValue(value);
        Object t = Values.numberOf(matchType);
        ExcelError error = Values.firstError(v, t);
        if (error != null) {
            return error;
        }
        Area area = asArea(array);
        if (!area.isVector()) {
            return ExcelError.NA;
        }
        double type = (Double) t;
        int at;
        if (type == 0) {
            at = exactIndex(area.values(), v);
        } else {
            at = approximateIndex(area.values(), v, type > 0);
        }
        return at < 0 ? ExcelError.NA : (Object) (double) (at + 1);
    }

    /** Picks the {@code index}-th (1-based) of the remaining arguments. */
    public static Object choose(Object index, Object... choices) {
        Object i = Values.numberOf(index);
        if (i instanceof ExcelError) {
            return i;
        }
        int at = (int) Math.floor((Double) i);
        return at < 1 || at > choices.length ? ExcelError.VALUE : choices[at - 1];
    }

    public static Object rows(Object array) {
        return array instanceof Area area ? (Object) (double) area.rows() : (Object) 1.0;
    }

    public static Object columns(Object array) {
        return array instanceof Area area ? (Object) (double) area.columns() : (Object) 1.0;
    }

    /** ROW: the compiler passes the resolved row number. */
    public static Object row(int row) {
        return (double) row;
    }

    /** COLUMN: the compiler passes the resolved column number. */
    public static Object column(int column) {
        return (double) column;
    }

    // ---------------------------------------------------------------- helpers

    private static Area asArea(Object value) {
        if (value instanceof Area area) {
            return area;
        }
        return new Area(1, 1, Collections.singletonList(value));
    }

    /** Feeds every number the aggregate rules admit to {@code sink}; returns the first error. */
    private static ExcelError numbers(Object[] args, DoubleConsumer sink) {
        for (Object arg : args) {
            if (arg instanceof Area area) {
                for (Object v : area.values()) {
                    if (v instanceof ExcelError error) {
                        return error;
                    }
                    if (v instanceof Number n) {
                        sink.accept(n.doubleValue());
                    }
                }
            } else if (arg != null) {
                Object n = Values.numberOf(arg);
                if (n instanceof ExcelError error) {
                    return error;
                }
                sink.accept((Double) n);
            }
        }
        return null;
    }

    private static double mean(List<Double> xs) {
        double total = 0.0;
        for (double x : xs) {
            total += x;
        }
        return total / xs.size();
    }

    private static Object kth(Object array, Object k, boolean largest) {
        List<Double> xs = new ArrayList<>();
        ExcelError error = numbers(new Object[] {array}, xs::add);
        if (error != null) {
            return error;
        }
        Object rank = Values.numberOf(k);
        if (rank instanceof ExcelError) {
            return rank;
        }
        int n = (int) Math.ceil((Double) rank);
        if (n < 1 || n > xs.size()) {
            return ExcelError.NUM;
        }
        Collections.sort(xs);
        return largest ? xs.get(xs.size() - n) : xs.get(n - 1);
    }

    private record Selection(int rows, int columns, boolean[] selected) {}

    /** Applies (range, criterion) pairs; all ranges must share dimensions. */
    private static Object select(Object[] rangeCriteria) {
        if (rangeCriteria.length == 0 || rangeCriteria.length % 2 != 0) {
            return ExcelError.VALUE;
        }
        Area first = asArea(rangeCriteria[0]);
        boolean[] selected = new boolean[first.rows() * first.columns()];
        Arrays.fill(selected, true);
        for (int p = 0; p < rangeCriteria.length; p += 2) {
            Area range = asArea(rangeCriteria[p]);
            if (range.rows() != first.rows() || range.columns() != first.columns()) {
                return ExcelError.VALUE;
            }
            Predicate<Object> test = Criteria.parse(rangeCriteria[p + 1]);
            for (int i = 0; i < selected.length; i++) {
                selected[i] = selected[i] && test.test(range.values().get(i));
            }
        }
        return new Selection(first.rows(), first.columns(), selected);
    }

    private static Object conditional(
            Object target, Object[] rangeCriteria, Function<List<Double>, Object> reduce) {
        Object selection = select(rangeCriteria);
        if (selection instanceof ExcelError) {
            return selection;
        }
        Selection s = (Selection) selection;
        Area values = asArea(target);
        if (values.rows() != s.rows() || values.columns() != s.columns()) {
            return ExcelError.VALUE;
        }
        List<Double> xs = new ArrayList<>();
        for (int i = 0; i < s.selected().length; i++) {
            if (!s.selected()[i]) {
                continue;
            }
            Object v = values.values().get(i);
            if (v instanceof ExcelError) {
                return v;
            }
            if (v instanceof Number n) {
                xs.add(n.doubleValue());
            }
        }
        return reduce.apply(xs);
    }

    private static Object logical(Object[] args, BiFunction<Boolean, Boolean, Boolean> combine) {
        List<Boolean> flags = new ArrayList<>();
        ExcelError error = logicals(args, flags);
        if (error != null) {
            return error;
        }
        if (flags.isEmpty()) {
            return ExcelError.VALUE;
        }
        boolean all = !flags.contains(Boolean.FALSE);
        boolean any = flags.contains(Boolean.TRUE);
        return combine.apply(all, any);
    }

    private static ExcelError logicals(Object[] args, List<Boolean> out) {
        for (Object arg : args) {
            if (arg instanceof Area area) {
                for (Object v : area.values()) {
                    if (v instanceof ExcelError error) {
                        return error;
                    }
                    if (v instanceof Boolean b) {
                        out.add(b);
                    } else if (v instanceof Number n) {
                        out.add(n.doubleValue() != 0.0);
                    }
                }
            } else if (arg != null) {
                Object b = Values.booleanOf(arg);
                if (b instanceof ExcelError error) {
                    return error;
                }
                out.add((Boolean) b);
            }
        }
        return null;
    }

    private static Object unary(Object arg, DoubleFunction<Object> f) {
        Object n = Values.numberOf(arg);
        return n instanceof ExcelError ? n : f.apply((Double) n);
    }

    private static Object binary(Object left, Object right, BiFunction<Double, Double, Object> f) {
        Object a = Values.numberOf(left);
        if (a instanceof ExcelError) {
            return a;
        }
        Object b = Values.numberOf(right);
        return b instanceof ExcelError ? b : f.apply((Double) a, (Double) b);
    }

    private static Object rounded(Object number, Object digits, RoundingMode mode) {
        return binary(number, digits, (x, d) -> {
            if (Double.isNaN(x) || Double.isInfinite(x)) {
                return ExcelError.NUM;
            }
            int scale = (int) Math.floor(d);
            return BigDecimal.valueOf(x).setScale(scale, mode).doubleValue();
        });
    }

    /** Removes binary noise so that {@code 0.3 / 0.1} counts as exactly 3. */
    private static double snap(double quotient) {
        double nearest = Math.rint(quotient);
        return Math.abs(quotient - nearest) < 1e-9 ? nearest : quotient;
    }

    private static Object multiple(double count, double significance) {
        if (Double.isNaN(count) || Double.isInfinite(count)) {
            return ExcelError.NUM;
        }
        return BigDecimal.valueOf(count).multiply(BigDecimal.valueOf(significance)).doubleValue();
    }

    private static Object text(Object value) {
        Object v = Values.scalar(value);
        return v instanceof ExcelError ? v : Values.textOf(v);
    }

    private static Object substring(Object text, Object count, BiFunction<String, Integer, String> cut) {
        Object s = text(text);
        Object n = Values.numberOf(count);
        ExcelError error = Values.firstError(s, n);
        if (error != null) {
            return error;
        }
        int chars = (int) Math.floor((Double) n);
        return chars < 0 ? ExcelError.VALUE : cut.apply((String) s, chars);
    }

    @FunctionalInterface
    private interface Locator {
        int indexOf(String needle, String haystack, int from);
    }

    private static Object locate(Object needle, Object haystack, Object start, Locator locator) {
        Object n = text(needle);
        Object h = text(haystack);
        Object s = Values.numberOf(start);
        ExcelError error = Values.firstError(n, h, s);
        if (error != null) {
            return error;
        }
        int from = (int) Math.floor((Double) s);
        String hay = (String) h;
        if (from < 1 || from > hay.length() + 1) {
            return ExcelError.VALUE;
        }
        int at = locator.indexOf((String) n, hay, from - 1);
        return at < 0 ? ExcelError.VALUE : (Object) (double) (at + 1);
    }

    @FunctionalInterface
    private interface TableCell {
        Object at(int matchPosition, int selectedLine);
    }

    private static Object tableLookup(
            Object value, Area keys, Object lineIndex, Object approximate, int lines, TableCell cell) {
        Object v = lookupValue(value);
        Object line = Values.numberOf(lineIndex);
        Object approx = approximate == null ? Boolean.FALSE : Values.booleanOf(approximate);
        ExcelError error = Values.firstError(v, line, approx);
        if (error != null) {
            return error;
        }
        int selected = (int) Math.floor((Double) line);
        if (selected < 1) {
            return ExcelError.VALUE;
        }
        if (selected > lines) {
            return ExcelError.REF;
        }
        int at = (Boolean) approx ? approximateIndex(keys.values(), v, true) : exactIndex(keys.values(), v);
        return at < 0 ? ExcelError.NA : cell.at(at + 1, selected);
    }

    private static Object lookupValue(Object value) {
        Object v = Values.scalar(value);
        return v == null ? 0.0 : v;
    }

    private static int exactIndex(List<Object> candidates, Object value) {
        Pattern wildcard = value instanceof String s && (s.contains("*") || s.contains("?") || s.contains("~"))
                ? Criteria.wildcard(s)
                : null;
        for (int i = 0; i < candidates.size(); i++) {
            Object c = candidates.get(i);
            if (wildcard != null ? c instanceof String t && wildcard.matcher(t).matches() : Values.looselyEquals(c, value)) {
                return i;
            }
        }
        return -1;
    }

    /** Linear scan over sorted data; stops at the first value past the target. */
    private static int approximateIndex(List<Object> candidates, Object value, boolean ascending) {
        int best = -1;
        for (int i = 0; i < candidates.size(); i++) {
            Object c = candidates.get(i);
            if (!sameKind(c, value)) {
                continue;
            }
            int cmp = Values.compare(c, value);
            if (ascending ? cmp <= 0 : cmp >= 0) {
                best = i;
                if (cmp == 0 && !ascending) {
                    break;
                }
            } else {
                break;
            }
        }
        return best;
    }

    private static boolean sameKind(Object a, Object b) {
        return (a instanceof Number && b instanceof Number)
                || (a instanceof String && b instanceof String)
                || (a instanceof Boolean && b instanceof Boolean);
    }
}
