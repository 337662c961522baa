package io.sheetcompiler.core.translate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The closed set of spreadsheet functions the compiler can translate, with the runtime method
 * each maps to and its argument-count bounds. Anything not listed fails the conversion.
 */
public final class FunctionTable {

    /** Upper bound for variadic functions, as in the spreadsheet. */
    public static final int VARIADIC = 255;

    /** How a call is rendered. */
    public enum Kind {
        /** {@code Functions.method(args...)}. */
        CALL,
        /** ROW/COLUMN: the compiler resolves the position and passes it as an {@code int}. */
        POSITION
    }

    /**
     * One translatable function.
     *
     * @param name           spreadsheet name, upper-case
     * @param javaMethod     static method in {@code io.sheetcompiler.runtime.Functions}
     * @param minArity       fewest arguments
     * @param maxArity       most arguments
     * @param rangeArguments whether single-cell references are passed as 1x1 areas, so that
     *                       range semantics (ignore text and blanks) also apply to them
     * @param kind           rendering style
     */
    public record Entry(String name, String javaMethod, int minArity, int maxArity, boolean rangeArguments, Kind kind) {

        public boolean accepts(int arity) {
            return arity >= minArity && arity <= maxArity;
        }

        public String arityDescription() {
            if (minArity == maxArity) {
                return minArity == 1 ? "1 argument" : minArity + " arguments";
            }
            if (maxArity == VARIADIC) {
                return "at least " + minArity + (minArity == 1 ? " argument" : " arguments");
            }
            return minArity + " to " + maxArity + " arguments";
        }
    }

    private static final Map<String, Entry> ENTRIES = new LinkedHashMap<>();

    static {
        // aggregation
        ranges("SUM", "sum", 1, VARIADIC);
        ranges("AVERAGE", "average", 1, VARIADIC);
        ranges("COUNT", "count", 1, VARIADIC);
        ranges("COUNTA", "counta", 1, VARIADIC);
        ranges("COUNTBLANK", "countblank", 1, 1);
        ranges("MIN", "min", 1, VARIADIC);
        ranges("MAX", "max", 1, VARIADIC);
        ranges("MEDIAN", "median", 1, VARIADIC);
        ranges("PRODUCT", "product", 1, VARIADIC);
        ranges("LARGE", "large", 2, 2);
        ranges("SMALL", "small", 2, 2);
        ranges("SUMPRODUCT", "sumproduct", 1, VARIADIC);
        ranges("SUMIF", "sumif", 2, 3);
        ranges("SUMIFS", "sumifs", 3, VARIADIC);
        ranges("COUNTIF", "countif", 2, 2);
        ranges("COUNTIFS", "countifs", 2, VARIADIC);
        ranges("AVERAGEIF", "averageif", 2, 3);
        ranges("AVERAGEIFS", "averageifs", 3, VARIADIC);
        ranges("MAXIFS", "maxifs", 3, VARIADIC);
        ranges("MINIFS", "minifs", 3, VARIADIC);
        // logical and information
        scalars("IF", "ifElse", 2, 3);
        ranges("AND", "and", 1, VARIADIC);
        ranges("OR", "or", 1, VARIADIC);
        ranges("XOR", "xor", 1, VARIADIC);
        scalars("NOT", "not", 1, 1);
        scalars("IFERROR", "iferror", 2, 2);
        scalars("IFNA", "ifna", 2, 2);
        scalars("ISBLANK", "isblank", 1, 1);
        scalars("ISERROR", "iserror", 1, 1);
        scalars("ISNA", "isna", 1, 1);
        scalars("ISNUMBER", "isnumber", 1, 1);
        scalars("ISTEXT", "istext", 1, 1);
        scalars("NA", "na", 0, 0);
        scalars("TRUE", "trueValue", 0, 0);
        scalars("FALSE", "falseValue", 0, 0);
        // math
        scalars("ABS", "abs", 1, 1);
        scalars("SIGN", "sign", 1, 1);
        scalars("ROUND", "round", 2, 2);
        scalars("ROUNDUP", "roundup", 2, 2);
        scalars("ROUNDDOWN", "rounddown", 2, 2);
        scalars("INT", "integer", 1, 1);
        scalars("TRUNC", "trunc", 1, 2);
        scalars("MOD", "mod", 2, 2);
        scalars("POWER", "power", 2, 2);
        scalars("SQRT", "sqrt", 1, 1);
        scalars("EXP", "exp", 1, 1);
        scalars("LN", "ln", 1, 1);
        scalars("LOG", "log", 1, 2);
        scalars("LOG10", "log10", 1, 1);
        scalars("CEILING", "ceiling", 1, 2);
        scalars("FLOOR", "floor", 1, 2);
        scalars("PI", "pi", 0, 0);
        // text
        scalars("LEN", "len", 1, 1);
        scalars("LEFT", "left", 1, 2);
        scalars("RIGHT", "right", 1, 2);
        scalars("MID", "mid", 3, 3);
        scalars("UPPER", "upper", 1, 1);
        scalars("LOWER", "lower", 1, 1);
        scalars("TRIM", "trim", 1, 1);
        scalars("CONCATENATE", "concatenate", 1, VARIADIC);
        ranges("CONCAT", "concatAll", 1, VARIADIC);
        scalars("EXACT", "exact", 2, 2);
        scalars("REPT", "rept", 2, 2);
        scalars("FIND", "find", 2, 3);
        scalars("SEARCH", "search", 2, 3);
        scalars("SUBSTITUTE", "substitute", 3, 4);
        scalars("VALUE", "value", 1, 1);
        // lookup and reference
        ranges("VLOOKUP", "vlookup", 3, 4);
        ranges("HLOOKUP", "hlookup", 3, 4);
        ranges("INDEX", "index", 2, 3);
        ranges("MATCH", "match", 2, 3);
        scalars("CHOOSE", "choose", 2, VARIADIC);
        ranges("ROWS", "rows", 1, 1);
        ranges("COLUMNS", "columns", 1, 1);
        register(new Entry("ROW", "row", 0, 1, false, Kind.POSITION));
        register(new Entry("COLUMN", "column", 0, 1, false, Kind.POSITION));
    }

    private FunctionTable() {
        // utility class
    }

    /** Looks up a normalised (upper-case, unprefixed) function name. */
    public static Optional<Entry> lookup(String name) {
        return Optional.ofNullable(ENTRIES.get(name));
    }

    /** Every entry, in registration order. */
    public static Map<String, Entry> entries() {
        return Collections.unmodifiableMap(ENTRIES);
    }

    private static void ranges(String name, String javaMethod, int min, int max) {
        register(new Entry(name, javaMethod, min, max, true, Kind.CALL));
    }

    private static void scalars(String name, String javaMethod, int min, int max) {
        register(new Entry(name, javaMethod, min, max, false, Kind.CALL));
    }

    private static void register(Entry entry) {
        ENTRIES.put(entry.name(), entry);
    }
}
