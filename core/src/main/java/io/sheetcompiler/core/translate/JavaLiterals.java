package io.sheetcompiler.core.translate;

import io.sheetcompiler.core.model.LiteralValue;

/** Spells values as Java source literals. */
public final class JavaLiterals {

    private JavaLiterals() {
        // utility class
    }

    /** A double literal that reads back to exactly {@code value}; always contains {@code .} or {@code E}. */
    public static String doubleLiteral(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("no literal for " + value);
        }
        String text = Double.toString(value);
        return value < 0 ? "(" + text + ")" : text;
    }

    /** A quoted, escaped Java string literal. */
    public static String stringLiteral(String value) {
        StringBuilder out = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (ch < 0x20 || ch > 0x7e) {
                        out.append(String.format("\\u%04x", (int) ch));
                    } else {
                        out.append(ch);
                    }
                }
            }
        }
        return out.append('"').toString();
    }

    /** The literal of a hardcoded value: {@code 10L}, {@code 2.5}, {@code true}, {@code "x"} or {@code null}. */
    public static String literal(LiteralValue value) {
        if (value instanceof LiteralValue.IntegerValue i) {
            return i.value() < 0 ? "(" + i.value() + "L)" : i.value() + "L";
        }
        if (value instanceof LiteralValue.FloatValue f) {
            return doubleLiteral(f.value());
        }
        if (value instanceof LiteralValue.BooleanValue b) {
            return Boolean.toString(b.value());
        }
        if (value instanceof LiteralValue.TextValue t) {
            return stringLiteral(t.value());
        }
        return "null";
    }
}
