package io.sheetcompiler.core.report;

import io.sheetcompiler.core.error.FormulaParseException;
import java.util.Objects;

/**
 * A finding about one cell that did not, or not yet, stop the conversion.
 *
 * @param kind    what was found
 * @param cell    the cell, as {@code Sheet!A1}
 * @param formula the formula text, or {@code null} for value cells
 * @param message human-readable detail
 */
public record Diagnostic(Kind kind, String cell, String formula, String message) {

    public enum Kind {
        /** A reference the compiler cannot resolve: defined name, unknown sheet or table, whole row or column. */
        UNSUPPORTED_REFERENCE,
        /** Any other formula syntax or argument-count problem. */
        PARSE_ERROR,
        /** A function outside the supported set. */
        UNSUPPORTED_FUNCTION,
        /** A hardcoded value with no literal form, replaced by blank. */
        SERIALIZATION,
        /** A group whose members read later members, emitted as singletons. */
        DISSOLVED_GROUP,
        /** A cell on a circular reference. */
        CIRCULAR_REFERENCE
    }

    public Diagnostic {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(cell, "cell must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static Diagnostic of(FormulaParseException e) {
        return new Diagnostic(
                e.isUnsupportedReference() ? Kind.UNSUPPORTED_REFERENCE : Kind.PARSE_ERROR,
                String.valueOf(e.cell()),
                e.formula(),
                e.getMessage());
    }
}
