package io.sheetcompiler.core.formula;

import io.sheetcompiler.core.model.CellAddress;
import io.sheetcompiler.core.model.Reference;
import io.sheetcompiler.core.model.WorkbookModel;
import java.util.List;
import java.util.Objects;

/**
 * Extracts the typed references of a formula, in left-to-right text order. Sheet qualifiers
 * resolve against the workbook's sheets and structured references against its tables.
 */
public final class ReferenceExtractor {

    private final WorkbookModel workbook;

    public ReferenceExtractor(WorkbookModel workbook) {
        this.workbook = Objects.requireNonNull(workbook, "workbook must not be null");
    }

    /**
     * Returns every reference in {@code formula}.
     *
     * @param formula formula text, with or without the leading {@code =}
     * @param owner   the cell holding the formula; unqualified references target its sheet
     * @throws io.sheetcompiler.core.error.FormulaParseException on malformed or unsupported references
     */
    public List<Reference> extract(String formula, CellAddress owner) {
        return tokenize(formula, owner).stream()
                .filter(t -> t.type() == TokenType.REFERENCE)
                .map(Token::reference)
                .toList();
    }

    /** Full token stream of {@code formula}, ending with an {@link TokenType#END} token. */
    public List<Token> tokenize(String formula, CellAddress owner) {
        Objects.requireNonNull(formula, "formula must not be null");
        Objects.requireNonNull(owner, "owner must not be null");
        return new FormulaLexer(formula, owner, workbook).tokenize();
    }
}
