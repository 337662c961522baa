package io.sheetcompiler.core.formula;

/** Lexical categories of formula text. */
public enum TokenType {
    NUMBER,
    TEXT,
    BOOLEAN,
    ERROR,
    REFERENCE,
    FUNCTION,
    OPERATOR,
    LPAREN,
    RPAREN,
    COMMA,
    END
}
