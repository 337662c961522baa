package io.sheetcompiler.core.formula;

import io.sheetcompiler.core.model.Reference;
import java.util.Objects;

/**
 * One lexical token.
 *
 * @param type      category
 * @param text      the token text; for {@link TokenType#TEXT} the unescaped string value
 * @param start     offset of the first character in the formula
 * @param end       offset one past the last character
 * @param reference the parsed reference for {@link TokenType#REFERENCE}, otherwise {@code null}
 */
public record Token(TokenType type, String text, int start, int end, Reference reference) {

    public Token {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    public boolean is(TokenType expected, String value) {
        return type == expected && text.equals(value);
    }
}
