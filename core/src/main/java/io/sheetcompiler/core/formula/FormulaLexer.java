package io.sheetcompiler.core.formula;

import io.sheetcompiler.core.error.FormulaParseException;
import io.sheetcompiler.core.model.AxisMode;
import io.sheetcompiler.core.model.CellAddress;
import io.sheetcompiler.core.model.Reference;
import io.sheetcompiler.core.model.Reference.Coordinate;
import io.sheetcompiler.core.model.TableDefinition;
import io.sheetcompiler.core.model.WorkbookModel;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits formula text into tokens, resolving every cell, range and table reference on the
 * way. One lexer instance handles one formula.
 *
 * <p>
 * Reference grammar: {@code [$]Col[$]Row}, optionally qualified by {@code Sheet!},
 * {@code 'Sheet Name'!}, {@code [File]Sheet!} or {@code '[File]Sheet Name'!}; two coordinates
 * joined by {@code :} form a range. {@code Table[...]} is a structured reference resolved
 * through the workbook's table definitions. Defined names, whole-row and whole-column ranges
 * are rejected as unsupported references.
 */
final class FormulaLexer {

    private static final Pattern NUMBER = Pattern.compile("(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern COORDINATE = Pattern.compile("(\\$?)([A-Za-z]{1,3})(\\$?)(\\d{1,7})");
    private static final Pattern COLUMN_ONLY = Pattern.compile("\\$?[A-Za-z]{1,3}");
    private static final List<String> ERROR_CODES =
            List.of("#NULL!", "#DIV/0!", "#VALUE!", "#REF!", "#NAME?", "#NUM!", "#N/A");
    private static final List<String> OPERATORS =
            List.of("<>", "<=", ">=", "<", ">", "=", "+", "-", "*", "/", "^", "&", "%");

    private final String text;
    private final CellAddress owner;
    private final WorkbookModel workbook;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;

    FormulaLexer(String text, CellAddress owner, WorkbookModel workbook) {
        this.text = text;
        this.owner = owner;
        this.workbook = workbook;
    }

    List<Token> tokenize() {
        pos = text.startsWith("=") ? 1 : 0;
        while (true) {
            skipWhitespace();
            if (pos >= text.length()) {
                break;
            }
            char ch = text.charAt(pos);
            int start = pos;
            if (ch == '"') {
                tokens.add(string());
            } else if (ch == '#') {
                tokens.add(errorLiteral());
            } else if (Character.isDigit(ch) || (ch == '.' && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1)))) {
                tokens.add(number());
            } else if (ch == '(') {
                pos++;
                tokens.add(new Token(TokenType.LPAREN, "(", start, pos, null));
            } else if (ch == ')') {
                pos++;
                tokens.add(new Token(TokenType.RPAREN, ")", start, pos, null));
            } else if (ch == ',') {
                pos++;
                tokens.add(new Token(TokenType.COMMA, ",", start, pos, null));
            } else if (ch == '\'' || ch == '[') {
                Qualifier qualifier = ch == '\'' ? quotedQualifier() : bracketQualifier();
                tokens.add(reference(qualifier, start));
            } else if (isWordChar(ch)) {
                tokens.add(word());
            } else if (ch == '{') {
                throw error("array constants are not supported", start, false);
            } else {
                tokens.add(operator());
            }
        }
        tokens.add(new Token(TokenType.END, "", pos, pos, null));
        return tokens;
    }

    // ---------------------------------------------------------------- literals

    private Token string() {
        int start = pos++;
        StringBuilder value = new StringBuilder();
        while (true) {
            if (pos >= text.length()) {
                throw error("unterminated string literal", start, false);
            }
            char ch = text.charAt(pos++);
            if (ch == '"') {
                if (pos < text.length() && text.charAt(pos) == '"') {
                    value.append('"');
                    pos++;
                } else {
                    break;
                }
            } else {
                value.append(ch);
            }
        }
        return new Token(TokenType.TEXT, value.toString(), start, pos, null);
    }

    private Token errorLiteral() {
        int start = pos;
        for (String code : ERROR_CODES) {
            if (text.regionMatches(true, pos, code, 0, code.length())) {
                pos += code.length();
                return new Token(TokenType.ERROR, code, start, pos, null);
            }
        }
        throw error("unknown error literal", start, false);
    }

    private Token number() {
        int start = pos;
        Matcher m = NUMBER.matcher(text).region(pos, text.length());
        if (!m.lookingAt()) {
            throw error("malformed number", start, false);
        }
        pos = m.end();
        if (pos < text.length() && text.charAt(pos) == ':') {
            throw error("whole-row ranges are not supported", start, true);
        }
        if (pos < text.length() && Character.isLetter(text.charAt(pos))) {
            throw error("malformed number", start, false);
        }
        if (!Double.isFinite(Double.parseDouble(m.group()))) {
            throw error("number out of range", start, false);
        }
        return new Token(TokenType.NUMBER, m.group(), start, pos, null);
    }

    private Token operator() {
        int start = pos;
        for (String op : OPERATORS) {
            if (text.startsWith(op, pos)) {
                pos += op.length();
                return new Token(TokenType.OPERATOR, op, start, pos, null);
            }
        }
        throw error("unexpected character '" + text.charAt(pos) + "'", start, false);
    }

    // ---------------------------------------------------------------- words and references

    private Token word() {
        int start = pos;
        String word = readWord();
        char next = pos < text.length() ? text.charAt(pos) : '\0';
        if (next == '!') {
            pos++;
            return reference(new Qualifier(null, word), start);
        }
        if (next == '(') {
            if (word.contains("$")) {
                throw error("malformed function name '" + word + "'", start, false);
            }
            return new Token(TokenType.FUNCTION, word, start, pos, null);
        }
        if (next == '[') {
            return table(word, start);
        }
        if (COORDINATE.matcher(word).matches() && coordinate(word) != null) {
            pos = start;
            return reference(null, start);
        }
        if (word.equalsIgnoreCase("TRUE") || word.equalsIgnoreCase("FALSE")) {
            return new Token(TokenType.BOOLEAN, word.toUpperCase(Locale.ROOT), start, pos, null);
        }
        if (next == ':' && COLUMN_ONLY.matcher(word).matches()) {
            throw error("whole-column ranges are not supported", start, true);
        }
        throw error("unknown name '" + word + "' (defined names are not supported)", start, true);
    }

    /** Parses the coordinate part of a reference; {@code pos} is just past any qualifier. */
    private Token reference(Qualifier qualifier, int start) {
        int coordinateStart = pos;
        String firstText = readWord();
        Coordinate first = coordinate(firstText);
        if (first == null) {
            if (pos < text.length() && text.charAt(pos) == ':' && COLUMN_ONLY.matcher(firstText).matches()) {
                throw error("whole-column ranges are not supported", start, true);
            }
            throw error("expected a cell coordinate after the sheet name", coordinateStart, true);
        }
        Coordinate last = null;
        if (pos < text.length() && text.charAt(pos) == ':') {
            pos++;
            int secondStart = pos;
            Qualifier secondQualifier = peekQualifier();
            if (secondQualifier != null && !secondQualifier.equals(qualifier)) {
                throw error("range corners on different sheets are not supported", secondStart, true);
            }
            String secondText = readWord();
            last = coordinate(secondText);
            if (last == null) {
                throw error("malformed range end '" + secondText + "'", secondStart, true);
            }
        }
        String sheet;
        String file = null;
        if (qualifier == null) {
            sheet = owner.sheet();
        } else if (qualifier.file() != null) {
            file = qualifier.file();
            sheet = qualifier.sheet();
        } else {
            sheet = workbook.resolveSheet(qualifier.sheet())
                    .orElseThrow(() -> error("unknown sheet '" + qualifier.sheet() + "'", start, true));
        }
        Reference reference = new Reference(
                text.substring(start, pos), start, pos, coordinateStart, sheet, file, qualifier != null, first, last, null);
        return new Token(TokenType.REFERENCE, reference.text(), start, pos, reference);
    }

    /** Consumes a qualifier ({@code Sheet!}, {@code 'Sheet'!}, {@code [F]S!}) if one follows. */
    private Qualifier peekQualifier() {
        if (pos >= text.length()) {
            return null;
        }
        char ch = text.charAt(pos);
        if (ch == '\'') {
            return quotedQualifier();
        }
        if (ch == '[') {
            return bracketQualifier();
        }
        int save = pos;
        String word = readWord();
        if (pos < text.length() && text.charAt(pos) == '!') {
            pos++;
            return new Qualifier(null, word);
        }
        pos = save;
        return null;
    }

    private Qualifier quotedQualifier() {
        int start = pos++;
        StringBuilder content = new StringBuilder();
        while (true) {
            if (pos >= text.length()) {
                throw error("unterminated quoted sheet name", start, true);
            }
            char ch = text.charAt(pos++);
            if (ch == '\'') {
                if (pos < text.length() && text.charAt(pos) == '\'') {
                    content.append('\'');
                    pos++;
                } else {
                    break;
                }
            } else {
                content.append(ch);
            }
        }
        expectBang(start);
        String name = content.toString();
        int open = name.indexOf('[');
        int close = name.indexOf(']', open + 1);
        if (open >= 0 && close > open) {
            return new Qualifier(name.substring(open + 1, close), name.substring(close + 1));
        }
        return new Qualifier(null, name);
    }

    private Qualifier bracketQualifier() {
        int start = pos;
        int close = text.indexOf(']', pos);
        if (close < 0) {
            throw error("unterminated external workbook name", start, true);
        }
        String file = text.substring(pos + 1, close);
        pos = close + 1;
        String sheet = readWord();
        if (file.isEmpty() || sheet.isEmpty()) {
            throw error("malformed external reference", start, true);
        }
        expectBang(start);
        return new Qualifier(file, sheet);
    }

    private void expectBang(int start) {
        if (pos >= text.length() || text.charAt(pos) != '!') {
            throw error("expected '!' after sheet name", start, true);
        }
        pos++;
    }

    private Coordinate coordinate(String word) {
        Matcher m = COORDINATE.matcher(word);
        if (!m.matches()) {
            return null;
        }
        int column;
        try {
            column = CellAddress.columnIndex(m.group(2));
        } catch (IllegalArgumentException e) {
            return null;
        }
        int row = Integer.parseInt(m.group(4));
        if (row < 1 || row > CellAddress.MAX_ROW) {
            return null;
        }
        return new Coordinate(
                column,
                m.group(1).isEmpty() ? AxisMode.RELATIVE : AxisMode.ABSOLUTE,
                row,
                m.group(3).isEmpty() ? AxisMode.RELATIVE : AxisMode.ABSOLUTE);
    }

    // ---------------------------------------------------------------- structured references

    private Token table(String name, int start) {
        TableDefinition table =
                workbook.table(name).orElseThrow(() -> error("unknown table '" + name + "'", start, true));
        String body = readBracket(start).trim();
        boolean thisRow = false;
        List<String> segments = new ArrayList<>();
        if (body.startsWith("@")) {
            thisRow = true;
            body = body.substring(1).trim();
            if (!body.isEmpty()) {
                segments.add(body);
            }
        } else if (body.startsWith("[")) {
            segments.addAll(splitSegments(body, start));
        } else if (!body.isEmpty()) {
            segments.add("[" + body + "]");
        }

        int top = Integer.MAX_VALUE;
        int bottom = Integer.MIN_VALUE;
        int left = Integer.MAX_VALUE;
        int right = Integer.MIN_VALUE;
        for (String segment : segments) {
            String item = unbracket(segment);
            if (item.startsWith("#")) {
                int[] rows = specifierRows(table, item, start);
                if (rows == null) {
                    thisRow = true;
                    continue;
                }
                top = Math.min(top, rows[0]);
                bottom = Math.max(bottom, rows[1]);
            } else {
                for (String column : item.split("\\]\\s*:\\s*\\[", -1)) {
                    int index = columnOf(table, unescape(column), start);
                    left = Math.min(left, index);
                    right = Math.max(right, index);
                }
            }
        }
        if (left == Integer.MAX_VALUE) {
            left = table.range().firstColumn();
            right = table.range().lastColumn();
        }
        AxisMode rowMode = AxisMode.ABSOLUTE;
        if (thisRow) {
            if (!owner.sheet().equals(table.sheet())
                    || owner.row() < table.firstDataRow()
                    || owner.row() > table.lastDataRow()) {
                throw error("this-row reference outside the data rows of table '" + table.name() + "'", start, true);
            }
            top = owner.row();
            bottom = owner.row();
            rowMode = AxisMode.RELATIVE;
        } else if (top == Integer.MAX_VALUE) {
            top = table.firstDataRow();
            bottom = table.lastDataRow();
        }
        Coordinate first = new Coordinate(left, AxisMode.ABSOLUTE, top, rowMode);
        Coordinate last = left == right && top == bottom ? null : new Coordinate(right, AxisMode.ABSOLUTE, bottom, rowMode);
        Reference reference = new Reference(
                text.substring(start, pos), start, pos, start, table.sheet(), null, true, first, last, table.name());
        return new Token(TokenType.REFERENCE, reference.text(), start, pos, reference);
    }

    /** Reads a bracketed body starting at {@code pos}; returns the text between the outer brackets. */
    private String readBracket(int start) {
        int open = pos;
        int depth = 0;
        while (pos < text.length()) {
            char ch = text.charAt(pos);
            if (ch == '\'' && pos + 1 < text.length()) {
                pos += 2;
                continue;
            }
            pos++;
            if (ch == '[') {
                depth++;
            } else if (ch == ']') {
                depth--;
                if (depth == 0) {
                    return text.substring(open + 1, pos - 1);
                }
            }
        }
        throw error("unterminated structured reference", start, true);
    }

    /** Splits {@code [a],[b]:[c]} into {@code [a]} and {@code [b]:[c]}. */
    private List<String> splitSegments(String body, int start) {
        List<String> segments = new ArrayList<>();
        int depth = 0;
        int from = 0;
        for (int i = 0; i < body.length(); i++) {
            char ch = body.charAt(i);
            if (ch == '\'') {
                i++;
            } else if (ch == '[') {
                depth++;
            } else if (ch == ']') {
                depth--;
            } else if (ch == ',' && depth == 0) {
                segments.add(body.substring(from, i).trim());
                from = i + 1;
            }
        }
        segments.add(body.substring(from).trim());
        for (String segment : segments) {
            if (!segment.startsWith("[") || !segment.endsWith("]")) {
                throw error("malformed structured reference", start, true);
            }
        }
        return segments;
    }

    private static String unbracket(String segment) {
        String s = segment.trim();
        if (s.startsWith("[") && s.endsWith("]")) {
            return s.substring(1, s.length() - 1).trim();
        }
        return s;
    }

    private static String unescape(String column) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < column.length(); i++) {
            char ch = column.charAt(i);
            if (ch == '\'' && i + 1 < column.length()) {
                ch = column.charAt(++i);
            }
            out.append(ch);
        }
        return out.toString();
    }

    /** Row span of a special item; {@code null} for {@code #This Row}. */
    private int[] specifierRows(TableDefinition table, String item, int start) {
        switch (item.toUpperCase(Locale.ROOT)) {
            case "#ALL":
                return new int[] {table.range().firstRow(), table.range().lastRow()};
            case "#DATA":
                return new int[] {table.firstDataRow(), table.lastDataRow()};
            case "#HEADERS":
                if (table.headerRows() == 0) {
                    throw error("table '" + table.name() + "' has no header row", start, true);
                }
                return new int[] {table.range().firstRow(), table.range().firstRow()};
            case "#TOTALS":
                if (table.totalsRows() == 0) {
                    throw error("table '" + table.name() + "' has no totals row", start, true);
                }
                return new int[] {table.range().lastRow(), table.range().lastRow()};
            case "#THIS ROW":
                return null;
            default:
                throw error("unknown table specifier '" + item + "'", start, true);
        }
    }

    private int columnOf(TableDefinition table, String column, int start) {
        OptionalInt index = table.columnIndex(column);
        if (index.isEmpty()) {
            throw error("table '" + table.name() + "' has no column '" + column + "'", start, true);
        }
        return table.range().firstColumn() + index.getAsInt();
    }

    // ---------------------------------------------------------------- helpers

    private String readWord() {
        int start = pos;
        while (pos < text.length() && isWordChar(text.charAt(pos))) {
            pos++;
        }
        return text.substring(start, pos);
    }

    private static boolean isWordChar(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_' || ch == '.' || ch == '$' || ch == '\\';
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private FormulaParseException error(String message, int offset, boolean unsupportedReference) {
        return new FormulaParseException(message, owner, text, offset, unsupportedReference);
    }

    private record Qualifier(String file, String sheet) {}
}
