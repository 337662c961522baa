package io.sheetcompiler.core.formula;

import io.sheetcompiler.core.error.FormulaParseException;
import io.sheetcompiler.core.model.Cell.FormulaCell;
import io.sheetcompiler.core.model.CellAddress;
import io.sheetcompiler.core.model.FormulaNode;
import io.sheetcompiler.core.model.Operator;
import io.sheetcompiler.core.model.Reference;
import io.sheetcompiler.core.translate.FunctionTable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Precedence-climbing parser from formula tokens to a {@link FormulaNode} tree.
 *
 * <p>
 * Precedence, loosest first: comparisons, {@code &}, {@code + -}, {@code * /}, {@code ^}, prefix
 * {@code - +}, postfix {@code %}. All binary operators are left-associative, and prefix minus
 * binds tighter than {@code ^}, so {@code -2^2} is 4.
 *
 * <p>
 * Argument counts of known functions are checked here; names missing from the
 * {@link FunctionTable} pass through and are rejected at translation.
 */
public final class FormulaParser {

    private static final List<String> FUNCTION_PREFIXES = List.of("_XLFN.", "_XLWS.");
    private static final Map<String, Operator> COMPARISONS = Map.of(
            "=", Operator.EQ, "<>", Operator.NE, "<", Operator.LT, "<=", Operator.LE, ">", Operator.GT, ">=", Operator.GE);
    private static final Map<String, Operator> ADDITIVE = Map.of("+", Operator.ADD, "-", Operator.SUBTRACT);
    private static final Map<String, Operator> MULTIPLICATIVE = Map.of("*", Operator.MULTIPLY, "/", Operator.DIVIDE);

    private final ReferenceExtractor extractor;

    public FormulaParser(ReferenceExtractor extractor) {
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
    }

    /**
     * Parses one formula cell.
     *
     * @throws FormulaParseException if the formula is malformed or has unsupported references
     */
    public FormulaCell parse(CellAddress address, String formula) {
        List<Token> tokens = extractor.tokenize(formula, address);
        List<Reference> references = new ArrayList<>();
        for (Token token : tokens) {
            if (token.type() == TokenType.REFERENCE) {
                references.add(token.reference());
            }
        }
        Cursor cursor = new Cursor(tokens, address, formula);
        if (cursor.peek().type() == TokenType.END) {
            throw cursor.error("empty formula", cursor.peek());
        }
        FormulaNode expression = cursor.comparison();
        if (cursor.peek().type() != TokenType.END) {
            throw cursor.error("unexpected '" + cursor.peek().text() + "'", cursor.peek());
        }
        return new FormulaCell(address, formula, references, expression);
    }

    /** Upper-cases a function name and strips the {@code _xlfn.}/{@code _xlws.} storage prefixes. */
    public static String normaliseFunctionName(String name) {
        String upper = name.toUpperCase(Locale.ROOT);
        boolean stripped = true;
        while (stripped) {
            stripped = false;
            for (String prefix : FUNCTION_PREFIXES) {
                if (upper.startsWith(prefix)) {
                    upper = upper.substring(prefix.length());
                    stripped = true;
                }
            }
        }
        return upper;
    }

    private static final class Cursor {

        private final List<Token> tokens;
        private final CellAddress owner;
        private final String formula;
        private int pos;
        private int slot;

        Cursor(List<Token> tokens, CellAddress owner, String formula) {
            this.tokens = tokens;
            this.owner = owner;
            this.formula = formula;
        }

        FormulaNode comparison() {
            FormulaNode left = concatenation();
            while (true) {
                Operator op = accept(COMPARISONS);
                if (op == null) {
                    return left;
                }
                left = new FormulaNode.Binary(op, left, concatenation());
            }
        }

        private FormulaNode concatenation() {
            FormulaNode left = additive();
            while (acceptOperator("&")) {
                left = new FormulaNode.Binary(Operator.CONCAT, left, additive());
            }
            return left;
        }

        private FormulaNode additive() {
            FormulaNode left = multiplicative();
            while (true) {
                Operator op = accept(ADDITIVE);
                if (op == null) {
                    return left;
                }
                left = new FormulaNode.Binary(op, left, multiplicative());
            }
        }

        private FormulaNode multiplicative() {
            FormulaNode left = power();
            while (true) {
                Operator op = accept(MULTIPLICATIVE);
                if (op == null) {
                    return left;
                }
                left = new FormulaNode.Binary(op, left, power());
            }
        }

        private FormulaNode power() {
            FormulaNode left = prefix();
            while (acceptOperator("^")) {
                left = new FormulaNode.Binary(Operator.POWER, left, prefix());
            }
            return left;
        }

        private FormulaNode prefix() {
            if (acceptOperator("-")) {
                return new FormulaNode.Unary(Operator.NEGATE, prefix());
            }
            if (acceptOperator("+")) {
                return new FormulaNode.Unary(Operator.PLUS, prefix());
            }
            FormulaNode operand = primary();
            while (acceptOperator("%")) {
                operand = new FormulaNode.Unary(Operator.PERCENT, operand);
            }
            return operand;
        }

        private FormulaNode primary() {
            Token token = next();
            switch (token.type()) {
                case NUMBER:
                    return new FormulaNode.NumberLiteral(Double.parseDouble(token.text()));
                case TEXT:
                    return new FormulaNode.TextLiteral(token.text());
                case BOOLEAN:
                    return new FormulaNode.BooleanLiteral(token.text().equals("TRUE"));
                case ERROR:
                    return new FormulaNode.ErrorLiteral(token.text());
                case REFERENCE:
                    return new FormulaNode.ReferenceSlot(slot++);
                case FUNCTION:
                    return call(token);
                case LPAREN:
                    FormulaNode inner = comparison();
                    expect(TokenType.RPAREN, "')'");
                    return inner;
                case END:
                    throw error("unexpected end of formula", token);
                default:
                    throw error("unexpected '" + token.text() + "'", token);
            }
        }

        private FormulaNode call(Token nameToken) {
            String name = normaliseFunctionName(nameToken.text());
            expect(TokenType.LPAREN, "'('");
            List<FormulaNode> arguments = new ArrayList<>();
            if (peek().type() == TokenType.RPAREN) {
                next();
            } else {
                while (true) {
                    TokenType upcoming = peek().type();
                    arguments.add(upcoming == TokenType.COMMA || upcoming == TokenType.RPAREN
                            ? new FormulaNode.Omitted()
                            : comparison());
                    Token separator = next();
                    if (separator.type() == TokenType.RPAREN) {
                        break;
                    }
                    if (separator.type() != TokenType.COMMA) {
                        throw error("expected ',' or ')' in arguments of " + name, separator);
                    }
                }
            }
            Optional<FunctionTable.Entry> entry = FunctionTable.lookup(name);
            if (entry.isPresent() && !entry.get().accepts(arguments.size())) {
                throw error(String.format("%s takes %s, got %d", name, entry.get().arityDescription(),
                        arguments.size()), nameToken);
            }
            return new FormulaNode.FunctionCall(name, arguments);
        }

        /** Consumes the next token if it is one of {@code operators}. */
        private Operator accept(Map<String, Operator> operators) {
            Token token = peek();
            Operator op = token.type() == TokenType.OPERATOR ? operators.get(token.text()) : null;
            if (op != null) {
                pos++;
            }
            return op;
        }

        private boolean acceptOperator(String symbol) {
            if (peek().is(TokenType.OPERATOR, symbol)) {
                pos++;
                return true;
            }
            return false;
        }

        private void expect(TokenType type, String description) {
            Token token = next();
            if (token.type() != type) {
                throw error("expected " + description + " but found '" + token.text() + "'", token);
            }
        }

        Token peek() {
            return tokens.get(pos);
        }

        private Token next() {
            Token token = tokens.get(pos);
            if (token.type() != TokenType.END) {
                pos++;
            }
            return token;
        }

        FormulaParseException error(String message, Token at) {
            return new FormulaParseException(message, owner, formula, at.start());
        }
    }
}
