package com.conveyal.coverage.expression;

import com.conveyal.coverage.CoverageProcessException;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for band scripts. Precedence from loosest to tightest: or, and, not, comparisons,
 * + and -, * / and %, unary minus, ** (right associative), indexing. Comparisons do not chain.
 *
 * The form {@code ds[0].B04} is accepted as another spelling of {@code B04}, so scripts written against a list of
 * datasets keep working.
 */
class ExpressionParser {

    /** Nesting beyond this depth is rejected rather than risking the stack of the evaluating thread. */
    private static final int MAX_DEPTH = 100;

    /** Height limit of one expression tree, including flat chains such as a + b + c. */
    private static final int MAX_HEIGHT = 500;

    private static final String DATASET_LIST = "ds";

    private final List<Token> tokens;

    private int position = 0;

    private int depth = 0;

    private ExpressionParser (List<Token> tokens) {
        this.tokens = tokens;
    }

    static List<Statement> parse (String source) {
        ExpressionParser parser = new ExpressionParser(Lexer.tokenize(source));
        List<Statement> statements = parser.statements(TokenType.EOF);
        parser.expect(TokenType.EOF);
        if (statements.isEmpty()) {
            throw CoverageProcessException.syntaxError("Script is empty.");
        }
        return statements;
    }

    /** Statements up to (not including) the given closing token. */
    private List<Statement> statements (TokenType end) {
        List<Statement> statements = new ArrayList<>();
        skipSeparators();
        while (!check(end) && !check(TokenType.EOF)) {
            Statement statement = statement();
            statements.add(statement);
            boolean endsWithBlock = statement instanceof Statement.If || statement instanceof Statement.While;
            if (check(TokenType.SEPARATOR)) {
                skipSeparators();
            } else if (!check(end) && !endsWithBlock) {
                throw error("Expected end of statement");
            }
        }
        return statements;
    }

    private Statement statement () {
        enter();
        try {
            if (match(TokenType.IF)) return ifStatement();
            if (match(TokenType.WHILE)) {
                Node condition = parenthesized();
                return new Statement.While(condition, block());
            }
            if (match(TokenType.RETURN)) return new Statement.Return(expression());
            if (check(TokenType.IDENTIFIER) && peek(1).type == TokenType.ASSIGN) {
                String name = advance().text;
                advance();
                return new Statement.Assign(name, expression());
            }
            return new Statement.ExpressionStatement(expression());
        } finally {
            depth--;
        }
    }

    private Statement ifStatement () {
        Node condition = parenthesized();
        List<Statement> thenBranch = block();
        List<Statement> elseBranch = new ArrayList<>();
        int afterThen = position;
        skipSeparators();
        if (match(TokenType.ELSE)) {
            if (match(TokenType.IF)) {
                // An else-if chain nests one level per link.
                enter();
                try {
                    elseBranch.add(ifStatement());
                } finally {
                    depth--;
                }
            } else {
                elseBranch = block();
            }
        } else {
            position = afterThen;
        }
        return new Statement.If(condition, thenBranch, elseBranch);
    }

    private Node parenthesized () {
        expect(TokenType.LPAREN);
        Node node = expression();
        expect(TokenType.RPAREN);
        return node;
    }

    private List<Statement> block () {
        expect(TokenType.LBRACE);
        List<Statement> body = statements(TokenType.RBRACE);
        expect(TokenType.RBRACE);
        return body;
    }

    private Node expression () {
        enter();
        try {
            return or();
        } finally {
            depth--;
        }
    }

    private Node or () {
        Node node = and();
        while (check(TokenType.OR)) {
            advance();
            node = checked(new Node.Binary(TokenType.OR, node, and()));
        }
        return node;
    }

    private Node and () {
        Node node = not();
        while (check(TokenType.AND)) {
            advance();
            node = checked(new Node.Binary(TokenType.AND, node, not()));
        }
        return node;
    }

    private Node not () {
        if (match(TokenType.NOT)) {
            enter();
            try {
                return checked(new Node.Not(not()));
            } finally {
                depth--;
            }
        }
        return comparison();
    }

    private Node comparison () {
        Node node = additive();
        if (check(TokenType.EQ) || check(TokenType.NE) || check(TokenType.LT)
                || check(TokenType.LE) || check(TokenType.GT) || check(TokenType.GE)) {
            TokenType operator = advance().type;
            node = checked(new Node.Binary(operator, node, additive()));
        }
        return node;
    }

    private Node additive () {
        Node node = multiplicative();
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            TokenType operator = advance().type;
            node = checked(new Node.Binary(operator, node, multiplicative()));
        }
        return node;
    }

    private Node multiplicative () {
        Node node = unary();
        while (check(TokenType.STAR) || check(TokenType.SLASH) || check(TokenType.PERCENT)) {
            TokenType operator = advance().type;
            node = checked(new Node.Binary(operator, node, unary()));
        }
        return node;
    }

    private Node unary () {
        if (check(TokenType.MINUS) || check(TokenType.PLUS)) {
            boolean negate = advance().type == TokenType.MINUS;
            enter();
            try {
                Node operand = unary();
                return negate ? checked(new Node.Negate(operand)) : operand;
            } finally {
                depth--;
            }
        }
        return power();
    }

    private Node power () {
        Node base = postfix();
        if (match(TokenType.POWER)) {
            // Right associative, and binds tighter than a unary minus on its left: -2 ** 2 is -4.
            return checked(new Node.Binary(TokenType.POWER, base, unary()));
        }
        return base;
    }

    private Node postfix () {
        Node node = primary();
        while (match(TokenType.LBRACKET)) {
            Node row = expression();
            expect(TokenType.COMMA);
            Node column = expression();
            expect(TokenType.RBRACKET);
            node = checked(new Node.Index(node, row, column));
        }
        return node;
    }

    private Node primary () {
        Token token = peek(0);
        switch (token.type) {
            case NUMBER:
                advance();
                try {
                    return new Node.Literal(Double.parseDouble(token.text));
                } catch (NumberFormatException e) {
                    throw CoverageProcessException.syntaxError("Malformed number " + token.text);
                }
            case LPAREN: {
                advance();
                Node node = expression();
                expect(TokenType.RPAREN);
                return node;
            }
            case IDENTIFIER:
                advance();
                return identifier(token);
            default:
                throw error("Expected a value");
        }
    }

    private Node identifier (Token token) {
        switch (token.text) {
            case "nan": return new Node.Literal(Double.NaN);
            case "inf": return new Node.Literal(Double.POSITIVE_INFINITY);
            default: break;
        }
        if (match(TokenType.LPAREN)) {
            List<Node> arguments = new ArrayList<>();
            if (!check(TokenType.RPAREN)) {
                do {
                    arguments.add(expression());
                } while (match(TokenType.COMMA));
            }
            expect(TokenType.RPAREN);
            if (!Operations.FUNCTIONS.containsKey(token.text)) {
                throw CoverageProcessException.syntaxError(
                        String.format("Unknown function %s at %s.", token.text, token.position()));
            }
            return checked(new Node.Call(token.text, arguments));
        }
        if (DATASET_LIST.equals(token.text) && check(TokenType.LBRACKET)
                && peek(1).type == TokenType.NUMBER && peek(2).type == TokenType.RBRACKET
                && peek(3).type == TokenType.DOT && peek(4).type == TokenType.IDENTIFIER) {
            position += 5;
            return new Node.Identifier(tokens.get(position - 1).text);
        }
        return new Node.Identifier(token.text);
    }

    // Token stream helpers.

    private void enter () {
        if (++depth > MAX_DEPTH) {
            throw CoverageProcessException.syntaxError("Script is nested too deeply.");
        }
    }

    /** Long operator chains build deep trees without deep parser recursion, so height is checked per node. */
    private static Node checked (Node node) {
        if (node.height > MAX_HEIGHT) {
            throw CoverageProcessException.syntaxError("Script expression is nested too deeply.");
        }
        return node;
    }

    private Token peek (int offset) {
        return tokens.get(Math.min(position + offset, tokens.size() - 1));
    }

    private boolean check (TokenType type) {
        return peek(0).type == type;
    }

    private boolean match (TokenType type) {
        if (check(type)) {
            position++;
            return true;
        }
        return false;
    }

    private Token advance () {
        Token token = peek(0);
        if (token.type != TokenType.EOF) position++;
        return token;
    }

    private void skipSeparators () {
        while (check(TokenType.SEPARATOR)) {
            position++;
        }
    }

    private void expect (TokenType type) {
        if (!match(type)) {
            throw error("Expected " + type.name().toLowerCase());
        }
    }

    private CoverageProcessException error (String message) {
        Token token = peek(0);
        return CoverageProcessException.syntaxError(
                String.format("%s but found %s at %s.", message, token, token.position()));
    }

}
