package com.conveyal.coverage.expression;

import com.conveyal.coverage.CoverageProcessException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Splits band-script source into tokens. Newlines are statement separators except inside parentheses or brackets,
 * where expressions may wrap freely. A # starts a comment running to the end of the line.
 */
class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "if", TokenType.IF,
            "else", TokenType.ELSE,
            "while", TokenType.WHILE,
            "return", TokenType.RETURN,
            "and", TokenType.AND,
            "or", TokenType.OR,
            "not", TokenType.NOT
    );

    private final String source;

    private final List<Token> tokens = new ArrayList<>();

    private int position = 0;
    private int line = 1;
    private int lineStart = 0;

    /** Depth of open parentheses and brackets, inside which newlines are not separators. */
    private int groupingDepth = 0;

    private Lexer (String source) {
        this.source = source;
    }

    static List<Token> tokenize (String source) {
        Lexer lexer = new Lexer(source);
        lexer.scan();
        return lexer.tokens;
    }

    private void scan () {
        while (position < source.length()) {
            char c = source.charAt(position);
            int column = position - lineStart + 1;
            if (c == '\n') {
                if (groupingDepth == 0) add(TokenType.SEPARATOR, "\n", column);
                position++;
                line++;
                lineStart = position;
            } else if (Character.isWhitespace(c)) {
                position++;
            } else if (c == '#') {
                while (position < source.length() && source.charAt(position) != '\n') position++;
            } else if (isAsciiDigit(c) || (c == '.' && isDigitAt(position + 1))) {
                scanNumber(column);
            } else if (Character.isLetter(c) || c == '_') {
                scanWord(column);
            } else {
                scanSymbol(c, column);
            }
        }
        add(TokenType.EOF, "", position - lineStart + 1);
    }

    /** Only ASCII digits start or continue a number. Other Unicode digits are not numeric literals. */
    private static boolean isAsciiDigit (char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isDigitAt (int index) {
        return index < source.length() && isAsciiDigit(source.charAt(index));
    }

    private void scanNumber (int column) {
        int start = position;
        while (isDigitAt(position)) position++;
        if (position < source.length() && source.charAt(position) == '.') {
            position++;
            while (isDigitAt(position)) position++;
        }
        if (position < source.length() && (source.charAt(position) == 'e' || source.charAt(position) == 'E')) {
            int exponent = position + 1;
            if (exponent < source.length() && (source.charAt(exponent) == '+' || source.charAt(exponent) == '-')) {
                exponent++;
            }
            if (isDigitAt(exponent)) {
                position = exponent;
                while (isDigitAt(position)) position++;
            }
        }
        add(TokenType.NUMBER, source.substring(start, position), column);
    }

    private void scanWord (int column) {
        int start = position;
        while (position < source.length()
                && (Character.isLetterOrDigit(source.charAt(position)) || source.charAt(position) == '_')) {
            position++;
        }
        String word = source.substring(start, position);
        add(KEYWORDS.getOrDefault(word, TokenType.IDENTIFIER), word, column);
    }

    private void scanSymbol (char c, int column) {
        char next = position + 1 < source.length() ? source.charAt(position + 1) : '\0';
        switch (c) {
            case '+': single(TokenType.PLUS, column); break;
            case '-': single(TokenType.MINUS, column); break;
            case '/': single(TokenType.SLASH, column); break;
            case '%': single(TokenType.PERCENT, column); break;
            case ',': single(TokenType.COMMA, column); break;
            case '.': single(TokenType.DOT, column); break;
            case ';': single(TokenType.SEPARATOR, column); break;
            case '{': single(TokenType.LBRACE, column); break;
            case '}': single(TokenType.RBRACE, column); break;
            case '(': groupingDepth++; single(TokenType.LPAREN, column); break;
            case '[': groupingDepth++; single(TokenType.LBRACKET, column); break;
            case ')': groupingDepth = Math.max(0, groupingDepth - 1); single(TokenType.RPAREN, column); break;
            case ']': groupingDepth = Math.max(0, groupingDepth - 1); single(TokenType.RBRACKET, column); break;
            case '*':
                if (next == '*') pair(TokenType.POWER, column);
                else single(TokenType.STAR, column);
                break;
            case '=':
                if (next == '=') pair(TokenType.EQ, column);
                else single(TokenType.ASSIGN, column);
                break;
            case '!':
                if (next == '=') pair(TokenType.NE, column);
                else throw unexpected(c, column);
                break;
            case '<':
                if (next == '=') pair(TokenType.LE, column);
                else single(TokenType.LT, column);
                break;
            case '>':
                if (next == '=') pair(TokenType.GE, column);
                else single(TokenType.GT, column);
                break;
            default:
                throw unexpected(c, column);
        }
    }

    private void single (TokenType type, int column) {
        add(type, source.substring(position, position + 1), column);
        position += 1;
    }

    private void pair (TokenType type, int column) {
        add(type, source.substring(position, position + 2), column);
        position += 2;
    }

    private void add (TokenType type, String text, int column) {
        tokens.add(new Token(type, text, line, column));
    }

    private CoverageProcessException unexpected (char c, int column) {
        return CoverageProcessException.syntaxError(
                String.format("Unexpected character '%c' at line %d, column %d.", c, line, column));
    }

}
