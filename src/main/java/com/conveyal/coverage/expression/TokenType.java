package com.conveyal.coverage.expression;

/** Lexical categories of the band-script language. */
enum TokenType {
    NUMBER, IDENTIFIER,
    // Keywords
    IF, ELSE, WHILE, RETURN, AND, OR, NOT,
    // Operators
    PLUS, MINUS, STAR, SLASH, PERCENT, POWER,
    EQ, NE, LT, LE, GT, GE, ASSIGN,
    // Punctuation
    LPAREN, RPAREN, LBRACKET, RBRACKET, LBRACE, RBRACE, COMMA, DOT,
    // Statement separators, a newline or a semicolon.
    SEPARATOR,
    EOF
}
