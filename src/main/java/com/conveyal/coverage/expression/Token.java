package com.conveyal.coverage.expression;

/** One lexical token with the position where it starts, for error messages. */
class Token {

    final TokenType type;

    final String text;

    final int line;

    final int column;

    Token (TokenType type, String text, int line, int column) {
        this.type = type;
        this.text = text;
        this.line = line;
        this.column = column;
    }

    String position () {
        return String.format("line %d, column %d", line, column);
    }

    @Override
    public String toString () {
        return type == TokenType.EOF ? "end of script" : "'" + text.replace("\n", "\\n") + "'";
    }

}
