package com.astrallang.compiler.lexer;

/**
 * 词法单元（行列号从 1 开始）
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;  // 字面量的值，其余为 null
    private final int line;
    private final int column;

    public Token(TokenType type, String lexeme, Object literal, int line, int column) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    public Object getLiteral() {
        return literal;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String toString() {
        return type + " '" + lexeme + "' @" + line + ":" + column;
    }
}
