package com.astrallang.compiler.lexer;

/**
 * Astral 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    INT_LITERAL,
    CHAR_LITERAL,
    STRING_LITERAL,

    // === 标识符 ===
    IDENTIFIER,
    UNDERSCORE,             // _

    // === 关键词 - 声明 ===
    KW_LET, KW_MUT, KW_FN, KW_STRUCT, KW_ENUM,

    // === 关键词 - 控制流 ===
    KW_IF, KW_ELSE, KW_MATCH, KW_WHILE, KW_FOR, KW_IN,
    KW_RETURN, KW_BREAK, KW_CONTINUE,

    // === 关键词 - 字面量 ===
    KW_TRUE, KW_FALSE,

    // === 关键词 - 内置类型 ===
    KW_INT, KW_BOOL, KW_STRING, KW_CHAR,

    // === 操作符 - 算术 ===
    PLUS,           // +
    MINUS,          // -
    MUL,            // *
    DIV,            // /
    MOD,            // %

    // === 操作符 - 比较 ===
    EQ,             // ==
    NE,             // !=
    LT,             // <
    GT,             // >
    LE,             // <=
    GE,             // >=

    // === 操作符 - 逻辑 ===
    AND,            // &&
    OR,             // ||
    NOT,            // !

    // === 操作符 - 其他 ===
    ASSIGN,         // =
    AMPERSAND,      // &
    ARROW,          // ->
    DOUBLE_ARROW,   // =>
    RANGE,          // ..
    DOUBLE_COLON,   // ::

    // === 分隔符 ===
    LPAREN, RPAREN,
    LBRACE, RBRACE,
    LBRACKET, RBRACKET,
    SEMICOLON,
    COLON,
    COMMA,
    DOT,

    // === 特殊 ===
    ERROR,
    EOF;

    /** 是否为内置类型关键词 */
    public boolean isBuiltinType() {
        return this == KW_INT || this == KW_BOOL || this == KW_STRING || this == KW_CHAR;
    }
}
