package com.astrallang.compiler.parser;

import com.astrallang.compiler.lexer.Token;
import com.astrallang.compiler.lexer.TokenType;

/**
 * 语法错误：携带出错 token，消息附带位置与期望的 token
 */
public class ParseException extends RuntimeException {
    private final Token token;
    private final String expected;  // 可选

    public ParseException(String message, Token token) {
        this(message, token, null);
    }

    public ParseException(String message, Token token, String expected) {
        super(message);
        this.token = token;
        this.expected = expected;
    }

    public Token getToken() {
        return token;
    }

    public String getExpected() {
        return expected;
    }

    /** 不含位置信息的原始消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        String message = super.getMessage();
        if (token != null) {
            message += " at line " + token.getLine() + ", column " + token.getColumn() + " (found " + describe(token) + ")";
        }
        return expected != null ? message + ", expected: " + expected : message;
    }

    private static String describe(Token token) {
        return token.getType() == TokenType.EOF ? "end of input" : "'" + token.getLexeme() + "'";
    }
}
