package com.astrallang.compiler.lexer;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Astral 词法分析器
 */
public class Lexer {
    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    private final PrintStream errStream;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 声明
        map.put("let", TokenType.KW_LET);
        map.put("mut", TokenType.KW_MUT);
        map.put("fn", TokenType.KW_FN);
        map.put("struct", TokenType.KW_STRUCT);
        map.put("enum", TokenType.KW_ENUM);

        // 控制流
        map.put("if", TokenType.KW_IF);
        map.put("else", TokenType.KW_ELSE);
        map.put("match", TokenType.KW_MATCH);
        map.put("while", TokenType.KW_WHILE);
        map.put("for", TokenType.KW_FOR);
        map.put("in", TokenType.KW_IN);
        map.put("return", TokenType.KW_RETURN);
        map.put("break", TokenType.KW_BREAK);
        map.put("continue", TokenType.KW_CONTINUE);

        map.put("true", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);

        // 内置类型
        map.put("int", TokenType.KW_INT);
        map.put("bool", TokenType.KW_BOOL);
        map.put("string", TokenType.KW_STRING);
        map.put("char", TokenType.KW_CHAR);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    public Lexer(String source, String fileName) {
        this(source, fileName, System.err);
    }

    public Lexer(String source, String fileName, PrintStream errStream) {
        this.source = source;
        this.fileName = fileName;
        this.errStream = errStream;
    }

    /**
     * 获取下一个 Token（流式接口）
     *
     * @return 下一个 Token
     */
    public Token nextToken() {
        skipWhitespace();

        if (isAtEnd()) {
            return new Token(TokenType.EOF, "", null, line, column);
        }

        start = current;
        scanToken();

        if (!tokens.isEmpty()) {
            return tokens.remove(tokens.size() - 1);
        }

        // 注释不产生 token
        return nextToken();
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\r' || c == '\t') {
                advance();
            } else if (c == '\n') {
                advance();
                newLine();
            } else {
                break;
            }
        }
    }

    /**
     * 执行词法分析，返回 Token 列表（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        List<Token> result = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            result.add(token);
        } while (token.getType() != TokenType.EOF);
        return result;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            // 单字符 Token
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '+': addToken(TokenType.PLUS); break;
            case '*': addToken(TokenType.MUL); break;
            case '%': addToken(TokenType.MOD); break;

            case '_':
                if (isAlphaNumeric(peek())) {
                    identifier();
                } else {
                    addToken(TokenType.UNDERSCORE);
                }
                break;

            // 可能是多字符的 Token
            case '.':
                addToken(match('.') ? TokenType.RANGE : TokenType.DOT);
                break;

            case ':':
                addToken(match(':') ? TokenType.DOUBLE_COLON : TokenType.COLON);
                break;

            case '-':
                addToken(match('>') ? TokenType.ARROW : TokenType.MINUS);
                break;

            case '/':
                if (match('/')) {
                    // 单行注释
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else {
                    addToken(TokenType.DIV);
                }
                break;

            case '=':
                if (match('=')) {
                    addToken(TokenType.EQ);
                } else if (match('>')) {
                    addToken(TokenType.DOUBLE_ARROW);
                } else {
                    addToken(TokenType.ASSIGN);
                }
                break;

            case '!':
                addToken(match('=') ? TokenType.NE : TokenType.NOT);
                break;

            case '<':
                addToken(match('=') ? TokenType.LE : TokenType.LT);
                break;

            case '>':
                addToken(match('=') ? TokenType.GE : TokenType.GT);
                break;

            case '&':
                addToken(match('&') ? TokenType.AND : TokenType.AMPERSAND);
                break;

            case '|':
                if (match('|')) {
                    addToken(TokenType.OR);
                } else {
                    error("Unexpected character '|'. Did you mean '||'?");
                }
                break;

            case '"':
                string();
                break;

            case '\'':
                character();
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_' ||
               Character.isLetter(c);
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        int tokenColumn = column - (current - start);
        tokens.add(new Token(type, lexeme, literal, line, tokenColumn));
    }

    // === 复杂 Token 扫描 ===

    private void string() {
        StringBuilder value = new StringBuilder();

        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\n') {
                error("Unterminated string literal");
                return;
            }
            if (peek() == '\\') {
                advance();
                int escaped = escapeChar();
                if (escaped < 0) return;
                value.append((char) escaped);
            } else {
                value.append(advance());
            }
        }

        if (isAtEnd()) {
            error("Unterminated string literal");
            return;
        }

        advance(); // 闭合的 "
        addToken(TokenType.STRING_LITERAL, value.toString());
    }

    /** 解析转义字符，非法转义时报错并返回 -1 */
    private int escapeChar() {
        if (isAtEnd()) {
            error("Unterminated escape sequence");
            return -1;
        }
        char c = advance();
        switch (c) {
            case 'n':  return '\n';
            case 't':  return '\t';
            case 'r':  return '\r';
            case '0':  return '\0';
            case '\\': return '\\';
            case '"':  return '"';
            case '\'': return '\'';
            default:
                error("Invalid escape sequence: \\" + c);
                return -1;
        }
    }

    private void character() {
        if (isAtEnd() || peek() == '\n') {
            error("Unterminated char literal");
            return;
        }

        char value;
        if (peek() == '\\') {
            advance();
            int escaped = escapeChar();
            if (escaped < 0) return;
            value = (char) escaped;
        } else {
            value = advance();
        }

        if (peek() != '\'') {
            error("Unterminated char literal");
            return;
        }
        advance();

        addToken(TokenType.CHAR_LITERAL, value);
    }

    private void number() {
        while (isDigit(peek())) advance();

        String text = source.substring(start, current);
        try {
            addToken(TokenType.INT_LITERAL, Long.parseLong(text));
        } catch (NumberFormatException e) {
            error("Invalid integer literal: " + text);
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;
        addToken(type);
    }

    private void error(String message) {
        String errorMsg = String.format("[%s:%d:%d] Lexer error: %s",
                fileName, line, column, message);
        errStream.println(errorMsg);
        addToken(TokenType.ERROR, message);
    }
}
