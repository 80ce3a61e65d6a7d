package com.astrallang.compiler.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer 单元测试
 */
class LexerTest {

    private final ByteArrayOutputStream errors = new ByteArrayOutputStream();

    /** 扫描源码，返回所有 token（含 EOF），错误输出写入 errors */
    private List<Token> scan(String source) {
        PrintStream ps = new PrintStream(errors, true, StandardCharsets.UTF_8);
        return new Lexer(source, "<test>", ps).scanTokens();
    }

    /** 扫描源码，返回非 EOF 的 token 列表 */
    private List<Token> tokens(String source) {
        return scan(source).stream()
                .filter(t -> t.getType() != TokenType.EOF)
                .collect(Collectors.toList());
    }

    private List<TokenType> types(String source) {
        return tokens(source).stream().map(Token::getType).collect(Collectors.toList());
    }

    private void assertSingleToken(String source, TokenType expected) {
        List<Token> toks = tokens(source);
        assertEquals(1, toks.size(), "Expected single token from: " + source);
        assertEquals(expected, toks.get(0).getType());
    }

    private void assertSingleToken(String source, TokenType expectedType, Object expectedLiteral) {
        List<Token> toks = tokens(source);
        assertEquals(1, toks.size(), "Expected single token from: " + source);
        assertEquals(expectedType, toks.get(0).getType());
        assertEquals(expectedLiteral, toks.get(0).getLiteral());
    }

    @Nested
    @DisplayName("关键词与标识符")
    class KeywordTests {

        @Test
        @DisplayName("声明与控制流关键词")
        void testKeywords() {
            assertSingleToken("let", TokenType.KW_LET);
            assertSingleToken("mut", TokenType.KW_MUT);
            assertSingleToken("fn", TokenType.KW_FN);
            assertSingleToken("struct", TokenType.KW_STRUCT);
            assertSingleToken("enum", TokenType.KW_ENUM);
            assertSingleToken("match", TokenType.KW_MATCH);
            assertSingleToken("while", TokenType.KW_WHILE);
            assertSingleToken("for", TokenType.KW_FOR);
            assertSingleToken("in", TokenType.KW_IN);
            assertSingleToken("break", TokenType.KW_BREAK);
            assertSingleToken("continue", TokenType.KW_CONTINUE);
            assertSingleToken("return", TokenType.KW_RETURN);
        }

        @Test
        @DisplayName("内置类型关键词")
        void testBuiltinTypes() {
            assertSingleToken("int", TokenType.KW_INT);
            assertSingleToken("bool", TokenType.KW_BOOL);
            assertSingleToken("string", TokenType.KW_STRING);
            assertSingleToken("char", TokenType.KW_CHAR);
            assertTrue(TokenType.KW_STRING.isBuiltinType());
            assertFalse(TokenType.KW_LET.isBuiltinType());
        }

        @Test
        @DisplayName("下划线：单独为通配符，前缀为标识符")
        void testUnderscore() {
            assertSingleToken("_", TokenType.UNDERSCORE);
            assertSingleToken("_tmp", TokenType.IDENTIFIER);
            assertSingleToken("i32", TokenType.IDENTIFIER);
        }
    }

    @Nested
    @DisplayName("运算符")
    class OperatorTests {

        @Test
        @DisplayName("多字符运算符")
        void testMultiCharOperators() {
            assertSingleToken("==", TokenType.EQ);
            assertSingleToken("!=", TokenType.NE);
            assertSingleToken("<=", TokenType.LE);
            assertSingleToken(">=", TokenType.GE);
            assertSingleToken("&&", TokenType.AND);
            assertSingleToken("||", TokenType.OR);
            assertSingleToken("->", TokenType.ARROW);
            assertSingleToken("=>", TokenType.DOUBLE_ARROW);
            assertSingleToken("..", TokenType.RANGE);
            assertSingleToken("::", TokenType.DOUBLE_COLON);
        }

        @Test
        @DisplayName("借用与范围")
        void testReferenceAndRange() {
            assertEquals(List.of(TokenType.AMPERSAND, TokenType.KW_MUT, TokenType.IDENTIFIER),
                    types("&mut x"));
            assertEquals(List.of(TokenType.INT_LITERAL, TokenType.RANGE, TokenType.INT_LITERAL),
                    types("0..10"));
        }

        @Test
        @DisplayName("单个 | 是词法错误")
        void testSinglePipe() {
            assertEquals(List.of(TokenType.ERROR), types("|"));
            assertTrue(errors.toString(StandardCharsets.UTF_8).contains("Lexer error"));
        }
    }

    @Nested
    @DisplayName("字面量")
    class LiteralTests {

        @Test
        @DisplayName("整数字面量")
        void testInteger() {
            assertSingleToken("42", TokenType.INT_LITERAL, 42L);
        }

        @Test
        @DisplayName("整数溢出")
        void testIntegerOverflow() {
            assertSingleToken("99999999999999999999", TokenType.ERROR);
            assertTrue(errors.toString(StandardCharsets.UTF_8).contains("Invalid integer literal"));
        }

        @Test
        @DisplayName("字符串转义")
        void testStringEscapes() {
            assertSingleToken("\"a\\n\\t\\\"b\"", TokenType.STRING_LITERAL, "a\n\t\"b");
        }

        @Test
        @DisplayName("未闭合字符串")
        void testUnterminatedString() {
            assertEquals(List.of(TokenType.ERROR), types("\"abc"));
            assertTrue(errors.toString(StandardCharsets.UTF_8)
                    .contains("[<test>:1:5] Lexer error: Unterminated string literal"));
        }

        @Test
        @DisplayName("非法转义")
        void testInvalidEscape() {
            List<TokenType> result = types("\"\\q\"");
            assertEquals(TokenType.ERROR, result.get(0));
            assertTrue(errors.toString(StandardCharsets.UTF_8).contains("Invalid escape sequence"));
        }

        @Test
        @DisplayName("字符字面量")
        void testChar() {
            assertSingleToken("'a'", TokenType.CHAR_LITERAL, 'a');
            assertSingleToken("'\\n'", TokenType.CHAR_LITERAL, '\n');
        }

        @Test
        @DisplayName("布尔字面量")
        void testBooleans() {
            assertSingleToken("true", TokenType.KW_TRUE);
            assertSingleToken("false", TokenType.KW_FALSE);
        }
    }

    @Nested
    @DisplayName("位置与注释")
    class PositionTests {

        @Test
        @DisplayName("行列号从 1 开始")
        void testLineAndColumn() {
            List<Token> toks = tokens("let x = 1;\n  y");
            Token y = toks.get(toks.size() - 1);
            assertEquals("y", y.getLexeme());
            assertEquals(2, y.getLine());
            assertEquals(3, y.getColumn());

            Token x = toks.get(1);
            assertEquals(1, x.getLine());
            assertEquals(5, x.getColumn());
        }

        @Test
        @DisplayName("行注释被跳过")
        void testComments() {
            assertEquals(List.of(TokenType.KW_LET, TokenType.IDENTIFIER),
                    types("// header\nlet // trailing\nx"));
        }

        @Test
        @DisplayName("以 EOF 结尾")
        void testEof() {
            List<Token> all = scan("");
            assertEquals(1, all.size());
            assertEquals(TokenType.EOF, all.get(0).getType());
        }
    }
}
