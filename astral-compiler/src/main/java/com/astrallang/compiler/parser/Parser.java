package com.astrallang.compiler.parser;

import com.astrallang.compiler.ast.AstNode;
import com.astrallang.compiler.ast.SourceLocation;
import com.astrallang.compiler.ast.decl.Program;
import com.astrallang.compiler.lexer.Lexer;
import com.astrallang.compiler.lexer.Token;
import com.astrallang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.astrallang.compiler.lexer.TokenType.*;

/**
 * Astral 语法分析器（递归下降）
 *
 * <p>遇到第一个语法错误即抛出 {@link ParseException}；词法错误（ERROR token）在成为当前 token 时转换为解析异常。</p>
 */
public class Parser {

    final Lexer lexer;
    final String fileName;
    Token current;
    Token previous;

    // === Helper 实例 ===
    final TypeParser typeParser = new TypeParser(this);
    final DeclParser declParser = new DeclParser(this);
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(Lexer lexer, String fileName) {
        this.lexer = lexer;
        this.fileName = fileName;
        advance();  // 读取第一个 token
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token
     */
    Token advance() {
        previous = current;
        current = lexer.nextToken();
        if (current.getType() == ERROR) {
            throw new ParseException("Lexical error: " + current.getLiteral(), current);
        }
        return previous;
    }

    /**
     * 检查当前 token 类型
     */
    boolean check(TokenType type) {
        return current.getType() == type;
    }

    /**
     * 检查当前 token 是否为给定类型之一
     */
    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    /**
     * 如果当前 token 匹配，则前进
     */
    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current, type.name());
    }

    /**
     * 期望标识符并返回其名称
     */
    String expectIdentifier(String message) {
        return expect(IDENTIFIER, message).getLexeme();
    }

    /**
     * 创建源码位置
     */
    SourceLocation location() {
        return locationOf(current);
    }

    /**
     * 从之前的 token 创建位置
     */
    SourceLocation previousLocation() {
        return locationOf(previous);
    }

    SourceLocation locationOf(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getColumn(),
                token.getLexeme().length());
    }

    /**
     * 是否到达文件末尾
     */
    boolean isAtEnd() {
        return check(EOF);
    }

    // ============ 程序解析 ============

    /**
     * 解析程序：顶层 fn / struct / enum 声明与语句按源码顺序保存
     */
    public Program parse() {
        SourceLocation loc = location();
        List<AstNode> items = new ArrayList<AstNode>();
        while (!isAtEnd()) {
            if (check(KW_FN)) {
                items.add(declParser.parseFunDecl());
            } else if (check(KW_STRUCT)) {
                items.add(declParser.parseStructDecl());
            } else if (check(KW_ENUM)) {
                items.add(declParser.parseEnumDecl());
            } else {
                items.add(stmtParser.parseStatement());
            }
        }
        return new Program(loc, items);
    }
}
