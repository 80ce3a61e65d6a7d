package com.astrallang.compiler.parser;

import com.astrallang.compiler.ast.SourceLocation;
import com.astrallang.compiler.ast.expr.Expression;
import com.astrallang.compiler.ast.expr.Identifier;
import com.astrallang.compiler.ast.expr.IndexExpr;
import com.astrallang.compiler.ast.stmt.*;
import com.astrallang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.astrallang.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    Statement parseStatement() {
        if (parser.check(LBRACE)) {
            return parseBlock();
        }
        if (parser.check(KW_LET)) {
            return parseLetStmt();
        }
        if (parser.check(KW_IF)) {
            return parseIfStmt();
        }
        if (parser.check(KW_WHILE)) {
            return parseWhileStmt();
        }
        if (parser.check(KW_FOR)) {
            return parseForStmt();
        }
        if (parser.check(KW_MATCH)) {
            return parseMatchStmt();
        }
        if (parser.check(KW_RETURN)) {
            return parseReturnStmt();
        }
        if (parser.check(KW_BREAK)) {
            SourceLocation loc = parser.location();
            parser.advance();
            parser.expect(SEMICOLON, "Expected ';' after 'break'");
            return new BreakStmt(loc);
        }
        if (parser.check(KW_CONTINUE)) {
            SourceLocation loc = parser.location();
            parser.advance();
            parser.expect(SEMICOLON, "Expected ';' after 'continue'");
            return new ContinueStmt(loc);
        }
        return parseExpressionOrAssignment();
    }

    Block parseBlock() {
        SourceLocation loc = parser.location();
        parser.expect(LBRACE, "Expected '{'");
        List<Statement> statements = new ArrayList<Statement>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            statements.add(parseStatement());
        }
        parser.expect(RBRACE, "Expected '}'");
        return new Block(loc, statements);
    }

    // let [mut] name [: type] = expr;
    private LetStmt parseLetStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_LET, "Expected 'let'");
        boolean mutable = parser.match(KW_MUT);
        String name = parser.expectIdentifier("Expected variable name");

        String typeAnnotation = null;
        if (parser.match(COLON)) {
            typeAnnotation = parser.typeParser.parseType();
        }

        parser.expect(ASSIGN, "Expected '=' in let binding");
        Expression initializer = parser.exprParser.parseExpression();
        parser.expect(SEMICOLON, "Expected ';' after let binding");
        return new LetStmt(loc, mutable, name, typeAnnotation, initializer);
    }

    private IfStmt parseIfStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_IF, "Expected 'if'");
        Expression condition = parser.exprParser.parseExpression();
        Block thenBranch = parseBlock();

        Statement elseBranch = null;
        if (parser.match(KW_ELSE)) {
            if (parser.check(KW_IF)) {
                elseBranch = parseIfStmt();
            } else {
                elseBranch = parseBlock();
            }
        }
        return new IfStmt(loc, condition, thenBranch, elseBranch);
    }

    private WhileStmt parseWhileStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_WHILE, "Expected 'while'");
        Expression condition = parser.exprParser.parseExpression();
        Block body = parseBlock();
        return new WhileStmt(loc, condition, body);
    }

    // for name in expr { ... }
    private ForStmt parseForStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_FOR, "Expected 'for'");
        SourceLocation varLoc = parser.location();
        String variable = parser.expectIdentifier("Expected loop variable name");
        parser.expect(KW_IN, "Expected 'in' after loop variable");
        Expression iterable = parser.exprParser.parseExpression();
        Block body = parseBlock();
        return new ForStmt(loc, variable, varLoc, iterable, body);
    }

    // match expr { pattern => body, ... }
    private MatchStmt parseMatchStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_MATCH, "Expected 'match'");
        Expression scrutinee = parser.exprParser.parseExpression();
        parser.expect(LBRACE, "Expected '{' after match value");

        List<MatchArm> arms = new ArrayList<MatchArm>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            SourceLocation armLoc = parser.location();
            Pattern pattern = parsePattern();
            parser.expect(DOUBLE_ARROW, "Expected '=>' after match pattern");

            Statement body;
            if (parser.check(LBRACE)) {
                body = parseBlock();
            } else {
                SourceLocation exprLoc = parser.location();
                body = new ExpressionStmt(exprLoc, parser.exprParser.parseExpression());
            }
            arms.add(new MatchArm(armLoc, pattern, body));
            parser.match(COMMA);
        }
        parser.expect(RBRACE, "Expected '}' after match arms");
        return new MatchStmt(loc, scrutinee, arms);
    }

    // _ | name | Enum::Variant [(name)]
    private Pattern parsePattern() {
        SourceLocation loc = parser.location();
        if (parser.match(UNDERSCORE)) {
            return Pattern.wildcard(loc);
        }
        String name = parser.expectIdentifier("Expected match pattern");
        if (!parser.match(DOUBLE_COLON)) {
            return Pattern.binding(loc, name);
        }
        String variant = parser.expectIdentifier("Expected enum variant name");
        String binding = null;
        if (parser.match(LPAREN)) {
            if (!parser.match(UNDERSCORE)) {
                binding = parser.expectIdentifier("Expected binding name in pattern");
            }
            parser.expect(RPAREN, "Expected ')' after pattern binding");
        }
        return Pattern.enumVariant(loc, name, variant, binding);
    }

    private ReturnStmt parseReturnStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_RETURN, "Expected 'return'");
        Expression value = null;
        if (!parser.check(SEMICOLON)) {
            value = parser.exprParser.parseExpression();
        }
        parser.expect(SEMICOLON, "Expected ';' after return");
        return new ReturnStmt(loc, value);
    }

    /**
     * 表达式语句或赋值：先按表达式解析，遇到 '=' 再检查左侧是否为可赋值位置
     */
    private Statement parseExpressionOrAssignment() {
        SourceLocation loc = parser.location();
        Expression expr = parser.exprParser.parseExpression();

        if (parser.check(ASSIGN)) {
            Token assign = parser.advance();
            Expression value = parser.exprParser.parseExpression();
            parser.expect(SEMICOLON, "Expected ';' after assignment");

            if (expr instanceof Identifier) {
                return new AssignStmt(loc, ((Identifier) expr).getName(), value);
            }
            if (expr instanceof IndexExpr && ((IndexExpr) expr).getTarget() instanceof Identifier) {
                IndexExpr index = (IndexExpr) expr;
                String arrayName = ((Identifier) index.getTarget()).getName();
                return new IndexAssignStmt(loc, arrayName, index.getIndex(), value);
            }
            throw new ParseException("Invalid assignment target", assign);
        }

        // 块末尾的尾表达式可以省略分号
        if (!parser.check(RBRACE)) {
            parser.expect(SEMICOLON, "Expected ';' after expression");
        }
        return new ExpressionStmt(loc, expr);
    }
}
