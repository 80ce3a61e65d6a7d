package com.astrallang.compiler.parser;

import com.astrallang.compiler.ast.SourceLocation;
import com.astrallang.compiler.ast.expr.*;
import com.astrallang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.astrallang.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        return parseRangeExpr();
    }

    // 范围 start..end（不可链式）
    private Expression parseRangeExpr() {
        Expression start = parseOrExpr();
        if (parser.match(RANGE)) {
            SourceLocation loc = parser.previousLocation();
            Expression end = parseOrExpr();
            return new RangeExpr(loc, start, end);
        }
        return start;
    }

    // ||
    private Expression parseOrExpr() {
        Expression left = parseAndExpr();
        while (parser.match(OR)) {
            SourceLocation loc = parser.previousLocation();
            Expression right = parseAndExpr();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.OR, right);
        }
        return left;
    }

    // &&
    private Expression parseAndExpr() {
        Expression left = parseComparisonExpr();
        while (parser.match(AND)) {
            SourceLocation loc = parser.previousLocation();
            Expression right = parseComparisonExpr();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.AND, right);
        }
        return left;
    }

    // == != < > <= >=
    private Expression parseComparisonExpr() {
        Expression left = parseAdditiveExpr();
        while (parser.checkAny(EQ, NE, LT, GT, LE, GE)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            Expression right = parseAdditiveExpr();

            BinaryExpr.BinaryOp binOp;
            switch (op.getType()) {
                case EQ: binOp = BinaryExpr.BinaryOp.EQ; break;
                case NE: binOp = BinaryExpr.BinaryOp.NE; break;
                case LT: binOp = BinaryExpr.BinaryOp.LT; break;
                case GT: binOp = BinaryExpr.BinaryOp.GT; break;
                case LE: binOp = BinaryExpr.BinaryOp.LE; break;
                case GE: binOp = BinaryExpr.BinaryOp.GE; break;
                default: throw new ParseException("Unexpected comparison operator", op);
            }
            left = new BinaryExpr(loc, left, binOp, right);
        }
        return left;
    }

    // + -
    private Expression parseAdditiveExpr() {
        Expression left = parseMultiplicativeExpr();
        while (parser.checkAny(PLUS, MINUS)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            Expression right = parseMultiplicativeExpr();
            BinaryExpr.BinaryOp binOp = op.getType() == PLUS
                    ? BinaryExpr.BinaryOp.ADD : BinaryExpr.BinaryOp.SUB;
            left = new BinaryExpr(loc, left, binOp, right);
        }
        return left;
    }

    // * / %
    private Expression parseMultiplicativeExpr() {
        Expression left = parseUnaryExpr();
        while (parser.checkAny(MUL, DIV, MOD)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            Expression right = parseUnaryExpr();

            BinaryExpr.BinaryOp binOp;
            switch (op.getType()) {
                case MUL: binOp = BinaryExpr.BinaryOp.MUL; break;
                case DIV: binOp = BinaryExpr.BinaryOp.DIV; break;
                case MOD: binOp = BinaryExpr.BinaryOp.MOD; break;
                default: throw new ParseException("Unexpected operator", op);
            }
            left = new BinaryExpr(loc, left, binOp, right);
        }
        return left;
    }

    // ! - & &mut
    private Expression parseUnaryExpr() {
        if (parser.match(NOT)) {
            SourceLocation loc = parser.previousLocation();
            return new UnaryExpr(loc, UnaryExpr.UnaryOp.NOT, parseUnaryExpr());
        }
        if (parser.match(MINUS)) {
            SourceLocation loc = parser.previousLocation();
            return new UnaryExpr(loc, UnaryExpr.UnaryOp.NEG, parseUnaryExpr());
        }
        if (parser.match(AMPERSAND)) {
            SourceLocation loc = parser.previousLocation();
            boolean mutable = parser.match(KW_MUT);
            return new ReferenceExpr(loc, parseUnaryExpr(), mutable);
        }
        return parsePostfixExpr();
    }

    // 调用、成员访问、方法调用、索引
    private Expression parsePostfixExpr() {
        Expression expr = parsePrimaryExpr();
        while (true) {
            if (parser.check(LPAREN)) {
                if (!(expr instanceof Identifier)) {
                    throw new ParseException("Only named functions can be called", parser.current);
                }
                parser.advance();
                List<Expression> args = parseArguments();
                expr = new CallExpr(expr.getLocation(), ((Identifier) expr).getName(), args);
            } else if (parser.match(DOT)) {
                SourceLocation loc = parser.previousLocation();
                String member = parser.expectIdentifier("Expected member name after '.'");
                if (parser.match(LPAREN)) {
                    List<Expression> args = parseArguments();
                    expr = new MethodCallExpr(loc, expr, member, args);
                } else {
                    expr = new MemberExpr(loc, expr, member);
                }
            } else if (parser.match(LBRACKET)) {
                SourceLocation loc = parser.previousLocation();
                Expression index = parseExpression();
                parser.expect(RBRACKET, "Expected ']' after index");
                expr = new IndexExpr(loc, expr, index);
            } else {
                return expr;
            }
        }
    }

    // '(' 已消费，解析到 ')'
    private List<Expression> parseArguments() {
        List<Expression> args = new ArrayList<Expression>();
        if (!parser.check(RPAREN)) {
            do {
                args.add(parseExpression());
            } while (parser.match(COMMA) && !parser.check(RPAREN));
        }
        parser.expect(RPAREN, "Expected ')' after arguments");
        return args;
    }

    private Expression parsePrimaryExpr() {
        SourceLocation loc = parser.location();

        if (parser.check(INT_LITERAL)) {
            return new Literal(loc, parser.advance().getLiteral(), Literal.LiteralKind.INT);
        }
        if (parser.check(STRING_LITERAL)) {
            return new Literal(loc, parser.advance().getLiteral(), Literal.LiteralKind.STRING);
        }
        if (parser.check(CHAR_LITERAL)) {
            return new Literal(loc, parser.advance().getLiteral(), Literal.LiteralKind.CHAR);
        }
        if (parser.match(KW_TRUE)) {
            return new Literal(loc, Boolean.TRUE, Literal.LiteralKind.BOOL);
        }
        if (parser.match(KW_FALSE)) {
            return new Literal(loc, Boolean.FALSE, Literal.LiteralKind.BOOL);
        }

        // 数组字面量
        if (parser.match(LBRACKET)) {
            List<Expression> elements = new ArrayList<Expression>();
            if (!parser.check(RBRACKET)) {
                do {
                    elements.add(parseExpression());
                } while (parser.match(COMMA) && !parser.check(RBRACKET));
            }
            parser.expect(RBRACKET, "Expected ']' after array elements");
            return new ArrayLiteral(loc, elements);
        }

        // 括号
        if (parser.match(LPAREN)) {
            Expression inner = parseExpression();
            parser.expect(RPAREN, "Expected ')' after expression");
            return inner;
        }

        if (parser.check(IDENTIFIER)) {
            String name = parser.advance().getLexeme();

            if (parser.match(DOUBLE_COLON)) {
                String variant = parser.expectIdentifier("Expected enum variant name after '::'");
                Expression payload = null;
                if (parser.match(LPAREN)) {
                    payload = parseExpression();
                    parser.expect(RPAREN, "Expected ')' after enum payload");
                }
                return new EnumValueExpr(loc, name, variant, payload);
            }

            // 仅大写开头的名称后接 '{' 视为结构体初始化，避免与 if x { 冲突
            if (parser.check(LBRACE) && Character.isUpperCase(name.charAt(0))) {
                return parseStructInit(loc, name);
            }

            return new Identifier(loc, name);
        }

        throw new ParseException("Expected expression", parser.current, "expression");
    }

    // Name { field: expr, ... }
    private StructInitExpr parseStructInit(SourceLocation loc, String typeName) {
        parser.expect(LBRACE, "Expected '{'");
        List<StructInitExpr.FieldInit> fields = new ArrayList<StructInitExpr.FieldInit>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            String fieldName = parser.expectIdentifier("Expected field name");
            parser.expect(COLON, "Expected ':' after field name");
            fields.add(new StructInitExpr.FieldInit(fieldName, parseExpression()));
            if (!parser.match(COMMA)) {
                break;
            }
        }
        parser.expect(RBRACE, "Expected '}' after struct fields");
        return new StructInitExpr(loc, typeName, fields);
    }
}
