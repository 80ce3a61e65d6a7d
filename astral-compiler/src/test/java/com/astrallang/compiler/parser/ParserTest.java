package com.astrallang.compiler.parser;

import com.astrallang.compiler.ast.AstNode;
import com.astrallang.compiler.ast.decl.*;
import com.astrallang.compiler.ast.expr.*;
import com.astrallang.compiler.ast.stmt.*;
import com.astrallang.compiler.lexer.Lexer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private Program parse(String source) {
        PrintStream sink = new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8);
        return new Parser(new Lexer(source, "<test>", sink), "<test>").parse();
    }

    private AstNode single(String source) {
        List<AstNode> items = parse(source).getItems();
        assertEquals(1, items.size());
        return items.get(0);
    }

    /** 解析 let 语句的初始化表达式 */
    private Expression initializer(String source) {
        AstNode node = single(source);
        assertInstanceOf(LetStmt.class, node);
        return ((LetStmt) node).getInitializer();
    }

    @Nested
    @DisplayName("声明")
    class DeclarationTests {

        @Test
        @DisplayName("函数参数的引用与可变标记")
        void testFunctionParameters() {
            FunDecl fn = (FunDecl) single(
                    "fn f(&s: string, mut n: int, r: &mut Point) -> int { return n; }");

            assertEquals("f", fn.getName());
            assertEquals("int", fn.getReturnType());
            List<Parameter> params = fn.getParams();
            assertEquals(3, params.size());

            assertTrue(params.get(0).isReference());
            assertFalse(params.get(0).isMutable());
            assertEquals("string", params.get(0).getType());

            assertFalse(params.get(1).isReference());
            assertTrue(params.get(1).isMutable());

            assertTrue(params.get(2).isReference());
            assertTrue(params.get(2).isMutable());
            assertEquals("Point", params.get(2).getType());
        }

        @Test
        @DisplayName("无返回类型的函数")
        void testFunctionWithoutReturnType() {
            FunDecl fn = (FunDecl) single("fn main() { }");
            assertFalse(fn.hasReturnType());
            assertTrue(fn.getBody().getStatements().isEmpty());
        }

        @Test
        @DisplayName("结构体与枚举")
        void testStructAndEnum() {
            Program program = parse(
                    "struct Point { x: int; y: int; }\n" +
                    "enum Shape { Empty, Circle(int), Named(string) }");
            List<Declaration> decls = program.getDeclarations();
            assertEquals(2, decls.size());

            StructDecl point = (StructDecl) decls.get(0);
            assertEquals(2, point.getFields().size());
            assertEquals("y", point.getFields().get(1).getName());
            assertEquals("int", point.getFields().get(1).getType());

            EnumDecl shape = (EnumDecl) decls.get(1);
            assertEquals(3, shape.getVariants().size());
            assertFalse(shape.getVariants().get(0).hasPayload());
            assertEquals("string", shape.getVariants().get(2).getPayloadType());
        }

        @Test
        @DisplayName("顶层声明与语句保持源码顺序")
        void testSourceOrder() {
            List<AstNode> items = parse("let a = 1;\nfn f() { }\nlet b = 2;").getItems();
            assertInstanceOf(LetStmt.class, items.get(0));
            assertInstanceOf(FunDecl.class, items.get(1));
            assertInstanceOf(LetStmt.class, items.get(2));
        }
    }

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("let 的可变性与类型注解")
        void testLetWithAnnotation() {
            LetStmt let = (LetStmt) single("let mut xs: [int; 3] = [1, 2, 3];");
            assertTrue(let.isMutable());
            assertEquals("xs", let.getName());
            assertEquals("[int; 3]", let.getTypeAnnotation());
            assertEquals(3, ((ArrayLiteral) let.getInitializer()).getElements().size());
        }

        @Test
        @DisplayName("引用类型注解")
        void testReferenceAnnotation() {
            LetStmt let = (LetStmt) single("let r: &string = &s;");
            assertEquals("&string", let.getTypeAnnotation());
        }

        @Test
        @DisplayName("赋值与数组元素赋值")
        void testAssignments() {
            List<AstNode> items = parse("x = 1;\nxs[0] = 2;").getItems();
            AssignStmt assign = (AssignStmt) items.get(0);
            assertEquals("x", assign.getName());
            assertEquals(1, assign.getLocation().getLine());

            IndexAssignStmt indexAssign = (IndexAssignStmt) items.get(1);
            assertEquals("xs", indexAssign.getArrayName());
            assertEquals(2, indexAssign.getLocation().getLine());
        }

        @Test
        @DisplayName("小写名称后的 { 是代码块而不是结构体初始化")
        void testIfConditionIsNotStructInit() {
            IfStmt stmt = (IfStmt) single("if ready { go(); } else if done { } else { }");
            assertInstanceOf(Identifier.class, stmt.getCondition());
            assertInstanceOf(IfStmt.class, stmt.getElseBranch());
            assertTrue(((IfStmt) stmt.getElseBranch()).hasElse());
        }

        @Test
        @DisplayName("for 循环与范围")
        void testForRange() {
            ForStmt loop = (ForStmt) single("for i in 0..10 { continue; }");
            assertEquals("i", loop.getVariable());
            assertInstanceOf(RangeExpr.class, loop.getIterable());
            assertInstanceOf(ContinueStmt.class, loop.getBody().getStatements().get(0));
        }

        @Test
        @DisplayName("match 模式")
        void testMatchPatterns() {
            MatchStmt match = (MatchStmt) single(
                    "match shape {\n" +
                    "    Shape::Circle(r) => { let a = r; }\n" +
                    "    Shape::Empty => done(),\n" +
                    "    other => { }\n" +
                    "    _ => { }\n" +
                    "}");
            List<MatchArm> arms = match.getArms();
            assertEquals(4, arms.size());

            Pattern circle = arms.get(0).getPattern();
            assertEquals(Pattern.PatternKind.ENUM_VARIANT, circle.getKind());
            assertEquals("Shape", circle.getEnumName());
            assertEquals("Circle", circle.getVariant());
            assertEquals("r", circle.getBinding());

            assertFalse(arms.get(1).getPattern().hasBinding());
            assertInstanceOf(ExpressionStmt.class, arms.get(1).getBody());
            assertEquals(Pattern.PatternKind.BINDING, arms.get(2).getPattern().getKind());
            assertEquals(Pattern.PatternKind.WILDCARD, arms.get(3).getPattern().getKind());
        }

        @Test
        @DisplayName("块末尾的尾表达式可以省略分号")
        void testTailExpression() {
            FunDecl fn = (FunDecl) single("fn add(a: int, b: int) -> int { a + b }");
            assertInstanceOf(ExpressionStmt.class, fn.getBody().getStatements().get(0));
        }
    }

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("乘法优先于加法")
        void testPrecedence() {
            BinaryExpr add = (BinaryExpr) initializer("let x = 1 + 2 * 3;");
            assertEquals(BinaryExpr.BinaryOp.ADD, add.getOperator());
            assertEquals(BinaryExpr.BinaryOp.MUL, ((BinaryExpr) add.getRight()).getOperator());
        }

        @Test
        @DisplayName("比较优先于逻辑运算")
        void testLogicalPrecedence() {
            BinaryExpr or = (BinaryExpr) initializer("let x = a < b || c == d && e;");
            assertEquals(BinaryExpr.BinaryOp.OR, or.getOperator());
            assertEquals(BinaryExpr.BinaryOp.LT, ((BinaryExpr) or.getLeft()).getOperator());
            assertEquals(BinaryExpr.BinaryOp.AND, ((BinaryExpr) or.getRight()).getOperator());
        }

        @Test
        @DisplayName("借用表达式")
        void testReference() {
            ReferenceExpr ref = (ReferenceExpr) initializer("let r = &mut x;");
            assertTrue(ref.isMutable());
            assertEquals("x", ((Identifier) ref.getOperand()).getName());
        }

        @Test
        @DisplayName("调用、方法调用、成员访问与索引")
        void testPostfix() {
            CallExpr call = (CallExpr) initializer("let v = take(a, &b);");
            assertEquals("take", call.getCallee());
            assertInstanceOf(ReferenceExpr.class, call.getArgs().get(1));

            MethodCallExpr method = (MethodCallExpr) initializer("let n = s.len();");
            assertEquals("len", method.getMethod());
            assertInstanceOf(Identifier.class, method.getReceiver());

            MemberExpr member = (MemberExpr) initializer("let x = p.x;");
            assertEquals("x", member.getMember());

            IndexExpr index = (IndexExpr) initializer("let e = xs[i + 1];");
            assertInstanceOf(BinaryExpr.class, index.getIndex());
        }

        @Test
        @DisplayName("结构体初始化与枚举值")
        void testAggregates() {
            StructInitExpr init = (StructInitExpr) initializer("let p = Point { x: 1, y: two };");
            assertEquals("Point", init.getTypeName());
            assertEquals(2, init.getFields().size());
            assertEquals("y", init.getFields().get(1).getName());

            EnumValueExpr value = (EnumValueExpr) initializer("let s = Shape::Circle(5);");
            assertEquals("Shape", value.getEnumName());
            assertEquals("Circle", value.getVariant());
            assertTrue(value.hasPayload());
        }

        @Test
        @DisplayName("字面量类型")
        void testLiterals() {
            assertEquals(Literal.LiteralKind.INT, ((Literal) initializer("let a = 7;")).getKind());
            assertEquals(Literal.LiteralKind.STRING, ((Literal) initializer("let a = \"s\";")).getKind());
            assertEquals(Literal.LiteralKind.CHAR, ((Literal) initializer("let a = 'c';")).getKind());
            assertEquals(Boolean.TRUE, ((Literal) initializer("let a = true;")).getValue());
        }

        @Test
        @DisplayName("标识符携带源码位置")
        void testIdentifierLocation() {
            Identifier id = (Identifier) initializer("let a =\n    value;");
            assertEquals(2, id.getLocation().getLine());
            assertEquals(5, id.getLocation().getColumn());
        }
    }

    @Nested
    @DisplayName("语法错误")
    class ErrorTests {

        @Test
        @DisplayName("缺少表达式")
        void testMissingExpression() {
            ParseException e = assertThrows(ParseException.class, () -> parse("let x = ;"));
            assertEquals(";", e.getToken().getLexeme());
            assertTrue(e.getMessage().contains("Expected expression"));
            assertTrue(e.getMessage().contains("at line 1, column 9 (found ';')"), e.getMessage());
        }

        @Test
        @DisplayName("输入提前结束")
        void testUnexpectedEndOfInput() {
            ParseException e = assertThrows(ParseException.class, () -> parse("let x = 1"));
            assertTrue(e.getMessage().contains("(found end of input)"), e.getMessage());
            assertTrue(e.getMessage().endsWith(", expected: SEMICOLON"), e.getMessage());
        }

        @Test
        @DisplayName("缺少分号")
        void testMissingSemicolon() {
            ParseException e = assertThrows(ParseException.class, () -> parse("let x = 1\nlet y = 2;"));
            assertEquals("SEMICOLON", e.getExpected());
            assertEquals(2, e.getToken().getLine());
        }

        @Test
        @DisplayName("非法赋值目标")
        void testInvalidAssignmentTarget() {
            assertThrows(ParseException.class, () -> parse("1 = 2;"));
        }

        @Test
        @DisplayName("词法错误转换为解析异常")
        void testLexicalError() {
            ParseException e = assertThrows(ParseException.class, () -> parse("let s = \"abc"));
            assertTrue(e.getRawMessage().startsWith("Lexical error"));
        }
    }
}
