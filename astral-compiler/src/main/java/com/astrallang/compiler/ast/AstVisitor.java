package com.astrallang.compiler.ast;

import com.astrallang.compiler.ast.decl.*;
import com.astrallang.compiler.ast.expr.*;
import com.astrallang.compiler.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>每种节点对应一个抽象方法，没有默认实现：新增节点类型时所有访问者都必须显式处理。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    R visitProgram(Program node, C ctx);

    R visitFunDecl(FunDecl node, C ctx);

    R visitParameter(Parameter node, C ctx);

    R visitStructDecl(StructDecl node, C ctx);

    R visitEnumDecl(EnumDecl node, C ctx);

    // ============ 语句 ============

    R visitBlock(Block node, C ctx);

    R visitLetStmt(LetStmt node, C ctx);

    R visitAssignStmt(AssignStmt node, C ctx);

    R visitIndexAssignStmt(IndexAssignStmt node, C ctx);

    R visitExpressionStmt(ExpressionStmt node, C ctx);

    R visitIfStmt(IfStmt node, C ctx);

    R visitWhileStmt(WhileStmt node, C ctx);

    R visitForStmt(ForStmt node, C ctx);

    R visitMatchStmt(MatchStmt node, C ctx);

    R visitReturnStmt(ReturnStmt node, C ctx);

    R visitBreakStmt(BreakStmt node, C ctx);

    R visitContinueStmt(ContinueStmt node, C ctx);

    // ============ 表达式 ============

    R visitLiteral(Literal node, C ctx);

    R visitIdentifier(Identifier node, C ctx);

    R visitBinaryExpr(BinaryExpr node, C ctx);

    R visitUnaryExpr(UnaryExpr node, C ctx);

    R visitReferenceExpr(ReferenceExpr node, C ctx);

    R visitCallExpr(CallExpr node, C ctx);

    R visitMethodCallExpr(MethodCallExpr node, C ctx);

    R visitMemberExpr(MemberExpr node, C ctx);

    R visitIndexExpr(IndexExpr node, C ctx);

    R visitArrayLiteral(ArrayLiteral node, C ctx);

    R visitStructInitExpr(StructInitExpr node, C ctx);

    R visitEnumValueExpr(EnumValueExpr node, C ctx);

    R visitRangeExpr(RangeExpr node, C ctx);
}
