package com.astrallang.compiler.ast.stmt;

import com.astrallang.compiler.ast.AstVisitor;
import com.astrallang.compiler.ast.SourceLocation;
import com.astrallang.compiler.ast.expr.Expression;

/**
 * If 语句，else 分支为 Block 或嵌套的 IfStmt
 */
public class IfStmt extends Statement {
    private final Expression condition;
    private final Block thenBranch;
    private final Statement elseBranch;  // 可选

    public IfStmt(SourceLocation location, Expression condition, Block thenBranch, Statement elseBranch) {
        super(location);
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elseBranch = elseBranch;
    }

    public Expression getCondition() {
        return condition;
    }

    public Block getThenBranch() {
        return thenBranch;
    }

    public Statement getElseBranch() {
        return elseBranch;
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfStmt(this, context);
    }
}
