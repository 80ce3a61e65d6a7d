package com.astrallang.compiler.ast.expr;

import com.astrallang.compiler.ast.AstVisitor;
import com.astrallang.compiler.ast.SourceLocation;

/**
 * 借用表达式 &expr / &mut expr
 */
public class ReferenceExpr extends Expression {
    private final Expression operand;
    private final boolean mutable;

    public ReferenceExpr(SourceLocation location, Expression operand, boolean mutable) {
        super(location);
        this.operand = operand;
        this.mutable = mutable;
    }

    public Expression getOperand() {
        return operand;
    }

    public boolean isMutable() {
        return mutable;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitReferenceExpr(this, context);
    }
}
