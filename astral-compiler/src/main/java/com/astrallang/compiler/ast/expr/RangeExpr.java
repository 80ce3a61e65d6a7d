package com.astrallang.compiler.ast.expr;

import com.astrallang.compiler.ast.AstVisitor;
import com.astrallang.compiler.ast.SourceLocation;

/**
 * 范围表达式 start..end（左闭右开）
 */
public class RangeExpr extends Expression {
    private final Expression start;
    private final Expression end;

    public RangeExpr(SourceLocation location, Expression start, Expression end) {
        super(location);
        this.start = start;
        this.end = end;
    }

    public Expression getStart() {
        return start;
    }

    public Expression getEnd() {
        return end;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRangeExpr(this, context);
    }
}
