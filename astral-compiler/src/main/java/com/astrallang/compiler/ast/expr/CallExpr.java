package com.astrallang.compiler.ast.expr;

import com.astrallang.compiler.ast.AstVisitor;
import com.astrallang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 函数调用 name(args)，被调用者按函数名解析而非变量
 */
public class CallExpr extends Expression {
    private final String callee;
    private final List<Expression> args;

    public CallExpr(SourceLocation location, String callee, List<Expression> args) {
        super(location);
        this.callee = callee;
        this.args = args;
    }

    public String getCallee() {
        return callee;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
