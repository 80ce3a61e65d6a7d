package com.astrallang.compiler.ast.expr;

import com.astrallang.compiler.ast.AstVisitor;
import com.astrallang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 方法调用 receiver.method(args)
 */
public class MethodCallExpr extends Expression {
    private final Expression receiver;
    private final String method;
    private final List<Expression> args;

    public MethodCallExpr(SourceLocation location, Expression receiver, String method, List<Expression> args) {
        super(location);
        this.receiver = receiver;
        this.method = method;
        this.args = args;
    }

    public Expression getReceiver() {
        return receiver;
    }

    public String getMethod() {
        return method;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMethodCallExpr(this, context);
    }
}
