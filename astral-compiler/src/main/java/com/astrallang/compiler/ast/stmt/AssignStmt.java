package com.astrallang.compiler.ast.stmt;

import com.astrallang.compiler.ast.AstVisitor;
import com.astrallang.compiler.ast.SourceLocation;
import com.astrallang.compiler.ast.expr.Expression;

/**
 * 赋值语句 name = value;
 */
public class AssignStmt extends Statement {
    private final String name;
    private final Expression value;

    public AssignStmt(SourceLocation location, String name, Expression value) {
        super(location);
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignStmt(this, context);
    }
}
