package com.astrallang.compiler.ast.stmt;

import com.astrallang.compiler.ast.AstVisitor;
import com.astrallang.compiler.ast.SourceLocation;
import com.astrallang.compiler.ast.expr.Expression;

/**
 * 数组元素赋值 name[index] = value;
 */
public class IndexAssignStmt extends Statement {
    private final String arrayName;
    private final Expression index;
    private final Expression value;

    public IndexAssignStmt(SourceLocation location, String arrayName, Expression index, Expression value) {
        super(location);
        this.arrayName = arrayName;
        this.index = index;
        this.value = value;
    }

    public String getArrayName() {
        return arrayName;
    }

    public Expression getIndex() {
        return index;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIndexAssignStmt(this, context);
    }
}
