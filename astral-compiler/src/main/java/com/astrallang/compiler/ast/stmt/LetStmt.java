package com.astrallang.compiler.ast.stmt;

import com.astrallang.compiler.ast.AstVisitor;
import com.astrallang.compiler.ast.SourceLocation;
import com.astrallang.compiler.ast.expr.Expression;

/**
 * 变量绑定 let [mut] name [: type] = initializer;
 */
public class LetStmt extends Statement {
    private final boolean mutable;
    private final String name;
    private final String typeAnnotation;  // 可选
    private final Expression initializer;

    public LetStmt(SourceLocation location, boolean mutable, String name,
                   String typeAnnotation, Expression initializer) {
        super(location);
        this.mutable = mutable;
        this.name = name;
        this.typeAnnotation = typeAnnotation;
        this.initializer = initializer;
    }

    public boolean isMutable() {
        return mutable;
    }

    public String getName() {
        return name;
    }

    public String getTypeAnnotation() {
        return typeAnnotation;
    }

    public boolean hasTypeAnnotation() {
        return typeAnnotation != null;
    }

    public Expression getInitializer() {
        return initializer;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLetStmt(this, context);
    }
}
