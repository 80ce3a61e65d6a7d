package com.astrallang.compiler.ast.expr;

import com.astrallang.compiler.ast.AstVisitor;
import com.astrallang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 数组字面量 [a, b, c]
 */
public class ArrayLiteral extends Expression {
    private final List<Expression> elements;

    public ArrayLiteral(SourceLocation location, List<Expression> elements) {
        super(location);
        this.elements = elements;
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArrayLiteral(this, context);
    }
}
