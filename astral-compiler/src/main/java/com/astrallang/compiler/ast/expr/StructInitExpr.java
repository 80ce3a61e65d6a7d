package com.astrallang.compiler.ast.expr;

import com.astrallang.compiler.ast.AstVisitor;
import com.astrallang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 结构体初始化 Name { field: expr, ... }
 */
public class StructInitExpr extends Expression {
    private final String typeName;
    private final List<FieldInit> fields;

    public StructInitExpr(SourceLocation location, String typeName, List<FieldInit> fields) {
        super(location);
        this.typeName = typeName;
        this.fields = fields;
    }

    public String getTypeName() {
        return typeName;
    }

    public List<FieldInit> getFields() {
        return fields;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStructInitExpr(this, context);
    }

    /**
     * 字段初始化项
     */
    public static final class FieldInit {
        private final String name;
        private final Expression value;

        public FieldInit(String name, Expression value) {
            this.name = name;
            this.value = value;
        }

        public String getName() { return name; }
        public Expression getValue() { return value; }
    }
}
