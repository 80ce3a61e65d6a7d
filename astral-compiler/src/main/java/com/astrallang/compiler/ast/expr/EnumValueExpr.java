package com.astrallang.compiler.ast.expr;

import com.astrallang.compiler.ast.AstVisitor;
import com.astrallang.compiler.ast.SourceLocation;

/**
 * 枚举值 Enum::Variant / Enum::Variant(payload)
 */
public class EnumValueExpr extends Expression {
    private final String enumName;
    private final String variant;
    private final Expression payload;  // 可选

    public EnumValueExpr(SourceLocation location, String enumName, String variant, Expression payload) {
        super(location);
        this.enumName = enumName;
        this.variant = variant;
        this.payload = payload;
    }

    public String getEnumName() {
        return enumName;
    }

    public String getVariant() {
        return variant;
    }

    public Expression getPayload() {
        return payload;
    }

    public boolean hasPayload() {
        return payload != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEnumValueExpr(this, context);
    }
}
