package com.astrallang.compiler.ast.decl;

import com.astrallang.compiler.ast.AstNode;
import com.astrallang.compiler.ast.AstVisitor;
import com.astrallang.compiler.ast.SourceLocation;

/**
 * 函数参数 [&][mut] name: type
 */
public class Parameter extends AstNode {
    private final String name;
    private final String type;
    private final boolean reference;
    private final boolean mutable;

    public Parameter(SourceLocation location, String name, String type,
                     boolean reference, boolean mutable) {
        super(location);
        this.name = name;
        this.type = type;
        this.reference = reference;
        this.mutable = mutable;
    }

    public String getName() {
        return name;
    }

    /** 声明的类型名（不含引用前缀） */
    public String getType() {
        return type;
    }

    /** 是否为引用参数（&T / &mut T），引用参数不拥有其值 */
    public boolean isReference() {
        return reference;
    }

    public boolean isMutable() {
        return mutable;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParameter(this, context);
    }
}
