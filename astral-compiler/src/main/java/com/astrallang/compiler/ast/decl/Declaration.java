package com.astrallang.compiler.ast.decl;

import com.astrallang.compiler.ast.AstNode;
import com.astrallang.compiler.ast.SourceLocation;

/**
 * 顶层声明基类（fn / struct / enum）
 */
public abstract class Declaration extends AstNode {
    protected final String name;

    protected Declaration(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
