package com.astrallang.compiler.ast.expr;

import com.astrallang.compiler.ast.AstNode;
import com.astrallang.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}
