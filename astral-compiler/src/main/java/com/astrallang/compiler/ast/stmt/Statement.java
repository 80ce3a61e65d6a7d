package com.astrallang.compiler.ast.stmt;

import com.astrallang.compiler.ast.AstNode;
import com.astrallang.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
