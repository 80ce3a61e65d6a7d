package com.astrallang.compiler.ast.decl;

import com.astrallang.compiler.ast.AstNode;
import com.astrallang.compiler.ast.AstVisitor;
import com.astrallang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * 程序根节点：按源码顺序保存顶层声明与语句
 */
public class Program extends AstNode {
    private final List<AstNode> items;

    public Program(SourceLocation location, List<AstNode> items) {
        super(location);
        this.items = items;
    }

    public List<AstNode> getItems() {
        return items;
    }

    /** 仅返回顶层声明 */
    public List<Declaration> getDeclarations() {
        List<Declaration> result = new ArrayList<Declaration>();
        for (AstNode item : items) {
            if (item instanceof Declaration) {
                result.add((Declaration) item);
            }
        }
        return result;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}
