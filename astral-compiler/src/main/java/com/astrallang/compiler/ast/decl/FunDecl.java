package com.astrallang.compiler.ast.decl;

import com.astrallang.compiler.ast.AstVisitor;
import com.astrallang.compiler.ast.SourceLocation;
import com.astrallang.compiler.ast.stmt.Block;

import java.util.List;

/**
 * 函数声明 fn name(params) -> type { ... }
 */
public class FunDecl extends Declaration {
    private final List<Parameter> params;
    private final String returnType;  // 可选
    private final Block body;

    public FunDecl(SourceLocation location, String name, List<Parameter> params,
                   String returnType, Block body) {
        super(location, name);
        this.params = params;
        this.returnType = returnType;
        this.body = body;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public String getReturnType() {
        return returnType;
    }

    public boolean hasReturnType() {
        return returnType != null;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunDecl(this, context);
    }
}
