package com.astrallang.compiler.ast.stmt;

import com.astrallang.compiler.ast.AstVisitor;
import com.astrallang.compiler.ast.SourceLocation;
import com.astrallang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * Match 语句 match scrutinee { pattern => body, ... }
 */
public class MatchStmt extends Statement {
    private final Expression scrutinee;
    private final List<MatchArm> arms;

    public MatchStmt(SourceLocation location, Expression scrutinee, List<MatchArm> arms) {
        super(location);
        this.scrutinee = scrutinee;
        this.arms = arms;
    }

    public Expression getScrutinee() {
        return scrutinee;
    }

    public List<MatchArm> getArms() {
        return arms;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMatchStmt(this, context);
    }
}
