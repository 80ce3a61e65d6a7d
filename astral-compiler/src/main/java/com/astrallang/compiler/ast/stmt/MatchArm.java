package com.astrallang.compiler.ast.stmt;

import com.astrallang.compiler.ast.SourceLocation;

/**
 * Match 分支：模式 + 分支体（Block 或 ExpressionStmt）
 */
public final class MatchArm {
    private final SourceLocation location;
    private final Pattern pattern;
    private final Statement body;

    public MatchArm(SourceLocation location, Pattern pattern, Statement body) {
        this.location = location;
        this.pattern = pattern;
        this.body = body;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public Statement getBody() {
        return body;
    }
}
