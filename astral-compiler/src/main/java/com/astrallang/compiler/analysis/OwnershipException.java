package com.astrallang.compiler.analysis;

/**
 * 检查过程中遇到第一个违规时抛出，在 {@link OwnershipChecker#analyze} 边界转换为失败结果
 */
public class OwnershipException extends RuntimeException {
    private final Diagnostic diagnostic;

    public OwnershipException(Diagnostic diagnostic) {
        super(diagnostic.getMessage());
        this.diagnostic = diagnostic;
    }

    public Diagnostic getDiagnostic() {
        return diagnostic;
    }
}
