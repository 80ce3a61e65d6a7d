package com.astrallang.compiler.analysis;

/**
 * 所有权检查结果：成功，或携带唯一一条诊断的失败
 */
public final class AnalysisResult {
    private static final AnalysisResult SUCCESS = new AnalysisResult(null);

    private final Diagnostic diagnostic;

    private AnalysisResult(Diagnostic diagnostic) {
        this.diagnostic = diagnostic;
    }

    public static AnalysisResult success() {
        return SUCCESS;
    }

    public static AnalysisResult failure(Diagnostic diagnostic) {
        if (diagnostic == null) {
            throw new IllegalArgumentException("failure requires a diagnostic");
        }
        return new AnalysisResult(diagnostic);
    }

    public boolean isSuccess() { return diagnostic == null; }

    /** 失败时的诊断，成功时为 null */
    public Diagnostic getDiagnostic() { return diagnostic; }

    @Override
    public String toString() {
        return isSuccess() ? "Success" : "Failure(" + diagnostic.header() + ")";
    }
}
