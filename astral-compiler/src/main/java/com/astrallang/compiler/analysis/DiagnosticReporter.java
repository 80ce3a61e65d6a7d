package com.astrallang.compiler.analysis;

/**
 * 诊断渲染：头部 + 源码片段（行号 + 插入符）+ Note / Help
 *
 * <pre>
 * main.astral:3:9: Error: use of moved value 'x'
 *    |
 *  3 | let z = x;
 *    |         ^
 *   Note: value declared at line 1 was moved at line 2, cannot be used again
 *   Help: consider borrowing '&amp;x' to keep ownership in the current scope
 * </pre>
 */
public final class DiagnosticReporter {

    private final boolean showSnippet;
    private final boolean showNotes;

    public DiagnosticReporter() {
        this(true, true);
    }

    public DiagnosticReporter(boolean showSnippet, boolean showNotes) {
        this.showSnippet = showSnippet;
        this.showNotes = showNotes;
    }

    public String render(Diagnostic diagnostic, String source) {
        StringBuilder sb = new StringBuilder(diagnostic.header());
        if (showSnippet && source != null) {
            appendSnippet(sb, source, diagnostic.getLine(), diagnostic.getColumn(), diagnostic.getLength());
        }
        if (showNotes) {
            if (diagnostic.hasNote()) {
                sb.append('\n').append("  Note: ").append(diagnostic.getNote());
            }
            if (diagnostic.hasHelp()) {
                sb.append('\n').append("  Help: ").append(diagnostic.getHelp());
            }
        }
        return sb.toString();
    }

    /**
     * 源码片段：行号不存在时不输出任何内容
     */
    public static String snippet(String source, int line, int column, int length) {
        StringBuilder sb = new StringBuilder();
        appendSnippet(sb, source, line, column, length);
        return sb.toString();
    }

    private static void appendSnippet(StringBuilder sb, String source, int line, int column, int length) {
        String[] lines = source.split("\n", -1);
        if (line < 1 || line > lines.length) {
            return;
        }
        String lineText = lines[line - 1];
        if (lineText.endsWith("\r")) {
            lineText = lineText.substring(0, lineText.length() - 1);
        }
        String lineNum = String.valueOf(line);
        StringBuilder gutter = new StringBuilder();
        for (int i = 0; i < lineNum.length() + 1; i++) gutter.append(' ');

        sb.append('\n').append(gutter).append(" |");
        sb.append('\n').append(' ').append(lineNum).append(" | ").append(lineText);
        sb.append('\n').append(gutter).append(" | ");
        for (int i = 1; i < column; i++) {
            // 保留制表符以对齐
            sb.append(i - 1 < lineText.length() && lineText.charAt(i - 1) == '\t' ? '\t' : ' ');
        }
        for (int i = 0; i < Math.max(1, length); i++) sb.append('^');
    }
}
