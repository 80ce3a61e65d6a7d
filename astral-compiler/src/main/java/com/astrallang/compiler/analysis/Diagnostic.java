package com.astrallang.compiler.analysis;

import com.astrallang.compiler.ast.SourceLocation;

/**
 * 所有权检查诊断：带位置的主消息，可选 Note / Help
 */
public final class Diagnostic {
    private final ErrorKind kind;
    private final String file;
    private final int line;
    private final int column;
    private final int length;   // 插入符宽度，至少为 1
    private final String message;
    private final String note;  // 可选
    private final String help;  // 可选

    public Diagnostic(ErrorKind kind, String file, int line, int column,
                      String message, String note, String help) {
        this(kind, file, line, column, 1, message, note, help);
    }

    public Diagnostic(ErrorKind kind, String file, SourceLocation location,
                      String message, String note, String help) {
        this(kind, file, location.getLine(), location.getColumn(), location.getLength(),
                message, note, help);
    }

    private Diagnostic(ErrorKind kind, String file, int line, int column, int length,
                       String message, String note, String help) {
        this.kind = kind;
        this.file = file;
        this.line = line;
        this.column = column;
        this.length = Math.max(1, length);
        this.message = message;
        this.note = note;
        this.help = help;
    }

    public ErrorKind getKind() { return kind; }
    public String getFile() { return file; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public int getLength() { return length; }
    public String getMessage() { return message; }
    public String getNote() { return note; }
    public String getHelp() { return help; }

    public boolean hasNote() { return note != null; }
    public boolean hasHelp() { return help != null; }

    /** 诊断头部 file:line:column: Error: message */
    public String header() {
        return file + ":" + line + ":" + column + ": Error: " + message;
    }

    /**
     * 不含源码片段的完整格式
     */
    public String format() {
        StringBuilder sb = new StringBuilder(header());
        if (note != null) {
            sb.append('\n').append("  Note: ").append(note);
        }
        if (help != null) {
            sb.append('\n').append("  Help: ").append(help);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return format();
    }
}
