package com.astrallang.compiler.ast;

/**
 * 源码位置信息：起始行列与起始 token 的长度
 */
public final class SourceLocation {
    private final String file;
    private final int line;
    private final int column;
    private final int length;

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0, 0);

    public SourceLocation(String file, int line, int column, int length) {
        this.file = file;
        this.line = line;
        this.column = column;
        this.length = length;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getLength() {
        return length;
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
