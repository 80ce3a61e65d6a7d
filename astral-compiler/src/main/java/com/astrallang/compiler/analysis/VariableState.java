package com.astrallang.compiler.analysis;

import com.astrallang.compiler.ast.SourceLocation;

/**
 * 单个声明的所有权状态
 *
 * <p>状态机：Live&amp;Unborrowed → Live&amp;Borrowed(n) / Consumed。借用计数只增不减。</p>
 */
public final class VariableState {
    private final String name;
    private final String typeName;
    private final boolean mutable;
    private final SourceLocation declaredAt;
    private final VariableKind kind;

    private boolean consumed;
    private SourceLocation movedAt;
    private int borrowCount;

    public VariableState(String name, String typeName, boolean mutable,
                         SourceLocation declaredAt, VariableKind kind) {
        this.name = name;
        this.typeName = typeName;
        this.mutable = mutable;
        this.declaredAt = declaredAt;
        this.kind = kind;
    }

    public String getName() { return name; }
    public String getTypeName() { return typeName; }
    public boolean isMutable() { return mutable; }
    public SourceLocation getDeclaredAt() { return declaredAt; }
    public VariableKind getKind() { return kind; }

    public boolean isConsumed() { return consumed; }

    /** 移动发生的位置，未移动时为 null */
    public SourceLocation getMovedAt() { return movedAt; }

    public int getBorrowCount() { return borrowCount; }
    public boolean isBorrowed() { return borrowCount > 0; }

    /** 标记为已移动 */
    public void consume(SourceLocation at) {
        this.consumed = true;
        this.movedAt = at;
    }

    public void borrow() {
        borrowCount++;
    }

    @Override
    public String toString() {
        return name + ": " + typeName
                + (mutable ? " mut" : "")
                + (consumed ? " consumed" : "")
                + (borrowCount > 0 ? " borrowed(" + borrowCount + ")" : "");
    }
}
