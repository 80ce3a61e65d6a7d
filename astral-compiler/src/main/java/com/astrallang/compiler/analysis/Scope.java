package com.astrallang.compiler.analysis;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 作用域帧：按声明顺序保存 name → VariableState
 */
public final class Scope {

    public enum ScopeKind {
        GLOBAL,     // 顶层
        FUNCTION,   // 函数体（含参数）
        BLOCK,      // { ... }
        LOOP,       // for 循环变量
        MATCH_ARM   // match 分支
    }

    private final ScopeKind kind;
    private final Map<String, VariableState> variables = new LinkedHashMap<String, VariableState>();

    public Scope(ScopeKind kind) {
        this.kind = kind;
    }

    public ScopeKind getKind() { return kind; }

    /** 同名重复声明直接替换（let 遮蔽） */
    public void declare(VariableState state) {
        variables.put(state.getName(), state);
    }

    /** 仅查找当前作用域 */
    public VariableState resolveLocal(String name) {
        return variables.get(name);
    }

    public int size() {
        return variables.size();
    }

    @Override
    public String toString() {
        return kind + variables.keySet().toString();
    }
}
