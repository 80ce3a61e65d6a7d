package com.astrallang.compiler.analysis;

import java.util.ArrayList;
import java.util.List;

/**
 * 作用域栈：最内层在末尾，全局作用域在构造时压入且永不弹出
 */
public final class ScopeStack {
    private final List<Scope> scopes = new ArrayList<Scope>();

    public ScopeStack() {
        scopes.add(new Scope(Scope.ScopeKind.GLOBAL));
    }

    public Scope pushScope(Scope.ScopeKind kind) {
        Scope scope = new Scope(kind);
        scopes.add(scope);
        return scope;
    }

    public Scope popScope() {
        if (scopes.size() == 1) {
            throw new IllegalStateException("Cannot pop the global scope");
        }
        return scopes.remove(scopes.size() - 1);
    }

    /** 声明到最内层作用域 */
    public void declare(VariableState state) {
        current().declare(state);
    }

    /** 从内向外查找，未找到返回 null */
    public VariableState lookup(String name) {
        for (int i = scopes.size() - 1; i >= 0; i--) {
            VariableState state = scopes.get(i).resolveLocal(name);
            if (state != null) return state;
        }
        return null;
    }

    /** 变量的类型名，未声明时返回 null */
    public String typeOf(String name) {
        VariableState state = lookup(name);
        return state != null ? state.getTypeName() : null;
    }

    public Scope current() {
        return scopes.get(scopes.size() - 1);
    }

    public Scope global() {
        return scopes.get(0);
    }

    public int depth() {
        return scopes.size();
    }
}
