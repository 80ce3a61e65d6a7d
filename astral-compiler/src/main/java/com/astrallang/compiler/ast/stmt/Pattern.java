package com.astrallang.compiler.ast.stmt;

import com.astrallang.compiler.ast.SourceLocation;

/**
 * Match 模式
 */
public final class Pattern {

    public enum PatternKind {
        WILDCARD,       // _
        BINDING,        // name
        ENUM_VARIANT    // Enum::Variant(binding)
    }

    private final SourceLocation location;
    private final PatternKind kind;
    private final String enumName;
    private final String variant;
    private final String binding;

    private Pattern(SourceLocation location, PatternKind kind, String enumName,
                    String variant, String binding) {
        this.location = location;
        this.kind = kind;
        this.enumName = enumName;
        this.variant = variant;
        this.binding = binding;
    }

    public static Pattern wildcard(SourceLocation location) {
        return new Pattern(location, PatternKind.WILDCARD, null, null, null);
    }

    public static Pattern binding(SourceLocation location, String name) {
        return new Pattern(location, PatternKind.BINDING, null, null, name);
    }

    public static Pattern enumVariant(SourceLocation location, String enumName, String variant, String binding) {
        return new Pattern(location, PatternKind.ENUM_VARIANT, enumName, variant, binding);
    }

    public SourceLocation getLocation() { return location; }
    public PatternKind getKind() { return kind; }
    public String getEnumName() { return enumName; }
    public String getVariant() { return variant; }

    /** 绑定的变量名，无绑定时为 null */
    public String getBinding() { return binding; }

    public boolean hasBinding() { return binding != null; }
}
