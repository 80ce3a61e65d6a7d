package com.astrallang.compiler.ast.decl;

import com.astrallang.compiler.ast.AstVisitor;
import com.astrallang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 枚举声明 enum Name { Variant, Variant(type), ... }
 */
public class EnumDecl extends Declaration {
    private final List<Variant> variants;

    public EnumDecl(SourceLocation location, String name, List<Variant> variants) {
        super(location, name);
        this.variants = variants;
    }

    public List<Variant> getVariants() {
        return variants;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEnumDecl(this, context);
    }

    /**
     * 枚举变体，payloadType 为 null 表示无负载
     */
    public static final class Variant {
        private final SourceLocation location;
        private final String name;
        private final String payloadType;

        public Variant(SourceLocation location, String name, String payloadType) {
            this.location = location;
            this.name = name;
            this.payloadType = payloadType;
        }

        public SourceLocation getLocation() { return location; }
        public String getName() { return name; }
        public String getPayloadType() { return payloadType; }
        public boolean hasPayload() { return payloadType != null; }
    }
}
