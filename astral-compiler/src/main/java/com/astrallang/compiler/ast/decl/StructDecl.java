package com.astrallang.compiler.ast.decl;

import com.astrallang.compiler.ast.AstVisitor;
import com.astrallang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 结构体声明 struct Name { field: type; ... }
 */
public class StructDecl extends Declaration {
    private final List<Field> fields;

    public StructDecl(SourceLocation location, String name, List<Field> fields) {
        super(location, name);
        this.fields = fields;
    }

    public List<Field> getFields() {
        return fields;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStructDecl(this, context);
    }

    /**
     * 结构体字段
     */
    public static final class Field {
        private final SourceLocation location;
        private final String name;
        private final String type;

        public Field(SourceLocation location, String name, String type) {
            this.location = location;
            this.name = name;
            this.type = type;
        }

        public SourceLocation getLocation() { return location; }
        public String getName() { return name; }
        public String getType() { return type; }
    }
}
