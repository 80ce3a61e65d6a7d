package com.astrallang.compiler.analysis;

import com.astrallang.compiler.ast.expr.*;

import java.util.List;

/**
 * 表达式类型名推断：只读查询，不改变任何变量状态
 */
public final class TypeInference {

    public static final String UNKNOWN = "unknown";
    public static final String RANGE = "range";

    private final TypeRegistry registry;
    private final ScopeStack scopes;

    public TypeInference(TypeRegistry registry, ScopeStack scopes) {
        this.registry = registry;
        this.scopes = scopes;
    }

    public String infer(Expression expr) {
        if (expr instanceof Literal) {
            return ((Literal) expr).getKind().getTypeName();
        }
        if (expr instanceof Identifier) {
            String type = scopes.typeOf(((Identifier) expr).getName());
            return type != null ? type : UNKNOWN;
        }
        if (expr instanceof BinaryExpr) {
            BinaryExpr bin = (BinaryExpr) expr;
            if (bin.getOperator().isComparison() || bin.getOperator().isLogical()) {
                return "bool";
            }
            return infer(bin.getLeft());
        }
        if (expr instanceof UnaryExpr) {
            UnaryExpr unary = (UnaryExpr) expr;
            if (unary.getOperator() == UnaryExpr.UnaryOp.NOT) {
                return "bool";
            }
            return infer(unary.getOperand());
        }
        if (expr instanceof ReferenceExpr) {
            ReferenceExpr ref = (ReferenceExpr) expr;
            return (ref.isMutable() ? "&mut " : "&") + infer(ref.getOperand());
        }
        if (expr instanceof ArrayLiteral) {
            List<Expression> elements = ((ArrayLiteral) expr).getElements();
            if (elements.isEmpty()) {
                return "[int; 0]";
            }
            return "[" + infer(elements.get(0)) + "; " + elements.size() + "]";
        }
        if (expr instanceof StructInitExpr) {
            return ((StructInitExpr) expr).getTypeName();
        }
        if (expr instanceof EnumValueExpr) {
            return ((EnumValueExpr) expr).getEnumName();
        }
        if (expr instanceof CallExpr) {
            String type = registry.returnTypeOf(((CallExpr) expr).getCallee());
            return type != null ? type : UNKNOWN;
        }
        if (expr instanceof IndexExpr) {
            String element = elementTypeOf(stripReference(infer(((IndexExpr) expr).getTarget())));
            return element != null ? element : UNKNOWN;
        }
        if (expr instanceof MemberExpr) {
            MemberExpr member = (MemberExpr) expr;
            String owner = stripReference(infer(member.getTarget()));
            String type = registry.fieldTypeOf(owner, member.getMember());
            return type != null ? type : UNKNOWN;
        }
        if (expr instanceof RangeExpr) {
            return RANGE;
        }
        // 方法调用没有可查询的签名
        return UNKNOWN;
    }

    /** 枚举模式绑定的类型：变体负载类型，未知时为 unknown */
    public String payloadTypeOf(String enumName, String variant) {
        String type = registry.payloadTypeOf(enumName, variant);
        return type != null ? type : UNKNOWN;
    }

    /**
     * 数组类型 [T; N] 的元素类型，非数组返回 null
     */
    public static String elementTypeOf(String typeName) {
        if (typeName == null || !typeName.startsWith("[") || !typeName.endsWith("]")) {
            return null;
        }
        int sep = typeName.lastIndexOf("; ");
        if (sep < 0) return null;
        return typeName.substring(1, sep);
    }

    /** 去掉 & / &mut 前缀 */
    public static String stripReference(String typeName) {
        if (typeName == null) return null;
        if (typeName.startsWith("&mut ")) return typeName.substring("&mut ".length());
        if (typeName.startsWith("&")) return typeName.substring(1);
        return typeName;
    }
}
