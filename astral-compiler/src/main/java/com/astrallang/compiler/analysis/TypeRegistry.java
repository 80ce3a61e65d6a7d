package com.astrallang.compiler.analysis;

import com.astrallang.compiler.ast.decl.Declaration;
import com.astrallang.compiler.ast.decl.EnumDecl;
import com.astrallang.compiler.ast.decl.FunDecl;
import com.astrallang.compiler.ast.decl.Program;
import com.astrallang.compiler.ast.decl.StructDecl;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 顶层声明签名表：函数返回类型、结构体字段类型、枚举变体负载类型。
 * 在遍历前一次性收集，类型推断不依赖声明顺序。
 */
public final class TypeRegistry {

    private final Map<String, String> functionReturnTypes = new HashMap<String, String>();
    private final Map<String, Map<String, String>> structFields = new HashMap<String, Map<String, String>>();
    private final Map<String, Map<String, String>> enumPayloads = new HashMap<String, Map<String, String>>();

    public static TypeRegistry collect(Program program) {
        TypeRegistry registry = new TypeRegistry();
        for (Declaration decl : program.getDeclarations()) {
            if (decl instanceof FunDecl) {
                FunDecl fun = (FunDecl) decl;
                registry.functionReturnTypes.put(fun.getName(), fun.hasReturnType() ? fun.getReturnType() : null);
            } else if (decl instanceof StructDecl) {
                Map<String, String> fields = new LinkedHashMap<String, String>();
                for (StructDecl.Field field : ((StructDecl) decl).getFields()) {
                    fields.put(field.getName(), field.getType());
                }
                registry.structFields.put(decl.getName(), fields);
            } else if (decl instanceof EnumDecl) {
                Map<String, String> payloads = new LinkedHashMap<String, String>();
                for (EnumDecl.Variant variant : ((EnumDecl) decl).getVariants()) {
                    payloads.put(variant.getName(), variant.getPayloadType());
                }
                registry.enumPayloads.put(decl.getName(), payloads);
            }
        }
        return registry;
    }

    /** 函数返回类型，未声明或无返回类型时为 null */
    public String returnTypeOf(String function) {
        return functionReturnTypes.get(function);
    }

    /** 结构体字段类型，未知时为 null */
    public String fieldTypeOf(String struct, String field) {
        Map<String, String> fields = structFields.get(struct);
        return fields != null ? fields.get(field) : null;
    }

    /** 枚举变体的负载类型，无负载或未知时为 null */
    public String payloadTypeOf(String enumName, String variant) {
        Map<String, String> payloads = enumPayloads.get(enumName);
        return payloads != null ? payloads.get(variant) : null;
    }
}
